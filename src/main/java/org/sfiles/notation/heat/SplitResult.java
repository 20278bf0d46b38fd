package org.sfiles.notation.heat;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.sfiles.notation.core.DegradedMergeWarning;
import org.sfiles.notation.graph.FlowsheetGraph;

import java.util.List;
import java.util.Map;

/**
 * Split graph plus the shadow-to-physical unit table.
 */
@Value
@Builder
public class SplitResult {
    FlowsheetGraph graph;
    /** Shadow unit id to physical base id, in shadow creation order. */
    @Singular("shadow")
    Map<String, String> shadowTable;
    @Singular
    List<DegradedMergeWarning> warnings;

    public boolean isShadow(String unitId) {
        return shadowTable.containsKey(unitId);
    }
}
