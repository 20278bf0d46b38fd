package org.sfiles.notation.heat;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.sfiles.notation.core.DegradedMergeWarning;
import org.sfiles.notation.graph.FlowsheetGraph;

import java.util.List;

/**
 * Merged graph plus the groups that could not be folded back.
 */
@Value
@Builder
public class MergeResult {
    FlowsheetGraph graph;
    @Singular
    List<DegradedMergeWarning> warnings;
}
