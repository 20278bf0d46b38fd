package org.sfiles.notation.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.sfiles.notation.graph.FlowsheetGraph;

import java.util.List;

/**
 * Output of one decode call.
 */
@Value
@Builder
public class DecodeResult {
    FlowsheetGraph graph;
    @Singular
    List<DegradedMergeWarning> warnings;
}
