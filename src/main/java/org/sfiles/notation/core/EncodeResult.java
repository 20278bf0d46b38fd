package org.sfiles.notation.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Output of one encode call: the numbered notation, its generalized
 * (type-only) form and any non-fatal warnings.
 */
@Value
@Builder
public class EncodeResult {
    List<String> tokens;
    String notation;
    List<String> generalizedTokens;
    String generalizedNotation;
    @Singular
    List<DegradedMergeWarning> warnings;
}
