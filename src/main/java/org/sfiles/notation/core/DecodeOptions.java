package org.sfiles.notation.core;

import lombok.Builder;
import lombok.Value;

/**
 * Options of one decode call.
 */
@Value
@Builder
public class DecodeOptions {
    /**
     * Fold heat-integration shadow units {@code base/k} back into one unit.
     */
    @Builder.Default
    boolean mergeHeatIntegration = true;

    public static DecodeOptions defaults() {
        return DecodeOptions.builder().build();
    }

    public static DecodeOptions unmerged() {
        return DecodeOptions.builder().mergeHeatIntegration(false).build();
    }
}
