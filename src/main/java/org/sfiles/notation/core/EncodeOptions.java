package org.sfiles.notation.core;

import lombok.Builder;
import lombok.Value;
import org.sfiles.notation.rank.RankingConfig;

/**
 * Options of one encode call.
 */
@Value
@Builder(toBuilder = true)
public class EncodeOptions {
    @Builder.Default
    NotationVersion version = NotationVersion.V2;

    /**
     * Render heat-exchange slot tags ({@code 1_in}, {@code hot_out}). Slot tags
     * of split units are re-derived on decode, so they are off by default.
     */
    @Builder.Default
    boolean includeHeatTags = false;

    /**
     * Canonical traversal order. When false the order is a seeded random
     * permutation; the output is still a valid decode target.
     */
    @Builder.Default
    boolean canonical = true;

    /** Seed of the random order, used only when {@code canonical} is false. */
    @Builder.Default
    long randomSeed = 0L;

    @Builder.Default
    RankingConfig rankingConfig = RankingConfig.defaults();

    public static EncodeOptions canonicalV2() {
        return EncodeOptions.builder().build();
    }

    public static EncodeOptions canonicalV1() {
        return EncodeOptions.builder().version(NotationVersion.V1).build();
    }

    /**
     * Non-canonical encoding for data augmentation.
     *
     * @param seed traversal order seed.
     */
    public static EncodeOptions augmentation(long seed) {
        return EncodeOptions.builder().canonical(false).randomSeed(seed).build();
    }
}
