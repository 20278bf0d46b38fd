package org.sfiles.notation.rank;

import lombok.Builder;
import lombok.Value;

/**
 * Configuration of the connectivity refinement loop of {@link CanonicalRanker}.
 */
@Value
@Builder
public class RankingConfig {
    /**
     * Consecutive iterations without a new distinct value after which the
     * refinement is considered converged.
     */
    @Builder.Default
    int stableIterations = 5;

    /**
     * Hard cap on refinement iterations.
     */
    @Builder.Default
    int maxIterations = 64;

    /**
     * Default canonical ranking configuration.
     */
    public static RankingConfig defaults() {
        return RankingConfig.builder().build();
    }
}
