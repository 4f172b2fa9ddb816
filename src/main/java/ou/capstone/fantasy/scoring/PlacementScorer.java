package ou.capstone.fantasy.scoring;

import ou.capstone.fantasy.tier.TierClassification;

/**
 * Turns one tournament placement into fantasy points.
 * Lower is better.
 */
@FunctionalInterface
public interface PlacementScorer {

    /**
     * @param placement finishing place, must be positive
     * @param tier      the tournament's tier
     * @param underdog  whether the player carries the underdog handicap
     * @return a finite, non-negative score
     */
    double score(int placement, TierClassification tier, boolean underdog);
}
