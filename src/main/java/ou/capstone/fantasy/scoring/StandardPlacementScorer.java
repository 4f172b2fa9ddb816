package ou.capstone.fantasy.scoring;

import ou.capstone.fantasy.tier.TierClassification;

/**
 * Placement points, weighted by tier, halved for underdogs.
 * A 3rd place at an Elite Series event is 3.0, or 1.5 for an underdog.
 */
public final class StandardPlacementScorer implements PlacementScorer {

    private static final double UNDERDOG_FACTOR = 0.5;

    @Override
    public double score(final int placement, final TierClassification tier, final boolean underdog) {
        if (placement <= 0) {
            throw new IllegalArgumentException("placement must be positive: " + placement);
        }
        final double raw = placement;
        final double weighted = raw * tier.multiplier();
        return underdog ? weighted * UNDERDOG_FACTOR : weighted;
    }
}
