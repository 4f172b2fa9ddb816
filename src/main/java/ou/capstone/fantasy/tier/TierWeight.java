package ou.capstone.fantasy.tier;

/** Scoring multiplier and short display label for one tier. */
public record TierWeight(double multiplier, String label) {

    public TierWeight {
        if (!(multiplier > 0.0) || Double.isInfinite(multiplier)) {
            throw new IllegalArgumentException("multiplier must be a positive finite number: " + multiplier);
        }
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("label is required");
        }
    }
}
