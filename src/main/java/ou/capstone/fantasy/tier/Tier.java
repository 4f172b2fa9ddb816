package ou.capstone.fantasy.tier;

/**
 * Prestige classification of a tournament.
 * UNMAPPED is what an unknown abbreviation resolves to; it is never a real tier.
 */
public enum Tier {
    ELITE_SERIES("Elite Series"),
    ELITE_SERIES_PLUS("Elite Series Plus"),
    MAJOR("Major"),
    UNMAPPED("Unmapped");

    private final String displayName;

    Tier(final String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    public boolean isMapped() {
        return this != UNMAPPED;
    }
}
