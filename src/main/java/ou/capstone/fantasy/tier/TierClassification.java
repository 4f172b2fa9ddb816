package ou.capstone.fantasy.tier;

/**
 * Result of classifying a tier abbreviation.
 *
 * @param abbreviation the abbreviation as it appeared in the schedule (trimmed)
 * @param tier         canonical tier, {@link Tier#UNMAPPED} if the abbreviation is unknown
 * @param multiplier   scoring multiplier
 * @param label        display label used in score entries and history
 */
public record TierClassification(String abbreviation, Tier tier, double multiplier, String label) {

    public boolean isUnmapped() {
        return tier == Tier.UNMAPPED;
    }

    public String tierName() {
        return tier.displayName();
    }
}
