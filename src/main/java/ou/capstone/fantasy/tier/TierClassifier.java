package ou.capstone.fantasy.tier;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps schedule tier abbreviations (ES, ESP, M) to a canonical {@link Tier},
 * its multiplier and its display label.
 *
 * The abbreviation table and the weight table are coupled: every tier reachable
 * from an abbreviation must carry a weight, and UNMAPPED must carry one too.
 * Both are checked on construction.
 */
public final class TierClassifier {

    private static final Logger logger = LoggerFactory.getLogger(TierClassifier.class);

    private static final TierWeight UNMAPPED_WEIGHT = new TierWeight(1.0, "Unmapped");

    private final Map<String, Tier> byAbbreviation;
    private final Map<Tier, TierWeight> weights;

    /** Default circuit tables. */
    public TierClassifier() {
        this(defaultAbbreviations(), defaultWeights());
    }

    public TierClassifier(final Map<String, Tier> abbreviations,
                          final Map<Tier, TierWeight> weights) {
        final Map<String, Tier> normalized = new HashMap<>();
        abbreviations.forEach((abbr, tier) -> {
            if (tier == Tier.UNMAPPED) {
                throw new IllegalArgumentException("Abbreviation '" + abbr + "' may not map to UNMAPPED");
            }
            normalized.put(normalize(abbr), tier);
        });

        final Map<Tier, TierWeight> copy = new EnumMap<>(Tier.class);
        copy.putAll(weights);
        copy.putIfAbsent(Tier.UNMAPPED, UNMAPPED_WEIGHT);

        for (Tier tier : normalized.values()) {
            if (!copy.containsKey(tier)) {
                throw new IllegalArgumentException("No multiplier/label defined for tier " + tier);
            }
        }

        this.byAbbreviation = Map.copyOf(normalized);
        this.weights = copy;
    }

    /**
     * Classifies an abbreviation. Unknown or blank abbreviations resolve to
     * {@link Tier#UNMAPPED}; that case is logged so bad schedule rows can be found.
     */
    public TierClassification classify(final String abbreviation) {
        final String raw = abbreviation == null ? "" : abbreviation.trim();
        final Tier tier = byAbbreviation.getOrDefault(normalize(raw), Tier.UNMAPPED);

        if (tier == Tier.UNMAPPED) {
            logger.warn("Unmapped tier abbreviation '{}', using {} with multiplier {}",
                    raw, Tier.UNMAPPED, weights.get(Tier.UNMAPPED).multiplier());
        }

        final TierWeight weight = weights.get(tier);
        return new TierClassification(raw, tier, weight.multiplier(), weight.label());
    }

    public TierWeight weightOf(final Tier tier) {
        return weights.get(tier);
    }

    private static String normalize(final String abbreviation) {
        return abbreviation == null ? "" : abbreviation.trim().toUpperCase(Locale.ROOT);
    }

    private static Map<String, Tier> defaultAbbreviations() {
        final Map<String, Tier> map = new LinkedHashMap<>();
        map.put("ES", Tier.ELITE_SERIES);
        map.put("ESP", Tier.ELITE_SERIES_PLUS);
        map.put("M", Tier.MAJOR);
        return map;
    }

    private static Map<Tier, TierWeight> defaultWeights() {
        final Map<Tier, TierWeight> map = new EnumMap<>(Tier.class);
        map.put(Tier.ELITE_SERIES, new TierWeight(1.0, "Elite"));
        map.put(Tier.ELITE_SERIES_PLUS, new TierWeight(1.5, "Elite"));
        map.put(Tier.MAJOR, new TierWeight(2.0, "Major"));
        map.put(Tier.UNMAPPED, UNMAPPED_WEIGHT);
        return map;
    }
}
