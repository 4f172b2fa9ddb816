package ou.capstone.fantasy.roster;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One player's result in one tournament of one week.
 * Only the counted flag ever changes, and only from false to true.
 */
public final class WeeklyScoreEntry {
    private final int week;
    private final String tournament;
    private final int placement;
    private final double score;
    private final String tier;        // display label, ex: "Elite"
    private boolean counted;

    @JsonCreator
    public WeeklyScoreEntry(@JsonProperty("week") final int week,
                            @JsonProperty("tournament") final String tournament,
                            @JsonProperty("placement") final int placement,
                            @JsonProperty("score") final double score,
                            @JsonProperty("tier") final String tier,
                            @JsonProperty("counted") final boolean counted) {
        this.week = week;
        this.tournament = tournament;
        this.placement = placement;
        this.score = score;
        this.tier = tier;
        this.counted = counted;
    }

    @JsonProperty("week")
    public int getWeek() { return week; }

    @JsonProperty("tournament")
    public String getTournament() { return tournament; }

    @JsonProperty("placement")
    public int getPlacement() { return placement; }

    @JsonProperty("score")
    public double getScore() { return score; }

    @JsonProperty("tier")
    public String getTier() { return tier; }

    @JsonProperty("counted")
    public boolean isCounted() { return counted; }

    void markCounted() {
        this.counted = true;
    }

    @Override
    public String toString() {
        return "WeeklyScoreEntry{week=" + week +
                ", tournament='" + tournament + '\'' +
                ", placement=" + placement +
                ", score=" + score +
                ", tier='" + tier + '\'' +
                ", counted=" + counted + '}';
    }
}
