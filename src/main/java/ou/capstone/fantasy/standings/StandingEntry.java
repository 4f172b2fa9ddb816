package ou.capstone.fantasy.standings;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A team's line in the standings. Totals and rank are derived from the weekly
 * breakdown by {@link StandingsAggregator}; breakdown records are append-only.
 */
public final class StandingEntry {
    private final String teamName;
    private final String owner;
    private double totalScore;
    private int weeksCounted;
    private int rank;
    private final List<WeeklyBreakdown> weeklyBreakdown;

    public StandingEntry(final String teamName, final String owner) {
        this(teamName, owner, 0.0, 0, 0, null);
    }

    @JsonCreator
    public StandingEntry(@JsonProperty("team_name") final String teamName,
                         @JsonProperty("owner") final String owner,
                         @JsonProperty("total_score") final double totalScore,
                         @JsonProperty("weeks_counted") final int weeksCounted,
                         @JsonProperty("rank") final int rank,
                         @JsonProperty("weekly_breakdown") final List<WeeklyBreakdown> weeklyBreakdown) {
        this.teamName = Objects.requireNonNull(teamName, "team_name is required");
        this.owner = owner == null ? "" : owner;
        this.totalScore = totalScore;
        this.weeksCounted = weeksCounted;
        this.rank = rank;
        this.weeklyBreakdown = weeklyBreakdown == null ? new ArrayList<>() : new ArrayList<>(weeklyBreakdown);
    }

    @JsonProperty("team_name")
    public String getTeamName() { return teamName; }

    @JsonProperty("owner")
    public String getOwner() { return owner; }

    @JsonProperty("total_score")
    public double getTotalScore() { return totalScore; }

    @JsonProperty("weeks_counted")
    public int getWeeksCounted() { return weeksCounted; }

    @JsonProperty("rank")
    public int getRank() { return rank; }

    @JsonProperty("weekly_breakdown")
    public List<WeeklyBreakdown> getWeeklyBreakdown() {
        return Collections.unmodifiableList(weeklyBreakdown);
    }

    public double averagePerWeek() {
        return weeksCounted > 0 ? totalScore / weeksCounted : 0.0;
    }

    void appendWeek(final WeeklyBreakdown week) {
        weeklyBreakdown.add(Objects.requireNonNull(week));
    }

    void updateTotals(final double totalScore, final int weeksCounted) {
        this.totalScore = totalScore;
        this.weeksCounted = weeksCounted;
    }

    void updateRank(final int rank) {
        this.rank = rank;
    }
}
