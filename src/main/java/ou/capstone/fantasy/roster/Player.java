package ou.capstone.fantasy.roster;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A rostered player and their season accumulators.
 *
 * Accumulators only move forward: season total and counters grow, score entries
 * are appended and never removed.
 */
public final class Player {
    private final String name;
    private final long pdgaNumber;
    private final boolean underdog;
    private double seasonTotal;
    private int timesCounted;
    private int tournamentsPlayed;
    private final List<WeeklyScoreEntry> weeklyScores;

    public Player(final String name, final long pdgaNumber, final boolean underdog) {
        this(name, pdgaNumber, underdog, 0.0, 0, 0, null);
    }

    @JsonCreator
    public Player(@JsonProperty("name") final String name,
                  @JsonProperty("pdga_number") final long pdgaNumber,
                  @JsonProperty("is_underdog") final boolean underdog,
                  @JsonProperty("season_total") final double seasonTotal,
                  @JsonProperty("times_counted") final int timesCounted,
                  @JsonProperty("tournaments_played") final int tournamentsPlayed,
                  @JsonProperty("weekly_scores") final List<WeeklyScoreEntry> weeklyScores) {
        this.name = Objects.requireNonNull(name, "name is required");
        this.pdgaNumber = pdgaNumber;
        this.underdog = underdog;
        this.seasonTotal = seasonTotal;
        this.timesCounted = timesCounted;
        this.tournamentsPlayed = tournamentsPlayed;
        this.weeklyScores = weeklyScores == null ? new ArrayList<>() : new ArrayList<>(weeklyScores);
    }

    @JsonProperty("name")
    public String getName() { return name; }

    @JsonProperty("pdga_number")
    public long getPdgaNumber() { return pdgaNumber; }

    @JsonProperty("is_underdog")
    public boolean isUnderdog() { return underdog; }

    @JsonProperty("season_total")
    public double getSeasonTotal() { return seasonTotal; }

    @JsonProperty("times_counted")
    public int getTimesCounted() { return timesCounted; }

    @JsonProperty("tournaments_played")
    public int getTournamentsPlayed() { return tournamentsPlayed; }

    @JsonProperty("weekly_scores")
    public List<WeeklyScoreEntry> getWeeklyScores() {
        return Collections.unmodifiableList(weeklyScores);
    }

    public void addEntry(final WeeklyScoreEntry entry) {
        weeklyScores.add(Objects.requireNonNull(entry));
    }

    public void addTournamentsPlayed(final int count) {
        if (count < 0) {
            throw new IllegalArgumentException("count must not be negative");
        }
        tournamentsPlayed += count;
    }

    /**
     * Counts this player's week: marks the given entries counted and adds their
     * scores to the season total. Entries stored before this week's scoring keep
     * their flags.
     *
     * @param weekEntries entries appended for this week, each already held by this player
     * @return the week score that was added
     */
    public double countWeek(final List<WeeklyScoreEntry> weekEntries) {
        double weekScore = 0.0;
        for (WeeklyScoreEntry entry : weekEntries) {
            if (weeklyScores.stream().noneMatch(own -> own == entry)) {
                throw new IllegalArgumentException("Entry does not belong to " + name + ": " + entry);
            }
            if (entry.isCounted()) {
                throw new IllegalArgumentException("Entry already counted: " + entry);
            }
            weekScore += entry.getScore();
        }
        weekEntries.forEach(WeeklyScoreEntry::markCounted);
        seasonTotal += weekScore;
        timesCounted++;
        return weekScore;
    }

    /** Season total re-derived from counted entries; matches {@link #getSeasonTotal()}. */
    public double countedEntriesTotal() {
        double total = 0.0;
        for (WeeklyScoreEntry entry : weeklyScores) {
            if (entry.isCounted()) {
                total += entry.getScore();
            }
        }
        return total;
    }

    public double averageWhenCounted() {
        return timesCounted > 0 ? seasonTotal / timesCounted : 0.0;
    }

    @Override
    public String toString() {
        return "Player{name='" + name + '\'' +
                ", pdgaNumber=" + pdgaNumber +
                ", underdog=" + underdog +
                ", seasonTotal=" + seasonTotal +
                ", timesCounted=" + timesCounted +
                ", tournamentsPlayed=" + tournamentsPlayed + '}';
    }
}
