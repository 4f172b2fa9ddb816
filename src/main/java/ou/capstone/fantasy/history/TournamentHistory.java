package ou.capstone.fantasy.history;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import ou.capstone.fantasy.Tournament;
import ou.capstone.fantasy.TournamentResults;
import ou.capstone.fantasy.api.ResultRow;
import ou.capstone.fantasy.roster.Player;
import ou.capstone.fantasy.roster.Team;
import ou.capstone.fantasy.scoring.PlacementScorer;

/**
 * The recent-tournaments document. Holds at most {@value #MAX_ENTRIES} entries;
 * adding one more evicts the oldest.
 */
public final class TournamentHistory {

    public static final int MAX_ENTRIES = 10;

    private final List<HistoryEntry> tournaments;

    public TournamentHistory() {
        this(null);
    }

    @JsonCreator
    public TournamentHistory(@JsonProperty("tournaments") final List<HistoryEntry> tournaments) {
        this.tournaments = tournaments == null ? new ArrayList<>() : new ArrayList<>(tournaments);
        while (this.tournaments.size() > MAX_ENTRIES) {
            this.tournaments.remove(0);
        }
    }

    @JsonProperty("tournaments")
    public List<HistoryEntry> getTournaments() {
        return Collections.unmodifiableList(tournaments);
    }

    public void add(final HistoryEntry entry) {
        if (tournaments.size() >= MAX_ENTRIES) {
            tournaments.remove(0);
        }
        tournaments.add(entry);
    }

    /**
     * Records a scored tournament with the finishes of every rostered player who played it.
     */
    public void record(final TournamentResults results,
                       final List<Team> teams,
                       final PlacementScorer scorer,
                       final int week) {
        final Tournament tournament = results.tournament();
        final List<FantasyResult> fantasyResults = new ArrayList<>();

        for (Team team : teams) {
            for (Player player : team.getPlayers()) {
                final Optional<ResultRow> row = results.findResult(player.getPdgaNumber());
                row.ifPresent(r -> fantasyResults.add(new FantasyResult(
                        player.getName(),
                        team.getName(),
                        Ordinals.of(r.placement()) + " place",
                        scorer.score(r.placement(), tournament.getTier(), player.isUnderdog()))));
            }
        }

        final String date = tournament.getEndDate() == null ? null : tournament.getEndDate().toString();
        add(new HistoryEntry(tournament.getName(), results.event().eventId(), date,
                tournament.getTier().label(), week, fantasyResults));
    }
}
