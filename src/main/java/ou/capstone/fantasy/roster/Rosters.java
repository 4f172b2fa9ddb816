package ou.capstone.fantasy.roster;

import java.util.List;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/** The rosters document: every team in the league. */
public final class Rosters {
    private final List<Team> teams;

    @JsonCreator
    public Rosters(@JsonProperty("teams") final List<Team> teams) {
        this.teams = teams == null ? List.of() : List.copyOf(teams);
    }

    @JsonProperty("teams")
    public List<Team> getTeams() { return teams; }

    public Optional<Team> findTeam(final String teamName) {
        return teams.stream().filter(t -> t.getName().equals(teamName)).findFirst();
    }
}
