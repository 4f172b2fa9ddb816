package ou.capstone.fantasy.roster;

import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/** A fantasy team. Roster membership is fixed for the season. */
public final class Team {
    private final String name;
    private final String owner;
    private final List<Player> players;

    @JsonCreator
    public Team(@JsonProperty("team_name") final String name,
                @JsonProperty("owner") final String owner,
                @JsonProperty("players") final List<Player> players) {
        this.name = Objects.requireNonNull(name, "team_name is required");
        this.owner = owner == null ? "" : owner;
        this.players = players == null ? List.of() : List.copyOf(players);
    }

    @JsonProperty("team_name")
    public String getName() { return name; }

    @JsonProperty("owner")
    public String getOwner() { return owner; }

    @JsonProperty("players")
    public List<Player> getPlayers() { return players; }

    @Override
    public String toString() {
        return "Team{name='" + name + "', owner='" + owner + "', players=" + players.size() + '}';
    }
}
