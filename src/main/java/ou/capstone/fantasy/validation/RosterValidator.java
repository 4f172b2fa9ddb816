package ou.capstone.fantasy.validation;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ou.capstone.fantasy.roster.Player;
import ou.capstone.fantasy.roster.Rosters;
import ou.capstone.fantasy.roster.Team;
import ou.capstone.fantasy.roster.WeeklyScoreEntry;

/**
 * Checks the rosters document before a run touches any state.
 * <p>
 * Team names must be present and unique, every player needs a name and a positive
 * PDGA number, and a PDGA number may appear only once per team. A player rostered
 * on two different teams is allowed but logged. No player may hold score entries
 * for a week the standings have not reached yet.
 */
public final class RosterValidator {
    private static final Logger logger = LoggerFactory.getLogger(RosterValidator.class);

    /**
     * @param rosters     the rosters document
     * @param currentWeek the standings' current week
     */
    public ValidationResult validate(final Rosters rosters, final int currentWeek) {
        final List<String> problems = new ArrayList<>();
        final Set<String> teamNames = new HashSet<>();
        final Map<Long, String> firstTeamByPdga = new HashMap<>();

        if (rosters.getTeams().isEmpty()) {
            return ValidationResult.error("Rosters contain no teams", List.of());
        }

        for (Team team : rosters.getTeams()) {
            final String teamName = team.getName();
            if (teamName.isBlank()) {
                problems.add("A team has a blank name");
            } else if (!teamNames.add(teamName)) {
                problems.add("Duplicate team name: " + teamName);
            }

            final Set<Long> seenInTeam = new HashSet<>();
            for (Player player : team.getPlayers()) {
                if (player.getName().isBlank()) {
                    problems.add("Team " + teamName + " has a player with a blank name");
                }
                final int latestWeek = player.getWeeklyScores().stream()
                        .mapToInt(WeeklyScoreEntry::getWeek)
                        .max()
                        .orElse(0);
                if (latestWeek > currentWeek) {
                    problems.add("Team " + teamName + ": " + player.getName() + " has scores for week "
                            + latestWeek + " but the standings are at week " + currentWeek);
                }
                if (player.getPdgaNumber() <= 0) {
                    problems.add("Team " + teamName + ": " + player.getName()
                            + " has invalid PDGA number " + player.getPdgaNumber());
                    continue;
                }
                if (!seenInTeam.add(player.getPdgaNumber())) {
                    problems.add("Team " + teamName + " lists PDGA #" + player.getPdgaNumber() + " twice");
                    continue;
                }
                final String other = firstTeamByPdga.putIfAbsent(player.getPdgaNumber(), teamName);
                if (other != null) {
                    logger.warn("{} (PDGA #{}) is rostered on both {} and {}",
                            player.getName(), player.getPdgaNumber(), other, teamName);
                }
            }
        }

        if (problems.isEmpty()) {
            return ValidationResult.success();
        }
        return ValidationResult.error("Rosters failed validation", problems);
    }
}
