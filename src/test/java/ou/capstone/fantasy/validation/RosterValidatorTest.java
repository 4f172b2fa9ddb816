package ou.capstone.fantasy.validation;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import org.junit.jupiter.api.Test;

import ou.capstone.fantasy.roster.Player;
import ou.capstone.fantasy.roster.Rosters;
import ou.capstone.fantasy.roster.Team;
import ou.capstone.fantasy.roster.WeeklyScoreEntry;

class RosterValidatorTest {

    private final RosterValidator validator = new RosterValidator();

    @Test
    void validRostersPass() {
        final Rosters rosters = new Rosters(List.of(
                new Team("A", "Ann", List.of(new Player("P1", 1, false), new Player("P2", 2, true))),
                new Team("B", "Ben", List.of(new Player("P3", 3, false)))));

        final ValidationResult result = validator.validate(rosters, 0);

        assertTrue(result.isOk());
        assertTrue(result.problems().isEmpty());
    }

    @Test
    void playerOnTwoTeamsIsAllowed() {
        final Rosters rosters = new Rosters(List.of(
                new Team("A", "Ann", List.of(new Player("Shared", 1, false))),
                new Team("B", "Ben", List.of(new Player("Shared", 1, false)))));

        assertTrue(validator.validate(rosters, 0).isOk());
    }

    @Test
    void duplicateWithinTeamAndDuplicateTeamNamesFail() {
        final Rosters rosters = new Rosters(List.of(
                new Team("A", "Ann", List.of(new Player("P1", 1, false), new Player("P1 again", 1, false))),
                new Team("A", "Other", List.of())));

        final ValidationResult result = validator.validate(rosters, 0);

        assertFalse(result.isOk());
        assertEquals(2, result.problems().size());
    }

    @Test
    void badPlayerFieldsFail() {
        final Rosters rosters = new Rosters(List.of(
                new Team("A", "Ann", List.of(new Player(" ", 5, false), new Player("Zero", 0, false)))));

        final ValidationResult result = validator.validate(rosters, 0);

        assertFalse(result.isOk());
        assertEquals(2, result.problems().size());
    }

    @Test
    void emptyRostersFail() {
        assertFalse(validator.validate(new Rosters(List.of()), 0).isOk());
    }

    @Test
    void scoresAheadOfStandingsWeekFail() {
        final Player carriedOver = new Player("Carried", 7, false, 50.0, 1, 1,
                List.of(new WeeklyScoreEntry(1, "Old Open", 50, 50.0, "Elite", true)));
        final Rosters rosters = new Rosters(List.of(new Team("A", "Ann", List.of(carriedOver))));

        final ValidationResult fresh = validator.validate(rosters, 0);
        assertFalse(fresh.isOk());
        assertTrue(fresh.problems().get(0).contains("week 1"));

        assertTrue(validator.validate(rosters, 1).isOk());
    }
}
