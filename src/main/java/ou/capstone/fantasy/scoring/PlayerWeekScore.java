package ou.capstone.fantasy.scoring;

/** A player's summed score over one week's tournaments. */
public record PlayerWeekScore(String playerName, long pdgaNumber, double weekScore, int tournamentsPlayed) {
}
