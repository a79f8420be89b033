package edu.brandeis.cosi103a.lycans.role;

import edu.brandeis.cosi103a.lycans.model.GameRecord;
import edu.brandeis.cosi103a.lycans.model.PlayerRecord;

import java.util.List;
import java.util.Optional;

/**
 * Decides which camp won a game and whether a camp or a player counts as a winner.
 */
public final class WinResolver {

    private WinResolver() {}

    /**
     * Winning camp from the victors' final camps. Any wolf-family victor makes the wolf alliance
     * ({@link Camp#LOUP}) the winner; all-Villageois victors make Villageois the winner; otherwise
     * the first solo camp among the victors wins. Empty when nobody is marked victorious.
     */
    public static Optional<Camp> winningCampOf(GameRecord game) {
        List<Camp> victorCamps = game.playerStats().stream()
            .filter(PlayerRecord::victorious)
            .map(p -> CampResolver.finalCamp(game, p))
            .toList();
        if (victorCamps.isEmpty()) {
            return Optional.empty();
        }
        if (victorCamps.stream().anyMatch(Camp::isWolfFamily)) {
            return Optional.of(Camp.LOUP);
        }
        if (victorCamps.stream().allMatch(c -> c == Camp.VILLAGEOIS)) {
            return Optional.of(Camp.VILLAGEOIS);
        }
        return victorCamps.stream()
            .filter(c -> c != Camp.VILLAGEOIS && !c.isWolfFamily())
            .findFirst();
    }

    /**
     * Camp-level win check. Wolf-family camps win whenever the wolf alliance wins; other camps
     * win on equality. Says nothing about individual members, see {@link #didPlayerWin}.
     */
    public static boolean didCampWin(Camp playerCamp, Camp winningCamp) {
        if (playerCamp == null || winningCamp == null) {
            return false;
        }
        return playerCamp.alliance() == winningCamp.alliance();
    }

    /**
     * Whether {@code player} won {@code game}. Victory is personal: a solo player winning next to
     * the wolves, or villagers winning next to a solo, all count as winners, while two Agents of
     * the same game can differ.
     */
    public static boolean didPlayerWin(GameRecord game, PlayerRecord player) {
        return player.victorious();
    }
}
