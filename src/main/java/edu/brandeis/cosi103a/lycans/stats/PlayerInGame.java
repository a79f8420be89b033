package edu.brandeis.cosi103a.lycans.stats;

import com.google.common.collect.ImmutableList;
import edu.brandeis.cosi103a.lycans.model.GameRecord;
import edu.brandeis.cosi103a.lycans.model.PlayerRecord;
import edu.brandeis.cosi103a.lycans.role.Camp;
import edu.brandeis.cosi103a.lycans.role.CampResolver;
import edu.brandeis.cosi103a.lycans.role.PlayerIdentity;
import edu.brandeis.cosi103a.lycans.role.WinResolver;

import java.util.List;
import java.util.Optional;

/**
 * A player's line in one game together with the camps and outcome resolved for it.
 */
public record PlayerInGame(
    GameRecord game,
    PlayerRecord player,
    Camp initialCamp,
    Camp finalCamp,
    Optional<Camp> winningCamp,
    boolean won
) {
    public String key() {
        return PlayerIdentity.keyOf(player);
    }

    public String displayName() {
        return PlayerIdentity.displayName(player);
    }

    /**
     * Resolves every player of one game. The winning camp is computed once per game.
     */
    public static ImmutableList<PlayerInGame> of(GameRecord game) {
        Optional<Camp> winner = WinResolver.winningCampOf(game);
        ImmutableList.Builder<PlayerInGame> rows = ImmutableList.builder();
        for (PlayerRecord p : game.playerStats()) {
            Camp initial = CampResolver.initialCamp(game, p);
            Camp fin = CampResolver.finalCamp(game, p);
            rows.add(new PlayerInGame(game, p, initial, fin, winner, WinResolver.didPlayerWin(game, p)));
        }
        return rows.build();
    }

    /** Flattens all games, in input order. */
    public static ImmutableList<PlayerInGame> flatten(List<GameRecord> games) {
        ImmutableList.Builder<PlayerInGame> rows = ImmutableList.builder();
        for (GameRecord game : games) {
            rows.addAll(of(game));
        }
        return rows.build();
    }
}
