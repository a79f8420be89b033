package edu.brandeis.cosi103a.lycans.scoring;

import com.google.common.collect.ImmutableList;
import edu.brandeis.cosi103a.lycans.model.GameRecord;
import edu.brandeis.cosi103a.lycans.role.Camp;
import edu.brandeis.cosi103a.lycans.stats.PlayerInGame;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Scores how steady a player's results are, from 5 (erratic) to 95 (steady).
 *
 * <p>The score blends three parts:
 * <ul>
 *   <li>camp variance (weight 0.4): starts at 50 and gains {@code (1 - variance) * 20} for each of
 *       the Villageois and wolf-family sub-histories with at least {@value #MIN_CAMP_GAMES} games;</li>
 *   <li>temporal stability (weight 0.3): win rates of the early, middle and late thirds of the
 *       history, {@code (1 - (max - min)) * 100};</li>
 *   <li>streak volatility (weight 0.3): {@code 100 - |changes / (n - 1) - 0.4| * 60}, where a
 *       change is a win followed by a loss or the reverse.</li>
 * </ul>
 * Histories shorter than {@value #MIN_GAMES} games get {@value #INSUFFICIENT} instead.
 */
public final class ConsistencyScorer {

    public static final int MIN_GAMES = 30;
    public static final int MIN_CAMP_GAMES = 10;
    public static final double INSUFFICIENT = 25.0;
    public static final double NATURAL_VOLATILITY = 0.4;

    private ConsistencyScorer() {}

    /**
     * @param history the player's games in chronological order
     */
    public static double advancedConsistency(List<Outcome> history) {
        int n = history.size();
        if (n < MIN_GAMES) {
            return INSUFFICIENT;
        }

        double campScore = 50.0;
        List<Outcome> village = history.stream().filter(o -> o.camp() == Camp.VILLAGEOIS).toList();
        List<Outcome> wolves = history.stream().filter(o -> o.camp().isWolfFamily()).toList();
        if (village.size() >= MIN_CAMP_GAMES) {
            campScore += (1 - variance(village)) * 20;
        }
        if (wolves.size() >= MIN_CAMP_GAMES) {
            campScore += (1 - variance(wolves)) * 20;
        }

        int third = n / 3;
        double early = winRate(history.subList(0, third));
        double middle = winRate(history.subList(third, 2 * third));
        double late = winRate(history.subList(2 * third, n));
        double max = Math.max(early, Math.max(middle, late));
        double min = Math.min(early, Math.min(middle, late));
        double temporal = (1 - (max - min)) * 100;

        int changes = 0;
        for (int i = 1; i < n; i++) {
            if (history.get(i).won() != history.get(i - 1).won()) {
                changes++;
            }
        }
        double volatility = (double) changes / (n - 1);
        double penalty = Math.abs(volatility - NATURAL_VOLATILITY) * 60;

        double score = 0.4 * campScore + 0.3 * temporal + 0.3 * (100 - penalty);
        return Math.max(5.0, Math.min(95.0, score));
    }

    /**
     * Chronological history of the player with the given identity key.
     */
    public static ImmutableList<Outcome> historyOf(List<GameRecord> games, String playerKey) {
        List<GameRecord> ordered = new ArrayList<>(games);
        ordered.sort(Comparator.comparing(g -> g.startInstant().orElse(Instant.MIN)));
        ImmutableList.Builder<Outcome> history = ImmutableList.builder();
        for (GameRecord game : ordered) {
            for (PlayerInGame row : PlayerInGame.of(game)) {
                if (row.key().equals(playerKey)) {
                    history.add(new Outcome(row.finalCamp(), row.won()));
                    break;
                }
            }
        }
        return history.build();
    }

    // Population variance of 0/1 outcomes.
    private static double variance(List<Outcome> outcomes) {
        double mean = winRate(outcomes);
        double sum = 0;
        for (Outcome o : outcomes) {
            double x = o.won() ? 1.0 : 0.0;
            sum += (x - mean) * (x - mean);
        }
        return sum / outcomes.size();
    }

    private static double winRate(List<Outcome> outcomes) {
        if (outcomes.isEmpty()) {
            return 0;
        }
        return outcomes.stream().filter(Outcome::won).count() / (double) outcomes.size();
    }
}
