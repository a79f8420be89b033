package edu.brandeis.cosi103a.lycans.stats;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;
import edu.brandeis.cosi103a.lycans.model.GameRecord;
import edu.brandeis.cosi103a.lycans.role.Camp;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * How each player does in each camp compared with everybody else in that camp.
 *
 * <p>Rows exist per final camp and for the two grouped camps "Camp Villageois" and
 * "Camp Loup" (the whole wolf family).
 */
public final class CampPerformance {

    public static final int MIN_GAMES = 3;
    public static final String GROUPED_VILLAGE = "Camp Villageois";
    public static final String GROUPED_WOLVES = "Camp Loup";

    private CampPerformance() {}

    /**
     * @param performance player win rate minus the camp's overall win rate, in points;
     *                    absent when either rate is undefined
     */
    public record Row(
        @JsonProperty("playerKey") String playerKey,
        @JsonProperty("playerName") String playerName,
        @JsonProperty("camp") String camp,
        @JsonProperty("games") int games,
        @JsonProperty("wins") int wins,
        @JsonProperty("winRate") Rate winRate,
        @JsonProperty("performance") OptionalDouble performance,
        @JsonProperty("totalGames") int totalGames
    ) {}

    private record CampKey(String player, String camp) {}

    public static ImmutableList<Row> compute(List<GameRecord> games) {
        return compute(games, MIN_GAMES);
    }

    public static ImmutableList<Row> compute(List<GameRecord> games, int minGames) {
        Map<String, int[]> campTotals = new LinkedHashMap<>();
        Map<CampKey, int[]> playerCamps = new LinkedHashMap<>();
        Map<String, Integer> playerGames = new LinkedHashMap<>();
        Map<String, String> names = new LinkedHashMap<>();

        for (PlayerInGame row : PlayerInGame.flatten(games)) {
            names.put(row.key(), row.displayName());
            playerGames.merge(row.key(), 1, Integer::sum);
            for (String camp : campsOf(row.finalCamp())) {
                count(campTotals.computeIfAbsent(camp, c -> new int[2]), row.won());
                count(playerCamps.computeIfAbsent(new CampKey(row.key(), camp), c -> new int[2]), row.won());
            }
        }

        ImmutableList.Builder<Row> rows = ImmutableList.builder();
        playerCamps.forEach((key, tally) -> {
            if (tally[0] < minGames) {
                return;
            }
            int[] camp = campTotals.get(key.camp());
            Rate playerRate = Rate.of(tally[1], tally[0]);
            Rate campRate = Rate.of(camp[1], camp[0]);
            OptionalDouble performance = playerRate.isDefined() && campRate.isDefined()
                ? OptionalDouble.of(playerRate.percent().getAsDouble() - campRate.percent().getAsDouble())
                : OptionalDouble.empty();
            rows.add(new Row(key.player(), names.get(key.player()), key.camp(), tally[0], tally[1], playerRate,
                performance, playerGames.get(key.player())));
        });
        return rows.build();
    }

    private static List<String> campsOf(Camp camp) {
        if (camp == Camp.VILLAGEOIS) {
            return List.of(camp.label(), GROUPED_VILLAGE);
        }
        if (camp.isWolfFamily()) {
            return List.of(camp.label(), GROUPED_WOLVES);
        }
        return List.of(camp.label());
    }

    private static void count(int[] tally, boolean won) {
        tally[0]++;
        if (won) {
            tally[1]++;
        }
    }
}
