package edu.brandeis.cosi103a.lycans.stats;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import edu.brandeis.cosi103a.lycans.model.GameRecord;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Per-player games, wins and final-camp histogram.
 */
public record PlayerStats(
    @JsonProperty("totalGames") int totalGames,
    @JsonProperty("players") List<PlayerSummary> players
) {

    public record PlayerSummary(
        @JsonProperty("key") String key,
        @JsonProperty("displayName") String displayName,
        @JsonProperty("gamesPlayed") int gamesPlayed,
        @JsonProperty("wins") int wins,
        @JsonProperty("winRate") Rate winRate,
        @JsonProperty("camps") Map<String, CampTally> camps
    ) {}

    public record CampTally(
        @JsonProperty("played") int played,
        @JsonProperty("won") int won,
        @JsonProperty("winRate") Rate winRate
    ) {}

    private static final class Acc {
        String displayName;
        int games;
        int wins;
        // Created on the first game in a camp.
        final Map<String, int[]> camps = new LinkedHashMap<>();
    }

    private static final Aggregation<PlayerInGame, String, Acc, PlayerSummary> BY_PLAYER = Aggregation.of(
        PlayerInGame::key,
        key -> new Acc(),
        (acc, row) -> {
            acc.displayName = row.displayName();
            acc.games++;
            int[] camp = acc.camps.computeIfAbsent(row.finalCamp().label(), c -> new int[2]);
            camp[0]++;
            if (row.won()) {
                acc.wins++;
                camp[1]++;
            }
        },
        (key, acc) -> {
            ImmutableMap.Builder<String, CampTally> camps = ImmutableMap.builder();
            acc.camps.forEach((camp, t) -> camps.put(camp, new CampTally(t[0], t[1], Rate.of(t[1], t[0]))));
            return new PlayerSummary(key, acc.displayName, acc.games, acc.wins,
                Rate.of(acc.wins, acc.games), camps.build());
        });

    /**
     * Players are keyed by id when present, else by normalized name; the display name is the one
     * used in the last game seen, so input is expected in chronological order.
     */
    public static PlayerStats compute(List<GameRecord> games) {
        List<PlayerSummary> players = new ArrayList<>(BY_PLAYER.run(PlayerInGame.flatten(games)));
        players.sort(Comparator.comparingInt(PlayerSummary::gamesPlayed).reversed()
            .thenComparing(PlayerSummary::displayName, String.CASE_INSENSITIVE_ORDER));
        return new PlayerStats(games.size(), ImmutableList.copyOf(players));
    }

    public Optional<PlayerSummary> find(String keyOrName) {
        return players.stream()
            .filter(p -> p.key().equals(keyOrName) || p.displayName().equalsIgnoreCase(keyOrName.trim()))
            .findFirst();
    }
}
