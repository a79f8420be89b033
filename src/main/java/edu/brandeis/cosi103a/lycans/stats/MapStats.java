package edu.brandeis.cosi103a.lycans.stats;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.LinkedHashMultiset;
import com.google.common.collect.Multiset;
import edu.brandeis.cosi103a.lycans.model.GameRecord;
import edu.brandeis.cosi103a.lycans.role.Camp;
import edu.brandeis.cosi103a.lycans.role.WinResolver;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Per-map breakdown: which camps win on each map, how long games there last, how much of the
 * harvest goal gets done, and how each player fares on each map.
 */
public record MapStats(
    @JsonProperty("maps") List<MapSummary> maps,
    @JsonProperty("players") List<PlayerMap> players
) {

    /**
     * @param harvestPercent mean of HarvestDone over HarvestGoal across games recording both
     */
    public record MapSummary(
        @JsonProperty("map") String map,
        @JsonProperty("games") int games,
        @JsonProperty("campWins") Map<String, Integer> campWins,
        @JsonProperty("averageDurationSeconds") OptionalDouble averageDurationSeconds,
        @JsonProperty("harvestGames") int harvestGames,
        @JsonProperty("harvestPercent") OptionalDouble harvestPercent
    ) {}

    public record PlayerMap(
        @JsonProperty("playerKey") String playerKey,
        @JsonProperty("playerName") String playerName,
        @JsonProperty("map") String map,
        @JsonProperty("games") int games,
        @JsonProperty("wins") int wins,
        @JsonProperty("winRate") Rate winRate
    ) {}

    private record PlayerOnMap(String key, String map) {}

    private static final class MapAcc {
        int games;
        final Multiset<String> wins = LinkedHashMultiset.create();
        long durationSum;
        int timed;
        double harvestSum;
        int harvested;

        void add(GameRecord game) {
            games++;
            WinResolver.winningCampOf(game).map(Camp::winLabel).ifPresent(wins::add);
            Optional<Long> duration = game.durationSeconds();
            if (duration.isPresent()) {
                durationSum += duration.get();
                timed++;
            }
            if (game.harvestDone() != null && game.harvestGoal() != null && game.harvestGoal() > 0) {
                harvestSum += game.harvestDone() * 100.0 / game.harvestGoal();
                harvested++;
            }
        }
    }

    private static final class PlayerAcc {
        String name;
        int games;
        int wins;

        void add(PlayerInGame row) {
            name = row.displayName();
            games++;
            if (row.won()) {
                wins++;
            }
        }
    }

    public static MapStats compute(List<GameRecord> games) {
        Aggregation<GameRecord, String, MapAcc, MapSummary> byMap = Aggregation.of(
            MapStats::mapOf,
            map -> new MapAcc(),
            MapAcc::add,
            (map, acc) -> new MapSummary(map, acc.games, Tallies.byCount(acc.wins),
                acc.timed == 0 ? OptionalDouble.empty() : OptionalDouble.of((double) acc.durationSum / acc.timed),
                acc.harvested,
                acc.harvested == 0 ? OptionalDouble.empty() : OptionalDouble.of(acc.harvestSum / acc.harvested)));
        Aggregation<PlayerInGame, PlayerOnMap, PlayerAcc, PlayerMap> byPlayer = Aggregation.of(
            row -> new PlayerOnMap(row.key(), mapOf(row.game())),
            key -> new PlayerAcc(),
            PlayerAcc::add,
            (key, acc) -> new PlayerMap(key.key(), acc.name, key.map(), acc.games, acc.wins,
                Rate.of(acc.wins, acc.games)));

        List<MapSummary> maps = new ArrayList<>(byMap.run(games));
        maps.sort(Comparator.comparingInt(MapSummary::games).reversed().thenComparing(MapSummary::map));
        List<PlayerMap> players = new ArrayList<>(byPlayer.run(PlayerInGame.flatten(games)));
        players.sort(Comparator.comparing(PlayerMap::playerName)
            .thenComparing(Comparator.comparingInt(PlayerMap::games).reversed())
            .thenComparing(PlayerMap::map));
        return new MapStats(ImmutableList.copyOf(maps), ImmutableList.copyOf(players));
    }

    public Optional<MapSummary> map(String name) {
        return maps.stream().filter(m -> m.map().equalsIgnoreCase(name)).findFirst();
    }

    static String mapOf(GameRecord game) {
        return KillerStatistics.orUnknown(game.mapName());
    }
}
