package edu.brandeis.cosi103a.lycans.stats;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import edu.brandeis.cosi103a.lycans.model.GameRecord;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Month-by-month leaderboard by win rate, restricted to players who played at least 40% of
 * the month's games.
 *
 * <p>{@link #progression} replays a month one game at a time so a leaderboard can be animated;
 * each frame carries the rank change of every player since the previous frame.
 */
public final class MonthlyRanking {

    private static final DateTimeFormatter MONTH = DateTimeFormatter.ofPattern("yyyy-MM").withZone(ZoneOffset.UTC);

    private MonthlyRanking() {}

    /**
     * Leaderboard of one month, or of the first {@code gamesConsidered} games of it.
     */
    public record Ranking(
        @JsonProperty("month") String month,
        @JsonProperty("gamesConsidered") int gamesConsidered,
        @JsonProperty("minGames") int minGames,
        @JsonProperty("players") List<RankedPlayer> players
    ) {
        public Optional<RankedPlayer> player(String key) {
            return players.stream().filter(p -> p.key().equals(key)).findFirst();
        }
    }

    /**
     * @param rankDelta previous rank minus this rank (positive means the player climbed);
     *                  absent when the player was not ranked in the previous frame
     */
    public record RankedPlayer(
        @JsonProperty("rank") int rank,
        @JsonProperty("key") String key,
        @JsonProperty("displayName") String displayName,
        @JsonProperty("gamesPlayed") int gamesPlayed,
        @JsonProperty("wins") int wins,
        @JsonProperty("winRate") Rate winRate,
        @JsonProperty("rankDelta") Optional<Integer> rankDelta
    ) {
        RankedPlayer withDelta(Optional<Integer> delta) {
            return new RankedPlayer(rank, key, displayName, gamesPlayed, wins, winRate, delta);
        }
    }

    /** Minimum games to be ranked out of {@code monthGames}: 40%, rounded up. */
    public static int minGames(int monthGames) {
        return (monthGames * 2 + 4) / 5;
    }

    /** "yyyy-MM" of the game's start date (UTC), absent when the date cannot be read. */
    public static Optional<String> monthOf(GameRecord game) {
        return game.startInstant().map(MONTH::format);
    }

    /**
     * Games grouped by month, months in ascending order, each month sorted by start time.
     * Games with an unreadable start date are left out.
     */
    public static ImmutableSortedMap<String, ImmutableList<GameRecord>> gamesByMonth(List<GameRecord> games) {
        TreeMap<String, List<GameRecord>> months = new TreeMap<>();
        for (GameRecord game : games) {
            monthOf(game).ifPresent(m -> months.computeIfAbsent(m, k -> new ArrayList<>()).add(game));
        }
        ImmutableSortedMap.Builder<String, ImmutableList<GameRecord>> builder = ImmutableSortedMap.naturalOrder();
        months.forEach((month, list) -> {
            List<GameRecord> sorted = new ArrayList<>(list);
            sorted.sort(Comparator.comparing(g -> g.startInstant().orElse(Instant.MIN)));
            builder.put(month, ImmutableList.copyOf(sorted));
        });
        return builder.build();
    }

    /** Final ranking of every month. */
    public static ImmutableList<Ranking> all(List<GameRecord> games) {
        ImmutableList.Builder<Ranking> result = ImmutableList.builder();
        gamesByMonth(games).forEach((month, monthGames) ->
            result.add(rankPrefix(month, monthGames, monthGames.size())));
        return result.build();
    }

    /** Ranking of one month, empty when no game falls in it. */
    public static Optional<Ranking> rank(List<GameRecord> games, String month) {
        ImmutableList<GameRecord> monthGames = gamesByMonth(games).get(month);
        if (monthGames == null) {
            return Optional.empty();
        }
        return Optional.of(rankPrefix(month, monthGames, monthGames.size()));
    }

    /**
     * Ranking over the first {@code k} games of a month's chronologically sorted games. The
     * participation floor is computed from {@code k}.
     */
    public static Ranking rankPrefix(String month, List<GameRecord> monthGames, int k) {
        int considered = Math.max(0, Math.min(k, monthGames.size()));
        List<GameRecord> prefix = monthGames.subList(0, considered);
        int floor = minGames(considered);

        Aggregation<PlayerInGame, String, int[], RankedPlayer> byPlayer = Aggregation.of(
            PlayerInGame::key,
            key -> new int[2],
            (acc, row) -> {
                acc[0]++;
                if (row.won()) {
                    acc[1]++;
                }
            },
            (key, acc) -> new RankedPlayer(0, key, null, acc[0], acc[1], Rate.of(acc[1], acc[0]), Optional.empty()));

        List<PlayerInGame> rows = PlayerInGame.flatten(prefix);
        Map<String, String> names = new HashMap<>();
        rows.forEach(r -> names.put(r.key(), r.displayName()));

        List<RankedPlayer> eligible = new ArrayList<>(byPlayer.run(rows).stream()
            .filter(p -> p.gamesPlayed() >= floor)
            .toList());
        eligible.sort(Comparator.comparing(RankedPlayer::winRate).reversed()
            .thenComparing(Comparator.comparingInt(RankedPlayer::gamesPlayed).reversed())
            .thenComparing(RankedPlayer::key));

        ImmutableList.Builder<RankedPlayer> ranked = ImmutableList.builder();
        for (int i = 0; i < eligible.size(); i++) {
            RankedPlayer p = eligible.get(i);
            ranked.add(new RankedPlayer(i + 1, p.key(), names.get(p.key()), p.gamesPlayed(), p.wins(),
                p.winRate(), Optional.empty()));
        }
        return new Ranking(month, considered, floor, ranked.build());
    }

    /**
     * One frame per game of the month: frame {@code i} ranks the first {@code i + 1} games, with
     * rank deltas against frame {@code i - 1}. Empty when the month has no games.
     */
    public static ImmutableList<Ranking> progression(List<GameRecord> games, String month) {
        ImmutableList<GameRecord> monthGames = gamesByMonth(games).get(month);
        if (monthGames == null) {
            return ImmutableList.of();
        }
        ImmutableList.Builder<Ranking> frames = ImmutableList.builder();
        Map<String, Integer> previousRanks = new HashMap<>();
        for (int k = 1; k <= monthGames.size(); k++) {
            Ranking frame = rankPrefix(month, monthGames, k);
            Map<String, Integer> ranks = new HashMap<>();
            List<RankedPlayer> players = new ArrayList<>();
            for (RankedPlayer p : frame.players()) {
                ranks.put(p.key(), p.rank());
                Integer before = previousRanks.get(p.key());
                players.add(p.withDelta(before == null ? Optional.empty() : Optional.of(before - p.rank())));
            }
            frames.add(new Ranking(month, frame.gamesConsidered(), frame.minGames(), ImmutableList.copyOf(players)));
            previousRanks = ranks;
        }
        return frames.build();
    }
}
