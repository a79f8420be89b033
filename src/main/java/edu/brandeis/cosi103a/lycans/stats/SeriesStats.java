package edu.brandeis.cosi103a.lycans.stats;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.Comparators;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.LinkedHashMultiset;
import com.google.common.collect.Multiset;
import edu.brandeis.cosi103a.lycans.model.GameRecord;
import edu.brandeis.cosi103a.lycans.role.Camp;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Longest consecutive runs per player, over games in chronological order: games in a row
 * started as a villager, games in a row started in the wolf family, wins in a row and losses
 * in a row.
 *
 * <p>Starting in any other camp breaks both camp runs. Of two runs of equal length the later
 * one is kept. A run is ongoing when the player's last game still extends it.
 */
public record SeriesStats(
    @JsonProperty("totalGames") int totalGames,
    @JsonProperty("totalPlayers") int totalPlayers,
    @JsonProperty("villageoisSeries") List<Series> villageoisSeries,
    @JsonProperty("wolfSeries") List<Series> wolfSeries,
    @JsonProperty("winSeries") List<Series> winSeries,
    @JsonProperty("lossSeries") List<Series> lossSeries
) {

    static final String VILLAGE = "Villageois";
    static final String WOLVES = "Loup";
    static final String OTHERS = "Autres";

    /**
     * @param gameIds    display labels of the games in the run, in order
     * @param campCounts games of the run per starting camp group
     */
    public record Series(
        @JsonProperty("playerKey") String playerKey,
        @JsonProperty("playerName") String playerName,
        @JsonProperty("length") int length,
        @JsonProperty("startGame") String startGame,
        @JsonProperty("endGame") String endGame,
        @JsonProperty("startDate") Optional<String> startDate,
        @JsonProperty("endDate") Optional<String> endDate,
        @JsonProperty("campCounts") Map<String, Integer> campCounts,
        @JsonProperty("gameIds") List<String> gameIds,
        @JsonProperty("ongoing") boolean ongoing
    ) {}

    private record Step(GameRecord game, String camp) {}

    private static final class Run {
        private final List<Step> current = new ArrayList<>();
        private List<Step> longest = List.of();

        void extend(GameRecord game, String camp) {
            current.add(new Step(game, camp));
            if (current.size() >= longest.size()) {
                longest = List.copyOf(current);
            }
        }

        void reset() {
            current.clear();
        }

        Optional<Series> toSeries(String key, String name) {
            if (longest.isEmpty()) {
                return Optional.empty();
            }
            Multiset<String> camps = LinkedHashMultiset.create();
            longest.forEach(s -> camps.add(s.camp()));
            GameRecord first = longest.get(0).game();
            GameRecord last = longest.get(longest.size() - 1).game();
            return Optional.of(new Series(key, name, longest.size(), first.label(), last.label(),
                Optional.ofNullable(first.startDate()), Optional.ofNullable(last.startDate()),
                Tallies.snapshot(camps),
                longest.stream().map(s -> s.game().label()).collect(ImmutableList.toImmutableList()),
                current.size() == longest.size()));
        }
    }

    private static final class Tracker {
        final String key;
        String name;
        final Run village = new Run();
        final Run wolves = new Run();
        final Run wins = new Run();
        final Run losses = new Run();

        Tracker(String key) {
            this.key = key;
        }

        void add(PlayerInGame row) {
            name = row.displayName();
            String camp = campGroup(row.initialCamp());
            switch (camp) {
                case VILLAGE -> {
                    village.extend(row.game(), camp);
                    wolves.reset();
                }
                case WOLVES -> {
                    wolves.extend(row.game(), camp);
                    village.reset();
                }
                default -> {
                    village.reset();
                    wolves.reset();
                }
            }
            if (row.won()) {
                wins.extend(row.game(), camp);
                losses.reset();
            } else {
                losses.extend(row.game(), camp);
                wins.reset();
            }
        }
    }

    /**
     * Games are ordered by start date; games without a readable one keep their input order
     * after every dated game.
     */
    public static SeriesStats compute(List<GameRecord> games) {
        List<GameRecord> ordered = new ArrayList<>(games);
        ordered.sort(Comparator.comparing(GameRecord::startInstant,
            Comparators.emptiesLast(Comparator.<Instant>naturalOrder())));

        Aggregation<PlayerInGame, String, Tracker, Tracker> byPlayer = Aggregation.of(
            PlayerInGame::key, Tracker::new, Tracker::add, (key, tracker) -> tracker);
        ImmutableList<Tracker> trackers = byPlayer.run(PlayerInGame.flatten(ordered));

        return new SeriesStats(ordered.size(), trackers.size(),
            longest(trackers, t -> t.village),
            longest(trackers, t -> t.wolves),
            longest(trackers, t -> t.wins),
            longest(trackers, t -> t.losses));
    }

    static String campGroup(Camp camp) {
        if (camp == Camp.VILLAGEOIS) {
            return VILLAGE;
        }
        return camp.isWolfFamily() ? WOLVES : OTHERS;
    }

    private static ImmutableList<Series> longest(List<Tracker> trackers, Function<Tracker, Run> run) {
        List<Series> series = new ArrayList<>();
        for (Tracker t : trackers) {
            run.apply(t).toSeries(t.key, t.name).ifPresent(series::add);
        }
        series.sort(Comparator.comparingInt(Series::length).reversed().thenComparing(Series::playerName));
        return ImmutableList.copyOf(series);
    }
}
