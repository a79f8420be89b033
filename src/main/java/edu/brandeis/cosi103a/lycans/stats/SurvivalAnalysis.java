package edu.brandeis.cosi103a.lycans.stats;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.Comparators;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.LinkedHashMultiset;
import com.google.common.collect.Multiset;
import edu.brandeis.cosi103a.lycans.model.GameRecord;
import edu.brandeis.cosi103a.lycans.model.PlayerRecord;
import edu.brandeis.cosi103a.lycans.role.Phase;
import edu.brandeis.cosi103a.lycans.role.PlayerIdentity;
import edu.brandeis.cosi103a.lycans.role.TimingCode;
import edu.brandeis.cosi103a.lycans.role.WinResolver;
import edu.brandeis.cosi103a.lycans.stats.KillerStatistics.KillRecord;
import edu.brandeis.cosi103a.lycans.stats.KillerStatistics.KillerProfile;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

import static edu.brandeis.cosi103a.lycans.stats.KillerStatistics.orUnknown;

/**
 * Deaths, killers and survival across a list of games.
 */
public record SurvivalAnalysis(
    @JsonProperty("overall") DeathStats overall,
    @JsonProperty("killers") List<KillerProfile> killers,
    @JsonProperty("timings") List<TimingDeaths> timings,
    @JsonProperty("players") List<PlayerSurvival> players,
    @JsonProperty("games") List<GameDeaths> games,
    @JsonProperty("maxKillsPerGame") List<KillRecord> maxKillsPerGame,
    @JsonProperty("maxKillsPerNight") List<KillRecord> maxKillsPerNight
) {

    public record DeathStats(
        @JsonProperty("totalDeaths") int totalDeaths,
        @JsonProperty("totalSurvivors") int totalSurvivors,
        @JsonProperty("survivalRate") Rate survivalRate,
        @JsonProperty("deathsByType") Map<String, Integer> deathsByType,
        @JsonProperty("deathsByTiming") Map<String, Integer> deathsByTiming,
        @JsonProperty("deathsByPhase") Map<Phase, Integer> deathsByPhase,
        @JsonProperty("averageDeathTiming") OptionalDouble averageDeathTiming,
        @JsonProperty("mostCommonDeathType") Optional<String> mostCommonDeathType,
        @JsonProperty("mostCommonDeathTiming") Optional<String> mostCommonDeathTiming
    ) {}

    /** Deaths recorded at one timing code. */
    public record TimingDeaths(
        @JsonProperty("timing") String timing,
        @JsonProperty("phase") Phase phase,
        @JsonProperty("dayNumber") int dayNumber,
        @JsonProperty("totalDeaths") int totalDeaths,
        @JsonProperty("deathsByType") Map<String, Integer> deathsByType,
        @JsonProperty("deathsByCamp") Map<String, Integer> deathsByCamp,
        @JsonProperty("killers") Map<String, Integer> killers
    ) {}

    public record PlayerSurvival(
        @JsonProperty("key") String key,
        @JsonProperty("player") String player,
        @JsonProperty("gamesPlayed") int gamesPlayed,
        @JsonProperty("timesKilled") int timesKilled,
        @JsonProperty("timesSurvived") int timesSurvived,
        @JsonProperty("survivalRate") Rate survivalRate,
        @JsonProperty("deathsByType") Map<String, Integer> deathsByType,
        @JsonProperty("deathsByTiming") Map<String, Integer> deathsByTiming,
        @JsonProperty("killedBy") Map<String, Integer> killedBy,
        @JsonProperty("campSurvival") Map<String, Rate> campSurvival,
        @JsonProperty("mostCommonDeathType") Optional<String> mostCommonDeathType,
        @JsonProperty("mostFrequentKiller") Optional<String> mostFrequentKiller
    ) {}

    public record DeathEntry(
        @JsonProperty("timing") String timing,
        @JsonProperty("victim") String victim,
        @JsonProperty("killer") Optional<String> killer,
        @JsonProperty("deathType") String deathType,
        @JsonProperty("phase") Phase phase
    ) {}

    public record GameDeaths(
        @JsonProperty("gameId") String gameId,
        @JsonProperty("gameDate") String gameDate,
        @JsonProperty("totalPlayers") int totalPlayers,
        @JsonProperty("totalDeaths") int totalDeaths,
        @JsonProperty("totalSurvivors") int totalSurvivors,
        @JsonProperty("winningCamp") Optional<String> winningCamp,
        @JsonProperty("deathProgression") List<DeathEntry> deathProgression,
        @JsonProperty("killersInGame") Map<String, Integer> killersInGame,
        @JsonProperty("deadliestPlayer") Optional<String> deadliestPlayer,
        @JsonProperty("endTiming") Optional<String> endTiming,
        @JsonProperty("durationSeconds") Optional<Long> durationSeconds,
        @JsonProperty("mortalityRate") Rate mortalityRate
    ) {}

    public static SurvivalAnalysis compute(List<GameRecord> games) {
        return new SurvivalAnalysis(
            deathStats(games),
            KillerStatistics.profiles(games),
            timingDistribution(games),
            playerSurvival(games),
            games.stream().map(SurvivalAnalysis::gameDeaths).collect(ImmutableList.toImmutableList()),
            KillerStatistics.maxKillsPerGame(games),
            KillerStatistics.maxKillsPerNight(games));
    }

    static Phase phaseOf(String timing) {
        return TimingCode.parse(timing).map(TimingCode::phase).orElse(Phase.UNKNOWN);
    }

    public static DeathStats deathStats(List<GameRecord> games) {
        int deaths = 0;
        int survivors = 0;
        Multiset<String> types = LinkedHashMultiset.create();
        Multiset<String> timings = LinkedHashMultiset.create();
        Map<Phase, Integer> phases = new EnumMap<>(Phase.class);
        double timingSum = 0;
        int timed = 0;
        for (GameRecord game : games) {
            for (PlayerRecord p : game.playerStats()) {
                if (!p.hasDied()) {
                    survivors++;
                    continue;
                }
                deaths++;
                types.add(orUnknown(p.deathType()));
                timings.add(orUnknown(p.deathTiming()));
                phases.merge(phaseOf(p.deathTiming()), 1, Integer::sum);
                Optional<Double> progress = TimingCode.parse(p.deathTiming()).flatMap(TimingCode::progress);
                if (progress.isPresent()) {
                    timingSum += progress.get();
                    timed++;
                }
            }
        }
        return new DeathStats(deaths, survivors, Rate.of(survivors, deaths + survivors),
            Tallies.byCount(types), Tallies.byCount(timings), ImmutableMap.copyOf(phases),
            timed == 0 ? OptionalDouble.empty() : OptionalDouble.of(timingSum / timed),
            Tallies.mostCommon(types), Tallies.mostCommon(timings));
    }

    private static final class TimingAcc {
        int deaths;
        final Multiset<String> types = LinkedHashMultiset.create();
        final Multiset<String> camps = LinkedHashMultiset.create();
        final Multiset<String> killers = LinkedHashMultiset.create();
    }

    private static final Aggregation<PlayerInGame, String, TimingAcc, TimingDeaths> BY_TIMING = Aggregation.of(
        row -> row.player().hasDied() && row.player().deathTiming() != null ? row.player().deathTiming().trim() : null,
        timing -> new TimingAcc(),
        (acc, row) -> {
            acc.deaths++;
            acc.types.add(orUnknown(row.player().deathType()));
            acc.camps.add(row.initialCamp().label());
            if (row.player().killerName() != null && !row.player().killerName().isBlank()) {
                acc.killers.add(row.player().killerName().trim());
            }
        },
        (timing, acc) -> {
            Optional<TimingCode> code = TimingCode.parse(timing);
            return new TimingDeaths(timing, code.map(TimingCode::phase).orElse(Phase.UNKNOWN),
                code.map(TimingCode::number).orElse(0), acc.deaths, Tallies.byCount(acc.types),
                Tallies.byCount(acc.camps), Tallies.byCount(acc.killers));
        });

    /**
     * Deaths per timing code, ordered by day number then phase. Unparsable timings come last.
     */
    public static ImmutableList<TimingDeaths> timingDistribution(List<GameRecord> games) {
        List<TimingDeaths> timings = new ArrayList<>(BY_TIMING.run(PlayerInGame.flatten(games)));
        timings.sort(Comparator.comparing((TimingDeaths t) -> TimingCode.parse(t.timing()),
            (a, b) -> {
                if (a.isPresent() && b.isPresent()) {
                    return a.get().compareTo(b.get());
                }
                return Boolean.compare(a.isEmpty(), b.isEmpty());
            }));
        return ImmutableList.copyOf(timings);
    }

    private static final class SurvivalAcc {
        String name;
        int games;
        int killed;
        final Multiset<String> types = LinkedHashMultiset.create();
        final Multiset<String> timings = LinkedHashMultiset.create();
        final Multiset<String> killers = LinkedHashMultiset.create();
        final Map<String, int[]> camps = new LinkedHashMap<>();
    }

    private static final Aggregation<PlayerInGame, String, SurvivalAcc, PlayerSurvival> BY_PLAYER = Aggregation.of(
        PlayerInGame::key,
        key -> new SurvivalAcc(),
        (acc, row) -> {
            PlayerRecord p = row.player();
            acc.name = row.displayName();
            acc.games++;
            int[] camp = acc.camps.computeIfAbsent(row.initialCamp().label(), c -> new int[2]);
            camp[0]++;
            if (p.hasDied()) {
                acc.killed++;
                acc.types.add(orUnknown(p.deathType()));
                acc.timings.add(orUnknown(p.deathTiming()));
                if (p.killerName() != null && !p.killerName().isBlank()) {
                    acc.killers.add(p.killerName().trim());
                }
            } else {
                camp[1]++;
            }
        },
        (key, acc) -> {
            ImmutableMap.Builder<String, Rate> camps = ImmutableMap.builder();
            acc.camps.forEach((camp, t) -> camps.put(camp, Rate.of(t[1], t[0])));
            int survived = acc.games - acc.killed;
            return new PlayerSurvival(key, acc.name, acc.games, acc.killed, survived, Rate.of(survived, acc.games),
                Tallies.byCount(acc.types), Tallies.byCount(acc.timings), Tallies.byCount(acc.killers),
                camps.build(), Tallies.mostCommon(acc.types), Tallies.mostCommon(acc.killers));
        });

    public static ImmutableList<PlayerSurvival> playerSurvival(List<GameRecord> games) {
        List<PlayerSurvival> players = new ArrayList<>(BY_PLAYER.run(PlayerInGame.flatten(games)));
        players.sort(Comparator.comparing(PlayerSurvival::survivalRate).reversed()
            .thenComparing(Comparator.comparingInt(PlayerSurvival::gamesPlayed).reversed()));
        return ImmutableList.copyOf(players);
    }

    public static GameDeaths gameDeaths(GameRecord game) {
        List<PlayerRecord> dead = game.playerStats().stream().filter(PlayerRecord::hasDied).toList();
        Multiset<String> killers = LinkedHashMultiset.create();
        List<DeathEntry> progression = new ArrayList<>();
        for (PlayerRecord p : dead) {
            Optional<String> killer = Optional.ofNullable(p.killerName())
                .filter(k -> !k.isBlank())
                .map(String::trim);
            killer.ifPresent(killers::add);
            progression.add(new DeathEntry(orUnknown(p.deathTiming()), PlayerIdentity.displayName(p), killer,
                orUnknown(p.deathType()), phaseOf(p.deathTiming())));
        }
        // Stable: unreadable timings keep roster order at the end.
        progression.sort(Comparator.comparing(
            (DeathEntry e) -> TimingCode.parse(e.timing()),
            Comparators.emptiesLast(Comparator.<TimingCode>naturalOrder())));
        int players = game.playerStats().size();
        return new GameDeaths(
            game.id(),
            game.startDate(),
            players,
            dead.size(),
            players - dead.size(),
            WinResolver.winningCampOf(game).map(c -> c.winLabel()),
            ImmutableList.copyOf(progression),
            Tallies.byCount(killers),
            Tallies.mostCommon(killers),
            Optional.ofNullable(game.endTiming()),
            game.durationSeconds(),
            Rate.of(dead.size(), players));
    }
}
