package edu.brandeis.cosi103a.lycans.stats;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.LinkedHashMultiset;
import com.google.common.collect.Multiset;
import edu.brandeis.cosi103a.lycans.model.GameRecord;
import edu.brandeis.cosi103a.lycans.model.PlayerRecord;
import edu.brandeis.cosi103a.lycans.role.CampResolver;
import edu.brandeis.cosi103a.lycans.role.Phase;
import edu.brandeis.cosi103a.lycans.role.PlayerIdentity;
import edu.brandeis.cosi103a.lycans.role.TimingCode;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Who kills whom: per-killer profiles and kill records per game and per night.
 */
public final class KillerStatistics {

    static final String UNKNOWN = "Inconnu";

    private KillerStatistics() {}

    public record KillerProfile(
        @JsonProperty("killer") String killer,
        @JsonProperty("totalKills") int totalKills,
        @JsonProperty("uniqueVictims") int uniqueVictims,
        @JsonProperty("victimsByRole") Map<String, Integer> victimsByRole,
        @JsonProperty("killsByDeathType") Map<String, Integer> killsByDeathType,
        @JsonProperty("killsByTiming") Map<String, Integer> killsByTiming,
        @JsonProperty("gamesAsKiller") int gamesAsKiller,
        @JsonProperty("killsPerGame") double killsPerGame,
        @JsonProperty("averageKillTiming") OptionalDouble averageKillTiming,
        @JsonProperty("mostTargetedRole") Optional<String> mostTargetedRole,
        @JsonProperty("mostCommonKillType") Optional<String> mostCommonKillType,
        @JsonProperty("preferredVictim") Optional<String> preferredVictim
    ) {}

    /**
     * Best kill count a player reached in a single game or night, and how often.
     */
    public record KillRecord(
        @JsonProperty("playerKey") String playerKey,
        @JsonProperty("playerName") String playerName,
        @JsonProperty("maxKills") int maxKills,
        @JsonProperty("timesAchieved") int timesAchieved,
        @JsonProperty("games") List<String> games
    ) {}

    private static final class ProfileAcc {
        String killer;
        int kills;
        final Multiset<String> victims = LinkedHashMultiset.create();
        final Multiset<String> roles = LinkedHashMultiset.create();
        final Multiset<String> types = LinkedHashMultiset.create();
        final Multiset<String> timings = LinkedHashMultiset.create();
        final Set<String> games = new HashSet<>();
        double timingSum;
        int timedKills;
    }

    private record Kill(GameRecord game, PlayerRecord victim) {
        String killerName() {
            return victim.killerName().trim();
        }
    }

    /**
     * One profile per killer name (trimmed, case-insensitive), most kills first.
     */
    public static ImmutableList<KillerProfile> profiles(List<GameRecord> games) {
        List<Kill> kills = new ArrayList<>();
        for (GameRecord game : games) {
            for (PlayerRecord p : game.playerStats()) {
                if (p.hasDied() && p.killerName() != null && !p.killerName().isBlank()) {
                    kills.add(new Kill(game, p));
                }
            }
        }
        Aggregation<Kill, String, ProfileAcc, KillerProfile> byKiller = Aggregation.of(
            kill -> PlayerIdentity.normalize(kill.killerName()),
            key -> new ProfileAcc(),
            (acc, kill) -> {
                PlayerRecord victim = kill.victim();
                acc.killer = kill.killerName();
                acc.kills++;
                acc.victims.add(PlayerIdentity.displayName(victim));
                acc.roles.add(CampResolver.initialCamp(kill.game(), victim).label());
                acc.types.add(orUnknown(victim.deathType()));
                acc.timings.add(orUnknown(victim.deathTiming()));
                acc.games.add(kill.game().id());
                Optional<Double> progress = TimingCode.parse(victim.deathTiming()).flatMap(TimingCode::progress);
                if (progress.isPresent()) {
                    acc.timingSum += progress.get();
                    acc.timedKills++;
                }
            },
            (key, acc) -> new KillerProfile(
                acc.killer,
                acc.kills,
                acc.victims.elementSet().size(),
                Tallies.byCount(acc.roles),
                Tallies.byCount(acc.types),
                Tallies.snapshot(acc.timings),
                acc.games.size(),
                acc.games.isEmpty() ? 0 : (double) acc.kills / acc.games.size(),
                acc.timedKills == 0 ? OptionalDouble.empty() : OptionalDouble.of(acc.timingSum / acc.timedKills),
                Tallies.mostCommon(acc.roles),
                Tallies.mostCommon(acc.types),
                Tallies.mostCommon(acc.victims)));

        List<KillerProfile> profiles = new ArrayList<>(byKiller.run(kills));
        profiles.sort(Comparator.comparingInt(KillerProfile::totalKills).reversed());
        return ImmutableList.copyOf(profiles);
    }

    /**
     * Highest number of victims each player killed in a single game. Only victims with a death
     * timing count.
     */
    public static ImmutableList<KillRecord> maxKillsPerGame(List<GameRecord> games) {
        Map<String, RecordAcc> records = new LinkedHashMap<>();
        for (GameRecord game : games) {
            for (PlayerRecord killer : game.playerStats()) {
                int kills = (int) game.playerStats().stream()
                    .filter(v -> v.deathTiming() != null && PlayerIdentity.sameName(v.killerName(), killer.username()))
                    .count();
                if (kills > 0) {
                    records.computeIfAbsent(PlayerIdentity.keyOf(killer), k -> new RecordAcc())
                        .offer(PlayerIdentity.displayName(killer), kills, game.label());
                }
            }
        }
        return finish(records);
    }

    /**
     * Highest number of victims each player killed during a single night.
     */
    public static ImmutableList<KillRecord> maxKillsPerNight(List<GameRecord> games) {
        Map<String, RecordAcc> records = new LinkedHashMap<>();
        for (GameRecord game : games) {
            Map<String, Multiset<String>> nightsByKiller = new LinkedHashMap<>();
            Map<String, String> names = new LinkedHashMap<>();
            for (PlayerRecord victim : game.playerStats()) {
                Optional<TimingCode> timing = TimingCode.parse(victim.deathTiming());
                if (victim.killerName() == null || victim.killerName().isBlank()
                        || timing.isEmpty() || timing.get().phase() != Phase.NIGHT) {
                    continue;
                }
                PlayerRecord killer = findByName(game, victim.killerName());
                String key = killer != null ? PlayerIdentity.keyOf(killer) : PlayerIdentity.normalize(victim.killerName());
                names.put(key, killer != null ? PlayerIdentity.displayName(killer) : victim.killerName().trim());
                nightsByKiller.computeIfAbsent(key, k -> LinkedHashMultiset.create()).add(timing.get().code());
            }
            nightsByKiller.forEach((key, nights) -> {
                for (Multiset.Entry<String> night : nights.entrySet()) {
                    records.computeIfAbsent(key, k -> new RecordAcc())
                        .offer(names.get(key), night.getCount(), game.label());
                }
            });
        }
        return finish(records);
    }

    private static final class RecordAcc {
        String name;
        int max;
        int times;
        final Set<String> games = new LinkedHashSet<>();

        void offer(String playerName, int kills, String gameLabel) {
            name = playerName;
            if (kills > max) {
                max = kills;
                times = 1;
                games.clear();
                games.add(gameLabel);
            } else if (kills == max) {
                times++;
                games.add(gameLabel);
            }
        }
    }

    private static ImmutableList<KillRecord> finish(Map<String, RecordAcc> records) {
        List<KillRecord> result = new ArrayList<>();
        records.forEach((key, acc) ->
            result.add(new KillRecord(key, acc.name, acc.max, acc.times, ImmutableList.copyOf(acc.games))));
        result.sort(Comparator.comparingInt(KillRecord::maxKills).reversed()
            .thenComparing(Comparator.comparingInt(KillRecord::timesAchieved).reversed()));
        return ImmutableList.copyOf(result);
    }

    private static PlayerRecord findByName(GameRecord game, String name) {
        for (PlayerRecord p : game.playerStats()) {
            if (PlayerIdentity.sameName(p.username(), name)) {
                return p;
            }
        }
        return null;
    }

    static String orUnknown(String value) {
        return value == null || value.isBlank() ? UNKNOWN : value.trim();
    }
}
