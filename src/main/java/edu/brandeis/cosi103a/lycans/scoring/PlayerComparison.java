package edu.brandeis.cosi103a.lycans.scoring;

import com.fasterxml.jackson.annotation.JsonProperty;
import edu.brandeis.cosi103a.lycans.model.GameRecord;
import edu.brandeis.cosi103a.lycans.model.PlayerRecord;
import edu.brandeis.cosi103a.lycans.model.Timestamps;
import edu.brandeis.cosi103a.lycans.model.VoteEvent;
import edu.brandeis.cosi103a.lycans.role.PlayerIdentity;
import edu.brandeis.cosi103a.lycans.stats.CampPerformance;
import edu.brandeis.cosi103a.lycans.stats.PlayerInGame;
import edu.brandeis.cosi103a.lycans.stats.PlayerStats;
import edu.brandeis.cosi103a.lycans.stats.PlayerStats.PlayerSummary;
import edu.brandeis.cosi103a.lycans.stats.Rate;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.function.DoubleUnaryOperator;
import java.util.function.ToDoubleFunction;

/**
 * Side-by-side comparison of two players: population-scaled metrics for each, plus their
 * head-to-head record in the games they shared.
 */
public final class PlayerComparison {

    /** Games a player needs to be part of the population the scalers are fit on. */
    public static final int DEFAULT_MIN_GAMES = 30;

    /** Harvest score of a player with no recorded loot, or of any player when nobody has loot. */
    public static final double NO_HARVEST_SCORE = 10.0;

    private PlayerComparison() {}

    /**
     * Raw metrics plus their 0-100 scores against the population.
     */
    public record PlayerMetrics(
        @JsonProperty("key") String key,
        @JsonProperty("displayName") String displayName,
        @JsonProperty("gamesPlayed") int gamesPlayed,
        @JsonProperty("winRate") Rate winRate,
        @JsonProperty("killsPerGame") double killsPerGame,
        @JsonProperty("survivalRate") Rate survivalRate,
        @JsonProperty("aggressiveness") double aggressiveness,
        @JsonProperty("campMastery") double campMastery,
        @JsonProperty("harvestPerHour") double harvestPerHour,
        @JsonProperty("participationScore") double participationScore,
        @JsonProperty("winRateScore") double winRateScore,
        @JsonProperty("killsPerGameScore") double killsPerGameScore,
        @JsonProperty("survivalRateScore") double survivalRateScore,
        @JsonProperty("aggressivenessScore") double aggressivenessScore,
        @JsonProperty("campMasteryScore") double campMasteryScore,
        @JsonProperty("harvestScore") double harvestScore,
        @JsonProperty("consistencyScore") double consistencyScore
    ) {}

    /**
     * Record of the two players in shared games. "Opposing" means different alliances, with
     * the whole wolf family counting as one alliance.
     */
    public record HeadToHead(
        @JsonProperty("commonGames") int commonGames,
        @JsonProperty("firstWins") int firstWins,
        @JsonProperty("secondWins") int secondWins,
        @JsonProperty("opposingGames") int opposingGames,
        @JsonProperty("firstWinsAsOpponent") int firstWinsAsOpponent,
        @JsonProperty("secondWinsAsOpponent") int secondWinsAsOpponent,
        @JsonProperty("firstKilledSecond") int firstKilledSecond,
        @JsonProperty("secondKilledFirst") int secondKilledFirst,
        @JsonProperty("sameCampGames") int sameCampGames,
        @JsonProperty("sameCampWins") int sameCampWins,
        @JsonProperty("sameWolfGames") int sameWolfGames,
        @JsonProperty("sameWolfWins") int sameWolfWins,
        @JsonProperty("averageDurationSeconds") OptionalDouble averageDurationSeconds
    ) {}

    public record Comparison(
        @JsonProperty("first") PlayerMetrics first,
        @JsonProperty("second") PlayerMetrics second,
        @JsonProperty("headToHead") HeadToHead headToHead
    ) {}

    private static final class Raw {
        String name;
        int games;
        int wins;
        int kills;
        int survived;
        int meetings;
        int votes;
        int skips;
        double campMastery;
        long loot;
        long lootSeconds;

        double killsPerGame() {
            return games == 0 ? 0 : (double) kills / games;
        }

        // Vote rate minus half the skip rate, in points.
        double aggressiveness() {
            if (meetings == 0) {
                return 0;
            }
            return votes * 100.0 / meetings - 0.5 * (skips * 100.0 / meetings);
        }

        double harvestPerHour() {
            return lootSeconds == 0 ? 0 : loot * 3600.0 / lootSeconds;
        }
    }

    public static Optional<Comparison> compare(List<GameRecord> games, String first, String second) {
        return compare(games, first, second, DEFAULT_MIN_GAMES);
    }

    /**
     * Compares two players given by identity key or display name. Empty when either player
     * does not appear in {@code games}.
     */
    public static Optional<Comparison> compare(List<GameRecord> games, String first, String second, int minGames) {
        PlayerStats stats = PlayerStats.compute(games);
        Optional<PlayerSummary> a = stats.find(first);
        Optional<PlayerSummary> b = stats.find(second);
        if (a.isEmpty() || b.isEmpty() || a.get().key().equals(b.get().key())) {
            return Optional.empty();
        }

        Map<String, Raw> raw = rawMetrics(games);
        List<Raw> population = new ArrayList<>();
        raw.values().forEach(r -> {
            if (r.games >= minGames) {
                population.add(r);
            }
        });
        DoubleUnaryOperator winScaler = scaler(population, r -> Rate.of(r.wins, r.games).percentOr(0));
        DoubleUnaryOperator killScaler = scaler(population, Raw::killsPerGame);
        DoubleUnaryOperator survivalScaler = scaler(population, r -> Rate.of(r.survived, r.games).percentOr(0));
        DoubleUnaryOperator aggressionScaler = scaler(population, Raw::aggressiveness);
        DoubleUnaryOperator participationScaler = scaler(population, r -> r.games);
        DoubleUnaryOperator masteryScaler = scaler(population, r -> r.campMastery);
        List<Raw> harvesters = population.stream().filter(r -> r.harvestPerHour() > 0).toList();
        DoubleUnaryOperator harvestScaler = harvesters.isEmpty()
            ? v -> NO_HARVEST_SCORE
            : scaler(harvesters, Raw::harvestPerHour);

        Scalers scalers = new Scalers(winScaler, killScaler, survivalScaler, aggressionScaler, participationScaler,
            masteryScaler, harvestScaler);
        String keyA = a.get().key();
        String keyB = b.get().key();
        return Optional.of(new Comparison(
            metrics(games, keyA, raw.get(keyA), scalers),
            metrics(games, keyB, raw.get(keyB), scalers),
            headToHead(games, keyA, keyB)));
    }

    private record Scalers(DoubleUnaryOperator win, DoubleUnaryOperator kills, DoubleUnaryOperator survival,
                           DoubleUnaryOperator aggression, DoubleUnaryOperator participation,
                           DoubleUnaryOperator mastery, DoubleUnaryOperator harvest) {}

    private static PlayerMetrics metrics(List<GameRecord> games, String key, Raw r, Scalers s) {
        Rate winRate = Rate.of(r.wins, r.games);
        Rate survival = Rate.of(r.survived, r.games);
        double harvest = r.harvestPerHour();
        return new PlayerMetrics(key, r.name, r.games, winRate, r.killsPerGame(), survival, r.aggressiveness(),
            r.campMastery, harvest,
            s.participation().applyAsDouble(r.games),
            s.win().applyAsDouble(winRate.percentOr(0)),
            s.kills().applyAsDouble(r.killsPerGame()),
            s.survival().applyAsDouble(survival.percentOr(0)),
            s.aggression().applyAsDouble(r.aggressiveness()),
            s.mastery().applyAsDouble(r.campMastery),
            harvest > 0 ? s.harvest().applyAsDouble(harvest) : NO_HARVEST_SCORE,
            ConsistencyScorer.advancedConsistency(ConsistencyScorer.historyOf(games, key)));
    }

    private static DoubleUnaryOperator scaler(List<Raw> population, ToDoubleFunction<Raw> metric) {
        List<Double> values = new ArrayList<>();
        population.forEach(r -> values.add(metric.applyAsDouble(r)));
        return DynamicScaler.build(values);
    }

    private static Map<String, Raw> rawMetrics(List<GameRecord> games) {
        Map<String, Raw> raw = new LinkedHashMap<>();
        for (GameRecord game : games) {
            Map<String, String> keyByName = new HashMap<>();
            for (PlayerInGame row : PlayerInGame.of(game)) {
                PlayerRecord p = row.player();
                keyByName.put(PlayerIdentity.normalize(p.username()), row.key());
                Raw r = raw.computeIfAbsent(row.key(), k -> new Raw());
                r.name = row.displayName();
                r.games++;
                if (row.won()) {
                    r.wins++;
                }
                if (!p.hasDied()) {
                    r.survived++;
                }
                if (p.totalCollectedLoot() != null) {
                    Optional<Long> seconds = presenceSeconds(game, p);
                    if (seconds.isPresent()) {
                        r.loot += p.totalCollectedLoot();
                        r.lootSeconds += seconds.get();
                    }
                }
                // Last vote of each meeting counts.
                Map<Integer, VoteEvent> byDay = new LinkedHashMap<>();
                p.votes().forEach(v -> byDay.put(v.day(), v));
                r.meetings += byDay.size();
                for (VoteEvent v : byDay.values()) {
                    if (v.isSkip()) {
                        r.skips++;
                    } else {
                        r.votes++;
                    }
                }
            }
            for (PlayerRecord victim : game.playerStats()) {
                String killerKey = keyByName.get(PlayerIdentity.normalize(victim.killerName()));
                if (victim.killerName() != null && killerKey != null) {
                    raw.get(killerKey).kills++;
                }
            }
        }
        campMastery(games, raw);
        return raw;
    }

    // Time the player spent in the game: until death when dead, else until the game ended.
    private static Optional<Long> presenceSeconds(GameRecord game, PlayerRecord p) {
        Optional<Instant> start = game.startInstant();
        Optional<Instant> end = Timestamps.parse(p.hasDied() ? p.deathDateIrl() : game.endDate());
        if (start.isEmpty() || end.isEmpty()) {
            return Optional.empty();
        }
        long seconds = Duration.between(start.get(), end.get()).getSeconds();
        return seconds > 0 ? Optional.of(seconds) : Optional.empty();
    }

    /**
     * Camp mastery is the games-weighted mean of a player's performance over the camps they
     * played often enough, grouped camps left out. Zero without any such camp.
     */
    private static void campMastery(List<GameRecord> games, Map<String, Raw> raw) {
        Map<String, double[]> sums = new HashMap<>();
        for (CampPerformance.Row row : CampPerformance.compute(games)) {
            if (row.camp().equals(CampPerformance.GROUPED_VILLAGE) || row.camp().equals(CampPerformance.GROUPED_WOLVES)
                || row.performance().isEmpty()) {
                continue;
            }
            double[] sum = sums.computeIfAbsent(row.playerKey(), k -> new double[2]);
            sum[0] += row.performance().getAsDouble() * row.games();
            sum[1] += row.games();
        }
        sums.forEach((key, sum) -> {
            Raw r = raw.get(key);
            if (r != null) {
                r.campMastery = sum[0] / sum[1];
            }
        });
    }

    private static HeadToHead headToHead(List<GameRecord> games, String keyA, String keyB) {
        int common = 0;
        int winsA = 0;
        int winsB = 0;
        int opposing = 0;
        int opposingWinsA = 0;
        int opposingWinsB = 0;
        int aKilledB = 0;
        int bKilledA = 0;
        int sameCamp = 0;
        int sameCampWins = 0;
        int sameWolf = 0;
        int sameWolfWins = 0;
        long durationSum = 0;
        int timedGames = 0;

        for (GameRecord game : games) {
            PlayerInGame a = null;
            PlayerInGame b = null;
            for (PlayerInGame row : PlayerInGame.of(game)) {
                if (row.key().equals(keyA)) {
                    a = row;
                } else if (row.key().equals(keyB)) {
                    b = row;
                }
            }
            if (a == null || b == null) {
                continue;
            }
            common++;
            if (a.won()) {
                winsA++;
            }
            if (b.won()) {
                winsB++;
            }
            if (PlayerIdentity.sameName(b.player().killerName(), a.player().username())) {
                aKilledB++;
            }
            if (PlayerIdentity.sameName(a.player().killerName(), b.player().username())) {
                bKilledA++;
            }
            Optional<Long> duration = game.durationSeconds();
            if (duration.isPresent()) {
                durationSum += duration.get();
                timedGames++;
            }
            if (a.finalCamp().alliance() != b.finalCamp().alliance()) {
                opposing++;
                if (a.won()) {
                    opposingWinsA++;
                }
                if (b.won()) {
                    opposingWinsB++;
                }
            } else {
                sameCamp++;
                boolean teamWon = a.won() || b.won();
                if (teamWon) {
                    sameCampWins++;
                }
                if (a.finalCamp().isWolfFamily()) {
                    sameWolf++;
                    if (teamWon) {
                        sameWolfWins++;
                    }
                }
            }
        }
        return new HeadToHead(common, winsA, winsB, opposing, opposingWinsA, opposingWinsB, aKilledB, bKilledA,
            sameCamp, sameCampWins, sameWolf, sameWolfWins,
            timedGames == 0 ? OptionalDouble.empty() : OptionalDouble.of((double) durationSum / timedGames));
    }
}
