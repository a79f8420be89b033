package edu.brandeis.cosi103a.lycans.stats;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;
import edu.brandeis.cosi103a.lycans.model.GameRecord;
import edu.brandeis.cosi103a.lycans.model.PlayerRecord;
import edu.brandeis.cosi103a.lycans.role.Camp;
import edu.brandeis.cosi103a.lycans.role.CampResolver;
import edu.brandeis.cosi103a.lycans.role.WinResolver;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Frequency and outcome of team make-ups, bucketed by number of players.
 */
public record TeamCompositionStats(
    @JsonProperty("buckets") List<PlayerCountBucket> buckets
) {
    /** Appearances a signature needs before it can be reported as most common or best. */
    public static final int MIN_APPEARANCES = 5;

    /**
     * Role-category counts of one game. The five counts add up to the game's player count.
     */
    public record Signature(
        @JsonProperty("pureWolf") int pureWolf,
        @JsonProperty("traitor") int traitor,
        @JsonProperty("louveteau") int louveteau,
        @JsonProperty("solo") int solo,
        @JsonProperty("villageois") int villageois
    ) {
        public static Signature of(GameRecord game) {
            int pureWolf = 0;
            int traitor = 0;
            int louveteau = 0;
            int solo = 0;
            int villageois = 0;
            for (PlayerRecord p : game.playerStats()) {
                switch (CampResolver.finalCamp(game, p)) {
                    case LOUP -> pureWolf++;
                    case TRAITRE -> traitor++;
                    case LOUVETEAU -> louveteau++;
                    case VILLAGEOIS -> villageois++;
                    default -> solo++;
                }
            }
            return new Signature(pureWolf, traitor, louveteau, solo, villageois);
        }

        public int wolves() {
            return pureWolf + traitor + louveteau;
        }

        public int total() {
            return wolves() + solo + villageois;
        }

        /** Key such as "3w-1s-2L-1T-0Lou". */
        public String key() {
            return wolves() + "w-" + solo + "s-" + pureWolf + "L-" + traitor + "T-" + louveteau + "Lou";
        }
    }

    public record Composition(
        @JsonProperty("key") String key,
        @JsonProperty("signature") Signature signature,
        @JsonProperty("appearances") int appearances,
        @JsonProperty("winsByWolves") int winsByWolves,
        @JsonProperty("winsByVillageois") int winsByVillageois,
        @JsonProperty("winsBySolo") int winsBySolo,
        @JsonProperty("wolfWinRate") Rate wolfWinRate,
        @JsonProperty("villageoisWinRate") Rate villageoisWinRate,
        @JsonProperty("soloWinRate") Rate soloWinRate
    ) {}

    public record PlayerCountBucket(
        @JsonProperty("playerCount") int playerCount,
        @JsonProperty("totalGames") int totalGames,
        @JsonProperty("compositions") List<Composition> compositions,
        @JsonProperty("mostCommon") Optional<String> mostCommon,
        @JsonProperty("bestWolfWinRate") Optional<String> bestWolfWinRate,
        @JsonProperty("bestVillageoisWinRate") Optional<String> bestVillageoisWinRate
    ) {}

    private record Row(Signature signature, Optional<Camp> winner) {}

    private static final class Acc {
        Signature signature;
        int appearances;
        int wolves;
        int villageois;
        int solo;
    }

    private static final Aggregation<Row, String, Acc, Composition> BY_SIGNATURE = Aggregation.of(
        row -> row.signature().key(),
        key -> new Acc(),
        (acc, row) -> {
            acc.signature = row.signature();
            acc.appearances++;
            row.winner().ifPresent(camp -> {
                if (camp.isWolfFamily()) {
                    acc.wolves++;
                } else if (camp == Camp.VILLAGEOIS) {
                    acc.villageois++;
                } else {
                    acc.solo++;
                }
            });
        },
        (key, acc) -> new Composition(key, acc.signature, acc.appearances, acc.wolves, acc.villageois, acc.solo,
            Rate.of(acc.wolves, acc.appearances), Rate.of(acc.villageois, acc.appearances),
            Rate.of(acc.solo, acc.appearances)));

    public static TeamCompositionStats compute(List<GameRecord> games) {
        TreeMap<Integer, List<Row>> byCount = new TreeMap<>();
        for (GameRecord game : games) {
            Row row = new Row(Signature.of(game), WinResolver.winningCampOf(game));
            byCount.computeIfAbsent(row.signature().total(), n -> new ArrayList<>()).add(row);
        }

        ImmutableList.Builder<PlayerCountBucket> buckets = ImmutableList.builder();
        byCount.forEach((playerCount, rows) -> {
            List<Composition> compositions = new ArrayList<>(BY_SIGNATURE.run(rows));
            compositions.sort(Comparator.comparingInt(Composition::appearances).reversed());
            List<Composition> eligible = compositions.stream()
                .filter(c -> c.appearances() >= MIN_APPEARANCES)
                .toList();
            buckets.add(new PlayerCountBucket(
                playerCount,
                rows.size(),
                ImmutableList.copyOf(compositions),
                eligible.stream().findFirst().map(Composition::key),
                best(eligible, Composition::wolfWinRate),
                best(eligible, Composition::villageoisWinRate)));
        });
        return new TeamCompositionStats(buckets.build());
    }

    // First composition wins ties.
    private static Optional<String> best(List<Composition> eligible, Function<Composition, Rate> rate) {
        Composition best = null;
        for (Composition c : eligible) {
            if (best == null || rate.apply(c).compareTo(rate.apply(best)) > 0) {
                best = c;
            }
        }
        return Optional.ofNullable(best).map(Composition::key);
    }

    public Optional<PlayerCountBucket> bucket(int playerCount) {
        return buckets.stream().filter(b -> b.playerCount() == playerCount).findFirst();
    }
}
