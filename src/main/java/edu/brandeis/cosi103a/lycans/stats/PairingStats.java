package edu.brandeis.cosi103a.lycans.stats;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;
import edu.brandeis.cosi103a.lycans.model.GameRecord;
import edu.brandeis.cosi103a.lycans.role.Camp;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * How often two players shared a special assignment in the same game and how often they
 * won together. Wolf pairs are any two pure Loup players of a game; lover pairs are the
 * Amoureux players of a game taken two by two in roster order.
 */
public record PairingStats(
    @JsonProperty("wolfPairs") List<PairStat> wolfPairs,
    @JsonProperty("loverPairs") List<PairStat> loverPairs
) {
    public static final int MIN_WOLF_PAIR_GAMES = 2;
    public static final int MIN_LOVER_PAIR_GAMES = 1;

    /**
     * @param pair        display key, the two names sorted and joined with " &amp; "
     * @param players     the two display names, sorted
     * @param appearances games the pair shared
     * @param wins        games both members won
     */
    public record PairStat(
        @JsonProperty("pair") String pair,
        @JsonProperty("players") List<String> players,
        @JsonProperty("appearances") int appearances,
        @JsonProperty("wins") int wins,
        @JsonProperty("winRate") Rate winRate,
        @JsonProperty("games") List<String> games
    ) {}

    private record Pairing(PlayerInGame first, PlayerInGame second) {
        String groupKey() {
            String a = first.key();
            String b = second.key();
            return a.compareTo(b) <= 0 ? a + "\u0000" + b : b + "\u0000" + a;
        }
    }

    private static final class Acc {
        String nameA;
        String nameB;
        int appearances;
        int wins;
        final List<String> games = new ArrayList<>();
    }

    public static PairingStats compute(List<GameRecord> games) {
        return compute(games, MIN_WOLF_PAIR_GAMES, MIN_LOVER_PAIR_GAMES);
    }

    public static PairingStats compute(List<GameRecord> games, int minWolfGames, int minLoverGames) {
        List<Pairing> wolves = new ArrayList<>();
        List<Pairing> lovers = new ArrayList<>();
        for (GameRecord game : games) {
            List<PlayerInGame> rows = PlayerInGame.of(game);
            List<PlayerInGame> pureWolves = rows.stream().filter(r -> r.finalCamp() == Camp.LOUP).toList();
            for (int i = 0; i < pureWolves.size(); i++) {
                for (int j = i + 1; j < pureWolves.size(); j++) {
                    wolves.add(new Pairing(pureWolves.get(i), pureWolves.get(j)));
                }
            }
            List<PlayerInGame> amoureux = rows.stream().filter(r -> r.finalCamp() == Camp.AMOUREUX).toList();
            for (int i = 0; i + 1 < amoureux.size(); i += 2) {
                lovers.add(new Pairing(amoureux.get(i), amoureux.get(i + 1)));
            }
        }
        return new PairingStats(tally(wolves, minWolfGames), tally(lovers, minLoverGames));
    }

    private static ImmutableList<PairStat> tally(List<Pairing> pairings, int minGames) {
        Aggregation<Pairing, String, Acc, PairStat> byPair = Aggregation.of(
            Pairing::groupKey,
            key -> new Acc(),
            (acc, p) -> {
                acc.nameA = p.first().displayName();
                acc.nameB = p.second().displayName();
                acc.appearances++;
                if (p.first().won() && p.second().won()) {
                    acc.wins++;
                }
                acc.games.add(p.first().game().label());
            },
            (key, acc) -> {
                List<String> names = new ArrayList<>(List.of(acc.nameA, acc.nameB));
                names.sort(String.CASE_INSENSITIVE_ORDER);
                return new PairStat(String.join(" & ", names), ImmutableList.copyOf(names),
                    acc.appearances, acc.wins, Rate.of(acc.wins, acc.appearances), ImmutableList.copyOf(acc.games));
            });
        List<PairStat> result = new ArrayList<>(byPair.run(pairings).stream()
            .filter(p -> p.appearances() >= minGames)
            .toList());
        result.sort(Comparator.comparingInt(PairStat::appearances).reversed()
            .thenComparing(Comparator.comparingInt(PairStat::wins).reversed())
            .thenComparing(PairStat::pair));
        return ImmutableList.copyOf(result);
    }
}
