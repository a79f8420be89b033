package edu.brandeis.cosi103a.lycans.stats;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import edu.brandeis.cosi103a.lycans.model.GameRecord;
import edu.brandeis.cosi103a.lycans.role.Camp;
import edu.brandeis.cosi103a.lycans.role.CampResolver;
import edu.brandeis.cosi103a.lycans.role.WinResolver;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Wins per winning camp across a list of games.
 *
 * <p>Games without any victor count in {@code totalGames} but not in {@code gamesWithWinner},
 * so the camp win counts always add up to {@code gamesWithWinner}.
 */
public record CampWinStats(
    @JsonProperty("totalGames") int totalGames,
    @JsonProperty("gamesWithWinner") int gamesWithWinner,
    @JsonProperty("camps") List<CampWins> camps,
    @JsonProperty("soloCamps") List<SoloAppearance> soloCamps
) {

    /** Win count and rate of one winning camp label. */
    public record CampWins(
        @JsonProperty("camp") String camp,
        @JsonProperty("wins") int wins,
        @JsonProperty("winRate") Rate winRate
    ) {}

    /** Number of games in which a solo camp was present. */
    public record SoloAppearance(
        @JsonProperty("camp") String camp,
        @JsonProperty("appearances") int appearances
    ) {}

    public static CampWinStats compute(List<GameRecord> games) {
        List<Camp> winners = new ArrayList<>();
        List<Camp> soloPresences = new ArrayList<>();
        for (GameRecord game : games) {
            WinResolver.winningCampOf(game).ifPresent(winners::add);
            game.playerStats().stream()
                .map(p -> CampResolver.finalCamp(game, p))
                .filter(Camp::isSolo)
                .collect(ImmutableSet.toImmutableSet())
                .forEach(soloPresences::add);
        }
        int gamesWithWinner = winners.size();

        Aggregation<Camp, String, int[], CampWins> winsByCamp = Aggregation.of(
            Camp::winLabel,
            label -> new int[1],
            (acc, camp) -> acc[0]++,
            (label, acc) -> new CampWins(label, acc[0], Rate.of(acc[0], gamesWithWinner)));
        Aggregation<Camp, String, int[], SoloAppearance> soloCounts = Aggregation.of(
            Camp::label,
            label -> new int[1],
            (acc, camp) -> acc[0]++,
            (label, acc) -> new SoloAppearance(label, acc[0]));

        List<CampWins> camps = new ArrayList<>(winsByCamp.run(winners));
        camps.sort(Comparator.comparingInt(CampWins::wins).reversed());
        List<SoloAppearance> solos = new ArrayList<>(soloCounts.run(soloPresences));
        solos.sort(Comparator.comparingInt(SoloAppearance::appearances).reversed());

        return new CampWinStats(games.size(), gamesWithWinner,
            ImmutableList.copyOf(camps), ImmutableList.copyOf(solos));
    }

    public Optional<CampWins> camp(String label) {
        return camps.stream().filter(c -> c.camp().equals(label)).findFirst();
    }

    /** Wins keyed by camp label, for quick lookups. */
    public Map<String, Integer> winsByCamp() {
        return camps.stream().collect(ImmutableMap.toImmutableMap(CampWins::camp, CampWins::wins));
    }
}
