package edu.brandeis.cosi103a.lycans.report;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableSortedSet;
import edu.brandeis.cosi103a.lycans.model.GameRecord;
import edu.brandeis.cosi103a.lycans.model.PlayerRecord;
import edu.brandeis.cosi103a.lycans.model.RoleChange;
import edu.brandeis.cosi103a.lycans.role.CampResolver;
import edu.brandeis.cosi103a.lycans.stats.CampPerformance;
import edu.brandeis.cosi103a.lycans.stats.CampWinStats;
import edu.brandeis.cosi103a.lycans.stats.ColorStats;
import edu.brandeis.cosi103a.lycans.stats.MapStats;
import edu.brandeis.cosi103a.lycans.stats.MonthlyRanking;
import edu.brandeis.cosi103a.lycans.stats.PairingStats;
import edu.brandeis.cosi103a.lycans.stats.PlayerStats;
import edu.brandeis.cosi103a.lycans.stats.SeriesStats;
import edu.brandeis.cosi103a.lycans.stats.SurvivalAnalysis;
import edu.brandeis.cosi103a.lycans.stats.TeamCompositionStats;
import edu.brandeis.cosi103a.lycans.stats.VotingStats;
import edu.brandeis.cosi103a.lycans.wolf.WolfTransformCalculator;
import edu.brandeis.cosi103a.lycans.wolf.WolfTransformStats;

import java.util.List;
import java.util.SortedSet;

/**
 * Every report over one selection of games, as written to {@code reports.json}.
 *
 * @param unmappedRoles raw role names seen in the games that the role table does not know;
 *                      players holding them were counted as Villageois
 */
public record StatsReport(
    @JsonProperty("modVersion") String modVersion,
    @JsonProperty("gamesAnalyzed") int gamesAnalyzed,
    @JsonProperty("campWins") CampWinStats campWins,
    @JsonProperty("players") PlayerStats players,
    @JsonProperty("pairings") PairingStats pairings,
    @JsonProperty("compositions") TeamCompositionStats compositions,
    @JsonProperty("colors") ColorStats colors,
    @JsonProperty("survival") SurvivalAnalysis survival,
    @JsonProperty("monthlyRankings") List<MonthlyRanking.Ranking> monthlyRankings,
    @JsonProperty("campPerformance") List<CampPerformance.Row> campPerformance,
    @JsonProperty("wolfTransforms") List<WolfTransformStats> wolfTransforms,
    @JsonProperty("voting") VotingStats voting,
    @JsonProperty("series") SeriesStats series,
    @JsonProperty("maps") MapStats maps,
    @JsonProperty("unmappedRoles") SortedSet<String> unmappedRoles
) {

    public static StatsReport build(String modVersion, List<GameRecord> games) {
        return new StatsReport(
            modVersion,
            games.size(),
            CampWinStats.compute(games),
            PlayerStats.compute(games),
            PairingStats.compute(games),
            TeamCompositionStats.compute(games),
            ColorStats.compute(games),
            SurvivalAnalysis.compute(games),
            MonthlyRanking.all(games),
            CampPerformance.compute(games),
            WolfTransformCalculator.compute(games),
            VotingStats.compute(games),
            SeriesStats.compute(games),
            MapStats.compute(games),
            unmappedRoles(games));
    }

    public static ImmutableSortedSet<String> unmappedRoles(List<GameRecord> games) {
        ImmutableSortedSet.Builder<String> roles = ImmutableSortedSet.naturalOrder();
        for (GameRecord game : games) {
            for (PlayerRecord p : game.playerStats()) {
                addIfUnknown(roles, p.mainRoleInitial());
                for (RoleChange change : p.mainRoleChanges()) {
                    addIfUnknown(roles, change.newMainRole());
                }
            }
        }
        return roles.build();
    }

    private static void addIfUnknown(ImmutableSortedSet.Builder<String> roles, String role) {
        if (role != null && !role.isBlank() && !CampResolver.isKnownRole(role)) {
            roles.add(role.trim());
        }
    }
}
