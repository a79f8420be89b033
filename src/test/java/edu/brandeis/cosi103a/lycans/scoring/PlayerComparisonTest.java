package edu.brandeis.cosi103a.lycans.scoring;

import edu.brandeis.cosi103a.lycans.GameFixtures;
import edu.brandeis.cosi103a.lycans.model.GameRecord;
import org.junit.jupiter.api.Test;

import java.util.List;

import static edu.brandeis.cosi103a.lycans.GameFixtures.game;
import static edu.brandeis.cosi103a.lycans.GameFixtures.loser;
import static edu.brandeis.cosi103a.lycans.GameFixtures.winner;
import static edu.brandeis.cosi103a.lycans.GameFixtures.withDeath;
import static edu.brandeis.cosi103a.lycans.GameFixtures.withEndDate;
import static edu.brandeis.cosi103a.lycans.GameFixtures.withLoot;
import static org.junit.jupiter.api.Assertions.*;

class PlayerComparisonTest {

    private final List<GameRecord> games = GameFixtures.sampleGames();

    @Test
    void compare_headToHead() {
        PlayerComparison.HeadToHead h2h = PlayerComparison.compare(games, "Alice", "Bob", 1)
            .orElseThrow().headToHead();

        assertEquals(3, h2h.commonGames());
        assertEquals(3, h2h.firstWins());
        assertEquals(2, h2h.secondWins());
        assertEquals(1, h2h.opposingGames());
        assertEquals(1, h2h.firstWinsAsOpponent());
        assertEquals(0, h2h.secondWinsAsOpponent());
        assertEquals(2, h2h.sameCampGames());
        assertEquals(1, h2h.sameWolfGames());
        assertEquals(0, h2h.firstKilledSecond());
        assertEquals(1900.0, h2h.averageDurationSeconds().getAsDouble(), 1e-9);
    }

    @Test
    void compare_metricsScaledAgainstPopulation() {
        PlayerComparison.PlayerMetrics alice = PlayerComparison.compare(games, "p-alice", "p-eve", 1)
            .orElseThrow().first();

        assertEquals(3, alice.gamesPlayed());
        assertEquals(100.0, alice.winRateScore(), 1e-9);
        assertEquals(1.0 / 3, alice.killsPerGame(), 1e-9);
        assertEquals(100.0, alice.killsPerGameScore(), 1e-9);
        assertEquals(100.0, alice.aggressiveness(), 1e-9);
        assertEquals(100.0, alice.aggressivenessScore(), 1e-9);
        assertEquals(ConsistencyScorer.INSUFFICIENT, alice.consistencyScore());
    }

    @Test
    void compare_skipCountsAgainstAggressiveness() {
        PlayerComparison.PlayerMetrics eve = PlayerComparison.compare(games, "Alice", "Eve", 1)
            .orElseThrow().second();

        assertEquals(-50.0, eve.aggressiveness(), 1e-9);
        assertEquals(0.0, eve.aggressivenessScore(), 1e-9);
        assertEquals(0.0, eve.winRateScore(), 1e-9);
    }

    @Test
    void compare_smallPopulationScoresNeutral() {
        PlayerComparison.PlayerMetrics alice = PlayerComparison.compare(games, "Alice", "Bob")
            .orElseThrow().first();

        assertEquals(DynamicScaler.NEUTRAL, alice.winRateScore());
        assertEquals(DynamicScaler.NEUTRAL, alice.survivalRateScore());
    }

    @Test
    void compare_absentOrSamePlayerIsEmpty() {
        assertTrue(PlayerComparison.compare(games, "Alice", "Nobody", 1).isEmpty());
        assertTrue(PlayerComparison.compare(games, "Alice", "p-alice", 1).isEmpty());
    }

    @Test
    void compare_participationScaledOnGamesPlayed() {
        List<GameRecord> played = List.of(
            game("g1", winner("A", "Villageois"), loser("B", "Loup")),
            game("g2", winner("A", "Villageois"), loser("B", "Loup")),
            game("g3", winner("A", "Villageois"), loser("C", "Loup")));

        PlayerComparison.Comparison c = PlayerComparison.compare(played, "A", "C", 1).orElseThrow();

        assertEquals(100.0, c.first().participationScore(), 1e-9);
        assertEquals(0.0, c.second().participationScore(), 1e-9);
    }

    @Test
    void compare_campMasteryFromPerformanceAgainstCamp() {
        List<GameRecord> played = List.of(
            game("g1", winner("A", "Villageois"), loser("B", "Villageois"), loser("W", "Loup")),
            game("g2", winner("A", "Villageois"), loser("B", "Villageois"), loser("W", "Loup")),
            game("g3", winner("A", "Villageois"), loser("B", "Villageois"), loser("W", "Loup")));

        PlayerComparison.Comparison c = PlayerComparison.compare(played, "A", "B", 1).orElseThrow();

        assertEquals(50.0, c.first().campMastery(), 1e-9);
        assertEquals(-50.0, c.second().campMastery(), 1e-9);
        assertEquals(100.0, c.first().campMasteryScore(), 1e-9);
        assertEquals(0.0, c.second().campMasteryScore(), 1e-9);
        PlayerComparison.PlayerMetrics wolf = PlayerComparison.compare(played, "W", "A", 1).orElseThrow().first();
        assertEquals(50.0, wolf.campMasteryScore(), 1e-9);
    }

    @Test
    void compare_harvestPerHourOfPresence() {
        GameRecord g = withEndDate(game("g",
            withLoot(winner("A", "Villageois"), 30),
            withLoot(withDeath(loser("B", "Villageois"), "2024-03-01T20:30:00Z", "N2", "Tué par un loup", "W"), 10),
            loser("C", "Villageois"),
            winner("W", "Loup")), "2024-03-01T21:00:00Z");

        PlayerComparison.Comparison ab = PlayerComparison.compare(List.of(g), "A", "B", 1).orElseThrow();
        assertEquals(30.0, ab.first().harvestPerHour(), 1e-9);
        assertEquals(20.0, ab.second().harvestPerHour(), 1e-9);
        assertEquals(100.0, ab.first().harvestScore(), 1e-9);
        assertEquals(0.0, ab.second().harvestScore(), 1e-9);

        PlayerComparison.PlayerMetrics c = PlayerComparison.compare(List.of(g), "A", "C", 1).orElseThrow().second();
        assertEquals(0.0, c.harvestPerHour());
        assertEquals(PlayerComparison.NO_HARVEST_SCORE, c.harvestScore());
    }

    @Test
    void compare_harvestScoreWithoutSpreadOrPopulation() {
        PlayerComparison.Comparison c = PlayerComparison.compare(games, "Alice", "Bob", 1).orElseThrow();

        assertEquals(8.0, c.first().harvestPerHour(), 1e-9);
        assertEquals(DynamicScaler.NEUTRAL, c.first().harvestScore());
        assertEquals(PlayerComparison.NO_HARVEST_SCORE, c.second().harvestScore());

        PlayerComparison.PlayerMetrics alice = PlayerComparison.compare(games, "Alice", "Bob")
            .orElseThrow().first();
        assertEquals(PlayerComparison.NO_HARVEST_SCORE, alice.harvestScore());
    }
}
