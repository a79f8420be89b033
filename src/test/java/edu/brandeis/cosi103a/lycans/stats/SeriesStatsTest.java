package edu.brandeis.cosi103a.lycans.stats;

import edu.brandeis.cosi103a.lycans.GameFixtures;
import edu.brandeis.cosi103a.lycans.model.GameRecord;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static edu.brandeis.cosi103a.lycans.GameFixtures.game;
import static edu.brandeis.cosi103a.lycans.GameFixtures.loser;
import static edu.brandeis.cosi103a.lycans.GameFixtures.winner;
import static org.junit.jupiter.api.Assertions.*;

class SeriesStatsTest {

    private final SeriesStats stats = SeriesStats.compute(GameFixtures.sampleGames());

    private static List<String> names(List<SeriesStats.Series> series) {
        return series.stream().map(SeriesStats.Series::playerName).toList();
    }

    @Test
    void compute_sampleWinSeries() {
        assertEquals(3, stats.totalGames());
        assertEquals(5, stats.totalPlayers());

        SeriesStats.Series alice = stats.winSeries().get(0);
        assertEquals("Alice", alice.playerName());
        assertEquals(3, alice.length());
        assertTrue(alice.ongoing());
        assertEquals(List.of("Partie 1", "g2", "g3"), alice.gameIds());
        assertEquals(Map.of("Loup", 1, "Villageois", 1, "Autres", 1), alice.campCounts());
        assertEquals(Optional.of("2024-03-01T20:00:00Z"), alice.startDate());
    }

    @Test
    void compute_sampleCampSeries() {
        assertEquals(List.of("Dave", "Carol", "Alice", "Eve"), names(stats.villageoisSeries()));
        assertTrue(stats.villageoisSeries().get(0).ongoing());
        assertFalse(stats.villageoisSeries().get(1).ongoing());

        SeriesStats.Series eve = stats.villageoisSeries().get(3);
        assertEquals("g3", eve.endGame());
        assertTrue(eve.ongoing());

        SeriesStats.Series bob = stats.wolfSeries().get(0);
        assertEquals("Bob", bob.playerName());
        assertEquals(List.of("Partie 1", "g2"), bob.gameIds());
        assertFalse(bob.ongoing());
    }

    @Test
    void compute_sampleLossSeries() {
        SeriesStats.Series eve = stats.lossSeries().get(0);
        assertEquals("Eve", eve.playerName());
        assertEquals(3, eve.length());
        assertTrue(eve.ongoing());

        SeriesStats.Series dave = stats.lossSeries().stream()
            .filter(s -> s.playerName().equals("Dave")).findFirst().orElseThrow();
        assertEquals(1, dave.length());
        assertEquals("g3", dave.startGame());
    }

    @Test
    void compute_ordersGamesByStartDateUndatedLast() {
        List<GameRecord> games = List.of(
            game("undated", null, "N3", List.of(winner("A", "Villageois"))),
            game("late", "2024-03-02T20:00:00Z", winner("A", "Villageois")),
            game("early", "2024-03-01T20:00:00Z", loser("A", "Villageois")));

        SeriesStats series = SeriesStats.compute(games);

        SeriesStats.Series wins = series.winSeries().get(0);
        assertEquals(List.of("late", "undated"), wins.gameIds());
        assertTrue(wins.ongoing());
        SeriesStats.Series losses = series.lossSeries().get(0);
        assertEquals(List.of("early"), losses.gameIds());
        assertFalse(losses.ongoing());
        assertEquals(3, series.villageoisSeries().get(0).length());
    }
}
