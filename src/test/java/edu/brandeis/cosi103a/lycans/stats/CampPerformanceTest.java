package edu.brandeis.cosi103a.lycans.stats;

import edu.brandeis.cosi103a.lycans.GameFixtures;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CampPerformanceTest {

    @Test
    void compute_dropsRowsBelowMinimum() {
        List<CampPerformance.Row> rows = CampPerformance.compute(GameFixtures.sampleGames());

        assertEquals(2, rows.size());
        CampPerformance.Row dave = rows.get(0);
        assertEquals("Dave", dave.playerName());
        assertEquals("Villageois", dave.camp());
        assertEquals(3, dave.games());
        assertEquals(1, dave.wins());
        // Villageois win 3 of 8 overall
        assertEquals(100.0 / 3 - 37.5, dave.performance().getAsDouble(), 1e-9);
        assertEquals(CampPerformance.GROUPED_VILLAGE, rows.get(1).camp());
    }

    @Test
    void compute_groupsWolfFamily() {
        List<CampPerformance.Row> rows = CampPerformance.compute(GameFixtures.sampleGames(), 1);

        CampPerformance.Row bobWolves = rows.stream()
            .filter(r -> r.playerKey().equals("p-bob") && r.camp().equals(CampPerformance.GROUPED_WOLVES))
            .findFirst().orElseThrow();
        assertEquals(2, bobWolves.games());
        assertEquals(1, bobWolves.wins());
        assertEquals(0.0, bobWolves.performance().getAsDouble(), 1e-9);
        assertEquals(3, bobWolves.totalGames());
    }
}
