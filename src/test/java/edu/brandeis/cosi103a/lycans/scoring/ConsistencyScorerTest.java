package edu.brandeis.cosi103a.lycans.scoring;

import edu.brandeis.cosi103a.lycans.model.GameRecord;
import edu.brandeis.cosi103a.lycans.role.Camp;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static edu.brandeis.cosi103a.lycans.GameFixtures.game;
import static edu.brandeis.cosi103a.lycans.GameFixtures.loser;
import static edu.brandeis.cosi103a.lycans.GameFixtures.winner;
import static org.junit.jupiter.api.Assertions.*;

class ConsistencyScorerTest {

    @Test
    void advancedConsistency_shortHistoryIsInsufficient() {
        List<Outcome> history = new ArrayList<>();
        for (int i = 0; i < 29; i++) {
            history.add(new Outcome(Camp.VILLAGEOIS, true));
        }
        assertEquals(ConsistencyScorer.INSUFFICIENT, ConsistencyScorer.advancedConsistency(history));
    }

    @Test
    void advancedConsistency_alwaysWinning() {
        List<Outcome> history = new ArrayList<>();
        for (int i = 0; i < 30; i++) {
            history.add(new Outcome(Camp.VILLAGEOIS, true));
        }
        // camp 70, temporal 100, volatility penalty 24
        assertEquals(80.8, ConsistencyScorer.advancedConsistency(history), 1e-9);
    }

    @Test
    void advancedConsistency_alternating() {
        List<Outcome> history = new ArrayList<>();
        for (int i = 0; i < 30; i++) {
            history.add(new Outcome(Camp.VILLAGEOIS, i % 2 == 0));
        }
        // camp 65, temporal 100, volatility penalty 36
        assertEquals(75.2, ConsistencyScorer.advancedConsistency(history), 1e-9);
    }

    @Test
    void advancedConsistency_staysWithinBounds() {
        List<Outcome> history = new ArrayList<>();
        for (int i = 0; i < 60; i++) {
            history.add(new Outcome(i % 2 == 0 ? Camp.LOUP : Camp.VILLAGEOIS, i < 20));
        }
        double score = ConsistencyScorer.advancedConsistency(history);
        assertTrue(score >= 5 && score <= 95, "score " + score);
    }

    @Test
    void historyOf_sortsByStartDate() {
        List<GameRecord> games = List.of(
            game("late", "2024-03-02T20:00:00Z", loser("A", "Loup"), winner("B", "Villageois")),
            game("early", "2024-03-01T20:00:00Z", winner("A", "Villageois"), loser("B", "Loup")));

        List<Outcome> history = ConsistencyScorer.historyOf(games, "id-a");

        assertEquals(List.of(new Outcome(Camp.VILLAGEOIS, true), new Outcome(Camp.LOUP, false)), history);
    }
}
