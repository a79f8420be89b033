package edu.brandeis.cosi103a.lycans.model;

import edu.brandeis.cosi103a.lycans.GameFixtures;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static edu.brandeis.cosi103a.lycans.GameFixtures.game;
import static edu.brandeis.cosi103a.lycans.GameFixtures.withEndDate;
import static org.junit.jupiter.api.Assertions.*;

class GameRecordTest {

    @Test
    void sampleLog_deserializes() {
        GameLog log = GameFixtures.sampleLog();

        assertEquals("0.212", log.modVersion());
        assertEquals(3, log.totalRecords());
        assertEquals(3, log.gameStats().size());

        GameRecord first = log.gameStats().get(0);
        assertEquals("Partie 1", first.label());
        assertTrue(first.modded());
        assertEquals(5, first.playerStats().size());

        PlayerRecord alice = first.playerStats().get(0);
        assertEquals("Alice", alice.username());
        assertTrue(alice.victorious());
        assertEquals(3, alice.actionsOrEmpty().size());
        assertTrue(alice.actionsOrEmpty().get(0).isType(ActionEvent.TRANSFORM));

        PlayerRecord eve = first.playerStats().get(4);
        assertTrue(eve.votes().get(0).isSkip());
    }

    @Test
    void missingListsBecomeEmptyButMissingActionsStayAbsent() {
        PlayerRecord p = GameFixtures.sampleGames().get(1).playerStats().get(0);
        assertTrue(p.mainRoleChanges().isEmpty());
        assertTrue(p.votes().isEmpty());
        assertFalse(p.hasActionLog());
        assertTrue(p.actionsOrEmpty().isEmpty());
        assertFalse(p.hasDied());
    }

    @Test
    void durationSeconds() {
        GameRecord g = game("g", "2024-03-01T20:00:00Z", "N1", List.of());
        assertEquals(Optional.empty(), g.durationSeconds());
        assertEquals(Optional.of(1800L), withEndDate(g, "2024-03-01T20:30:00Z").durationSeconds());
        assertEquals(Optional.empty(), withEndDate(g, "2024-03-01T19:30:00Z").durationSeconds());
    }

    @Test
    void legacyRoles_membersByRole() {
        LegacyRoles roles = new LegacyRoles("Alice, Bob", "Carol", null, null, null, null, null, " ", null, null, null);
        var members = roles.membersByRole();

        assertEquals(List.of("Traître", "Loup"), List.copyOf(members.keySet()));
        assertEquals(List.of("Alice", "Bob"), members.get("Loup"));
    }
}
