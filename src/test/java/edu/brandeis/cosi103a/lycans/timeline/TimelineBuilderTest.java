package edu.brandeis.cosi103a.lycans.timeline;

import edu.brandeis.cosi103a.lycans.GameFixtures;
import edu.brandeis.cosi103a.lycans.model.ActionEvent;
import edu.brandeis.cosi103a.lycans.model.GameRecord;
import edu.brandeis.cosi103a.lycans.model.PlayerRecord;
import edu.brandeis.cosi103a.lycans.model.RoleChange;
import edu.brandeis.cosi103a.lycans.model.VoteEvent;
import edu.brandeis.cosi103a.lycans.role.Phase;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static edu.brandeis.cosi103a.lycans.GameFixtures.game;
import static edu.brandeis.cosi103a.lycans.GameFixtures.loser;
import static edu.brandeis.cosi103a.lycans.GameFixtures.withRoleChanges;
import static edu.brandeis.cosi103a.lycans.GameFixtures.withVotesAndActions;
import static org.junit.jupiter.api.Assertions.*;

class TimelineBuilderTest {

    private static ActionEvent action(String date, String timing) {
        return new ActionEvent(date, timing, null, "Gadget", "Lanterne", null);
    }

    @Test
    void buildTimeline_phasesInLogicalOrder() {
        // wall clocks disagree with the phase sequence on purpose
        PlayerRecord p = withVotesAndActions(loser("A", "Villageois"),
            List.of(new VoteEvent(1, "B", "2024-03-01T20:10:00Z")),
            List.of(
                action("2024-03-01T20:20:00Z", "J2"),
                action("2024-03-01T20:15:00Z", "N2"),
                action("2024-03-01T20:02:00Z", "N1")));

        GameTimeline timeline = TimelineBuilder.buildTimeline(game("g", p));

        assertEquals(List.of("N1", "M1", "J2", "N2"),
            timeline.phases().stream().map(TimelinePhase::timing).toList());
        assertEquals(4, timeline.totalEvents());
        assertEquals(Phase.MEETING, timeline.phases().get(1).phase());
        assertEquals("Meeting 1", timeline.phases().get(1).label());
    }

    @Test
    void buildTimeline_sampleGame() {
        GameRecord g = GameFixtures.sampleGames().get(0);

        GameTimeline timeline = TimelineBuilder.buildTimeline(g);

        assertEquals("g1", timeline.gameId());
        assertEquals(10, timeline.totalEvents());
        assertEquals(List.of("N1", "M1", "N2", "J3"),
            timeline.phases().stream().map(TimelinePhase::timing).toList());
        assertEquals(List.of("Alice", "Bob", "Carol", "Dave", "Eve"), timeline.allPlayers());
        assertEquals(Optional.of("2024-03-01T20:02:00Z"), timeline.start());
        assertEquals(Optional.of("2024-03-01T20:30:00Z"), timeline.end());

        TimelinePhase night = timeline.phases().get(0);
        assertEquals(3, night.events().size());
        assertEquals("2024-03-01T20:02:00Z", night.start());
        assertEquals("2024-03-01T20:04:00Z", night.end());
        TimelineEvent death = night.events().get(1);
        assertEquals(TimelineEventType.DEATH, death.type());
        assertEquals("Carol", death.player());
        assertEquals("Alice", death.target());

        TimelinePhase meeting = timeline.phases().get(1);
        assertEquals(5, meeting.events().size());
        assertNull(meeting.events().get(2).target(), "a skipped vote has no target");

        TimelineEvent end = timeline.phases().get(3).events().get(0);
        assertEquals(TimelineEventType.GAME_END, end.type());
    }

    @Test
    void buildTimeline_roleChangesBucketedByElapsedMinutes() {
        PlayerRecord p = withRoleChanges(loser("A", "Villageois"), List.of(
            new RoleChange("Loup", "2024-03-01T20:17:00Z"),
            new RoleChange("Vaudou", "2024-03-01T20:02:00Z")));

        GameTimeline timeline = TimelineBuilder.buildTimeline(game("g", p));

        assertEquals(List.of("N1", "N3"), timeline.phases().stream().map(TimelinePhase::timing).toList());
        assertEquals(TimelineEventType.ROLE_CHANGE, timeline.phases().get(1).events().get(0).type());
    }

    @Test
    void buildTimeline_unresolvedTimingCountedButNotGrouped() {
        PlayerRecord p = withVotesAndActions(loser("A", "Villageois"), List.of(), List.of(
            action("2024-03-01T20:05:00Z", "U3"),
            action("2024-03-01T20:06:00Z", "N1"),
            action(null, "N1")));

        GameTimeline timeline = TimelineBuilder.buildTimeline(game("g", p));

        assertEquals(2, timeline.totalEvents());
        assertEquals(1, timeline.phases().size());
        assertEquals(1, timeline.phases().get(0).events().size());
    }

    @Test
    void buildTimeline_emptyGame() {
        GameTimeline timeline = TimelineBuilder.buildTimeline(game("g"));

        assertEquals(0, timeline.totalEvents());
        assertTrue(timeline.phases().isEmpty());
        assertTrue(timeline.start().isEmpty());
    }

    @Test
    void approximateTiming_atLeastNightOne() {
        Instant start = Instant.parse("2024-03-01T20:00:00Z");
        assertEquals("N1", TimelineBuilder.approximateTiming(Optional.empty(), Optional.of(start)).code());
        assertEquals("N1", TimelineBuilder.approximateTiming(Optional.of(start), Optional.of(start)).code());
        assertEquals("N4", TimelineBuilder.approximateTiming(Optional.of(start),
            Optional.of(start.plusSeconds(20 * 60))).code());
    }
}
