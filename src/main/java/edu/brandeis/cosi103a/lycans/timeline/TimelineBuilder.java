package edu.brandeis.cosi103a.lycans.timeline;

import com.google.common.collect.ImmutableList;
import edu.brandeis.cosi103a.lycans.model.ActionEvent;
import edu.brandeis.cosi103a.lycans.model.GameRecord;
import edu.brandeis.cosi103a.lycans.model.PlayerRecord;
import edu.brandeis.cosi103a.lycans.model.RoleChange;
import edu.brandeis.cosi103a.lycans.model.Timestamps;
import edu.brandeis.cosi103a.lycans.model.VoteEvent;
import edu.brandeis.cosi103a.lycans.role.PlayerIdentity;
import edu.brandeis.cosi103a.lycans.role.TimingCode;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Merges a game's actions, votes, deaths and role changes into one timeline grouped by phase.
 *
 * <p>Events are sorted by wall-clock time, but phases are ordered by their timing code (day
 * number, then Night, Day, Meeting) because in-game clocks do not always agree with the
 * phase sequence.
 */
public final class TimelineBuilder {

    /**
     * Assumed phase length used to place role changes, which carry no timing code of their own.
     * Role change timings are an approximation.
     */
    public static final int MINUTES_PER_PHASE = 5;

    private TimelineBuilder() {}

    private record Stamped(Instant at, TimelineEvent event) {}

    public static GameTimeline buildTimeline(GameRecord game) {
        List<Stamped> events = new ArrayList<>();
        Optional<Instant> gameStart = game.startInstant();

        for (PlayerRecord p : game.playerStats()) {
            String name = PlayerIdentity.displayName(p);
            for (ActionEvent a : p.actionsOrEmpty()) {
                String what = a.actionName() != null ? a.actionType() + " (" + a.actionName() + ")" : a.actionType();
                add(events, a.date(), new TimelineEvent(TimelineEventType.ACTION, null, a.timing(), name,
                    a.actionTarget(), what, a.position()));
            }
            for (VoteEvent v : p.votes()) {
                if (v.date() == null) {
                    continue;
                }
                String what = v.isSkip() ? "skips the vote" : "votes for " + v.target();
                add(events, v.date(), new TimelineEvent(TimelineEventType.VOTE, null,
                    TimingCode.meeting(v.day()).code(), name, v.isSkip() ? null : v.target(), what, null));
            }
            if (p.deathDateIrl() != null && p.deathTiming() != null) {
                String what = p.deathType() != null ? "dies (" + p.deathType() + ")" : "dies";
                add(events, p.deathDateIrl(), new TimelineEvent(TimelineEventType.DEATH, null, p.deathTiming(), name,
                    p.killerName(), what, p.deathPosition()));
            }
            for (RoleChange change : p.mainRoleChanges()) {
                Optional<Instant> at = Timestamps.parse(change.date());
                String timing = approximateTiming(gameStart, at).code();
                add(events, change.date(), new TimelineEvent(TimelineEventType.ROLE_CHANGE, null, timing, name,
                    null, "becomes " + change.newMainRole(), null));
            }
        }
        if (game.endTiming() != null && game.endDate() != null) {
            add(events, game.endDate(), new TimelineEvent(TimelineEventType.GAME_END, null, game.endTiming(), null,
                null, "game ends", null));
        }

        events.sort(Comparator.comparing(Stamped::at));

        Map<TimingCode, List<Stamped>> byPhase = new TreeMap<>();
        for (Stamped s : events) {
            TimingCode.parseResolved(s.event().timing())
                .ifPresent(code -> byPhase.computeIfAbsent(code, c -> new ArrayList<>()).add(s));
        }
        ImmutableList.Builder<TimelinePhase> phases = ImmutableList.builder();
        byPhase.forEach((code, stamped) -> phases.add(new TimelinePhase(
            code.code(),
            code.phase(),
            code.number(),
            code.label(),
            stamped.stream().map(Stamped::event).collect(ImmutableList.toImmutableList()),
            stamped.get(0).at().toString(),
            stamped.get(stamped.size() - 1).at().toString())));

        List<String> players = game.playerStats().stream()
            .map(PlayerIdentity::displayName)
            .filter(n -> !n.isEmpty())
            .distinct()
            .sorted(String.CASE_INSENSITIVE_ORDER)
            .toList();

        return new GameTimeline(
            game.id(),
            phases.build(),
            events.size(),
            ImmutableList.copyOf(players),
            events.isEmpty() ? Optional.empty() : Optional.of(events.get(0).at().toString()),
            events.isEmpty() ? Optional.empty() : Optional.of(events.get(events.size() - 1).at().toString()));
    }

    /**
     * Night bucket for a moment of the game: elapsed minutes divided by the phase length,
     * at least Night 1.
     */
    static TimingCode approximateTiming(Optional<Instant> gameStart, Optional<Instant> at) {
        if (gameStart.isEmpty() || at.isEmpty()) {
            return TimingCode.night(1);
        }
        long minutes = Duration.between(gameStart.get(), at.get()).toMinutes();
        return TimingCode.night((int) Math.max(1, minutes / MINUTES_PER_PHASE));
    }

    // Events without a readable timestamp cannot be placed and are left out.
    private static void add(List<Stamped> events, String timestamp, TimelineEvent event) {
        Timestamps.parse(timestamp).ifPresent(at -> events.add(new Stamped(at, new TimelineEvent(
            event.type(), at.toString(), event.timing(), event.player(), event.target(), event.description(),
            event.position()))));
    }
}
