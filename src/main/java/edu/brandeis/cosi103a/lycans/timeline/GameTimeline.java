package edu.brandeis.cosi103a.lycans.timeline;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Optional;

/**
 * A game's events grouped into phases in logical order.
 *
 * @param totalEvents every event built, including those whose timing could not be grouped
 * @param start       earliest event timestamp, absent for a game without events
 * @param end         latest event timestamp
 */
public record GameTimeline(
    @JsonProperty("gameId") String gameId,
    @JsonProperty("phases") List<TimelinePhase> phases,
    @JsonProperty("totalEvents") int totalEvents,
    @JsonProperty("allPlayers") List<String> allPlayers,
    @JsonProperty("start") Optional<String> start,
    @JsonProperty("end") Optional<String> end
) {}
