package edu.brandeis.cosi103a.lycans.timeline;

import com.fasterxml.jackson.annotation.JsonProperty;
import edu.brandeis.cosi103a.lycans.model.Position;

/**
 * One entry of a game timeline.
 *
 * @param timing      timing code the event belongs to, possibly unparsable
 * @param player      acting player (voter, victim, ...); null for the game end
 * @param target      vote target, action target or killer, when there is one
 * @param description short human-readable summary
 */
public record TimelineEvent(
    @JsonProperty("type") TimelineEventType type,
    @JsonProperty("timestamp") String timestamp,
    @JsonProperty("timing") String timing,
    @JsonProperty("player") String player,
    @JsonProperty("target") String target,
    @JsonProperty("description") String description,
    @JsonProperty("position") Position position
) {}
