package edu.brandeis.cosi103a.lycans.timeline;

import com.fasterxml.jackson.annotation.JsonProperty;
import edu.brandeis.cosi103a.lycans.role.Phase;

import java.util.List;

/**
 * Events sharing one timing code, with the earliest and latest timestamps among them.
 */
public record TimelinePhase(
    @JsonProperty("timing") String timing,
    @JsonProperty("phase") Phase phase,
    @JsonProperty("number") int number,
    @JsonProperty("label") String label,
    @JsonProperty("events") List<TimelineEvent> events,
    @JsonProperty("start") String start,
    @JsonProperty("end") String end
) {}
