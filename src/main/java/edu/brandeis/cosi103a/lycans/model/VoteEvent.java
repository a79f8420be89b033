package edu.brandeis.cosi103a.lycans.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A vote cast during a meeting. Older logs have no vote date.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record VoteEvent(
    @JsonProperty("Day") int day,
    @JsonProperty("Target") String target,
    @JsonProperty("Date") String date
) {
    /** Target value recorded when the voter abstained. */
    public static final String SKIP = "Passé";

    @JsonIgnore
    public boolean isSkip() {
        return target == null || SKIP.equalsIgnoreCase(target.trim());
    }
}
