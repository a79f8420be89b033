package edu.brandeis.cosi103a.lycans.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * One completed game as recorded in the game log.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GameRecord(
    @JsonProperty("Id") String id,
    @JsonProperty("DisplayedId") String displayedId,
    @JsonProperty("StartDate") String startDate,
    @JsonProperty("EndDate") String endDate,
    @JsonProperty("MapName") String mapName,
    @JsonProperty("HarvestGoal") Integer harvestGoal,
    @JsonProperty("HarvestDone") Integer harvestDone,
    @JsonProperty("EndTiming") String endTiming,
    @JsonProperty("Version") String version,
    @JsonProperty("Modded") boolean modded,
    @JsonProperty("LegacyData") LegacyData legacyData,
    @JsonProperty("LegacyRoles") LegacyRoles legacyRoles,
    @JsonProperty("PlayerStats") List<PlayerRecord> playerStats
) {
    public GameRecord {
        playerStats = playerStats == null ? ImmutableList.of() : ImmutableList.copyOf(playerStats);
    }

    @JsonIgnore
    public Optional<Instant> startInstant() {
        return Timestamps.parse(startDate);
    }

    /**
     * Wall-clock length of the game in seconds, absent when either date is missing or the
     * end does not come after the start.
     */
    @JsonIgnore
    public Optional<Long> durationSeconds() {
        Optional<Instant> start = Timestamps.parse(startDate);
        Optional<Instant> end = Timestamps.parse(endDate);
        if (start.isEmpty() || end.isEmpty()) {
            return Optional.empty();
        }
        long seconds = Duration.between(start.get(), end.get()).getSeconds();
        return seconds > 0 ? Optional.of(seconds) : Optional.empty();
    }

    /** Display id when present, else the raw id. */
    @JsonIgnore
    public String label() {
        return displayedId != null ? displayedId : id;
    }
}
