package edu.brandeis.cosi103a.lycans.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Top-level content of a {@code gamelog.json} file.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GameLog(
    @JsonProperty("ModVersion") String modVersion,
    @JsonProperty("TotalRecords") int totalRecords,
    @JsonProperty("GameStats") List<GameRecord> gameStats
) {
    public GameLog {
        gameStats = gameStats == null ? ImmutableList.of() : ImmutableList.copyOf(gameStats);
    }
}
