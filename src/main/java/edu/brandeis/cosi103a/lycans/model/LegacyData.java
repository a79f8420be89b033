package edu.brandeis.cosi103a.lycans.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Fields carried over from logs recorded before the per-player format existed.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LegacyData(
    @JsonProperty("VictoryType") String victoryType
) {}
