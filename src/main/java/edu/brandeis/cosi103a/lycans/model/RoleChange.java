package edu.brandeis.cosi103a.lycans.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A change of main role during a game.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RoleChange(
    @JsonProperty("NewMainRole") String newMainRole,
    @JsonProperty("RoleChangeDateIrl") String date
) {}
