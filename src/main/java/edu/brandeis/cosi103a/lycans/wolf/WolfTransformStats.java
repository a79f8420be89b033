package edu.brandeis.cosi103a.lycans.wolf;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Transformation totals for one player across the games they played with a wolf role.
 *
 * @param transformsPerNight transforms divided by nights spent as a wolf, 0 when no night was counted
 * @param transformsPerGame  transforms divided by wolf games
 */
public record WolfTransformStats(
    @JsonProperty("playerKey") String playerKey,
    @JsonProperty("displayName") String displayName,
    @JsonProperty("wolfGames") int wolfGames,
    @JsonProperty("transforms") int transforms,
    @JsonProperty("untransforms") int untransforms,
    @JsonProperty("nightsAsWolf") int nightsAsWolf,
    @JsonProperty("transformsPerNight") double transformsPerNight,
    @JsonProperty("transformsPerGame") double transformsPerGame
) {}
