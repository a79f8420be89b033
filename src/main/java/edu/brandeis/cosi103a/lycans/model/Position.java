package edu.brandeis.cosi103a.lycans.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * World coordinates where an action or death happened.
 */
public record Position(
    @JsonProperty("x") double x,
    @JsonProperty("y") double y,
    @JsonProperty("z") double z
) {}
