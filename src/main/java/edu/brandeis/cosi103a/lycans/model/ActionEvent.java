package edu.brandeis.cosi103a.lycans.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A timestamped in-game action such as a gadget use, a potion or a wolf transformation.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ActionEvent(
    @JsonProperty("Date") String date,
    @JsonProperty("Timing") String timing,
    @JsonProperty("Position") Position position,
    @JsonProperty("ActionType") String actionType,
    @JsonProperty("ActionName") String actionName,
    @JsonProperty("ActionTarget") String actionTarget
) {
    public static final String TRANSFORM = "Transform";
    public static final String UNTRANSFORM = "Untransform";

    public boolean isType(String type) {
        return actionType != null && actionType.equalsIgnoreCase(type);
    }
}
