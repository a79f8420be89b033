package edu.brandeis.cosi103a.lycans.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * One player's line in a game log: role assignment, death, votes and actions.
 *
 * <p>{@code actions} stays null when the log predates action tracking, so callers can tell
 * "no actions recorded" apart from "no actions performed".
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PlayerRecord(
    @JsonProperty("ID") String id,
    @JsonProperty("Username") String username,
    @JsonProperty("Color") String color,
    @JsonProperty("MainRoleInitial") String mainRoleInitial,
    @JsonProperty("MainRoleChanges") List<RoleChange> mainRoleChanges,
    @JsonProperty("Power") String power,
    @JsonProperty("SecondaryRole") String secondaryRole,
    @JsonProperty("DeathDateIrl") String deathDateIrl,
    @JsonProperty("DeathTiming") String deathTiming,
    @JsonProperty("DeathPosition") Position deathPosition,
    @JsonProperty("DeathType") String deathType,
    @JsonProperty("KillerName") String killerName,
    @JsonProperty("Victorious") boolean victorious,
    @JsonProperty("Votes") List<VoteEvent> votes,
    @JsonProperty("Actions") List<ActionEvent> actions,
    @JsonProperty("TotalCollectedLoot") Integer totalCollectedLoot
) {
    public PlayerRecord {
        mainRoleChanges = mainRoleChanges == null ? ImmutableList.of() : ImmutableList.copyOf(mainRoleChanges);
        votes = votes == null ? ImmutableList.of() : ImmutableList.copyOf(votes);
        actions = actions == null ? null : ImmutableList.copyOf(actions);
    }

    @JsonIgnore
    public boolean hasDied() {
        return deathDateIrl != null && !deathDateIrl.isBlank();
    }

    @JsonIgnore
    public boolean hasActionLog() {
        return actions != null;
    }

    @JsonIgnore
    public List<ActionEvent> actionsOrEmpty() {
        return actions == null ? ImmutableList.of() : actions;
    }
}
