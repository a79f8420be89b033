package edu.brandeis.cosi103a.lycans.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * Per-game role assignment lists from older logs. Each value is a comma-separated list of
 * player names holding that role, or null when nobody did.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LegacyRoles(
    @JsonProperty("Loups") String wolves,
    @JsonProperty("Traître") String traitor,
    @JsonProperty("Idiot du village") String villageIdiot,
    @JsonProperty("Cannibale") String cannibal,
    @JsonProperty("Agent") String agent,
    @JsonProperty("Espion") String spy,
    @JsonProperty("Scientifique") String scientist,
    @JsonProperty("Amoureux") String lovers,
    @JsonProperty("La Bête") String beast,
    @JsonProperty("Chasseur de primes") String bountyHunter,
    @JsonProperty("Vaudou") String voodoo
) {
    private static final Splitter NAME_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();

    /**
     * Role name to player names, in column order. Roles with no players are omitted.
     */
    @JsonIgnore
    public ImmutableMap<String, ImmutableList<String>> membersByRole() {
        ImmutableMap.Builder<String, ImmutableList<String>> builder = ImmutableMap.builder();
        put(builder, "Traître", traitor);
        put(builder, "Loup", wolves);
        put(builder, "Idiot du Village", villageIdiot);
        put(builder, "Cannibale", cannibal);
        put(builder, "Agent", agent);
        put(builder, "Espion", spy);
        put(builder, "Scientifique", scientist);
        put(builder, "Amoureux", lovers);
        put(builder, "La Bête", beast);
        put(builder, "Chasseur de primes", bountyHunter);
        put(builder, "Vaudou", voodoo);
        return builder.build();
    }

    private static void put(ImmutableMap.Builder<String, ImmutableList<String>> builder,
                            String role, String names) {
        if (names == null || names.isBlank()) {
            return;
        }
        builder.put(role, ImmutableList.copyOf(NAME_SPLITTER.split(names)));
    }
}
