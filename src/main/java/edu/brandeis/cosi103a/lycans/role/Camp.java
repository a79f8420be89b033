package edu.brandeis.cosi103a.lycans.role;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Faction a player scores for. The wolf family (Loup, Traître, Louveteau) is kept apart for
 * composition breakdowns and shares the "Loups" win condition.
 */
public enum Camp {
    VILLAGEOIS("Villageois", Kind.VILLAGE),
    LOUP("Loup", Kind.WOLF),
    TRAITRE("Traître", Kind.WOLF),
    LOUVETEAU("Louveteau", Kind.WOLF),
    AMOUREUX("Amoureux", Kind.SOLO),
    IDIOT_DU_VILLAGE("Idiot du Village", Kind.SOLO),
    CANNIBALE("Cannibale", Kind.SOLO),
    AGENT("Agent", Kind.SOLO),
    ESPION("Espion", Kind.SOLO),
    SCIENTIFIQUE("Scientifique", Kind.SOLO),
    LA_BETE("La Bête", Kind.SOLO),
    CHASSEUR_DE_PRIMES("Chasseur de primes", Kind.SOLO),
    VAUDOU("Vaudou", Kind.SOLO);

    /** Label of the wolf alliance when it wins. */
    public static final String WOLF_ALLIANCE_LABEL = "Loups";

    enum Kind { VILLAGE, WOLF, SOLO }

    private final String label;
    private final Kind kind;

    Camp(String label, Kind kind) {
        this.label = label;
        this.kind = kind;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public boolean isWolfFamily() {
        return kind == Kind.WOLF;
    }

    public boolean isSolo() {
        return kind == Kind.SOLO;
    }

    /**
     * Camp used for win checks: every wolf-family camp collapses to {@link #LOUP}.
     */
    public Camp alliance() {
        return isWolfFamily() ? LOUP : this;
    }

    /**
     * Label used when this camp is reported as a game winner ("Loups" for the wolf alliance).
     */
    public String winLabel() {
        return isWolfFamily() ? WOLF_ALLIANCE_LABEL : label;
    }
}
