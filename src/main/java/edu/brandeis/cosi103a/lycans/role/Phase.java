package edu.brandeis.cosi103a.lycans.role;

import java.util.Optional;

/**
 * Phase letter of a timing code. Declaration order is the in-day order used for sorting.
 */
public enum Phase {
    DAY('J', "Jour"),
    NIGHT('N', "Nuit"),
    MEETING('M', "Meeting"),
    UNKNOWN('U', "Journée");

    private final char code;
    private final String label;

    Phase(char code, String label) {
        this.code = code;
        this.label = label;
    }

    public char code() {
        return code;
    }

    public String label() {
        return label;
    }

    public static Optional<Phase> fromCode(char code) {
        for (Phase phase : values()) {
            if (phase.code == Character.toUpperCase(code)) {
                return Optional.of(phase);
            }
        }
        return Optional.empty();
    }
}
