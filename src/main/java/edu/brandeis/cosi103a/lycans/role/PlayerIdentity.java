package edu.brandeis.cosi103a.lycans.role;

import edu.brandeis.cosi103a.lycans.model.PlayerRecord;

import java.util.Locale;

/**
 * Stable identity keys for players whose display names change over time.
 */
public final class PlayerIdentity {

    private PlayerIdentity() {}

    /**
     * Aggregation key: the player's id when present, otherwise the normalized display name.
     */
    public static String keyOf(PlayerRecord player) {
        if (player.id() != null && !player.id().isBlank()) {
            return player.id().trim();
        }
        return normalize(player.username());
    }

    /** Trimmed, lower-cased name; null becomes the empty string. */
    public static String normalize(String name) {
        return name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
    }

    public static boolean sameName(String a, String b) {
        return !normalize(a).isEmpty() && normalize(a).equals(normalize(b));
    }

    /** Display name with surrounding whitespace removed. */
    public static String displayName(PlayerRecord player) {
        return player.username() == null ? "" : player.username().trim();
    }
}
