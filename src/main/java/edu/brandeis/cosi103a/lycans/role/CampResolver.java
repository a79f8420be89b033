package edu.brandeis.cosi103a.lycans.role;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import edu.brandeis.cosi103a.lycans.model.GameRecord;
import edu.brandeis.cosi103a.lycans.model.LegacyRoles;
import edu.brandeis.cosi103a.lycans.model.PlayerRecord;
import edu.brandeis.cosi103a.lycans.model.RoleChange;
import edu.brandeis.cosi103a.lycans.model.Timestamps;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Maps a player's raw role fields and role-change history to a single {@link Camp}.
 */
public final class CampResolver {

    public static final String VILLAGEOIS_ELITE = "Villageois Élite";
    public static final ImmutableSet<String> ELITE_POWERS =
        ImmutableSet.of("chasseur", "alchimiste", "protecteur", "disciple");

    private static final ImmutableSet<String> WOLF_ROLES = ImmutableSet.of("loup", "traître", "louveteau");

    // Keys are normalized role names.
    private static final ImmutableMap<String, Camp> ROLE_TABLE = ImmutableMap.<String, Camp>builder()
        .put("villageois", Camp.VILLAGEOIS)
        .put("villageois élite", Camp.VILLAGEOIS)
        .put("chasseur", Camp.VILLAGEOIS)
        .put("alchimiste", Camp.VILLAGEOIS)
        .put("protecteur", Camp.VILLAGEOIS)
        .put("disciple", Camp.VILLAGEOIS)
        .put("loup", Camp.LOUP)
        .put("traître", Camp.TRAITRE)
        .put("louveteau", Camp.LOUVETEAU)
        .put("amoureux", Camp.AMOUREUX)
        .put("amoureux loup", Camp.AMOUREUX)
        .put("amoureux villageois", Camp.AMOUREUX)
        .put("idiot du village", Camp.IDIOT_DU_VILLAGE)
        .put("cannibale", Camp.CANNIBALE)
        .put("agent", Camp.AGENT)
        .put("espion", Camp.ESPION)
        .put("scientifique", Camp.SCIENTIFIQUE)
        .put("la bête", Camp.LA_BETE)
        .put("chasseur de primes", Camp.CHASSEUR_DE_PRIMES)
        .put("vaudou", Camp.VAUDOU)
        .put("zombie", Camp.VAUDOU)
        .build();

    private CampResolver() {}

    /**
     * Resolves the camp of {@code player} at the start or the end of {@code game}.
     */
    public static Camp resolveCamp(GameRecord game, PlayerRecord player, Moment moment) {
        return moment == Moment.INITIAL ? initialCamp(game, player) : finalCamp(game, player);
    }

    /**
     * Camp at game start. Precedence: traitor flag, elite villager power, initial role,
     * per-game legacy role lists, then Villageois.
     */
    public static Camp initialCamp(GameRecord game, PlayerRecord player) {
        if (isTraitorFlagged(player)) {
            return Camp.TRAITRE;
        }
        if (hasElitePower(player)) {
            return Camp.VILLAGEOIS;
        }
        Optional<Camp> fromRole = lookup(player.mainRoleInitial());
        if (fromRole.isPresent()) {
            return fromRole.get();
        }
        return campFromLegacyLists(game, player).orElse(Camp.VILLAGEOIS);
    }

    /**
     * Camp at game end: the camp of the last role change, or the initial camp when the role
     * never changed.
     */
    public static Camp finalCamp(GameRecord game, PlayerRecord player) {
        return lastRoleChange(player)
            .map(change -> campOfRole(change.newMainRole()))
            .orElseGet(() -> initialCamp(game, player));
    }

    /**
     * Role name held at game end, falling back to the initial role.
     */
    public static String finalRole(PlayerRecord player) {
        return lastRoleChange(player)
            .map(RoleChange::newMainRole)
            .orElse(player.mainRoleInitial());
    }

    /**
     * Camp for a raw role name. Unknown and missing roles resolve to Villageois.
     */
    public static Camp campOfRole(String role) {
        return lookup(role).orElse(Camp.VILLAGEOIS);
    }

    public static boolean isKnownRole(String role) {
        return lookup(role).isPresent();
    }

    /** True for Loup, Traître and Louveteau role names. */
    public static boolean isWolfRole(String role) {
        return WOLF_ROLES.contains(PlayerIdentity.normalize(role));
    }

    static boolean isTraitorFlagged(PlayerRecord player) {
        return "traître".equals(PlayerIdentity.normalize(player.secondaryRole()));
    }

    static boolean hasElitePower(PlayerRecord player) {
        return VILLAGEOIS_ELITE.equalsIgnoreCase(trim(player.mainRoleInitial()))
            && ELITE_POWERS.contains(PlayerIdentity.normalize(player.power()));
    }

    static Optional<RoleChange> lastRoleChange(PlayerRecord player) {
        List<RoleChange> changes = player.mainRoleChanges();
        if (changes.isEmpty()) {
            return Optional.empty();
        }
        List<RoleChange> ordered = changes;
        boolean allDated = changes.stream().allMatch(c -> Timestamps.parse(c.date()).isPresent());
        if (allDated) {
            ordered = new ArrayList<>(changes);
            ordered.sort(Comparator.comparing((RoleChange c) -> Timestamps.parse(c.date()).orElse(Instant.MIN)));
        }
        return Optional.of(ordered.get(ordered.size() - 1));
    }

    private static Optional<Camp> campFromLegacyLists(GameRecord game, PlayerRecord player) {
        LegacyRoles legacy = game == null ? null : game.legacyRoles();
        if (legacy == null) {
            return Optional.empty();
        }
        for (Map.Entry<String, ImmutableList<String>> entry : legacy.membersByRole().entrySet()) {
            for (String name : entry.getValue()) {
                if (PlayerIdentity.sameName(name, player.username())) {
                    return Optional.of(campOfRole(entry.getKey()));
                }
            }
        }
        return Optional.empty();
    }

    private static Optional<Camp> lookup(String role) {
        String key = PlayerIdentity.normalize(role);
        if (key.isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(ROLE_TABLE.get(key));
    }

    private static String trim(String s) {
        return s == null ? "" : s.trim();
    }
}
