package edu.brandeis.cosi103a.lycans.wolf;

import com.google.common.collect.ImmutableList;
import edu.brandeis.cosi103a.lycans.model.ActionEvent;
import edu.brandeis.cosi103a.lycans.model.GameRecord;
import edu.brandeis.cosi103a.lycans.model.PlayerRecord;
import edu.brandeis.cosi103a.lycans.role.CampResolver;
import edu.brandeis.cosi103a.lycans.role.PlayerIdentity;
import edu.brandeis.cosi103a.lycans.role.TimingCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Counts how often wolf-role players transform, normalized by the nights they spent alive as a wolf.
 */
public final class WolfTransformCalculator {
    private static final Logger logger = LoggerFactory.getLogger(WolfTransformCalculator.class);

    private WolfTransformCalculator() {}

    /**
     * Number of nights a player went through before the given timing. Night k counts itself,
     * day and meeting k count the k-1 nights before them. Unresolved {@code U} timings are
     * guessed as two phases per day.
     */
    public static int nightsAsWolf(String timing) {
        return TimingCode.parse(timing)
            .map(code -> switch (code.phase()) {
                case NIGHT -> code.number();
                case DAY, MEETING -> Math.max(0, code.number() - 1);
                case UNKNOWN -> Math.max(0, (code.number() - 1) / 2);
            })
            .orElse(0);
    }

    public static double transformsPerNight(int transforms, int nights) {
        return nights == 0 ? 0.0 : (double) transforms / nights;
    }

    /**
     * Per-player totals over wolf-role players, sorted by transforms then name. Games without
     * an action log are skipped since they cannot tell zero transforms from no data.
     */
    public static ImmutableList<WolfTransformStats> compute(List<GameRecord> games) {
        Map<String, Tally> tallies = new LinkedHashMap<>();
        for (GameRecord game : games) {
            for (PlayerRecord p : game.playerStats()) {
                if (!CampResolver.isWolfRole(CampResolver.finalRole(p))) {
                    continue;
                }
                if (!p.hasActionLog()) {
                    logger.debug("No action log for {} in game {}", PlayerIdentity.displayName(p), game.label());
                    continue;
                }
                Tally tally = tallies.computeIfAbsent(PlayerIdentity.keyOf(p), k -> new Tally());
                tally.name = PlayerIdentity.displayName(p);
                tally.games++;
                for (ActionEvent action : p.actionsOrEmpty()) {
                    if (action.isType(ActionEvent.TRANSFORM)) {
                        tally.transforms++;
                    } else if (action.isType(ActionEvent.UNTRANSFORM)) {
                        tally.untransforms++;
                    }
                }
                tally.nights += nightsAsWolf(p.hasDied() && p.deathTiming() != null ? p.deathTiming() : game.endTiming());
            }
        }

        List<WolfTransformStats> rows = new ArrayList<>();
        tallies.forEach((key, t) -> rows.add(new WolfTransformStats(
            key,
            t.name,
            t.games,
            t.transforms,
            t.untransforms,
            t.nights,
            transformsPerNight(t.transforms, t.nights),
            t.games == 0 ? 0.0 : (double) t.transforms / t.games)));
        rows.sort(Comparator.comparingInt(WolfTransformStats::transforms).reversed()
            .thenComparing(WolfTransformStats::displayName, String.CASE_INSENSITIVE_ORDER));
        return ImmutableList.copyOf(rows);
    }

    private static final class Tally {
        String name;
        int games;
        int transforms;
        int untransforms;
        int nights;
    }
}
