package edu.brandeis.cosi103a.lycans.report;

import com.google.common.collect.ImmutableList;
import edu.brandeis.cosi103a.lycans.model.GameRecord;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Selection of games a report is computed over. Every criterion is optional; an empty filter
 * keeps every game.
 *
 * @param modOnly keep only games played with the mod
 * @param map     keep only games on this map, compared case-insensitively
 * @param from    keep games starting at or after this instant
 * @param to      keep games starting before this instant
 */
public record GameFilter(boolean modOnly, Optional<String> map, Optional<Instant> from, Optional<Instant> to) {

    public GameFilter {
        map = map.filter(m -> !m.isBlank());
    }

    public GameFilter(boolean modOnly, String map) {
        this(modOnly, Optional.ofNullable(map), Optional.empty(), Optional.empty());
    }

    public boolean isEmpty() {
        return !modOnly && map.isEmpty() && from.isEmpty() && to.isEmpty();
    }

    public boolean test(GameRecord game) {
        if (modOnly && !game.modded()) {
            return false;
        }
        if (map.isPresent() && !map.get().equalsIgnoreCase(game.mapName())) {
            return false;
        }
        if (from.isPresent() || to.isPresent()) {
            Optional<Instant> start = game.startInstant();
            if (start.isEmpty()) {
                return false;
            }
            if (from.isPresent() && start.get().isBefore(from.get())) {
                return false;
            }
            if (to.isPresent() && !start.get().isBefore(to.get())) {
                return false;
            }
        }
        return true;
    }

    /** Games passing the filter, in input order. */
    public ImmutableList<GameRecord> apply(List<GameRecord> games) {
        if (isEmpty()) {
            return ImmutableList.copyOf(games);
        }
        return games.stream().filter(this::test).collect(ImmutableList.toImmutableList());
    }
}
