package edu.brandeis.cosi103a.lycans.stats;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Multiset;

import java.util.Comparator;
import java.util.Optional;

/**
 * Helpers for the insertion-ordered multisets the reports count with.
 */
final class Tallies {

    private Tallies() {}

    /**
     * Entry with the highest count; ties go to the element counted first.
     */
    static <T> Optional<T> mostCommon(Multiset<T> counts) {
        T best = null;
        int bestCount = 0;
        for (Multiset.Entry<T> entry : counts.entrySet()) {
            if (entry.getCount() > bestCount) {
                best = entry.getElement();
                bestCount = entry.getCount();
            }
        }
        return Optional.ofNullable(best);
    }

    /**
     * Snapshot sorted by count, highest first, ties in insertion order.
     */
    static <T> ImmutableMap<T, Integer> byCount(Multiset<T> counts) {
        ImmutableMap.Builder<T, Integer> builder = ImmutableMap.builder();
        counts.entrySet().stream()
            .sorted(Comparator.comparingInt(Multiset.Entry<T>::getCount).reversed())
            .forEach(e -> builder.put(e.getElement(), e.getCount()));
        return builder.build();
    }

    /** Snapshot in insertion order. */
    static <T> ImmutableMap<T, Integer> snapshot(Multiset<T> counts) {
        ImmutableMap.Builder<T, Integer> builder = ImmutableMap.builder();
        for (Multiset.Entry<T> entry : counts.entrySet()) {
            builder.put(entry.getElement(), entry.getCount());
        }
        return builder.build();
    }
}
