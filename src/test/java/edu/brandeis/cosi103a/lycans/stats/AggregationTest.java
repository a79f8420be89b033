package edu.brandeis.cosi103a.lycans.stats;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.OptionalDouble;

import static org.junit.jupiter.api.Assertions.*;

class AggregationTest {

    private static final Aggregation<String, Character, int[], String> BY_INITIAL = Aggregation.of(
        word -> word.isEmpty() ? null : word.charAt(0),
        key -> new int[1],
        (acc, word) -> acc[0]++,
        (key, acc) -> key + "=" + acc[0]);

    @Test
    void run_groupsInFirstSeenOrder() {
        List<String> result = BY_INITIAL.run(Arrays.asList("banana", "apple", "blueberry", "avocado", "cherry"));
        assertEquals(List.of("b=2", "a=2", "c=1"), result);
    }

    @Test
    void run_nullKeySkipsItem() {
        assertEquals(List.of("k=1"), BY_INITIAL.run(List.of("", "kiwi", "")));
    }

    @Test
    void run_isRepeatable() {
        List<String> words = List.of("fig", "grape", "fig");
        assertEquals(BY_INITIAL.run(words), BY_INITIAL.run(words));
    }

    @Test
    void rate_zeroTotalIsAbsent() {
        assertEquals(OptionalDouble.empty(), Rate.of(0, 0).percent());
        assertFalse(Rate.of(0, 0).isDefined());
        assertEquals(-1.0, Rate.of(0, 0).percentOr(-1.0));
        assertEquals(OptionalDouble.of(25.0), Rate.of(1, 4).percent());
    }

    @Test
    void rate_absentSortsLowest() {
        assertTrue(Rate.of(0, 0).compareTo(Rate.of(0, 5)) < 0);
        assertTrue(Rate.of(3, 4).compareTo(Rate.of(1, 2)) > 0);
    }
}
