package edu.brandeis.cosi103a.lycans.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class TimestampsTest {

    @Test
    void parse_isoWithOffset() {
        assertEquals(Optional.of(Instant.parse("2024-03-01T18:00:00Z")),
            Timestamps.parse("2024-03-01T20:00:00+02:00"));
    }

    @Test
    void parse_isoWithoutOffsetIsUtc() {
        assertEquals(Optional.of(Instant.parse("2024-03-01T20:00:00Z")), Timestamps.parse("2024-03-01T20:00:00"));
    }

    @Test
    void parse_frenchDate() {
        assertEquals(Optional.of(Instant.parse("2024-03-15T00:00:00Z")), Timestamps.parse("15/03/2024"));
    }

    @Test
    void parse_garbageIsEmpty() {
        assertTrue(Timestamps.parse(null).isEmpty());
        assertTrue(Timestamps.parse("  ").isEmpty());
        assertTrue(Timestamps.parse("yesterday").isEmpty());
    }
}
