package edu.brandeis.cosi103a.lycans.model;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import java.util.function.Function;

/**
 * Parses the timestamps found in game logs: ISO-8601 with or without offset, or the French
 * {@code dd/MM/yyyy} dates of older exports. Values without an offset are read as UTC.
 */
public final class Timestamps {

    private static final DateTimeFormatter FRENCH_DATE = DateTimeFormatter.ofPattern("dd/MM/yyyy");

    private Timestamps() {}

    public static Optional<Instant> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String text = value.trim();
        return attempt(text, t -> OffsetDateTime.parse(t).toInstant())
            .or(() -> attempt(text, t -> LocalDateTime.parse(t).toInstant(ZoneOffset.UTC)))
            .or(() -> attempt(text, t -> LocalDate.parse(t, FRENCH_DATE).atStartOfDay().toInstant(ZoneOffset.UTC)));
    }

    private static Optional<Instant> attempt(String text, Function<String, Instant> parser) {
        try {
            return Optional.of(parser.apply(text));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
