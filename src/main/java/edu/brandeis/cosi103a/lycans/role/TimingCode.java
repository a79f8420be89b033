package edu.brandeis.cosi103a.lycans.role;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Comparator;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Phase plus ordinal, written as "N2", "J3", "M1" or "U4". Ordered by number first, then
 * Day before Night before Meeting.
 */
public record TimingCode(Phase phase, int number) implements Comparable<TimingCode> {

    private static final Pattern ANY = Pattern.compile("^([NJMU])(\\d+)$");
    private static final Pattern RESOLVED = Pattern.compile("^[NJM]\\d+$");

    private static final Comparator<TimingCode> ORDER = Comparator
        .comparingInt(TimingCode::number)
        .thenComparing(TimingCode::phase);

    /**
     * Parses any timing code, including unresolved "U" codes.
     */
    public static Optional<TimingCode> parse(String text) {
        if (text == null) {
            return Optional.empty();
        }
        Matcher m = ANY.matcher(text.trim());
        if (!m.matches()) {
            return Optional.empty();
        }
        try {
            int number = Integer.parseInt(m.group(2));
            return Phase.fromCode(m.group(1).charAt(0)).map(phase -> new TimingCode(phase, number));
        } catch (NumberFormatException overflow) {
            return Optional.empty();
        }
    }

    /**
     * Parses only Night, Day and Meeting codes.
     */
    public static Optional<TimingCode> parseResolved(String text) {
        if (text == null || !RESOLVED.matcher(text.trim()).matches()) {
            return Optional.empty();
        }
        return parse(text);
    }

    public static TimingCode night(int number) {
        return new TimingCode(Phase.NIGHT, number);
    }

    public static TimingCode meeting(int number) {
        return new TimingCode(Phase.MEETING, number);
    }

    @JsonValue
    public String code() {
        return String.valueOf(phase.code()) + number;
    }

    /** Human label such as "Nuit 2" or "Journée 4". */
    public String label() {
        return phase.label() + " " + number;
    }

    /** Night k counts as k.0 and Meeting k as k.5. Other phases have no numeric position. */
    public Optional<Double> progress() {
        return switch (phase) {
            case NIGHT -> Optional.of((double) number);
            case MEETING -> Optional.of(number + 0.5);
            default -> Optional.empty();
        };
    }

    @Override
    public int compareTo(TimingCode other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return code();
    }
}
