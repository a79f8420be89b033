package edu.brandeis.cosi103a.lycans.stats;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Comparator;
import java.util.OptionalDouble;

/**
 * A count over a total, reported as a percentage. A zero total has no percentage at all
 * rather than 0 or NaN.
 */
public record Rate(
    @JsonProperty("count") int count,
    @JsonProperty("total") int total
) implements Comparable<Rate> {

    /** Absent rates sort below every defined rate. */
    private static final Comparator<Rate> ORDER = Comparator.comparingDouble(
        (Rate r) -> r.percent().orElse(Double.NEGATIVE_INFINITY));

    public static Rate of(int count, int total) {
        return new Rate(count, total);
    }

    @JsonProperty("percent")
    public OptionalDouble percent() {
        return total == 0 ? OptionalDouble.empty() : OptionalDouble.of(count * 100.0 / total);
    }

    @JsonIgnore
    public boolean isDefined() {
        return total != 0;
    }

    /** Percentage, or {@code fallback} when the total is zero. */
    public double percentOr(double fallback) {
        return percent().orElse(fallback);
    }

    @Override
    public int compareTo(Rate other) {
        return ORDER.compare(this, other);
    }
}
