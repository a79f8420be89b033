package edu.brandeis.cosi103a.lycans.scoring;

import java.util.Arrays;
import java.util.Collection;
import java.util.function.DoubleUnaryOperator;

/**
 * Min-max normalization of a raw metric onto 0 to 100, fit to the population it is given.
 */
public final class DynamicScaler {

    /** Score returned for every value when the population gives no spread to scale on. */
    public static final double NEUTRAL = 50.0;

    private DynamicScaler() {}

    /**
     * Builds a scaler from the population's values. Empty input, or input where every value
     * is equal, yields a scaler that returns {@link #NEUTRAL} for anything. Values outside the
     * fitted range are clamped to 0 or 100.
     */
    public static DoubleUnaryOperator build(Collection<Double> values) {
        if (values.isEmpty()) {
            return v -> NEUTRAL;
        }
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double v : values) {
            min = Math.min(min, v);
            max = Math.max(max, v);
        }
        if (max == min) {
            return v -> NEUTRAL;
        }
        double lo = min;
        double span = max - min;
        return v -> Math.max(0.0, Math.min(100.0, (v - lo) / span * 100.0));
    }

    public static DoubleUnaryOperator build(double... values) {
        return build(Arrays.stream(values).boxed().toList());
    }
}
