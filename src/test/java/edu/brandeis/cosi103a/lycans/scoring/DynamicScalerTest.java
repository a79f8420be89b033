package edu.brandeis.cosi103a.lycans.scoring;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.function.DoubleUnaryOperator;

import static org.junit.jupiter.api.Assertions.*;

class DynamicScalerTest {

    @Test
    void build_singleValueIsNeutral() {
        DoubleUnaryOperator scale = DynamicScaler.build(42.0);
        assertEquals(50.0, scale.applyAsDouble(42.0));
        assertEquals(50.0, scale.applyAsDouble(-1000.0));
    }

    @Test
    void build_equalValuesAreNeutral() {
        DoubleUnaryOperator scale = DynamicScaler.build(7.0, 7.0, 7.0);
        assertEquals(50.0, scale.applyAsDouble(7.0));
        assertEquals(50.0, scale.applyAsDouble(8.0));
    }

    @Test
    void build_emptyIsNeutral() {
        assertEquals(50.0, DynamicScaler.build(List.of()).applyAsDouble(3.0));
    }

    @Test
    void build_minMax() {
        DoubleUnaryOperator scale = DynamicScaler.build(0.0, 100.0);
        assertEquals(0.0, scale.applyAsDouble(0.0));
        assertEquals(50.0, scale.applyAsDouble(50.0));
        assertEquals(100.0, scale.applyAsDouble(100.0));
    }

    @Test
    void build_clampsOutsideFittedRange() {
        DoubleUnaryOperator scale = DynamicScaler.build(List.of(10.0, 20.0, 30.0));
        assertEquals(25.0, scale.applyAsDouble(15.0), 1e-9);
        assertEquals(0.0, scale.applyAsDouble(-5.0));
        assertEquals(100.0, scale.applyAsDouble(99.0));
    }
}
