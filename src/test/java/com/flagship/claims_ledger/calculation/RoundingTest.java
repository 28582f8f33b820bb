package com.flagship.claims_ledger.calculation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RoundingTest {

    @Test
    @DisplayName("Half values round toward positive infinity")
    void testRoundHalfUp_TiesGoUp() {
        assertEquals(3.0, Rounding.roundHalfUp(2.5));
        assertEquals(-2.0, Rounding.roundHalfUp(-2.5));
        assertEquals(-3.0, Rounding.roundHalfUp(-2.6));
        assertEquals(2.0, Rounding.roundHalfUp(2.4999));
    }

    @Test
    @DisplayName("Values at or above 2^52 are returned unchanged")
    void testRoundHalfUp_LargeValuesUnchanged() {
        double large = 4503599627370497.0;
        assertEquals(large, Rounding.roundHalfUp(large));
        assertEquals(Double.POSITIVE_INFINITY, Rounding.roundHalfUp(Double.POSITIVE_INFINITY));
    }

    @Test
    @DisplayName("Scaled rounding follows binary representation of the input")
    void testRoundToScale() {
        assertEquals(416.67, Rounding.roundToScale(416.666666, 2));
        assertEquals(10.416751, Rounding.roundToScale(10.4167505, 6));
        // 1.005 is stored slightly below 1.005
        assertEquals(1.0, Rounding.roundToScale(1.005, 2));
    }

    @Test
    @DisplayName("High precision rounding keeps ordinary doubles intact")
    void testRoundHighPrecision() {
        assertEquals(50000.0, Rounding.roundHighPrecision(50000.0));
        assertEquals(1.0 / 3, Rounding.roundHighPrecision(1.0 / 3));
        assertEquals(0.1 + 0.2, Rounding.roundHighPrecision(0.1 + 0.2));
    }

    @Test
    @DisplayName("floorToUnit truncates toward zero and maps non-finite values to zero")
    void testFloorToUnit() {
        assertEquals(3L, Rounding.floorToUnit(3.99));
        assertEquals(-3L, Rounding.floorToUnit(-3.7));
        assertEquals(0L, Rounding.floorToUnit(Double.NaN));
        assertEquals(0L, Rounding.floorToUnit(Double.NEGATIVE_INFINITY));
    }

    @Test
    @DisplayName("safeDivide returns zero for a zero divisor")
    void testSafeDivide() {
        assertEquals(0.0, Rounding.safeDivide(10, 0));
        assertEquals(2.5, Rounding.safeDivide(10, 4));
        assertEquals(0.0, Rounding.floor(Double.NaN));
    }
}
