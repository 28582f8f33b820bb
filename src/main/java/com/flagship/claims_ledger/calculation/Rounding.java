package com.flagship.claims_ledger.calculation;

/**
 * Numeric primitives shared by every allocation step.
 *
 * All amounts are computed in IEEE-754 doubles and rounded with the same
 * half-up rule as the historical allocation engine, so results are bit-identical
 * with claims already recorded in production. Do not replace with BigDecimal.
 */
public final class Rounding {

    /** Decimal places used to strip binary noise from chained multiplications. */
    public static final int HIGH_PRECISION_DECIMALS = 25;

    private static final double HIGH_PRECISION_FACTOR = 1e25;

    // Doubles at or above this magnitude have no fractional part.
    private static final double INTEGRAL_THRESHOLD = 4503599627370496.0; // 2^52

    private Rounding() {
        // Utility class
    }

    /**
     * Rounds to 25 decimal places, half-up.
     */
    public static double roundHighPrecision(double value) {
        return roundHalfUp(value * HIGH_PRECISION_FACTOR) / HIGH_PRECISION_FACTOR;
    }

    /**
     * Rounds to the given number of decimal places, half-up.
     */
    public static double roundToScale(double value, int decimals) {
        double factor = Math.pow(10, decimals);
        return roundHalfUp(value * factor) / factor;
    }

    /**
     * Truncates toward zero to a whole number of smallest units.
     * Returns 0 for NaN and infinities.
     */
    public static long floorToUnit(double value) {
        if (!Double.isFinite(value)) {
            return 0L;
        }
        return (long) value;
    }

    /**
     * Floor that is safe for non-finite input, returned as a double.
     */
    public static double floor(double value) {
        if (!Double.isFinite(value)) {
            return 0.0;
        }
        return Math.floor(value);
    }

    /**
     * Divides, yielding 0 when the divisor is zero or the result is not finite.
     */
    public static double safeDivide(double dividend, double divisor) {
        if (divisor == 0.0) {
            return 0.0;
        }
        double result = dividend / divisor;
        return Double.isFinite(result) ? result : 0.0;
    }

    /**
     * Round half toward positive infinity, returning a double.
     */
    static double roundHalfUp(double value) {
        if (!Double.isFinite(value) || Math.abs(value) >= INTEGRAL_THRESHOLD) {
            return value;
        }
        double floor = Math.floor(value);
        return (value - floor) >= 0.5 ? floor + 1.0 : floor;
    }
}
