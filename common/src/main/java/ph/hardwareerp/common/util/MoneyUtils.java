package ph.hardwareerp.common.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Utility class for fixed-point money arithmetic.
 * Every value is kept at 2 decimal places, rounded half-up on the cent.
 */
public final class MoneyUtils {

    public static final BigDecimal ZERO = BigDecimal.ZERO.setScale(2, RoundingMode.HALF_UP);
    public static final BigDecimal ONE_CENT = new BigDecimal("0.01");

    /**
     * Tolerance for amount comparisons against values that passed through
     * client-side floating point.
     */
    public static final BigDecimal EPSILON = new BigDecimal("0.000001");

    private MoneyUtils() {
        // Utility class - no instantiation
    }

    /**
     * Round amount to 2 decimal places. Null is treated as zero.
     */
    public static BigDecimal round2(BigDecimal amount) {
        if (amount == null) {
            return ZERO;
        }
        return amount.setScale(2, RoundingMode.HALF_UP);
    }

    /**
     * Round amount to 2 decimal places and clamp negatives to zero.
     */
    public static BigDecimal nonNegative(BigDecimal amount) {
        BigDecimal rounded = round2(amount);
        return rounded.signum() < 0 ? ZERO : rounded;
    }

    /**
     * Divide and round the quotient to the cent.
     */
    public static BigDecimal divide(BigDecimal amount, int divisor, RoundingMode mode) {
        return round2(amount).divide(BigDecimal.valueOf(divisor), 2, mode);
    }

    /**
     * Check if amount is positive (greater than zero).
     */
    public static boolean isPositive(BigDecimal amount) {
        return amount != null && amount.compareTo(BigDecimal.ZERO) > 0;
    }

    /**
     * Check whether two amounts are equal within {@link #EPSILON}.
     */
    public static boolean sameAmount(BigDecimal a, BigDecimal b) {
        if (a == null || b == null) {
            return false;
        }
        return a.subtract(b).abs().compareTo(EPSILON) < 0;
    }

    /**
     * Check whether {@code amount} does not exceed {@code limit} by more than {@link #EPSILON}.
     */
    public static boolean notAbove(BigDecimal amount, BigDecimal limit) {
        return amount.compareTo(limit.add(EPSILON)) <= 0;
    }

    /**
     * Convert a value read from a document store (double or long) into a money amount.
     */
    public static BigDecimal fromNumber(Number value) {
        if (value == null) {
            return ZERO;
        }
        return BigDecimal.valueOf(value.doubleValue()).setScale(2, RoundingMode.HALF_UP);
    }
}
