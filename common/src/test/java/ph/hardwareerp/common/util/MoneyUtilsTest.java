package ph.hardwareerp.common.util;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.RoundingMode;

import static org.junit.jupiter.api.Assertions.*;

class MoneyUtilsTest {

    @Test
    void round2_ShouldRoundHalfUpOnTheCent() {
        assertEquals(new BigDecimal("10.13"), MoneyUtils.round2(new BigDecimal("10.125")));
        assertEquals(new BigDecimal("10.12"), MoneyUtils.round2(new BigDecimal("10.1249")));
        assertEquals(new BigDecimal("0.00"), MoneyUtils.round2(null));
    }

    @Test
    void nonNegative_ShouldClampNegatives() {
        assertEquals(new BigDecimal("0.00"), MoneyUtils.nonNegative(new BigDecimal("-5.00")));
        assertEquals(new BigDecimal("5.00"), MoneyUtils.nonNegative(new BigDecimal("5")));
    }

    @Test
    void divide_ShouldHonourRoundingMode() {
        assertEquals(new BigDecimal("33.33"), MoneyUtils.divide(new BigDecimal("100.00"), 3, RoundingMode.HALF_UP));
        assertEquals(new BigDecimal("0.01"), MoneyUtils.divide(new BigDecimal("0.07"), 5, RoundingMode.HALF_UP));
        assertEquals(new BigDecimal("0.00"), MoneyUtils.divide(new BigDecimal("0.07"), 10, RoundingMode.DOWN));
    }

    @Test
    void sameAmount_ShouldTolerateEpsilon() {
        assertTrue(MoneyUtils.sameAmount(new BigDecimal("1000.00"), new BigDecimal("1000.0000001")));
        assertFalse(MoneyUtils.sameAmount(new BigDecimal("1000.00"), new BigDecimal("1000.01")));
        assertFalse(MoneyUtils.sameAmount(null, BigDecimal.ONE));
    }

    @Test
    void notAbove_ShouldAllowEpsilonOverrun() {
        assertTrue(MoneyUtils.notAbove(new BigDecimal("1200.0000005"), new BigDecimal("1200.00")));
        assertFalse(MoneyUtils.notAbove(new BigDecimal("1200.01"), new BigDecimal("1200.00")));
    }

    @Test
    void fromNumber_ShouldReadStoredDoubles() {
        assertEquals(new BigDecimal("0.30"), MoneyUtils.fromNumber(0.1 + 0.2));
        assertEquals(new BigDecimal("150.00"), MoneyUtils.fromNumber(150L));
        assertEquals(new BigDecimal("0.00"), MoneyUtils.fromNumber(null));
    }
}
