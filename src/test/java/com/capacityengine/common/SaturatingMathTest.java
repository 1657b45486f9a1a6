package com.capacityengine.common;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SaturatingMathTest {

    @Test
    void testAddSaturatesAtMax() {
        assertEquals(Long.MAX_VALUE, SaturatingMath.add(Long.MAX_VALUE, 1));
        assertEquals(Long.MAX_VALUE, SaturatingMath.add(Long.MAX_VALUE - 5, 10));
        assertEquals(15, SaturatingMath.add(5, 10));
    }

    @Test
    void testSubtractStopsAtZero() {
        assertEquals(0, SaturatingMath.subtractToZero(5, 10));
        assertEquals(0, SaturatingMath.subtractToZero(10, 10));
        assertEquals(3, SaturatingMath.subtractToZero(10, 7));
    }

    @Test
    void testMulDivFloors() {
        // 35,476,000 * 50,000 uTPS over 2,000 ms
        assertEquals(3547, SaturatingMath.mulDiv(35_476_000L, 50_000L, 2_000L, 1_000_000_000_000L));
        assertEquals(0, SaturatingMath.mulDiv(1, 1, 1, 2));
    }

    @Test
    void testMulDivSaturatesInsteadOfWrapping() {
        long result = SaturatingMath.mulDiv(Long.MAX_VALUE, Long.MAX_VALUE, Long.MAX_VALUE, 1);
        assertEquals(Long.MAX_VALUE, result);
    }

    @Test
    void testMulDivIsExactWhenIntermediateOverflowsLong() {
        // intermediate product is far beyond 2^63 but the quotient fits
        long result = SaturatingMath.mulDiv(4_000_000_000L, 4_000_000_000L, 4_000_000_000L,
            16_000_000_000_000_000L);
        assertEquals(4_000_000_000_000L, result);
    }

    @Test
    void testMulDivRejectsBadArguments() {
        assertThrows(IllegalArgumentException.class, () -> SaturatingMath.mulDiv(1, 1, 1, 0));
        assertThrows(IllegalArgumentException.class, () -> SaturatingMath.mulDiv(-1, 1, 1, 1));
    }
}
