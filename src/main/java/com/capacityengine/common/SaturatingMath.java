package com.capacityengine.common;

import java.math.BigInteger;

/**
 * Overflow-free arithmetic on non-negative longs. Results clamp at {@link Long#MAX_VALUE}
 * and zero instead of wrapping.
 */
public final class SaturatingMath {

    private static final BigInteger LONG_MAX = BigInteger.valueOf(Long.MAX_VALUE);

    private SaturatingMath() {
    }

    public static long add(long a, long b) {
        long sum = a + b;
        if (((a ^ sum) & (b ^ sum)) < 0) {
            return sum < 0 ? Long.MAX_VALUE : Long.MIN_VALUE;
        }
        return sum;
    }

    /**
     * Subtracts, never going below zero.
     */
    public static long subtractToZero(long a, long b) {
        return b >= a ? 0 : a - b;
    }

    /**
     * Computes {@code floor(a * b * c / divisor)} exactly, saturating at {@link Long#MAX_VALUE}.
     */
    public static long mulDiv(long a, long b, long c, long divisor) {
        if (divisor <= 0) {
            throw new IllegalArgumentException("Divisor must be positive: " + divisor);
        }
        if (a < 0 || b < 0 || c < 0) {
            throw new IllegalArgumentException("Operands must be non-negative");
        }
        BigInteger result = BigInteger.valueOf(a)
            .multiply(BigInteger.valueOf(b))
            .multiply(BigInteger.valueOf(c))
            .divide(BigInteger.valueOf(divisor));
        return result.compareTo(LONG_MAX) > 0 ? Long.MAX_VALUE : result.longValue();
    }
}
