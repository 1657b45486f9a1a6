package com.capacityengine.common;

import com.capacityengine.common.exception.InvalidAmountException;
import lombok.Value;

/**
 * Conversion rate from locked asset units to throughput, as a fraction in [0, 1]
 * expressed in parts per million.
 *
 * One asset unit converts to {@code ratio} TPS, so {@code amount} units give
 * {@code floor(amount * ratio * 1,000,000)} micro-TPS.
 */
@Value
public class AssetRatio {

    public static final long PARTS = 1_000_000L;
    public static final long MAX_MICRO_TPS = 4_294_967_295L;

    long partsPerMillion;

    public static AssetRatio fromPartsPerMillion(long partsPerMillion) {
        if (partsPerMillion < 0 || partsPerMillion > PARTS) {
            throw new IllegalArgumentException("Ratio must be within 0..1000000 ppm: " + partsPerMillion);
        }
        return new AssetRatio(partsPerMillion);
    }

    /**
     * Converts a locked amount into a lifetime rate.
     *
     * @throws InvalidAmountException when the amount is not positive, or the rate is zero
     *         or does not fit an unsigned 32-bit value
     */
    public long microTpsFor(long amount) {
        if (amount <= 0) {
            throw new InvalidAmountException("Locked amount must be positive: " + amount);
        }
        long microTps = SaturatingMath.mulDiv(amount, partsPerMillion, PARTS, PARTS);
        if (microTps == 0) {
            throw new InvalidAmountException("Locked amount " + amount + " converts to zero throughput");
        }
        if (microTps > MAX_MICRO_TPS) {
            throw new InvalidAmountException("Locked amount " + amount + " exceeds the maximal throughput");
        }
        return microTps;
    }
}
