package com.capacityengine.common;

import com.capacityengine.common.exception.InvalidAmountException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AssetRatioTest {

    private final AssetRatio ratio = AssetRatio.fromPartsPerMillion(100);

    @Test
    void testConvertsLockedAmountToMicroTps() {
        assertEquals(50_000, ratio.microTpsFor(500));
        assertEquals(100_000, ratio.microTpsFor(1_000));
    }

    @Test
    void testFullRatioConvertsOneUnitToOneTps() {
        assertEquals(1_000_000, AssetRatio.fromPartsPerMillion(1_000_000).microTpsFor(1));
    }

    @Test
    void testZeroOrNegativeAmountIsInvalid() {
        assertThrows(InvalidAmountException.class, () -> ratio.microTpsFor(0));
        assertThrows(InvalidAmountException.class, () -> ratio.microTpsFor(-10));
    }

    @Test
    void testAmountConvertingToZeroIsInvalid() {
        assertThrows(InvalidAmountException.class, () -> AssetRatio.fromPartsPerMillion(0).microTpsFor(1_000));
    }

    @Test
    void testRateAboveUnsigned32BitRangeIsInvalid() {
        // 42,949,673 * 100 = 4,294,967,300 > 4,294,967,295
        assertEquals(4_294_967_200L, ratio.microTpsFor(42_949_672));
        assertThrows(InvalidAmountException.class, () -> ratio.microTpsFor(42_949_673));
        assertThrows(InvalidAmountException.class, () -> ratio.microTpsFor(Long.MAX_VALUE));
    }

    @Test
    void testRatioOutsideUnitIntervalIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> AssetRatio.fromPartsPerMillion(1_000_001));
        assertThrows(IllegalArgumentException.class, () -> AssetRatio.fromPartsPerMillion(-1));
    }
}
