package com.finvolv.lease.model;

import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for RentTiers
 */
class RentTiersTest {

    @Test
    void testAmountForYear_OneBasedAndOutOfRange() {
        RentTiers tiers = RentTiers.of(100.0, 200.0);

        assertEquals(100.0, tiers.amountForYear(1));
        assertEquals(200.0, tiers.amountForYear(2));
        assertNull(tiers.amountForYear(0));
        assertNull(tiers.amountForYear(3));
        assertEquals(0.0, tiers.amountOrZero(3));
    }

    @Test
    void testPresentCount_AbsentAndZeroAreNotPresent() {
        RentTiers tiers = RentTiers.of(Arrays.asList(100.0, null, 0.0, 300.0));

        assertEquals(4, tiers.size());
        assertEquals(2, tiers.presentCount());
        assertFalse(tiers.isPresent(2));
        assertFalse(tiers.isPresent(3));
        assertNull(tiers.amountForYear(2));
        assertEquals(0.0, tiers.amountForYear(3));
    }

    @Test
    void testPadTo_AddsAbsentEntriesWithoutTruncating() {
        RentTiers tiers = RentTiers.of(100.0);

        RentTiers padded = tiers.padTo(3);
        assertEquals(3, padded.size());
        assertEquals(Arrays.asList(100.0, null, null), padded.asList());
        assertEquals(1, padded.presentCount());

        assertSame(padded, padded.padTo(2));
        assertEquals(3, padded.padTo(2).size());
    }

    @Test
    void testAsList_IsUnmodifiable() {
        RentTiers tiers = RentTiers.of(100.0);
        assertThrows(UnsupportedOperationException.class, () -> tiers.asList().add(1.0));
    }
}
