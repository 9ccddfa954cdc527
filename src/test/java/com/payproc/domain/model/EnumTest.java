package com.payproc.domain.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for enums
 */
class EnumTest {

    @Test
    void testActivityType() {
        // Test fromValue
        assertEquals(ActivityType.DEPOSIT, ActivityType.fromValue("deposit"));
        assertEquals(ActivityType.WITHDRAWAL, ActivityType.fromValue("withdrawal"));
        assertEquals(ActivityType.DISPUTE, ActivityType.fromValue("dispute"));
        assertEquals(ActivityType.RESOLVE, ActivityType.fromValue("resolve"));
        assertEquals(ActivityType.CHARGEBACK, ActivityType.fromValue("chargeback"));

        // Test case sensitivity
        assertThrows(IllegalArgumentException.class, () -> ActivityType.fromValue("DEPOSIT"));
        assertFalse(ActivityType.isValid("ChargeBack"));

        // Test isValid
        assertTrue(ActivityType.isValid("resolve"));
        assertFalse(ActivityType.isValid("transfer"));
        assertFalse(ActivityType.isValid(""));

        // Test getValue
        assertEquals("withdrawal", ActivityType.WITHDRAWAL.getValue());

        // Test invalid value
        assertThrows(IllegalArgumentException.class, () -> ActivityType.fromValue("transfer"));
    }

    @Test
    void testCarriesAmount() {
        assertTrue(ActivityType.DEPOSIT.carriesAmount());
        assertTrue(ActivityType.WITHDRAWAL.carriesAmount());
        assertFalse(ActivityType.DISPUTE.carriesAmount());
        assertFalse(ActivityType.RESOLVE.carriesAmount());
        assertFalse(ActivityType.CHARGEBACK.carriesAmount());
    }
}
