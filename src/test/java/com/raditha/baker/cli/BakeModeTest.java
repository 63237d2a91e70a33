package com.raditha.baker.cli;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class BakeModeTest {

    @Test
    void testFromString_ValidValues() {
        assertEquals(BakeMode.CHECK, BakeMode.fromString("check"));
        assertEquals(BakeMode.FIX, BakeMode.fromString("fix"));
        assertEquals(BakeMode.DRY_RUN, BakeMode.fromString("dry-run"));
    }

    @Test
    void testFromString_CaseInsensitive() {
        assertEquals(BakeMode.CHECK, BakeMode.fromString("CHECK"));
        assertEquals(BakeMode.FIX, BakeMode.fromString("Fix"));
        assertEquals(BakeMode.DRY_RUN, BakeMode.fromString("DRY-RUN"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"invalid", "dry_run", "", "fixes"})
    void testFromString_InvalidValues(String invalidValue) {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> BakeMode.fromString(invalidValue)
        );
        assertTrue(exception.getMessage().contains("Invalid bake mode"));
        assertTrue(exception.getMessage().contains("Must be: check, fix, or dry-run"));
    }

    @Test
    void testFromString_NullValue() {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> BakeMode.fromString(null)
        );
        assertEquals("BakeMode value cannot be null", exception.getMessage());
    }

    @Test
    void testIsFixing() {
        assertFalse(BakeMode.CHECK.isFixing());
        assertTrue(BakeMode.FIX.isFixing());
        assertTrue(BakeMode.DRY_RUN.isFixing());
    }

    @Test
    void testRoundTrip() {
        for (BakeMode mode : BakeMode.values()) {
            assertEquals(mode, BakeMode.fromString(mode.toCliString()));
        }
    }
}
