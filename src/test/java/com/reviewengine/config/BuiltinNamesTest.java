package com.reviewengine.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BuiltinNamesTest {

    @Test
    void testDefaultResourceHoldsPythonBuiltins() {
        BuiltinNames builtins = BuiltinNames.defaults();

        assertTrue(builtins.contains("print"));
        assertTrue(builtins.contains("len"));
        assertTrue(builtins.contains("ValueError"));
        assertTrue(builtins.contains("__name__"));
        assertFalse(builtins.contains("numpy"));
        assertFalse(builtins.getNames().stream().anyMatch(name -> name.startsWith("#")));
    }

    @Test
    void testNamesAreReadOnly() {
        BuiltinNames builtins = BuiltinNames.defaults();

        assertThrows(UnsupportedOperationException.class, () -> builtins.getNames().add("extra"));
    }

    @Test
    void testMissingResourceFails() {
        assertThrows(IllegalStateException.class, () -> new BuiltinNames("no-such-builtins.txt"));
    }
}
