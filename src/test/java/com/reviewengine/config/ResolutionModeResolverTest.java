package com.reviewengine.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ResolutionModeResolverTest {

    @Test
    void testOrdered() {
        ResolutionModeResolver resolver = new ResolutionModeResolver("ordered");

        assertTrue(resolver.isOrdered());
        assertFalse(resolver.isTwoPhase());
        assertEquals(ResolutionMode.ORDERED, resolver.getMode());
    }

    @Test
    void testTwoPhaseSpellings() {
        assertEquals(ResolutionMode.TWO_PHASE, new ResolutionModeResolver("two-phase").getMode());
        assertEquals(ResolutionMode.TWO_PHASE, new ResolutionModeResolver("TWO_PHASE").getMode());
        assertEquals(ResolutionMode.TWO_PHASE, new ResolutionModeResolver(" Two-Phase ").getMode());
    }

    @Test
    void testBlankFallsBackToOrdered() {
        assertEquals(ResolutionMode.ORDERED, new ResolutionModeResolver("").getMode());
    }

    @Test
    void testUnknownModeIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new ResolutionModeResolver("lazy"));
    }
}
