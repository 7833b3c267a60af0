package org.natded.support;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class IdentifiersTest {

    @Test
    void lowercaseInitialIsVariable() {
        assertTrue(Identifiers.isVariableName("x"));
        assertTrue(Identifiers.isVariableName("x'"));
        assertTrue(Identifiers.isVariableName("αβ"));
        assertFalse(Identifiers.isVariableName("X"));
        assertFalse(Identifiers.isVariableName("⊥"));
        assertFalse(Identifiers.isVariableName("_"));
    }

    @Test
    void upperCaseInitial() {
        assertTrue(Identifiers.startsUpperCase("P"));
        assertTrue(Identifiers.startsUpperCase("Δx"));
        assertFalse(Identifiers.startsUpperCase("p"));
        assertFalse(Identifiers.startsUpperCase("_"));
    }

    @Test
    void quantifierKeywordPrefix() {
        assertTrue(Identifiers.startsWithQuantifierKeyword("forallx"));
        assertTrue(Identifiers.startsWithQuantifierKeyword("exists"));
        assertFalse(Identifiers.startsWithQuantifierKeyword("fora"));
        assertFalse(Identifiers.startsWithQuantifierKeyword("Forallx"));

        assertEquals("x", Identifiers.stripQuantifierKeyword("forallx"));
        assertEquals("y'", Identifiers.stripQuantifierKeyword("existsy'"));
        assertEquals("", Identifiers.stripQuantifierKeyword("forall"));
        assertThrows(IllegalArgumentException.class, () -> Identifiers.stripQuantifierKeyword("p"));
    }

    @Test
    void emptyNameRejected() {
        assertThrows(IllegalArgumentException.class, () -> Identifiers.isVariableName(""));
        assertThrows(IllegalArgumentException.class, () -> Identifiers.startsUpperCase(null));
    }
}
