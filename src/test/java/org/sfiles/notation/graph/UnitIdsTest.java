package org.sfiles.notation.graph;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Optional;
import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.*;

class UnitIdsTest {

    @Test
    @DisplayName("Numbered id splits into type and instance")
    void testNumberedId() {
        assertEquals("pump", UnitIds.typeOf("pump-12"));
        assertEquals(OptionalInt.of(12), UnitIds.instanceOf("pump-12"));
        assertTrue(UnitIds.isNumbered("pump-12"));
        assertEquals("pump", UnitIds.generalize("pump-12"));
    }

    @Test
    @DisplayName("Generalized id has a type and no instance")
    void testGeneralizedId() {
        assertEquals("pump", UnitIds.typeOf("pump"));
        assertEquals(OptionalInt.empty(), UnitIds.instanceOf("pump"));
        assertFalse(UnitIds.isNumbered("pump"));
    }

    @Test
    @DisplayName("Shadow suffix is a positive stream index")
    void testShadowId() {
        assertEquals("hex-1", UnitIds.baseOf("hex-1/2"));
        assertEquals(Optional.of("2"), UnitIds.suffixOf("hex-1/2"));
        assertEquals(OptionalInt.of(2), UnitIds.shadowIndexOf("hex-1/2"));
        assertTrue(UnitIds.isShadow("hex-1/2"));
        assertEquals("hex", UnitIds.typeOf("hex-1/2"));
        assertEquals(OptionalInt.of(1), UnitIds.instanceOf("hex-1/2"));
        assertEquals("hex-1/3", UnitIds.shadow("hex-1", 3));
    }

    @Test
    @DisplayName("Uppercase suffix is a control code, never a shadow")
    void testControlId() {
        assertEquals(Optional.of("FC"), UnitIds.controlCodeOf("C-1/FC"));
        assertFalse(UnitIds.isShadow("C-1/FC"));
        assertTrue(UnitIds.isControlUnit("C-1/FC"));
        assertTrue(UnitIds.isControlUnit("C"));
        assertFalse(UnitIds.isControlUnit("col-1"));
        assertEquals(Optional.empty(), UnitIds.controlCodeOf("hex-1/2"));
    }

    @Test
    @DisplayName("Annotation text is digits or uppercase letters")
    void testAnnotationText() {
        assertTrue(UnitIds.isAnnotationText("1"));
        assertTrue(UnitIds.isAnnotationText("TIR"));
        assertFalse(UnitIds.isAnnotationText("tout"));
        assertFalse(UnitIds.isAnnotationText("1_in"));
        assertTrue(UnitIds.isHeatIntegrationGroup("12"));
        assertFalse(UnitIds.isHeatIntegrationGroup("FC"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", " ", "a(b", "a)b", "a{b", "a}b", "a[b", "a]b", "pump 1"})
    @DisplayName("Ids with structural characters are rejected")
    void testRejectsReservedCharacters(String unitId) {
        assertThrows(IllegalArgumentException.class, () -> UnitIds.requireId(unitId));
    }

    @Test
    @DisplayName("Null id is rejected")
    void testRejectsNull() {
        assertThrows(IllegalArgumentException.class, () -> UnitIds.requireId(null));
    }
}
