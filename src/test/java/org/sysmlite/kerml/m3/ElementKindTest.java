package org.sysmlite.kerml.m3;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ElementKindTest {

    @Test
    void everyKindIsItsOwnKindAndAnElement() {
        for (ElementKind kind : ElementKind.values()) {
            assertTrue(kind.isKind(kind), kind::name);
            assertTrue(kind.isKind(ElementKind.ELEMENT), kind::name);
        }
    }

    @Test
    void followsEverySuperKind() {
        assertTrue(ElementKind.CONNECTION_DEFINITION.isKind(ElementKind.PART_DEFINITION));
        assertTrue(ElementKind.CONNECTION_DEFINITION.isKind(ElementKind.ASSOCIATION_STRUCTURE));
        assertTrue(ElementKind.CONNECTION_DEFINITION.isKind(ElementKind.ASSOCIATION));
        assertTrue(ElementKind.CONNECTION_DEFINITION.isKind(ElementKind.CLASS));
        assertFalse(ElementKind.PART_DEFINITION.isKind(ElementKind.CONNECTION_DEFINITION));
        assertFalse(ElementKind.CLASS.isKind(ElementKind.DATA_TYPE));
    }

    @Test
    void matchesAnyOfSeveralKinds() {
        assertTrue(ElementKind.STRUCTURE.isAny(ElementKind.DATA_TYPE, ElementKind.CLASS));
        assertFalse(ElementKind.PACKAGE.isAny(ElementKind.TYPE, ElementKind.RELATIONSHIP));
    }

    @Test
    void displayName() {
        assertEquals("PartDefinition", ElementKind.PART_DEFINITION.displayName());
    }
}
