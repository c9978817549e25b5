package com.agentflow.workflow.type;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FieldTypeTest {

    @Test
    void parse_scalarsAndCompounds() {
        assertEquals(FieldKind.STRING, FieldType.parse("str").getKind());
        assertEquals(FieldKind.INTEGER, FieldType.parse(" int ").getKind());
        assertEquals(FieldKind.BOOLEAN, FieldType.parse("bool").getKind());

        FieldType list = FieldType.parse("list[str]");
        assertTrue(list.isList());
        assertEquals(FieldKind.STRING, list.getElementType().getKind());

        FieldType dict = FieldType.parse("dict[str, int]");
        assertEquals(FieldKind.DICT, dict.getKind());
        assertEquals(FieldKind.STRING, dict.getKeyType().getKind());
        assertEquals(FieldKind.INTEGER, dict.getElementType().getKind());

        assertNull(FieldType.parse("list").getElementType());
    }

    @Test
    void parse_unknownTypeThrowsWithTypeString() {
        TypeParseException e = assertThrows(TypeParseException.class, () -> FieldType.parse("string"));
        assertEquals("string", e.getTypeString());
        assertFalse(FieldType.isValid("dict[str]"));
        assertFalse(FieldType.isValid(""));
        assertTrue(FieldType.isValid("list[list[int]]"));
    }

    @Test
    void accepts_checksNumbersAndElements() {
        assertTrue(FieldType.parse("int").accepts(3));
        assertTrue(FieldType.parse("int").accepts(3.0));
        assertFalse(FieldType.parse("int").accepts(3.5));
        assertTrue(FieldType.parse("float").accepts(7));
        assertFalse(FieldType.parse("bool").accepts("true"));
        assertTrue(FieldType.parse("list[str]").accepts(List.of("a", "b")));
        assertFalse(FieldType.parse("list[str]").accepts(List.of("a", 1)));
        assertTrue(FieldType.parse("dict[str,int]").accepts(Map.of("a", 1)));
        assertFalse(FieldType.parse("dict[str,int]").accepts(Map.of("a", "x")));
        assertFalse(FieldType.parse("str").accepts(null));
    }

    @Test
    void normalize_widensNumbers() {
        assertEquals(5L, FieldType.parse("int").normalize(5));
        assertEquals(2.0, FieldType.parse("float").normalize(2));
        assertEquals(List.of(1L, 2L), FieldType.parse("list[int]").normalize(List.of(1, 2.0)));
    }

    @Test
    void equals_ignoresSpellingOfSameType() {
        assertEquals(FieldType.parse("dict[str,int]"), FieldType.parse("dict[str, int]"));
        assertEquals(FieldType.listOf(FieldType.of(FieldKind.STRING)), FieldType.parse("list[str]"));
    }
}
