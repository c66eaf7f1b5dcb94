package com.rusttrace.adapter.static_analysis;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NamespaceContextTest {

    private static final List<NamespaceContext> SAMPLES = List.of(
        NamespaceContext.EMPTY,
        NamespaceContext.of("main"),
        NamespaceContext.fromString("parser.lexer"),
        NamespaceContext.of("a", "b", "c")
    );

    @Test
    void emptyStringIsEmptyContext() {
        assertSame(NamespaceContext.EMPTY, NamespaceContext.fromString(""));
        assertTrue(NamespaceContext.fromString("").isEmpty());
        assertEquals("", NamespaceContext.EMPTY.toString());
    }

    @Test
    void fromStringSplitsOnDots() {
        NamespaceContext context = NamespaceContext.fromString("main.parser.Lexer");
        assertEquals(List.of("main", "parser", "Lexer"), context.segments());
        assertEquals("main.parser.Lexer", context.toString());
    }

    @Test
    void combineConcatenatesSegments() {
        NamespaceContext combined = NamespaceContext.of("main").combine("inline").combine(NamespaceContext.of("S"));
        assertEquals(NamespaceContext.of("main", "inline", "S"), combined);
    }

    @Test
    void emptyIsTwoSidedIdentity() {
        for (NamespaceContext a : SAMPLES) {
            assertEquals(a, NamespaceContext.EMPTY.combine(a));
            assertEquals(a, a.combine(NamespaceContext.EMPTY));
        }
    }

    @Test
    void combineIsAssociative() {
        for (NamespaceContext a : SAMPLES) {
            for (NamespaceContext b : SAMPLES) {
                for (NamespaceContext c : SAMPLES) {
                    assertEquals(a.combine(b).combine(c), a.combine(b.combine(c)),
                        "(" + a + "," + b + "," + c + ")");
                }
            }
        }
    }

    @Test
    void sumCombinesLeftToRight() {
        assertEquals(NamespaceContext.EMPTY, NamespaceContext.sum(List.of()));
        List<NamespaceContext> stack = List.of(
            NamespaceContext.of("a", "b"), NamespaceContext.EMPTY, NamespaceContext.fromString("c.main"));
        assertEquals("a.b.c.main", NamespaceContext.sum(stack).toString());
    }
}
