package org.pragmatica.purify.transform;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SortWrapperTest {

    @Test
    void wrap_wildcardCall_wrappedWithSort() {
        assertEquals("$(sort $(wildcard src/*.c))", SortWrapper.wrap("$(wildcard src/*.c)", "wildcard", ""));
    }

    @Test
    void wrap_severalCalls_eachWrapped() {
        var result = SortWrapper.wrap("$(wildcard a/*.c) $(wildcard b/*.c)", "wildcard", "");

        assertEquals("$(sort $(wildcard a/*.c)) $(sort $(wildcard b/*.c))", result);
    }

    @Test
    void wrap_alreadySorted_unchanged() {
        var text = "$(sort $(wildcard *.c))";

        assertFalse(SortWrapper.needsWrapping(text, "wildcard", ""));
        assertEquals(text, SortWrapper.wrap(text, "wildcard", ""));
    }

    @Test
    void wrap_sortOfLargerExpression_stillWrapsCall() {
        var text = "$(sort $(wildcard *.c) main.c)";

        assertTrue(SortWrapper.needsWrapping(text, "wildcard", ""));
    }

    @Test
    void wrap_shellFind_onlyMatchesFindCommand() {
        assertEquals("$(sort $(shell find . -name '*.o'))", SortWrapper.wrap("$(shell find . -name '*.o')", "shell", "find"));
        assertFalse(SortWrapper.needsWrapping("$(shell date +%s)", "shell", "find"));
        assertFalse(SortWrapper.needsWrapping("$(shell finder)", "shell", "find"));
    }

    @Test
    void wrap_escapedDollar_ignored() {
        assertFalse(SortWrapper.needsWrapping("$$(wildcard *.c)", "wildcard", ""));
    }
}
