package org.pragmatica.purify.make;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MakeFunctionsTest {

    @Test
    void calls_findsEveryCallInOrder() {
        var text = "$(wildcard src/*.c) $(wildcard lib/*.c)";

        var calls = MakeFunctions.calls(text, "wildcard");

        assertEquals(List.of("$(wildcard src/*.c)", "$(wildcard lib/*.c)"),
                     calls.stream().map(call -> call.text(text)).toList());
    }

    @Test
    void calls_nestedParentheses_closeAtMatchingDelimiter() {
        var text = "$(wildcard $(addprefix src/,*.c)) tail";

        var call = MakeFunctions.calls(text, "wildcard").get(0);

        assertEquals("$(wildcard $(addprefix src/,*.c))", call.text(text));
    }

    @Test
    void calls_sortArgument_markedSorted() {
        var calls = MakeFunctions.calls("$(sort $(wildcard *.c))", "wildcard");

        assertEquals(1, calls.size());
        var call = calls.get(0);
        assertTrue(call.sorted());
    }

    @Test
    void calls_escapedDollar_ignored() {
        assertTrue(MakeFunctions.calls("$$(wildcard *.c)", "wildcard").isEmpty());
    }

    @Test
    void calls_shellCommandFilter_matchesWholeWord() {
        assertEquals(1, MakeFunctions.calls("$(shell find . -name '*.o')", "shell", "find").size());
        assertTrue(MakeFunctions.calls("$(shell finder .)", "shell", "find").isEmpty());
        assertTrue(MakeFunctions.calls("$(shell date)", "shell", "find").isEmpty());
    }

    @Test
    void calls_bracedForm_recognized() {
        assertEquals(1, MakeFunctions.calls("${wildcard *.h}", "wildcard").size());
    }

    @Test
    void unsortedCalls_skipsSortedOnes() {
        var text = "$(sort $(wildcard a/*)) $(wildcard b/*)";

        var unsorted = MakeFunctions.unsortedCalls(text, "wildcard", "");

        assertEquals(1, unsorted.size());
        var call = unsorted.get(0);
        assertEquals("$(wildcard b/*)", call.text(text));
    }

    @Test
    void closingIndex_unbalanced_returnsMinusOne() {
        assertEquals(-1, MakeFunctions.closingIndex("$(wildcard *.c", 1));
    }
}
