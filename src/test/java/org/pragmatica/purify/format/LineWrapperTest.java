package org.pragmatica.purify.format;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.*;

class LineWrapperTest {

    // === Joining ===

    @Test
    void join_continuationSegments_collapsesToOneLine() {
        var joined = LineWrapper.join(List.of("apt-get install \\", "    curl \\", "    wget"));

        assertEquals("apt-get install curl wget", joined);
    }

    @Test
    void join_singleSegment_unchanged() {
        assertEquals("echo hi", LineWrapper.join(List.of("echo hi")));
    }

    @Test
    void stripContinuation_removesBackslashAndBlanks() {
        assertEquals("foo", LineWrapper.stripContinuation("foo  \\  "));
        assertEquals("bar", LineWrapper.stripContinuation("bar"));
    }

    // === Wrapping ===

    @Test
    void wrap_longLine_breaksAtLastBlankThatFits() {
        var lines = LineWrapper.wrap("echo aaaa bbbb cccc dddd", 20, "    ");

        assertEquals(List.of("echo aaaa bbbb \\", "    cccc dddd"), lines);
    }

    @Test
    void wrap_shortLine_unchanged() {
        assertEquals(List.of("echo hi"), LineWrapper.wrap("echo hi", 20, "  "));
    }

    @Test
    void wrap_noBlank_returnsLineAsIs() {
        var line = "x".repeat(30);

        assertEquals(List.of(line), LineWrapper.wrap(line, 20, "  "));
    }

    @Test
    void wrap_quotedBlanks_neverSplit() {
        var lines = LineWrapper.wrap("echo 'a b c d e f g h i j k'", 20, "  ");

        assertEquals(List.of("echo \\", "  'a b c d e f g h i j k'"), lines);
    }

    @Test
    void wrap_joinedBack_restoresLine() {
        var line = "gcc -O2 -Wall -Wextra -o build/app src/main.c src/util.c";

        assertEquals(line, LineWrapper.join(LineWrapper.wrap(line, 24, "    ")));
    }

    // === Options ===

    @Test
    void formatOptions_tinyLineLength_rejected() {
        assertThrows(IllegalArgumentException.class,
                     () -> new FormatOptions(false, OptionalInt.of(10), false, false));
    }

    @Test
    void formatOptions_preserveFormatting_disablesCleanup() {
        var options = new FormatOptions(true, OptionalInt.empty(), false, false);

        assertFalse(options.removeBlankLines());
        assertFalse(options.joinContinuations());
        assertTrue(FormatOptions.DEFAULT.removeBlankLines());
    }
}
