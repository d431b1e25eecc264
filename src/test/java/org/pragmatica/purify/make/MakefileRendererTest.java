package org.pragmatica.purify.make;

import org.pragmatica.purify.format.FormatOptions;
import org.junit.jupiter.api.Test;

import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.*;

class MakefileRendererTest {

    private static String roundTrip(String source, FormatOptions options) {
        return MakefileRenderer.render(MakefileParser.parse(source).unwrap(), options);
    }

    @Test
    void render_normalizesAssignmentsAndRules() {
        var source = "CC=gcc\napp:main.o\n\t$(CC) -o app main.o\n";

        assertEquals("CC = gcc\napp: main.o\n\t$(CC) -o app main.o\n", roundTrip(source, FormatOptions.DEFAULT));
    }

    @Test
    void render_blankLines_removedByDefault() {
        var source = "A = 1\n\nB = 2\n";

        assertEquals("A = 1\nB = 2\n", roundTrip(source, FormatOptions.DEFAULT));
        assertEquals(source, roundTrip(source, new FormatOptions(false, OptionalInt.empty(), true, false)));
    }

    @Test
    void render_continuations_joinedUnlessKept() {
        var source = "SRCS = a.c \\\n  b.c\n";

        assertEquals("SRCS = a.c b.c\n", roundTrip(source, FormatOptions.DEFAULT));
        assertEquals(source, roundTrip(source, new FormatOptions(false, OptionalInt.empty(), false, true)));
    }

    @Test
    void render_preserveFormatting_keepsOriginalText() {
        var source = "FLAGS   :=   -O2\n\nLIBS=-lm\n";

        assertEquals(source, roundTrip(source, new FormatOptions(true, OptionalInt.empty(), false, false)));
    }

    @Test
    void render_conditionalAndDefine_roundTrip() {
        var source = """
            ifeq ($(OS),Windows_NT)
            EXE = .exe
            else ifdef CROSS
            EXE = .bin
            else
            EXE =
            endif
            define BANNER
            Building $(APP)
            endef
            """;

        assertEquals(source, roundTrip(source, FormatOptions.DEFAULT));
    }

    @Test
    void render_maxLineLength_wrapsRecipes() {
        var source = "all:\n\tgcc -O2 -Wall -o build/app main.c util.c\n";

        var text = roundTrip(source, FormatOptions.DEFAULT.withMaxLineLength(24));

        assertTrue(text.startsWith("all:\n\tgcc -O2 -Wall -o \\\n"), text);
        assertTrue(text.lines().skip(2).allMatch(line -> line.startsWith("\t    ")), text);
    }
}
