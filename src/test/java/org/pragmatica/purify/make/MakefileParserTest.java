package org.pragmatica.purify.make;

import org.pragmatica.purify.error.ParseError;
import org.pragmatica.purify.make.MakeItem.Flavor;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class MakefileParserTest {

    private static List<MakeItem> parse(String source) {
        var result = MakefileParser.parse(source);
        assertTrue(result.isSuccess(), () -> "Parse failed: " + result.error().message());
        return result.unwrap().items();
    }

    private static ParseError parseError(String source) {
        var result = MakefileParser.parse(source);
        assertTrue(result.isFailure(), "Expected parse failure for: " + source);
        return result.error();
    }

    // === Variables ===

    @Test
    void parse_assignmentFlavors_recognized() {
        var items = parse("""
            A = 1
            B := 2
            C ?= 3
            D += 4
            E != date
            F ::= 6
            """);

        assertEquals(List.of(Flavor.RECURSIVE, Flavor.SIMPLE, Flavor.CONDITIONAL, Flavor.APPEND, Flavor.SHELL, Flavor.POSIX_SIMPLE),
                     items.stream().map(item -> ((MakeItem.Variable) item).flavor()).toList());
    }

    @Test
    void parse_variableValue_isStripped() {
        var variable = assertInstanceOf(MakeItem.Variable.class, parse("CFLAGS :=   -O2 -Wall  \n").get(0));

        assertEquals("CFLAGS", variable.name());
        assertEquals("-O2 -Wall", variable.value());
    }

    @Test
    void parse_exportOverride_setModifiers() {
        var variable = assertInstanceOf(MakeItem.Variable.class, parse("override export PREFIX = /usr\n").get(0));

        assertTrue(variable.exported());
        assertTrue(variable.override());
    }

    @Test
    void parse_continuationLines_joinedIntoValue() {
        var variable = assertInstanceOf(MakeItem.Variable.class, parse("SRCS = a.c \\\n       b.c \\\n       c.c\n").get(0));

        assertEquals("a.c b.c c.c", variable.value());
        assertEquals(3, variable.segments().size());
        assertEquals(3, variable.span().end().line());
    }

    @Test
    void parse_functionCallWithColon_staysAssignment() {
        var variable = assertInstanceOf(MakeItem.Variable.class, parse("OBJS := $(SRCS:.c=.o)\n").get(0));

        assertEquals("$(SRCS:.c=.o)", variable.value());
    }

    // === Rules ===

    @Test
    void parse_target_collectsRecipeLines() {
        var target = assertInstanceOf(MakeItem.Target.class, parse("""
            app: main.o util.o | build
            \t$(CC) -o $@ $^
            \tstrip $@
            """).get(0));

        assertEquals("app", target.name());
        assertEquals(List.of("main.o", "util.o"), target.prerequisites());
        assertEquals(List.of("build"), target.orderOnly());
        assertEquals(List.of("$(CC) -o $@ $^", "strip $@"), target.recipe().stream().map(MakeItem.RecipeLine::text).toList());
    }

    @Test
    void parse_inlineRecipe_kept() {
        var target = assertInstanceOf(MakeItem.Target.class, parse("clean: ; rm -f *.o\n").get(0));

        assertEquals(Optional.of("rm -f *.o"), target.inlineRecipe());
    }

    @Test
    void parse_patternRule_isPatternRule() {
        var rule = assertInstanceOf(MakeItem.PatternRule.class, parse("%.o: %.c\n\t$(CC) -c $<\n").get(0));

        assertEquals("%.o", rule.targetPattern());
        assertEquals(1, rule.recipe().size());
    }

    @Test
    void parse_phonyDeclaration_marksTargets() {
        var items = parse("""
            .PHONY: clean
            clean:
            \trm -f app
            build:
            \tmake app
            """);

        var clean = assertInstanceOf(MakeItem.Target.class, items.get(1));
        var build = assertInstanceOf(MakeItem.Target.class, items.get(2));
        assertTrue(clean.phony());
        assertFalse(build.phony());
    }

    @Test
    void parse_doubleColonRule_flagged() {
        var target = assertInstanceOf(MakeItem.Target.class, parse("all:: one\n").get(0));

        assertTrue(target.doubleColon());
    }

    // === Blocks ===

    @Test
    void parse_conditional_splitsBranches() {
        var conditional = assertInstanceOf(MakeItem.Conditional.class, parse("""
            ifeq ($(OS),Windows_NT)
            EXE = .exe
            else
            EXE =
            endif
            """).get(0));

        assertEquals("ifeq", conditional.directive());
        assertEquals("($(OS),Windows_NT)", conditional.arguments());
        assertEquals(1, conditional.thenItems().size());
        assertEquals(1, conditional.elseItems().size());
    }

    @Test
    void parse_elseIfChain_nestsConditional() {
        var conditional = assertInstanceOf(MakeItem.Conditional.class, parse("""
            ifdef DEBUG
            CFLAGS = -g
            else ifdef PROFILE
            CFLAGS = -pg
            endif
            """).get(0));

        assertTrue(conditional.elseChained());
        assertEquals("ifdef", assertInstanceOf(MakeItem.Conditional.class, conditional.elseItems().get(0)).directive());
    }

    @Test
    void parse_define_keepsBodyLines() {
        var define = assertInstanceOf(MakeItem.Define.class, parse("""
            define HELP
            usage: make target
            endef
            """).get(0));

        assertEquals("HELP", define.name());
        assertEquals(List.of("usage: make target"), define.lines());
    }

    @Test
    void parse_includeAndComment_recognized() {
        var items = parse("# settings\n-include local.mk\n\n");

        assertEquals(" settings", assertInstanceOf(MakeItem.Comment.class, items.get(0)).text());
        var include = assertInstanceOf(MakeItem.Include.class, items.get(1));
        assertTrue(include.optional());
        assertInstanceOf(MakeItem.Blank.class, items.get(2));
    }

    // === Errors ===

    @Test
    void parse_recipeBeforeTarget_rejected() {
        var error = assertInstanceOf(ParseError.InvalidSyntax.class, parseError("\techo orphan\n"));

        assertEquals(1, error.location().line());
    }

    @Test
    void parse_missingEndif_reportsBlock() {
        var error = assertInstanceOf(ParseError.UnterminatedBlock.class, parseError("ifdef X\nA = 1\n"));

        assertEquals("ifdef", error.opener());
        assertEquals("endif", error.closer());
    }

    @Test
    void parse_strayEndif_reportsUnexpected() {
        assertInstanceOf(ParseError.UnexpectedInput.class, parseError("endif\n"));
    }

    @Test
    void parse_missingEndef_reportsBlock() {
        var error = assertInstanceOf(ParseError.UnterminatedBlock.class, parseError("define X\nbody\n"));

        assertEquals("endef", error.closer());
    }

    // === Metadata ===

    @Test
    void statementCount_skipsLayout() {
        var makefile = MakefileParser.parse("# c\n\nA = 1\nall:\n\techo $(A)\n").unwrap();

        assertEquals(3, makefile.statementCount());
    }
}
