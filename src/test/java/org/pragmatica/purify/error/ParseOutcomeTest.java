package org.pragmatica.purify.error;

import org.pragmatica.purify.tree.SourceLocation;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ParseOutcomeTest {

    private static final ParseError ERROR = new ParseError.UnexpectedEof(SourceLocation.at(2, 4, 10), "'fi'");

    @Test
    void success_unwrapsAndMaps() {
        var outcome = ParseOutcome.success("abc").map(String::length);

        assertTrue(outcome.isSuccess());
        assertEquals(3, outcome.unwrap());
        assertThrows(IllegalStateException.class, outcome::error);
    }

    @Test
    void failure_propagatesThroughMapAndFlatMap() {
        ParseOutcome<String> outcome = ParseOutcome.failure(ERROR);

        var mapped = outcome.map(String::length).flatMap(n -> ParseOutcome.success(n + 1));

        assertTrue(mapped.isFailure());
        assertSame(ERROR, mapped.error());
        var thrown = assertThrows(IllegalStateException.class, mapped::unwrap);
        assertTrue(thrown.getMessage().contains("Unexpected end of input"));
    }

    @Test
    void fold_choosesBranch() {
        assertEquals("ok:1", ParseOutcome.success(1).fold(error -> "error", value -> "ok:" + value));
        assertEquals("error", ParseOutcome.<Integer>failure(ERROR).fold(error -> "error", value -> "ok:" + value));
    }

    @Test
    void flatMap_successCanFail() {
        var outcome = ParseOutcome.success("x").flatMap(value -> ParseOutcome.<Integer>failure(ERROR));

        assertTrue(outcome.isFailure());
    }

    // === Errors ===

    @Test
    void describe_usesFileLineAndColumn() {
        assertEquals("build.sh:2:4: Unexpected end of input at 2:4, expected 'fi'", ERROR.describe(Optional.of("build.sh")));
        assertTrue(ERROR.describe(Optional.empty()).startsWith("<input>:2:4: "));
    }

    @Test
    void messages_nameTheMissingPiece() {
        var location = SourceLocation.at(1, 1, 0);

        assertEquals("'case' at 1:1 is never closed, expected 'esac'",
                     new ParseError.UnterminatedBlock(location, "case", "esac").message());
        assertEquals("'esac'", new ParseError.UnterminatedBlock(location, "case", "esac").expected());
        assertEquals("closing \"", new ParseError.UnterminatedQuote(location, "\"").expected());
        assertEquals("Invalid C-style for clause '((i=0; i<3))' at 1:1: found 2 clauses, expected three",
                     new ParseError.InvalidForClause(location, "i=0; i<3", 2).message());
        assertEquals("Nesting exceeds 100 levels at 1:1", new ParseError.NestingTooDeep(location, 100).message());
    }

    @Test
    void toDiagnostic_labelsExpectation() {
        var diagnostic = ERROR.toDiagnostic();

        assertEquals(Diagnostic.Severity.ERROR, diagnostic.severity());
        assertEquals(Optional.of("parse"), diagnostic.code());
        assertEquals(1, diagnostic.labels().size());
        var label = diagnostic.labels().get(0);
        assertEquals("expected 'fi'", label.message());
    }
}
