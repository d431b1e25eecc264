package org.pragmatica.purify.error;

import org.pragmatica.purify.tree.SourceLocation;
import org.pragmatica.purify.tree.SourceSpan;

import java.util.Optional;

/**
 * Fatal parse error with location and the grammar expectation that was not met.
 */
public sealed interface ParseError {
    SourceLocation location();

    /**
     * What the parser was looking for when it gave up.
     */
    String expected();

    String message();

    /**
     * One-line report in {@code file:line:column: message} form.
     */
    default String describe(Optional<String> file) {
        return file.orElse("<input>") + ":" + location().line() + ":" + location().column() + ": " + message();
    }

    default Diagnostic toDiagnostic() {
        return Diagnostic.error("parse", message(), SourceSpan.at(location()))
                         .withLabel("expected " + expected());
    }

    /**
     * Unexpected input error.
     */
    record UnexpectedInput(
    SourceLocation location,
    String found,
    String expected) implements ParseError {
        @Override
        public String message() {
            return "Unexpected '" + found + "' at " + location + ", expected " + expected;
        }
    }

    /**
     * Unexpected end of input.
     */
    record UnexpectedEof(
    SourceLocation location,
    String expected) implements ParseError {
        @Override
        public String message() {
            return "Unexpected end of input at " + location + ", expected " + expected;
        }
    }

    /**
     * Quoted string, substitution or expansion that never closes.
     */
    record UnterminatedQuote(
    SourceLocation location,
    String closer) implements ParseError {
        @Override
        public String expected() {
            return "closing " + closer;
        }

        @Override
        public String message() {
            return "Unterminated quoting started at " + location + ", expected closing " + closer;
        }
    }

    /**
     * Here-document whose delimiter line is missing.
     */
    record UnterminatedHereDoc(
    SourceLocation location,
    String delimiter) implements ParseError {
        @Override
        public String expected() {
            return "here-document delimiter '" + delimiter + "'";
        }

        @Override
        public String message() {
            return "Here-document started at " + location + " is missing its delimiter '" + delimiter + "'";
        }
    }

    /**
     * Compound construct without its closing keyword ({@code case} without {@code esac}, and so on).
     */
    record UnterminatedBlock(
    SourceLocation location,
    String opener,
    String closer) implements ParseError {
        @Override
        public String expected() {
            return "'" + closer + "'";
        }

        @Override
        public String message() {
            return "'" + opener + "' at " + location + " is never closed, expected '" + closer + "'";
        }
    }

    /**
     * C-style for header that does not hold exactly three clauses.
     */
    record InvalidForClause(
    SourceLocation location,
    String header,
    int clauses) implements ParseError {
        @Override
        public String expected() {
            return "three ';'-separated clauses";
        }

        @Override
        public String message() {
            return "Invalid C-style for clause '((" + header + "))' at " + location
                   + ": found " + clauses + " clauses, expected three";
        }
    }

    /**
     * Input nested deeper than the parser's recursion limit.
     */
    record NestingTooDeep(
    SourceLocation location,
    int limit) implements ParseError {
        @Override
        public String expected() {
            return "at most " + limit + " nesting levels";
        }

        @Override
        public String message() {
            return "Nesting exceeds " + limit + " levels at " + location;
        }
    }

    /**
     * Structurally invalid input that is not a simple token mismatch.
     */
    record InvalidSyntax(
    SourceLocation location,
    String reason,
    String expected) implements ParseError {
        @Override
        public String message() {
            return reason + " at " + location;
        }
    }
}
