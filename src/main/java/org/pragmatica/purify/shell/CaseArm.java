package org.pragmatica.purify.shell;

import org.pragmatica.purify.tree.SourceSpan;

import java.util.List;

/**
 * One arm of a {@code case} statement: glob patterns, body and the terminator that ends it.
 */
public record CaseArm(List<String> patterns, List<ShellStatement> body, Terminator terminator, SourceSpan span) {

    public enum Terminator {
        BREAK(";;"),
        FALLTHROUGH(";&"),
        CONTINUE(";;&");

        private final String symbol;

        Terminator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        public static Terminator fromSymbol(String symbol) {
            return switch (symbol) {
                case ";&" -> FALLTHROUGH;
                case ";;&" -> CONTINUE;
                default -> BREAK;
            };
        }
    }
}
