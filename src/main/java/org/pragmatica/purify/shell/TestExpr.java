package org.pragmatica.purify.shell;

import org.pragmatica.purify.tree.SourceSpan;

import java.util.Arrays;
import java.util.Optional;

/**
 * Conditional expressions of {@code test}, {@code [ ]} and {@code [[ ]]}.
 */
public sealed interface TestExpr {
    SourceSpan span();

    record Unary(UnaryOperator operator, ShellExpression operand, SourceSpan span) implements TestExpr {}

    record Binary(BinaryOperator operator, ShellExpression left, ShellExpression right, SourceSpan span) implements TestExpr {}

    /**
     * Bare word, true when non-empty.
     */
    record Word(ShellExpression word, SourceSpan span) implements TestExpr {}

    record Not(TestExpr operand, SourceSpan span) implements TestExpr {}

    record And(TestExpr left, TestExpr right, SourceSpan span) implements TestExpr {}

    record Or(TestExpr left, TestExpr right, SourceSpan span) implements TestExpr {}

    record Group(TestExpr inner, SourceSpan span) implements TestExpr {}

    enum UnaryOperator {
        EXISTS("-e"),
        EXISTS_LEGACY("-a"),
        REGULAR_FILE("-f"),
        DIRECTORY("-d"),
        READABLE("-r"),
        WRITABLE("-w"),
        EXECUTABLE("-x"),
        NON_EMPTY_FILE("-s"),
        SYMLINK("-L"),
        SYMLINK_LEGACY("-h"),
        PIPE("-p"),
        SOCKET("-S"),
        BLOCK_DEVICE("-b"),
        CHAR_DEVICE("-c"),
        SET_GID("-g"),
        SET_UID("-u"),
        STICKY("-k"),
        OWNED("-O"),
        GROUP_OWNED("-G"),
        MODIFIED("-N"),
        TERMINAL("-t"),
        EMPTY_STRING("-z"),
        NON_EMPTY_STRING("-n"),
        VARIABLE_SET("-v"),
        OPTION_SET("-o");

        private final String symbol;

        UnaryOperator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        public static Optional<UnaryOperator> fromSymbol(String symbol) {
            return Arrays.stream(values())
                         .filter(op -> op.symbol.equals(symbol))
                         .findFirst();
        }
    }

    enum BinaryOperator {
        STRING_EQUAL("="),
        STRING_EQUAL_EXTENDED("=="),
        STRING_NOT_EQUAL("!="),
        STRING_LESS("<"),
        STRING_GREATER(">"),
        REGEX_MATCH("=~"),
        INT_EQUAL("-eq"),
        INT_NOT_EQUAL("-ne"),
        INT_LESS("-lt"),
        INT_LESS_EQUAL("-le"),
        INT_GREATER("-gt"),
        INT_GREATER_EQUAL("-ge"),
        NEWER("-nt"),
        OLDER("-ot"),
        SAME_FILE("-ef");

        private final String symbol;

        BinaryOperator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        public boolean isIntegerComparison() {
            return name().startsWith("INT_");
        }

        public static Optional<BinaryOperator> fromSymbol(String symbol) {
            var normalized = switch (symbol) {
                case "\\<" -> "<";
                case "\\>" -> ">";
                default -> symbol;
            };
            return Arrays.stream(values())
                         .filter(op -> op.symbol.equals(normalized))
                         .findFirst();
        }
    }
}
