package org.pragmatica.purify.shell;

import org.pragmatica.purify.tree.SourceSpan;

import java.util.List;
import java.util.Optional;

/**
 * Word-level expressions: everything that can appear as a command argument, assignment value,
 * loop item or test operand.
 */
public sealed interface ShellExpression extends ShellNode {

    enum Quoting {
        NONE,
        SINGLE,
        ANSI_C
    }

    /**
     * Literal text. For {@link Quoting#NONE} the value is the raw source text, escapes included.
     */
    record Literal(String value, Quoting quoting, SourceSpan span) implements ShellExpression {}

    /**
     * {@code $name} or {@code ${name}}; special parameters use their symbol as name.
     */
    record Variable(String name, boolean braced, SourceSpan span) implements ShellExpression {}

    record ArrayLiteral(List<ShellExpression> elements, SourceSpan span) implements ShellExpression {}

    record Glob(String pattern, SourceSpan span) implements ShellExpression {}

    /**
     * Arithmetic expansion {@code $((...))}.
     */
    record Arithmetic(ArithExpr expression, SourceSpan span) implements ShellExpression {}

    record CommandSubstitution(List<ShellStatement> body, boolean backtick, SourceSpan span) implements ShellExpression {}

    /**
     * Test expression, {@code [[ ]]} when extended and {@code [ ]} otherwise.
     */
    record Test(TestExpr test, boolean extended, SourceSpan span) implements ShellExpression {}

    /**
     * A command whose exit status serves as a condition.
     */
    record CommandCondition(ShellStatement statement, SourceSpan span) implements ShellExpression {}

    /**
     * Adjacent word parts. A double-quoted string is a concat with {@code doubleQuoted} set,
     * whose literal parts hold the raw text between the quotes.
     */
    record Concat(List<ShellExpression> parts, boolean doubleQuoted, SourceSpan span) implements ShellExpression {}

    record ParamExpansion(String name,
                          ParamOperator operator,
                          Optional<ShellExpression> operand,
                          SourceSpan span) implements ShellExpression {}

    /**
     * Operators of {@code ${...}} parameter expansion.
     */
    enum ParamOperator {
        LENGTH("#"),
        DEFAULT(":-"),
        DEFAULT_UNSET("-"),
        ASSIGN_DEFAULT(":="),
        ASSIGN_DEFAULT_UNSET("="),
        ERROR_IF_UNSET(":?"),
        ERROR_IF_UNSET_ONLY("?"),
        ALTERNATIVE(":+"),
        ALTERNATIVE_UNSET("+"),
        REMOVE_LONGEST_PREFIX("##"),
        REMOVE_PREFIX("#"),
        REMOVE_LONGEST_SUFFIX("%%"),
        REMOVE_SUFFIX("%"),
        REPLACE_ALL("//"),
        REPLACE("/"),
        UPPERCASE_ALL("^^"),
        UPPERCASE("^"),
        LOWERCASE_ALL(",,"),
        LOWERCASE(","),
        SUBSTRING(":");

        private final String symbol;

        ParamOperator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        /**
         * Operators in longest-match order, excluding {@link #LENGTH} which is a prefix form.
         */
        static final List<ParamOperator> MATCH_ORDER = List.of(
            DEFAULT, ASSIGN_DEFAULT, ERROR_IF_UNSET, ALTERNATIVE,
            REMOVE_LONGEST_PREFIX, REMOVE_LONGEST_SUFFIX, REPLACE_ALL, UPPERCASE_ALL, LOWERCASE_ALL,
            DEFAULT_UNSET, ASSIGN_DEFAULT_UNSET, ERROR_IF_UNSET_ONLY, ALTERNATIVE_UNSET,
            REMOVE_PREFIX, REMOVE_SUFFIX, REPLACE, UPPERCASE, LOWERCASE, SUBSTRING);
    }
}
