package org.pragmatica.purify.shell;

import org.pragmatica.purify.tree.SourceSpan;

import java.util.Optional;
import java.util.OptionalInt;

/**
 * Token types produced by {@link ShellLexer}.
 */
public sealed interface ShellToken {
    SourceSpan span();

    /**
     * A shell word. {@code plain} words are a single unquoted, unescaped literal and are the
     * only ones that may act as reserved words.
     */
    record Word(SourceSpan span, String raw, ShellExpression value, boolean plain) implements ShellToken {
        public boolean is(String keyword) {
            return plain && raw.equals(keyword);
        }
    }

    /**
     * A word of the form {@code NAME=value}, {@code NAME+=value} or {@code NAME[i]=value}.
     */
    record AssignmentWord(SourceSpan span,
                          String raw,
                          String name,
                          Optional<String> index,
                          boolean append,
                          ShellExpression value) implements ShellToken {}

    record Operator(SourceSpan span, String symbol) implements ShellToken {
        public boolean is(String expected) {
            return symbol.equals(expected);
        }
    }

    record Newline(SourceSpan span) implements ShellToken {}

    record RedirectOp(SourceSpan span, String symbol, OptionalInt fd) implements ShellToken {}

    /**
     * Here-document operator together with its delimiter and the body collected from the
     * lines that follow.
     */
    record HereDoc(SourceSpan span,
                   OptionalInt fd,
                   boolean stripTabs,
                   String delimiterWord,
                   String delimiter,
                   boolean quoted,
                   String body) implements ShellToken {}

    /**
     * Raw text between {@code ((} and {@code ))}.
     */
    record ArithBlock(SourceSpan span, String text) implements ShellToken {}

    record Comment(SourceSpan span, String text) implements ShellToken {}

    record Eof(SourceSpan span) implements ShellToken {}
}
