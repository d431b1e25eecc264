package org.pragmatica.purify.shell;

import org.pragmatica.purify.tree.SourceSpan;

import java.util.OptionalInt;

/**
 * I/O redirections attached to commands.
 */
public sealed interface Redirect extends ShellNode {

    OptionalInt fd();

    /**
     * {@code >}, {@code >>}, {@code <}, {@code >|}, {@code <>}, {@code &>} and {@code &>>}.
     */
    record FileRedirect(String operator, OptionalInt fd, ShellExpression target, SourceSpan span) implements Redirect {
        public boolean isAppend() {
            return operator.equals(">>") || operator.equals("&>>");
        }
    }

    /**
     * {@code >&} and {@code <&} descriptor duplication, target kept as written.
     */
    record Duplicate(String operator, OptionalInt fd, String target, SourceSpan span) implements Redirect {}

    /**
     * Here-document. A quoted delimiter disables expansion inside the body.
     */
    record HereDocument(OptionalInt fd,
                        String delimiterWord,
                        String delimiter,
                        String body,
                        boolean quotedDelimiter,
                        boolean stripTabs,
                        SourceSpan span) implements Redirect {}

    record HereString(OptionalInt fd, ShellExpression target, SourceSpan span) implements Redirect {}
}
