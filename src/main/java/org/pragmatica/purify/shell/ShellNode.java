package org.pragmatica.purify.shell;

import org.pragmatica.purify.tree.SourceSpan;

/**
 * Any node of a shell syntax tree.
 */
public sealed interface ShellNode permits ShellStatement, ShellExpression, Redirect {
    SourceSpan span();
}
