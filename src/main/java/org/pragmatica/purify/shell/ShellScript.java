package org.pragmatica.purify.shell;

import org.pragmatica.purify.tree.SyntaxMetadata;
import org.pragmatica.purify.tree.SyntaxTree;

import java.util.List;
import java.util.Optional;

/**
 * Parsed shell script: top-level statements plus source metadata.
 */
public record ShellScript(List<ShellStatement> statements, SyntaxMetadata metadata) implements SyntaxTree {

    public ShellScript {
        statements = List.copyOf(statements);
    }

    public ShellScript withStatements(List<ShellStatement> newStatements) {
        return new ShellScript(newStatements, metadata);
    }

    public Optional<ShellStatement.Comment> shebang() {
        if (!statements.isEmpty() && statements.get(0) instanceof ShellStatement.Comment comment && comment.isShebang()) {
            return Optional.of(comment);
        }
        return Optional.empty();
    }

    @Override
    public int statementCount() {
        return ShellTrees.countStatements(statements);
    }
}
