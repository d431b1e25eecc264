package org.pragmatica.purify.tree;

/**
 * Common view over the per-dialect syntax trees.
 */
public interface SyntaxTree {
    SyntaxMetadata metadata();

    /**
     * Number of statement nodes in the tree, nested ones included.
     */
    int statementCount();
}
