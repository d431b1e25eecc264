package org.pragmatica.purify.transform;

import org.pragmatica.purify.tree.SyntaxTree;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of applying transformations: the new tree, the transformations that changed it, and
 * the safe ones that were turned into advisories because their target could not be rewritten.
 *
 * @param transformations every input transformation in the order the rewriter visited it, with
 *                        downgraded ones replaced by their advisory
 */
public record RewriteOutcome<T extends SyntaxTree>(T tree,
                                                   List<Transformation> applied,
                                                   List<Transformation.Advisory> downgraded,
                                                   List<Transformation> transformations) {

    public RewriteOutcome {
        applied = List.copyOf(applied);
        downgraded = List.copyOf(downgraded);
        transformations = List.copyOf(transformations);
    }

    /**
     * Collects outcomes while a rewriter walks its transformations.
     */
    static final class Recorder {
        private final List<Transformation> applied = new ArrayList<>();
        private final List<Transformation.Advisory> downgraded = new ArrayList<>();
        private final List<Transformation> transformations = new ArrayList<>();

        void applied(Transformation transformation) {
            applied.add(transformation);
            transformations.add(transformation);
        }

        void downgraded(Transformation.Advisory advisory) {
            downgraded.add(advisory);
            transformations.add(advisory);
        }

        void advisory(Transformation transformation) {
            transformations.add(transformation);
        }

        <T extends SyntaxTree> RewriteOutcome<T> finish(T tree) {
            return new RewriteOutcome<>(tree, applied, downgraded, transformations);
        }
    }
}
