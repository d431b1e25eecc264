package org.pragmatica.purify;

import org.pragmatica.purify.analysis.SemanticIssue;
import org.pragmatica.purify.report.PurificationReport;
import org.pragmatica.purify.transform.Transformation;
import org.pragmatica.purify.tree.SyntaxTree;

import java.util.List;

/**
 * Outcome of a successful purification.
 *
 * @param tree            the rewritten tree
 * @param text            the tree rendered as source
 * @param transformations every planned transformation in application order, downgraded ones as advisories
 * @param issues          issues found in the input
 */
public record PurificationResult(Dialect dialect,
                                 SyntaxTree tree,
                                 String text,
                                 List<Transformation> transformations,
                                 PurificationReport report,
                                 List<SemanticIssue> issues) {

    public PurificationResult {
        transformations = List.copyOf(transformations);
        issues = List.copyOf(issues);
    }

    public int statementCount() {
        return tree.statementCount();
    }

    public List<Transformation> appliedTransformations() {
        return transformations.stream()
                              .filter(Transformation::safe)
                              .toList();
    }

    public List<Transformation.Advisory> advisories() {
        return transformations.stream()
                              .filter(Transformation.Advisory.class::isInstance)
                              .map(Transformation.Advisory.class::cast)
                              .toList();
    }
}
