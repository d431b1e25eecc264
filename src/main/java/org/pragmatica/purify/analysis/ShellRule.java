package org.pragmatica.purify.analysis;

import org.pragmatica.purify.shell.ShellNode;
import org.pragmatica.purify.tree.SourceSpan;

import java.util.List;
import java.util.Optional;

/**
 * Entry of the shell rule catalog: a stable id plus a pure detector over single nodes.
 */
public record ShellRule(String id, IssueCategory category, IssueSeverity severity, Detector detector) {

    @FunctionalInterface
    public interface Detector {
        List<Finding> detect(ShellNode node, ShellAnalysisContext context);
    }

    /**
     * What a detector reports before the rule stamps its id, category and severity on it.
     */
    public record Finding(SourceSpan span, String message, Optional<String> fix) {
        public static Finding of(SourceSpan span, String message, String fix) {
            return new Finding(span, message, Optional.of(fix));
        }

        public static Finding of(SourceSpan span, String message) {
            return new Finding(span, message, Optional.empty());
        }
    }

    List<SemanticIssue> check(ShellNode node, ShellAnalysisContext context) {
        return detector.detect(node, context)
                       .stream()
                       .map(finding -> new SemanticIssue(id, category, severity, finding.span(), finding.message(), finding.fix()))
                       .toList();
    }
}
