package org.pragmatica.purify.analysis;

import org.pragmatica.purify.error.Diagnostic;
import org.pragmatica.purify.tree.SourceSpan;

import java.util.Optional;

/**
 * A risk pattern found in a syntax tree, or reported by an external lint engine.
 *
 * @param rule     stable rule code such as {@code DET001} or {@code NO_WILDCARD}
 * @param span     location of the offending node; several issues may share one
 * @param fix      suggested replacement or manual action
 */
public record SemanticIssue(String rule,
                            IssueCategory category,
                            IssueSeverity severity,
                            SourceSpan span,
                            String message,
                            Optional<String> fix) {

    public static SemanticIssue of(String rule,
                                   IssueCategory category,
                                   IssueSeverity severity,
                                   SourceSpan span,
                                   String message) {
        return new SemanticIssue(rule, category, severity, span, message, Optional.empty());
    }

    public SemanticIssue withFix(String suggestion) {
        return new SemanticIssue(rule, category, severity, span, message, Optional.of(suggestion));
    }

    public Diagnostic toDiagnostic() {
        var diagnostic = Diagnostic.of(severity.toDiagnosticSeverity(), rule, message, span)
                                   .withLabel(category.display());
        return fix.map(diagnostic::withHelp).orElse(diagnostic);
    }
}
