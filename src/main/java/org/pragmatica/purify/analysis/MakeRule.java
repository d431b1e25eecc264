package org.pragmatica.purify.analysis;

import org.pragmatica.purify.analysis.ShellRule.Finding;

import java.util.List;

/**
 * Entry of the Makefile rule catalog. Detectors see the whole file, since most Makefile risks
 * are relations between rules, plus the issues that earlier catalog entries already reported.
 */
public record MakeRule(String id, IssueCategory category, IssueSeverity severity, Detector detector) {

    @FunctionalInterface
    public interface Detector {
        List<Finding> detect(MakefileFacts facts, List<SemanticIssue> earlier);
    }

    List<SemanticIssue> check(MakefileFacts facts, List<SemanticIssue> earlier) {
        return detector.detect(facts, earlier)
                       .stream()
                       .map(finding -> new SemanticIssue(id, category, severity, finding.span(), finding.message(), finding.fix()))
                       .toList();
    }
}
