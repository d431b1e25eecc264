package org.pragmatica.purify.analysis;

import org.pragmatica.purify.analysis.ShellRule.Finding;
import org.pragmatica.purify.docker.Dockerfile;

import java.util.List;

/**
 * Entry of the Dockerfile rule catalog.
 */
public record DockerRule(String id, IssueCategory category, IssueSeverity severity, Detector detector) {

    @FunctionalInterface
    public interface Detector {
        List<Finding> detect(Dockerfile dockerfile);
    }

    List<SemanticIssue> check(Dockerfile dockerfile) {
        return detector.detect(dockerfile)
                       .stream()
                       .map(finding -> new SemanticIssue(id, category, severity, finding.span(), finding.message(), finding.fix()))
                       .toList();
    }
}
