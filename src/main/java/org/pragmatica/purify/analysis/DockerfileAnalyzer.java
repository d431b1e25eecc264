package org.pragmatica.purify.analysis;

import org.pragmatica.purify.docker.Dockerfile;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the Dockerfile rule catalog.
 */
public final class DockerfileAnalyzer {
    private static final Logger log = LoggerFactory.getLogger(DockerfileAnalyzer.class);

    private DockerfileAnalyzer() {}

    public static List<SemanticIssue> analyze(Dockerfile dockerfile) {
        return analyze(dockerfile, AnalysisOptions.DEFAULT);
    }

    public static List<SemanticIssue> analyze(Dockerfile dockerfile, AnalysisOptions options) {
        var issues = new ArrayList<SemanticIssue>();
        for (var rule : DockerfileRules.CATALOG) {
            if (options.isEnabled(rule.category())) {
                issues.addAll(rule.check(dockerfile));
            }
        }
        log.debug("Dockerfile analysis found {} issues in {} instructions", issues.size(), dockerfile.statementCount());
        return List.copyOf(issues);
    }
}
