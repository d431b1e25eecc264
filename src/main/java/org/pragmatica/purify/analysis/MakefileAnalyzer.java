package org.pragmatica.purify.analysis;

import org.pragmatica.purify.make.Makefile;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the Makefile rule catalog. Items nested in conditionals are analyzed like top-level ones.
 */
public final class MakefileAnalyzer {
    private static final Logger log = LoggerFactory.getLogger(MakefileAnalyzer.class);

    private MakefileAnalyzer() {}

    public static List<SemanticIssue> analyze(Makefile makefile) {
        return analyze(makefile, AnalysisOptions.DEFAULT);
    }

    public static List<SemanticIssue> analyze(Makefile makefile, AnalysisOptions options) {
        long started = System.nanoTime();
        var facts = MakefileFacts.of(makefile);
        var issues = new ArrayList<SemanticIssue>();
        for (var rule : MakefileRules.CATALOG) {
            if (options.isEnabled(rule.category())) {
                issues.addAll(rule.check(facts, List.copyOf(issues)));
            }
        }
        log.debug("Makefile analysis found {} issues in {} rules, {} us",
                  issues.size(), facts.rules().size(), (System.nanoTime() - started) / 1000);
        return List.copyOf(issues);
    }
}
