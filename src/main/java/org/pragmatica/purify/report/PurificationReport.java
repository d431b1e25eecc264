package org.pragmatica.purify.report;

import org.pragmatica.purify.analysis.SemanticIssue;
import org.pragmatica.purify.transform.RewriteOutcome;
import org.pragmatica.purify.transform.Transformation;

import java.util.ArrayList;
import java.util.List;

/**
 * Summary of one purification run.
 *
 * @param subject                what was purified, such as {@code Makefile}; used in report titles
 * @param transformationsApplied number of planned transformations, advisories included
 * @param issuesFixed            number of safe transformations that changed the tree
 * @param manualFixesNeeded      number of advisories, downgraded transformations and external issues
 * @param lines                  one human-readable line per transformation and external issue
 * @param sideEffects            state-changing commands found in the input
 * @param externalIssues         issues merged from other producers
 */
public record PurificationReport(String subject,
                                 int transformationsApplied,
                                 int issuesFixed,
                                 int manualFixesNeeded,
                                 List<String> lines,
                                 List<String> sideEffects,
                                 List<SemanticIssue> externalIssues) {

    public PurificationReport {
        lines = List.copyOf(lines);
        sideEffects = List.copyOf(sideEffects);
        externalIssues = List.copyOf(externalIssues);
    }

    public static PurificationReport of(String subject, RewriteOutcome<?> outcome, List<String> sideEffects) {
        var transformations = outcome.transformations();
        var lines = transformations.stream()
                                   .map(PurificationReport::line)
                                   .toList();
        int manual = (int) transformations.stream()
                                          .filter(transformation -> !transformation.safe())
                                          .count();
        return new PurificationReport(subject, transformations.size(), outcome.applied().size(), manual, lines,
                                      sideEffects, List.of());
    }

    public String title() {
        return subject + " Purification Report";
    }

    /**
     * Merges issues found by another producer; each one needs a manual fix.
     */
    public PurificationReport withExternalIssues(List<SemanticIssue> issues) {
        if (issues.isEmpty()) {
            return this;
        }
        var newLines = new ArrayList<>(lines);
        var newIssues = new ArrayList<>(externalIssues);
        for (var issue : issues) {
            newLines.add(line("manual", issue.rule(), issue.span().start().toString(),
                              issue.fix().map(fix -> issue.message() + ". Suggestion: " + fix).orElse(issue.message())));
            newIssues.add(issue);
        }
        return new PurificationReport(subject, transformationsApplied, issuesFixed, manualFixesNeeded + issues.size(),
                                      newLines, sideEffects, newIssues);
    }

    static String line(Transformation transformation) {
        return line(transformation.safe() ? "fixed" : "manual", transformation.ruleId(),
                    transformation.span().start().toString(), transformation.description());
    }

    private static String line(String status, String rule, String location, String description) {
        return "[" + status + "] " + rule + " at " + location + ": " + description;
    }
}
