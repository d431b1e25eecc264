package org.pragmatica.purify.report;

import org.pragmatica.purify.analysis.IssueCategory;
import org.pragmatica.purify.analysis.IssueSeverity;
import org.pragmatica.purify.analysis.SemanticIssue;
import org.pragmatica.purify.analysis.ShellAnalyzer;
import org.pragmatica.purify.shell.ShellParser;
import org.pragmatica.purify.transform.PlanOptions;
import org.pragmatica.purify.transform.ShellRewriter;
import org.pragmatica.purify.transform.TransformationPlanner;
import org.pragmatica.purify.tree.SourceLocation;
import org.pragmatica.purify.tree.SourceSpan;
import org.junit.jupiter.api.Test;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ReportFormatterTest {

    private static final PurificationReport REPORT = new PurificationReport(
        "Makefile", 2, 1, 1,
        List.of("[fixed] NO_WILDCARD at 1:1: Wrapped $(wildcard ...) with $(sort ...)",
                "[manual] NO_RANDOM at 2:1: Use of $RANDOM"),
        List.of(),
        List.of());

    // === Report construction ===

    @Test
    void of_countsFixedAndManualTransformations() {
        var script = ShellParser.parse("mkdir out\nx=$RANDOM\n").unwrap();
        var planned = TransformationPlanner.planShell(script, ShellAnalyzer.analyze(script), PlanOptions.DEFAULT);
        var report = PurificationReport.of("Shell", ShellRewriter.apply(script, planned),
                                           List.of("line 1: mkdir out (creates directory)"));

        assertEquals(2, report.transformationsApplied());
        assertEquals(1, report.issuesFixed());
        assertEquals(1, report.manualFixesNeeded());
        assertEquals(List.of("[fixed] IDEM001 at 1:1: Added -p to mkdir",
                             "[manual] DET001 at 2:3: Use of non-deterministic $RANDOM. Suggestion: "
                             + "Use a fixed seed such as ${SEED:-42}"),
                     report.lines());
        assertEquals("Shell Purification Report", report.title());
    }

    @Test
    void withExternalIssues_addsManualLines() {
        var issue = SemanticIssue.of("SC2086", IssueCategory.SECURITY, IssueSeverity.HIGH,
                                     SourceSpan.at(SourceLocation.at(3, 5, 20)), "Double quote to prevent globbing")
                                 .withFix("\"$x\"");
        var merged = REPORT.withExternalIssues(List.of(issue));

        assertEquals(2, merged.manualFixesNeeded());
        assertEquals(REPORT.issuesFixed(), merged.issuesFixed());
        assertEquals("[manual] SC2086 at 3:5: Double quote to prevent globbing. Suggestion: \"$x\"",
                     merged.lines().get(merged.lines().size() - 1));
        assertEquals(List.of(issue), merged.externalIssues());
        assertSame(REPORT, REPORT.withExternalIssues(List.of()));
    }

    // === Formats ===

    @Test
    void format_text_listsCountsAndNumberedLines() {
        var expected = """
            Makefile Purification Report
            ============================
            Transformations Applied: 2
            Issues Fixed: 1
            Manual Fixes Needed: 1

            1: [fixed] NO_WILDCARD at 1:1: Wrapped $(wildcard ...) with $(sort ...)
            2: [manual] NO_RANDOM at 2:1: Use of $RANDOM
            """;

        assertEquals(expected, ReportFormatter.format(REPORT, ReportFormat.TEXT));
    }

    @Test
    void format_text_appendsSideEffects() {
        var report = new PurificationReport("Shell", 0, 0, 0, List.of(), List.of("line 1: rm -f a (removes files)"), List.of());

        var text = ReportFormatter.format(report, ReportFormat.TEXT);

        assertTrue(text.endsWith("Side Effects:\n  - line 1: rm -f a (removes files)\n"));
    }

    @Test
    void format_json_usesSnakeCaseKeys() throws Exception {
        var json = new ObjectMapper().readTree(ReportFormatter.format(REPORT, ReportFormat.JSON));

        assertEquals(2, json.get("transformations_applied").asInt());
        assertEquals(1, json.get("issues_fixed").asInt());
        assertEquals(1, json.get("manual_fixes_needed").asInt());
        assertEquals(2, json.get("report").size());
        assertEquals("[manual] NO_RANDOM at 2:1: Use of $RANDOM", json.get("report").get(1).asText());
        assertTrue(json.get("side_effects").isEmpty());
    }

    @Test
    void format_markdown_tablesWithEscapedPipes() {
        var report = new PurificationReport("Shell", 1, 1, 0, List.of("[fixed] DET006 at 1:7: Piped a | b"),
                                            List.of(), List.of());
        var markdown = ReportFormatter.format(report, ReportFormat.MARKDOWN);

        assertTrue(markdown.startsWith("# Shell Purification Report\n\n"));
        assertTrue(markdown.contains("| Issues Fixed | 1 |"));
        assertTrue(markdown.contains("## Transformations"));
        assertTrue(markdown.contains("| 1 | [fixed] DET006 at 1:7: Piped a \\| b |"));
        assertFalse(markdown.contains("## Side Effects"));
    }

    @Test
    void formatIssues_rendersDiagnostics() {
        var source = "rm a\n";
        var issues = ShellAnalyzer.analyze(ShellParser.parse(source).unwrap());

        var formatted = ReportFormatter.formatIssues(issues, source, Optional.of("run.sh"));

        assertTrue(formatted.startsWith("warning[IDEM002]: rm fails when the file does not exist\n"));
        assertTrue(formatted.contains("  --> run.sh:1:1\n"));
        assertTrue(formatted.contains("1 | rm a\n"));
        assertTrue(formatted.contains("idempotency"));
        assertTrue(formatted.endsWith("= help: rm -f\n"));
    }
}
