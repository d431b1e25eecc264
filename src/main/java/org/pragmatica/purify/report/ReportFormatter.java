package org.pragmatica.purify.report;

import org.pragmatica.purify.analysis.SemanticIssue;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * Renders purification reports and issue lists for people and tools.
 */
public final class ReportFormatter {
    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private ReportFormatter() {}

    public static String format(PurificationReport report, ReportFormat format) {
        return switch (format) {
            case TEXT -> text(report);
            case JSON -> json(report);
            case MARKDOWN -> markdown(report);
        };
    }

    /**
     * Issues as source diagnostics, separated by blank lines.
     */
    public static String formatIssues(List<SemanticIssue> issues, String source, Optional<String> filename) {
        return issues.stream()
                     .map(issue -> issue.toDiagnostic().format(source, filename))
                     .collect(Collectors.joining("\n"));
    }

    private static String text(PurificationReport report) {
        var sb = new StringBuilder();
        sb.append(report.title()).append('\n');
        sb.append("=".repeat(report.title().length())).append('\n');
        sb.append("Transformations Applied: ").append(report.transformationsApplied()).append('\n');
        sb.append("Issues Fixed: ").append(report.issuesFixed()).append('\n');
        sb.append("Manual Fixes Needed: ").append(report.manualFixesNeeded()).append('\n');
        sb.append('\n');
        var lines = report.lines();
        for (int i = 0; i < lines.size(); i++) {
            sb.append(i + 1).append(": ").append(lines.get(i)).append('\n');
        }
        if (!report.sideEffects().isEmpty()) {
            sb.append('\n').append("Side Effects:").append('\n');
            report.sideEffects().forEach(effect -> sb.append("  - ").append(effect).append('\n'));
        }
        return sb.toString();
    }

    private static String json(PurificationReport report) {
        var root = MAPPER.createObjectNode();
        root.put("transformations_applied", report.transformationsApplied());
        root.put("issues_fixed", report.issuesFixed());
        root.put("manual_fixes_needed", report.manualFixesNeeded());
        var lines = root.putArray("report");
        report.lines().forEach(lines::add);
        var effects = root.putArray("side_effects");
        report.sideEffects().forEach(effects::add);
        try {
            return MAPPER.writeValueAsString(root) + "\n";
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Report could not be serialized", e);
        }
    }

    private static String markdown(PurificationReport report) {
        var sb = new StringBuilder();
        sb.append("# ").append(report.title()).append("\n\n");
        sb.append("| Metric | Count |\n");
        sb.append("|---|---|\n");
        sb.append("| Transformations Applied | ").append(report.transformationsApplied()).append(" |\n");
        sb.append("| Issues Fixed | ").append(report.issuesFixed()).append(" |\n");
        sb.append("| Manual Fixes Needed | ").append(report.manualFixesNeeded()).append(" |\n");
        if (!report.lines().isEmpty()) {
            sb.append("\n## Transformations\n\n");
            sb.append("| # | Change |\n");
            sb.append("|---|---|\n");
            var lines = report.lines();
            for (int i = 0; i < lines.size(); i++) {
                sb.append("| ").append(i + 1).append(" | ").append(escapeCell(lines.get(i))).append(" |\n");
            }
        }
        if (!report.sideEffects().isEmpty()) {
            sb.append("\n## Side Effects\n\n");
            report.sideEffects().forEach(effect -> sb.append("- `").append(effect).append("`\n"));
        }
        return sb.toString();
    }

    private static String escapeCell(String text) {
        return text.replace("|", "\\|");
    }
}
