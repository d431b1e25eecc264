package org.pragmatica.purify.error;

import org.pragmatica.purify.tree.SourceSpan;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Rust-style rendering of a parse error or a semantic issue against the source it came from.
 *
 * <pre>
 * warning[DET001]: Use of non-deterministic $RANDOM
 *   --> build.sh:3:8
 *    |
 *  3 | SESSION=$RANDOM
 *    |         ^^^^^^^ determinism
 *    |
 *    = help: use a fixed seed such as ${SEED:-42}
 * </pre>
 *
 * @param severity how loudly the diagnostic is reported
 * @param code     rule id such as {@code DET001}, or {@code parse} for syntax errors
 * @param message  headline
 * @param span     region the headline refers to
 * @param labels   underlined regions; when empty the span itself is underlined
 * @param notes    trailing {@code = ...} lines
 */
public record Diagnostic(Severity severity,
                         Optional<String> code,
                         String message,
                         SourceSpan span,
                         List<Label> labels,
                         List<String> notes) {

    public enum Severity {
        ERROR,
        WARNING,
        INFO,
        HINT;

        public String display() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    /**
     * Underlined region. Primary labels draw {@code ^}, secondary ones {@code -}.
     */
    public record Label(SourceSpan span, String message, boolean primary) {
        public static Label primary(SourceSpan span, String message) {
            return new Label(span, message, true);
        }

        public static Label secondary(SourceSpan span, String message) {
            return new Label(span, message, false);
        }

        boolean covers(int line) {
            return span.start().line() <= line && line <= span.end().line();
        }

        int firstColumnOn(int line) {
            return span.start().line() == line ? span.start().column() : 1;
        }

        int lastColumnOn(int line, String text) {
            return span.end().line() == line ? span.end().column() : text.length() + 1;
        }
    }

    public static Diagnostic error(String code, String message, SourceSpan span) {
        return of(Severity.ERROR, code, message, span);
    }

    public static Diagnostic warning(String code, String message, SourceSpan span) {
        return of(Severity.WARNING, code, message, span);
    }

    public static Diagnostic of(Severity severity, String code, String message, SourceSpan span) {
        return new Diagnostic(severity, Optional.of(code), message, span, List.of(), List.of());
    }

    public Diagnostic withLabel(String text) {
        return withLabels(Label.primary(span, text));
    }

    public Diagnostic withSecondaryLabel(SourceSpan at, String text) {
        return withLabels(Label.secondary(at, text));
    }

    public Diagnostic withNote(String note) {
        return new Diagnostic(severity, code, message, span, labels, appended(notes, note));
    }

    public Diagnostic withHelp(String help) {
        return withNote("help: " + help);
    }

    private Diagnostic withLabels(Label label) {
        return new Diagnostic(severity, code, message, span, appended(labels, label), notes);
    }

    private static <T> List<T> appended(List<T> list, T element) {
        return Stream.concat(list.stream(), Stream.of(element)).toList();
    }

    /**
     * Multi-line rendering with a numbered gutter, underlines and notes.
     */
    public String format(String source, Optional<String> filename) {
        var sourceLines = source.split("\n", -1);
        var shown = effectiveLabels();
        int first = shown.stream().mapToInt(label -> label.span().start().line()).min().orElse(span.start().line());
        int last = shown.stream().mapToInt(label -> label.span().end().line()).max().orElse(span.end().line());
        first = Math.min(first, span.start().line());
        last = Math.max(last, span.end().line());

        var width = String.valueOf(last).length();
        var margin = " ".repeat(width + 1) + "|";
        var out = new StringBuilder();

        out.append(headline()).append('\n');
        out.append("  --> ")
           .append(filename.map(name -> name + ":").orElse(""))
           .append(span.start().line()).append(':').append(span.start().column())
           .append('\n');
        out.append(margin).append('\n');

        for (int line = Math.max(first, 1); line <= Math.min(last, sourceLines.length); line++) {
            var text = sourceLines[line - 1];
            out.append(String.format("%" + width + "d | ", line)).append(text).append('\n');

            var underline = underline(line, text, shown);
            if (!underline.isEmpty()) {
                out.append(" ".repeat(width)).append(" | ").append(underline).append('\n');
            }
        }

        out.append(margin).append('\n');
        notes.forEach(note -> out.append(" ".repeat(width + 1)).append("= ").append(note).append('\n'));
        return out.toString();
    }

    /**
     * {@code file:line:column: severity[code]: message}.
     */
    public String formatSimple(Optional<String> filename) {
        return filename.orElse("<input>") + ":" + span.start().line() + ":" + span.start().column() + ": " + headline();
    }

    private String headline() {
        return severity.display() + code.map(c -> "[" + c + "]").orElse("") + ": " + message;
    }

    private List<Label> effectiveLabels() {
        return labels.isEmpty() ? List.of(Label.primary(span, "")) : labels;
    }

    private static String underline(int line, String text, List<Label> shown) {
        var onLine = new ArrayList<Label>();
        for (var label : shown) {
            if (label.covers(line)) {
                onLine.add(label);
            }
        }
        onLine.sort(Comparator.comparingInt(label -> label.firstColumnOn(line)));

        var marks = new StringBuilder();
        for (var label : onLine) {
            var from = label.firstColumnOn(line);
            while (marks.length() + 1 < from) {
                marks.append(' ');
            }
            var length = Math.max(1, label.lastColumnOn(line, text) - from);
            marks.append(String.valueOf(label.primary() ? '^' : '-').repeat(length));
            if (!label.message().isEmpty()) {
                marks.append(' ').append(label.message());
            }
        }
        return marks.toString();
    }
}
