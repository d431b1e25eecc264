package org.pragmatica.purify.analysis;

import org.pragmatica.purify.tree.SourceSpan;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Facts collected while walking a script, readable by rule detectors.
 *
 * <p>Variables assigned from an entropy source are tainted for the rest of the block that
 * assigned them, nested blocks included. A later clean assignment in the same block clears
 * the taint.
 */
public final class ShellAnalysisContext {

    /**
     * Entropy source a variable was assigned from, keyed by the rule that flags the source.
     */
    public record Taint(String rule, String source) {}

    private final AnalysisOptions options;
    private final boolean errexit;
    private final Set<SourceSpan> guarded = new HashSet<>();
    private final Deque<Map<String, Optional<Taint>>> scopes = new ArrayDeque<>();

    ShellAnalysisContext(AnalysisOptions options, boolean errexit) {
        this.options = options;
        this.errexit = errexit;
    }

    public AnalysisOptions options() {
        return options;
    }

    /**
     * Whether the script enables {@code set -e} anywhere.
     */
    public boolean errexit() {
        return errexit;
    }

    public boolean isGuarded(SourceSpan commandSpan) {
        return guarded.contains(commandSpan);
    }

    public Optional<Taint> taintOf(String variable) {
        for (var scope : scopes) {
            var entry = scope.get(variable);
            if (entry != null) {
                return entry;
            }
        }
        return Optional.empty();
    }

    void guard(SourceSpan commandSpan) {
        guarded.add(commandSpan);
    }

    void assign(String variable, Optional<Taint> taint) {
        if (scopes.isEmpty()) {
            enterBlock();
        }
        scopes.peek().put(variable, taint);
    }

    void enterBlock() {
        scopes.push(new HashMap<>());
    }

    void exitBlock() {
        scopes.pop();
    }
}
