package org.pragmatica.purify;

import org.pragmatica.purify.analysis.DockerfileAnalyzer;
import org.pragmatica.purify.analysis.IssueCategory;
import org.pragmatica.purify.analysis.MakefileAnalyzer;
import org.pragmatica.purify.analysis.SemanticIssue;
import org.pragmatica.purify.analysis.ShellAnalyzer;
import org.pragmatica.purify.analysis.SideEffectTracker;
import org.pragmatica.purify.docker.Dockerfile;
import org.pragmatica.purify.docker.DockerfileParser;
import org.pragmatica.purify.docker.DockerfileRenderer;
import org.pragmatica.purify.error.ParseOutcome;
import org.pragmatica.purify.make.Makefile;
import org.pragmatica.purify.make.MakefileParser;
import org.pragmatica.purify.make.MakefileRenderer;
import org.pragmatica.purify.report.PurificationReport;
import org.pragmatica.purify.shell.ShellParser;
import org.pragmatica.purify.shell.ShellRenderer;
import org.pragmatica.purify.shell.ShellScript;
import org.pragmatica.purify.transform.DockerfileRewriter;
import org.pragmatica.purify.transform.MakefileRewriter;
import org.pragmatica.purify.transform.RewriteOutcome;
import org.pragmatica.purify.transform.ShellRewriter;
import org.pragmatica.purify.transform.TransformationPlanner;
import org.pragmatica.purify.tree.SyntaxTree;

import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for purifying shell scripts, Makefiles and Dockerfiles.
 *
 * <p>Example usage:
 * <pre>{@code
 * var result = ShellPurifier.purify("FILES := $(wildcard *.c)\n", Dialect.MAKEFILE).unwrap();
 *
 * result.text();    // FILES := $(sort $(wildcard *.c))
 * result.report();  // 1 issue fixed, 0 manual fixes
 * }</pre>
 *
 * <p>Each call parses, analyzes, plans, rewrites a copy and renders it. A parse error stops the
 * pipeline and is returned as the failure; nothing is rendered from a partial tree.
 */
public final class ShellPurifier {
    private static final Logger log = LoggerFactory.getLogger(ShellPurifier.class);

    private ShellPurifier() {}

    /**
     * Purify source text with the default configuration.
     */
    public static ParseOutcome<PurificationResult> purify(String source, Dialect dialect) {
        return purify(source, dialect, PurifyConfig.DEFAULT);
    }

    /**
     * Purify source text with custom configuration.
     */
    public static ParseOutcome<PurificationResult> purify(String source, Dialect dialect, PurifyConfig config) {
        return purify(source, dialect, config, Optional.empty());
    }

    /**
     * Purify source text read from a file; the file name appears in error messages and tree metadata.
     */
    public static ParseOutcome<PurificationResult> purify(String source,
                                                          Dialect dialect,
                                                          PurifyConfig config,
                                                          Optional<String> sourceFile) {
        long started = System.nanoTime();
        var result = parse(source, dialect, sourceFile).map(tree -> run(tree, dialect, config));
        if (result.isSuccess()) {
            var report = result.unwrap().report();
            log.debug("Purified {} in {} us: {} fixed, {} manual", dialect, (System.nanoTime() - started) / 1000,
                      report.issuesFixed(), report.manualFixesNeeded());
        } else {
            log.debug("Purification of {} stopped: {}", dialect, result.error().describe(sourceFile));
        }
        return result;
    }

    /**
     * Parse only, for callers that score or lint the tree themselves.
     */
    public static ParseOutcome<SyntaxTree> parse(String source, Dialect dialect) {
        return parse(source, dialect, Optional.empty());
    }

    public static ParseOutcome<SyntaxTree> parse(String source, Dialect dialect, Optional<String> sourceFile) {
        return switch (dialect) {
            case SHELL -> ShellParser.parse(source, sourceFile).map(SyntaxTree.class::cast);
            case MAKEFILE -> MakefileParser.parse(source, sourceFile).map(SyntaxTree.class::cast);
            case DOCKERFILE -> DockerfileParser.parse(source, sourceFile).map(SyntaxTree.class::cast);
        };
    }

    /**
     * Parse and analyze without rewriting.
     */
    public static ParseOutcome<List<SemanticIssue>> analyze(String source, Dialect dialect) {
        return analyze(source, dialect, PurifyConfig.DEFAULT);
    }

    public static ParseOutcome<List<SemanticIssue>> analyze(String source, Dialect dialect, PurifyConfig config) {
        return parse(source, dialect).map(tree -> analyze(tree, config));
    }

    private static List<SemanticIssue> analyze(SyntaxTree tree, PurifyConfig config) {
        var options = config.analysisOptions();
        if (tree instanceof ShellScript script) {
            return ShellAnalyzer.analyze(script, options);
        }
        if (tree instanceof Makefile makefile) {
            return MakefileAnalyzer.analyze(makefile, options);
        }
        if (tree instanceof Dockerfile dockerfile) {
            return DockerfileAnalyzer.analyze(dockerfile, options);
        }
        throw new IllegalStateException("No analyzer for " + tree.getClass().getSimpleName());
    }

    private static PurificationResult run(SyntaxTree tree, Dialect dialect, PurifyConfig config) {
        var issues = analyze(tree, config);
        var plan = TransformationPlanner.plan(tree, issues, config.planOptions());
        var format = config.formatOptions();
        if (tree instanceof ShellScript script) {
            var outcome = ShellRewriter.apply(script, plan);
            var sideEffects = config.trackSideEffects() ? SideEffectTracker.collect(script) : List.<String>of();
            return result(dialect, outcome, ShellRenderer.render(outcome.tree(), format), sideEffects, issues);
        }
        if (tree instanceof Makefile makefile) {
            var outcome = MakefileRewriter.apply(makefile, plan);
            return result(dialect, outcome, MakefileRenderer.render(outcome.tree(), format), List.of(), issues);
        }
        if (tree instanceof Dockerfile dockerfile) {
            var outcome = DockerfileRewriter.apply(dockerfile, plan);
            return result(dialect, outcome, DockerfileRenderer.render(outcome.tree(), format), List.of(), issues);
        }
        throw new IllegalStateException("No rewriter for " + tree.getClass().getSimpleName());
    }

    private static PurificationResult result(Dialect dialect,
                                             RewriteOutcome<?> outcome,
                                             String text,
                                             List<String> sideEffects,
                                             List<SemanticIssue> issues) {
        var report = PurificationReport.of(dialect.displayName(), outcome, sideEffects);
        return new PurificationResult(dialect, outcome.tree(), text, outcome.transformations(), report, issues);
    }

    /**
     * Create a builder for a purifier with custom configuration.
     */
    public static Builder builder(Dialect dialect) {
        return new Builder(dialect);
    }

    public static final class Builder {
        private final Dialect dialect;
        private boolean strictIdempotency = true;
        private boolean removeNonDeterministic = true;
        private boolean trackSideEffects = true;
        private boolean typeCheck = false;
        private boolean emitGuards = false;
        private boolean preserveFormatting = false;
        private OptionalInt maxLineLength = OptionalInt.empty();
        private boolean skipBlankLineRemoval = false;
        private boolean skipConsolidation = false;
        private final Set<IssueCategory> enabledCategories = EnumSet.allOf(IssueCategory.class);
        private Optional<String> sourceFile = Optional.empty();

        private Builder(Dialect dialect) {
            this.dialect = dialect;
        }

        public Builder strictIdempotency(boolean enabled) {
            this.strictIdempotency = enabled;
            return this;
        }

        public Builder removeNonDeterministic(boolean enabled) {
            this.removeNonDeterministic = enabled;
            return this;
        }

        public Builder trackSideEffects(boolean enabled) {
            this.trackSideEffects = enabled;
            return this;
        }

        public Builder typeCheck(boolean enabled) {
            this.typeCheck = enabled;
            return this;
        }

        public Builder emitGuards(boolean enabled) {
            this.emitGuards = enabled;
            return this;
        }

        public Builder preserveFormatting(boolean enabled) {
            this.preserveFormatting = enabled;
            return this;
        }

        public Builder maxLineLength(int length) {
            this.maxLineLength = OptionalInt.of(length);
            return this;
        }

        public Builder skipBlankLineRemoval(boolean enabled) {
            this.skipBlankLineRemoval = enabled;
            return this;
        }

        public Builder skipConsolidation(boolean enabled) {
            this.skipConsolidation = enabled;
            return this;
        }

        public Builder disable(IssueCategory category) {
            enabledCategories.remove(category);
            return this;
        }

        public Builder enable(IssueCategory category) {
            enabledCategories.add(category);
            return this;
        }

        public Builder sourceFile(String name) {
            this.sourceFile = Optional.of(name);
            return this;
        }

        public PurifyConfig config() {
            return new PurifyConfig(strictIdempotency, removeNonDeterministic, trackSideEffects, typeCheck, emitGuards,
                                    preserveFormatting, maxLineLength, skipBlankLineRemoval, skipConsolidation,
                                    enabledCategories);
        }

        public ParseOutcome<PurificationResult> purify(String source) {
            return ShellPurifier.purify(source, dialect, config(), sourceFile);
        }
    }
}
