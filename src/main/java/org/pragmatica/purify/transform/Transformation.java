package org.pragmatica.purify.transform;

import org.pragmatica.purify.analysis.IssueCategory;
import org.pragmatica.purify.analysis.SemanticIssue;
import org.pragmatica.purify.analysis.TypeChecker.ShellType;
import org.pragmatica.purify.tree.SourceSpan;

import java.util.Optional;

/**
 * A planned change to a syntax tree. Structural variants name the node they rewrite by span
 * and are safe; {@link Advisory} documents an issue that needs a human decision.
 */
public sealed interface Transformation {

    String ruleId();

    IssueCategory category();

    SourceSpan span();

    default boolean safe() {
        return true;
    }

    String description();

    // === Shell ===

    /**
     * Adds an option to a command. When an existing short-option cluster holds {@code mergeWith},
     * the flag letter joins that cluster instead, turning {@code -s} into {@code -sf}.
     */
    record AddFlag(String ruleId, IssueCategory category, SourceSpan span, String command, String flag,
                   Optional<Character> mergeWith) implements Transformation {
        @Override
        public String description() {
            return mergeWith.map(letter -> "Changed " + command + " -" + letter + " to -" + letter + flag.substring(1))
                            .orElse("Added " + flag + " to " + command);
        }
    }

    record QuoteExpansion(String ruleId, IssueCategory category, SourceSpan span) implements Transformation {
        @Override
        public String description() {
            return "Quoted expansion to prevent word splitting";
        }
    }

    record RenameCommand(String ruleId, IssueCategory category, SourceSpan span, String from, String to) implements Transformation {
        @Override
        public String description() {
            return "Replaced '" + from + "' with '" + to + "'";
        }
    }

    record ConvertFunctionSyntax(String ruleId, IssueCategory category, SourceSpan span, String name) implements Transformation {
        @Override
        public String description() {
            return "Converted 'function " + name + "' to '" + name + "()'";
        }
    }

    record ConvertExtendedTest(String ruleId, IssueCategory category, SourceSpan span) implements Transformation {
        @Override
        public String description() {
            return "Converted [[ ]] to [ ] with quoted operands";
        }
    }

    record ReplaceShebang(String ruleId, IssueCategory category, SourceSpan span, String interpreter) implements Transformation {
        @Override
        public String description() {
            return "Replaced shebang with #!" + interpreter;
        }
    }

    /**
     * Inserts {@code sort} after {@code find} in the pipeline of a command substitution.
     */
    record PipeThroughSort(String ruleId, IssueCategory category, SourceSpan span) implements Transformation {
        @Override
        public String description() {
            return "Piped find output through sort";
        }
    }

    /**
     * Emits a runtime check after an assignment to a typed variable.
     */
    record InsertTypeGuard(String ruleId, IssueCategory category, SourceSpan span, String variable, ShellType type)
        implements Transformation {
        @Override
        public String description() {
            return "Inserted " + type.display() + " guard for '" + variable + "'";
        }
    }

    // === Makefile ===

    /**
     * Wraps unsorted calls of a make function in a variable value with {@code $(sort ...)}.
     * A non-empty {@code command} limits {@code $(shell ...)} calls to that command.
     */
    record WrapWithSort(String ruleId, IssueCategory category, SourceSpan span, String function, String command)
        implements Transformation {
        @Override
        public String description() {
            return "Wrapped $(" + function + (command.isEmpty() ? "" : " " + command) + " ...) with $(sort ...)";
        }
    }

    // === Dockerfile ===

    record PinBaseImage(String ruleId, IssueCategory category, SourceSpan span, String image, String tag)
        implements Transformation {
        @Override
        public String description() {
            return "Pinned base image " + image + " to " + image + ":" + tag;
        }
    }

    record ConvertAddToCopy(String ruleId, IssueCategory category, SourceSpan span) implements Transformation {
        @Override
        public String description() {
            return "Converted ADD to COPY for local files";
        }
    }

    record AddAptFlag(String ruleId, IssueCategory category, SourceSpan span, String flag) implements Transformation {
        @Override
        public String description() {
            return "Added " + flag + " to apt-get install";
        }
    }

    record AddPackageCleanup(String ruleId, IssueCategory category, SourceSpan span, String cleanup) implements Transformation {
        @Override
        public String description() {
            return "Appended '" + cleanup + "' to remove the package cache";
        }
    }

    // === Manual ===

    /**
     * An issue left for a human. {@code downgraded} marks a safe transformation whose target was
     * gone or already changed when the rewriter reached it.
     */
    record Advisory(String ruleId,
                    IssueCategory category,
                    SourceSpan span,
                    String message,
                    Optional<String> suggestion,
                    boolean downgraded) implements Transformation {

        public static Advisory of(SemanticIssue issue) {
            return new Advisory(issue.rule(), issue.category(), issue.span(), issue.message(), issue.fix(), false);
        }

        public static Advisory downgrade(Transformation transformation, String reason) {
            return new Advisory(transformation.ruleId(), transformation.category(), transformation.span(),
                                "Not applied: " + transformation.description() + " (" + reason + ")", Optional.empty(), true);
        }

        @Override
        public boolean safe() {
            return false;
        }

        @Override
        public String description() {
            return suggestion.map(text -> message + ". Suggestion: " + text).orElse(message);
        }
    }
}
