package org.pragmatica.purify.make;

import org.pragmatica.purify.tree.SourceSpan;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Top-level and nested items of a Makefile.
 *
 * <p>Items that may span continuation lines keep the physical {@code segments} they were
 * parsed from, so formatting can be preserved on request. An empty segment list means the
 * item was produced by a rewrite and has no original text.
 */
public sealed interface MakeItem {
    SourceSpan span();

    enum Flavor {
        RECURSIVE("="),
        SIMPLE(":="),
        POSIX_SIMPLE("::="),
        CONDITIONAL("?="),
        APPEND("+="),
        SHELL("!=");

        private final String symbol;

        Flavor(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        public static Optional<Flavor> fromSymbol(String symbol) {
            return Arrays.stream(values())
                         .filter(flavor -> flavor.symbol.equals(symbol))
                         .findFirst();
        }
    }

    record Variable(String name,
                    Flavor flavor,
                    String value,
                    List<String> segments,
                    boolean exported,
                    boolean override,
                    SourceSpan span) implements MakeItem {
        public Variable withValue(String newValue) {
            return new Variable(name, flavor, newValue, List.of(), exported, override, span);
        }
    }

    /**
     * Explicit rule. {@code name} holds the target list as written.
     */
    record Target(String name,
                  List<String> prerequisites,
                  List<String> orderOnly,
                  Optional<String> inlineRecipe,
                  List<RecipeLine> recipe,
                  boolean phony,
                  boolean doubleColon,
                  SourceSpan span) implements MakeItem {
        public Target withPhony(boolean isPhony) {
            return new Target(name, prerequisites, orderOnly, inlineRecipe, recipe, isPhony, doubleColon, span);
        }

        public Target withRecipe(List<RecipeLine> newRecipe) {
            return new Target(name, prerequisites, orderOnly, inlineRecipe, List.copyOf(newRecipe), phony, doubleColon, span);
        }
    }

    /**
     * Rule whose target contains {@code %}.
     */
    record PatternRule(String targetPattern,
                       List<String> prerequisites,
                       List<String> orderOnly,
                       Optional<String> inlineRecipe,
                       List<RecipeLine> recipe,
                       boolean doubleColon,
                       SourceSpan span) implements MakeItem {
        public PatternRule withRecipe(List<RecipeLine> newRecipe) {
            return new PatternRule(targetPattern, prerequisites, orderOnly, inlineRecipe, List.copyOf(newRecipe), doubleColon, span);
        }
    }

    /**
     * Tab-prefixed shell line. {@code text} excludes the tab and has continuations joined.
     * Appears inside a rule, or on its own when a comment or conditional separates it from
     * the rule it belongs to.
     */
    record RecipeLine(String text, List<String> segments, SourceSpan span) implements MakeItem {
        public RecipeLine withText(String newText) {
            return new RecipeLine(newText, List.of(), span);
        }
    }

    record Include(String path, boolean optional, String keyword, SourceSpan span) implements MakeItem {}

    /**
     * {@code ifeq}/{@code ifneq}/{@code ifdef}/{@code ifndef} block. With {@code elseChained},
     * {@code elseItems} holds the single conditional written as {@code else ifeq ...}.
     */
    record Conditional(String directive,
                       String arguments,
                       List<MakeItem> thenItems,
                       List<MakeItem> elseItems,
                       boolean elseChained,
                       SourceSpan span) implements MakeItem {}

    record Define(String name, Optional<String> flavor, List<String> lines, SourceSpan span) implements MakeItem {}

    record Comment(String text, SourceSpan span) implements MakeItem {}

    /**
     * Any other line, such as {@code vpath}, {@code unexport} or a bare function call.
     */
    record Directive(String text, SourceSpan span) implements MakeItem {}

    record Blank(SourceSpan span) implements MakeItem {}
}
