package org.pragmatica.purify.analysis;

import org.pragmatica.purify.make.MakeItem;
import org.pragmatica.purify.make.Makefile;
import org.pragmatica.purify.tree.SourceSpan;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Read-only index of a Makefile for the rule catalog: its variables, its rules with their
 * recipes, and the special targets it declares.
 */
public final class MakefileFacts {
    private final List<MakeItem.Variable> variables;
    private final List<Rule> rules;
    private final Set<String> specialTargets;
    private final boolean bashShell;

    /**
     * A target or pattern rule. Recipe lines separated from their rule by a comment or
     * conditional are attached to the rule that precedes them.
     */
    public record Rule(String name,
                       List<String> prerequisites,
                       List<MakeItem.RecipeLine> recipe,
                       boolean phony,
                       SourceSpan span) {
        public List<String> targets() {
            return List.of(name.strip().split("\\s+"));
        }

        public boolean dependsOn(String target) {
            return prerequisites.contains(target);
        }
    }

    private MakefileFacts(List<MakeItem.Variable> variables, List<Rule> rules, Set<String> specialTargets, boolean bashShell) {
        this.variables = variables;
        this.rules = rules;
        this.specialTargets = specialTargets;
        this.bashShell = bashShell;
    }

    public static MakefileFacts of(Makefile makefile) {
        var variables = new ArrayList<MakeItem.Variable>();
        var rules = new ArrayList<Rule>();
        var special = new TreeSet<String>();
        var pendingRecipe = new ArrayList<MakeItem.RecipeLine>();

        collect(makefile.items(), variables, rules, special, pendingRecipe);
        flush(rules, pendingRecipe);

        boolean bash = variables.stream()
                                .anyMatch(variable -> variable.name().equals("SHELL") && variable.value().contains("bash"));
        return new MakefileFacts(List.copyOf(variables), List.copyOf(rules), special, bash);
    }

    private static void collect(List<MakeItem> items,
                                List<MakeItem.Variable> variables,
                                List<Rule> rules,
                                Set<String> special,
                                List<MakeItem.RecipeLine> pendingRecipe) {
        for (var item : items) {
            if (item instanceof MakeItem.Variable variable) {
                variables.add(variable);
            } else if (item instanceof MakeItem.Target target) {
                flush(rules, pendingRecipe);
                if (target.name().startsWith(".")) {
                    special.add(target.name());
                } else {
                    rules.add(new Rule(target.name(), target.prerequisites(), target.recipe(), target.phony(), target.span()));
                }
            } else if (item instanceof MakeItem.PatternRule rule) {
                flush(rules, pendingRecipe);
                rules.add(new Rule(rule.targetPattern(), rule.prerequisites(), rule.recipe(), false, rule.span()));
            } else if (item instanceof MakeItem.RecipeLine line) {
                pendingRecipe.add(line);
            } else if (item instanceof MakeItem.Conditional conditional) {
                collect(conditional.thenItems(), variables, rules, special, pendingRecipe);
                collect(conditional.elseItems(), variables, rules, special, pendingRecipe);
            }
        }
    }

    private static void flush(List<Rule> rules, List<MakeItem.RecipeLine> pending) {
        if (pending.isEmpty() || rules.isEmpty()) {
            pending.clear();
            return;
        }
        var last = rules.remove(rules.size() - 1);
        var recipe = new ArrayList<>(last.recipe());
        recipe.addAll(pending);
        rules.add(new Rule(last.name(), last.prerequisites(), List.copyOf(recipe), last.phony(), last.span()));
        pending.clear();
    }

    public List<MakeItem.Variable> variables() {
        return variables;
    }

    public List<Rule> rules() {
        return rules;
    }

    public boolean hasSpecialTarget(String name) {
        return specialTargets.contains(name);
    }

    /**
     * Whether {@code SHELL} is set to bash, which makes bash syntax in recipes legitimate.
     */
    public boolean bashShell() {
        return bashShell;
    }

    /**
     * Recipe text without the {@code @}, {@code -} and {@code +} prefixes.
     */
    public static String command(MakeItem.RecipeLine line) {
        var text = line.text().strip();
        int i = 0;
        while (i < text.length() && (text.charAt(i) == '@' || text.charAt(i) == '-' || text.charAt(i) == '+')) {
            i++;
        }
        return text.substring(i).strip();
    }

    /**
     * Whether the recipe line ignores its exit status with a {@code -} prefix.
     */
    public static boolean ignoresErrors(MakeItem.RecipeLine line) {
        var text = line.text().strip();
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '-') {
                return true;
            }
            if (c != '@' && c != '+') {
                return false;
            }
        }
        return false;
    }
}
