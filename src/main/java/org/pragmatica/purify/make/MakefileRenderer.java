package org.pragmatica.purify.make;

import org.pragmatica.purify.format.FormatOptions;
import org.pragmatica.purify.format.LineWrapper;

import java.util.List;

/**
 * Renders a {@link Makefile} back to text.
 */
public final class MakefileRenderer {
    private final FormatOptions options;
    private final StringBuilder out = new StringBuilder();

    private MakefileRenderer(FormatOptions options) {
        this.options = options;
    }

    public static String render(Makefile makefile) {
        return render(makefile, FormatOptions.DEFAULT);
    }

    public static String render(Makefile makefile, FormatOptions options) {
        var renderer = new MakefileRenderer(options);
        renderer.items(makefile.items());
        return renderer.out.toString();
    }

    private void items(List<MakeItem> items) {
        items.forEach(this::item);
    }

    private void item(MakeItem item) {
        if (item instanceof MakeItem.Variable variable) {
            variable(variable);
        } else if (item instanceof MakeItem.Target target) {
            rule(target.name(), target.doubleColon(), target.prerequisites(), target.orderOnly(),
                 target.inlineRecipe().orElse(null), target.recipe());
        } else if (item instanceof MakeItem.PatternRule rule) {
            rule(rule.targetPattern(), rule.doubleColon(), rule.prerequisites(), rule.orderOnly(),
                 rule.inlineRecipe().orElse(null), rule.recipe());
        } else if (item instanceof MakeItem.RecipeLine recipeLine) {
            recipeLine(recipeLine);
        } else if (item instanceof MakeItem.Include include) {
            line(include.keyword() + " " + include.path());
        } else if (item instanceof MakeItem.Conditional conditional) {
            conditional(conditional, false);
            line("endif");
        } else if (item instanceof MakeItem.Define define) {
            line("define " + define.name() + define.flavor().map(flavor -> " " + flavor).orElse(""));
            define.lines().forEach(this::raw);
            line("endef");
        } else if (item instanceof MakeItem.Comment comment) {
            raw("#" + comment.text());
        } else if (item instanceof MakeItem.Directive directive) {
            line(directive.text());
        } else if (item instanceof MakeItem.Blank) {
            if (!options.removeBlankLines()) {
                raw("");
            }
        } else {
            throw new IllegalStateException("Unknown Makefile item " + item.getClass().getSimpleName());
        }
    }

    private void variable(MakeItem.Variable variable) {
        if (keepsSegments(variable.segments())) {
            variable.segments().forEach(this::raw);
            return;
        }
        var sb = new StringBuilder();
        if (variable.override()) {
            sb.append("override ");
        }
        if (variable.exported()) {
            sb.append("export ");
        }
        sb.append(variable.name()).append(' ').append(variable.flavor().symbol());
        if (!variable.value().isEmpty()) {
            sb.append(' ').append(variable.value());
        }
        line(sb.toString());
    }

    private void rule(String targets,
                      boolean doubleColon,
                      List<String> prerequisites,
                      List<String> orderOnly,
                      String inline,
                      List<MakeItem.RecipeLine> recipe) {
        var sb = new StringBuilder(targets).append(doubleColon ? "::" : ":");
        if (!prerequisites.isEmpty()) {
            sb.append(' ').append(String.join(" ", prerequisites));
        }
        if (!orderOnly.isEmpty()) {
            sb.append(" | ").append(String.join(" ", orderOnly));
        }
        if (inline != null) {
            sb.append(';');
            if (!inline.isEmpty()) {
                sb.append(' ').append(inline);
            }
        }
        line(sb.toString());
        recipe.forEach(this::recipeLine);
    }

    private void recipeLine(MakeItem.RecipeLine recipeLine) {
        if (keepsSegments(recipeLine.segments())) {
            recipeLine.segments().forEach(this::raw);
            return;
        }
        line("\t" + recipeLine.text());
    }

    private void conditional(MakeItem.Conditional conditional, boolean chained) {
        line((chained ? "else " : "") + conditional.directive() + " " + conditional.arguments());
        items(conditional.thenItems());
        if (conditional.elseChained()) {
            conditional((MakeItem.Conditional) conditional.elseItems().get(0), true);
        } else if (!conditional.elseItems().isEmpty()) {
            line("else");
            items(conditional.elseItems());
        }
    }

    private boolean keepsSegments(List<String> segments) {
        if (segments.isEmpty()) {
            return false;
        }
        return options.preserveFormatting() || (!options.joinContinuations() && segments.size() > 1);
    }

    private void line(String text) {
        if (options.maxLineLength().isEmpty()) {
            raw(text);
            return;
        }
        boolean recipe = text.startsWith("\t");
        var indent = recipe ? "\t    " : "    ";
        var pieces = LineWrapper.wrap(recipe ? text.substring(1) : text, options.maxLineLength().getAsInt(), indent);
        if (recipe) {
            pieces.set(0, "\t" + pieces.get(0));
        }
        pieces.forEach(this::raw);
    }

    private void raw(String text) {
        out.append(text).append('\n');
    }
}
