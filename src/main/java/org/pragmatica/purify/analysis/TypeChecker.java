package org.pragmatica.purify.analysis;

import org.pragmatica.purify.shell.ArithExpr;
import org.pragmatica.purify.shell.ShellExpression;
import org.pragmatica.purify.shell.ShellScript;
import org.pragmatica.purify.shell.ShellStatement;
import org.pragmatica.purify.shell.ShellTrees;
import org.pragmatica.purify.tree.SourceSpan;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.BiConsumer;
import java.util.regex.Pattern;

/**
 * Gradual type checker for shell variables.
 *
 * <p>Types come from {@code # @type name: int} comments and from {@code declare -i},
 * {@code typeset -i} and {@code local -i}. Untyped variables are never checked, and values
 * that are not literal are assumed to fit.
 */
public final class TypeChecker {
    private static final Pattern ANNOTATION = Pattern.compile("\\s*@type\\s+([A-Za-z_][A-Za-z0-9_]*)\\s*:\\s*(\\w+)\\s*");
    private static final Pattern INTEGER = Pattern.compile("-?[0-9]+");

    public enum ShellType {
        INT,
        BOOL,
        STRING,
        PATH;

        public static Optional<ShellType> fromName(String name) {
            return switch (name.toLowerCase(Locale.ROOT)) {
                case "int", "integer" -> Optional.of(INT);
                case "bool", "boolean" -> Optional.of(BOOL);
                case "str", "string" -> Optional.of(STRING);
                case "path" -> Optional.of(PATH);
                default -> Optional.empty();
            };
        }

        public String display() {
            return name().toLowerCase(Locale.ROOT);
        }

        boolean accepts(ShellExpression value) {
            if (this == STRING || this == PATH) {
                return true;
            }
            if (value instanceof ShellExpression.Arithmetic) {
                return this == INT;
            }
            return ShellTrees.literalText(value)
                             .map(text -> this == INT ? INTEGER.matcher(text).matches()
                                                      : text.equals("true") || text.equals("false"))
                             .orElse(true);
        }
    }

    /**
     * Assignment to a variable whose declared type can be checked at run time.
     */
    public record TypedAssignment(String name, ShellType type, SourceSpan span) {}

    private final Map<String, ShellType> declared = new HashMap<>();
    private final List<SemanticIssue> issues = new ArrayList<>();
    private final Map<SourceSpan, TypedAssignment> typed = new LinkedHashMap<>();

    private TypeChecker() {}

    public static List<SemanticIssue> check(ShellScript script) {
        return run(script).issues;
    }

    /**
     * Assignments to {@code int} and {@code bool} variables, in source order.
     */
    public static List<TypedAssignment> typedAssignments(ShellScript script) {
        return List.copyOf(run(script).typed.values());
    }

    private static TypeChecker run(ShellScript script) {
        var checker = new TypeChecker();
        ShellTrees.walk(script.statements(), new ShellTrees.Visitor() {
            @Override
            public void statement(ShellStatement statement) {
                checker.statement(statement);
            }

            @Override
            public void expression(ShellExpression expression) {
                if (expression instanceof ShellExpression.Arithmetic arithmetic) {
                    checker.arithmetic(arithmetic.expression(), arithmetic.span());
                }
            }
        });
        return checker;
    }

    private void statement(ShellStatement statement) {
        if (statement instanceof ShellStatement.Comment comment) {
            var matcher = ANNOTATION.matcher(comment.text());
            if (matcher.matches()) {
                ShellType.fromName(matcher.group(2)).ifPresent(type -> declared.put(matcher.group(1), type));
            }
        } else if (statement instanceof ShellStatement.Assignment assignment) {
            var type = declared.get(assignment.name());
            if (type != null) {
                checkValue(assignment.name(), type, assignment.value(), assignment.span());
            }
        } else if (statement instanceof ShellStatement.Command command) {
            integerDeclarations(command, (name, value) -> {
                declared.put(name, ShellType.INT);
                value.ifPresent(text -> checkLiteral(name, text, command.span()));
            });
        } else if (statement instanceof ShellStatement.ArithCommand command) {
            arithmetic(command.expression(), command.span());
        }
    }

    private void integerDeclarations(ShellStatement.Command command, BiConsumer<String, Optional<String>> onDeclaration) {
        var name = command.name();
        if (!name.equals("declare") && !name.equals("typeset") && !name.equals("local")) {
            return;
        }
        if (!ShellTrees.hasFlag(command, 'i')) {
            return;
        }
        for (var text : ShellTrees.argumentTexts(command)) {
            if (text.isEmpty() || text.startsWith("-")) {
                continue;
            }
            int equals = text.indexOf('=');
            if (equals < 0) {
                onDeclaration.accept(text, Optional.empty());
            } else {
                onDeclaration.accept(text.substring(0, equals), Optional.of(text.substring(equals + 1)));
            }
        }
    }

    private void checkValue(String name, ShellType type, ShellExpression value, SourceSpan span) {
        if (type == ShellType.INT || type == ShellType.BOOL) {
            typed.put(span, new TypedAssignment(name, type, span));
        }
        if (!type.accepts(value)) {
            var shown = ShellTrees.literalText(value).orElse("value");
            issues.add(mismatch(name, type, shown, span));
        }
    }

    private void checkLiteral(String name, String text, SourceSpan span) {
        if (!INTEGER.matcher(text).matches()) {
            issues.add(mismatch(name, ShellType.INT, text, span));
        }
    }

    private void arithmetic(ArithExpr expression, SourceSpan span) {
        expression.variables()
                  .stream()
                  .distinct()
                  .filter(name -> declared.get(name) == ShellType.STRING)
                  .forEach(name -> issues.add(
                      SemanticIssue.of("TYPE002", IssueCategory.ERROR_HANDLING, IssueSeverity.MEDIUM, span,
                                       "String variable '" + name + "' is used in arithmetic")
                                   .withFix("Declare '" + name + "' as int or convert it before the arithmetic")));
    }

    private static SemanticIssue mismatch(String name, ShellType type, String shown, SourceSpan span) {
        return SemanticIssue.of("TYPE001", IssueCategory.ERROR_HANDLING, IssueSeverity.HIGH, span,
                                "Value '" + shown + "' assigned to '" + name + "' is not a valid " + type.display())
                            .withFix("Assign a " + type.display() + " value or change the declared type of '" + name + "'");
    }
}
