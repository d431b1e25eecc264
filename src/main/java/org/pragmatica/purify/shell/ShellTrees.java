package org.pragmatica.purify.shell;

import org.pragmatica.purify.shell.ShellExpression.ArrayLiteral;
import org.pragmatica.purify.shell.ShellExpression.CommandCondition;
import org.pragmatica.purify.shell.ShellExpression.CommandSubstitution;
import org.pragmatica.purify.shell.ShellExpression.Concat;
import org.pragmatica.purify.shell.ShellExpression.Literal;
import org.pragmatica.purify.shell.ShellExpression.ParamExpansion;
import org.pragmatica.purify.shell.ShellExpression.Test;
import org.pragmatica.purify.shell.ShellStatement.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Traversal and query helpers over shell syntax trees.
 */
public final class ShellTrees {
    private ShellTrees() {}

    /**
     * Callbacks for {@link #walk}. Nodes are reported in source order, parents before children.
     */
    public interface Visitor {
        default void statement(ShellStatement statement) {}

        default void expression(ShellExpression expression) {}

        default void redirect(Redirect redirect) {}

        /**
         * A statement block (script, body, branch or substitution) is entered.
         */
        default void enterBlock() {}

        default void exitBlock() {}
    }

    public static void walk(List<ShellStatement> statements, Visitor visitor) {
        visitor.enterBlock();
        for (var statement : statements) {
            walkStatement(statement, visitor);
        }
        visitor.exitBlock();
    }

    public static void walkStatement(ShellStatement statement, Visitor visitor) {
        visitor.statement(statement);
        if (statement instanceof Command command) {
            command.prefix().forEach(assignment -> walkStatement(assignment, visitor));
            command.args().forEach(arg -> walkExpression(arg, visitor));
            command.redirects().forEach(redirect -> walkRedirect(redirect, visitor));
        } else if (statement instanceof Pipeline pipeline) {
            pipeline.commands().forEach(command -> walkStatement(command, visitor));
        } else if (statement instanceof AndList andList) {
            walkStatement(andList.left(), visitor);
            walkStatement(andList.right(), visitor);
        } else if (statement instanceof OrList orList) {
            walkStatement(orList.left(), visitor);
            walkStatement(orList.right(), visitor);
        } else if (statement instanceof If ifStatement) {
            walkExpression(ifStatement.condition(), visitor);
            walk(ifStatement.thenBranch(), visitor);
            for (var elif : ifStatement.elifs()) {
                walkExpression(elif.condition(), visitor);
                walk(elif.body(), visitor);
            }
            ifStatement.elseBranch().ifPresent(body -> walk(body, visitor));
        } else if (statement instanceof While loop) {
            walkExpression(loop.condition(), visitor);
            walk(loop.body(), visitor);
        } else if (statement instanceof Until loop) {
            walkExpression(loop.condition(), visitor);
            walk(loop.body(), visitor);
        } else if (statement instanceof For loop) {
            loop.items().ifPresent(items -> items.forEach(item -> walkExpression(item, visitor)));
            walk(loop.body(), visitor);
        } else if (statement instanceof ForCStyle loop) {
            walk(loop.body(), visitor);
        } else if (statement instanceof Case caseStatement) {
            walkExpression(caseStatement.word(), visitor);
            caseStatement.arms().forEach(arm -> walk(arm.body(), visitor));
        } else if (statement instanceof Select select) {
            select.items().ifPresent(items -> items.forEach(item -> walkExpression(item, visitor)));
            walk(select.body(), visitor);
        } else if (statement instanceof Function function) {
            walk(function.body(), visitor);
        } else if (statement instanceof Group group) {
            walk(group.body(), visitor);
        } else if (statement instanceof Negated negated) {
            walkStatement(negated.statement(), visitor);
        } else if (statement instanceof Coproc coproc) {
            walkStatement(coproc.body(), visitor);
        } else if (statement instanceof Assignment assignment) {
            walkExpression(assignment.value(), visitor);
        } else if (statement instanceof Return returnStatement) {
            returnStatement.code().ifPresent(code -> walkExpression(code, visitor));
        } else if (statement instanceof Exit exit) {
            exit.code().ifPresent(code -> walkExpression(code, visitor));
        } else if (statement instanceof Background background) {
            walkStatement(background.statement(), visitor);
        } else if (statement instanceof TestCommand testCommand) {
            walkExpression(testCommand.test(), visitor);
        } else if (statement instanceof Redirected redirected) {
            walkStatement(redirected.body(), visitor);
            redirected.redirects().forEach(redirect -> walkRedirect(redirect, visitor));
        }
    }

    public static void walkExpression(ShellExpression expression, Visitor visitor) {
        visitor.expression(expression);
        if (expression instanceof Concat concat) {
            concat.parts().forEach(part -> walkExpression(part, visitor));
        } else if (expression instanceof ArrayLiteral array) {
            array.elements().forEach(element -> walkExpression(element, visitor));
        } else if (expression instanceof ParamExpansion expansion) {
            expansion.operand().ifPresent(operand -> walkExpression(operand, visitor));
        } else if (expression instanceof CommandSubstitution substitution) {
            walk(substitution.body(), visitor);
        } else if (expression instanceof CommandCondition condition) {
            walkStatement(condition.statement(), visitor);
        } else if (expression instanceof Test test) {
            testOperands(test.test()).forEach(operand -> walkExpression(operand, visitor));
        }
    }

    private static void walkRedirect(Redirect redirect, Visitor visitor) {
        visitor.redirect(redirect);
        if (redirect instanceof Redirect.FileRedirect file) {
            walkExpression(file.target(), visitor);
        } else if (redirect instanceof Redirect.HereString hereString) {
            walkExpression(hereString.target(), visitor);
        }
    }

    /**
     * Word operands of a test expression in source order.
     */
    public static List<ShellExpression> testOperands(TestExpr test) {
        var operands = new ArrayList<ShellExpression>();
        collectOperands(test, operands);
        return operands;
    }

    private static void collectOperands(TestExpr test, List<ShellExpression> operands) {
        if (test instanceof TestExpr.Unary unary) {
            operands.add(unary.operand());
        } else if (test instanceof TestExpr.Binary binary) {
            operands.add(binary.left());
            operands.add(binary.right());
        } else if (test instanceof TestExpr.Word word) {
            operands.add(word.word());
        } else if (test instanceof TestExpr.Not not) {
            collectOperands(not.operand(), operands);
        } else if (test instanceof TestExpr.And and) {
            collectOperands(and.left(), operands);
            collectOperands(and.right(), operands);
        } else if (test instanceof TestExpr.Or or) {
            collectOperands(or.left(), operands);
            collectOperands(or.right(), operands);
        } else if (test instanceof TestExpr.Group group) {
            collectOperands(group.inner(), operands);
        }
    }

    /**
     * Counts statement nodes reachable through statement bodies and conditions. Statements
     * inside command substitutions belong to an expression and are not counted.
     */
    public static int countStatements(List<ShellStatement> statements) {
        int count = 0;
        for (var statement : statements) {
            count += 1 + countStatements(childStatements(statement));
        }
        return count;
    }

    /**
     * Direct child statements, including commands used as conditions.
     */
    public static List<ShellStatement> childStatements(ShellStatement statement) {
        var children = new ArrayList<ShellStatement>();
        if (statement instanceof Command command) {
            children.addAll(command.prefix());
        } else if (statement instanceof Pipeline pipeline) {
            children.addAll(pipeline.commands());
        } else if (statement instanceof AndList andList) {
            children.add(andList.left());
            children.add(andList.right());
        } else if (statement instanceof OrList orList) {
            children.add(orList.left());
            children.add(orList.right());
        } else if (statement instanceof If ifStatement) {
            addCondition(ifStatement.condition(), children);
            children.addAll(ifStatement.thenBranch());
            for (var elif : ifStatement.elifs()) {
                addCondition(elif.condition(), children);
                children.addAll(elif.body());
            }
            ifStatement.elseBranch().ifPresent(children::addAll);
        } else if (statement instanceof While loop) {
            addCondition(loop.condition(), children);
            children.addAll(loop.body());
        } else if (statement instanceof Until loop) {
            addCondition(loop.condition(), children);
            children.addAll(loop.body());
        } else if (statement instanceof For loop) {
            children.addAll(loop.body());
        } else if (statement instanceof ForCStyle loop) {
            children.addAll(loop.body());
        } else if (statement instanceof Case caseStatement) {
            caseStatement.arms().forEach(arm -> children.addAll(arm.body()));
        } else if (statement instanceof Select select) {
            children.addAll(select.body());
        } else if (statement instanceof Function function) {
            children.addAll(function.body());
        } else if (statement instanceof Group group) {
            children.addAll(group.body());
        } else if (statement instanceof Negated negated) {
            children.add(negated.statement());
        } else if (statement instanceof Coproc coproc) {
            children.add(coproc.body());
        } else if (statement instanceof Background background) {
            children.add(background.statement());
        } else if (statement instanceof Redirected redirected) {
            children.add(redirected.body());
        }
        return children;
    }

    private static void addCondition(ShellExpression condition, List<ShellStatement> children) {
        if (condition instanceof CommandCondition commandCondition) {
            children.add(commandCondition.statement());
        }
    }

    /**
     * Text of a word made only of literal parts, such as {@code foo}, {@code 'foo'} or {@code "foo"}.
     */
    public static Optional<String> literalText(ShellExpression expression) {
        if (expression instanceof Literal literal) {
            return Optional.of(literal.value());
        }
        if (expression instanceof Concat concat) {
            var sb = new StringBuilder();
            for (var part : concat.parts()) {
                var text = literalText(part);
                if (text.isEmpty()) {
                    return Optional.empty();
                }
                sb.append(text.get());
            }
            return Optional.of(sb.toString());
        }
        return Optional.empty();
    }

    /**
     * Whether the expression references a variable accepted by the predicate, looking inside
     * quotes, expansions and command substitutions.
     */
    public static boolean referencesVariable(ShellExpression expression, Predicate<String> names) {
        var found = new boolean[1];
        walkExpression(expression, new Visitor() {
            @Override
            public void expression(ShellExpression nested) {
                if (nested instanceof ShellExpression.Variable variable && names.test(variable.name())) {
                    found[0] = true;
                } else if (nested instanceof ParamExpansion expansion && names.test(expansion.name())) {
                    found[0] = true;
                } else if (nested instanceof ShellExpression.Arithmetic arithmetic
                           && arithmetic.expression().variables().stream().anyMatch(names)) {
                    found[0] = true;
                }
            }
        });
        return found[0];
    }

    /**
     * Whether the expression runs a command accepted by the predicate inside a substitution.
     */
    public static boolean invokesCommand(ShellExpression expression, Predicate<Command> matcher) {
        var found = new boolean[1];
        walkExpression(expression, new Visitor() {
            @Override
            public void statement(ShellStatement statement) {
                if (statement instanceof Command command && matcher.test(command)) {
                    found[0] = true;
                }
            }
        });
        return found[0];
    }

    /**
     * Literal texts of a command's arguments; non-literal arguments yield an empty string.
     */
    public static List<String> argumentTexts(Command command) {
        return command.args().stream()
                      .map(arg -> literalText(arg).orElse(""))
                      .toList();
    }

    /**
     * Whether any option-looking argument ({@code -x}, {@code -xyz}) contains the letter, or any
     * argument equals one of the long forms.
     */
    public static boolean hasFlag(Command command, char letter, String... longForms) {
        for (var text : argumentTexts(command)) {
            if (text.equals("--")) {
                return false;
            }
            if (text.startsWith("--")) {
                for (var longForm : longForms) {
                    if (text.equals(longForm)) {
                        return true;
                    }
                }
            } else if (text.startsWith("-") && text.length() > 1 && text.indexOf(letter, 1) > 0) {
                return true;
            }
        }
        return false;
    }
}
