package org.pragmatica.purify.transform;

import org.pragmatica.purify.shell.CaseArm;
import org.pragmatica.purify.shell.Redirect;
import org.pragmatica.purify.shell.ShellExpression;
import org.pragmatica.purify.shell.ShellStatement;
import org.pragmatica.purify.shell.ShellStatement.*;
import org.pragmatica.purify.shell.TestExpr;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Bottom-up copy of a shell tree. Subclasses override the hooks to replace nodes; every node is
 * rebuilt after its children, so a hook sees children that were already rewritten.
 */
abstract class ShellTreeMapper {

    protected ShellStatement rewriteStatement(ShellStatement statement) {
        return statement;
    }

    protected ShellExpression rewriteExpression(ShellExpression expression) {
        return expression;
    }

    /**
     * Statements to put in place of one statement of a block, after it was rewritten.
     */
    protected List<ShellStatement> expand(ShellStatement statement) {
        return List.of(statement);
    }

    final List<ShellStatement> statements(List<ShellStatement> statements) {
        var result = new ArrayList<ShellStatement>();
        for (var statement : statements) {
            result.addAll(expand(statement(statement)));
        }
        return result;
    }

    final ShellStatement statement(ShellStatement statement) {
        return rewriteStatement(children(statement));
    }

    final ShellExpression expression(ShellExpression expression) {
        return rewriteExpression(children(expression));
    }

    private ShellStatement children(ShellStatement statement) {
        if (statement instanceof Command command) {
            return new Command(command.name(), expressions(command.args()), redirects(command.redirects()),
                               command.prefix().stream().map(this::assignment).toList(), command.span());
        }
        if (statement instanceof Pipeline pipeline) {
            return new Pipeline(pipeline.commands().stream().map(this::statement).toList(), pipeline.stderrJoins(), pipeline.span());
        }
        if (statement instanceof AndList andList) {
            return new AndList(statement(andList.left()), statement(andList.right()), andList.span());
        }
        if (statement instanceof OrList orList) {
            return new OrList(statement(orList.left()), statement(orList.right()), orList.span());
        }
        if (statement instanceof If ifStatement) {
            var elifs = ifStatement.elifs()
                                   .stream()
                                   .map(elif -> new ElifBranch(expression(elif.condition()), statements(elif.body())))
                                   .toList();
            return new If(expression(ifStatement.condition()), statements(ifStatement.thenBranch()), elifs,
                          ifStatement.elseBranch().map(this::statements), ifStatement.span());
        }
        if (statement instanceof While loop) {
            return new While(expression(loop.condition()), statements(loop.body()), loop.span());
        }
        if (statement instanceof Until loop) {
            return new Until(expression(loop.condition()), statements(loop.body()), loop.span());
        }
        if (statement instanceof For loop) {
            return new For(loop.variable(), loop.items().map(this::expressions), statements(loop.body()), loop.span());
        }
        if (statement instanceof ForCStyle loop) {
            return new ForCStyle(loop.init(), loop.condition(), loop.increment(), statements(loop.body()), loop.span());
        }
        if (statement instanceof Case caseStatement) {
            var arms = caseStatement.arms()
                                    .stream()
                                    .map(arm -> new CaseArm(arm.patterns(), statements(arm.body()), arm.terminator(), arm.span()))
                                    .toList();
            return new Case(expression(caseStatement.word()), arms, caseStatement.span());
        }
        if (statement instanceof Select select) {
            return new Select(select.variable(), select.items().map(this::expressions), statements(select.body()), select.span());
        }
        if (statement instanceof Function function) {
            return new Function(function.name(), statements(function.body()), function.keywordSyntax(), function.span());
        }
        if (statement instanceof Group group) {
            return new Group(statements(group.body()), group.subshell(), group.span());
        }
        if (statement instanceof Negated negated) {
            return new Negated(statement(negated.statement()), negated.span());
        }
        if (statement instanceof Coproc coproc) {
            return new Coproc(coproc.name(), statement(coproc.body()), coproc.span());
        }
        if (statement instanceof Assignment assignment) {
            return assignmentChildren(assignment);
        }
        if (statement instanceof Return returnStatement) {
            return new Return(returnStatement.code().map(this::expression), returnStatement.span());
        }
        if (statement instanceof Exit exit) {
            return new Exit(exit.code().map(this::expression), exit.span());
        }
        if (statement instanceof Background background) {
            return new Background(statement(background.statement()), background.span());
        }
        if (statement instanceof TestCommand testCommand) {
            var test = expression(testCommand.test());
            if (test instanceof ShellExpression.Test rewritten) {
                return new TestCommand(rewritten, testCommand.span());
            }
            throw new IllegalStateException("Test command operand rewritten to " + test.getClass().getSimpleName());
        }
        if (statement instanceof Redirected redirected) {
            return new Redirected(statement(redirected.body()), redirects(redirected.redirects()), redirected.span());
        }
        return statement;
    }

    private Assignment assignment(Assignment assignment) {
        var rewritten = statement(assignment);
        if (rewritten instanceof Assignment result) {
            return result;
        }
        throw new IllegalStateException("Prefix assignment rewritten to " + rewritten.getClass().getSimpleName());
    }

    private Assignment assignmentChildren(Assignment assignment) {
        return new Assignment(assignment.name(), assignment.index(), expression(assignment.value()), assignment.kind(),
                              assignment.append(), assignment.span());
    }

    private ShellExpression children(ShellExpression expression) {
        if (expression instanceof ShellExpression.ArrayLiteral array) {
            return new ShellExpression.ArrayLiteral(expressions(array.elements()), array.span());
        }
        if (expression instanceof ShellExpression.CommandSubstitution substitution) {
            return new ShellExpression.CommandSubstitution(statements(substitution.body()), substitution.backtick(),
                                                           substitution.span());
        }
        if (expression instanceof ShellExpression.Test test) {
            return new ShellExpression.Test(test(test.test()), test.extended(), test.span());
        }
        if (expression instanceof ShellExpression.CommandCondition condition) {
            return new ShellExpression.CommandCondition(statement(condition.statement()), condition.span());
        }
        if (expression instanceof ShellExpression.Concat concat) {
            return new ShellExpression.Concat(expressions(concat.parts()), concat.doubleQuoted(), concat.span());
        }
        if (expression instanceof ShellExpression.ParamExpansion expansion) {
            return new ShellExpression.ParamExpansion(expansion.name(), expansion.operator(),
                                                      expansion.operand().map(this::expression), expansion.span());
        }
        return expression;
    }

    private TestExpr test(TestExpr test) {
        if (test instanceof TestExpr.Unary unary) {
            return new TestExpr.Unary(unary.operator(), expression(unary.operand()), unary.span());
        }
        if (test instanceof TestExpr.Binary binary) {
            return new TestExpr.Binary(binary.operator(), expression(binary.left()), expression(binary.right()), binary.span());
        }
        if (test instanceof TestExpr.Word word) {
            return new TestExpr.Word(expression(word.word()), word.span());
        }
        if (test instanceof TestExpr.Not not) {
            return new TestExpr.Not(test(not.operand()), not.span());
        }
        if (test instanceof TestExpr.And and) {
            return new TestExpr.And(test(and.left()), test(and.right()), and.span());
        }
        if (test instanceof TestExpr.Or or) {
            return new TestExpr.Or(test(or.left()), test(or.right()), or.span());
        }
        if (test instanceof TestExpr.Group group) {
            return new TestExpr.Group(test(group.inner()), group.span());
        }
        throw new IllegalStateException("Unknown test node " + test.getClass().getSimpleName());
    }

    private List<ShellExpression> expressions(List<ShellExpression> expressions) {
        return expressions.stream().map(this::expression).toList();
    }

    private List<Redirect> redirects(List<Redirect> redirects) {
        return redirects.stream().map(this::redirect).toList();
    }

    private Redirect redirect(Redirect redirect) {
        if (redirect instanceof Redirect.FileRedirect file) {
            return new Redirect.FileRedirect(file.operator(), file.fd(), expression(file.target()), file.span());
        }
        if (redirect instanceof Redirect.HereString hereString) {
            return new Redirect.HereString(hereString.fd(), expression(hereString.target()), hereString.span());
        }
        return redirect;
    }

    static <T> Optional<T> as(Object node, Class<T> type) {
        return type.isInstance(node) ? Optional.of(type.cast(node)) : Optional.empty();
    }
}
