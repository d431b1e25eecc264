package org.pragmatica.purify.transform;

import org.pragmatica.purify.analysis.ShellRules;
import org.pragmatica.purify.analysis.TypeChecker.ShellType;
import org.pragmatica.purify.shell.CaseArm;
import org.pragmatica.purify.shell.Redirect;
import org.pragmatica.purify.shell.ShellExpression;
import org.pragmatica.purify.shell.ShellExpression.Concat;
import org.pragmatica.purify.shell.ShellExpression.Literal;
import org.pragmatica.purify.shell.ShellExpression.Quoting;
import org.pragmatica.purify.shell.ShellScript;
import org.pragmatica.purify.shell.ShellStatement;
import org.pragmatica.purify.shell.ShellStatement.Command;
import org.pragmatica.purify.shell.ShellStatement.Pipeline;
import org.pragmatica.purify.shell.ShellTrees;
import org.pragmatica.purify.shell.TestExpr;
import org.pragmatica.purify.tree.SourceSpan;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies shell transformations to a copy of a script.
 *
 * <p>Transformations run one at a time in source order, type guards last. Each one rebuilds the
 * tree and replaces the node with its span, kind and precondition; when no node qualifies (a
 * previous rewrite replaced it, or the precondition no longer holds) it is downgraded to an
 * advisory.
 */
public final class ShellRewriter {
    private static final Logger log = LoggerFactory.getLogger(ShellRewriter.class);
    private static final Pattern POSIX_SHELL_OPTIONS = Pattern.compile("-[aefnuvxC]+");
    private static final String UNSAFE_LITERAL_CHARS = "\\*?[$`";

    private ShellRewriter() {}

    public static RewriteOutcome<ShellScript> apply(ShellScript script, List<Transformation> transformations) {
        var recorder = new RewriteOutcome.Recorder();
        var statements = script.statements();
        for (var transformation : applicationOrder(transformations)) {
            if (!transformation.safe()) {
                recorder.advisory(transformation);
                continue;
            }
            var pass = new Pass(transformation);
            var rewritten = pass.statements(statements);
            if (pass.hits > 0) {
                statements = rewritten;
                recorder.applied(transformation);
            } else {
                var advisory = Transformation.Advisory.downgrade(transformation, "target changed or not found");
                log.debug("Downgraded {} at {}: {}", transformation.ruleId(), transformation.span(), advisory.message());
                recorder.downgraded(advisory);
            }
        }
        return recorder.finish(script.withStatements(statements));
    }

    private static List<Transformation> applicationOrder(List<Transformation> transformations) {
        return transformations.stream()
                              .sorted(Comparator.comparing((Transformation t) -> t instanceof Transformation.InsertTypeGuard)
                                                .thenComparing(Transformation::span, SourceSpan.SOURCE_ORDER))
                              .toList();
    }

    private static final class Pass extends ShellTreeMapper {
        private final Transformation transformation;
        private int hits;

        Pass(Transformation transformation) {
            this.transformation = transformation;
        }

        @Override
        protected ShellStatement rewriteStatement(ShellStatement statement) {
            if (!statement.span().equals(transformation.span())) {
                return statement;
            }
            var result = rewrite(statement);
            result.ifPresent(ignored -> hits++);
            return result.orElse(statement);
        }

        @Override
        protected ShellExpression rewriteExpression(ShellExpression expression) {
            if (!expression.span().equals(transformation.span())) {
                return expression;
            }
            var result = rewrite(expression);
            result.ifPresent(ignored -> hits++);
            return result.orElse(expression);
        }

        @Override
        protected List<ShellStatement> expand(ShellStatement statement) {
            if (transformation instanceof Transformation.InsertTypeGuard guard && statement.span().equals(guard.span())) {
                hits++;
                return List.of(statement, typeGuard(guard.variable(), guard.type(), SourceSpan.at(statement.span().end())));
            }
            return List.of(statement);
        }

        private Optional<ShellStatement> rewrite(ShellStatement statement) {
            if (transformation instanceof Transformation.AddFlag addFlag) {
                return as(statement, Command.class).flatMap(command -> addFlag(command, addFlag));
            }
            if (transformation instanceof Transformation.RenameCommand rename) {
                return as(statement, Command.class)
                    .filter(command -> command.name().equals(rename.from()))
                    .map(command -> new Command(rename.to(), command.args(), command.redirects(), command.prefix(), command.span()));
            }
            if (transformation instanceof Transformation.ConvertFunctionSyntax) {
                return as(statement, ShellStatement.Function.class)
                    .filter(ShellStatement.Function::keywordSyntax)
                    .map(function -> new ShellStatement.Function(function.name(), function.body(), false, function.span()));
            }
            if (transformation instanceof Transformation.ReplaceShebang replace) {
                return as(statement, ShellStatement.Comment.class)
                    .filter(ShellStatement.Comment::isShebang)
                    .flatMap(comment -> replaceShebang(comment, replace.interpreter()));
            }
            return Optional.empty();
        }

        private Optional<ShellExpression> rewrite(ShellExpression expression) {
            if (transformation instanceof Transformation.QuoteExpansion) {
                return Optional.of(expression)
                               .filter(ShellRules::isUnquotedExpansion)
                               .filter(ShellRewriter::isQuotable)
                               .map(ShellRewriter::quoted);
            }
            if (transformation instanceof Transformation.ConvertExtendedTest) {
                return as(expression, ShellExpression.Test.class)
                    .filter(ShellExpression.Test::extended)
                    .flatMap(test -> posixTest(test.test()).map(converted -> new ShellExpression.Test(converted, false, test.span())));
            }
            if (transformation instanceof Transformation.PipeThroughSort) {
                return as(expression, ShellExpression.CommandSubstitution.class)
                    .filter(substitution -> substitution.body().size() == 1 && ShellRules.isUnsortedFind(substitution.body().get(0)))
                    .map(substitution -> new ShellExpression.CommandSubstitution(List.of(sortAfterFind(substitution.body().get(0))),
                                                                                 substitution.backtick(), substitution.span()));
            }
            return Optional.empty();
        }
    }

    // === Commands ===

    private static Optional<ShellStatement> addFlag(Command command, Transformation.AddFlag addFlag) {
        var letter = addFlag.flag().charAt(1);
        if (!command.name().equals(addFlag.command()) || ShellTrees.hasFlag(command, letter)) {
            return Optional.empty();
        }
        var args = new ArrayList<>(command.args());
        if (addFlag.mergeWith().isPresent()) {
            for (int i = 0; i < args.size(); i++) {
                var text = ShellTrees.literalText(args.get(i)).orElse("");
                if (isShortOptions(text) && text.indexOf(addFlag.mergeWith().get()) > 0) {
                    args.set(i, new Literal(text + letter, Quoting.NONE, args.get(i).span()));
                    return Optional.of(command.withArgs(args));
                }
            }
        }
        args.add(0, new Literal(addFlag.flag(), Quoting.NONE, SourceSpan.at(command.span().start())));
        return Optional.of(command.withArgs(args));
    }

    private static boolean isShortOptions(String text) {
        return text.length() > 1 && text.charAt(0) == '-' && text.charAt(1) != '-';
    }

    private static Optional<ShellStatement> replaceShebang(ShellStatement.Comment comment, String interpreter) {
        var words = List.of(comment.text().substring(1).strip().split("\\s+"));
        int first = 1;
        if (words.get(0).endsWith("env")) {
            while (first < words.size() && words.get(first).startsWith("-")) {
                first++;
            }
            first++;
        }
        var options = first < words.size() ? words.subList(first, words.size()) : List.<String>of();
        if (!options.stream().allMatch(option -> POSIX_SHELL_OPTIONS.matcher(option).matches())) {
            return Optional.empty();
        }
        var text = new StringBuilder("!").append(interpreter);
        options.forEach(option -> text.append(' ').append(option));
        return Optional.of(new ShellStatement.Comment(text.toString(), comment.span()));
    }

    private static ShellStatement sortAfterFind(ShellStatement body) {
        if (body instanceof Command find) {
            return new Pipeline(List.of(find, sortCommand(find)), List.of(false), find.span());
        }
        var pipeline = (Pipeline) body;
        var commands = new ArrayList<>(pipeline.commands());
        var joins = new ArrayList<>(pipeline.stderrJoins());
        for (int i = 0; i < commands.size(); i++) {
            if (commands.get(i) instanceof Command command && command.name().equals("find")) {
                commands.add(i + 1, sortCommand(command));
                joins.add(i, false);
                break;
            }
        }
        return new Pipeline(commands, joins, pipeline.span());
    }

    private static Command sortCommand(Command find) {
        return new Command("sort", List.of(), List.of(), SourceSpan.at(find.span().end()));
    }

    // === Quoting ===

    /**
     * Whether double quotes around the word keep every part's meaning apart from splitting and globbing.
     */
    static boolean isQuotable(ShellExpression expression) {
        var parts = expression instanceof Concat concat && !concat.doubleQuoted() ? concat.parts() : List.of(expression);
        for (int i = 0; i < parts.size(); i++) {
            var part = parts.get(i);
            if (part instanceof Literal literal) {
                if (literal.quoting() != Quoting.NONE
                    || literal.value().chars().anyMatch(c -> UNSAFE_LITERAL_CHARS.indexOf(c) >= 0)
                    || i == 0 && literal.value().startsWith("~")) {
                    return false;
                }
            } else if (!(part instanceof ShellExpression.Variable
                         || part instanceof ShellExpression.ParamExpansion
                         || part instanceof ShellExpression.CommandSubstitution
                         || part instanceof ShellExpression.Arithmetic
                         || part instanceof Concat nested && nested.doubleQuoted())) {
                return false;
            }
        }
        return true;
    }

    static ShellExpression quoted(ShellExpression expression) {
        var parts = new ArrayList<ShellExpression>();
        var source = expression instanceof Concat concat && !concat.doubleQuoted() ? concat.parts() : List.of(expression);
        for (var part : source) {
            if (part instanceof Concat nested && nested.doubleQuoted()) {
                parts.addAll(nested.parts());
            } else {
                parts.add(part);
            }
        }
        return new Concat(parts, true, expression.span());
    }

    // === Tests ===

    /**
     * The {@code [ ]} form of a {@code [[ ]]} test, or empty when {@code [ ]} cannot express it:
     * regex and string ordering operators, pattern matches, {@code -v}/{@code -o} and operands
     * that cannot be quoted.
     */
    static Optional<TestExpr> posixTest(TestExpr test) {
        if (test instanceof TestExpr.Unary unary) {
            if (unary.operator() == TestExpr.UnaryOperator.VARIABLE_SET || unary.operator() == TestExpr.UnaryOperator.OPTION_SET) {
                return Optional.empty();
            }
            return operand(unary.operand()).map(operand -> new TestExpr.Unary(unary.operator(), operand, unary.span()));
        }
        if (test instanceof TestExpr.Binary binary) {
            return posixBinary(binary);
        }
        if (test instanceof TestExpr.Word word) {
            return operand(word.word()).map(operand -> new TestExpr.Word(operand, word.span()));
        }
        if (test instanceof TestExpr.Not not) {
            return posixTest(not.operand()).map(operand -> new TestExpr.Not(operand, not.span()));
        }
        if (test instanceof TestExpr.And and) {
            var left = posixTest(and.left());
            var right = posixTest(and.right());
            return left.isPresent() && right.isPresent()
                ? Optional.of(new TestExpr.And(left.get(), right.get(), and.span()))
                : Optional.empty();
        }
        if (test instanceof TestExpr.Or or) {
            var left = posixTest(or.left());
            var right = posixTest(or.right());
            return left.isPresent() && right.isPresent()
                ? Optional.of(new TestExpr.Or(left.get(), right.get(), or.span()))
                : Optional.empty();
        }
        if (test instanceof TestExpr.Group group) {
            return posixTest(group.inner()).map(inner -> new TestExpr.Group(inner, group.span()));
        }
        return Optional.empty();
    }

    private static Optional<TestExpr> posixBinary(TestExpr.Binary binary) {
        var operator = binary.operator();
        switch (operator) {
            case REGEX_MATCH, STRING_LESS, STRING_GREATER:
                return Optional.empty();
            case STRING_EQUAL, STRING_EQUAL_EXTENDED, STRING_NOT_EQUAL:
                if (ShellRules.isUnquotedExpansion(binary.right()) || binary.right() instanceof ShellExpression.Glob) {
                    return Optional.empty();
                }
                if (operator == TestExpr.BinaryOperator.STRING_EQUAL_EXTENDED) {
                    operator = TestExpr.BinaryOperator.STRING_EQUAL;
                }
                break;
            default:
                if (operator.isIntegerComparison() && !(isIntegerOperand(binary.left()) && isIntegerOperand(binary.right()))) {
                    return Optional.empty();
                }
                break;
        }
        var left = operand(binary.left());
        var right = operand(binary.right());
        if (left.isEmpty() || right.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new TestExpr.Binary(operator, left.get(), right.get(), binary.span()));
    }

    // Inside [[ ]] integer operands are arithmetic, so bare names would mean variables.
    private static boolean isIntegerOperand(ShellExpression operand) {
        return ShellTrees.literalText(operand).map(text -> text.matches("-?[0-9]+")).orElse(true);
    }

    private static Optional<ShellExpression> operand(ShellExpression operand) {
        if (operand instanceof ShellExpression.Glob) {
            return Optional.empty();
        }
        if (operand instanceof Literal literal && literal.quoting() == Quoting.NONE
            && literal.value().chars().anyMatch(c -> c == '*' || c == '?' || c == '[')) {
            return Optional.empty();
        }
        if (ShellRules.isUnquotedExpansion(operand)) {
            return isQuotable(operand) ? Optional.of(quoted(operand)) : Optional.empty();
        }
        return Optional.of(operand);
    }

    // === Type guards ===

    /**
     * Runtime check that exits when the variable does not hold a value of its declared type.
     * All nodes of the guard share the zero-length span where it is inserted.
     */
    static ShellStatement typeGuard(String variable, ShellType type, SourceSpan span) {
        var failure = List.<ShellStatement>of(
            new Command("echo",
                        List.of(new Concat(List.of(new Literal(variable + ": expected " + type.display(), Quoting.NONE, span)), true, span)),
                        List.of(new Redirect.Duplicate(">&", OptionalInt.empty(), "2", span)),
                        span),
            new ShellStatement.Exit(Optional.of(new Literal("1", Quoting.NONE, span)), span));
        if (type == ShellType.BOOL) {
            var word = new Concat(List.of(new ShellExpression.Variable(variable, false, span)), true, span);
            return new ShellStatement.Case(word, List.of(
                new CaseArm(List.of("true", "false"), List.of(new Command(":", List.of(), List.of(), span)), CaseArm.Terminator.BREAK, span),
                new CaseArm(List.of("*"), failure, CaseArm.Terminator.BREAK, span)), span);
        }
        var unsigned = new ShellExpression.ParamExpansion(variable, ShellExpression.ParamOperator.REMOVE_PREFIX,
                                                          Optional.of(new Literal("-", Quoting.NONE, span)), span);
        return new ShellStatement.Case(new Concat(List.of(unsigned), true, span), List.of(
            new CaseArm(List.of("''", "*[!0-9]*"), failure, CaseArm.Terminator.BREAK, span)), span);
    }
}
