package org.pragmatica.purify.shell;

import org.pragmatica.purify.error.ParseError;
import org.pragmatica.purify.error.SyntaxFailure;
import org.pragmatica.purify.tree.SourceSpan;

import java.util.List;
import java.util.Optional;

/**
 * Parser for the operand lists of {@code test}, {@code [ ]} and {@code [[ ]]}.
 *
 * <p>Precedence, loosest first: or, and, negation, primaries. Single-bracket tests spell
 * the connectives {@code -o}/{@code -a} and group with {@code \( \)}.
 */
final class TestParser {

    /**
     * One operand or operator. {@code text} is the literal spelling when the item may act as an
     * operator, {@code value} is absent for bare operator tokens of {@code [[ ]]}.
     */
    record Item(String text, ShellExpression value, SourceSpan span) {
        static Item word(String text, ShellExpression value, SourceSpan span) {
            return new Item(text, value, span);
        }

        static Item operator(String symbol, SourceSpan span) {
            return new Item(symbol, null, span);
        }

        boolean isOperatorToken() {
            return value == null;
        }
    }

    private final List<Item> items;
    private final boolean extended;
    private final SourceSpan whole;
    private final int outerDepth;
    private int pos;
    private int nesting;

    private TestParser(List<Item> items, boolean extended, SourceSpan whole, int outerDepth) {
        this.items = items;
        this.extended = extended;
        this.whole = whole;
        this.outerDepth = outerDepth;
    }

    /**
     * Parses the arguments of {@code [} or {@code test}; empty when they do not form a
     * well-formed test, in which case the caller keeps the plain command.
     *
     * @throws SyntaxFailure when the test nests deeper than the script allows
     */
    static Optional<ShellExpression.Test> parseSingleBracket(boolean bracket,
                                                             List<ShellExpression> args,
                                                             SourceSpan span,
                                                             int depth) {
        var operands = args;
        if (bracket) {
            if (args.isEmpty() || !ShellTrees.literalText(args.get(args.size() - 1)).filter("]"::equals).isPresent()) {
                return Optional.empty();
            }
            operands = args.subList(0, args.size() - 1);
        }
        if (operands.isEmpty()) {
            return Optional.empty();
        }
        var items = operands.stream()
                            .map(arg -> Item.word(ShellTrees.literalText(arg).orElse(null), arg, arg.span()))
                            .toList();
        try {
            var parser = new TestParser(items, false, span, depth);
            var expr = parser.parseOr();
            if (parser.pos != items.size()) {
                return Optional.empty();
            }
            return Optional.of(new ShellExpression.Test(expr, false, span));
        } catch (SyntaxFailure notATest) {
            if (notATest.error() instanceof ParseError.NestingTooDeep) {
                throw notATest;
            }
            return Optional.empty();
        }
    }

    /**
     * Parses the contents of {@code [[ ]]}.
     *
     * @throws SyntaxFailure when the contents are not a valid conditional expression
     */
    static TestExpr parseExtended(List<Item> items, SourceSpan span, int depth) {
        var parser = new TestParser(items, true, span, depth);
        if (items.isEmpty()) {
            throw parser.failure("empty conditional expression");
        }
        var expr = parser.parseOr();
        if (parser.pos != items.size()) {
            throw parser.failure("unexpected '" + describe(items.get(parser.pos)) + "'");
        }
        return expr;
    }

    private TestExpr parseOr() {
        var left = parseAnd();
        int links = 0;
        while (atConnective(extended ? "||" : "-o")) {
            descend();
            links++;
            pos++;
            var right = parseAnd();
            left = new TestExpr.Or(left, right, left.span().merge(right.span()));
        }
        nesting -= links;
        return left;
    }

    private TestExpr parseAnd() {
        var left = parseNot();
        int links = 0;
        while (atConnective(extended ? "&&" : "-a")) {
            descend();
            links++;
            pos++;
            var right = parseNot();
            left = new TestExpr.And(left, right, left.span().merge(right.span()));
        }
        nesting -= links;
        return left;
    }

    private TestExpr parseNot() {
        if (pos + 1 < items.size() && "!".equals(current().text()) && !current().isOperatorToken()) {
            descend();
            var bang = items.get(pos++);
            var operand = parseNot();
            nesting--;
            return new TestExpr.Not(operand, bang.span().merge(operand.span()));
        }
        return parsePrimary();
    }

    private TestExpr parsePrimary() {
        if (pos >= items.size()) {
            throw failure("missing operand");
        }
        var item = current();
        if (isOpenParen(item)) {
            descend();
            pos++;
            var inner = parseOr();
            if (pos >= items.size() || !isCloseParen(current())) {
                throw failure("expected ')'");
            }
            nesting--;
            var close = items.get(pos++);
            return new TestExpr.Group(inner, item.span().merge(close.span()));
        }
        if (item.isOperatorToken() && !isComparison(item)) {
            throw failure("unexpected '" + item.text() + "'");
        }
        if (pos + 2 < items.size() && isComparison(items.get(pos + 1)) && !item.isOperatorToken()) {
            var operator = TestExpr.BinaryOperator.fromSymbol(items.get(pos + 1).text()).orElseThrow();
            var right = items.get(pos + 2);
            if (right.isOperatorToken()) {
                throw failure("missing right operand of '" + operator.symbol() + "'");
            }
            pos += 3;
            return new TestExpr.Binary(operator, item.value(), right.value(), item.span().merge(right.span()));
        }
        var unary = item.text() == null ? Optional.<TestExpr.UnaryOperator>empty() : TestExpr.UnaryOperator.fromSymbol(item.text());
        if (unary.isPresent() && pos + 1 < items.size() && !items.get(pos + 1).isOperatorToken()) {
            var operand = items.get(pos + 1);
            pos += 2;
            return new TestExpr.Unary(unary.get(), operand.value(), item.span().merge(operand.span()));
        }
        if (item.isOperatorToken()) {
            throw failure("unexpected '" + item.text() + "'");
        }
        pos++;
        return new TestExpr.Word(item.value(), item.span());
    }

    private void descend() {
        nesting++;
        if (outerDepth + nesting > ShellParser.MAX_DEPTH) {
            throw new SyntaxFailure(new ParseError.NestingTooDeep(current().span().start(), ShellParser.MAX_DEPTH));
        }
    }

    private boolean atConnective(String symbol) {
        if (pos >= items.size()) {
            return false;
        }
        var item = current();
        return symbol.equals(item.text()) && (item.isOperatorToken() == extended);
    }

    private boolean isComparison(Item item) {
        if (item.text() == null) {
            return false;
        }
        if (extended && (item.text().equals("<") || item.text().equals(">"))) {
            return item.isOperatorToken();
        }
        return !item.isOperatorToken() && TestExpr.BinaryOperator.fromSymbol(item.text()).isPresent();
    }

    private boolean isOpenParen(Item item) {
        if (extended) {
            return item.isOperatorToken() && "(".equals(item.text());
        }
        return "(".equals(item.text()) || "\\(".equals(item.text());
    }

    private boolean isCloseParen(Item item) {
        if (extended) {
            return item.isOperatorToken() && ")".equals(item.text());
        }
        return ")".equals(item.text()) || "\\)".equals(item.text());
    }

    private Item current() {
        return items.get(pos);
    }

    private SyntaxFailure failure(String reason) {
        var location = pos < items.size() ? items.get(pos).span().start() : whole.end();
        return new SyntaxFailure(new ParseError.InvalidSyntax(location, "Invalid test expression: " + reason, "test expression"));
    }

    private static String describe(Item item) {
        return item.text() != null ? item.text() : ShellTrees.literalText(item.value()).orElse("word");
    }
}
