package org.pragmatica.purify.shell;

import org.pragmatica.purify.error.ParseError;
import org.pragmatica.purify.error.SyntaxFailure;
import org.pragmatica.purify.tree.SourceLocation;
import org.pragmatica.purify.tree.SourceSpan;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Precedence-climbing parser for shell arithmetic.
 *
 * <p>Every operator and parenthesis adds a tree level. Levels count against
 * {@link ShellParser#MAX_DEPTH} together with the nesting of the surrounding script.
 */
final class ArithParser {
    private static final List<String> OPERATORS = List.of(
        "<<=", ">>=", "**", "++", "--", "<<", ">>", "<=", ">=", "==", "!=", "&&", "||",
        "+=", "-=", "*=", "/=", "%=", "&=", "^=", "|=",
        "+", "-", "*", "/", "%", "<", ">", "=", "!", "~", "&", "|", "^", "?", ":", ",", "(", ")");

    private static final Set<String> ASSIGNMENT_OPERATORS = Set.of(
        "=", "+=", "-=", "*=", "/=", "%=", "<<=", ">>=", "&=", "^=", "|=");

    private static final List<Set<String>> BINARY_LEVELS = List.of(
        Set.of("||"),
        Set.of("&&"),
        Set.of("|"),
        Set.of("^"),
        Set.of("&"),
        Set.of("==", "!="),
        Set.of("<", "<=", ">", ">="),
        Set.of("<<", ">>"),
        Set.of("+", "-"),
        Set.of("*", "/", "%"));

    private enum Kind {
        NUMBER,
        NAME,
        DOLLAR_NAME,
        OPERATOR,
        END
    }

    private record Token(Kind kind, String text, int start, int end) {}

    private final String text;
    private final SourceLocation base;
    private final List<Token> tokens;
    private final int outerDepth;
    private int pos;
    private int nesting;

    private ArithParser(String text, SourceLocation base, int outerDepth) {
        this.text = text;
        this.base = base;
        this.outerDepth = outerDepth;
        this.tokens = tokenize();
    }

    /**
     * Parses arithmetic text whose first character sits at {@code base}, found {@code depth}
     * levels deep in the script.
     *
     * @throws SyntaxFailure when the text is not a valid arithmetic expression or nests too deeply
     */
    static ArithExpr parse(String text, SourceLocation base, int depth) {
        var parser = new ArithParser(text, base, depth);
        if (parser.peek().kind() == Kind.END) {
            throw parser.error(0, "empty arithmetic expression");
        }
        var expr = parser.parseComma();
        if (parser.peek().kind() != Kind.END) {
            throw parser.error(parser.peek().start(), "unexpected '" + parser.peek().text() + "'");
        }
        return expr;
    }

    private List<Token> tokenize() {
        var result = new ArrayList<Token>();
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (Character.isWhitespace(c) || (c == '\\' && i + 1 < text.length() && text.charAt(i + 1) == '\n')) {
                i++;
                continue;
            }
            int start = i;
            if (Character.isDigit(c)) {
                while (i < text.length() && (Character.isLetterOrDigit(text.charAt(i)) || text.charAt(i) == '#' || text.charAt(i) == '_')) {
                    i++;
                }
                result.add(new Token(Kind.NUMBER, text.substring(start, i), start, i));
            } else if (ShellLexer.isNameStart(c)) {
                i = scanName(i);
                result.add(new Token(Kind.NAME, text.substring(start, i), start, i));
            } else if (c == '$') {
                i = scanDollarName(i);
                result.add(new Token(Kind.DOLLAR_NAME, text.substring(start, i), start, i));
            } else {
                final int at = i;
                var operator = OPERATORS.stream()
                                        .filter(op -> text.startsWith(op, at))
                                        .findFirst()
                                        .orElseThrow(() -> error(at, "unexpected character '" + c + "'"));
                i += operator.length();
                result.add(new Token(Kind.OPERATOR, operator, start, i));
            }
        }
        result.add(new Token(Kind.END, "", text.length(), text.length()));
        return result;
    }

    private int scanName(int i) {
        while (i < text.length() && ShellLexer.isNameChar(text.charAt(i))) {
            i++;
        }
        if (i < text.length() && text.charAt(i) == '[') {
            int close = text.indexOf(']', i);
            if (close < 0) {
                throw error(i, "unterminated subscript");
            }
            i = close + 1;
        }
        return i;
    }

    private int scanDollarName(int i) {
        int start = i;
        i++;
        if (i < text.length() && text.charAt(i) == '{') {
            int close = text.indexOf('}', i);
            if (close < 0) {
                throw error(start, "unterminated '${'");
            }
            return close + 1;
        }
        if (i < text.length() && (Character.isDigit(text.charAt(i)) || "#?@*$!".indexOf(text.charAt(i)) >= 0)) {
            return i + 1;
        }
        if (i < text.length() && ShellLexer.isNameStart(text.charAt(i))) {
            return scanName(i);
        }
        throw error(start, "'$' without a parameter name");
    }

    // === Grammar ===

    private ArithExpr parseComma() {
        var left = parseAssign();
        int links = 0;
        while (isOperator(",")) {
            descend(advance().start());
            links++;
            var right = parseAssign();
            left = new ArithExpr.Binary(",", left, right, merge(left, right));
        }
        nesting -= links;
        return left;
    }

    private ArithExpr parseAssign() {
        var token = peek();
        if (token.kind() == Kind.NAME
            && peekAt(1).kind() == Kind.OPERATOR
            && ASSIGNMENT_OPERATORS.contains(peekAt(1).text())) {
            advance();
            var operator = advance().text();
            var value = nested(token.start(), this::parseAssign);
            return new ArithExpr.Assign(token.text(), operator, value, SourceSpan.of(locate(token.start()), value.span().end()));
        }
        return parseTernary();
    }

    private ArithExpr parseTernary() {
        var condition = parseBinary(0);
        if (!isOperator("?")) {
            return condition;
        }
        descend(advance().start());
        var whenTrue = parseAssign();
        if (!isOperator(":")) {
            throw error(peek().start(), "expected ':' in conditional expression");
        }
        advance();
        var whenFalse = parseAssign();
        nesting--;
        return new ArithExpr.Ternary(condition, whenTrue, whenFalse, merge(condition, whenFalse));
    }

    private ArithExpr parseBinary(int level) {
        if (level == BINARY_LEVELS.size()) {
            return parseUnary();
        }
        var operators = BINARY_LEVELS.get(level);
        var left = parseBinary(level + 1);
        int links = 0;
        while (peek().kind() == Kind.OPERATOR && operators.contains(peek().text())) {
            var operator = advance();
            descend(operator.start());
            links++;
            var right = parseBinary(level + 1);
            left = new ArithExpr.Binary(operator.text(), left, right, merge(left, right));
        }
        nesting -= links;
        return left;
    }

    private ArithExpr parseUnary() {
        var token = peek();
        if (token.kind() == Kind.OPERATOR && (token.text().equals("++") || token.text().equals("--"))
            && peekAt(1).kind() == Kind.NAME) {
            advance();
            var name = advance();
            return new ArithExpr.Increment(name.text(), token.text(), true, span(token.start(), name.end()));
        }
        if (token.kind() == Kind.OPERATOR && Set.of("!", "~", "-", "+").contains(token.text())) {
            advance();
            var operand = nested(token.start(), this::parseUnary);
            return new ArithExpr.Unary(token.text(), operand, SourceSpan.of(locate(token.start()), operand.span().end()));
        }
        return parsePower();
    }

    private ArithExpr parsePower() {
        var base = parsePostfix();
        if (isOperator("**")) {
            var operator = advance();
            var exponent = nested(operator.start(), this::parseUnary);
            return new ArithExpr.Binary("**", base, exponent, merge(base, exponent));
        }
        return base;
    }

    private ArithExpr parsePostfix() {
        var primary = parsePrimary();
        if (primary instanceof ArithExpr.Variable variable && !variable.dollar()
            && (isOperator("++") || isOperator("--"))) {
            var operator = advance();
            return new ArithExpr.Increment(variable.name(), operator.text(), false,
                                           SourceSpan.of(variable.span().start(), locate(operator.end())));
        }
        return primary;
    }

    private ArithExpr parsePrimary() {
        var token = peek();
        switch (token.kind()) {
            case NUMBER -> {
                advance();
                return new ArithExpr.Number(token.text(), span(token.start(), token.end()));
            }
            case NAME -> {
                advance();
                return new ArithExpr.Variable(token.text(), false, span(token.start(), token.end()));
            }
            case DOLLAR_NAME -> {
                advance();
                var name = token.text().substring(1).replace("{", "").replace("}", "");
                return new ArithExpr.Variable(name, true, span(token.start(), token.end()));
            }
            default -> {
                if (isOperator("(")) {
                    advance();
                    var inner = nested(token.start(), this::parseComma);
                    if (!isOperator(")")) {
                        throw error(peek().start(), "expected ')'");
                    }
                    var close = advance();
                    return new ArithExpr.Group(inner, span(token.start(), close.end()));
                }
                throw error(token.start(), token.kind() == Kind.END
                    ? "unexpected end of arithmetic expression"
                    : "unexpected '" + token.text() + "'");
            }
        }
    }

    // === Helpers ===

    private void descend(int index) {
        nesting++;
        if (outerDepth + nesting > ShellParser.MAX_DEPTH) {
            throw new SyntaxFailure(new ParseError.NestingTooDeep(locate(index), ShellParser.MAX_DEPTH));
        }
    }

    private ArithExpr nested(int index, Supplier<ArithExpr> inner) {
        descend(index);
        try {
            return inner.get();
        } finally {
            nesting--;
        }
    }

    private boolean isOperator(String operator) {
        return peek().kind() == Kind.OPERATOR && peek().text().equals(operator);
    }

    private Token peek() {
        return tokens.get(pos);
    }

    private Token peekAt(int ahead) {
        return tokens.get(Math.min(pos + ahead, tokens.size() - 1));
    }

    private Token advance() {
        var token = tokens.get(pos);
        if (pos < tokens.size() - 1) {
            pos++;
        }
        return token;
    }

    private SourceSpan merge(ArithExpr left, ArithExpr right) {
        return left.span().merge(right.span());
    }

    private SourceSpan span(int start, int end) {
        return SourceSpan.of(locate(start), locate(end));
    }

    private SourceLocation locate(int index) {
        int line = base.line();
        int column = base.column();
        for (int i = 0; i < index && i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                line++;
                column = 1;
            } else {
                column++;
            }
        }
        return SourceLocation.at(line, column, base.offset() + index);
    }

    private SyntaxFailure error(int index, String reason) {
        return new SyntaxFailure(new ParseError.InvalidSyntax(locate(index), "Invalid arithmetic: " + reason,
                                                               "arithmetic expression"));
    }
}
