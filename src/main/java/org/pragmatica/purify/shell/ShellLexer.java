package org.pragmatica.purify.shell;

import org.pragmatica.purify.error.ParseError;
import org.pragmatica.purify.error.ParseOutcome;
import org.pragmatica.purify.error.SyntaxFailure;
import org.pragmatica.purify.shell.ShellExpression.ParamOperator;
import org.pragmatica.purify.shell.ShellExpression.Quoting;
import org.pragmatica.purify.tree.SourceLocation;
import org.pragmatica.purify.tree.SourceSpan;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Lexer for POSIX/bash shell source.
 *
 * <p>Words are scanned into {@link ShellExpression} values as they are read, so quoting,
 * parameter expansion and command substitution are resolved here. Substitution bodies are
 * handed to {@link ShellParser} recursively. Here-document bodies are collected when their
 * operator is seen and skipped when the lexer reaches the end of that line.
 */
public final class ShellLexer {
    private static final int MAX_INPUT_SIZE = 4_000_000;
    private static final int DEFAULT_TOKEN_CAPACITY = 32;

    private final String input;
    private final int limit;
    private final int offsetShift;
    private final int depth;
    private int pos;
    private int line;
    private int column;
    private int hereDocResume = -1;
    private int expansionNesting;
    private boolean inDoubleBracket;
    private ShellToken previous;

    private ShellLexer(String input, int from, int to, SourceLocation start, int offsetShift, int depth) {
        this.input = input;
        this.pos = from;
        this.limit = to;
        this.line = start.line();
        this.column = start.column();
        this.offsetShift = offsetShift;
        this.depth = depth;
    }

    public static ParseOutcome<List<ShellToken>> tokenize(String input) {
        checkSize(input);
        try {
            return ParseOutcome.success(new ShellLexer(input, 0, input.length(), SourceLocation.START, 0, 0).tokenizeAll());
        } catch (SyntaxFailure failure) {
            return ParseOutcome.failure(failure.error());
        }
    }

    static void checkSize(String input) {
        if (input.length() > MAX_INPUT_SIZE) {
            throw new IllegalArgumentException(
            "Shell input exceeds maximum size of " + MAX_INPUT_SIZE + " characters");
        }
    }

    /**
     * Tokenizes {@code input[from, to)} whose first character sits at {@code start}.
     * Offsets reported in spans are {@code index + offsetShift}.
     */
    static List<ShellToken> tokenizeRegion(String input, int from, int to, SourceLocation start, int offsetShift, int depth) {
        return new ShellLexer(input, from, to, start, offsetShift, depth).tokenizeAll();
    }

    private List<ShellToken> tokenizeAll() {
        var tokens = new ArrayList<ShellToken>();
        while (true) {
            skipBlanks();
            if (isAtEnd()) {
                break;
            }
            var token = nextToken();
            tokens.add(token);
            previous = token;
        }
        tokens.add(new ShellToken.Eof(SourceSpan.at(currentLocation())));
        return tokens;
    }

    private ShellToken nextToken() {
        var start = currentLocation();
        char c = peek();
        if (c == '\n') {
            advance();
            var token = new ShellToken.Newline(span(start));
            skipPendingHereDocBodies();
            return token;
        }
        if (c == '#') {
            return scanComment(start);
        }
        if (isDigit(c) && isIoNumber()) {
            return scanIoNumberRedirect(start);
        }
        if (c == '<' || c == '>') {
            return scanRedirect(start, OptionalInt.empty());
        }
        if (c == '(' && peekAt(1) == '(') {
            return scanArithBlock(start);
        }
        if (isOperatorStart(c)) {
            return scanOperator(start);
        }
        if (inDoubleBracket && previous instanceof ShellToken.Word word && word.is("=~")) {
            return scanRegexWord(start);
        }
        if (isAssignmentStart()) {
            return scanAssignmentWord(start);
        }
        var word = scanWord(start);
        if (word.is("[[")) {
            inDoubleBracket = true;
        } else if (word.is("]]")) {
            inDoubleBracket = false;
        }
        return word;
    }

    // === Comments and operators ===

    private ShellToken scanComment(SourceLocation start) {
        advance();
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd() && peek() != '\n') {
            sb.append(advance());
        }
        return new ShellToken.Comment(span(start), sb.toString());
    }

    private ShellToken scanOperator(SourceLocation start) {
        char c = advance();
        String symbol = switch (c) {
            case ';' -> {
                if (match(";&")) {
                    yield ";;&";
                }
                if (match(";")) {
                    yield ";;";
                }
                yield match("&") ? ";&" : ";";
            }
            case '&' -> {
                if (match("&")) {
                    yield "&&";
                }
                if (match(">>")) {
                    yield "&>>";
                }
                yield match(">") ? "&>" : "&";
            }
            case '|' -> {
                if (match("|")) {
                    yield "||";
                }
                yield match("&") ? "|&" : "|";
            }
            default -> String.valueOf(c);
        };
        if (symbol.equals("&>") || symbol.equals("&>>")) {
            return new ShellToken.RedirectOp(span(start), symbol, OptionalInt.empty());
        }
        return new ShellToken.Operator(span(start), symbol);
    }

    private ShellToken scanIoNumberRedirect(SourceLocation start) {
        var digits = new StringBuilder();
        while (isDigit(peek())) {
            digits.append(advance());
        }
        return scanRedirect(start, OptionalInt.of(Integer.parseInt(digits.toString())));
    }

    private ShellToken scanRedirect(SourceLocation start, OptionalInt fd) {
        char c = advance();
        if (c == '<') {
            if (match("<<")) {
                return new ShellToken.RedirectOp(span(start), "<<<", fd);
            }
            if (match("<-")) {
                return scanHereDoc(start, fd, true);
            }
            if (match("<")) {
                return scanHereDoc(start, fd, false);
            }
            if (match("&")) {
                return new ShellToken.RedirectOp(span(start), "<&", fd);
            }
            if (match(">")) {
                return new ShellToken.RedirectOp(span(start), "<>", fd);
            }
            return new ShellToken.RedirectOp(span(start), "<", fd);
        }
        if (match(">")) {
            return new ShellToken.RedirectOp(span(start), ">>", fd);
        }
        if (match("&")) {
            return new ShellToken.RedirectOp(span(start), ">&", fd);
        }
        if (match("|")) {
            return new ShellToken.RedirectOp(span(start), ">|", fd);
        }
        return new ShellToken.RedirectOp(span(start), ">", fd);
    }

    // === Here-documents ===

    private ShellToken scanHereDoc(SourceLocation start, OptionalInt fd, boolean stripTabs) {
        while (!isAtEnd() && (peek() == ' ' || peek() == '\t')) {
            advance();
        }
        int wordStart = pos;
        while (!isAtEnd() && !isWordBoundary(peek())) {
            char c = advance();
            if (c == '\\' && !isAtEnd()) {
                advance();
            } else if (c == '\'' || c == '"') {
                while (!isAtEnd() && peek() != c) {
                    advance();
                }
                if (isAtEnd()) {
                    throw fail(new ParseError.UnterminatedQuote(start, String.valueOf(c)));
                }
                advance();
            }
        }
        var delimiterWord = input.substring(wordStart, pos);
        if (delimiterWord.isEmpty()) {
            throw fail(new ParseError.InvalidSyntax(start, "Here-document without delimiter", "delimiter word"));
        }
        boolean quoted = delimiterWord.indexOf('\'') >= 0 || delimiterWord.indexOf('"') >= 0 || delimiterWord.indexOf('\\') >= 0;
        var delimiter = delimiterWord.replace("'", "").replace("\"", "").replace("\\", "");

        int bodyStart;
        if (hereDocResume >= 0) {
            bodyStart = hereDocResume;
        } else {
            int newline = input.indexOf('\n', pos);
            if (newline < 0 || newline >= limit) {
                throw fail(new ParseError.UnterminatedHereDoc(start, delimiter));
            }
            bodyStart = newline + 1;
        }
        int cursor = bodyStart;
        while (cursor <= limit) {
            int lineEnd = input.indexOf('\n', cursor);
            if (lineEnd < 0 || lineEnd > limit) {
                lineEnd = limit;
            }
            var candidate = input.substring(cursor, lineEnd);
            if (stripTabs) {
                candidate = candidate.replaceFirst("^\t+", "");
            }
            if (candidate.equals(delimiter)) {
                hereDocResume = lineEnd < limit ? lineEnd + 1 : limit;
                var body = input.substring(bodyStart, cursor);
                return new ShellToken.HereDoc(span(start), fd, stripTabs, delimiterWord, delimiter, quoted, body);
            }
            if (lineEnd >= limit) {
                break;
            }
            cursor = lineEnd + 1;
        }
        throw fail(new ParseError.UnterminatedHereDoc(start, delimiter));
    }

    private void skipPendingHereDocBodies() {
        if (hereDocResume < 0) {
            return;
        }
        while (pos < hereDocResume && !isAtEnd()) {
            advance();
        }
        hereDocResume = -1;
    }

    // === Arithmetic blocks ===

    private ShellToken scanArithBlock(SourceLocation start) {
        advance();
        advance();
        int contentStart = pos;
        int end = findArithmeticEnd();
        if (end < 0) {
            throw fail(new ParseError.UnterminatedQuote(start, "))"));
        }
        while (pos < end) {
            advance();
        }
        var text = input.substring(contentStart, end);
        advance();
        advance();
        return new ShellToken.ArithBlock(span(start), text);
    }

    /**
     * Index of the {@code ))} closing an arithmetic context opened just before {@code pos},
     * or -1 when the parentheses close in a way arithmetic cannot.
     */
    private int findArithmeticEnd() {
        int parens = 0;
        int i = pos;
        while (i < limit) {
            char c = input.charAt(i);
            if (c == '(') {
                parens++;
            } else if (c == ')') {
                if (parens == 0) {
                    return i + 1 < limit && input.charAt(i + 1) == ')' ? i : -1;
                }
                parens--;
            } else if (c == '\'' || c == '"') {
                int close = input.indexOf(c, i + 1);
                if (close < 0 || close >= limit) {
                    return -1;
                }
                i = close;
            }
            i++;
        }
        return -1;
    }

    // === Words ===

    private boolean isAssignmentStart() {
        if (!isNameStart(peek())) {
            return false;
        }
        int i = pos + 1;
        while (i < limit && isNameChar(input.charAt(i))) {
            i++;
        }
        if (i < limit && input.charAt(i) == '[') {
            int close = i + 1;
            while (close < limit && input.charAt(close) != ']' && !isWordBoundary(input.charAt(close))) {
                close++;
            }
            if (close >= limit || input.charAt(close) != ']') {
                return false;
            }
            i = close + 1;
        }
        if (i + 1 < limit && input.charAt(i) == '+' && input.charAt(i + 1) == '=') {
            return true;
        }
        return i < limit && input.charAt(i) == '=';
    }

    private ShellToken scanAssignmentWord(SourceLocation start) {
        int startPos = pos;
        var name = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (isNameChar(peek())) {
            name.append(advance());
        }
        Optional<String> index = Optional.empty();
        if (peek() == '[') {
            advance();
            var sb = new StringBuilder();
            while (peek() != ']') {
                sb.append(advance());
            }
            advance();
            index = Optional.of(sb.toString());
        }
        boolean append = match("+");
        advance();
        // consume '='
        ShellExpression value;
        if (!isAtEnd() && peek() == '(') {
            value = scanArrayLiteral();
        } else if (isAtEnd() || isWordBoundary(peek())) {
            value = new ShellExpression.Literal("", Quoting.NONE, SourceSpan.at(currentLocation()));
        } else {
            value = scanWordValue();
        }
        var raw = input.substring(startPos, pos);
        return new ShellToken.AssignmentWord(span(start), raw, name.toString(), index, append, value);
    }

    private ShellExpression scanArrayLiteral() {
        var start = currentLocation();
        advance();
        var elements = new ArrayList<ShellExpression>();
        while (true) {
            while (!isAtEnd() && (Character.isWhitespace(peek()) || isLineContinuation())) {
                advance();
            }
            if (isAtEnd()) {
                throw fail(new ParseError.UnterminatedQuote(start, ")"));
            }
            if (peek() == ')') {
                advance();
                return new ShellExpression.ArrayLiteral(List.copyOf(elements), span(start));
            }
            if (isWordBoundary(peek())) {
                throw fail(new ParseError.UnexpectedInput(currentLocation(), String.valueOf(peek()), "array element or ')'"));
            }
            elements.add(scanWordValue());
        }
    }

    private ShellToken.Word scanWord(SourceLocation start) {
        int startPos = pos;
        var value = scanWordValue();
        var raw = input.substring(startPos, pos);
        boolean plain = value instanceof ShellExpression.Literal literal
                        && literal.quoting() == Quoting.NONE
                        && raw.indexOf('\\') < 0;
        return new ShellToken.Word(span(start), raw, value, plain);
    }

    private ShellToken scanRegexWord(SourceLocation start) {
        int startPos = pos;
        int parens = 0;
        while (!isAtEnd()) {
            char c = peek();
            if (parens == 0 && (c == ' ' || c == '\t' || c == '\n')) {
                break;
            }
            if (c == '(') {
                parens++;
            } else if (c == ')') {
                parens--;
            } else if (c == '\\') {
                advance();
            }
            advance();
        }
        var raw = input.substring(startPos, pos);
        return new ShellToken.Word(span(start), raw, new ShellExpression.Literal(raw, Quoting.NONE, span(start)), false);
    }

    /**
     * Scans one unquoted-context word into an expression: a single part on its own, or a
     * {@link ShellExpression.Concat} of adjacent parts.
     */
    private ShellExpression scanWordValue() {
        var start = currentLocation();
        var parts = new WordParts();
        while (!isAtEnd() && !isWordBoundary(peek())) {
            char c = peek();
            if (c == '\\') {
                if (peekAt(1) == '\n') {
                    advance();
                    advance();
                    continue;
                }
                parts.literalChar(currentLocation(), advance());
                if (!isAtEnd()) {
                    parts.literalChar(currentLocation(), advance());
                }
            } else if (c == '\'') {
                parts.add(scanSingleQuoted());
            } else if (c == '"') {
                parts.add(scanDoubleQuoted());
            } else if (c == '`') {
                parts.add(scanBacktick());
            } else if (c == '$' && startsExpansion()) {
                parts.add(scanDollar());
            } else {
                parts.literalChar(currentLocation(), advance());
            }
        }
        return parts.build(start, span(start), false);
    }

    private ShellExpression scanSingleQuoted() {
        var start = currentLocation();
        advance();
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd() && peek() != '\'') {
            sb.append(advance());
        }
        if (isAtEnd()) {
            throw fail(new ParseError.UnterminatedQuote(start, "'"));
        }
        advance();
        return new ShellExpression.Literal(sb.toString(), Quoting.SINGLE, span(start));
    }

    private ShellExpression scanDoubleQuoted() {
        var start = currentLocation();
        advance();
        var parts = new WordParts();
        while (!isAtEnd() && peek() != '"') {
            char c = peek();
            if (c == '\\') {
                parts.literalChar(currentLocation(), advance());
                if (!isAtEnd()) {
                    parts.literalChar(currentLocation(), advance());
                }
            } else if (c == '`') {
                parts.add(scanBacktick());
            } else if (c == '$' && startsExpansion()) {
                parts.add(scanDollar());
            } else {
                parts.literalChar(currentLocation(), advance());
            }
        }
        if (isAtEnd()) {
            throw fail(new ParseError.UnterminatedQuote(start, "\""));
        }
        advance();
        return parts.buildQuoted(span(start));
    }

    private ShellExpression scanBacktick() {
        var start = currentLocation();
        advance();
        var contentStart = currentLocation();
        int contentPos = pos;
        var content = new StringBuilder();
        boolean escaped = false;
        while (!isAtEnd() && peek() != '`') {
            char c = advance();
            if (c == '\\' && !isAtEnd() && (peek() == '`' || peek() == '\\' || peek() == '$')) {
                content.append(advance());
                escaped = true;
            } else {
                content.append(c);
            }
        }
        if (isAtEnd()) {
            throw fail(new ParseError.UnterminatedQuote(start, "`"));
        }
        int contentEnd = pos;
        advance();
        List<ShellStatement> body = escaped
            ? ShellParser.parseRegion(content.toString(), 0, content.length(), contentStart, contentStart.offset(), depth + 1)
            : ShellParser.parseRegion(input, contentPos, contentEnd, contentStart, offsetShift, depth + 1);
        return new ShellExpression.CommandSubstitution(body, true, span(start));
    }

    // === Dollar expansions ===

    private boolean startsExpansion() {
        char next = peekAt(1);
        return next == '(' || next == '{' || next == '\'' || isNameStart(next) || isDigit(next) || isSpecialParameter(next);
    }

    private ShellExpression scanDollar() {
        var start = currentLocation();
        advance();
        char c = peek();
        if (c == '(' && peekAt(1) == '(') {
            var arithmetic = tryScanArithmetic(start);
            if (arithmetic.isPresent()) {
                return arithmetic.get();
            }
        }
        if (c == '(') {
            return scanCommandSubstitution(start);
        }
        if (c == '{') {
            return scanParamExpansion(start);
        }
        if (c == '\'') {
            return scanAnsiQuoted(start);
        }
        if (isDigit(c) || isSpecialParameter(c)) {
            advance();
            return new ShellExpression.Variable(String.valueOf(c), false, span(start));
        }
        var name = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd() && isNameChar(peek())) {
            name.append(advance());
        }
        return new ShellExpression.Variable(name.toString(), false, span(start));
    }

    private Optional<ShellExpression> tryScanArithmetic(SourceLocation start) {
        int savedPos = pos;
        pos += 2;
        int end = findArithmeticEnd();
        pos = savedPos;
        if (end < 0) {
            return Optional.empty();
        }
        advance();
        advance();
        var contentStart = currentLocation();
        int contentPos = pos;
        while (pos < end) {
            advance();
        }
        var text = input.substring(contentPos, end);
        advance();
        advance();
        var expression = ArithParser.parse(text, contentStart, depth + expansionNesting);
        return Optional.of(new ShellExpression.Arithmetic(expression, span(start)));
    }

    private ShellExpression scanCommandSubstitution(SourceLocation start) {
        advance();
        var contentStart = currentLocation();
        int contentPos = pos;
        skipBalanced(start);
        int contentEnd = pos;
        advance();
        var body = ShellParser.parseRegion(input, contentPos, contentEnd, contentStart, offsetShift, depth + 1);
        return new ShellExpression.CommandSubstitution(body, false, span(start));
    }

    /**
     * Advances to the {@code )} matching an already consumed {@code (}, skipping quotes,
     * nested substitutions and comments.
     */
    private void skipBalanced(SourceLocation start) {
        int parens = 1;
        int openCases = 0;
        boolean wordStart = true;
        while (!isAtEnd()) {
            char c = peek();
            if (wordStart && startsKeyword("case")) {
                openCases++;
            } else if (wordStart && startsKeyword("esac")) {
                openCases--;
            }
            if (c == ')' && parens == 1 && openCases > 0) {
                // case pattern terminator, not the end of the substitution
                advance();
            } else if (c == ')') {
                parens--;
                if (parens == 0) {
                    return;
                }
                advance();
            } else if (c == '(') {
                parens++;
                advance();
            } else if (c == '\\') {
                advance();
                if (!isAtEnd()) {
                    advance();
                }
            } else if (c == '\'') {
                var quoteStart = currentLocation();
                advance();
                while (!isAtEnd() && peek() != '\'') {
                    advance();
                }
                if (isAtEnd()) {
                    throw fail(new ParseError.UnterminatedQuote(quoteStart, "'"));
                }
                advance();
            } else if (c == '"') {
                skipDoubleQuoted();
            } else if (c == '`') {
                var quoteStart = currentLocation();
                advance();
                while (!isAtEnd() && peek() != '`') {
                    if (advance() == '\\' && !isAtEnd()) {
                        advance();
                    }
                }
                if (isAtEnd()) {
                    throw fail(new ParseError.UnterminatedQuote(quoteStart, "`"));
                }
                advance();
            } else if (c == '#' && wordStart) {
                while (!isAtEnd() && peek() != '\n') {
                    advance();
                }
            } else {
                advance();
            }
            wordStart = c == ' ' || c == '\t' || c == '\n' || c == ';' || c == '(' || c == '|' || c == '&';
        }
        throw fail(new ParseError.UnterminatedQuote(start, ")"));
    }

    private boolean startsKeyword(String keyword) {
        int end = pos + keyword.length();
        return input.startsWith(keyword, pos) && end <= limit && (end == limit || isWordBoundary(input.charAt(end)));
    }

    private void skipDoubleQuoted() {
        var quoteStart = currentLocation();
        advance();
        while (!isAtEnd() && peek() != '"') {
            char c = advance();
            if (c == '\\' && !isAtEnd()) {
                advance();
            } else if (c == '$' && !isAtEnd() && peek() == '(') {
                var nestedStart = currentLocation();
                advance();
                skipBalanced(nestedStart);
                advance();
            }
        }
        if (isAtEnd()) {
            throw fail(new ParseError.UnterminatedQuote(quoteStart, "\""));
        }
        advance();
    }

    private ShellExpression scanAnsiQuoted(SourceLocation start) {
        advance();
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd() && peek() != '\'') {
            char c = advance();
            sb.append(c);
            if (c == '\\' && !isAtEnd()) {
                sb.append(advance());
            }
        }
        if (isAtEnd()) {
            throw fail(new ParseError.UnterminatedQuote(start, "'"));
        }
        advance();
        return new ShellExpression.Literal(sb.toString(), Quoting.ANSI_C, span(start));
    }

    private ShellExpression scanParamExpansion(SourceLocation start) {
        expansionNesting++;
        if (depth + expansionNesting > ShellParser.MAX_DEPTH) {
            throw fail(new ParseError.NestingTooDeep(start, ShellParser.MAX_DEPTH));
        }
        try {
            return scanParamExpansionBody(start);
        } finally {
            expansionNesting--;
        }
    }

    private ShellExpression scanParamExpansionBody(SourceLocation start) {
        advance();
        if (peek() == '#' && peekAt(1) != '}') {
            advance();
            var name = scanParameterName(start);
            expectBrace(start);
            return new ShellExpression.ParamExpansion(name, ParamOperator.LENGTH, Optional.empty(), span(start));
        }
        var name = scanParameterName(start);
        if (peek() == '}') {
            advance();
            return new ShellExpression.Variable(name, true, span(start));
        }
        var operator = ParamOperator.MATCH_ORDER.stream()
                                                .filter(op -> input.startsWith(op.symbol(), pos))
                                                .findFirst()
                                                .orElseThrow(() -> fail(new ParseError.InvalidSyntax(
                                                    currentLocation(), "Bad substitution", "parameter expansion operator or '}'")));
        for (int i = 0; i < operator.symbol().length(); i++) {
            advance();
        }
        var operand = scanExpansionOperand(start);
        expectBrace(start);
        return new ShellExpression.ParamExpansion(name, operator, operand, span(start));
    }

    private String scanParameterName(SourceLocation start) {
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        if (peek() == '!' && isNameStart(peekAt(1))) {
            sb.append(advance());
        }
        if (isSpecialParameter(peek()) && sb.length() == 0) {
            sb.append(advance());
        } else if (isDigit(peek())) {
            while (isDigit(peek())) {
                sb.append(advance());
            }
        } else {
            while (!isAtEnd() && isNameChar(peek())) {
                sb.append(advance());
            }
        }
        if (sb.length() == 0) {
            throw fail(new ParseError.InvalidSyntax(currentLocation(), "Bad substitution", "parameter name"));
        }
        if (peek() == '[') {
            while (!isAtEnd() && peek() != ']') {
                sb.append(advance());
            }
            if (isAtEnd()) {
                throw fail(new ParseError.UnterminatedQuote(start, "]"));
            }
            sb.append(advance());
        }
        return sb.toString();
    }

    private Optional<ShellExpression> scanExpansionOperand(SourceLocation expansionStart) {
        var start = currentLocation();
        var parts = new WordParts();
        int braces = 0;
        while (!isAtEnd() && !(peek() == '}' && braces == 0)) {
            char c = peek();
            if (c == '\\') {
                parts.literalChar(currentLocation(), advance());
                if (!isAtEnd()) {
                    parts.literalChar(currentLocation(), advance());
                }
            } else if (c == '\'') {
                parts.add(scanSingleQuoted());
            } else if (c == '"') {
                parts.add(scanDoubleQuoted());
            } else if (c == '`') {
                parts.add(scanBacktick());
            } else if (c == '$' && startsExpansion()) {
                parts.add(scanDollar());
            } else {
                if (c == '{') {
                    braces++;
                } else if (c == '}') {
                    braces--;
                }
                parts.literalChar(currentLocation(), advance());
            }
        }
        if (isAtEnd()) {
            throw fail(new ParseError.UnterminatedQuote(expansionStart, "}"));
        }
        if (parts.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(parts.build(start, span(start), false));
    }

    private void expectBrace(SourceLocation start) {
        if (isAtEnd() || peek() != '}') {
            throw fail(new ParseError.UnterminatedQuote(start, "}"));
        }
        advance();
    }

    /**
     * Accumulates the parts of one word, merging adjacent literal characters.
     */
    private final class WordParts {
        private final List<ShellExpression> parts = new ArrayList<>();
        private final StringBuilder literal = new StringBuilder();
        private SourceLocation literalStart;
        private boolean globbing;

        void literalChar(SourceLocation at, char c) {
            if (literalStart == null) {
                literalStart = at;
            }
            literal.append(c);
            if (c == '*' || c == '?' || c == '[') {
                globbing = true;
            }
        }

        void add(ShellExpression part) {
            flush();
            parts.add(part);
        }

        boolean isEmpty() {
            return parts.isEmpty() && literal.length() == 0;
        }

        private void flush() {
            if (literalStart != null) {
                parts.add(new ShellExpression.Literal(literal.toString(), Quoting.NONE,
                                                      SourceSpan.of(literalStart, currentLocation())));
                literal.setLength(0);
                literalStart = null;
            }
        }

        ShellExpression build(SourceLocation start, SourceSpan span, boolean quoted) {
            boolean onlyLiteral = parts.isEmpty();
            var text = literal.toString();
            flush();
            if (onlyLiteral && !quoted && globbing && isGlobPattern(text)) {
                return new ShellExpression.Glob(text, span);
            }
            if (parts.size() == 1) {
                return parts.get(0);
            }
            if (parts.isEmpty()) {
                return new ShellExpression.Literal("", Quoting.NONE, SourceSpan.at(start));
            }
            return new ShellExpression.Concat(List.copyOf(parts), false, span);
        }

        ShellExpression buildQuoted(SourceSpan span) {
            flush();
            return new ShellExpression.Concat(List.copyOf(parts), true, span);
        }
    }

    private static boolean isGlobPattern(String text) {
        if (text.equals("[") || text.equals("[[") || text.indexOf('\\') >= 0) {
            return false;
        }
        if (text.indexOf('*') >= 0 || text.indexOf('?') >= 0) {
            return true;
        }
        int open = text.indexOf('[');
        return open >= 0 && text.indexOf(']', open + 2) > open;
    }

    // === Character helpers ===

    private boolean isIoNumber() {
        int i = pos;
        while (i < limit && isDigit(input.charAt(i))) {
            i++;
        }
        return i < limit && (input.charAt(i) == '<' || input.charAt(i) == '>')
               && !(i + 1 < limit && input.charAt(i + 1) == '(');
    }

    private void skipBlanks() {
        while (!isAtEnd()) {
            char c = peek();
            if (c == ' ' || c == '\t' || c == '\r') {
                advance();
            } else if (isLineContinuation()) {
                advance();
                advance();
            } else {
                break;
            }
        }
    }

    private boolean isLineContinuation() {
        return peek() == '\\' && peekAt(1) == '\n';
    }

    private static boolean isOperatorStart(char c) {
        return c == ';' || c == '&' || c == '|' || c == '(' || c == ')';
    }

    static boolean isWordBoundary(char c) {
        return c == ' ' || c == '\t' || c == '\n' || c == '\r'
               || c == ';' || c == '&' || c == '|' || c == '<' || c == '>' || c == '(' || c == ')';
    }

    static boolean isNameStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    static boolean isNameChar(char c) {
        return isNameStart(c) || isDigit(c);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isSpecialParameter(char c) {
        return c == '?' || c == '#' || c == '@' || c == '*' || c == '$' || c == '!' || c == '-';
    }

    private boolean match(String expected) {
        if (input.startsWith(expected, pos) && pos + expected.length() <= limit) {
            for (int i = 0; i < expected.length(); i++) {
                advance();
            }
            return true;
        }
        return false;
    }

    private boolean isAtEnd() {
        return pos >= limit;
    }

    private char peek() {
        return isAtEnd() ? '\0' : input.charAt(pos);
    }

    private char peekAt(int ahead) {
        return pos + ahead < limit ? input.charAt(pos + ahead) : '\0';
    }

    private char advance() {
        char c = input.charAt(pos++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private SourceLocation currentLocation() {
        return SourceLocation.at(line, column, pos + offsetShift);
    }

    private SourceSpan span(SourceLocation start) {
        return SourceSpan.of(start, currentLocation());
    }

    private static SyntaxFailure fail(ParseError error) {
        return new SyntaxFailure(error);
    }
}
