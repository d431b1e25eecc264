package org.pragmatica.purify.shell;

import org.pragmatica.purify.error.ParseError;
import org.pragmatica.purify.error.ParseOutcome;
import org.pragmatica.purify.error.SyntaxFailure;
import org.pragmatica.purify.shell.ShellExpression.Quoting;
import org.pragmatica.purify.shell.ShellStatement.*;
import org.pragmatica.purify.tree.SourceLocation;
import org.pragmatica.purify.tree.SourceSpan;
import org.pragmatica.purify.tree.SyntaxMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Recursive-descent parser for POSIX/bash shell scripts.
 *
 * <p>Example usage:
 * <pre>{@code
 * var script = ShellParser.parse("mkdir /tmp/build && cd /tmp/build").unwrap();
 * }</pre>
 */
public final class ShellParser {
    private static final Logger log = LoggerFactory.getLogger(ShellParser.class);

    static final int MAX_DEPTH = 100;

    private static final Set<String> MISPLACED_KEYWORDS = Set.of(
        "then", "else", "elif", "fi", "do", "done", "esac", "}", "]]");
    private static final Set<String> CASE_TERMINATORS = Set.of(";;", ";&", ";;&");
    private static final Set<String> NO_CLOSERS = Set.of();

    private final List<ShellToken> tokens;
    private final int depth;
    private int pos;
    private int nesting;

    private ShellParser(List<ShellToken> tokens, int depth) {
        this.tokens = tokens;
        this.depth = depth;
        this.pos = 0;
    }

    /**
     * Parse shell source into a syntax tree.
     */
    public static ParseOutcome<ShellScript> parse(String source) {
        return parse(source, Optional.empty());
    }

    /**
     * Parse shell source, recording the file it came from in the tree metadata.
     */
    public static ParseOutcome<ShellScript> parse(String source, Optional<String> sourceFile) {
        ShellLexer.checkSize(source);
        long started = System.nanoTime();
        try {
            var statements = parseRegion(source, 0, source.length(), SourceLocation.START, 0, 0);
            var metadata = SyntaxMetadata.of(sourceFile, source, Duration.ofNanos(System.nanoTime() - started));
            log.debug("Parsed {} top-level shell statements from {} lines", statements.size(), metadata.lineCount());
            return ParseOutcome.success(new ShellScript(statements, metadata));
        } catch (SyntaxFailure failure) {
            log.debug("Shell parse failed: {}", failure.error().message());
            return ParseOutcome.failure(failure.error());
        }
    }

    /**
     * Parse a region of text, used for the bodies of command substitutions.
     */
    static List<ShellStatement> parseRegion(String input, int from, int to, SourceLocation start, int offsetShift, int depth) {
        if (depth > MAX_DEPTH) {
            throw new SyntaxFailure(new ParseError.NestingTooDeep(start, MAX_DEPTH));
        }
        var tokens = ShellLexer.tokenizeRegion(input, from, to, start, offsetShift, depth);
        return new ShellParser(tokens, depth).parseProgram();
    }

    private List<ShellStatement> parseProgram() {
        var statements = parseList(NO_CLOSERS);
        if (!(peek() instanceof ShellToken.Eof)) {
            throw unexpected(peek(), "end of input");
        }
        return statements;
    }

    // === Lists ===

    /**
     * Parses statements until end of input, a closing operator, or one of the closing keywords.
     */
    private List<ShellStatement> parseList(Set<String> closers) {
        var statements = new ArrayList<ShellStatement>();
        while (true) {
            skipNewlines();
            if (peek() instanceof ShellToken.Comment comment) {
                advance();
                statements.add(new Comment(comment.text(), comment.span()));
                continue;
            }
            if (atListEnd(closers)) {
                break;
            }
            var statement = parseAndOr();
            boolean terminated = false;
            if (isOperator("&")) {
                var amp = advance();
                statement = new Background(statement, statement.span().merge(amp.span()));
                terminated = true;
            } else if (isOperator(";")) {
                advance();
                terminated = true;
            }
            statements.add(statement);
            if (!terminated
                && !(peek() instanceof ShellToken.Newline)
                && !(peek() instanceof ShellToken.Comment)
                && !atListEnd(closers)) {
                throw unexpected(peek(), "';' or newline");
            }
        }
        return statements;
    }

    private boolean atListEnd(Set<String> closers) {
        var token = peek();
        if (token instanceof ShellToken.Eof) {
            return true;
        }
        if (token instanceof ShellToken.Operator operator) {
            return operator.is(")") || CASE_TERMINATORS.contains(operator.symbol());
        }
        return token instanceof ShellToken.Word word && word.plain() && closers.contains(word.raw());
    }

    private ShellStatement parseAndOr() {
        var left = parsePipeline();
        int links = 0;
        while (isOperator("&&") || isOperator("||")) {
            enter();
            links++;
            var operator = (ShellToken.Operator) advance();
            skipNewlines();
            var right = parsePipeline();
            var span = left.span().merge(right.span());
            left = operator.is("&&")
                ? new AndList(left, right, span)
                : new OrList(left, right, span);
        }
        nesting -= links;
        return left;
    }

    private ShellStatement parsePipeline() {
        var start = peek();
        boolean negated = false;
        if (isWord("!")) {
            advance();
            negated = true;
        }
        var commands = new ArrayList<ShellStatement>();
        var stderrJoins = new ArrayList<Boolean>();
        commands.add(parseCommand());
        while (isOperator("|") || isOperator("|&")) {
            stderrJoins.add(isOperator("|&"));
            advance();
            skipNewlines();
            commands.add(parseCommand());
        }
        ShellStatement result = commands.size() == 1
            ? commands.get(0)
            : new Pipeline(List.copyOf(commands), List.copyOf(stderrJoins),
                           commands.get(0).span().merge(commands.get(commands.size() - 1).span()));
        if (negated) {
            result = new Negated(result, SourceSpan.of(start.span().start(), result.span().end()));
        }
        return result;
    }

    // === Commands ===

    private ShellStatement parseCommand() {
        enter();
        try {
            var token = peek();
            ShellStatement compound = null;
            if (token instanceof ShellToken.Word word && word.plain()) {
                if (MISPLACED_KEYWORDS.contains(word.raw())) {
                    throw unexpected(token, "command");
                }
                switch (word.raw()) {
                    case "if" -> compound = parseIf();
                    case "while" -> compound = parseWhile(false);
                    case "until" -> compound = parseWhile(true);
                    case "for" -> compound = parseFor();
                    case "select" -> compound = parseSelect();
                    case "case" -> compound = parseCase();
                    case "{" -> compound = parseGroup();
                    case "[[" -> compound = parseExtendedTest();
                    case "function" -> {
                        return parseFunction(true);
                    }
                    case "coproc" -> {
                        return parseCoproc();
                    }
                    default -> {
                        if (peekAt(1) instanceof ShellToken.Operator open && open.is("(")
                            && peekAt(2) instanceof ShellToken.Operator close && close.is(")")) {
                            return parseFunction(false);
                        }
                    }
                }
            } else if (token instanceof ShellToken.Operator operator && operator.is("(")) {
                compound = parseSubshell();
            } else if (token instanceof ShellToken.ArithBlock block) {
                advance();
                compound = new ArithCommand(ArithParser.parse(block.text(), shifted(block.span().start(), 2), depth + nesting), block.span());
            }
            if (compound != null) {
                return withRedirects(compound);
            }
            return parseSimpleCommand();
        } finally {
            nesting--;
        }
    }

    private ShellStatement withRedirects(ShellStatement compound) {
        var redirects = new ArrayList<Redirect>();
        while (peek() instanceof ShellToken.RedirectOp || peek() instanceof ShellToken.HereDoc) {
            redirects.add(parseRedirect());
        }
        if (redirects.isEmpty()) {
            return compound;
        }
        var span = compound.span().merge(redirects.get(redirects.size() - 1).span());
        return new Redirected(compound, List.copyOf(redirects), span);
    }

    private ShellStatement parseSimpleCommand() {
        var startToken = peek();
        var prefix = new ArrayList<Assignment>();
        var redirects = new ArrayList<Redirect>();
        var args = new ArrayList<ShellExpression>();
        var argTokens = new ArrayList<ShellToken>();
        ShellToken.Word nameToken = null;

        while (true) {
            var token = peek();
            if (nameToken == null && token instanceof ShellToken.AssignmentWord assignment) {
                advance();
                prefix.add(toAssignment(assignment, AssignmentKind.PLAIN, assignment.span()));
            } else if (token instanceof ShellToken.RedirectOp || token instanceof ShellToken.HereDoc) {
                redirects.add(parseRedirect());
            } else if (token instanceof ShellToken.Word word) {
                advance();
                if (nameToken == null) {
                    nameToken = word;
                } else {
                    args.add(word.value());
                    argTokens.add(word);
                }
            } else if (token instanceof ShellToken.AssignmentWord assignment) {
                advance();
                args.add(assignmentAsWord(assignment));
                argTokens.add(assignment);
            } else {
                break;
            }
        }

        if (nameToken == null && prefix.isEmpty() && redirects.isEmpty()) {
            throw unexpected(startToken, "command");
        }
        var span = SourceSpan.of(startToken.span().start(), previousEnd());
        if (nameToken == null) {
            if (prefix.size() == 1 && redirects.isEmpty()) {
                return prefix.get(0);
            }
            return new Command("", List.of(), List.copyOf(redirects), List.copyOf(prefix), span);
        }
        if (prefix.isEmpty() && redirects.isEmpty() && nameToken.plain()) {
            var special = specialForm(nameToken.raw(), args, argTokens, span);
            if (special.isPresent()) {
                return special.get();
            }
        }
        return new Command(nameToken.raw(), List.copyOf(args), List.copyOf(redirects), List.copyOf(prefix), span);
    }

    /**
     * Builtins that have their own statement kind; empty when the command is ordinary.
     */
    private Optional<ShellStatement> specialForm(String name,
                                                 List<ShellExpression> args,
                                                 List<ShellToken> argTokens,
                                                 SourceSpan span) {
        switch (name) {
            case "return" -> {
                return args.size() <= 1 ? Optional.of(new Return(args.stream().findFirst(), span)) : Optional.empty();
            }
            case "exit" -> {
                return args.size() <= 1 ? Optional.of(new Exit(args.stream().findFirst(), span)) : Optional.empty();
            }
            case "export", "local", "readonly" -> {
                if (argTokens.size() == 1 && argTokens.get(0) instanceof ShellToken.AssignmentWord assignment) {
                    var kind = AssignmentKind.valueOf(name.toUpperCase(Locale.ROOT));
                    return Optional.of(toAssignment(assignment, kind, span));
                }
                return Optional.empty();
            }
            case "[", "test" -> {
                return TestParser.parseSingleBracket(name.equals("["), args, span, depth + nesting)
                                 .<ShellStatement>map(test -> new TestCommand(test, span));
            }
            default -> {
                return Optional.empty();
            }
        }
    }

    private Redirect parseRedirect() {
        var token = advance();
        if (token instanceof ShellToken.HereDoc hereDoc) {
            return new Redirect.HereDocument(hereDoc.fd(), hereDoc.delimiterWord(), hereDoc.delimiter(),
                                             hereDoc.body(), hereDoc.quoted(), hereDoc.stripTabs(), hereDoc.span());
        }
        var operator = (ShellToken.RedirectOp) token;
        var target = peek();
        if (!(target instanceof ShellToken.Word) && !(target instanceof ShellToken.AssignmentWord)) {
            throw unexpected(target, "redirection target");
        }
        advance();
        var span = operator.span().merge(target.span());
        return switch (operator.symbol()) {
            case ">&", "<&" -> new Redirect.Duplicate(operator.symbol(), operator.fd(), rawText(target), span);
            case "<<<" -> new Redirect.HereString(operator.fd(), wordValue(target), span);
            default -> new Redirect.FileRedirect(operator.symbol(), operator.fd(), wordValue(target), span);
        };
    }

    // === Compound commands ===

    private ShellStatement parseIf() {
        var start = advance();
        var condition = parseCondition(Set.of("then"), start, "if", "then");
        expectKeyword("then", start, "if", "fi");
        var thenBranch = parseList(Set.of("elif", "else", "fi"));
        var elifs = new ArrayList<ElifBranch>();
        while (isWord("elif")) {
            advance();
            var elifCondition = parseCondition(Set.of("then"), start, "if", "then");
            expectKeyword("then", start, "if", "fi");
            elifs.add(new ElifBranch(elifCondition, parseList(Set.of("elif", "else", "fi"))));
        }
        Optional<List<ShellStatement>> elseBranch = Optional.empty();
        if (isWord("else")) {
            advance();
            elseBranch = Optional.of(parseList(Set.of("fi")));
        }
        var end = expectKeyword("fi", start, "if", "fi");
        return new If(condition, thenBranch, List.copyOf(elifs), elseBranch, spanOf(start, end));
    }

    private ShellStatement parseWhile(boolean until) {
        var start = advance();
        var keyword = until ? "until" : "while";
        var condition = parseCondition(Set.of("do"), start, keyword, "do");
        expectKeyword("do", start, keyword, "done");
        var body = parseList(Set.of("done"));
        var end = expectKeyword("done", start, keyword, "done");
        return until
            ? new Until(condition, body, spanOf(start, end))
            : new While(condition, body, spanOf(start, end));
    }

    private ShellExpression parseCondition(Set<String> closers, ShellToken opener, String keyword, String closer) {
        var statements = parseList(closers).stream()
                                           .filter(statement -> !(statement instanceof Comment))
                                           .toList();
        if (statements.isEmpty()) {
            if (peek() instanceof ShellToken.Eof) {
                throw new SyntaxFailure(new ParseError.UnterminatedBlock(opener.span().start(), keyword, closer));
            }
            throw unexpected(peek(), "condition");
        }
        if (statements.size() == 1) {
            var statement = statements.get(0);
            if (statement instanceof TestCommand testCommand) {
                return testCommand.test();
            }
            return new ShellExpression.CommandCondition(statement, statement.span());
        }
        var span = statements.get(0).span().merge(statements.get(statements.size() - 1).span());
        return new ShellExpression.CommandCondition(new Group(statements, false, span), span);
    }

    private ShellStatement parseFor() {
        var start = advance();
        if (peek() instanceof ShellToken.ArithBlock header) {
            advance();
            var clauses = header.text().split(";", -1);
            if (clauses.length != 3) {
                throw new SyntaxFailure(new ParseError.InvalidForClause(header.span().start(), header.text(), clauses.length));
            }
            skipSeparator();
            expectKeyword("do", start, "for", "done");
            var body = parseList(Set.of("done"));
            var end = expectKeyword("done", start, "for", "done");
            return new ForCStyle(clauses[0].trim(), clauses[1].trim(), clauses[2].trim(), body, spanOf(start, end));
        }
        var variable = expectName(start, "for");
        var items = parseLoopItems();
        expectKeyword("do", start, "for", "done");
        var body = parseList(Set.of("done"));
        var end = expectKeyword("done", start, "for", "done");
        return new For(variable, items, body, spanOf(start, end));
    }

    private ShellStatement parseSelect() {
        var start = advance();
        var variable = expectName(start, "select");
        var items = parseLoopItems();
        expectKeyword("do", start, "select", "done");
        var body = parseList(Set.of("done"));
        var end = expectKeyword("done", start, "select", "done");
        return new Select(variable, items, body, spanOf(start, end));
    }

    private Optional<List<ShellExpression>> parseLoopItems() {
        skipNewlinesAndComments();
        Optional<List<ShellExpression>> items = Optional.empty();
        if (isWord("in")) {
            advance();
            var list = new ArrayList<ShellExpression>();
            while (peek() instanceof ShellToken.Word || peek() instanceof ShellToken.AssignmentWord) {
                list.add(wordValue(advance()));
            }
            items = Optional.of(List.copyOf(list));
        }
        skipSeparator();
        return items;
    }

    private String expectName(ShellToken opener, String keyword) {
        var token = peek();
        if (token instanceof ShellToken.Word word && word.plain()) {
            advance();
            return word.raw();
        }
        if (token instanceof ShellToken.Eof) {
            throw new SyntaxFailure(new ParseError.UnterminatedBlock(opener.span().start(), keyword, "done"));
        }
        throw unexpected(token, "loop variable name");
    }

    private ShellStatement parseCase() {
        var start = advance();
        var wordToken = peek();
        if (wordToken instanceof ShellToken.Eof) {
            throw unterminatedCase(start);
        }
        if (!(wordToken instanceof ShellToken.Word) && !(wordToken instanceof ShellToken.AssignmentWord)) {
            throw unexpected(wordToken, "word after 'case'");
        }
        advance();
        var word = wordValue(wordToken);
        skipNewlinesAndComments();
        expectKeyword("in", start, "case", "esac");
        var arms = new ArrayList<CaseArm>();
        while (true) {
            skipNewlinesAndComments();
            if (peek() instanceof ShellToken.Eof) {
                throw unterminatedCase(start);
            }
            if (isWord("esac")) {
                break;
            }
            arms.add(parseCaseArm(start));
        }
        var end = advance();
        return new Case(word, List.copyOf(arms), spanOf(start, end));
    }

    private CaseArm parseCaseArm(ShellToken caseStart) {
        var armStart = peek();
        if (isOperator("(")) {
            advance();
        }
        var patterns = new ArrayList<String>();
        while (true) {
            var token = peek();
            if (token instanceof ShellToken.Eof) {
                throw unterminatedCase(caseStart);
            }
            if (!(token instanceof ShellToken.Word) && !(token instanceof ShellToken.AssignmentWord)) {
                throw unexpected(token, "case pattern");
            }
            advance();
            patterns.add(rawText(token));
            if (!isOperator("|")) {
                break;
            }
            advance();
        }
        if (!isOperator(")")) {
            if (peek() instanceof ShellToken.Eof) {
                throw unterminatedCase(caseStart);
            }
            throw unexpected(peek(), "')' after case pattern");
        }
        advance();
        var body = parseList(Set.of("esac"));
        var terminator = CaseArm.Terminator.BREAK;
        var end = previousEnd();
        if (peek() instanceof ShellToken.Operator operator && CASE_TERMINATORS.contains(operator.symbol())) {
            advance();
            terminator = CaseArm.Terminator.fromSymbol(operator.symbol());
            end = operator.span().end();
        } else if (peek() instanceof ShellToken.Eof) {
            throw unterminatedCase(caseStart);
        } else if (!isWord("esac")) {
            throw unexpected(peek(), "';;' or 'esac'");
        }
        return new CaseArm(List.copyOf(patterns), body, terminator, SourceSpan.of(armStart.span().start(), end));
    }

    private SyntaxFailure unterminatedCase(ShellToken start) {
        return new SyntaxFailure(new ParseError.UnterminatedBlock(start.span().start(), "case", "esac"));
    }

    private ShellStatement parseFunction(boolean keywordSyntax) {
        var start = peek();
        String name;
        if (keywordSyntax) {
            advance();
            var nameToken = peek();
            if (!(nameToken instanceof ShellToken.Word word)) {
                throw unexpected(nameToken, "function name");
            }
            advance();
            name = word.raw();
            if (isOperator("(")) {
                advance();
                expectOperator(")");
            }
        } else {
            name = ((ShellToken.Word) advance()).raw();
            advance();
            advance();
        }
        skipNewlinesAndComments();
        if (peek() instanceof ShellToken.Eof) {
            throw unexpected(peek(), "function body");
        }
        var body = parseCommand();
        var statements = body instanceof Group group && !group.subshell()
            ? group.body()
            : List.of(body);
        return new Function(name, statements, keywordSyntax, SourceSpan.of(start.span().start(), body.span().end()));
    }

    private ShellStatement parseGroup() {
        var start = advance();
        var body = parseList(Set.of("}"));
        if (body.isEmpty() && !(peek() instanceof ShellToken.Eof)) {
            throw unexpected(peek(), "command");
        }
        var end = expectKeyword("}", start, "{", "}");
        return new Group(body, false, spanOf(start, end));
    }

    private ShellStatement parseSubshell() {
        var start = advance();
        var body = parseList(NO_CLOSERS);
        if (peek() instanceof ShellToken.Eof) {
            throw new SyntaxFailure(new ParseError.UnterminatedBlock(start.span().start(), "(", ")"));
        }
        if (body.isEmpty()) {
            throw unexpected(peek(), "command");
        }
        var end = expectOperator(")");
        return new Group(body, true, spanOf(start, end));
    }

    private ShellStatement parseCoproc() {
        var start = advance();
        Optional<String> name = Optional.empty();
        if (peek() instanceof ShellToken.Word word && word.plain() && peekAt(1) instanceof ShellToken.Word next && next.is("{")) {
            advance();
            name = Optional.of(word.raw());
        }
        var body = parseCommand();
        return new Coproc(name, body, SourceSpan.of(start.span().start(), body.span().end()));
    }

    private ShellStatement parseExtendedTest() {
        var start = advance();
        var items = new ArrayList<TestParser.Item>();
        while (!isWord("]]")) {
            var token = peek();
            if (token instanceof ShellToken.Eof) {
                throw new SyntaxFailure(new ParseError.UnterminatedBlock(start.span().start(), "[[", "]]"));
            }
            advance();
            if (token instanceof ShellToken.Newline) {
                continue;
            }
            if (token instanceof ShellToken.Word word) {
                items.add(TestParser.Item.word(word.plain() ? word.raw() : null, word.value(), word.span()));
            } else if (token instanceof ShellToken.AssignmentWord assignment) {
                items.add(TestParser.Item.word(null, assignmentAsWord(assignment), assignment.span()));
            } else if (token instanceof ShellToken.Operator operator) {
                items.add(TestParser.Item.operator(operator.symbol(), operator.span()));
            } else if (token instanceof ShellToken.RedirectOp redirect && redirect.fd().isEmpty()) {
                items.add(TestParser.Item.operator(redirect.symbol(), redirect.span()));
            } else {
                throw unexpected(token, "test operand or ']]'");
            }
        }
        var end = advance();
        var span = spanOf(start, end);
        var test = TestParser.parseExtended(items, span, depth + nesting);
        return new TestCommand(new ShellExpression.Test(test, true, span), span);
    }

    // === Word conversion ===

    private Assignment toAssignment(ShellToken.AssignmentWord word, AssignmentKind kind, SourceSpan span) {
        return new Assignment(word.name(), word.index(), word.value(), kind, word.append(), span);
    }

    /**
     * An assignment-shaped word in argument position is an ordinary word.
     */
    static ShellExpression assignmentAsWord(ShellToken.AssignmentWord word) {
        var head = word.name() + word.index().map(index -> "[" + index + "]").orElse("") + (word.append() ? "+=" : "=");
        var start = word.span().start();
        var headEnd = SourceLocation.at(start.line(), start.column() + head.length(), start.offset() + head.length());
        var literal = new ShellExpression.Literal(head, Quoting.NONE, SourceSpan.of(start, headEnd));
        var value = word.value();
        if (value instanceof ShellExpression.Literal valueLiteral && valueLiteral.quoting() == Quoting.NONE) {
            return new ShellExpression.Literal(head + valueLiteral.value(), Quoting.NONE, word.span());
        }
        var parts = new ArrayList<ShellExpression>();
        parts.add(literal);
        if (value instanceof ShellExpression.Concat concat && !concat.doubleQuoted()) {
            parts.addAll(concat.parts());
        } else {
            parts.add(value);
        }
        return new ShellExpression.Concat(List.copyOf(parts), false, word.span());
    }

    private static ShellExpression wordValue(ShellToken token) {
        if (token instanceof ShellToken.Word word) {
            return word.value();
        }
        return assignmentAsWord((ShellToken.AssignmentWord) token);
    }

    private static String rawText(ShellToken token) {
        if (token instanceof ShellToken.Word word) {
            return word.raw();
        }
        return ((ShellToken.AssignmentWord) token).raw();
    }

    // === Token helpers ===

    private void enter() {
        nesting++;
        if (nesting + depth > MAX_DEPTH) {
            throw new SyntaxFailure(new ParseError.NestingTooDeep(peek().span().start(), MAX_DEPTH));
        }
    }

    private ShellToken expectKeyword(String keyword, ShellToken opener, String openerKeyword, String closer) {
        if (isWord(keyword)) {
            return advance();
        }
        if (peek() instanceof ShellToken.Eof) {
            throw new SyntaxFailure(new ParseError.UnterminatedBlock(opener.span().start(), openerKeyword, closer));
        }
        throw unexpected(peek(), "'" + keyword + "'");
    }

    private ShellToken expectOperator(String symbol) {
        if (isOperator(symbol)) {
            return advance();
        }
        throw unexpected(peek(), "'" + symbol + "'");
    }

    private void skipSeparator() {
        if (isOperator(";")) {
            advance();
        }
        skipNewlinesAndComments();
    }

    private void skipNewlines() {
        while (peek() instanceof ShellToken.Newline) {
            advance();
        }
    }

    private void skipNewlinesAndComments() {
        while (peek() instanceof ShellToken.Newline || peek() instanceof ShellToken.Comment) {
            advance();
        }
    }

    private boolean isWord(String keyword) {
        return peek() instanceof ShellToken.Word word && word.is(keyword);
    }

    private boolean isOperator(String symbol) {
        return peek() instanceof ShellToken.Operator operator && operator.is(symbol);
    }

    private ShellToken peek() {
        return tokens.get(pos);
    }

    private ShellToken peekAt(int ahead) {
        return tokens.get(Math.min(pos + ahead, tokens.size() - 1));
    }

    private ShellToken advance() {
        var token = tokens.get(pos);
        if (pos < tokens.size() - 1) {
            pos++;
        }
        return token;
    }

    private SourceLocation previousEnd() {
        return tokens.get(Math.max(0, pos - 1)).span().end();
    }

    private static SourceSpan spanOf(ShellToken start, ShellToken end) {
        return SourceSpan.of(start.span().start(), end.span().end());
    }

    private static SourceLocation shifted(SourceLocation location, int columns) {
        return SourceLocation.at(location.line(), location.column() + columns, location.offset() + columns);
    }

    private static SyntaxFailure unexpected(ShellToken token, String expected) {
        if (token instanceof ShellToken.Eof) {
            return new SyntaxFailure(new ParseError.UnexpectedEof(token.span().start(), expected));
        }
        return new SyntaxFailure(new ParseError.UnexpectedInput(token.span().start(), tokenDescription(token), expected));
    }

    private static String tokenDescription(ShellToken token) {
        if (token instanceof ShellToken.Word word) {
            return word.raw();
        }
        if (token instanceof ShellToken.AssignmentWord word) {
            return word.raw();
        }
        if (token instanceof ShellToken.Operator operator) {
            return operator.symbol();
        }
        if (token instanceof ShellToken.RedirectOp redirect) {
            return redirect.symbol();
        }
        if (token instanceof ShellToken.HereDoc hereDoc) {
            return "<<" + hereDoc.delimiterWord();
        }
        if (token instanceof ShellToken.ArithBlock block) {
            return "((" + block.text() + "))";
        }
        if (token instanceof ShellToken.Comment comment) {
            return "#" + comment.text();
        }
        return token instanceof ShellToken.Newline ? "newline" : "end of input";
    }
}
