package org.pragmatica.purify.shell;

import org.pragmatica.purify.format.FormatOptions;
import org.pragmatica.purify.format.LineWrapper;
import org.pragmatica.purify.shell.ShellExpression.Quoting;
import org.pragmatica.purify.shell.ShellStatement.*;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Renders shell syntax trees back to source text.
 *
 * <p>Output is re-parsable into the same tree, with two exceptions: reserved words used as bare
 * arguments come back single-quoted, and {@code select} loops are lowered to a POSIX
 * {@code while}/{@code read} menu.
 */
public final class ShellRenderer {
    private static final String INDENT = "    ";
    private static final Set<String> RESERVED_WORDS = Set.of(
        "if", "then", "else", "elif", "fi", "do", "done", "case", "esac", "while", "until", "for",
        "in", "select", "function", "time", "coproc", "{", "}", "!", "[[", "]]");

    // Bare in command position the shell times the pipeline; quoted it becomes a PATH lookup.
    private static final Set<String> PIPELINE_KEYWORDS = Set.of("time");

    private final FormatOptions options;
    private final List<Redirect.HereDocument> pendingHereDocs = new ArrayList<>();
    private StringBuilder out = new StringBuilder();
    private int indent;

    private ShellRenderer(FormatOptions options, int indent) {
        this.options = options;
        this.indent = indent;
    }

    public static String render(ShellScript script) {
        return render(script, FormatOptions.DEFAULT);
    }

    public static String render(ShellScript script, FormatOptions options) {
        var renderer = new ShellRenderer(options, 0);
        renderer.statements(script.statements());
        return renderer.out.toString();
    }

    /**
     * Renders one statement on a single line where its form allows.
     */
    public static String renderStatement(ShellStatement statement) {
        var renderer = new ShellRenderer(FormatOptions.DEFAULT, 0);
        renderer.statement(statement);
        renderer.flushHereDocs();
        return renderer.out.toString();
    }

    public static String renderExpression(ShellExpression expression) {
        return new ShellRenderer(FormatOptions.DEFAULT, 0).word(expression);
    }

    // === Line writer ===

    private void write(String text) {
        out.append(text);
    }

    private void startLine() {
        out.append(INDENT.repeat(indent));
    }

    private void newline() {
        out.append('\n');
        flushHereDocs();
    }

    private void flushHereDocs() {
        for (var hereDoc : pendingHereDocs) {
            out.append(hereDoc.body());
            out.append(hereDoc.delimiter()).append('\n');
        }
        pendingHereDocs.clear();
    }

    private String capture(Runnable action) {
        var saved = out;
        out = new StringBuilder();
        try {
            action.run();
            return out.toString();
        } finally {
            out = saved;
        }
    }

    // === Statements ===

    private void statements(List<ShellStatement> statements) {
        for (var statement : statements) {
            if (statement instanceof Command && options.maxLineLength().isPresent()) {
                var text = capture(() -> statement(statement));
                if (text.indexOf('\n') < 0) {
                    var prefix = INDENT.repeat(indent);
                    var lines = LineWrapper.wrap(prefix + text, options.maxLineLength().getAsInt(), prefix + INDENT);
                    write(String.join("\n", lines));
                    newline();
                    continue;
                }
            }
            startLine();
            statement(statement);
            newline();
        }
    }

    private void body(List<ShellStatement> statements) {
        newline();
        indent++;
        statements(statements);
        indent--;
    }

    private void statement(ShellStatement statement) {
        if (statement instanceof Command command) {
            command(command);
        } else if (statement instanceof Pipeline pipeline) {
            for (int i = 0; i < pipeline.commands().size(); i++) {
                if (i > 0) {
                    write(pipeline.stderrJoins().get(i - 1) ? " |& " : " | ");
                }
                statement(pipeline.commands().get(i));
            }
        } else if (statement instanceof AndList andList) {
            statement(andList.left());
            write(" && ");
            statement(andList.right());
        } else if (statement instanceof OrList orList) {
            statement(orList.left());
            write(" || ");
            statement(orList.right());
        } else if (statement instanceof If ifStatement) {
            ifStatement(ifStatement);
        } else if (statement instanceof While loop) {
            loop("while ", loop.condition(), loop.body());
        } else if (statement instanceof Until loop) {
            loop("until ", loop.condition(), loop.body());
        } else if (statement instanceof For loop) {
            write("for " + loop.variable());
            loop.items().ifPresent(items -> write(" in" + items.stream().map(item -> " " + word(item)).collect(Collectors.joining())));
            write("; do");
            body(loop.body());
            startLine();
            write("done");
        } else if (statement instanceof ForCStyle loop) {
            write("for ((" + loop.init() + "; " + loop.condition() + "; " + loop.increment() + ")); do");
            body(loop.body());
            startLine();
            write("done");
        } else if (statement instanceof Case caseStatement) {
            caseStatement(caseStatement);
        } else if (statement instanceof Select select) {
            select(select);
        } else if (statement instanceof Function function) {
            write(function.keywordSyntax() ? "function " + function.name() + " {" : function.name() + "() {");
            body(function.body());
            startLine();
            write("}");
        } else if (statement instanceof Group group) {
            group(group);
        } else if (statement instanceof Negated negated) {
            write("! ");
            statement(negated.statement());
        } else if (statement instanceof Coproc coproc) {
            write("coproc ");
            coproc.name().ifPresent(name -> write(name + " "));
            statement(coproc.body());
        } else if (statement instanceof Assignment assignment) {
            write(assignment(assignment));
        } else if (statement instanceof Return returnStatement) {
            write("return" + returnStatement.code().map(code -> " " + word(code)).orElse(""));
        } else if (statement instanceof Exit exit) {
            write("exit" + exit.code().map(code -> " " + word(code)).orElse(""));
        } else if (statement instanceof Comment comment) {
            write("#" + comment.text());
        } else if (statement instanceof Background background) {
            statement(background.statement());
            write(" &");
        } else if (statement instanceof TestCommand testCommand) {
            write(test(testCommand.test()));
        } else if (statement instanceof ArithCommand arithCommand) {
            write("((" + arith(arithCommand.expression()) + "))");
        } else if (statement instanceof Redirected redirected) {
            statement(redirected.body());
            redirected.redirects().forEach(redirect -> write(" " + redirect(redirect)));
        } else {
            throw new IllegalStateException("No text form for " + statement.getClass().getSimpleName());
        }
    }

    private void command(Command command) {
        var parts = new ArrayList<String>();
        command.prefix().forEach(assignment -> parts.add(assignment(assignment)));
        if (!command.name().isEmpty()) {
            parts.add(quotedAsName(command.name()) ? "'" + command.name() + "'" : command.name());
        }
        command.args().forEach(arg -> parts.add(word(arg)));
        command.redirects().forEach(redirect -> parts.add(redirect(redirect)));
        write(String.join(" ", parts));
    }

    private static boolean quotedAsName(String name) {
        return RESERVED_WORDS.contains(name) && !PIPELINE_KEYWORDS.contains(name);
    }

    private void ifStatement(If ifStatement) {
        write("if ");
        condition(ifStatement.condition());
        write("; then");
        body(ifStatement.thenBranch());
        for (var elif : ifStatement.elifs()) {
            startLine();
            write("elif ");
            condition(elif.condition());
            write("; then");
            body(elif.body());
        }
        ifStatement.elseBranch().ifPresent(elseBranch -> {
            startLine();
            write("else");
            body(elseBranch);
        });
        startLine();
        write("fi");
    }

    private void loop(String keyword, ShellExpression condition, List<ShellStatement> body) {
        write(keyword);
        condition(condition);
        write("; do");
        body(body);
        startLine();
        write("done");
    }

    private void condition(ShellExpression condition) {
        if (condition instanceof ShellExpression.CommandCondition commandCondition) {
            statement(commandCondition.statement());
        } else {
            write(word(condition));
        }
    }

    private void caseStatement(Case caseStatement) {
        write("case " + word(caseStatement.word()) + " in");
        newline();
        indent++;
        for (var arm : caseStatement.arms()) {
            startLine();
            write(String.join("|", arm.patterns()) + ")");
            newline();
            indent++;
            statements(arm.body());
            startLine();
            write(arm.terminator().symbol());
            newline();
            indent--;
        }
        indent--;
        startLine();
        write("esac");
    }

    private void group(Group group) {
        if (group.body().size() == 1 && isSimple(group.body().get(0))) {
            var inner = capture(() -> statement(group.body().get(0)));
            if (inner.indexOf('\n') < 0) {
                boolean background = group.body().get(0) instanceof Background;
                write(group.subshell()
                          ? "( " + inner + " )"
                          : "{ " + inner + (background ? " }" : "; }"));
                return;
            }
        }
        write(group.subshell() ? "(" : "{");
        body(group.body());
        startLine();
        write(group.subshell() ? ")" : "}");
    }

    /**
     * Lowers {@code select} to a numbered menu printed to stderr and a {@code read} loop.
     */
    private void select(Select select) {
        var items = select.items()
                          .map(list -> list.stream().map(this::word).collect(Collectors.joining(" ")))
                          .orElse("\"$@\"");
        var lines = List.of(
            "__select_i=0",
            "for __select_opt in " + items + "; do",
            INDENT + "__select_i=$((__select_i + 1))",
            INDENT + "printf '%s) %s\\n' \"$__select_i\" \"$__select_opt\" >&2",
            "done",
            "while printf '%s' \"${PS3:-#? }\" >&2 && read -r REPLY; do",
            INDENT + select.variable() + "=",
            INDENT + "__select_i=0",
            INDENT + "for __select_opt in " + items + "; do",
            INDENT + INDENT + "__select_i=$((__select_i + 1))",
            INDENT + INDENT + "if [ \"$__select_i\" = \"$REPLY\" ]; then",
            INDENT + INDENT + INDENT + select.variable() + "=$__select_opt",
            INDENT + INDENT + INDENT + "break",
            INDENT + INDENT + "fi",
            INDENT + "done");
        for (int i = 0; i < lines.size(); i++) {
            if (i > 0) {
                startLine();
            }
            write(lines.get(i));
            newline();
        }
        indent++;
        statements(select.body());
        indent--;
        startLine();
        write("done");
    }

    private boolean isSimple(ShellStatement statement) {
        if (statement instanceof Command command) {
            return command.redirects().stream().noneMatch(Redirect.HereDocument.class::isInstance);
        }
        if (statement instanceof Pipeline pipeline) {
            return pipeline.commands().stream().allMatch(this::isSimple);
        }
        if (statement instanceof AndList andList) {
            return isSimple(andList.left()) && isSimple(andList.right());
        }
        if (statement instanceof OrList orList) {
            return isSimple(orList.left()) && isSimple(orList.right());
        }
        if (statement instanceof Negated negated) {
            return isSimple(negated.statement());
        }
        if (statement instanceof Background background) {
            return isSimple(background.statement());
        }
        return statement instanceof Assignment
               || statement instanceof Return
               || statement instanceof Exit
               || statement instanceof TestCommand
               || statement instanceof ArithCommand;
    }

    private String assignment(Assignment assignment) {
        var sb = new StringBuilder();
        if (assignment.kind() != AssignmentKind.PLAIN) {
            sb.append(assignment.kind().keyword()).append(' ');
        }
        sb.append(assignment.name());
        assignment.index().ifPresent(index -> sb.append('[').append(index).append(']'));
        sb.append(assignment.append() ? "+=" : "=");
        sb.append(value(assignment.value()));
        return sb.toString();
    }

    private String redirect(Redirect redirect) {
        var fd = fd(redirect.fd());
        if (redirect instanceof Redirect.FileRedirect file) {
            return fd + file.operator() + " " + value(file.target());
        }
        if (redirect instanceof Redirect.Duplicate duplicate) {
            return fd + duplicate.operator() + duplicate.target();
        }
        if (redirect instanceof Redirect.HereDocument hereDoc) {
            pendingHereDocs.add(hereDoc);
            return fd + (hereDoc.stripTabs() ? "<<-" : "<<") + hereDoc.delimiterWord();
        }
        if (redirect instanceof Redirect.HereString hereString) {
            return fd + "<<< " + word(hereString.target());
        }
        throw new IllegalStateException("No text form for " + redirect.getClass().getSimpleName());
    }

    private static String fd(OptionalInt fd) {
        return fd.isPresent() ? String.valueOf(fd.getAsInt()) : "";
    }

    // === Words ===

    /**
     * A word in argument position.
     */
    private String word(ShellExpression expression) {
        if (expression instanceof ShellExpression.Literal literal && literal.quoting() == Quoting.NONE) {
            if (literal.value().isEmpty()) {
                return "\"\"";
            }
            if (RESERVED_WORDS.contains(literal.value())) {
                return "'" + literal.value() + "'";
            }
        }
        return value(expression);
    }

    /**
     * A word where bare reserved words and empty text need no protection.
     */
    private String value(ShellExpression expression) {
        if (expression instanceof ShellExpression.Literal literal) {
            return switch (literal.quoting()) {
                case NONE -> literal.value();
                case SINGLE -> "'" + literal.value() + "'";
                case ANSI_C -> "$'" + literal.value() + "'";
            };
        }
        if (expression instanceof ShellExpression.Variable variable) {
            return variable.braced() ? "${" + variable.name() + "}" : "$" + variable.name();
        }
        if (expression instanceof ShellExpression.ArrayLiteral array) {
            return array.elements().stream().map(this::word).collect(Collectors.joining(" ", "(", ")"));
        }
        if (expression instanceof ShellExpression.Glob glob) {
            return glob.pattern();
        }
        if (expression instanceof ShellExpression.Arithmetic arithmetic) {
            return "$((" + arith(arithmetic.expression()) + "))";
        }
        if (expression instanceof ShellExpression.CommandSubstitution substitution) {
            return substitution(substitution);
        }
        if (expression instanceof ShellExpression.Test test) {
            return test(test);
        }
        if (expression instanceof ShellExpression.CommandCondition condition) {
            return capture(() -> statement(condition.statement()));
        }
        if (expression instanceof ShellExpression.Concat concat) {
            var text = parts(concat.parts());
            return concat.doubleQuoted() ? "\"" + text + "\"" : text;
        }
        if (expression instanceof ShellExpression.ParamExpansion expansion) {
            if (expansion.operator() == ShellExpression.ParamOperator.LENGTH) {
                return "${#" + expansion.name() + "}";
            }
            return "${" + expansion.name() + expansion.operator().symbol()
                   + expansion.operand().map(this::value).orElse("") + "}";
        }
        throw new IllegalStateException("No text form for " + expression.getClass().getSimpleName());
    }

    private String parts(List<ShellExpression> parts) {
        var sb = new StringBuilder();
        for (int i = 0; i < parts.size(); i++) {
            var part = parts.get(i);
            var text = value(part);
            if (part instanceof ShellExpression.Variable variable && !variable.braced() && i + 1 < parts.size()) {
                var next = value(parts.get(i + 1));
                if (!next.isEmpty() && needsBraces(variable.name(), next.charAt(0))) {
                    text = "${" + variable.name() + "}";
                }
            }
            sb.append(text);
        }
        return sb.toString();
    }

    private static boolean needsBraces(String name, char next) {
        if (Character.isDigit(name.charAt(0)) || name.length() == 1 && !ShellLexer.isNameStart(name.charAt(0))) {
            return Character.isDigit(next);
        }
        return ShellLexer.isNameChar(next);
    }

    private String substitution(ShellExpression.CommandSubstitution substitution) {
        var body = substitution.body();
        if (body.stream().allMatch(this::isSimple)) {
            var inline = new StringBuilder();
            for (int i = 0; i < body.size(); i++) {
                var statement = body.get(i);
                inline.append(capture(() -> statement(statement)));
                if (i < body.size() - 1) {
                    inline.append(statement instanceof Background ? " " : "; ");
                }
            }
            var text = inline.toString();
            if (substitution.backtick() && text.indexOf('`') < 0 && text.indexOf('\\') < 0) {
                return "`" + text + "`";
            }
            return text.startsWith("(") ? "$( " + text + ")" : "$(" + text + ")";
        }
        var nested = new ShellRenderer(options, indent + 1);
        nested.statements(body);
        return "$(\n" + nested.out + INDENT.repeat(indent) + ")";
    }

    // === Tests ===

    private String test(ShellExpression.Test test) {
        return test.extended()
            ? "[[ " + testExpr(test.test(), true) + " ]]"
            : "[ " + testExpr(test.test(), false) + " ]";
    }

    private String testExpr(TestExpr expr, boolean extended) {
        if (expr instanceof TestExpr.Unary unary) {
            return unary.operator().symbol() + " " + word(unary.operand());
        }
        if (expr instanceof TestExpr.Binary binary) {
            var symbol = binary.operator().symbol();
            if (!extended && (symbol.equals("<") || symbol.equals(">"))) {
                symbol = "\\" + symbol;
            }
            return word(binary.left()) + " " + symbol + " " + word(binary.right());
        }
        if (expr instanceof TestExpr.Word testWord) {
            return word(testWord.word());
        }
        if (expr instanceof TestExpr.Not not) {
            return "! " + testExpr(not.operand(), extended);
        }
        if (expr instanceof TestExpr.And and) {
            return testExpr(and.left(), extended) + (extended ? " && " : " -a ") + testExpr(and.right(), extended);
        }
        if (expr instanceof TestExpr.Or or) {
            return testExpr(or.left(), extended) + (extended ? " || " : " -o ") + testExpr(or.right(), extended);
        }
        if (expr instanceof TestExpr.Group group) {
            return extended
                ? "( " + testExpr(group.inner(), true) + " )"
                : "\\( " + testExpr(group.inner(), false) + " \\)";
        }
        throw new IllegalStateException("No text form for " + expr.getClass().getSimpleName());
    }

    // === Arithmetic ===

    static String arith(ArithExpr expr) {
        if (expr instanceof ArithExpr.Number number) {
            return number.literal();
        }
        if (expr instanceof ArithExpr.Variable variable) {
            if (!variable.dollar()) {
                return variable.name();
            }
            return variable.name().chars().allMatch(c -> ShellLexer.isNameChar((char) c))
                ? "$" + variable.name()
                : "${" + variable.name() + "}";
        }
        if (expr instanceof ArithExpr.Unary unary) {
            var operand = arith(unary.operand());
            boolean separate = !operand.isEmpty() && (operand.charAt(0) == '-' || operand.charAt(0) == '+');
            return unary.operator() + (separate ? " " : "") + operand;
        }
        if (expr instanceof ArithExpr.Binary binary) {
            if (binary.operator().equals(",")) {
                return arith(binary.left()) + ", " + arith(binary.right());
            }
            return arith(binary.left()) + " " + binary.operator() + " " + arith(binary.right());
        }
        if (expr instanceof ArithExpr.Ternary ternary) {
            return arith(ternary.condition()) + " ? " + arith(ternary.whenTrue()) + " : " + arith(ternary.whenFalse());
        }
        if (expr instanceof ArithExpr.Assign assign) {
            return assign.name() + " " + assign.operator() + " " + arith(assign.value());
        }
        if (expr instanceof ArithExpr.Increment increment) {
            return increment.prefix() ? increment.operator() + increment.name() : increment.name() + increment.operator();
        }
        if (expr instanceof ArithExpr.Group group) {
            return "(" + arith(group.inner()) + ")";
        }
        throw new IllegalStateException("No text form for " + expr.getClass().getSimpleName());
    }
}
