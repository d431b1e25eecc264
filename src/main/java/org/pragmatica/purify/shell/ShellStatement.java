package org.pragmatica.purify.shell;

import org.pragmatica.purify.tree.SourceSpan;

import java.util.List;
import java.util.Optional;

/**
 * Statement nodes of a shell syntax tree. The set is closed so that analyzer, rewriter and
 * renderer can dispatch over every kind.
 */
public sealed interface ShellStatement extends ShellNode {

    /**
     * Simple command. {@code name} is the first word as written and may be empty when the
     * command consists of prefix assignments and redirects only.
     */
    record Command(String name,
                   List<ShellExpression> args,
                   List<Redirect> redirects,
                   List<Assignment> prefix,
                   SourceSpan span) implements ShellStatement {
        public Command(String name, List<ShellExpression> args, List<Redirect> redirects, SourceSpan span) {
            this(name, args, redirects, List.of(), span);
        }

        public Command withArgs(List<ShellExpression> newArgs) {
            return new Command(name, List.copyOf(newArgs), redirects, prefix, span);
        }
    }

    /**
     * Commands joined by {@code |}; {@code stderrJoins} marks each junction written as {@code |&}.
     */
    record Pipeline(List<ShellStatement> commands, List<Boolean> stderrJoins, SourceSpan span) implements ShellStatement {}

    record AndList(ShellStatement left, ShellStatement right, SourceSpan span) implements ShellStatement {}

    record OrList(ShellStatement left, ShellStatement right, SourceSpan span) implements ShellStatement {}

    record If(ShellExpression condition,
              List<ShellStatement> thenBranch,
              List<ElifBranch> elifs,
              Optional<List<ShellStatement>> elseBranch,
              SourceSpan span) implements ShellStatement {}

    record ElifBranch(ShellExpression condition, List<ShellStatement> body) {}

    record While(ShellExpression condition, List<ShellStatement> body, SourceSpan span) implements ShellStatement {}

    record Until(ShellExpression condition, List<ShellStatement> body, SourceSpan span) implements ShellStatement {}

    /**
     * {@code for name [in items]}; absent items iterate the positional parameters.
     */
    record For(String variable,
               Optional<List<ShellExpression>> items,
               List<ShellStatement> body,
               SourceSpan span) implements ShellStatement {}

    /**
     * {@code for ((init; condition; increment))} with the clauses kept as raw text.
     */
    record ForCStyle(String init,
                     String condition,
                     String increment,
                     List<ShellStatement> body,
                     SourceSpan span) implements ShellStatement {}

    record Case(ShellExpression word, List<CaseArm> arms, SourceSpan span) implements ShellStatement {}

    record Select(String variable,
                  Optional<List<ShellExpression>> items,
                  List<ShellStatement> body,
                  SourceSpan span) implements ShellStatement {}

    /**
     * Function definition; {@code keywordSyntax} records the bash-only {@code function} form.
     */
    record Function(String name,
                    List<ShellStatement> body,
                    boolean keywordSyntax,
                    SourceSpan span) implements ShellStatement {}

    /**
     * Brace group, or subshell when {@code subshell} is set.
     */
    record Group(List<ShellStatement> body, boolean subshell, SourceSpan span) implements ShellStatement {}

    record Negated(ShellStatement statement, SourceSpan span) implements ShellStatement {}

    record Coproc(Optional<String> name, ShellStatement body, SourceSpan span) implements ShellStatement {}

    enum AssignmentKind {
        PLAIN(""),
        EXPORT("export"),
        LOCAL("local"),
        READONLY("readonly");

        private final String keyword;

        AssignmentKind(String keyword) {
            this.keyword = keyword;
        }

        public String keyword() {
            return keyword;
        }
    }

    record Assignment(String name,
                      Optional<String> index,
                      ShellExpression value,
                      AssignmentKind kind,
                      boolean append,
                      SourceSpan span) implements ShellStatement {
        public boolean exported() {
            return kind == AssignmentKind.EXPORT;
        }
    }

    record Return(Optional<ShellExpression> code, SourceSpan span) implements ShellStatement {}

    record Exit(Optional<ShellExpression> code, SourceSpan span) implements ShellStatement {}

    /**
     * Comment text after the {@code #}; a first-line comment starting with {@code !} is the shebang.
     */
    record Comment(String text, SourceSpan span) implements ShellStatement {
        public boolean isShebang() {
            return text.startsWith("!") && span.start().line() == 1;
        }
    }

    record Background(ShellStatement statement, SourceSpan span) implements ShellStatement {}

    record TestCommand(ShellExpression.Test test, SourceSpan span) implements ShellStatement {}

    /**
     * Arithmetic command {@code (( expr ))}.
     */
    record ArithCommand(ArithExpr expression, SourceSpan span) implements ShellStatement {}

    /**
     * Compound command followed by redirects, such as {@code while ...; done < file}.
     */
    record Redirected(ShellStatement body, List<Redirect> redirects, SourceSpan span) implements ShellStatement {}
}
