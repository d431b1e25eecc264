package org.pragmatica.purify.analysis;

import org.pragmatica.purify.analysis.ShellRule.Finding;
import org.pragmatica.purify.shell.ShellExpression;
import org.pragmatica.purify.shell.ShellExpression.CommandSubstitution;
import org.pragmatica.purify.shell.ShellExpression.Concat;
import org.pragmatica.purify.shell.ShellExpression.ParamExpansion;
import org.pragmatica.purify.shell.ShellExpression.ParamOperator;
import org.pragmatica.purify.shell.ShellExpression.Quoting;
import org.pragmatica.purify.shell.ShellExpression.Variable;
import org.pragmatica.purify.shell.ShellNode;
import org.pragmatica.purify.shell.ShellStatement;
import org.pragmatica.purify.shell.ShellStatement.Command;
import org.pragmatica.purify.shell.ShellStatement.Pipeline;
import org.pragmatica.purify.shell.ShellTrees;
import org.pragmatica.purify.shell.Redirect;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.pragmatica.purify.analysis.IssueCategory.*;
import static org.pragmatica.purify.analysis.IssueSeverity.*;

/**
 * The shell rule catalog. Order of the list is the order in which rules report issues found
 * on the same node.
 */
public final class ShellRules {
    private ShellRules() {}

    public static final String RANDOM_FIX = "Use a fixed seed such as ${SEED:-42}";
    public static final String TIMESTAMP_FIX = "Use a fixed timestamp such as ${SOURCE_DATE_EPOCH}";

    static final Set<String> RANDOM_VARIABLES = Set.of("RANDOM", "SRANDOM");
    static final Set<String> CLOCK_VARIABLES = Set.of("SECONDS", "EPOCHSECONDS", "EPOCHREALTIME");
    static final Set<String> PROCESS_VARIABLES = Set.of("$", "BASHPID", "PPID");
    private static final Set<String> SHELLS = Set.of("sh", "bash", "zsh", "dash", "ksh");
    private static final Set<String> NUMERIC_SPECIALS = Set.of("#", "?", "$", "!", "*", "-");
    private static final Set<String> SPLITTING_BUILTINS = Set.of("set", "eval", "read", "unset");
    private static final Set<String> BASH_BUILTINS = Set.of("declare", "typeset", "let", "shopt", "mapfile", "readarray");
    private static final Set<String> WORLD_WRITABLE = Set.of("777", "0777", "a+w", "o+w", "a+rwx", "o+rwx", "ugo+w");
    private static final Set<ParamOperator> BASH_EXPANSIONS = Set.of(
        ParamOperator.REPLACE, ParamOperator.REPLACE_ALL, ParamOperator.UPPERCASE, ParamOperator.UPPERCASE_ALL,
        ParamOperator.LOWERCASE, ParamOperator.LOWERCASE_ALL, ParamOperator.SUBSTRING);

    public static final List<ShellRule> CATALOG = List.of(
        new ShellRule("DET001", DETERMINISM, HIGH, ShellRules::randomSource),
        new ShellRule("DET002", DETERMINISM, HIGH, ShellRules::clockSource),
        new ShellRule("DET003", DETERMINISM, MEDIUM, ShellRules::processIdSource),
        new ShellRule("DET004", DETERMINISM, MEDIUM, ShellRules::hostnameSource),
        new ShellRule("DET005", DETERMINISM, MEDIUM, ShellRules::tempFileName),
        new ShellRule("DET006", DETERMINISM, MEDIUM, ShellRules::unsortedFind),
        new ShellRule("IDEM001", IDEMPOTENCY, MEDIUM, ShellRules::mkdirWithoutParents),
        new ShellRule("IDEM002", IDEMPOTENCY, MEDIUM, ShellRules::rmWithoutForce),
        new ShellRule("IDEM003", IDEMPOTENCY, MEDIUM, ShellRules::symlinkWithoutForce),
        new ShellRule("IDEM004", IDEMPOTENCY, LOW, ShellRules::appendRedirect),
        new ShellRule("SEC001", SECURITY, CRITICAL, ShellRules::dynamicEval),
        new ShellRule("SEC002", SECURITY, HIGH, ShellRules::unquotedExpansion),
        new ShellRule("SEC003", SECURITY, CRITICAL, ShellRules::downloadPipedToShell),
        new ShellRule("SEC004", SECURITY, HIGH, ShellRules::worldWritable),
        new ShellRule("PORT001", PORTABILITY, LOW, ShellRules::bashShebang),
        new ShellRule("PORT002", PORTABILITY, MEDIUM, ShellRules::extendedTest),
        new ShellRule("PORT003", PORTABILITY, LOW, ShellRules::functionKeyword),
        new ShellRule("PORT004", PORTABILITY, LOW, ShellRules::echoOptions),
        new ShellRule("PORT005", PORTABILITY, LOW, ShellRules::sourceCommand),
        new ShellRule("PORT006", PORTABILITY, MEDIUM, ShellRules::bashOnlyConstruct),
        new ShellRule("ERR001", ERROR_HANDLING, MEDIUM, ShellRules::unguardedCd));

    public static Optional<ShellRule> byId(String id) {
        return CATALOG.stream()
                      .filter(rule -> rule.id().equals(id))
                      .findFirst();
    }

    // === Determinism ===

    private static List<Finding> randomSource(ShellNode node, ShellAnalysisContext context) {
        var name = variableName(node);
        if (name.filter(RANDOM_VARIABLES::contains).isPresent()) {
            return List.of(Finding.of(node.span(), "Use of non-deterministic $" + name.get(), RANDOM_FIX));
        }
        if (arithmeticVariables(node).stream().anyMatch(RANDOM_VARIABLES::contains)) {
            return List.of(Finding.of(node.span(), "Use of non-deterministic $RANDOM in arithmetic", RANDOM_FIX));
        }
        if (expandingHereDoc(node).filter(body -> body.contains("$RANDOM") || body.contains("${RANDOM}")
                                                  || body.contains("$SRANDOM") || body.contains("${SRANDOM}")).isPresent()) {
            return List.of(Finding.of(node.span(), "Here-document expands non-deterministic $RANDOM", RANDOM_FIX));
        }
        return derivedUse(node, context, "DET001", RANDOM_FIX);
    }

    private static List<Finding> clockSource(ShellNode node, ShellAnalysisContext context) {
        if (node instanceof Command command && command.name().equals("date") && !hasFixedEpoch(command)) {
            return List.of(Finding.of(command.span(), "Use of non-deterministic date", TIMESTAMP_FIX));
        }
        var name = variableName(node);
        if (name.filter(CLOCK_VARIABLES::contains).isPresent()) {
            return List.of(Finding.of(node.span(), "Use of non-deterministic $" + name.get(), TIMESTAMP_FIX));
        }
        if (expandingHereDoc(node).filter(body -> body.contains("$(date") || body.contains("`date")).isPresent()) {
            return List.of(Finding.of(node.span(), "Here-document expands non-deterministic date", TIMESTAMP_FIX));
        }
        return derivedUse(node, context, "DET002", TIMESTAMP_FIX);
    }

    private static List<Finding> processIdSource(ShellNode node, ShellAnalysisContext context) {
        var fix = "Use a fixed identifier instead of the process ID";
        var name = variableName(node);
        if (name.filter(PROCESS_VARIABLES::contains).isPresent()) {
            var shown = name.get().equals("$") ? "$$" : "$" + name.get();
            return List.of(Finding.of(node.span(), "Use of non-deterministic process ID " + shown, fix));
        }
        if (expandingHereDoc(node).filter(body -> body.contains("$$")).isPresent()) {
            return List.of(Finding.of(node.span(), "Here-document expands non-deterministic process ID $$", fix));
        }
        return derivedUse(node, context, "DET003", fix);
    }

    private static List<Finding> hostnameSource(ShellNode node, ShellAnalysisContext context) {
        var fix = "Pass the host name in explicitly";
        if (node instanceof Command command
            && (command.name().equals("hostname")
                || command.name().equals("uname") && (ShellTrees.hasFlag(command, 'n', "--nodename")
                                                       || ShellTrees.hasFlag(command, 'a', "--all")))) {
            return List.of(Finding.of(command.span(), "Output of '" + command.name() + "' depends on the host", fix));
        }
        if (variableName(node).filter("HOSTNAME"::equals).isPresent()) {
            return List.of(Finding.of(node.span(), "Use of host-dependent $HOSTNAME", fix));
        }
        return List.of();
    }

    private static List<Finding> tempFileName(ShellNode node, ShellAnalysisContext context) {
        if (node instanceof Command command && (command.name().equals("mktemp") || command.name().equals("tempfile"))) {
            return List.of(Finding.of(command.span(), "'" + command.name() + "' creates a randomly named file",
                                      "Use a fixed, explicitly created path"));
        }
        return List.of();
    }

    private static List<Finding> unsortedFind(ShellNode node, ShellAnalysisContext context) {
        if (node instanceof CommandSubstitution substitution
            && substitution.body().size() == 1
            && isUnsortedFind(substitution.body().get(0))) {
            return List.of(Finding.of(substitution.span(), "Output order of 'find' depends on the file system",
                                      "Pipe the output through sort"));
        }
        return List.of();
    }

    /**
     * A bare {@code find}, or a pipeline with {@code find} and no {@code sort} after it.
     */
    public static boolean isUnsortedFind(ShellStatement statement) {
        if (statement instanceof Command command) {
            return command.name().equals("find");
        }
        if (statement instanceof Pipeline pipeline) {
            var commands = pipeline.commands();
            for (int i = 0; i < commands.size(); i++) {
                if (isCommand(commands.get(i), "find")) {
                    return commands.subList(i + 1, commands.size())
                                   .stream()
                                   .noneMatch(later -> isCommand(later, "sort"));
                }
            }
        }
        return false;
    }

    // === Idempotency ===

    private static List<Finding> mkdirWithoutParents(ShellNode node, ShellAnalysisContext context) {
        if (node instanceof Command command && command.name().equals("mkdir")
            && !ShellTrees.hasFlag(command, 'p', "--parents")) {
            return List.of(Finding.of(command.span(), "mkdir fails when the directory already exists", "mkdir -p"));
        }
        return List.of();
    }

    private static List<Finding> rmWithoutForce(ShellNode node, ShellAnalysisContext context) {
        if (node instanceof Command command && command.name().equals("rm")
            && !ShellTrees.hasFlag(command, 'f', "--force")) {
            return List.of(Finding.of(command.span(), "rm fails when the file does not exist", "rm -f"));
        }
        return List.of();
    }

    private static List<Finding> symlinkWithoutForce(ShellNode node, ShellAnalysisContext context) {
        if (node instanceof Command command && command.name().equals("ln")
            && ShellTrees.hasFlag(command, 's', "--symbolic")
            && !ShellTrees.hasFlag(command, 'f', "--force")) {
            return List.of(Finding.of(command.span(), "ln -s fails when the link already exists", "ln -sf"));
        }
        return List.of();
    }

    private static List<Finding> appendRedirect(ShellNode node, ShellAnalysisContext context) {
        if (context.options().strictIdempotency()
            && node instanceof Redirect.FileRedirect redirect
            && redirect.isAppend()
            && ShellTrees.literalText(redirect.target()).filter(target -> target.startsWith("/dev/")).isEmpty()) {
            return List.of(Finding.of(redirect.span(), "Appending with '" + redirect.operator() + "' is not idempotent",
                                      "Write the file with '>' or guard the append with a grep check"));
        }
        return List.of();
    }

    // === Security ===

    private static List<Finding> dynamicEval(ShellNode node, ShellAnalysisContext context) {
        if (node instanceof Command command && command.name().equals("eval")
            && command.args().stream().anyMatch(arg -> ShellTrees.literalText(arg).isEmpty())) {
            return List.of(Finding.of(command.span(), "eval of non-literal input can execute arbitrary code",
                                      "Replace eval with explicit commands or a case statement"));
        }
        return List.of();
    }

    private static List<Finding> unquotedExpansion(ShellNode node, ShellAnalysisContext context) {
        List<ShellExpression> operands;
        if (node instanceof Command command && !SPLITTING_BUILTINS.contains(command.name())) {
            operands = command.args();
        } else if (node instanceof ShellExpression.Test test && !test.extended()) {
            operands = ShellTrees.testOperands(test.test());
        } else {
            return List.of();
        }
        var findings = new ArrayList<Finding>();
        for (var operand : operands) {
            if (isUnquotedExpansion(operand)) {
                findings.add(Finding.of(operand.span(), "Unquoted expansion is subject to word splitting and globbing",
                                        "Quote the expansion: \"" + ShellTrees.literalText(operand).orElse("$var") + "\""));
            }
        }
        return findings;
    }

    /**
     * Whether the word contains an expansion outside double quotes whose result can be split.
     */
    public static boolean isUnquotedExpansion(ShellExpression expression) {
        if (expression instanceof Variable variable) {
            return !NUMERIC_SPECIALS.contains(variable.name());
        }
        if (expression instanceof ParamExpansion expansion) {
            return expansion.operator() != ParamOperator.LENGTH;
        }
        if (expression instanceof CommandSubstitution) {
            return true;
        }
        if (expression instanceof Concat concat && !concat.doubleQuoted()) {
            return concat.parts().stream().anyMatch(ShellRules::isUnquotedExpansion);
        }
        return false;
    }

    private static List<Finding> downloadPipedToShell(ShellNode node, ShellAnalysisContext context) {
        if (!(node instanceof Pipeline pipeline)) {
            return List.of();
        }
        boolean downloading = false;
        for (var stage : pipeline.commands()) {
            if (isCommand(stage, "curl") || isCommand(stage, "wget")) {
                downloading = true;
            } else if (downloading && stage instanceof Command command && runsShell(command)) {
                return List.of(Finding.of(pipeline.span(), "Downloaded content is executed without verification",
                                          "Download to a file, verify its checksum, then run it"));
            }
        }
        return List.of();
    }

    private static boolean runsShell(Command command) {
        if (SHELLS.contains(command.name())) {
            return true;
        }
        var args = ShellTrees.argumentTexts(command);
        return command.name().equals("sudo") && !args.isEmpty() && SHELLS.contains(args.get(0));
    }

    private static List<Finding> worldWritable(ShellNode node, ShellAnalysisContext context) {
        if (node instanceof Command command && command.name().equals("chmod")
            && ShellTrees.argumentTexts(command).stream().anyMatch(WORLD_WRITABLE::contains)) {
            return List.of(Finding.of(command.span(), "chmod makes files writable by everyone",
                                      "Grant only the permissions needed, such as 755 or 644"));
        }
        return List.of();
    }

    // === Portability ===

    private static List<Finding> bashShebang(ShellNode node, ShellAnalysisContext context) {
        if (node instanceof ShellStatement.Comment comment && comment.isShebang()) {
            var interpreter = shebangInterpreter(comment.text());
            if (interpreter.filter(name -> name.equals("bash") || name.equals("zsh") || name.equals("ksh")).isPresent()) {
                return List.of(Finding.of(comment.span(), "Shebang requires " + interpreter.get(), "#!/bin/sh"));
            }
        }
        return List.of();
    }

    /**
     * Interpreter named by a shebang comment text (after the {@code #}), looking through {@code env}.
     */
    public static Optional<String> shebangInterpreter(String text) {
        var words = text.substring(1).strip().split("\\s+");
        if (words.length == 0 || words[0].isEmpty()) {
            return Optional.empty();
        }
        var program = basename(words[0]);
        if (!program.equals("env")) {
            return Optional.of(program);
        }
        for (int i = 1; i < words.length; i++) {
            if (!words[i].startsWith("-")) {
                return Optional.of(basename(words[i]));
            }
        }
        return Optional.empty();
    }

    private static List<Finding> extendedTest(ShellNode node, ShellAnalysisContext context) {
        if (node instanceof ShellExpression.Test test && test.extended()) {
            return List.of(Finding.of(test.span(), "[[ ]] is not POSIX", "Use [ ] with quoted operands"));
        }
        return List.of();
    }

    private static List<Finding> functionKeyword(ShellNode node, ShellAnalysisContext context) {
        if (node instanceof ShellStatement.Function function && function.keywordSyntax()) {
            return List.of(Finding.of(function.span(), "The 'function' keyword is not POSIX", function.name() + "() { ... }"));
        }
        return List.of();
    }

    private static List<Finding> echoOptions(ShellNode node, ShellAnalysisContext context) {
        if (node instanceof Command command && command.name().equals("echo") && !command.args().isEmpty()) {
            var first = ShellTrees.literalText(command.args().get(0)).orElse("");
            if (first.matches("-[neE]+") && (first.contains("e") || first.contains("n"))) {
                return List.of(Finding.of(command.span(), "echo " + first + " behaves differently across shells",
                                          "Use printf instead"));
            }
        }
        return List.of();
    }

    private static List<Finding> sourceCommand(ShellNode node, ShellAnalysisContext context) {
        if (node instanceof Command command && command.name().equals("source")) {
            return List.of(Finding.of(command.span(), "'source' is not POSIX", ". file"));
        }
        return List.of();
    }

    private static List<Finding> bashOnlyConstruct(ShellNode node, ShellAnalysisContext context) {
        return bashOnlyDescription(node).map(what -> List.of(Finding.of(node.span(), "Bash-only construct: " + what,
                                                                         "Rewrite with POSIX sh constructs")))
                                        .orElse(List.of());
    }

    private static Optional<String> bashOnlyDescription(ShellNode node) {
        if (node instanceof ShellExpression.ArrayLiteral) {
            return Optional.of("array");
        }
        if (node instanceof ShellStatement.Assignment assignment && assignment.index().isPresent()) {
            return Optional.of("array element assignment");
        }
        if (node instanceof ShellStatement.Select) {
            return Optional.of("select");
        }
        if (node instanceof ShellStatement.Coproc) {
            return Optional.of("coproc");
        }
        if (node instanceof ShellStatement.ForCStyle) {
            return Optional.of("C-style for loop");
        }
        if (node instanceof ShellStatement.ArithCommand) {
            return Optional.of("(( )) arithmetic command");
        }
        if (node instanceof Command command && BASH_BUILTINS.contains(command.name())) {
            return Optional.of(command.name());
        }
        if (node instanceof Redirect.HereString) {
            return Optional.of("here-string");
        }
        if (node instanceof Redirect.FileRedirect redirect && redirect.operator().startsWith("&>")) {
            return Optional.of(redirect.operator() + " redirect");
        }
        if (node instanceof Pipeline pipeline && pipeline.stderrJoins().contains(Boolean.TRUE)) {
            return Optional.of("|& pipe");
        }
        if (node instanceof ShellExpression.Literal literal && literal.quoting() == Quoting.ANSI_C) {
            return Optional.of("$'...' quoting");
        }
        if (node instanceof ParamExpansion expansion && BASH_EXPANSIONS.contains(expansion.operator())) {
            return Optional.of("${..." + expansion.operator().symbol() + "...} expansion");
        }
        return Optional.empty();
    }

    // === Error handling ===

    private static List<Finding> unguardedCd(ShellNode node, ShellAnalysisContext context) {
        if (node instanceof Command command && command.name().equals("cd")
            && !context.errexit() && !context.isGuarded(command.span())) {
            return List.of(Finding.of(command.span(), "cd failure is ignored and later commands run in the wrong directory",
                                      "cd DIR || exit 1"));
        }
        return List.of();
    }

    // === Helpers ===

    /**
     * Name of a plain or braced variable reference, or of a parameter expansion.
     */
    static Optional<String> variableName(ShellNode node) {
        if (node instanceof Variable variable) {
            return Optional.of(variable.name());
        }
        if (node instanceof ParamExpansion expansion) {
            return Optional.of(expansion.name());
        }
        return Optional.empty();
    }

    private static List<String> arithmeticVariables(ShellNode node) {
        if (node instanceof ShellExpression.Arithmetic arithmetic) {
            return arithmetic.expression().variables();
        }
        if (node instanceof ShellStatement.ArithCommand command) {
            return command.expression().variables();
        }
        return List.of();
    }

    /**
     * Body of a here-document whose delimiter is unquoted, so that expansions inside it run.
     */
    private static Optional<String> expandingHereDoc(ShellNode node) {
        if (node instanceof Redirect.HereDocument hereDoc && !hereDoc.quotedDelimiter()) {
            return Optional.of(hereDoc.body());
        }
        return Optional.empty();
    }

    private static List<Finding> derivedUse(ShellNode node, ShellAnalysisContext context, String rule, String fix) {
        var name = variableName(node);
        if (name.isEmpty()) {
            return List.of();
        }
        return context.taintOf(name.get())
                      .filter(taint -> taint.rule().equals(rule))
                      .map(taint -> List.of(Finding.of(node.span(),
                                                       "Variable '" + name.get() + "' is derived from " + taint.source(),
                                                       fix)))
                      .orElse(List.of());
    }

    /**
     * Entropy source that a value reads from, if any.
     */
    static Optional<ShellAnalysisContext.Taint> entropySource(ShellExpression value, ShellAnalysisContext context) {
        if (ShellTrees.referencesVariable(value, RANDOM_VARIABLES::contains)) {
            return Optional.of(new ShellAnalysisContext.Taint("DET001", "$RANDOM"));
        }
        if (ShellTrees.referencesVariable(value, CLOCK_VARIABLES::contains)
            || ShellTrees.invokesCommand(value, command -> command.name().equals("date") && !hasFixedEpoch(command))) {
            return Optional.of(new ShellAnalysisContext.Taint("DET002", "the current time"));
        }
        if (ShellTrees.referencesVariable(value, PROCESS_VARIABLES::contains)) {
            return Optional.of(new ShellAnalysisContext.Taint("DET003", "the process ID"));
        }
        var inherited = new ArrayList<ShellAnalysisContext.Taint>();
        ShellTrees.referencesVariable(value, name -> {
            context.taintOf(name).ifPresent(inherited::add);
            return false;
        });
        return inherited.stream().findFirst();
    }

    private static boolean hasFixedEpoch(Command command) {
        for (var arg : command.args()) {
            if (ShellTrees.referencesVariable(arg, "SOURCE_DATE_EPOCH"::equals)) {
                return true;
            }
            var text = ShellTrees.literalText(arg).orElse("");
            if (text.startsWith("@") || text.startsWith("--date=@") || text.equals("-r") || text.startsWith("--reference")) {
                return true;
            }
        }
        return false;
    }

    private static boolean isCommand(ShellStatement statement, String name) {
        return statement instanceof Command command && command.name().equals(name);
    }

    private static String basename(String path) {
        int slash = path.lastIndexOf('/');
        return slash >= 0 ? path.substring(slash + 1) : path;
    }
}
