package org.pragmatica.purify.transform;

import org.pragmatica.purify.analysis.DockerfileRules;
import org.pragmatica.purify.analysis.IssueCategory;
import org.pragmatica.purify.analysis.MakefileRules;
import org.pragmatica.purify.analysis.SemanticIssue;
import org.pragmatica.purify.analysis.TypeChecker;
import org.pragmatica.purify.docker.BaseImage;
import org.pragmatica.purify.docker.DockerItem.Instruction;
import org.pragmatica.purify.docker.Dockerfile;
import org.pragmatica.purify.make.Makefile;
import org.pragmatica.purify.shell.ShellExpression;
import org.pragmatica.purify.shell.ShellNode;
import org.pragmatica.purify.shell.ShellRenderer;
import org.pragmatica.purify.shell.ShellScript;
import org.pragmatica.purify.shell.ShellStatement;
import org.pragmatica.purify.shell.ShellTrees;
import org.pragmatica.purify.tree.SourceSpan;
import org.pragmatica.purify.tree.SyntaxTree;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps semantic issues to transformations.
 *
 * <p>Each rule id with a structural fix has a template; the template returns empty when the
 * flagged node cannot be rewritten safely, and the issue then becomes an {@link Transformation.Advisory}
 * carrying its message and fix suggestion. Several issues with the same rule and span plan one
 * transformation.
 */
public final class TransformationPlanner {
    private static final Logger log = LoggerFactory.getLogger(TransformationPlanner.class);

    static final String TYPE_GUARD = "TYPE_GUARD";

    private TransformationPlanner() {}

    private interface Template<T> {
        Optional<Transformation> plan(SemanticIssue issue, T target);
    }

    public static List<Transformation> plan(SyntaxTree tree, List<SemanticIssue> issues, PlanOptions options) {
        if (tree instanceof ShellScript script) {
            return planShell(script, issues, options);
        }
        if (tree instanceof Makefile makefile) {
            return planMakefile(makefile, issues, options);
        }
        if (tree instanceof Dockerfile dockerfile) {
            return planDockerfile(dockerfile, issues);
        }
        throw new IllegalStateException("No planner for " + tree.getClass().getSimpleName());
    }

    // === Shell ===

    public static List<Transformation> planShell(ShellScript script, List<SemanticIssue> issues, PlanOptions options) {
        var nodes = new HashMap<SourceSpan, List<ShellNode>>();
        ShellTrees.walk(script.statements(), new ShellTrees.Visitor() {
            @Override
            public void statement(ShellStatement statement) {
                nodes.computeIfAbsent(statement.span(), span -> new ArrayList<>()).add(statement);
            }

            @Override
            public void expression(ShellExpression expression) {
                nodes.computeIfAbsent(expression.span(), span -> new ArrayList<>()).add(expression);
            }
        });
        var templates = shellTemplates(options);
        Function<SemanticIssue, List<ShellNode>> lookup = issue -> nodes.getOrDefault(issue.span(), List.of());
        var planned = planAll(issues, templates, lookup);

        // A #!/bin/sh shebang is only safe once every other portability issue is fixed.
        boolean manualPortability = planned.stream()
                                           .anyMatch(t -> !t.safe() && t.category() == IssueCategory.PORTABILITY
                                                          && !t.ruleId().equals("PORT001"));
        var result = new ArrayList<Transformation>(planned.size());
        for (var transformation : planned) {
            if (manualPortability && transformation instanceof Transformation.ReplaceShebang) {
                result.add(new Transformation.Advisory(transformation.ruleId(), transformation.category(), transformation.span(),
                                                       "Shebang kept: script still uses non-POSIX constructs",
                                                       Optional.of("#!/bin/sh after removing them"), false));
            } else {
                result.add(transformation);
            }
        }
        if (options.emitGuards()) {
            result.addAll(typeGuards(script));
        }
        return List.copyOf(result);
    }

    private static Map<String, Template<List<ShellNode>>> shellTemplates(PlanOptions options) {
        var templates = new HashMap<String, Template<List<ShellNode>>>();
        templates.put("DET006", (issue, nodes) -> options.removeNonDeterministic()
            ? Optional.of(new Transformation.PipeThroughSort(issue.rule(), issue.category(), issue.span()))
            : Optional.empty());
        templates.put("IDEM001", (issue, nodes) -> Optional.of(
            new Transformation.AddFlag(issue.rule(), issue.category(), issue.span(), "mkdir", "-p", Optional.empty())));
        templates.put("IDEM002", (issue, nodes) -> Optional.of(
            new Transformation.AddFlag(issue.rule(), issue.category(), issue.span(), "rm", "-f", Optional.empty())));
        templates.put("IDEM003", (issue, nodes) -> Optional.of(
            new Transformation.AddFlag(issue.rule(), issue.category(), issue.span(), "ln", "-f", Optional.of('s'))));
        templates.put("SEC002", (issue, nodes) -> nodes.stream()
                                                       .filter(ShellExpression.class::isInstance)
                                                       .map(ShellExpression.class::cast)
                                                       .filter(ShellRewriter::isQuotable)
                                                       .findFirst()
                                                       .map(node -> new Transformation.QuoteExpansion(issue.rule(), issue.category(),
                                                                                                      issue.span())));
        templates.put("PORT001", (issue, nodes) -> Optional.of(
            new Transformation.ReplaceShebang(issue.rule(), issue.category(), issue.span(), "/bin/sh")));
        templates.put("PORT002", (issue, nodes) -> nodes.stream()
                                                        .filter(ShellExpression.Test.class::isInstance)
                                                        .map(ShellExpression.Test.class::cast)
                                                        .filter(test -> ShellRewriter.posixTest(test.test()).isPresent())
                                                        .findFirst()
                                                        .map(test -> new Transformation.ConvertExtendedTest(issue.rule(), issue.category(),
                                                                                                            issue.span())));
        templates.put("PORT003", (issue, nodes) -> nodes.stream()
                                                        .filter(ShellStatement.Function.class::isInstance)
                                                        .map(ShellStatement.Function.class::cast)
                                                        .findFirst()
                                                        .map(function -> new Transformation.ConvertFunctionSyntax(
                                                            issue.rule(), issue.category(), issue.span(), function.name())));
        templates.put("PORT005", (issue, nodes) -> Optional.of(
            new Transformation.RenameCommand(issue.rule(), issue.category(), issue.span(), "source", ".")));
        return templates;
    }

    /**
     * One guard per assignment to an {@code int} or {@code bool} variable, unless the script
     * already carries that guard.
     */
    private static List<Transformation> typeGuards(ShellScript script) {
        var rendered = normalized(ShellRenderer.render(script));
        var guards = new ArrayList<Transformation>();
        for (var assignment : TypeChecker.typedAssignments(script)) {
            var guard = ShellRewriter.typeGuard(assignment.name(), assignment.type(), SourceSpan.at(assignment.span().end()));
            if (rendered.contains(normalized(ShellRenderer.renderStatement(guard)))) {
                continue;
            }
            guards.add(new Transformation.InsertTypeGuard(TYPE_GUARD, IssueCategory.ERROR_HANDLING, assignment.span(),
                                                          assignment.name(), assignment.type()));
        }
        return guards;
    }

    private static String normalized(String text) {
        return text.lines().map(String::strip).reduce("", (left, right) -> left + "\n" + right);
    }

    // === Makefile ===

    public static List<Transformation> planMakefile(Makefile makefile, List<SemanticIssue> issues, PlanOptions options) {
        var templates = new HashMap<String, Template<Makefile>>();
        templates.put(MakefileRules.NO_WILDCARD, (issue, tree) -> options.removeNonDeterministic()
            ? Optional.of(new Transformation.WrapWithSort(issue.rule(), issue.category(), issue.span(), "wildcard", ""))
            : Optional.empty());
        templates.put(MakefileRules.NO_UNORDERED_FIND, (issue, tree) -> options.removeNonDeterministic()
            ? Optional.of(new Transformation.WrapWithSort(issue.rule(), issue.category(), issue.span(), "shell", "find"))
            : Optional.empty());
        return planAll(issues, templates, issue -> makefile);
    }

    // === Dockerfile ===

    public static List<Transformation> planDockerfile(Dockerfile dockerfile, List<SemanticIssue> issues) {
        var instructions = new HashMap<SourceSpan, Instruction>();
        dockerfile.instructions().forEach(instruction -> instructions.put(instruction.span(), instruction));

        var templates = new HashMap<String, Template<Optional<Instruction>>>();
        templates.put(DockerfileRules.UNPINNED_IMAGE, (issue, from) -> from.flatMap(BaseImage::of).flatMap(
            image -> DockerfileRules.knownPin(image)
                                    .map(tag -> new Transformation.PinBaseImage(issue.rule(), issue.category(), issue.span(),
                                                                                image.name(), tag))));
        templates.put(DockerfileRules.ADD_LOCAL, (issue, add) -> add.filter(DockerfileRules::addsLocalFiles)
                                                                    .map(ignored -> new Transformation.ConvertAddToCopy(
                                                                        issue.rule(), issue.category(), issue.span())));
        templates.put(DockerfileRules.APT_RECOMMENDS, (issue, run) -> Optional.of(
            new Transformation.AddAptFlag(issue.rule(), issue.category(), issue.span(), DockerfileRules.NO_RECOMMENDS)));
        templates.put(DockerfileRules.PACKAGE_CLEANUP, (issue, run) -> run.flatMap(
            instruction -> DockerfileRules.cleanupFor(instruction.arguments())
                                          .map(cleanup -> new Transformation.AddPackageCleanup(issue.rule(), issue.category(),
                                                                                               issue.span(), cleanup))));
        return planAll(issues, templates, issue -> Optional.ofNullable(instructions.get(issue.span())));
    }

    // === Common ===

    private static <T> List<Transformation> planAll(List<SemanticIssue> issues,
                                                    Map<String, Template<T>> templates,
                                                    Function<SemanticIssue, T> target) {
        var seen = new HashSet<String>();
        var planned = new ArrayList<Transformation>();
        for (var issue : issues) {
            if (!seen.add(issue.rule() + "@" + issue.span())) {
                continue;
            }
            var template = templates.get(issue.rule());
            var transformation = template == null ? Optional.<Transformation>empty() : template.plan(issue, target.apply(issue));
            if (template != null && transformation.isEmpty()) {
                log.debug("No safe rewrite for {} at {}, planning advisory", issue.rule(), issue.span());
            }
            planned.add(transformation.orElseGet(() -> Transformation.Advisory.of(issue)));
        }
        log.debug("Planned {} transformations for {} issues", planned.size(), issues.size());
        return planned;
    }
}
