package org.pragmatica.purify.analysis;

import org.pragmatica.purify.shell.Redirect;
import org.pragmatica.purify.shell.ShellExpression;
import org.pragmatica.purify.shell.ShellNode;
import org.pragmatica.purify.shell.ShellScript;
import org.pragmatica.purify.shell.ShellStatement;
import org.pragmatica.purify.shell.ShellTrees;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the shell rule catalog over a script in one read-only walk.
 *
 * <p>Issues come out in walk order (parents before children, source order among siblings),
 * and in catalog order for issues found on the same node.
 */
public final class ShellAnalyzer {
    private static final Logger log = LoggerFactory.getLogger(ShellAnalyzer.class);

    private ShellAnalyzer() {}

    public static List<SemanticIssue> analyze(ShellScript script) {
        return analyze(script, AnalysisOptions.DEFAULT);
    }

    public static List<SemanticIssue> analyze(ShellScript script, AnalysisOptions options) {
        long started = System.nanoTime();
        var rules = ShellRules.CATALOG.stream()
                                      .filter(rule -> options.isEnabled(rule.category()))
                                      .toList();
        var context = new ShellAnalysisContext(options, enablesErrexit(script));
        var issues = new ArrayList<SemanticIssue>();

        ShellTrees.walk(script.statements(), new ShellTrees.Visitor() {
            @Override
            public void statement(ShellStatement statement) {
                recordGuards(statement, context);
                check(statement);
                if (statement instanceof ShellStatement.Assignment assignment) {
                    context.assign(assignment.name(), ShellRules.entropySource(assignment.value(), context));
                }
            }

            @Override
            public void expression(ShellExpression expression) {
                check(expression);
            }

            @Override
            public void redirect(Redirect redirect) {
                check(redirect);
            }

            @Override
            public void enterBlock() {
                context.enterBlock();
            }

            @Override
            public void exitBlock() {
                context.exitBlock();
            }

            private void check(ShellNode node) {
                for (var rule : rules) {
                    issues.addAll(rule.check(node, context));
                }
            }
        });

        if (options.typeCheck() && options.isEnabled(IssueCategory.ERROR_HANDLING)) {
            issues.addAll(TypeChecker.check(script));
        }
        log.debug("Shell analysis found {} issues in {} us", issues.size(), (System.nanoTime() - started) / 1000);
        return List.copyOf(issues);
    }

    /**
     * Commands whose failure is handled by the surrounding list or condition.
     */
    private static void recordGuards(ShellStatement statement, ShellAnalysisContext context) {
        if (statement instanceof ShellStatement.OrList orList) {
            guardLeftmost(orList.left(), context);
        } else if (statement instanceof ShellStatement.AndList andList) {
            guardLeftmost(andList.left(), context);
        } else if (statement instanceof ShellStatement.If ifStatement) {
            guardCondition(ifStatement.condition(), context);
            ifStatement.elifs().forEach(elif -> guardCondition(elif.condition(), context));
        } else if (statement instanceof ShellStatement.While loop) {
            guardCondition(loop.condition(), context);
        } else if (statement instanceof ShellStatement.Until loop) {
            guardCondition(loop.condition(), context);
        }
    }

    private static void guardCondition(ShellExpression condition, ShellAnalysisContext context) {
        if (condition instanceof ShellExpression.CommandCondition commandCondition) {
            guardLeftmost(commandCondition.statement(), context);
        }
    }

    private static void guardLeftmost(ShellStatement statement, ShellAnalysisContext context) {
        if (statement instanceof ShellStatement.AndList andList) {
            guardLeftmost(andList.left(), context);
        } else if (statement instanceof ShellStatement.OrList orList) {
            guardLeftmost(orList.left(), context);
        } else if (statement instanceof ShellStatement.Negated negated) {
            guardLeftmost(negated.statement(), context);
        } else {
            context.guard(statement.span());
        }
    }

    static boolean enablesErrexit(ShellScript script) {
        var shebangErrexit = script.shebang()
                                   .map(comment -> List.of(comment.text().split("\\s+")).contains("-e"))
                                   .orElse(false);
        if (shebangErrexit) {
            return true;
        }
        var found = new boolean[1];
        ShellTrees.walk(script.statements(), new ShellTrees.Visitor() {
            @Override
            public void statement(ShellStatement statement) {
                if (statement instanceof ShellStatement.Command command && command.name().equals("set")
                    && (ShellTrees.hasFlag(command, 'e') || ShellTrees.argumentTexts(command).contains("errexit"))) {
                    found[0] = true;
                }
            }
        });
        return found[0];
    }
}
