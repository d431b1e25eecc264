package org.pragmatica.purify.analysis;

import org.pragmatica.purify.shell.Redirect;
import org.pragmatica.purify.shell.ShellRenderer;
import org.pragmatica.purify.shell.ShellScript;
import org.pragmatica.purify.shell.ShellStatement;
import org.pragmatica.purify.shell.ShellTrees;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Lists the commands of a script that change system state.
 */
public final class SideEffectTracker {
    private static final Map<String, String> STATE_CHANGING = Map.ofEntries(
        Map.entry("mkdir", "creates directory"),
        Map.entry("rmdir", "removes directory"),
        Map.entry("rm", "removes files"),
        Map.entry("cp", "copies files"),
        Map.entry("mv", "moves files"),
        Map.entry("ln", "creates link"),
        Map.entry("touch", "updates file timestamps"),
        Map.entry("chmod", "changes permissions"),
        Map.entry("chown", "changes ownership"),
        Map.entry("install", "installs files"),
        Map.entry("tee", "writes files"),
        Map.entry("dd", "writes data"),
        Map.entry("useradd", "creates user"),
        Map.entry("groupadd", "creates group"),
        Map.entry("apt-get", "manages packages"),
        Map.entry("apk", "manages packages"),
        Map.entry("yum", "manages packages"),
        Map.entry("dnf", "manages packages"),
        Map.entry("systemctl", "changes services"));

    private SideEffectTracker() {}

    /**
     * One line per state-changing command or file write: {@code line N: text (effect)}.
     */
    public static List<String> collect(ShellScript script) {
        var effects = new ArrayList<String>();
        ShellTrees.walk(script.statements(), new ShellTrees.Visitor() {
            @Override
            public void statement(ShellStatement statement) {
                if (statement instanceof ShellStatement.Command command && STATE_CHANGING.containsKey(command.name())) {
                    effects.add("line " + command.span().start().line() + ": " + firstLine(ShellRenderer.renderStatement(command))
                                + " (" + STATE_CHANGING.get(command.name()) + ")");
                }
            }

            @Override
            public void redirect(Redirect redirect) {
                if (redirect instanceof Redirect.FileRedirect file && file.operator().contains(">")) {
                    var target = ShellRenderer.renderExpression(file.target());
                    if (!target.startsWith("/dev/")) {
                        effects.add("line " + file.span().start().line() + ": " + file.operator() + " " + target
                                    + " (" + (file.isAppend() ? "appends to file" : "writes file") + ")");
                    }
                }
            }
        });
        return List.copyOf(effects);
    }

    private static String firstLine(String text) {
        var stripped = text.strip();
        int newline = stripped.indexOf('\n');
        return newline < 0 ? stripped : stripped.substring(0, newline);
    }
}
