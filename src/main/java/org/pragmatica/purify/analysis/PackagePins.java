package org.pragmatica.purify.analysis;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Finds package installs without a version pin in recipe and {@code RUN} command text.
 * Understands {@code apt-get}/{@code apt install} ({@code pkg=version}), {@code apk add}
 * ({@code pkg=version}), {@code pip install} ({@code pkg==version}) and {@code npm install}
 * ({@code pkg@version}).
 */
public final class PackagePins {
    private PackagePins() {}

    private static final Set<String> SEPARATORS = Set.of("&&", "||", ";", "|");

    public record UnpinnedPackage(String manager, String name) {
        public String suggestion() {
            return switch (manager) {
                case "pip" -> name + "==<version>";
                case "npm" -> name + "@<version>";
                default -> name + "=<version>";
            };
        }
    }

    public static List<UnpinnedPackage> unpinned(String commandText) {
        var words = List.of(commandText.replace(";", " ; ").strip().split("\\s+"));
        var result = new ArrayList<UnpinnedPackage>();
        int i = 0;
        while (i < words.size()) {
            var manager = installer(words, i);
            if (manager.isEmpty()) {
                i++;
                continue;
            }
            i = skipToPackages(words, i);
            while (i < words.size() && !SEPARATORS.contains(words.get(i))) {
                var word = words.get(i++);
                if (!word.startsWith("-") && !word.contains("$") && !isPinned(manager, word)) {
                    result.add(new UnpinnedPackage(manager, word));
                }
            }
        }
        return result;
    }

    private static String installer(List<String> words, int at) {
        var word = words.get(at);
        var next = at + 1 < words.size() ? words.get(at + 1) : "";
        if ((word.equals("apt-get") || word.equals("apt")) && next.equals("install")) {
            return "apt";
        }
        if (word.equals("apk") && next.equals("add")) {
            return "apk";
        }
        if ((word.equals("pip") || word.equals("pip3")) && next.equals("install")) {
            return "pip";
        }
        if (word.equals("npm") && (next.equals("install") || next.equals("i"))) {
            return "npm";
        }
        return "";
    }

    // Moves past the manager, its subcommand and any option words before the package list.
    private static int skipToPackages(List<String> words, int at) {
        int i = at + 2;
        while (i < words.size() && words.get(i).startsWith("-") && !SEPARATORS.contains(words.get(i))) {
            i++;
        }
        return i;
    }

    private static boolean isPinned(String manager, String word) {
        return switch (manager) {
            case "pip" -> word.contains("==") || word.startsWith("-r") || word.endsWith(".txt") || word.endsWith(".whl");
            case "npm" -> word.lastIndexOf('@') > 0 || word.startsWith(".") || word.startsWith("/");
            default -> word.contains("=") || word.endsWith(".deb") || word.endsWith(".apk");
        };
    }
}
