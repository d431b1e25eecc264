package org.pragmatica.purify;

import java.util.Locale;

/**
 * Input languages the purifier understands.
 */
public enum Dialect {
    SHELL("Shell Script"),
    MAKEFILE("Makefile"),
    DOCKERFILE("Dockerfile");

    private final String displayName;

    Dialect(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * Dialect suggested by a file name; anything unrecognized is treated as a shell script.
     */
    public static Dialect forFileName(String fileName) {
        var name = fileName.substring(fileName.lastIndexOf('/') + 1);
        var lower = name.toLowerCase(Locale.ROOT);
        if (lower.equals("makefile") || lower.equals("gnumakefile") || lower.endsWith(".mk")) {
            return MAKEFILE;
        }
        if (lower.equals("dockerfile") || lower.startsWith("dockerfile.") || lower.endsWith(".dockerfile")) {
            return DOCKERFILE;
        }
        return SHELL;
    }
}
