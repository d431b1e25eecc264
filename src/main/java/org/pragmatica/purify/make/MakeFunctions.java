package org.pragmatica.purify.make;

import java.util.ArrayList;
import java.util.List;

/**
 * Locates GNU make function calls such as {@code $(wildcard *.c)} inside variable values and
 * recipe text. Closing delimiters are found by depth tracking so nested calls stay intact.
 */
public final class MakeFunctions {
    private MakeFunctions() {}

    /**
     * A call occupying {@code text.substring(start, end)}; {@code sorted} is set when the call is
     * the direct argument of {@code $(sort ...)}.
     */
    public record Call(String function, int start, int end, boolean sorted) {
        public String text(String source) {
            return source.substring(start, end);
        }
    }

    /**
     * Calls of {@code function} in source order. For {@code shell} the call only matches when its
     * command is {@code command}; pass an empty command to match any call of the function.
     */
    public static List<Call> calls(String text, String function, String command) {
        var result = new ArrayList<Call>();
        int from = 0;
        while (from < text.length()) {
            int start = findOpening(text, function, command, from);
            if (start < 0) {
                break;
            }
            int end = closingIndex(text, start + 1);
            if (end < 0) {
                break;
            }
            result.add(new Call(function, start, end + 1, isSortArgument(text, start, end + 1)));
            from = end + 1;
        }
        return result;
    }

    public static List<Call> calls(String text, String function) {
        return calls(text, function, "");
    }

    public static List<Call> unsortedCalls(String text, String function, String command) {
        return calls(text, function, command).stream()
                                             .filter(call -> !call.sorted())
                                             .toList();
    }

    /**
     * Index of the delimiter that closes the one at {@code open}, or -1 when unbalanced.
     */
    public static int closingIndex(String text, int open) {
        char opener = text.charAt(open);
        char closer = opener == '{' ? '}' : ')';
        int depth = 0;
        for (int i = open; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == opener) {
                depth++;
            } else if (c == closer) {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    private static int findOpening(String text, String function, String command, int from) {
        for (int i = from; i + 2 < text.length(); i++) {
            if (text.charAt(i) != '$' || (text.charAt(i + 1) != '(' && text.charAt(i + 1) != '{')) {
                continue;
            }
            if (i > 0 && text.charAt(i - 1) == '$') {
                continue;
            }
            int nameEnd = i + 2 + function.length();
            if (!text.startsWith(function, i + 2) || nameEnd >= text.length() || !Character.isWhitespace(text.charAt(nameEnd))) {
                continue;
            }
            if (command.isEmpty() || startsWithWord(text, skipBlanks(text, nameEnd), command)) {
                return i;
            }
        }
        return -1;
    }

    private static boolean isSortArgument(String text, int start, int end) {
        var before = text.substring(0, start).stripTrailing();
        if (!before.endsWith("$(sort") && !before.endsWith("${sort")) {
            return false;
        }
        int open = before.length() - "(sort".length();
        int close = closingIndex(text, open);
        return close >= end && text.substring(end, close).isBlank();
    }

    private static int skipBlanks(String text, int from) {
        int i = from;
        while (i < text.length() && Character.isWhitespace(text.charAt(i))) {
            i++;
        }
        return i;
    }

    private static boolean startsWithWord(String text, int at, String word) {
        if (!text.startsWith(word, at)) {
            return false;
        }
        int end = at + word.length();
        return end == text.length() || !Character.isLetterOrDigit(text.charAt(end)) && text.charAt(end) != '_';
    }
}
