package org.pragmatica.purify.format;

import java.util.ArrayList;
import java.util.List;

/**
 * Backslash-continuation handling shared by the generators.
 */
public final class LineWrapper {
    private static final String CONTINUATION = " \\";

    private LineWrapper() {}

    /**
     * Joins continuation segments into one logical line. Each segment but the last is expected
     * to end with a backslash; indentation of the following segments collapses to one space.
     */
    public static String join(List<String> segments) {
        var sb = new StringBuilder();
        for (int i = 0; i < segments.size(); i++) {
            var segment = segments.get(i);
            if (i > 0) {
                segment = segment.stripLeading();
            }
            if (i < segments.size() - 1) {
                segment = stripContinuation(segment);
            }
            if (sb.length() > 0 && !segment.isEmpty()) {
                sb.append(' ');
            }
            sb.append(segment);
        }
        return sb.toString();
    }

    /**
     * Removes a trailing backslash and the blanks before it.
     */
    public static String stripContinuation(String segment) {
        var trimmed = segment.stripTrailing();
        if (trimmed.endsWith("\\")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed.stripTrailing();
    }

    /**
     * Splits a line longer than {@code maxLength} at blanks outside quotes. Every piece but the
     * last ends with a backslash continuation, and every piece but the first starts with
     * {@code indent}. A line without a usable break point is returned unchanged.
     */
    public static List<String> wrap(String line, int maxLength, String indent) {
        var pieces = new ArrayList<String>();
        var rest = line;
        var prefix = "";
        while ((prefix + rest).length() > maxLength) {
            int limit = maxLength - prefix.length() - CONTINUATION.length();
            int split = breakPoint(rest, limit);
            if (split < 0) {
                break;
            }
            pieces.add(prefix + rest.substring(0, split).stripTrailing() + CONTINUATION);
            rest = rest.substring(split).stripLeading();
            prefix = indent;
        }
        pieces.add(prefix + rest);
        return pieces;
    }

    /**
     * Last blank outside quotes at or before {@code limit}, or the first one after it when the
     * leading word is already too long; -1 when the line has no such blank.
     */
    private static int breakPoint(String text, int limit) {
        int best = -1;
        char quote = 0;
        boolean leading = true;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\\' && quote != '\'') {
                i++;
                leading = false;
                continue;
            }
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                }
                continue;
            }
            if (c == '\'' || c == '"') {
                quote = c;
                leading = false;
            } else if (c == ' ' || c == '\t') {
                if (leading) {
                    continue;
                }
                if (i > limit && best > 0) {
                    return best;
                }
                best = i;
                if (i > limit) {
                    return best;
                }
            } else {
                leading = false;
            }
        }
        return best > 0 && best < text.stripTrailing().length() ? best : -1;
    }
}
