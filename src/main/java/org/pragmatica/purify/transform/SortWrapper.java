package org.pragmatica.purify.transform;

import org.pragmatica.purify.make.MakeFunctions;

/**
 * Wraps make function calls with {@code $(sort ...)} so their word order no longer depends on
 * the file system.
 */
public final class SortWrapper {
    private SortWrapper() {}

    /**
     * Wraps every unsorted call of {@code function}; see {@link MakeFunctions#calls(String, String, String)}
     * for the meaning of {@code command}. Text without such calls is returned unchanged.
     */
    public static String wrap(String text, String function, String command) {
        var calls = MakeFunctions.unsortedCalls(text, function, command);
        var sb = new StringBuilder(text);
        for (int i = calls.size() - 1; i >= 0; i--) {
            var call = calls.get(i);
            sb.insert(call.end(), ")");
            sb.insert(call.start(), "$(sort ");
        }
        return sb.toString();
    }

    public static boolean needsWrapping(String text, String function, String command) {
        return !MakeFunctions.unsortedCalls(text, function, command).isEmpty();
    }
}
