package org.pragmatica.purify.tree;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Facts about the source a tree was parsed from.
 *
 * <p>The parse duration is informational only and takes no part in equality, so two parses
 * of the same text compare equal.
 */
public record SyntaxMetadata(Optional<String> sourceFile, int lineCount, Duration parseDuration) {

    public static SyntaxMetadata of(Optional<String> sourceFile, String source, Duration parseDuration) {
        return new SyntaxMetadata(sourceFile, countLines(source), parseDuration);
    }

    public static int countLines(String source) {
        if (source.isEmpty()) {
            return 0;
        }
        int lines = 1;
        for (int i = 0; i < source.length(); i++) {
            if (source.charAt(i) == '\n' && i + 1 < source.length()) {
                lines++;
            }
        }
        return lines;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof SyntaxMetadata other
               && sourceFile.equals(other.sourceFile)
               && lineCount == other.lineCount;
    }

    @Override
    public int hashCode() {
        return Objects.hash(sourceFile, lineCount);
    }
}
