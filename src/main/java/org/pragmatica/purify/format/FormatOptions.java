package org.pragmatica.purify.format;

import java.util.OptionalInt;

/**
 * Layout preferences for the code generators.
 *
 * @param preserveFormatting   keep blank lines and continuation lines exactly as parsed
 * @param maxLineLength        wrap longer lines with backslash continuations
 * @param skipBlankLineRemoval keep blank lines even when not preserving formatting
 * @param skipConsolidation    keep continuation lines instead of joining them
 */
public record FormatOptions(boolean preserveFormatting,
                            OptionalInt maxLineLength,
                            boolean skipBlankLineRemoval,
                            boolean skipConsolidation) {

    public static final FormatOptions DEFAULT = new FormatOptions(false, OptionalInt.empty(), false, false);

    public FormatOptions {
        if (maxLineLength.isPresent() && maxLineLength.getAsInt() < 20) {
            throw new IllegalArgumentException("maxLineLength must be at least 20, got " + maxLineLength.getAsInt());
        }
    }

    public boolean removeBlankLines() {
        return !preserveFormatting && !skipBlankLineRemoval;
    }

    public boolean joinContinuations() {
        return !preserveFormatting && !skipConsolidation;
    }

    public FormatOptions withMaxLineLength(int length) {
        return new FormatOptions(preserveFormatting, OptionalInt.of(length), skipBlankLineRemoval, skipConsolidation);
    }
}
