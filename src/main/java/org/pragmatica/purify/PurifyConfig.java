package org.pragmatica.purify;

import org.pragmatica.purify.analysis.AnalysisOptions;
import org.pragmatica.purify.analysis.IssueCategory;
import org.pragmatica.purify.format.FormatOptions;
import org.pragmatica.purify.transform.PlanOptions;

import java.util.EnumSet;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Purification configuration options.
 */
public record PurifyConfig(
    boolean strictIdempotency,
    boolean removeNonDeterministic,
    boolean trackSideEffects,
    boolean typeCheck,
    boolean emitGuards,
    boolean preserveFormatting,
    OptionalInt maxLineLength,
    boolean skipBlankLineRemoval,
    boolean skipConsolidation,
    Set<IssueCategory> enabledCategories
) {
    public static final PurifyConfig DEFAULT = new PurifyConfig(
        true,
        true,
        true,
        false,
        false,
        false,
        OptionalInt.empty(),
        false,
        false,
        EnumSet.allOf(IssueCategory.class)
    );

    public PurifyConfig {
        enabledCategories = Set.copyOf(enabledCategories);
    }

    public FormatOptions formatOptions() {
        return new FormatOptions(preserveFormatting, maxLineLength, skipBlankLineRemoval, skipConsolidation);
    }

    public AnalysisOptions analysisOptions() {
        return new AnalysisOptions(strictIdempotency, typeCheck, enabledCategories);
    }

    /**
     * Guards need the declared types, so they are only planned together with type checking.
     */
    public PlanOptions planOptions() {
        return new PlanOptions(removeNonDeterministic, emitGuards && typeCheck);
    }
}
