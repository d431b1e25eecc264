package org.pragmatica.purify.analysis;

import java.util.EnumSet;
import java.util.Set;

/**
 * Switches read by the analyzers.
 *
 * @param strictIdempotency also flag append redirects
 * @param typeCheck         run the gradual type checker over shell scripts
 * @param enabledCategories rule families to run; rules of other categories never fire
 */
public record AnalysisOptions(boolean strictIdempotency, boolean typeCheck, Set<IssueCategory> enabledCategories) {

    public static final AnalysisOptions DEFAULT = new AnalysisOptions(true, false, EnumSet.allOf(IssueCategory.class));

    public AnalysisOptions {
        enabledCategories = Set.copyOf(enabledCategories);
    }

    public boolean isEnabled(IssueCategory category) {
        return enabledCategories.contains(category);
    }
}
