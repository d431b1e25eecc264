package org.pragmatica.purify.transform;

/**
 * Switches read by the {@link TransformationPlanner}.
 *
 * @param removeNonDeterministic plan ordering rewrites as safe transformations instead of advisories
 * @param emitGuards             insert runtime checks after assignments to typed variables
 */
public record PlanOptions(boolean removeNonDeterministic, boolean emitGuards) {

    public static final PlanOptions DEFAULT = new PlanOptions(true, false);
}
