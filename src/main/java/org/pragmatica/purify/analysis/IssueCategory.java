package org.pragmatica.purify.analysis;

/**
 * Rule families. Each can be switched off independently.
 */
public enum IssueCategory {
    DETERMINISM("determinism"),
    IDEMPOTENCY("idempotency"),
    SECURITY("security"),
    PORTABILITY("portability"),
    PARALLEL_SAFETY("parallel-safety"),
    PERFORMANCE("performance"),
    ERROR_HANDLING("error-handling"),
    REPRODUCIBILITY("reproducibility");

    private final String display;

    IssueCategory(String display) {
        this.display = display;
    }

    public String display() {
        return display;
    }
}
