package org.pragmatica.purify.analysis;

import org.pragmatica.purify.error.Diagnostic;

public enum IssueSeverity {
    CRITICAL,
    HIGH,
    MEDIUM,
    LOW;

    public Diagnostic.Severity toDiagnosticSeverity() {
        return switch (this) {
            case CRITICAL -> Diagnostic.Severity.ERROR;
            case HIGH, MEDIUM -> Diagnostic.Severity.WARNING;
            case LOW -> Diagnostic.Severity.INFO;
        };
    }
}
