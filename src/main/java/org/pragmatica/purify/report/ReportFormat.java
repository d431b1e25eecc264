package org.pragmatica.purify.report;

/**
 * Output formats of {@link ReportFormatter}.
 */
public enum ReportFormat {
    TEXT,
    JSON,
    MARKDOWN
}
