package com.conciliator.engine.enums;

/**
 * Problems detected while processing a statement.
 * Only EXTRACTION_EMPTY and ALL_STRATEGIES_FAILED stop a statement from being produced.
 */
public enum StatementIssue {
    EXTRACTION_EMPTY,
    ALL_STRATEGIES_FAILED,
    PARTIAL_QUALITY,
    RECONCILIATION_MISMATCH,
    AMBIGUOUS_MSI_MATCH
}
