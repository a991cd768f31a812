package com.conciliator.engine.enums;

/**
 * Outcome of the opening + credits - debits = closing check.
 * UNVERIFIED means one of the balances could not be derived, so no check was made.
 */
public enum ReconciliationStatus {
    OK,
    MISMATCH,
    UNVERIFIED
}
