package com.conciliator.engine.enums;

public enum ClassificationSource {
    /** Value supplied by the caller as already known for the account. */
    KNOWN,
    /** Value taken from the injected advisory classification. */
    ADVISORY,
    /** Value derived from keyword heuristics over the statement text. */
    HEURISTIC
}
