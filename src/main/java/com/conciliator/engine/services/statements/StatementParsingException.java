package com.conciliator.engine.services.statements;

import com.conciliator.engine.enums.StatementIssue;
import com.conciliator.engine.services.statements.model.ParseDiagnostics;

/**
 * Thrown when no statement can be produced: the text is empty or every strategy failed.
 * Carries the diagnostics gathered so far for manual review.
 */
public class StatementParsingException extends IllegalArgumentException {

    private final StatementIssue issue;
    private final transient ParseDiagnostics diagnostics;

    public StatementParsingException(StatementIssue issue, String message, ParseDiagnostics diagnostics) {
        super(message);
        this.issue = issue;
        this.diagnostics = diagnostics;
    }

    public StatementIssue getIssue() {
        return issue;
    }

    public ParseDiagnostics getDiagnostics() {
        return diagnostics;
    }
}
