package com.conciliator.engine.services.statements.model;

import com.conciliator.engine.enums.AccountType;

/**
 * Bank/account classification produced outside the engine (e.g. by an AI classifier) and injected by the caller.
 */
public record AdvisoryClassification(String bankName, AccountType accountType, double confidence) {
}
