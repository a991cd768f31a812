package com.conciliator.engine.services.statements.model;

import com.conciliator.engine.enums.AccountType;

/**
 * Suggested correction of the stored account profile. The engine never applies it; the caller decides.
 * A null "new" value means that attribute is not being changed.
 */
public record AccountProfileUpdate(
        String accountId,
        AccountType previousAccountType,
        AccountType newAccountType,
        String previousBankName,
        String newBankName,
        double confidence
) {
}
