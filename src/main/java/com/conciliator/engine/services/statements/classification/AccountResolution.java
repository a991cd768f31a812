package com.conciliator.engine.services.statements.classification;

import com.conciliator.engine.enums.AccountType;
import com.conciliator.engine.enums.ClassificationSource;
import com.conciliator.engine.services.statements.model.AccountProfileUpdate;

/**
 * Bank and account type the engine will work with for one statement.
 *
 * @param bankId key used for rule resolution, null when the bank is unknown
 * @param profileUpdate suggested correction of the stored profile, null when none
 */
public record AccountResolution(
        String bankId,
        String bankName,
        AccountType accountType,
        double confidence,
        ClassificationSource source,
        AccountProfileUpdate profileUpdate
) {
    public boolean msiEnabled() {
        return accountType == AccountType.CREDIT_CARD;
    }
}
