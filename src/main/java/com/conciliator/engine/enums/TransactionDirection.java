package com.conciliator.engine.enums;

import java.math.BigDecimal;

/**
 * Direction of money relative to the account holder.
 * CREDIT amounts are never negative, DEBIT amounts are never positive.
 */
public enum TransactionDirection {
    CREDIT,
    DEBIT;

    public boolean isConsistentWith(BigDecimal amount) {
        if (amount == null) {
            return false;
        }
        return this == CREDIT ? amount.signum() >= 0 : amount.signum() <= 0;
    }
}
