package com.conciliator.engine.enums;

public enum AccountType {
    CREDIT_CARD,
    DEBIT_CARD,
    CHECKING,
    SAVINGS
}
