package com.conciliator.engine.enums;

public enum MovementKind {
    INCOME,
    EXPENSE,
    TRANSFER
}
