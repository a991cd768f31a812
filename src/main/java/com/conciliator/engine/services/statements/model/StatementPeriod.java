package com.conciliator.engine.services.statements.model;

import java.time.LocalDate;

public record StatementPeriod(LocalDate start, LocalDate end) {

    public boolean contains(LocalDate date) {
        if (date == null) return false;
        if (start != null && date.isBefore(start)) return false;
        return end == null || !date.isAfter(end);
    }
}
