package com.conciliator.engine.services.statements.util;

import java.time.LocalDate;

/**
 * Year information for dates printed as month + day only.
 * When the statement period crosses a year boundary (DIC - ENE), months after the period end
 * month belong to the start year.
 */
public record YearContext(Integer yearHint, LocalDate periodStart, LocalDate periodEnd) {

    public static YearContext ofYear(Integer year) {
        return new YearContext(year, null, null);
    }

    public static YearContext none() {
        return new YearContext(null, null, null);
    }

    public int yearFor(int month) {
        if (periodStart != null && periodEnd != null && periodStart.getYear() < periodEnd.getYear()) {
            return month > periodEnd.getMonthValue() ? periodStart.getYear() : periodEnd.getYear();
        }
        if (periodEnd != null) {
            return periodEnd.getYear();
        }
        if (yearHint != null) {
            return yearHint;
        }
        return LocalDate.now().getYear();
    }
}
