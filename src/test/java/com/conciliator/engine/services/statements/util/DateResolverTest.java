package com.conciliator.engine.services.statements.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.LocalDate;
import java.util.List;

import org.junit.jupiter.api.Test;

class DateResolverTest {

    private static final YearContext YEAR_2024 = YearContext.ofYear(2024);

    @Test
    void numericFormats() {
        assertEquals(LocalDate.of(2024, 12, 5), DateResolver.parse("05/12/2024", YearContext.none()));
        assertEquals(LocalDate.of(2024, 12, 5), DateResolver.parse("2024-12-05", YearContext.none()));
        assertEquals(LocalDate.of(2024, 12, 5), DateResolver.parse("05/12/24", YearContext.none()));
    }

    @Test
    void spanishMonthForms() {
        assertEquals(LocalDate.of(2024, 12, 5), DateResolver.parse("DIC 05", YEAR_2024));
        assertEquals(LocalDate.of(2024, 12, 5), DateResolver.parse("DIC. 05", YEAR_2024));
        assertEquals(LocalDate.of(2024, 12, 5), DateResolver.parse("05-DIC-2024", YearContext.none()));
        assertEquals(LocalDate.of(2024, 12, 5), DateResolver.parse("5 de diciembre de 2024", YearContext.none()));
        assertEquals(LocalDate.of(2024, 11, 15), DateResolver.parse("15 de noviembre", YEAR_2024));
    }

    @Test
    void englishMonthForms() {
        assertEquals(LocalDate.of(2024, 12, 5), DateResolver.parse("Dec 5, 2024", YearContext.none()));
        assertEquals(LocalDate.of(2024, 1, 9), DateResolver.parse("JAN 09", YEAR_2024));
    }

    @Test
    void periodCrossingYearAssignsMonthsToTheRightYear() {
        YearContext years = new YearContext(null, LocalDate.of(2024, 12, 15), LocalDate.of(2025, 1, 14));

        assertEquals(LocalDate.of(2024, 12, 20), DateResolver.fromMonthDay("DIC", "20", years));
        assertEquals(LocalDate.of(2025, 1, 5), DateResolver.fromMonthDay("ENE", "05", years));
    }

    @Test
    void impossibleDatesAreIgnored() {
        assertNull(DateResolver.parse("31/02/2024", YearContext.none()));
        assertNull(DateResolver.fromMonthDay("FEB", "30", YEAR_2024));
        assertNull(DateResolver.parse("sin fecha", YEAR_2024));
    }

    @Test
    void findFirstReportsEarliestTokenWithSpan() {
        String line = "COMPRA 12/11/2024 APLICADA 15/11/2024";

        DateResolver.DateMatch match = DateResolver.findFirst(line, YearContext.none()).orElseThrow();

        assertEquals(LocalDate.of(2024, 11, 12), match.date());
        assertEquals("12/11/2024", line.substring(match.start(), match.end()));
        assertEquals(List.of(LocalDate.of(2024, 11, 12), LocalDate.of(2024, 11, 15)),
                DateResolver.findAll(line, YearContext.none()));
    }

    @Test
    void monthTokens() {
        assertEquals(Integer.valueOf(12), DateResolver.monthNumber("dic."));
        assertEquals(Integer.valueOf(9), DateResolver.monthNumber("Septiembre"));
        assertNull(DateResolver.monthNumber("XYZ"));
        assertTrue(DateResolver.containsMonthToken("ENE 05 DEPOSITO"));
        assertFalse(DateResolver.containsMonthToken("DEPOSITO EN EFECTIVO"));
    }
}
