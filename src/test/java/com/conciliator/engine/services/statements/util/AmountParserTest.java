package com.conciliator.engine.services.statements.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import java.math.BigDecimal;

import org.junit.jupiter.api.Test;

class AmountParserTest {

    @Test
    void parsesMexicanFormatWithCurrencySign() {
        assertEquals(new BigDecimal("1234.56"), AmountParser.parse("1,234.56"));
        assertEquals(new BigDecimal("1234.56"), AmountParser.parse("$ 1,234.56"));
        assertEquals(new BigDecimal("12.50"), AmountParser.parse("MXN 12.5"));
    }

    @Test
    void negativeForms() {
        assertEquals(new BigDecimal("-350.00"), AmountParser.parse("-350.00"));
        assertEquals(new BigDecimal("-350.00"), AmountParser.parse("350.00-"));
        assertEquals(new BigDecimal("-350.00"), AmountParser.parse("(350.00)"));
    }

    @Test
    void europeanAndThousandsOnlyFormats() {
        assertEquals(new BigDecimal("1234.56"), AmountParser.parse("1.234,56"));
        assertEquals(new BigDecimal("1234567.00"), AmountParser.parse("1.234.567"));
        assertEquals(new BigDecimal("12.50"), AmountParser.parse("12,5"));
    }

    @Test
    void unreadableTokensReturnNull() {
        assertNull(AmountParser.parse(null));
        assertNull(AmountParser.parse(""));
        assertNull(AmountParser.parse("abc"));
        assertNull(AmountParser.parse("$"));
    }
}
