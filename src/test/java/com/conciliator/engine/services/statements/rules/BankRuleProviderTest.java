package com.conciliator.engine.services.statements.rules;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.conciliator.engine.config.BankRulesProperties;
import com.fasterxml.jackson.databind.ObjectMapper;

class BankRuleProviderTest {

    private static BankRuleOverride override(String bankId, int version) {
        BankRuleOverride o = new BankRuleOverride();
        o.setBankId(bankId);
        o.setVersion(version);
        return o;
    }

    @Test
    void overrideExtendsBaseKeywordsWithoutDroppingAny() {
        BankRuleOverride inbursa = override("Inbursa", 1);
        inbursa.setCreditKeywords(List.of("Traspaso"));
        inbursa.setAliases(List.of("Banco Inbursa"));

        BankRuleProvider provider = new BankRuleProvider(List.of(inbursa));
        RuleSet rules = provider.resolve("inbursa");

        assertTrue(rules.getCreditKeywords().contains("traspaso"));
        assertTrue(rules.getCreditKeywords().containsAll(RuleSet.BASE_CREDIT_KEYWORDS));
        assertTrue(rules.getDebitKeywords().containsAll(RuleSet.BASE_DEBIT_KEYWORDS));
        assertTrue(rules.getSkipKeywords().containsAll(RuleSet.BASE_SKIP_KEYWORDS));
        assertEquals("inbursa", rules.getBankId());
        assertEquals("inbursa", provider.resolve("BANCO INBURSA").getBankId());
    }

    @Test
    void resolvingNeverMutatesTheBaseRuleSet() {
        BankRuleOverride inbursa = override("inbursa", 1);
        inbursa.setCreditKeywords(List.of("traspaso"));
        inbursa.setMergeMultilineConcepts(true);
        BankRuleProvider provider = new BankRuleProvider(List.of(inbursa));

        RuleSet first = provider.resolve("inbursa");
        RuleSet second = provider.resolve("inbursa");

        assertNotSame(first, second);
        assertFalse(RuleSet.base().getCreditKeywords().contains("traspaso"));
        assertFalse(RuleSet.base().isMergeMultilineConcepts());
        assertTrue(first.isMergeMultilineConcepts());
    }

    @Test
    void unknownBankGetsBaseRules() {
        BankRuleProvider provider = new BankRuleProvider(List.of(override("bbva", 1)));

        RuleSet rules = provider.resolve("banco inventado");

        assertTrue(rules.isBase());
        assertEquals(RuleSet.base().getCreditKeywords(), rules.getCreditKeywords());
        assertTrue(provider.resolve(null).isBase());
    }

    @Test
    void invalidOrIncompletePatternsAreSkipped() {
        BankRuleOverride santander = override("santander", 1);
        santander.setCustomLinePatterns(List.of(
                "(?<description>[",
                "^(?<description>.+)\\s+(?<amount>\\d+\\.\\d{2})$",
                "^(?<date>\\d{2}/\\d{2}/\\d{4})\\s+(?<description>.+?)\\s+(?<amount>[\\d,]+\\.\\d{2})$"));
        santander.setAmountPatterns(List.of("[0-9", "\\d+\\.\\d{2}"));

        RuleSet rules = new BankRuleProvider(List.of(santander)).resolve("santander");

        assertEquals(1, rules.getCustomLinePatterns().size());
        assertEquals(RuleSet.base().getAmountPatterns().size() + 1, rules.getAmountPatterns().size());
    }

    @Test
    void higherVersionWinsForTheSameBank() {
        BankRuleOverride v1 = override("banorte", 1);
        v1.setPreferFirstAmount(false);
        BankRuleOverride v2 = override("banorte", 2);
        v2.setPreferFirstAmount(true);

        RuleSet rules = new BankRuleProvider(List.of(v2, v1)).resolve("banorte");

        assertEquals(2, rules.getVersion());
        assertTrue(rules.isPreferFirstAmount());
    }

    @Test
    void loadsShippedRuleFilesFromClasspath() {
        BankRulesProperties properties = new BankRulesProperties();

        BankRuleProvider provider = new BankRuleProvider(new ObjectMapper(), properties);

        assertTrue(provider.knownKeys().containsAll(List.of("bbva", "inbursa", "santander", "banamex", "banorte", "amex")));
        RuleSet inbursa = provider.resolve("inbursa");
        assertTrue(inbursa.isHasRunningBalanceColumn());
        assertFalse(inbursa.getCustomLinePatterns().isEmpty());
    }
}
