package com.conciliator.engine.services.statements.rules;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Bank-specific additions read from {@code bank-rules/*.json}. Lists are appended to the base,
 * flags left null keep the base value.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class BankRuleOverride {

    private String bankId;
    private int version;
    private List<String> aliases = new ArrayList<>();

    private List<String> creditKeywords = new ArrayList<>();
    private List<String> debitKeywords = new ArrayList<>();
    private List<String> skipKeywords = new ArrayList<>();
    private List<String> amountPatterns = new ArrayList<>();
    private List<String> customLinePatterns = new ArrayList<>();

    private Boolean preferFirstAmount;
    private Boolean hasRunningBalanceColumn;
    private Boolean mergeMultilineConcepts;
}
