package com.conciliator.engine.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import lombok.Data;

@Data
@ConfigurationProperties(prefix = "conciliator.rules")
public class BankRulesProperties {

    /**
     * Resource pattern of the bank override files.
     */
    private String location = "classpath*:bank-rules/*.json";

    /**
     * Skip loading overrides entirely (base rules only).
     */
    private boolean overridesEnabled = true;
}
