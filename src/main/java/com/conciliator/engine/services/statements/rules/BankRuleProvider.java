package com.conciliator.engine.services.statements.rules;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.core.io.support.ResourcePatternResolver;
import org.springframework.stereotype.Component;

import com.conciliator.engine.config.BankRulesProperties;
import com.conciliator.engine.services.statements.util.TextNormalizer;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.extern.slf4j.Slf4j;

/**
 * Resolves the {@link RuleSet} for a bank: the immutable base extended with the bank's override.
 * Overrides are loaded once; every {@link #resolve(String)} call builds a new RuleSet.
 */
@Slf4j
@Component
public class BankRuleProvider {

    private record CompiledOverride(
            BankRuleOverride source,
            List<Pattern> amountPatterns,
            List<LinePattern> linePatterns
    ) {
    }

    private final Map<String, CompiledOverride> overridesByKey;

    @Autowired
    public BankRuleProvider(ObjectMapper objectMapper, BankRulesProperties properties) {
        this(properties.isOverridesEnabled()
                ? loadOverrides(objectMapper, properties.getLocation())
                : List.of());
    }

    public BankRuleProvider(Collection<BankRuleOverride> overrides) {
        Map<String, CompiledOverride> byKey = new LinkedHashMap<>();
        for (BankRuleOverride override : overrides) {
            if (override == null || override.getBankId() == null || override.getBankId().isBlank()) {
                log.warn("[BankRuleProvider] Ignoring override without bankId");
                continue;
            }
            CompiledOverride compiled = compile(override);
            register(byKey, override.getBankId(), compiled);
            if (override.getAliases() != null) {
                for (String alias : override.getAliases()) {
                    register(byKey, alias, compiled);
                }
            }
        }
        this.overridesByKey = Map.copyOf(byKey);
        log.info("[BankRuleProvider] {} bank override keys registered", overridesByKey.size());
    }

    /**
     * Base rules extended with the override registered for {@code bankId}. Unknown or null ids yield the base.
     */
    public RuleSet resolve(String bankId) {
        RuleSet base = RuleSet.base();
        String key = TextNormalizer.normalize(bankId);
        CompiledOverride override = key.isEmpty() ? null : overridesByKey.get(key);
        if (override == null) {
            log.debug("[BankRuleProvider] No override for '{}', using base rules", bankId);
            return base.toBuilder().build();
        }

        BankRuleOverride src = override.source();
        RuleSet.RuleSetBuilder builder = base.toBuilder()
                .bankId(TextNormalizer.normalize(src.getBankId()))
                .version(src.getVersion())
                .creditKeywords(normalizedKeywords(src.getCreditKeywords()))
                .debitKeywords(normalizedKeywords(src.getDebitKeywords()))
                .skipKeywords(normalizedKeywords(src.getSkipKeywords()))
                .amountPatterns(override.amountPatterns())
                .customLinePatterns(override.linePatterns());

        if (src.getPreferFirstAmount() != null) builder.preferFirstAmount(src.getPreferFirstAmount());
        if (src.getHasRunningBalanceColumn() != null) builder.hasRunningBalanceColumn(src.getHasRunningBalanceColumn());
        if (src.getMergeMultilineConcepts() != null) builder.mergeMultilineConcepts(src.getMergeMultilineConcepts());

        RuleSet resolved = builder.build();
        log.debug("[BankRuleProvider] Resolved rules for '{}' v{}: credit={}, debit={}, skip={}, linePatterns={}",
                resolved.getBankId(), resolved.getVersion(), resolved.getCreditKeywords().size(),
                resolved.getDebitKeywords().size(), resolved.getSkipKeywords().size(),
                resolved.getCustomLinePatterns().size());
        return resolved;
    }

    public Set<String> knownKeys() {
        return overridesByKey.keySet();
    }

    private static void register(Map<String, CompiledOverride> byKey, String key, CompiledOverride compiled) {
        String normalized = TextNormalizer.normalize(key);
        if (normalized.isEmpty()) return;
        CompiledOverride previous = byKey.get(normalized);
        if (previous != null && previous.source().getVersion() > compiled.source().getVersion()) {
            log.warn("[BankRuleProvider] Keeping v{} for '{}', ignoring older v{}",
                    previous.source().getVersion(), normalized, compiled.source().getVersion());
            return;
        }
        byKey.put(normalized, compiled);
    }

    private static CompiledOverride compile(BankRuleOverride override) {
        List<Pattern> amountPatterns = new ArrayList<>();
        for (String regex : nullToEmpty(override.getAmountPatterns())) {
            try {
                amountPatterns.add(Pattern.compile(regex));
            } catch (PatternSyntaxException e) {
                log.warn("[BankRuleProvider] Invalid amount pattern for {}: '{}' ({})",
                        override.getBankId(), regex, e.getDescription());
            }
        }

        List<LinePattern> linePatterns = new ArrayList<>();
        for (String regex : nullToEmpty(override.getCustomLinePatterns())) {
            try {
                LinePattern pattern = LinePattern.compile(regex);
                if (pattern.isUsable()) {
                    linePatterns.add(pattern);
                } else {
                    log.warn("[BankRuleProvider] Line pattern for {} lacks date/description/amount groups: '{}'",
                            override.getBankId(), regex);
                }
            } catch (PatternSyntaxException e) {
                log.warn("[BankRuleProvider] Invalid line pattern for {}: '{}' ({})",
                        override.getBankId(), regex, e.getDescription());
            }
        }
        return new CompiledOverride(override, List.copyOf(amountPatterns), List.copyOf(linePatterns));
    }

    private static List<String> normalizedKeywords(List<String> keywords) {
        List<String> out = new ArrayList<>();
        for (String keyword : nullToEmpty(keywords)) {
            String normalized = TextNormalizer.normalize(keyword);
            if (!normalized.isEmpty()) {
                out.add(normalized);
            }
        }
        return out;
    }

    private static List<String> nullToEmpty(List<String> values) {
        return values == null ? List.of() : values;
    }

    static List<BankRuleOverride> loadOverrides(ObjectMapper objectMapper, String location) {
        List<BankRuleOverride> out = new ArrayList<>();
        ResourcePatternResolver resolver = new PathMatchingResourcePatternResolver();
        Resource[] resources;
        try {
            resources = resolver.getResources(location);
        } catch (IOException e) {
            log.warn("[BankRuleProvider] Could not list bank rules at {}: {}", location, e.getMessage());
            return out;
        }

        for (Resource resource : resources) {
            try (InputStream in = resource.getInputStream()) {
                BankRuleOverride override = objectMapper.readValue(in, BankRuleOverride.class);
                out.add(override);
                log.info("[BankRuleProvider] Loaded {} v{} from {}",
                        override.getBankId(), override.getVersion(), resource.getFilename());
            } catch (IOException e) {
                log.warn("[BankRuleProvider] Skipping unreadable rule file {}: {}", resource.getFilename(), e.getMessage());
            }
        }
        return out;
    }
}
