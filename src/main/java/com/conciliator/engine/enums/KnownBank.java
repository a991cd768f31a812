package com.conciliator.engine.enums;

import java.util.List;
import java.util.Optional;

import com.conciliator.engine.services.statements.util.TextNormalizer;

/**
 * Banks the engine recognizes by name. The id is the key used to look up bank rule overrides.
 * Phrases are matched against normalized text (lower case, no accents).
 */
public enum KnownBank {
    BBVA("bbva", "BBVA", List.of("bbva", "bancomer")),
    SANTANDER("santander", "Santander", List.of("santander")),
    BANAMEX("banamex", "Citibanamex", List.of("citibanamex", "banamex", "banco nacional de mexico")),
    BANORTE("banorte", "Banorte", List.of("banorte")),
    HSBC("hsbc", "HSBC", List.of("hsbc")),
    SCOTIABANK("scotiabank", "Scotiabank", List.of("scotiabank", "scotia bank")),
    INBURSA("inbursa", "Inbursa", List.of("inbursa")),
    AMEX("amex", "American Express", List.of("american express", "amex")),
    BANREGIO("banregio", "Banregio", List.of("banregio")),
    BANCOPPEL("bancoppel", "BanCoppel", List.of("bancoppel")),
    AZTECA("azteca", "Banco Azteca", List.of("banco azteca")),
    AFIRME("afirme", "Afirme", List.of("afirme")),
    BANBAJIO("banbajio", "BanBajio", List.of("banbajio", "banco del bajio")),
    NU("nu", "Nu Mexico", List.of("nu mexico", "nubank", "nu bank")),
    HEY_BANCO("hey", "Hey Banco", List.of("hey banco"));

    private final String id;
    private final String displayName;
    private final List<String> phrases;

    KnownBank(String id, String displayName, List<String> phrases) {
        this.id = id;
        this.displayName = displayName;
        this.phrases = phrases;
    }

    public String getId() {
        return id;
    }

    public String getDisplayName() {
        return displayName;
    }

    public List<String> getPhrases() {
        return phrases;
    }

    /**
     * Resolves a free-form bank name ("BBVA México", "Citibanamex", "inbursa") to a known bank.
     */
    public static Optional<KnownBank> fromName(String name) {
        String normalized = TextNormalizer.normalize(name);
        if (normalized.isEmpty()) {
            return Optional.empty();
        }
        for (KnownBank bank : values()) {
            if (bank.id.equals(normalized) || TextNormalizer.normalize(bank.displayName).equals(normalized)) {
                return Optional.of(bank);
            }
        }
        for (KnownBank bank : values()) {
            for (String phrase : bank.phrases) {
                if (TextNormalizer.containsPhrase(normalized, phrase)) {
                    return Optional.of(bank);
                }
            }
        }
        return Optional.empty();
    }
}
