package com.conciliator.engine.services.statements.model;

import java.math.BigDecimal;
import java.time.LocalDate;

import com.conciliator.engine.enums.MovementKind;
import com.conciliator.engine.enums.TransactionDirection;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One ledger line. Strategies create it with whatever they could read; the normalizer fixes
 * direction and sign; the MSI matcher attaches {@link MsiEnrichment}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Transaction {

    /** Position in the normalized ledger (TX-0001...), assigned by the engine. */
    private String ref;

    private LocalDate date;
    private String description;

    /** Signed once normalized: credit >= 0, debit <= 0. */
    private BigDecimal amount;

    private TransactionDirection direction;
    private MovementKind movementKind;

    /** Bank reference / folio printed on the line. */
    private String reference;

    private BigDecimal balanceAfter;
    private double confidence;
    private MsiEnrichment msi;
    private String category;

    private String rawLine;
    private String sourceStrategy;

    /** "BALANCE INICIAL" / "SALDO ANTERIOR" rows that only carry a balance. */
    private boolean carryRow;

    public BigDecimal absoluteAmount() {
        return amount == null ? BigDecimal.ZERO : amount.abs();
    }

    public void appendDescription(String fragment) {
        if (fragment == null || fragment.isBlank()) return;
        String current = description == null ? "" : description.trim();
        description = current.isEmpty() ? fragment.trim() : current + " " + fragment.trim();
    }
}
