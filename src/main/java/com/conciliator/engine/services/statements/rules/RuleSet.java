package com.conciliator.engine.services.statements.rules;

import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

import com.conciliator.engine.services.statements.util.AmountParser;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Keyword and pattern configuration used by every strategy and by the normalizer.
 * Instances are immutable; a fresh one is resolved for each parse.
 */
@Value
@Builder(toBuilder = true)
public class RuleSet {

    /** Bank the rules were resolved for, "base" when no override applied. */
    String bankId;

    /** Version of the override file merged in, 0 for the base. */
    int version;

    @Singular Set<String> creditKeywords;
    @Singular Set<String> debitKeywords;
    @Singular Set<String> skipKeywords;
    @Singular List<Pattern> amountPatterns;
    @Singular List<LinePattern> customLinePatterns;

    boolean preferFirstAmount;
    boolean hasRunningBalanceColumn;
    boolean mergeMultilineConcepts;

    public static final List<String> BASE_CREDIT_KEYWORDS = List.of(
            "deposito", "abono", "transferencia recibida", "interes", "intereses", "devolucion",
            "ingreso", "credito", "deposito electronico", "spei recibido", "ganado", "ganados");

    public static final List<String> BASE_DEBIT_KEYWORDS = List.of(
            "cargo", "retiro", "pago", "compra", "comision", "domiciliacion",
            "transferencia enviada", "spei enviado", "debito", "iva");

    public static final List<String> BASE_SKIP_KEYWORDS = List.of(
            "balance inicial", "saldo anterior", "saldo inicial", "saldo final", "saldo actual",
            "saldo promedio", "total de cargos", "total de abonos", "total cargos", "total abonos",
            "pagina", "pag.", "fecha descripcion", "fecha concepto");

    private static final RuleSet BASE = RuleSet.builder()
            .bankId("base")
            .version(0)
            .creditKeywords(BASE_CREDIT_KEYWORDS)
            .debitKeywords(BASE_DEBIT_KEYWORDS)
            .skipKeywords(BASE_SKIP_KEYWORDS)
            .amountPattern(Pattern.compile(AmountParser.STRICT_AMOUNT))
            .preferFirstAmount(false)
            .hasRunningBalanceColumn(false)
            .mergeMultilineConcepts(false)
            .build();

    public static RuleSet base() {
        return BASE;
    }

    public boolean isBase() {
        return "base".equals(bankId);
    }
}
