package com.conciliator.engine.services.statements.strategies;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Component;

import com.conciliator.engine.enums.TransactionDirection;
import com.conciliator.engine.services.statements.model.Transaction;
import com.conciliator.engine.services.statements.normalization.DirectionClassifier;
import com.conciliator.engine.services.statements.rules.RuleSet;
import com.conciliator.engine.services.statements.util.AmountParser;
import com.conciliator.engine.services.statements.util.CarryRows;
import com.conciliator.engine.services.statements.util.DateResolver;
import com.conciliator.engine.services.statements.util.DescriptionCleaner;
import com.conciliator.engine.services.statements.util.StatementHeaderExtractor;
import com.conciliator.engine.services.statements.util.TextNormalizer;
import com.conciliator.engine.services.statements.util.YearContext;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.extern.slf4j.Slf4j;

/**
 * Reads rows already structured by the extraction layer (Excel/CSV sheets serialized as a JSON
 * array of objects). Columns are recognized by header name.
 */
@Slf4j
@Component
public class StructuredRecordStrategy implements ExtractionStrategy {

    public static final String NAME = "structured";

    enum Column {
        DATE("fecha", "date", "dia", "day", "fecha operacion", "fecha de operacion"),
        DESCRIPTION("descripcion", "description", "concepto", "detalle", "desc"),
        AMOUNT("monto", "amount", "importe", "cantidad"),
        DEBIT("cargo", "cargos", "debit", "debito", "salida", "retiro", "retiros"),
        CREDIT("abono", "abonos", "credit", "credito", "entrada", "ingreso", "deposito", "depositos"),
        BALANCE("saldo", "balance"),
        REFERENCE("referencia", "reference", "folio", "ref");

        private final List<String> aliases;

        Column(String... aliases) {
            this.aliases = List.of(aliases);
        }
    }

    // 1899-12-30 is day zero of spreadsheet serial dates.
    private static final LocalDate SPREADSHEET_EPOCH = LocalDate.of(1899, 12, 30);

    private final ObjectMapper objectMapper;

    public StructuredRecordStrategy(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public String name() {
        return NAME;
    }

    public boolean accepts(String text) {
        return text != null && text.stripLeading().startsWith("[");
    }

    @Override
    public StrategyResult run(String text, RuleSet rules) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        if (!accepts(text)) {
            return StrategyResult.failed(NAME, "not_structured_input", metadata);
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            log.warn("[StructuredRecordStrategy] Invalid JSON input: {}", e.getOriginalMessage());
            return StrategyResult.failed(NAME, "invalid_json", metadata);
        }
        if (root == null || !root.isArray() || root.isEmpty()) {
            return StrategyResult.failed(NAME, "empty_records", metadata);
        }

        Map<Column, String> columns = detectColumns(root);
        metadata.put("records", root.size());
        metadata.put("columns", columns.toString());
        boolean hasAmount = columns.containsKey(Column.AMOUNT)
                || columns.containsKey(Column.DEBIT)
                || columns.containsKey(Column.CREDIT);
        if (!columns.containsKey(Column.DATE) || !hasAmount) {
            return StrategyResult.failed(NAME, "missing_required_columns", metadata);
        }

        YearContext years = StatementHeaderExtractor.extract(text).yearContext();
        List<Transaction> out = new ArrayList<>();
        int unreadable = 0;
        for (JsonNode row : root) {
            Transaction tx = toTransaction(row, columns, years, rules);
            if (tx == null) {
                unreadable++;
            } else {
                out.add(tx);
            }
        }
        metadata.put("unreadableRows", unreadable);

        if (out.isEmpty()) {
            return StrategyResult.failed(NAME, "no_transactions", metadata);
        }
        return StrategyResult.success(NAME, out, metadata);
    }

    static Map<Column, String> detectColumns(JsonNode rows) {
        Map<Column, String> found = new LinkedHashMap<>();
        JsonNode first = rows.get(0);
        if (first == null || !first.isObject()) return found;

        Iterator<String> names = first.fieldNames();
        while (names.hasNext()) {
            String field = names.next();
            String normalized = TextNormalizer.normalizeDescription(field);
            for (Column column : Column.values()) {
                if (!found.containsKey(column) && matches(column, normalized)) {
                    found.put(column, field);
                    break;
                }
            }
        }
        return found;
    }

    private static boolean matches(Column column, String normalizedHeader) {
        for (String alias : column.aliases) {
            if (normalizedHeader.equals(alias) || normalizedHeader.startsWith(alias + " ")) {
                return true;
            }
        }
        return false;
    }

    private Transaction toTransaction(JsonNode row, Map<Column, String> columns, YearContext years, RuleSet rules) {
        if (row == null || !row.isObject()) return null;

        LocalDate date = readDate(row.get(columns.get(Column.DATE)), years);
        String description = text(row, columns.get(Column.DESCRIPTION));
        BigDecimal balance = amount(row, columns.get(Column.BALANCE));

        BigDecimal amount;
        TransactionDirection direction;
        if (columns.containsKey(Column.AMOUNT) && amount(row, columns.get(Column.AMOUNT)) != null) {
            amount = amount(row, columns.get(Column.AMOUNT));
            // a single signed column: negative is a debit, otherwise keywords decide and the sign is the default
            if (amount.signum() < 0) {
                direction = TransactionDirection.DEBIT;
            } else {
                TransactionDirection byKeyword = DirectionClassifier.keywordDirection(description, rules);
                direction = byKeyword != null ? byKeyword : TransactionDirection.CREDIT;
                if (direction == TransactionDirection.DEBIT) {
                    amount = amount.negate();
                }
            }
        } else {
            BigDecimal debit = amount(row, columns.get(Column.DEBIT));
            BigDecimal credit = amount(row, columns.get(Column.CREDIT));
            if (debit != null && debit.signum() != 0) {
                amount = debit.abs().negate();
                direction = TransactionDirection.DEBIT;
            } else if (credit != null && credit.signum() != 0) {
                amount = credit.abs();
                direction = TransactionDirection.CREDIT;
            } else {
                amount = BigDecimal.ZERO;
                direction = null;
            }
        }

        if (date == null && amount.signum() == 0 && balance == null) {
            return null;
        }

        String cleaned = DescriptionCleaner.clean(description);
        String reference = text(row, columns.get(Column.REFERENCE));
        boolean carry = amount.signum() == 0 && CarryRows.isCarry(cleaned);
        return Transaction.builder()
                .date(date)
                .description(cleaned.isEmpty() ? description.trim() : cleaned)
                .amount(carry ? BigDecimal.ZERO : amount)
                .direction(carry ? null : direction)
                .balanceAfter(balance)
                .reference(reference.isEmpty() ? DescriptionCleaner.extractReference(description) : reference)
                .carryRow(carry)
                .confidence(0.95)
                .rawLine(row.toString())
                .sourceStrategy(NAME)
                .build();
    }

    private static LocalDate readDate(JsonNode node, YearContext years) {
        if (node == null || node.isNull()) return null;
        if (node.isNumber()) {
            long serial = node.asLong();
            return serial > 0 ? SPREADSHEET_EPOCH.plusDays(serial) : null;
        }
        return DateResolver.parse(node.asText(), years);
    }

    private static String text(JsonNode row, String field) {
        if (field == null) return "";
        JsonNode node = row.get(field);
        return node == null || node.isNull() ? "" : node.asText("").trim();
    }

    private static BigDecimal amount(JsonNode row, String field) {
        if (field == null) return null;
        JsonNode node = row.get(field);
        if (node == null || node.isNull()) return null;
        if (node.isNumber()) {
            return node.decimalValue().setScale(2, RoundingMode.HALF_UP);
        }
        return AmountParser.parse(node.asText());
    }
}
