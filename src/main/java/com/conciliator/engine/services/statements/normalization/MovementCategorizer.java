package com.conciliator.engine.services.statements.normalization;

import java.util.List;

import com.conciliator.engine.enums.MovementKind;
import com.conciliator.engine.enums.TransactionDirection;
import com.conciliator.engine.services.statements.util.TextNormalizer;

public final class MovementCategorizer {

    public static final List<String> TRANSFER_KEYWORDS = List.of(
            "traspaso", "transferencia", "mov.banc", "transfer", "pago tarjeta", "pago tarjeta de credito",
            "card payment", "interbank", "spei propio", "cta propia", "pagotarjeta", "payment thank you",
            "pago total", "pago mensual", "payment received");

    private MovementCategorizer() {
    }

    public static MovementKind movementKind(String description, TransactionDirection direction) {
        if (TextNormalizer.containsAny(description, TRANSFER_KEYWORDS)) {
            return MovementKind.TRANSFER;
        }
        return direction == TransactionDirection.CREDIT ? MovementKind.INCOME : MovementKind.EXPENSE;
    }

    public static String categorize(String description, TransactionDirection direction) {
        if (description == null || description.isBlank()) {
            return "Otros";
        }

        if (direction == TransactionDirection.CREDIT) {
            if (containsAny(description, "nomina", "sueldo", "salario", "honorarios")) {
                return "Nomina";
            }
            if (containsAny(description, "interes", "intereses", "rendimiento", "ganado", "ganados")) {
                return "Intereses";
            }
        }

        if (containsAny(description, "netflix", "spotify", "apple", "google", "openai", "amazon prime", "disney", "hbo", "youtube")) {
            return "Suscripciones";
        }
        if (containsAny(description, "cfe", "telmex", "izzi", "totalplay", "megacable", "telcel", "at&t", "att", "agua", "gas natural", "recarga")) {
            return "Servicios";
        }
        if (containsAny(description, "uber", "didi", "cabify", "autobus", "ado", "vivaaerobus", "volaris", "aeromexico")) {
            return "Transporte";
        }
        if (containsAny(description, "pemex", "gasolinera", "shell", "bp", "mobil", "oxxo gas", "g500")) {
            return "Combustible";
        }
        if (containsAny(description, "walmart", "soriana", "chedraui", "oxxo", "costco", "heb", "bodega aurrera", "la comer", "superama", "rappi")) {
            return "Supermercado";
        }
        if (containsAny(description, "comision", "iva", "anualidad", "cuota", "membership fee", "intereses moratorios")) {
            return "Comisiones";
        }
        if (TextNormalizer.containsAny(description, TRANSFER_KEYWORDS) || containsAny(description, "spei")) {
            return "Transferencias";
        }
        return "Otros";
    }

    private static boolean containsAny(String haystack, String... needles) {
        return TextNormalizer.containsAny(haystack, List.of(needles));
    }
}
