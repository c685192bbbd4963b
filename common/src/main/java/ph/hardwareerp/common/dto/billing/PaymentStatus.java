package ph.hardwareerp.common.dto.billing;

import java.util.Locale;

/**
 * Payment lifecycle status.
 *
 * PENDING: submitted by the payer, awaiting review
 * RECEIVED: confirmed by a reviewer (terminal, counts against the balance)
 * REJECTED: rejected by a reviewer (terminal, balance unaffected)
 * UNKNOWN: stored value this service does not recognize (never applied, never transitioned)
 */
public enum PaymentStatus {
    PENDING,
    RECEIVED,
    REJECTED,
    UNKNOWN;

    public boolean isTerminal() {
        return this != PENDING;
    }

    /**
     * Stored value, lower case as written by the payer and reviewer screens.
     */
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parse a stored status. Missing values read as PENDING (rows written before the
     * field existed); anything unrecognized reads as UNKNOWN.
     */
    public static PaymentStatus fromValue(String value) {
        if (value == null || value.isBlank()) {
            return PENDING;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "pending" -> PENDING;
            case "received" -> RECEIVED;
            case "rejected" -> REJECTED;
            default -> UNKNOWN;
        };
    }
}
