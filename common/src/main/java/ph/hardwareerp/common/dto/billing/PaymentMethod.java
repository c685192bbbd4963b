package ph.hardwareerp.common.dto.billing;

import java.util.Locale;

/**
 * How a payment was tendered.
 */
public enum PaymentMethod {
    CASH,
    CHEQUE;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Lenient parse; anything that is not "cash" is treated as a cheque/deposit.
     */
    public static PaymentMethod fromValue(String value) {
        if (value != null && "cash".equalsIgnoreCase(value.trim())) {
            return CASH;
        }
        return CHEQUE;
    }
}
