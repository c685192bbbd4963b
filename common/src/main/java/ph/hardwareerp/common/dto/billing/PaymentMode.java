package ph.hardwareerp.common.dto.billing;

/**
 * Customer payment mode, selects which amount rules apply.
 *
 * CASH: any positive amount up to the balance
 * CREDIT: whole installment terms only (or the full balance)
 */
public enum PaymentMode {
    CASH,
    CREDIT
}
