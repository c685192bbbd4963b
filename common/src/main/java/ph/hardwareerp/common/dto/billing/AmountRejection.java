package ph.hardwareerp.common.dto.billing;

/**
 * Why a payment amount cannot be submitted.
 */
public enum AmountRejection {
    NOT_PAYABLE,
    NON_POSITIVE,
    EXCEEDS_BALANCE,
    NOT_A_TERM_MULTIPLE
}
