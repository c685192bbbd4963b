package ph.hardwareerp.billing.event;

/**
 * Hands billing notifications to whatever delivers them (admin bell, email).
 */
public interface NotificationDispatcher {

    /**
     * Tell reviewers a new payment is waiting.
     */
    void paymentSubmitted(PaymentSubmittedEvent event);

    /**
     * Tell the payer how their payment was reconciled.
     */
    void paymentReconciled(PaymentReconciledEvent event);
}
