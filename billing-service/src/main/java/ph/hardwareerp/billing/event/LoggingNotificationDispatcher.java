package ph.hardwareerp.billing.event;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Default dispatcher used until a delivery channel is wired in.
 */
@Slf4j
@Component
public class LoggingNotificationDispatcher implements NotificationDispatcher {

    @Override
    public void paymentSubmitted(PaymentSubmittedEvent event) {
        log.info("Payment request: customer={} order={} amount={} ({}{})",
                event.getCustomerId(), event.getOrderId(), event.getAmount(), event.getMethod(),
                event.getChequeNumber() != null ? " " + event.getChequeNumber() : "");
    }

    @Override
    public void paymentReconciled(PaymentReconciledEvent event) {
        log.info("Payment {} {} by {}: customer={} order={} amount={}",
                event.getPaymentId(), event.getOutcome(), event.getReviewer(),
                event.getCustomerId(), event.getOrderId(), event.getAmount());
    }
}
