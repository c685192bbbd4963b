package ph.hardwareerp.billing.event;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import ph.hardwareerp.billing.repository.PaymentRepository;
import ph.hardwareerp.common.dto.billing.PaymentDto;

import java.util.Optional;

/**
 * Forwards billing events to the notification dispatcher off the request thread.
 *
 * A reconciliation outcome is only announced when the stored payment carries
 * that status, so a payer is never told "received" for a payment that is not.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PaymentNotificationListener {

    private final NotificationDispatcher notificationDispatcher;
    private final PaymentRepository paymentRepository;

    @Async("notificationExecutor")
    @EventListener
    public void onPaymentSubmitted(PaymentSubmittedEvent event) {
        notificationDispatcher.paymentSubmitted(event);
    }

    @Async("notificationExecutor")
    @EventListener
    public void onPaymentReconciled(PaymentReconciledEvent event) {
        Optional<PaymentDto> stored = paymentRepository.findById(event.getPaymentId());
        if (stored.isEmpty() || stored.get().getStatus() != event.getOutcome()) {
            log.warn("Skipping notification for payment {}: stored status {} does not match {}",
                    event.getPaymentId(),
                    stored.map(PaymentDto::getStatus).orElse(null),
                    event.getOutcome());
            return;
        }
        notificationDispatcher.paymentReconciled(event);
    }
}
