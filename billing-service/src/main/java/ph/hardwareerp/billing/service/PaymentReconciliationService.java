package ph.hardwareerp.billing.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import ph.hardwareerp.billing.event.PaymentReconciledEvent;
import ph.hardwareerp.billing.repository.PaymentRepository;
import ph.hardwareerp.common.dto.billing.PaymentDto;
import ph.hardwareerp.common.dto.billing.PaymentStatus;
import ph.hardwareerp.common.exception.PaymentAlreadyProcessedException;
import ph.hardwareerp.common.exception.ResourceNotFoundException;
import ph.hardwareerp.common.exception.ValidationException;

import java.time.LocalDateTime;

/**
 * Applies a reviewer's confirm or reject decision to a pending payment.
 *
 * States: PENDING -> RECEIVED, PENDING -> REJECTED. Both are terminal.
 *
 * There is no check-then-write here. The repository performs one conditional
 * write guarded by "status is still pending"; when it reports that nothing was
 * written, another reviewer already decided and the caller gets
 * PaymentAlreadyProcessedException with the status read back from the store.
 * A failed or timed-out call is never retried, since replaying a confirm could
 * count the money twice.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PaymentReconciliationService {

    private final PaymentRepository paymentRepository;
    private final PaymentStoreView paymentStoreView;
    private final ApplicationEventPublisher eventPublisher;

    /**
     * Mark a pending payment as received. The order's paid amount grows in the same commit.
     */
    public PaymentDto confirm(String paymentId, String reviewer) {
        return transition(paymentId, PaymentStatus.RECEIVED, reviewer);
    }

    /**
     * Mark a pending payment as rejected. The balance is unaffected.
     */
    public PaymentDto reject(String paymentId, String reviewer) {
        return transition(paymentId, PaymentStatus.REJECTED, reviewer);
    }

    private PaymentDto transition(String paymentId, PaymentStatus target, String reviewer) {
        if (paymentId == null || paymentId.isBlank()) {
            throw new ValidationException("paymentId", "Payment ID is required");
        }
        if (reviewer == null || reviewer.isBlank()) {
            throw new ValidationException("reviewer", "Reviewer is required");
        }

        log.info("Reviewer {} moving payment {} to {}", reviewer, paymentId, target);
        boolean applied = paymentRepository.updateStatusIfPending(
                paymentId, target, reviewer.trim(), LocalDateTime.now());

        PaymentDto current = paymentRepository.findById(paymentId)
                .orElseThrow(() -> new ResourceNotFoundException("Payment", paymentId));

        if (!applied) {
            log.warn("Payment {} already processed (status {}), {} by {} not applied",
                    paymentId, current.getStatus(), target, reviewer);
            throw new PaymentAlreadyProcessedException(paymentId, current.getStatus().value());
        }

        paymentStoreView.recordLocalWrite(current);
        eventPublisher.publishEvent(PaymentReconciledEvent.from(current));

        log.info("Payment {} for order {} is now {} (amount {})",
                paymentId, current.getOrderId(), current.getStatus(), current.getAmount());
        return current;
    }
}
