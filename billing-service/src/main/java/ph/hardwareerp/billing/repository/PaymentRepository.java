package ph.hardwareerp.billing.repository;

import ph.hardwareerp.common.dto.billing.PaymentDto;
import ph.hardwareerp.common.dto.billing.PaymentStatus;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Data access for payment rows. Data access only - NO business logic here.
 *
 * Status changes go through {@link #updateStatusIfPending}, a conditional write
 * that only succeeds while the row is still pending.
 */
public interface PaymentRepository {

    List<PaymentDto> findByOrderId(String orderId);

    Optional<PaymentDto> findById(String id);

    /**
     * Insert a new payment in pending status and return it with its generated id.
     */
    PaymentDto insertPending(PaymentDto payment);

    /**
     * Move a payment out of pending in one atomic step.
     *
     * When the target is RECEIVED the order's paid amount is increased in the
     * same commit.
     *
     * @return true when the row was pending and has been updated, false when
     *         another reviewer got there first (nothing written)
     * @throws ph.hardwareerp.common.exception.ResourceNotFoundException if the payment does not exist
     */
    boolean updateStatusIfPending(String paymentId, PaymentStatus target, String reviewer, LocalDateTime reviewedAt);
}
