package ph.hardwareerp.billing.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import ph.hardwareerp.billing.repository.PaymentRepository;
import ph.hardwareerp.common.dto.billing.PaymentDto;
import ph.hardwareerp.common.dto.billing.PaymentStatus;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Materialized set of payment attempts per order.
 *
 * While the realtime subscription is live the view is fed by Firestore change
 * events and answers reads from memory. Until then (or after the subscription
 * fails) every read goes to the repository.
 *
 * Local writes are recorded immediately so a submitter's next read already
 * sees its own payment. A terminal status is never overwritten by a late
 * pending event, since payments only move forward.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PaymentStoreView {

    private static final Comparator<PaymentDto> BY_CREATED_AT = Comparator.comparing(
            PaymentDto::getCreatedAt, Comparator.nullsFirst(Comparator.<LocalDateTime>naturalOrder()));

    private final PaymentRepository paymentRepository;

    private final Map<String, Map<String, PaymentDto>> paymentsByOrder = new ConcurrentHashMap<>();

    private volatile boolean live;

    /**
     * Payments of an order, oldest first.
     */
    public List<PaymentDto> paymentsFor(String orderId) {
        List<PaymentDto> payments;
        if (live) {
            Map<String, PaymentDto> cached = paymentsByOrder.get(orderId);
            payments = cached != null ? new ArrayList<>(cached.values()) : new ArrayList<>();
        } else {
            payments = new ArrayList<>(paymentRepository.findByOrderId(orderId));
        }
        payments.sort(BY_CREATED_AT);
        return payments;
    }

    /**
     * Apply a change event from the realtime subscription.
     */
    public void apply(PaymentDto payment) {
        if (payment.getOrderId() == null || payment.getId() == null) {
            return;
        }
        paymentsByOrder
                .computeIfAbsent(payment.getOrderId(), k -> new ConcurrentHashMap<>())
                .merge(payment.getId(), payment, PaymentStoreView::newer);
    }

    /**
     * Record a payment this instance just wrote.
     */
    public void recordLocalWrite(PaymentDto payment) {
        if (live) {
            apply(payment);
        }
    }

    public void remove(String orderId, String paymentId) {
        if (orderId == null || paymentId == null) {
            return;
        }
        Map<String, PaymentDto> payments = paymentsByOrder.get(orderId);
        if (payments != null) {
            payments.remove(paymentId);
        }
    }

    /**
     * Called once the subscription delivered its initial snapshot.
     */
    public void markLive() {
        if (!live) {
            live = true;
            log.info("Payment view is live ({} orders cached)", paymentsByOrder.size());
        }
    }

    /**
     * Drop everything and fall back to repository reads.
     */
    public void reset() {
        live = false;
        paymentsByOrder.clear();
        log.warn("Payment view reset, reads go to the repository");
    }

    public boolean isLive() {
        return live;
    }

    private static PaymentDto newer(PaymentDto existing, PaymentDto incoming) {
        PaymentStatus current = existing.getStatus();
        if (current != null && current.isTerminal() && incoming.getStatus() == PaymentStatus.PENDING) {
            return existing;
        }
        return incoming;
    }
}
