package ph.hardwareerp.billing.event;

import lombok.Builder;
import lombok.Value;
import ph.hardwareerp.common.dto.billing.PaymentDto;
import ph.hardwareerp.common.dto.billing.PaymentMethod;
import ph.hardwareerp.common.dto.billing.PaymentStatus;

import java.math.BigDecimal;

/**
 * A reviewer moved a payment to RECEIVED or REJECTED.
 */
@Value
@Builder
public class PaymentReconciledEvent {

    String paymentId;
    String orderId;
    String customerId;
    BigDecimal amount;
    PaymentMethod method;
    PaymentStatus outcome;
    String reviewer;

    public static PaymentReconciledEvent from(PaymentDto payment) {
        return PaymentReconciledEvent.builder()
                .paymentId(payment.getId())
                .orderId(payment.getOrderId())
                .customerId(payment.getCustomerId())
                .amount(payment.getAmount())
                .method(payment.getMethod())
                .outcome(payment.getStatus())
                .reviewer(payment.getReviewedBy())
                .build();
    }
}
