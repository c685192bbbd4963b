package ph.hardwareerp.billing.event;

import lombok.Builder;
import lombok.Value;
import ph.hardwareerp.common.dto.billing.PaymentDto;
import ph.hardwareerp.common.dto.billing.PaymentMethod;

import java.math.BigDecimal;

/**
 * A payer submitted a payment that now awaits review.
 */
@Value
@Builder
public class PaymentSubmittedEvent {

    String paymentId;
    String orderId;
    String customerId;
    BigDecimal amount;
    PaymentMethod method;
    String chequeNumber;

    public static PaymentSubmittedEvent from(PaymentDto payment) {
        return PaymentSubmittedEvent.builder()
                .paymentId(payment.getId())
                .orderId(payment.getOrderId())
                .customerId(payment.getCustomerId())
                .amount(payment.getAmount())
                .method(payment.getMethod())
                .chequeNumber(payment.getChequeNumber())
                .build();
    }
}
