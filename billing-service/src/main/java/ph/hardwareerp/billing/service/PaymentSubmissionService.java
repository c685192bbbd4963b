package ph.hardwareerp.billing.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import ph.hardwareerp.billing.event.PaymentSubmittedEvent;
import ph.hardwareerp.billing.repository.PaymentRepository;
import ph.hardwareerp.common.dto.billing.AmountCheck;
import ph.hardwareerp.common.dto.billing.OrderBillingSummaryDto;
import ph.hardwareerp.common.dto.billing.PaymentDto;
import ph.hardwareerp.common.dto.billing.PaymentMethod;
import ph.hardwareerp.common.dto.billing.PaymentMode;
import ph.hardwareerp.common.dto.billing.PaymentStatus;
import ph.hardwareerp.common.dto.billing.SubmitPaymentRequest;
import ph.hardwareerp.common.exception.ValidationException;
import ph.hardwareerp.common.util.MoneyUtils;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Records a payer's payment as pending after checking it against the current options.
 *
 * Business Logic:
 * - The amount is validated against freshly computed options before any write
 * - Cash customers pay cash; everyone else pays by cheque
 * - Cheques need number, bank, a date not in the past and a receipt image reference
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PaymentSubmissionService {

    private final BillingService billingService;
    private final PaymentAmountValidator paymentAmountValidator;
    private final PaymentRepository paymentRepository;
    private final PaymentStoreView paymentStoreView;
    private final ApplicationEventPublisher eventPublisher;

    public PaymentDto submit(SubmitPaymentRequest request) {
        log.info("Payment submission for order {} by customer {}: {}",
                request.getOrderId(), request.getCustomerId(), request.getAmount());

        OrderBillingSummaryDto billing = billingService.getOrderBilling(request.getOrderId());
        if (!Objects.equals(request.getCustomerId(), billing.getCustomerId())) {
            throw new ValidationException("customerId", "Order does not belong to this customer");
        }

        AmountCheck check = paymentAmountValidator.check(billing.getOptions(), request.getAmount());
        if (!check.isValid()) {
            log.warn("Rejected payment amount {} for order {}: {}",
                    request.getAmount(), request.getOrderId(), check.getRejection());
            throw new ValidationException("amount", check.getMessage());
        }

        PaymentMethod method = billing.getMode() == PaymentMode.CASH ? PaymentMethod.CASH : PaymentMethod.CHEQUE;
        if (method == PaymentMethod.CHEQUE) {
            validateCheque(request);
        }

        PaymentDto saved = paymentRepository.insertPending(PaymentDto.builder()
                .orderId(request.getOrderId())
                .customerId(request.getCustomerId())
                .amount(MoneyUtils.round2(request.getAmount()))
                .method(method)
                .status(PaymentStatus.PENDING)
                .chequeNumber(blankToNull(request.getChequeNumber()))
                .bankName(blankToNull(request.getBankName()))
                .chequeDate(request.getChequeDate())
                .receiptReference(blankToNull(request.getReceiptReference()))
                .createdAt(LocalDateTime.now())
                .build());

        paymentStoreView.recordLocalWrite(saved);
        eventPublisher.publishEvent(PaymentSubmittedEvent.from(saved));

        log.info("Payment {} recorded as pending ({} {})", saved.getId(), method, saved.getAmount());
        return saved;
    }

    private void validateCheque(SubmitPaymentRequest request) {
        if (isBlank(request.getChequeNumber())) {
            throw new ValidationException("chequeNumber", "Cheque number is required");
        }
        if (isBlank(request.getBankName())) {
            throw new ValidationException("bankName", "Bank name is required");
        }
        if (request.getChequeDate() == null) {
            throw new ValidationException("chequeDate", "Cheque date is required");
        }
        if (request.getChequeDate().isBefore(LocalDate.now())) {
            throw new ValidationException("chequeDate", "Cheque date cannot be in the past");
        }
        if (isBlank(request.getReceiptReference())) {
            throw new ValidationException("receiptReference", "Cheque image is required");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String blankToNull(String value) {
        return isBlank(value) ? null : value.trim();
    }
}
