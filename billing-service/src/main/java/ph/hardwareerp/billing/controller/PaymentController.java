package ph.hardwareerp.billing.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import ph.hardwareerp.billing.service.PaymentReconciliationService;
import ph.hardwareerp.billing.service.PaymentSubmissionService;
import ph.hardwareerp.common.dto.ApiResponse;
import ph.hardwareerp.common.dto.billing.PaymentDto;
import ph.hardwareerp.common.dto.billing.ReviewPaymentRequest;
import ph.hardwareerp.common.dto.billing.SubmitPaymentRequest;

/**
 * REST Controller for payment submission and reviewer reconciliation.
 *
 * A confirm or reject that lost the race to another reviewer answers 409;
 * the client should reload the payment rather than retry.
 */
@RestController
@RequestMapping("/api/billing/payments")
@RequiredArgsConstructor
@Tag(name = "Payments", description = "Payment submission and reconciliation")
public class PaymentController {

    private final PaymentSubmissionService paymentSubmissionService;
    private final PaymentReconciliationService paymentReconciliationService;

    @PostMapping
    @Operation(summary = "Submit a payment for review")
    public ResponseEntity<ApiResponse<PaymentDto>> submitPayment(
            @Valid @RequestBody SubmitPaymentRequest request) {
        PaymentDto created = paymentSubmissionService.submit(request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(created, "Payment submitted. Awaiting verification."));
    }

    @PostMapping("/{paymentId}/confirm")
    @Operation(summary = "Confirm a pending payment as received")
    public ResponseEntity<ApiResponse<PaymentDto>> confirmPayment(
            @PathVariable String paymentId,
            @Valid @RequestBody ReviewPaymentRequest request) {
        PaymentDto payment = paymentReconciliationService.confirm(paymentId, request.getReviewer());
        return ResponseEntity.ok(ApiResponse.success(payment, "Payment marked as received"));
    }

    @PostMapping("/{paymentId}/reject")
    @Operation(summary = "Reject a pending payment")
    public ResponseEntity<ApiResponse<PaymentDto>> rejectPayment(
            @PathVariable String paymentId,
            @Valid @RequestBody ReviewPaymentRequest request) {
        PaymentDto payment = paymentReconciliationService.reject(paymentId, request.getReviewer());
        return ResponseEntity.ok(ApiResponse.success(payment, "Payment rejected"));
    }
}
