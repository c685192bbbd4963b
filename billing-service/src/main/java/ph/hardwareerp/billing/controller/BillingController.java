package ph.hardwareerp.billing.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import ph.hardwareerp.billing.service.BillingService;
import ph.hardwareerp.common.dto.ApiResponse;
import ph.hardwareerp.common.dto.billing.AmountCheck;
import ph.hardwareerp.common.dto.billing.AmountCheckRequest;
import ph.hardwareerp.common.dto.billing.OrderBillingSummaryDto;
import ph.hardwareerp.common.dto.billing.OutstandingOrderDto;
import ph.hardwareerp.common.dto.billing.PaymentDto;

import java.util.List;

/**
 * REST Controller for order balances, installment schedules and payment options.
 *
 * IMPORTANT: Controllers contain NO business logic.
 * All logic is delegated to BillingService.
 */
@RestController
@RequestMapping("/api/billing")
@RequiredArgsConstructor
@Tag(name = "Billing", description = "Order balance, installment schedule and payment options")
public class BillingController {

    private final BillingService billingService;

    @GetMapping("/orders/{orderId}")
    @Operation(summary = "Get billing summary for an order")
    public ResponseEntity<ApiResponse<OrderBillingSummaryDto>> getOrderBilling(@PathVariable String orderId) {
        return ResponseEntity.ok(ApiResponse.success(billingService.getOrderBilling(orderId)));
    }

    @GetMapping("/orders/{orderId}/payments")
    @Operation(summary = "Get payments submitted for an order")
    public ResponseEntity<ApiResponse<List<PaymentDto>>> getOrderPayments(@PathVariable String orderId) {
        return ResponseEntity.ok(ApiResponse.success(billingService.getOrderPayments(orderId)));
    }

    @PostMapping("/orders/{orderId}/amount-check")
    @Operation(summary = "Check whether an amount can be submitted for an order")
    public ResponseEntity<ApiResponse<AmountCheck>> checkAmount(
            @PathVariable String orderId,
            @Valid @RequestBody AmountCheckRequest request) {
        return ResponseEntity.ok(ApiResponse.success(billingService.checkAmount(orderId, request.getAmount())));
    }

    @GetMapping("/customers/{customerId}/outstanding")
    @Operation(summary = "Get completed orders with a remaining balance")
    public ResponseEntity<ApiResponse<List<OutstandingOrderDto>>> getOutstandingOrders(
            @PathVariable String customerId) {
        return ResponseEntity.ok(ApiResponse.success(billingService.getOutstandingOrders(customerId)));
    }
}
