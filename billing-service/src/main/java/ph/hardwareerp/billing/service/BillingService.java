package ph.hardwareerp.billing.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import ph.hardwareerp.billing.repository.CustomerRepository;
import ph.hardwareerp.billing.repository.InstallmentRepository;
import ph.hardwareerp.billing.repository.OrderRepository;
import ph.hardwareerp.billing.repository.ShippingFeeRepository;
import ph.hardwareerp.common.dto.billing.AmountCheck;
import ph.hardwareerp.common.dto.billing.EqualizedSchedule;
import ph.hardwareerp.common.dto.billing.OrderBalance;
import ph.hardwareerp.common.dto.billing.OrderBillingSummaryDto;
import ph.hardwareerp.common.dto.billing.OrderDto;
import ph.hardwareerp.common.dto.billing.OrderTotals;
import ph.hardwareerp.common.dto.billing.OutstandingOrderDto;
import ph.hardwareerp.common.dto.billing.PaymentDto;
import ph.hardwareerp.common.dto.billing.PaymentMode;
import ph.hardwareerp.common.dto.billing.PaymentOptions;
import ph.hardwareerp.common.dto.customer.CustomerDto;
import ph.hardwareerp.common.exception.ResourceNotFoundException;
import ph.hardwareerp.common.exception.ValidationException;
import ph.hardwareerp.common.util.MoneyUtils;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;

/**
 * Computes the billing picture of an order.
 *
 * Pipeline: order ledger + payment view -> balance -> installment equalizer
 * -> payment options. Nothing is cached: orders, shipping fees and installment
 * rows are re-read on every call because logistics may set a fee at any time.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BillingService {

    private static final String COMPLETED = "completed";
    private static final BigDecimal OUTSTANDING_THRESHOLD = new BigDecimal("0.01");

    private final OrderRepository orderRepository;
    private final InstallmentRepository installmentRepository;
    private final CustomerRepository customerRepository;
    private final ShippingFeeRepository shippingFeeRepository;
    private final PaymentStoreView paymentStoreView;
    private final OrderLedgerService orderLedgerService;
    private final BalanceCalculator balanceCalculator;
    private final InstallmentEqualizer installmentEqualizer;
    private final PaymentModeResolver paymentModeResolver;
    private final PaymentAmountValidator paymentAmountValidator;

    /**
     * Full billing summary for one order.
     */
    public OrderBillingSummaryDto getOrderBilling(String orderId) {
        OrderDto order = findOrder(orderId);

        BigDecimal shippingFee = shippingFeeRepository.findShippingFee(order);
        OrderTotals totals = orderLedgerService.compute(order, shippingFee);
        OrderBalance balance = balanceCalculator.calculate(
                totals.getGrandTotal(), paymentStoreView.paymentsFor(order.getId()));

        CustomerDto customer = customerRepository.findById(order.getCustomerId()).orElse(null);
        PaymentMode mode = paymentModeResolver.resolve(customer, order);

        EqualizedSchedule schedule = installmentEqualizer.equalize(
                installmentRepository.findByOrderId(order.getId()), balance.getBalance(), LocalDate.now());
        PaymentOptions options = paymentAmountValidator.options(
                schedule, mode, orderLedgerService.isPayable(totals));

        log.debug("Order {} billing: mode={}, grandTotal={}, balance={}, unpaidTerms={}",
                orderId, mode, totals.getGrandTotal(), balance.getBalance(), schedule.getUnpaidTerms().size());

        return OrderBillingSummaryDto.builder()
                .orderId(order.getId())
                .customerId(order.getCustomerId())
                .mode(mode)
                .totals(totals)
                .balance(balance)
                .schedule(schedule)
                .options(options)
                .build();
    }

    /**
     * Completed orders of a customer that still have money owed, largest balance first.
     */
    public List<OutstandingOrderDto> getOutstandingOrders(String customerId) {
        if (customerId == null || customerId.isBlank()) {
            throw new ValidationException("customerId", "Customer ID is required");
        }

        return orderRepository.findByCustomerIdAndStatus(customerId, COMPLETED).stream()
                .map(this::toOutstanding)
                .filter(o -> o.getBalance().compareTo(OUTSTANDING_THRESHOLD) > 0)
                .sorted(Comparator.comparing(OutstandingOrderDto::getBalance).reversed())
                .toList();
    }

    /**
     * Check an amount against the current options without writing anything.
     */
    public AmountCheck checkAmount(String orderId, BigDecimal amount) {
        OrderBillingSummaryDto billing = getOrderBilling(orderId);
        return paymentAmountValidator.check(billing.getOptions(), amount);
    }

    /**
     * Payments of an order, oldest first.
     */
    public List<PaymentDto> getOrderPayments(String orderId) {
        findOrder(orderId);
        return paymentStoreView.paymentsFor(orderId);
    }

    private OutstandingOrderDto toOutstanding(OrderDto order) {
        OrderTotals totals = orderLedgerService.compute(order, shippingFeeRepository.findShippingFee(order));
        OrderBalance balance = balanceCalculator.calculate(
                totals.getGrandTotal(), paymentStoreView.paymentsFor(order.getId()));
        return OutstandingOrderDto.builder()
                .orderId(order.getId())
                .customerId(order.getCustomerId())
                .grandTotal(totals.getGrandTotal())
                .balance(MoneyUtils.round2(balance.getBalance()))
                .payable(orderLedgerService.isPayable(totals))
                .build();
    }

    private OrderDto findOrder(String orderId) {
        return orderRepository.findById(orderId)
                .orElseThrow(() -> new ResourceNotFoundException("Order", orderId));
    }
}
