package ph.hardwareerp.billing.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;
import ph.hardwareerp.billing.repository.CustomerRepository;
import ph.hardwareerp.billing.repository.InstallmentRepository;
import ph.hardwareerp.billing.repository.OrderRepository;
import ph.hardwareerp.billing.repository.ShippingFeeRepository;
import ph.hardwareerp.common.dto.billing.AmountRejection;
import ph.hardwareerp.common.dto.billing.InstallmentTermDto;
import ph.hardwareerp.common.dto.billing.OrderBillingSummaryDto;
import ph.hardwareerp.common.dto.billing.OrderDto;
import ph.hardwareerp.common.dto.billing.OrderLineItemDto;
import ph.hardwareerp.common.dto.billing.OutstandingOrderDto;
import ph.hardwareerp.common.dto.billing.PaymentDto;
import ph.hardwareerp.common.dto.billing.PaymentMethod;
import ph.hardwareerp.common.dto.billing.PaymentMode;
import ph.hardwareerp.common.dto.billing.PaymentStatus;
import ph.hardwareerp.common.dto.customer.CustomerDto;
import ph.hardwareerp.common.exception.ResourceNotFoundException;
import ph.hardwareerp.common.exception.ValidationException;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BillingServiceTest {

    @Mock
    private OrderRepository orderRepository;

    @Mock
    private InstallmentRepository installmentRepository;

    @Mock
    private CustomerRepository customerRepository;

    @Mock
    private ShippingFeeRepository shippingFeeRepository;

    @Mock
    private PaymentStoreView paymentStoreView;

    private BillingService service;

    @BeforeEach
    void setUp() {
        PaymentAmountValidator validator = new PaymentAmountValidator();
        ReflectionTestUtils.setField(validator, "cashStep", new BigDecimal("1000.00"));
        ReflectionTestUtils.setField(validator, "minCash", new BigDecimal("0.01"));

        service = new BillingService(orderRepository, installmentRepository, customerRepository,
                shippingFeeRepository, paymentStoreView, new OrderLedgerService(), new BalanceCalculator(),
                new InstallmentEqualizer(), new PaymentModeResolver(), validator);
    }

    @Test
    void getOrderBilling_ShouldEqualizeRemainingBalanceOverUnpaidTerms() {
        // Arrange
        OrderDto order = order("order-1", "1200.00");
        when(orderRepository.findById("order-1")).thenReturn(Optional.of(order));
        when(shippingFeeRepository.findShippingFee(order)).thenReturn(new BigDecimal("300.00"));
        when(paymentStoreView.paymentsFor("order-1")).thenReturn(List.of(
                payment("400.00", PaymentMethod.CHEQUE, PaymentStatus.RECEIVED)));
        when(customerRepository.findById("cust-1")).thenReturn(Optional.of(
                CustomerDto.builder().id("cust-1").paymentType("credit").build()));
        when(installmentRepository.findByOrderId("order-1")).thenReturn(List.of(
                term(1, "400.00", "paid"),
                term(2, "0", "pending"),
                term(3, "0", "pending")));

        // Act
        OrderBillingSummaryDto billing = service.getOrderBilling("order-1");

        // Assert
        assertEquals(PaymentMode.CREDIT, billing.getMode());
        assertEquals(new BigDecimal("1500.00"), billing.getTotals().getGrandTotal());
        assertEquals(new BigDecimal("1100.00"), billing.getBalance().getBalance());
        assertEquals(List.of(new BigDecimal("550.00"), new BigDecimal("550.00")),
                billing.getSchedule().getRemainingAmounts());
        assertTrue(billing.getOptions().isPayable());
        assertEquals(List.of(new BigDecimal("550.00"), new BigDecimal("1100.00")),
                billing.getOptions().getPrefixSums());
    }

    @Test
    void getOrderBilling_ShouldNotBePayableWithoutShippingFee() {
        OrderDto order = order("order-1", "1200.00");
        when(orderRepository.findById("order-1")).thenReturn(Optional.of(order));
        when(shippingFeeRepository.findShippingFee(order)).thenReturn(null);
        when(paymentStoreView.paymentsFor("order-1")).thenReturn(List.of());
        when(customerRepository.findById("cust-1")).thenReturn(Optional.empty());
        when(installmentRepository.findByOrderId("order-1")).thenReturn(List.of());

        OrderBillingSummaryDto billing = service.getOrderBilling("order-1");

        assertEquals(new BigDecimal("1200.00"), billing.getBalance().getBalance());
        assertFalse(billing.getOptions().isPayable());
    }

    @Test
    void getOrderBilling_ShouldFailForUnknownOrder() {
        when(orderRepository.findById("missing")).thenReturn(Optional.empty());

        assertThrows(ResourceNotFoundException.class, () -> service.getOrderBilling("missing"));
    }

    @Test
    void checkAmount_ShouldUseCurrentOptions() {
        OrderDto order = order("order-1", "700.00");
        when(orderRepository.findById("order-1")).thenReturn(Optional.of(order));
        when(shippingFeeRepository.findShippingFee(order)).thenReturn(new BigDecimal("300.00"));
        when(paymentStoreView.paymentsFor("order-1")).thenReturn(List.of());
        when(customerRepository.findById("cust-1")).thenReturn(Optional.of(
                CustomerDto.builder().id("cust-1").paymentType("cash").build()));
        when(installmentRepository.findByOrderId("order-1")).thenReturn(List.of());

        assertEquals(AmountRejection.EXCEEDS_BALANCE,
                service.checkAmount("order-1", new BigDecimal("1000.01")).getRejection());
    }

    @Test
    void getOutstandingOrders_ShouldListOwingOrdersLargestFirst() {
        // Arrange
        OrderDto small = order("order-small", "100.00");
        OrderDto settled = order("order-settled", "200.00");
        OrderDto large = order("order-large", "500.00");
        when(orderRepository.findByCustomerIdAndStatus("cust-1", "completed"))
                .thenReturn(List.of(small, settled, large));
        when(shippingFeeRepository.findShippingFee(any(OrderDto.class))).thenReturn(null);
        when(paymentStoreView.paymentsFor("order-small")).thenReturn(List.of());
        when(paymentStoreView.paymentsFor("order-settled")).thenReturn(List.of(
                payment("200.00", PaymentMethod.CASH, PaymentStatus.RECEIVED)));
        when(paymentStoreView.paymentsFor("order-large")).thenReturn(List.of());

        // Act
        List<OutstandingOrderDto> outstanding = service.getOutstandingOrders("cust-1");

        // Assert
        assertEquals(List.of("order-large", "order-small"),
                outstanding.stream().map(OutstandingOrderDto::getOrderId).toList());
        assertFalse(outstanding.get(0).isPayable());
    }

    @Test
    void getOutstandingOrders_ShouldRequireCustomerId() {
        assertThrows(ValidationException.class, () -> service.getOutstandingOrders(" "));
        verifyNoInteractions(orderRepository);
    }

    @Test
    void getOrderPayments_ShouldRequireExistingOrder() {
        when(orderRepository.findById("order-1")).thenReturn(Optional.of(order("order-1", "10.00")));
        when(paymentStoreView.paymentsFor("order-1")).thenReturn(List.of(
                payment("5.00", PaymentMethod.CASH, PaymentStatus.PENDING)));

        assertEquals(1, service.getOrderPayments("order-1").size());
    }

    private static OrderDto order(String id, String unitPrice) {
        return OrderDto.builder()
                .id(id)
                .customerId("cust-1")
                .status("completed")
                .items(List.of(OrderLineItemDto.builder()
                        .productName("Cement 40kg")
                        .quantity(BigDecimal.ONE)
                        .unitPrice(new BigDecimal(unitPrice))
                        .build()))
                .build();
    }

    private static PaymentDto payment(String amount, PaymentMethod method, PaymentStatus status) {
        return PaymentDto.builder()
                .amount(new BigDecimal(amount))
                .method(method)
                .status(status)
                .build();
    }

    private static InstallmentTermDto term(int termNo, String paid, String status) {
        return InstallmentTermDto.builder()
                .termNo(termNo)
                .dueDate(LocalDate.now().plusMonths(termNo))
                .amountDue(new BigDecimal("400.00"))
                .amountPaid(new BigDecimal(paid))
                .status(status)
                .build();
    }
}
