package ph.hardwareerp.billing.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import ph.hardwareerp.common.dto.billing.OrderDto;
import ph.hardwareerp.common.dto.billing.OrderLineItemDto;
import ph.hardwareerp.common.dto.billing.OrderTotals;
import ph.hardwareerp.common.util.MoneyUtils;

import java.math.BigDecimal;
import java.util.List;

/**
 * Derives an order's grand total from its line items, tax and shipping fee.
 *
 * Formula: grandTotal = max(subtotal - discountTotal, 0) + salesTax + shippingFee
 *
 * When the order carries a grand total override (financed orders with interest),
 * the override replaces the items-plus-tax part and shipping is still added.
 * Malformed values are clamped to zero, never thrown.
 */
@Slf4j
@Service
public class OrderLedgerService {

    private static final BigDecimal MAX_DISCOUNT_PERCENT = BigDecimal.valueOf(100);

    /**
     * Compute totals using the shipping fee stored on the order.
     */
    public OrderTotals compute(OrderDto order) {
        return compute(order, order != null ? order.getShippingFee() : null);
    }

    /**
     * Compute totals with an externally supplied shipping fee.
     *
     * @param order Order with line items
     * @param shippingFee Fee from the logistics record, null while unscheduled
     */
    public OrderTotals compute(OrderDto order, BigDecimal shippingFee) {
        List<OrderLineItemDto> items = order != null && order.getItems() != null
                ? order.getItems()
                : List.of();

        // Line amounts are summed exactly and rounded once per total
        BigDecimal subtotal = BigDecimal.ZERO;
        BigDecimal discountTotal = BigDecimal.ZERO;

        for (OrderLineItemDto item : items) {
            BigDecimal lineGross = lineGross(item);
            subtotal = subtotal.add(lineGross);
            discountTotal = discountTotal.add(lineGross.multiply(discountPercent(item)).movePointLeft(2));
        }

        subtotal = MoneyUtils.round2(subtotal);
        discountTotal = MoneyUtils.round2(discountTotal);
        BigDecimal salesTax = MoneyUtils.nonNegative(order != null ? order.getSalesTax() : null);

        BigDecimal computedExclShipping = MoneyUtils.nonNegative(subtotal.subtract(discountTotal)).add(salesTax);
        BigDecimal grandTotalExclShipping = order != null && order.getGrandTotalOverride() != null
                ? MoneyUtils.nonNegative(order.getGrandTotalOverride())
                : MoneyUtils.round2(computedExclShipping);

        BigDecimal fee = MoneyUtils.nonNegative(shippingFee);
        BigDecimal grandTotal = MoneyUtils.round2(grandTotalExclShipping.add(fee));

        log.debug("Order {} totals: subtotal={}, discount={}, tax={}, shipping={}, grandTotal={}",
                order != null ? order.getId() : null, subtotal, discountTotal, salesTax, fee, grandTotal);

        return OrderTotals.builder()
                .subtotal(subtotal)
                .discountTotal(discountTotal)
                .salesTax(salesTax)
                .grandTotalExclShipping(grandTotalExclShipping)
                .shippingFee(fee)
                .grandTotal(grandTotal)
                .perTermAmount(MoneyUtils.nonNegative(order != null ? order.getPerTermAmount() : null))
                .build();
    }

    /**
     * An order only becomes payable once logistics has set a shipping fee.
     */
    public boolean isPayable(OrderTotals totals) {
        return totals != null && MoneyUtils.isPositive(totals.getShippingFee());
    }

    private BigDecimal lineGross(OrderLineItemDto item) {
        BigDecimal quantity = clampZero(item.getQuantity());
        BigDecimal unitPrice = clampZero(item.getUnitPrice());
        return quantity.multiply(unitPrice);
    }

    private BigDecimal discountPercent(OrderLineItemDto item) {
        BigDecimal pct = clampZero(item.getDiscountPercent());
        return pct.min(MAX_DISCOUNT_PERCENT);
    }

    private BigDecimal clampZero(BigDecimal value) {
        return value == null || value.signum() < 0 ? BigDecimal.ZERO : value;
    }
}
