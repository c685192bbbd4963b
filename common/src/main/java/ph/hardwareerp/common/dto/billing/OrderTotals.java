package ph.hardwareerp.common.dto.billing;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Order grand total breakdown. All amounts rounded to 2 decimals.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderTotals {

    private BigDecimal subtotal;
    private BigDecimal discountTotal;
    private BigDecimal salesTax;
    private BigDecimal grandTotalExclShipping;
    private BigDecimal shippingFee;
    private BigDecimal grandTotal;          // grandTotalExclShipping + shippingFee
    private BigDecimal perTermAmount;
}
