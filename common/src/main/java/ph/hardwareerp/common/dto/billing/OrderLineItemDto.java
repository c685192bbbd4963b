package ph.hardwareerp.common.dto.billing;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * One priced line of an order.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderLineItemDto {

    private String productName;
    private BigDecimal quantity;
    private BigDecimal unitPrice;
    private BigDecimal discountPercent;
}
