package ph.hardwareerp.common.dto.billing;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Customer order as stored in the orders collection.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderDto {

    private String id;
    private String customerId;
    private String status;              // pending, completed, rejected

    @Builder.Default
    private List<OrderLineItemDto> items = new ArrayList<>();

    private BigDecimal salesTax;

    /**
     * Shipping fee from the logistics record. Null until a delivery is scheduled.
     */
    private BigDecimal shippingFee;

    /**
     * Pre-shipping total including financing interest. When present it replaces
     * the computed items total; shipping is still added on top.
     */
    private BigDecimal grandTotalOverride;

    private BigDecimal perTermAmount;
    private String terms;               // free text, e.g. "Net 30", "6 months"
    private String truckDeliveryId;
}
