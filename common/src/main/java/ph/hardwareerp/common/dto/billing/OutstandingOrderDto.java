package ph.hardwareerp.common.dto.billing;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Completed order that still has money owed on it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OutstandingOrderDto {

    private String orderId;
    private String customerId;
    private BigDecimal grandTotal;
    private BigDecimal balance;
    private boolean payable;
}
