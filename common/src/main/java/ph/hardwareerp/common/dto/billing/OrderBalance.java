package ph.hardwareerp.common.dto.billing;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Outstanding balance of an order derived from its grand total and payments.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderBalance {

    private BigDecimal grandTotal;
    private BigDecimal receivedTotal;
    private BigDecimal pendingCashTotal;

    /**
     * Pending cheque payments are shown but never applied until reviewed.
     */
    private BigDecimal pendingChequeTotal;

    private BigDecimal appliedTotal;        // receivedTotal + pendingCashTotal
    private BigDecimal balance;             // max(grandTotal - appliedTotal, 0)
}
