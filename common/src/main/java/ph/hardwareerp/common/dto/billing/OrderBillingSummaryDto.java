package ph.hardwareerp.common.dto.billing;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Everything the payer and reviewer screens need for one order, computed fresh.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderBillingSummaryDto {

    private String orderId;
    private String customerId;
    private PaymentMode mode;
    private OrderTotals totals;
    private OrderBalance balance;
    private EqualizedSchedule schedule;
    private PaymentOptions options;
}
