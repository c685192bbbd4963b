package ph.hardwareerp.common.dto.billing;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Stored installment row created by the scheduling process at order creation.
 * Read-only for billing.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InstallmentTermDto {

    private String id;
    private String orderId;
    private int termNo;

    @JsonFormat(pattern = "yyyy-MM-dd")
    private LocalDate dueDate;

    private BigDecimal amountDue;
    private BigDecimal amountPaid;
    private String status;              // pending, paid
}
