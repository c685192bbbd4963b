package ph.hardwareerp.common.dto.billing;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Payer's submission for one order.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubmitPaymentRequest {

    @NotBlank(message = "Order ID is required")
    private String orderId;

    @NotBlank(message = "Customer ID is required")
    private String customerId;

    @NotNull(message = "Amount is required")
    @Positive(message = "Amount must be positive")
    private BigDecimal amount;

    /**
     * Required for cheque payments.
     */
    private String chequeNumber;
    private String bankName;
    private LocalDate chequeDate;
    private String receiptReference;
}
