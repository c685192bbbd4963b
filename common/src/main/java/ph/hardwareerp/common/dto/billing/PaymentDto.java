package ph.hardwareerp.common.dto.billing;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Payment attempt against an order.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class PaymentDto {

    private String id;
    private String orderId;
    private String customerId;
    private BigDecimal amount;
    private PaymentMethod method;
    private PaymentStatus status;

    // Cheque facts, optional for cash
    private String chequeNumber;
    private String bankName;

    @JsonFormat(pattern = "yyyy-MM-dd")
    private LocalDate chequeDate;

    /**
     * Reference to the uploaded receipt image. Opaque to billing.
     */
    private String receiptReference;

    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    private LocalDateTime createdAt;

    private String reviewedBy;

    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    private LocalDateTime reviewedAt;
}
