package ph.hardwareerp.common.dto.billing;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * One installment term as seen after equalization.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EqualizedTerm {

    private int termNo;

    @JsonFormat(pattern = "yyyy-MM-dd")
    private LocalDate dueDate;

    private BigDecimal amountDue;           // amountPaid + remaining for unpaid terms
    private BigDecimal amountPaid;
    private BigDecimal remaining;
    private boolean paid;
    private boolean overdue;

    /**
     * True for the catch-up term created when the stored schedule is exhausted.
     */
    private boolean synthesized;
}
