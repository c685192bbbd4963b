package ph.hardwareerp.common.dto.billing;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Installment schedule re-derived from the current balance.
 * Summing {@link #getRemainingAmounts()} gives {@link #getBalance()} to the cent.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EqualizedSchedule {

    private BigDecimal balance;

    @Builder.Default
    private List<EqualizedTerm> terms = new ArrayList<>();

    private boolean catchUp;

    // Stored schedule totals, before equalization
    private BigDecimal scheduledDue;
    private BigDecimal scheduledPaid;

    private EqualizedTerm nextUnpaid;

    @JsonIgnore
    public List<EqualizedTerm> getUnpaidTerms() {
        return terms.stream().filter(t -> !t.isPaid()).toList();
    }

    /**
     * Remaining amount per unpaid term, in term order.
     */
    @JsonIgnore
    public List<BigDecimal> getRemainingAmounts() {
        return getUnpaidTerms().stream().map(EqualizedTerm::getRemaining).toList();
    }
}
