package ph.hardwareerp.common.dto.billing;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Outcome of checking an entered amount against the payment options.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AmountCheck {

    private BigDecimal amount;
    private boolean valid;
    private AmountRejection rejection;      // null when valid

    /**
     * Number of whole terms the amount covers (credit mode), 0 otherwise.
     */
    private int termsCovered;

    private String message;
}
