package ph.hardwareerp.common.dto.billing;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * What a payer may submit for one order. Drives the stepper and multiplier controls.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentOptions {

    private PaymentMode mode;
    private BigDecimal balance;

    /**
     * False when the order has no shipping fee yet or nothing is owed.
     */
    private boolean payable;

    // Credit mode
    @Builder.Default
    private List<BigDecimal> prefixSums = new ArrayList<>();
    private int maxMultiplier;
    private int halfMultiplier;
    private boolean catchUp;

    // Cash mode
    private BigDecimal cashStep;
    private BigDecimal minCash;

    // Shortcut amounts
    private BigDecimal fullAmount;
    private BigDecimal halfAmount;
}
