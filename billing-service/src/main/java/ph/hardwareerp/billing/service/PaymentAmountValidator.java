package ph.hardwareerp.billing.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import ph.hardwareerp.common.dto.billing.AmountCheck;
import ph.hardwareerp.common.dto.billing.AmountRejection;
import ph.hardwareerp.common.dto.billing.EqualizedSchedule;
import ph.hardwareerp.common.dto.billing.PaymentMode;
import ph.hardwareerp.common.dto.billing.PaymentOptions;
import ph.hardwareerp.common.util.MoneyUtils;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * Decides which amounts a payer may submit.
 *
 * CASH: any amount with 0 < amount <= balance.
 *
 * CREDIT: only whole terms. Valid amounts are the prefix sums of the equalized
 * remaining amounts (term 1, terms 1..2, ..., all terms) or exactly the balance.
 * Anything else would leave a partial term behind and is rejected before submission.
 *
 * Orders without a shipping fee are not payable at all.
 */
@Slf4j
@Service
public class PaymentAmountValidator {

    @Value("${billing.cash-step:1000.00}")
    private BigDecimal cashStep;

    @Value("${billing.min-cash:0.01}")
    private BigDecimal minCash;

    /**
     * Build the payment options for one order.
     *
     * @param schedule Equalized schedule (its balance is the amount owed)
     * @param mode Customer payment mode
     * @param payable False while the order has no shipping fee
     */
    public PaymentOptions options(EqualizedSchedule schedule, PaymentMode mode, boolean payable) {
        BigDecimal balance = MoneyUtils.nonNegative(schedule != null ? schedule.getBalance() : null);
        boolean open = payable && balance.signum() > 0;

        if (!open) {
            log.debug("Order not payable: shippingFeeSet={}, balance={}", payable, balance);
            return PaymentOptions.builder()
                    .mode(mode)
                    .balance(balance)
                    .payable(false)
                    .fullAmount(MoneyUtils.ZERO)
                    .halfAmount(MoneyUtils.ZERO)
                    .build();
        }

        if (mode == PaymentMode.CASH) {
            BigDecimal half = MoneyUtils.divide(balance, 2, RoundingMode.HALF_UP).max(minCash);
            return PaymentOptions.builder()
                    .mode(mode)
                    .balance(balance)
                    .payable(true)
                    .cashStep(MoneyUtils.round2(cashStep))
                    .minCash(MoneyUtils.round2(minCash))
                    .fullAmount(balance)
                    .halfAmount(half.min(balance))
                    .build();
        }

        List<BigDecimal> prefixSums = prefixSums(schedule.getRemainingAmounts());
        int n = prefixSums.size();

        int maxMultiplier = 0;
        for (int k = 1; k <= n; k++) {
            if (MoneyUtils.notAbove(prefixSums.get(k - 1), balance)) {
                maxMultiplier = k;
            }
        }
        maxMultiplier = Math.max(1, maxMultiplier);
        int halfMultiplier = Math.max(1, n / 2);

        // Catch-up half is a display hint; check() still takes only the full balance there
        BigDecimal halfAmount = schedule.isCatchUp()
                ? MoneyUtils.divide(balance, 2, RoundingMode.HALF_UP).max(MoneyUtils.ONE_CENT)
                : prefixSums.get(Math.min(halfMultiplier, maxMultiplier) - 1);

        return PaymentOptions.builder()
                .mode(mode)
                .balance(balance)
                .payable(true)
                .prefixSums(prefixSums)
                .maxMultiplier(maxMultiplier)
                .halfMultiplier(halfMultiplier)
                .catchUp(schedule.isCatchUp())
                .fullAmount(balance)
                .halfAmount(halfAmount)
                .build();
    }

    /**
     * Check an entered amount. No state is touched.
     */
    public AmountCheck check(PaymentOptions options, BigDecimal amount) {
        if (options == null || !options.isPayable()) {
            return reject(amount, AmountRejection.NOT_PAYABLE,
                    "Order is not payable yet (no shipping fee or nothing owed)");
        }
        if (amount == null || MoneyUtils.round2(amount).signum() <= 0) {
            return reject(amount, AmountRejection.NON_POSITIVE, "Amount must be greater than 0");
        }
        if (!MoneyUtils.notAbove(amount, options.getBalance())) {
            return reject(amount, AmountRejection.EXCEEDS_BALANCE,
                    "Amount exceeds the remaining balance of " + options.getBalance());
        }

        if (options.getMode() == PaymentMode.CASH) {
            return accept(amount, 0);
        }

        List<BigDecimal> prefixSums = options.getPrefixSums();
        for (int k = 1; k <= prefixSums.size(); k++) {
            if (MoneyUtils.sameAmount(amount, prefixSums.get(k - 1))) {
                return accept(amount, k);
            }
        }
        if (MoneyUtils.sameAmount(amount, options.getBalance())) {
            return accept(amount, prefixSums.size());
        }

        return reject(amount, AmountRejection.NOT_A_TERM_MULTIPLE,
                "Amount must cover whole installment terms or the full balance");
    }

    /**
     * Amount for paying {@code multiplier} terms, clamped to [1, maxMultiplier].
     */
    public BigDecimal amountForMultiplier(PaymentOptions options, int multiplier) {
        if (!options.isPayable() || options.getPrefixSums().isEmpty()) {
            return MoneyUtils.ZERO;
        }
        int clamped = Math.max(1, Math.min(multiplier, options.getMaxMultiplier()));
        return options.getPrefixSums().get(clamped - 1);
    }

    /**
     * Move a cash amount one step up or down, clamped to [minCash, balance].
     */
    public BigDecimal stepCash(PaymentOptions options, BigDecimal current, boolean increase) {
        if (!options.isPayable()) {
            return MoneyUtils.ZERO;
        }
        BigDecimal balance = options.getBalance();
        BigDecimal step = options.getCashStep() != null ? options.getCashStep() : MoneyUtils.round2(cashStep);
        BigDecimal floor = options.getMinCash() != null ? options.getMinCash() : MoneyUtils.round2(minCash);
        BigDecimal cur = MoneyUtils.nonNegative(current);

        BigDecimal next = increase ? cur.add(step).min(balance) : cur.subtract(step).max(floor);
        return MoneyUtils.round2(next.min(balance));
    }

    private List<BigDecimal> prefixSums(List<BigDecimal> remaining) {
        List<BigDecimal> sums = new ArrayList<>(remaining.size());
        BigDecimal running = MoneyUtils.ZERO;
        for (BigDecimal amount : remaining) {
            running = MoneyUtils.round2(running.add(amount));
            sums.add(running);
        }
        return sums;
    }

    private AmountCheck accept(BigDecimal amount, int termsCovered) {
        return AmountCheck.builder()
                .amount(MoneyUtils.round2(amount))
                .valid(true)
                .termsCovered(termsCovered)
                .build();
    }

    private AmountCheck reject(BigDecimal amount, AmountRejection rejection, String message) {
        log.debug("Rejected amount {}: {}", amount, rejection);
        return AmountCheck.builder()
                .amount(amount)
                .valid(false)
                .rejection(rejection)
                .message(message)
                .build();
    }
}
