package ph.hardwareerp.billing.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import ph.hardwareerp.common.dto.billing.OrderBalance;
import ph.hardwareerp.common.dto.billing.PaymentDto;
import ph.hardwareerp.common.dto.billing.PaymentMethod;
import ph.hardwareerp.common.dto.billing.PaymentStatus;
import ph.hardwareerp.common.util.MoneyUtils;

import java.math.BigDecimal;
import java.util.Collection;

/**
 * Combines an order's grand total with its payments into the outstanding balance.
 *
 * Applied payments:
 * - RECEIVED payments of any method
 * - PENDING cash payments (reserved so the payer cannot stack submissions)
 *
 * PENDING cheques stay out of the balance until a reviewer confirms them.
 */
@Slf4j
@Service
public class BalanceCalculator {

    public OrderBalance calculate(BigDecimal grandTotal, Collection<PaymentDto> payments) {
        BigDecimal received = MoneyUtils.ZERO;
        BigDecimal pendingCash = MoneyUtils.ZERO;
        BigDecimal pendingCheque = MoneyUtils.ZERO;

        if (payments != null) {
            for (PaymentDto payment : payments) {
                BigDecimal amount = MoneyUtils.nonNegative(payment.getAmount());
                PaymentStatus status = payment.getStatus() != null ? payment.getStatus() : PaymentStatus.PENDING;

                if (status == PaymentStatus.RECEIVED) {
                    received = received.add(amount);
                } else if (status == PaymentStatus.PENDING) {
                    if (payment.getMethod() == PaymentMethod.CASH) {
                        pendingCash = pendingCash.add(amount);
                    } else {
                        pendingCheque = pendingCheque.add(amount);
                    }
                }
            }
        }

        BigDecimal total = MoneyUtils.nonNegative(grandTotal);
        BigDecimal applied = MoneyUtils.round2(received.add(pendingCash));
        BigDecimal balance = MoneyUtils.nonNegative(total.subtract(applied));

        log.debug("Balance: grandTotal={}, received={}, pendingCash={}, pendingCheque={}, balance={}",
                total, received, pendingCash, pendingCheque, balance);

        return OrderBalance.builder()
                .grandTotal(total)
                .receivedTotal(MoneyUtils.round2(received))
                .pendingCashTotal(MoneyUtils.round2(pendingCash))
                .pendingChequeTotal(MoneyUtils.round2(pendingCheque))
                .appliedTotal(applied)
                .balance(balance)
                .build();
    }
}
