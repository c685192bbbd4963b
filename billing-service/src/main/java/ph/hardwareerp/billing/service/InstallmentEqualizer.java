package ph.hardwareerp.billing.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import ph.hardwareerp.common.dto.billing.EqualizedSchedule;
import ph.hardwareerp.common.dto.billing.EqualizedTerm;
import ph.hardwareerp.common.dto.billing.InstallmentTermDto;
import ph.hardwareerp.common.util.MoneyUtils;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Re-derives the remaining amount per unpaid installment term from the current balance.
 *
 * Stored due amounts go stale as shipping fees and payments arrive, so they are
 * never trusted. The current balance is spread evenly over the unpaid terms in
 * term order, and the rounding remainder lands on the last unpaid term:
 *
 *   balance 100.00 over 3 terms -> 33.33, 33.33, 33.34
 *
 * When every stored term is paid but money is still owed (a late shipping fee),
 * a single catch-up term due today carries the whole balance.
 *
 * Produces a view only. Stored rows are not modified.
 */
@Slf4j
@Service
public class InstallmentEqualizer {

    public EqualizedSchedule equalize(List<InstallmentTermDto> stored, BigDecimal balance, LocalDate today) {
        BigDecimal owed = MoneyUtils.nonNegative(balance);

        List<InstallmentTermDto> sorted = stored == null ? List.of() : stored.stream()
                .sorted(Comparator.comparingInt(InstallmentTermDto::getTermNo))
                .toList();

        BigDecimal scheduledDue = MoneyUtils.ZERO;
        BigDecimal scheduledPaid = MoneyUtils.ZERO;
        List<InstallmentTermDto> unpaid = new ArrayList<>();
        for (InstallmentTermDto term : sorted) {
            scheduledDue = scheduledDue.add(MoneyUtils.nonNegative(term.getAmountDue()));
            scheduledPaid = scheduledPaid.add(MoneyUtils.nonNegative(term.getAmountPaid()));
            if (!isPaid(term)) {
                unpaid.add(term);
            }
        }

        List<EqualizedTerm> terms = new ArrayList<>();
        boolean catchUp = false;

        if (unpaid.isEmpty()) {
            sorted.forEach(t -> terms.add(passThrough(t)));
            if (owed.signum() > 0) {
                int lastTermNo = sorted.isEmpty() ? 0 : sorted.get(sorted.size() - 1).getTermNo();
                terms.add(catchUpTerm(lastTermNo + 1, owed, today));
                catchUp = true;
                log.debug("Schedule exhausted, synthesized catch-up term {} for {}", lastTermNo + 1, owed);
            }
        } else {
            List<BigDecimal> shares = distribute(owed, unpaid.size());
            int next = 0;
            for (InstallmentTermDto term : sorted) {
                if (isPaid(term)) {
                    terms.add(passThrough(term));
                } else {
                    terms.add(equalizedTerm(term, shares.get(next++), today));
                }
            }
            log.debug("Equalized {} over {} unpaid terms: {}", owed, unpaid.size(), shares);
        }

        EqualizedTerm nextUnpaid = terms.stream().filter(t -> !t.isPaid()).findFirst().orElse(null);

        return EqualizedSchedule.builder()
                .balance(owed)
                .terms(terms)
                .catchUp(catchUp)
                .scheduledDue(MoneyUtils.round2(scheduledDue))
                .scheduledPaid(MoneyUtils.round2(scheduledPaid))
                .nextUnpaid(nextUnpaid)
                .build();
    }

    /**
     * Split {@code amount} into {@code parts} cent amounts summing exactly to {@code amount},
     * remainder on the last part.
     */
    List<BigDecimal> distribute(BigDecimal amount, int parts) {
        if (parts <= 0) {
            return List.of();
        }

        BigDecimal per = MoneyUtils.divide(amount, parts, RoundingMode.HALF_UP);
        BigDecimal last = amount.subtract(per.multiply(BigDecimal.valueOf(parts - 1L)));

        // Rounding up on tiny balances can overshoot; fall back to whole cents rounded down.
        if (last.signum() < 0) {
            per = MoneyUtils.divide(amount, parts, RoundingMode.DOWN);
            last = amount.subtract(per.multiply(BigDecimal.valueOf(parts - 1L)));
        }

        List<BigDecimal> shares = new ArrayList<>(parts);
        for (int i = 0; i < parts - 1; i++) {
            shares.add(per);
        }
        shares.add(MoneyUtils.round2(last));
        return shares;
    }

    /**
     * A term counts as paid when flagged so or when its paid amount covers the due amount.
     */
    public static boolean isPaid(InstallmentTermDto term) {
        if ("paid".equalsIgnoreCase(term.getStatus())) {
            return true;
        }
        BigDecimal due = MoneyUtils.round2(term.getAmountDue());
        BigDecimal paid = MoneyUtils.round2(term.getAmountPaid());
        return paid.add(MoneyUtils.EPSILON).compareTo(due) >= 0;
    }

    private EqualizedTerm passThrough(InstallmentTermDto term) {
        return EqualizedTerm.builder()
                .termNo(term.getTermNo())
                .dueDate(term.getDueDate())
                .amountDue(MoneyUtils.round2(term.getAmountDue()))
                .amountPaid(MoneyUtils.round2(term.getAmountPaid()))
                .remaining(MoneyUtils.ZERO)
                .paid(true)
                .overdue(false)
                .synthesized(false)
                .build();
    }

    private EqualizedTerm equalizedTerm(InstallmentTermDto term, BigDecimal remaining, LocalDate today) {
        BigDecimal paid = MoneyUtils.nonNegative(term.getAmountPaid());
        return EqualizedTerm.builder()
                .termNo(term.getTermNo())
                .dueDate(term.getDueDate())
                .amountDue(MoneyUtils.round2(paid.add(remaining)))
                .amountPaid(paid)
                .remaining(remaining)
                .paid(false)
                .overdue(isOverdue(term.getDueDate(), today))
                .synthesized(false)
                .build();
    }

    private EqualizedTerm catchUpTerm(int termNo, BigDecimal balance, LocalDate today) {
        return EqualizedTerm.builder()
                .termNo(termNo)
                .dueDate(today)
                .amountDue(balance)
                .amountPaid(MoneyUtils.ZERO)
                .remaining(balance)
                .paid(false)
                .overdue(false)
                .synthesized(true)
                .build();
    }

    private boolean isOverdue(LocalDate dueDate, LocalDate today) {
        return dueDate != null && today != null && dueDate.isBefore(today);
    }
}
