package ph.hardwareerp.billing.service;

import org.junit.jupiter.api.Test;
import ph.hardwareerp.common.dto.billing.EqualizedSchedule;
import ph.hardwareerp.common.dto.billing.EqualizedTerm;
import ph.hardwareerp.common.dto.billing.InstallmentTermDto;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InstallmentEqualizerTest {

    private static final LocalDate TODAY = LocalDate.of(2025, 6, 15);

    private final InstallmentEqualizer equalizer = new InstallmentEqualizer();

    @Test
    void equalize_ShouldPlaceRoundingRemainderOnLastTerm() {
        List<InstallmentTermDto> terms = List.of(
                term(1, "40.00", "0", "pending"),
                term(2, "40.00", "0", "pending"),
                term(3, "40.00", "0", "pending"));

        EqualizedSchedule schedule = equalizer.equalize(terms, new BigDecimal("100.00"), TODAY);

        assertEquals(List.of(new BigDecimal("33.33"), new BigDecimal("33.33"), new BigDecimal("33.34")),
                schedule.getRemainingAmounts());
        assertFalse(schedule.isCatchUp());
    }

    @Test
    void equalize_RemainingAmountsShouldAlwaysSumToBalance() {
        String[] balances = {"0.00", "0.01", "0.07", "1.00", "99.99", "100.00", "1234.56", "100000.01"};
        for (String raw : balances) {
            BigDecimal balance = new BigDecimal(raw);
            for (int n = 1; n <= 12; n++) {
                List<InstallmentTermDto> terms = new ArrayList<>();
                for (int i = 1; i <= n; i++) {
                    terms.add(term(i, "500.00", "0", "pending"));
                }

                EqualizedSchedule schedule = equalizer.equalize(terms, balance, TODAY);

                BigDecimal sum = schedule.getRemainingAmounts().stream()
                        .reduce(BigDecimal.ZERO, BigDecimal::add);
                assertEquals(0, sum.compareTo(balance), "balance " + raw + " over " + n + " terms");
                assertTrue(schedule.getRemainingAmounts().stream().allMatch(a -> a.signum() >= 0),
                        "negative share for balance " + raw + " over " + n + " terms");
            }
        }
    }

    @Test
    void equalize_ShouldKeepSharesNonNegativeForTinyBalances() {
        List<InstallmentTermDto> terms = new ArrayList<>();
        for (int i = 1; i <= 10; i++) {
            terms.add(term(i, "10.00", "0", "pending"));
        }

        EqualizedSchedule schedule = equalizer.equalize(terms, new BigDecimal("0.07"), TODAY);

        List<BigDecimal> shares = schedule.getRemainingAmounts();
        assertEquals(new BigDecimal("0.00"), shares.get(0));
        assertEquals(new BigDecimal("0.07"), shares.get(9));
    }

    @Test
    void equalize_ShouldSynthesizeCatchUpTermWhenScheduleExhausted() {
        List<InstallmentTermDto> terms = List.of(
                term(1, "500.00", "500.00", "paid"),
                term(2, "500.00", "500.00", "paid"));

        EqualizedSchedule schedule = equalizer.equalize(terms, new BigDecimal("250.00"), TODAY);

        assertTrue(schedule.isCatchUp());
        assertEquals(1, schedule.getUnpaidTerms().size());
        EqualizedTerm catchUp = schedule.getUnpaidTerms().get(0);
        assertEquals(3, catchUp.getTermNo());
        assertEquals(TODAY, catchUp.getDueDate());
        assertEquals(new BigDecimal("250.00"), catchUp.getRemaining());
        assertEquals(new BigDecimal("250.00"), catchUp.getAmountDue());
        assertTrue(catchUp.isSynthesized());
        assertEquals(3, schedule.getTerms().size());
    }

    @Test
    void equalize_ShouldSynthesizeFirstTermWhenNoScheduleExists() {
        EqualizedSchedule schedule = equalizer.equalize(List.of(), new BigDecimal("250.00"), TODAY);

        assertTrue(schedule.isCatchUp());
        assertEquals(1, schedule.getUnpaidTerms().get(0).getTermNo());
        assertEquals(List.of(new BigDecimal("250.00")), schedule.getRemainingAmounts());
    }

    @Test
    void equalize_ShouldReturnNothingWhenNoUnpaidTermsAndNothingOwed() {
        List<InstallmentTermDto> terms = List.of(term(1, "500.00", "500.00", "paid"));

        EqualizedSchedule schedule = equalizer.equalize(terms, BigDecimal.ZERO, TODAY);

        assertFalse(schedule.isCatchUp());
        assertTrue(schedule.getUnpaidTerms().isEmpty());
        assertNull(schedule.getNextUnpaid());
    }

    @Test
    void equalize_ShouldOverrideStaleDueAmountsAndKeepPaidTerms() {
        // Schedule built before a 300.00 shipping fee was added
        List<InstallmentTermDto> terms = List.of(
                term(1, "1000.00", "1000.00", "paid"),
                term(2, "1000.00", "400.00", "pending"),
                term(3, "1000.00", "0", "pending"));

        EqualizedSchedule schedule = equalizer.equalize(terms, new BigDecimal("1900.00"), TODAY);

        EqualizedTerm first = schedule.getTerms().get(0);
        assertTrue(first.isPaid());
        assertEquals(new BigDecimal("1000.00"), first.getAmountDue());

        EqualizedTerm second = schedule.getTerms().get(1);
        assertEquals(new BigDecimal("950.00"), second.getRemaining());
        assertEquals(new BigDecimal("1350.00"), second.getAmountDue());
        assertEquals(new BigDecimal("400.00"), second.getAmountPaid());

        assertEquals(new BigDecimal("950.00"), schedule.getTerms().get(2).getRemaining());
        assertEquals(new BigDecimal("3000.00"), schedule.getScheduledDue());
        assertEquals(new BigDecimal("1400.00"), schedule.getScheduledPaid());
    }

    @Test
    void equalize_ShouldTreatCoveredAmountAsPaidEvenWithoutStatus() {
        List<InstallmentTermDto> terms = List.of(
                term(1, "500.00", "500.00", "pending"),
                term(2, "500.00", "0", "pending"));

        EqualizedSchedule schedule = equalizer.equalize(terms, new BigDecimal("500.00"), TODAY);

        assertEquals(1, schedule.getUnpaidTerms().size());
        assertEquals(2, schedule.getNextUnpaid().getTermNo());
    }

    @Test
    void equalize_ShouldSortByTermNumber() {
        List<InstallmentTermDto> terms = List.of(
                term(3, "100.00", "0", "pending"),
                term(1, "100.00", "0", "pending"),
                term(2, "100.00", "0", "pending"));

        EqualizedSchedule schedule = equalizer.equalize(terms, new BigDecimal("0.05"), TODAY);

        assertEquals(List.of(1, 2, 3), schedule.getTerms().stream().map(EqualizedTerm::getTermNo).toList());
        assertEquals(new BigDecimal("0.02"), schedule.getTerms().get(0).getRemaining());
        assertEquals(new BigDecimal("0.01"), schedule.getTerms().get(2).getRemaining());
    }

    @Test
    void equalize_ShouldClampNegativeBalance() {
        List<InstallmentTermDto> terms = List.of(term(1, "100.00", "0", "pending"));

        EqualizedSchedule schedule = equalizer.equalize(terms, new BigDecimal("-20.00"), TODAY);

        assertEquals(new BigDecimal("0.00"), schedule.getBalance());
        assertEquals(List.of(new BigDecimal("0.00")), schedule.getRemainingAmounts());
    }

    @Test
    void equalize_ShouldFlagOverdueTerms() {
        InstallmentTermDto late = term(1, "100.00", "0", "pending");
        late.setDueDate(TODAY.minusDays(1));
        InstallmentTermDto dueToday = term(2, "100.00", "0", "pending");
        dueToday.setDueDate(TODAY);

        EqualizedSchedule schedule = equalizer.equalize(List.of(late, dueToday), new BigDecimal("200.00"), TODAY);

        assertTrue(schedule.getTerms().get(0).isOverdue());
        assertFalse(schedule.getTerms().get(1).isOverdue());
        assertEquals(1, schedule.getNextUnpaid().getTermNo());
    }

    @Test
    void equalize_ShouldBeIdempotentAndLeaveStoredRowsUntouched() {
        List<InstallmentTermDto> terms = List.of(
                term(1, "400.00", "0", "pending"),
                term(2, "400.00", "0", "pending"));

        EqualizedSchedule first = equalizer.equalize(terms, new BigDecimal("1000.00"), TODAY);
        EqualizedSchedule second = equalizer.equalize(terms, new BigDecimal("1000.00"), TODAY);

        assertEquals(first, second);
        assertEquals(new BigDecimal("400.00"), terms.get(0).getAmountDue());
    }

    private static InstallmentTermDto term(int termNo, String due, String paid, String status) {
        return InstallmentTermDto.builder()
                .orderId("order-1")
                .termNo(termNo)
                .dueDate(TODAY.plusMonths(termNo))
                .amountDue(new BigDecimal(due))
                .amountPaid(new BigDecimal(paid))
                .status(status)
                .build();
    }
}
