package ph.hardwareerp.billing.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;
import ph.hardwareerp.common.dto.billing.AmountCheck;
import ph.hardwareerp.common.dto.billing.AmountRejection;
import ph.hardwareerp.common.dto.billing.EqualizedSchedule;
import ph.hardwareerp.common.dto.billing.InstallmentTermDto;
import ph.hardwareerp.common.dto.billing.PaymentMode;
import ph.hardwareerp.common.dto.billing.PaymentOptions;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PaymentAmountValidatorTest {

    private static final LocalDate TODAY = LocalDate.of(2025, 6, 15);

    private final InstallmentEqualizer equalizer = new InstallmentEqualizer();
    private PaymentAmountValidator validator;

    @BeforeEach
    void setUp() {
        validator = new PaymentAmountValidator();
        ReflectionTestUtils.setField(validator, "cashStep", new BigDecimal("1000.00"));
        ReflectionTestUtils.setField(validator, "minCash", new BigDecimal("0.01"));
    }

    @Test
    void options_ShouldListPrefixSumsForCreditOrders() {
        PaymentOptions options = creditOptions("1500.00", 3);

        assertEquals(List.of(new BigDecimal("500.00"), new BigDecimal("1000.00"), new BigDecimal("1500.00")),
                options.getPrefixSums());
        assertEquals(3, options.getMaxMultiplier());
        assertEquals(1, options.getHalfMultiplier());
        assertEquals(new BigDecimal("500.00"), options.getHalfAmount());
        assertEquals(new BigDecimal("1500.00"), options.getFullAmount());
    }

    @Test
    void check_ShouldAcceptOnlyWholeTermsInCreditMode() {
        PaymentOptions options = creditOptions("1500.00", 3);

        AmountCheck two = validator.check(options, new BigDecimal("1000.00"));
        assertTrue(two.isValid());
        assertEquals(2, two.getTermsCovered());

        AmountCheck partial = validator.check(options, new BigDecimal("750.00"));
        assertFalse(partial.isValid());
        assertEquals(AmountRejection.NOT_A_TERM_MULTIPLE, partial.getRejection());

        assertEquals(AmountRejection.EXCEEDS_BALANCE,
                validator.check(options, new BigDecimal("2000.00")).getRejection());
    }

    @Test
    void check_ShouldAcceptFullBalanceWithUnevenShares() {
        PaymentOptions options = creditOptions("100.00", 3);

        assertEquals(List.of(new BigDecimal("33.33"), new BigDecimal("66.66"), new BigDecimal("100.00")),
                options.getPrefixSums());
        assertTrue(validator.check(options, new BigDecimal("66.66")).isValid());
        assertTrue(validator.check(options, new BigDecimal("100")).isValid());
        assertFalse(validator.check(options, new BigDecimal("50.00")).isValid());
    }

    @Test
    void check_ShouldAcceptAnyAmountUpToBalanceInCashMode() {
        PaymentOptions options = cashOptions("1200.00");

        assertTrue(validator.check(options, new BigDecimal("0.01")).isValid());
        assertTrue(validator.check(options, new BigDecimal("437.19")).isValid());
        assertTrue(validator.check(options, new BigDecimal("1200.00")).isValid());

        assertEquals(AmountRejection.NON_POSITIVE, validator.check(options, BigDecimal.ZERO).getRejection());
        assertEquals(AmountRejection.NON_POSITIVE, validator.check(options, new BigDecimal("-5")).getRejection());
        assertEquals(AmountRejection.NON_POSITIVE, validator.check(options, null).getRejection());
        assertEquals(AmountRejection.EXCEEDS_BALANCE,
                validator.check(options, new BigDecimal("1200.01")).getRejection());
    }

    @Test
    void check_ShouldRejectEverythingWhenOrderNotPayable() {
        EqualizedSchedule schedule = equalizer.equalize(terms(2), new BigDecimal("1000.00"), TODAY);
        PaymentOptions options = validator.options(schedule, PaymentMode.CASH, false);

        assertFalse(options.isPayable());
        assertEquals(new BigDecimal("0.00"), options.getFullAmount());
        AmountCheck check = validator.check(options, new BigDecimal("100.00"));
        assertFalse(check.isValid());
        assertEquals(AmountRejection.NOT_PAYABLE, check.getRejection());
    }

    @Test
    void options_ShouldNotBePayableWhenNothingOwed() {
        EqualizedSchedule schedule = equalizer.equalize(List.of(), BigDecimal.ZERO, TODAY);

        assertFalse(validator.options(schedule, PaymentMode.CREDIT, true).isPayable());
    }

    @Test
    void options_ShouldOfferHalfOfScheduleForCreditOrders() {
        PaymentOptions options = creditOptions("2000.00", 4);

        assertEquals(2, options.getHalfMultiplier());
        assertEquals(new BigDecimal("1000.00"), options.getHalfAmount());
    }

    @Test
    void options_ShouldOfferHalfBalanceForCashOrders() {
        assertEquals(new BigDecimal("600.00"), cashOptions("1200.00").getHalfAmount());
        assertEquals(new BigDecimal("0.01"), cashOptions("0.01").getHalfAmount());
    }

    @Test
    void catchUp_ShouldAcceptOnlyFullBalance() {
        List<InstallmentTermDto> paid = List.of(
                InstallmentTermDto.builder().termNo(1).amountDue(new BigDecimal("500.00"))
                        .amountPaid(new BigDecimal("500.00")).status("paid").build());
        EqualizedSchedule schedule = equalizer.equalize(paid, new BigDecimal("250.00"), TODAY);

        PaymentOptions options = validator.options(schedule, PaymentMode.CREDIT, true);

        assertTrue(options.isCatchUp());
        assertEquals(new BigDecimal("125.00"), options.getHalfAmount());
        assertTrue(validator.check(options, new BigDecimal("250.00")).isValid());

        AmountCheck half = validator.check(options, new BigDecimal("125.00"));
        assertFalse(half.isValid());
        assertEquals(AmountRejection.NOT_A_TERM_MULTIPLE, half.getRejection());
        assertFalse(validator.check(options, new BigDecimal("100.00")).isValid());
    }

    @Test
    void catchUp_ShouldRejectHalfWhenNoScheduleExists() {
        EqualizedSchedule schedule = equalizer.equalize(List.of(), new BigDecimal("250.00"), TODAY);
        PaymentOptions options = validator.options(schedule, PaymentMode.CREDIT, true);

        assertEquals(List.of(new BigDecimal("250.00")), options.getPrefixSums());
        AmountCheck half = validator.check(options, new BigDecimal("125.00"));
        assertFalse(half.isValid());
        assertEquals(0, half.getTermsCovered());
        assertTrue(validator.check(options, new BigDecimal("250.00")).isValid());
    }

    @Test
    void amountForMultiplier_ShouldClampToAvailableTerms() {
        PaymentOptions options = creditOptions("1500.00", 3);

        assertEquals(new BigDecimal("500.00"), validator.amountForMultiplier(options, 0));
        assertEquals(new BigDecimal("1000.00"), validator.amountForMultiplier(options, 2));
        assertEquals(new BigDecimal("1500.00"), validator.amountForMultiplier(options, 9));
    }

    @Test
    void stepCash_ShouldStayWithinMinimumAndBalance() {
        PaymentOptions options = cashOptions("1200.00");

        assertEquals(new BigDecimal("1000.00"), validator.stepCash(options, BigDecimal.ZERO, true));
        assertEquals(new BigDecimal("1200.00"), validator.stepCash(options, new BigDecimal("1000.00"), true));
        assertEquals(new BigDecimal("200.00"), validator.stepCash(options, new BigDecimal("1200.00"), false));
        assertEquals(new BigDecimal("0.01"), validator.stepCash(options, new BigDecimal("200.00"), false));
    }

    private PaymentOptions creditOptions(String balance, int termCount) {
        EqualizedSchedule schedule = equalizer.equalize(terms(termCount), new BigDecimal(balance), TODAY);
        return validator.options(schedule, PaymentMode.CREDIT, true);
    }

    private PaymentOptions cashOptions(String balance) {
        EqualizedSchedule schedule = equalizer.equalize(List.of(), new BigDecimal(balance), TODAY);
        return validator.options(schedule, PaymentMode.CASH, true);
    }

    private static List<InstallmentTermDto> terms(int count) {
        List<InstallmentTermDto> terms = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            terms.add(InstallmentTermDto.builder()
                    .termNo(i)
                    .dueDate(TODAY.plusMonths(i))
                    .amountDue(new BigDecimal("500.00"))
                    .amountPaid(BigDecimal.ZERO)
                    .status("pending")
                    .build());
        }
        return terms;
    }
}
