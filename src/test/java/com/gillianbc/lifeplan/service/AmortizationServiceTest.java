package com.gillianbc.lifeplan.service;

import com.gillianbc.lifeplan.InvalidInputException;
import com.gillianbc.lifeplan.model.Debt;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AmortizationServiceTest {

    private final AmortizationService service = new AmortizationService();

    private static Debt debt(String principal, String rate, String payment, int monthsRemaining) {
        return Debt.builder()
                .id("d1")
                .name("Loan")
                .principal(new BigDecimal(principal))
                .interestRate(new BigDecimal(rate))
                .minimumPayment(new BigDecimal(payment))
                .monthsRemaining(monthsRemaining)
                .build();
    }

    @Test
    @DisplayName("Zero rate payment is principal over term")
    void monthlyPayment_zeroRate() {
        assertEquals(new BigDecimal("1000.00"), service.monthlyPayment(new BigDecimal("12000"), BigDecimal.ZERO, 12));
    }

    @Test
    @DisplayName("Zero rate payment rounds up to the next cent")
    void monthlyPayment_zeroRate_roundsUp() {
        assertEquals(new BigDecimal("33.34"), service.monthlyPayment(new BigDecimal("100"), BigDecimal.ZERO, 3));
    }

    @Test
    @DisplayName("Level payment clears a 30-year mortgage in exactly the term")
    void amortizationSchedule_clearsWithinTerm() {
        BigDecimal principal = new BigDecimal("200000");
        BigDecimal principalPaid = BigDecimal.ZERO;
        AmortizationEntry last = null;
        int count = 0;
        for (AmortizationEntry entry : service.amortizationSchedule(principal, new BigDecimal("0.06"), 360)) {
            principalPaid = principalPaid.add(entry.getPrincipal());
            last = entry;
            count++;
        }
        assertEquals(new BigDecimal("0.00"), last.getBalance());
        assertTrue(count <= 360);
        assertEquals(0, principal.compareTo(principalPaid));
    }

    @Test
    @DisplayName("Every month of a schedule satisfies payment = principal + interest")
    void amortizationSchedule_paymentIdentity() {
        for (AmortizationEntry entry : service.amortizationSchedule(new BigDecimal("25000"), new BigDecimal("0.05"), 60)) {
            assertEquals(0, entry.getPayment().compareTo(entry.getPrincipal().add(entry.getInterest())), "month " + entry.getMonth());
            assertTrue(entry.getBalance().signum() >= 0);
        }
    }

    @Test
    @DisplayName("Extra payments shorten the schedule")
    void amortizationSchedule_extraPayment_shorter() {
        int standard = 0;
        for (AmortizationEntry ignored : service.amortizationSchedule(new BigDecimal("25000"), new BigDecimal("0.05"), 60)) {
            standard++;
        }
        int accelerated = 0;
        for (AmortizationEntry ignored : service.amortizationSchedule(new BigDecimal("25000"), new BigDecimal("0.05"), 60, new BigDecimal("200"))) {
            accelerated++;
        }
        assertEquals(60, standard);
        assertTrue(accelerated < standard);
    }

    @Test
    @DisplayName("A schedule can be iterated more than once")
    void amortizationSchedule_restartable() {
        Iterable<AmortizationEntry> schedule = service.amortizationSchedule(new BigDecimal("1200"), BigDecimal.ZERO, 12);
        int first = 0;
        for (AmortizationEntry ignored : schedule) {
            first++;
        }
        int second = 0;
        for (AmortizationEntry ignored : schedule) {
            second++;
        }
        assertEquals(12, first);
        assertEquals(first, second);
    }

    @Test
    @DisplayName("Open-ended debt pays off mid-year and reports the month")
    void debtYear_midYearPayoff() {
        DebtYearResult result = service.debtYear(debt("500", "0", "100", 0), new BigDecimal("500"));
        assertTrue(result.isPaidOff());
        assertEquals(5, result.getPayoffMonth());
        assertEquals(new BigDecimal("0.00"), result.getEndBalance());
        assertEquals(new BigDecimal("500.00"), result.getTotalPaid());
    }

    @Test
    @DisplayName("The last month of a finite term settles the balance")
    void debtYear_termEnds_clipsFinalPayment() {
        DebtYearResult result = service.debtYear(debt("1000", "0", "100", 3), new BigDecimal("1000"));
        assertTrue(result.isPaidOff());
        assertEquals(3, result.getPayoffMonth());
        assertEquals(new BigDecimal("1000.00"), result.getTotalPaid());
        assertEquals(0, result.getMonthsRemaining());
    }

    @Test
    @DisplayName("A full year without payoff counts down the term")
    void debtYear_fullYear() {
        DebtYearResult result = service.debtYear(debt("6000", "0", "100", 60), new BigDecimal("6000"));
        assertFalse(result.isPaidOff());
        assertNull(result.getPayoffMonth());
        assertEquals(new BigDecimal("4800.00"), result.getEndBalance());
        assertEquals(48, result.getMonthsRemaining());
    }

    @Test
    @DisplayName("Repeated years clear an under-paid loan within its configured term")
    void debtYear_repeated_clearsWithinTermMonths() {
        Debt current = Debt.builder()
                .id("d1")
                .name("Loan")
                .principal(new BigDecimal("10000"))
                .interestRate(new BigDecimal("0.05"))
                .minimumPayment(new BigDecimal("100"))
                .termMonths(60)
                .build();
        BigDecimal balance = current.getPrincipal();
        DebtYearResult result = null;
        for (int year = 1; year <= 5; year++) {
            result = service.debtYear(current, balance);
            balance = result.getEndBalance();
            current = current.toBuilder().monthsRemaining(result.getMonthsRemaining()).build();
            if (year < 5) {
                assertFalse(result.isPaidOff(), "year " + year);
                assertEquals(60 - 12 * year, result.getMonthsRemaining());
            }
        }
        assertEquals(new BigDecimal("0.00"), result.getEndBalance());
        assertTrue(result.isPaidOff());
        assertEquals(12, result.getPayoffMonth());
    }

    @Test
    @DisplayName("Repeated years at the level payment land on exactly zero")
    void debtYear_repeated_levelPayment() {
        BigDecimal payment = service.monthlyPayment(new BigDecimal("25000"), new BigDecimal("0.065"), 60);
        Debt debt = Debt.builder()
                .id("car")
                .name("Car loan")
                .principal(new BigDecimal("25000"))
                .interestRate(new BigDecimal("0.065"))
                .minimumPayment(payment)
                .termMonths(60)
                .build();
        BigDecimal balance = debt.getPrincipal();
        int remaining = debt.remainingTerm();
        for (int year = 1; year <= 5; year++) {
            DebtYearResult result = service.debtYear(debt, balance, remaining);
            balance = result.getEndBalance();
            remaining = result.getMonthsRemaining();
        }
        assertEquals(new BigDecimal("0.00"), balance);
        assertEquals(0, remaining);
    }

    @Test
    @DisplayName("Remaining term falls back to the configured term")
    void remainingTerm_defaultsToTermMonths() {
        Debt debt = debt("1000", "0", "10", 0).toBuilder().termMonths(24).build();
        assertEquals(24, debt.remainingTerm());
        assertEquals(12, debt.toBuilder().monthsRemaining(12).build().remainingTerm());
        assertEquals(0, debt("1000", "0", "10", 0).remainingTerm());
    }

    @Test
    @DisplayName("A zero starting balance is already paid off with no payoff month")
    void debtYear_zeroBalance() {
        DebtYearResult result = service.debtYear(debt("0", "0.05", "100", 0), BigDecimal.ZERO);
        assertTrue(result.isPaidOff());
        assertNull(result.getPayoffMonth());
        assertEquals(new BigDecimal("0.00"), result.getTotalPaid());
    }

    @Test
    @DisplayName("A payment below the interest lets the balance grow")
    void debtYear_negativeAmortization() {
        DebtYearResult result = service.debtYear(debt("10000", "0.24", "100", 0), new BigDecimal("10000"));
        assertFalse(result.isPaidOff());
        assertTrue(result.getEndBalance().compareTo(new BigDecimal("10000")) > 0);
    }

    @Test
    @DisplayName("Payoff months at zero interest")
    void payoffMonths_zeroRate() {
        assertEquals(10, service.payoffMonths(new BigDecimal("10000"), BigDecimal.ZERO, new BigDecimal("1000")));
    }

    @Test
    @DisplayName("A payment that only covers the interest never pays off")
    void payoffMonths_interestOnly_null() {
        assertNull(service.payoffMonths(new BigDecimal("10000"), new BigDecimal("0.12"), new BigDecimal("100")));
    }

    @Test
    @DisplayName("PMI applies strictly above the threshold")
    void shouldPayPmi_threshold() {
        BigDecimal threshold = new BigDecimal("0.80");
        assertTrue(service.shouldPayPmi(new BigDecimal("180000"), new BigDecimal("200000"), threshold));
        assertFalse(service.shouldPayPmi(new BigDecimal("160000"), new BigDecimal("200000"), threshold));
        assertFalse(service.shouldPayPmi(new BigDecimal("160000"), null, threshold));
    }

    @Test
    @DisplayName("LTV is zero without a property value")
    void ltv_noProperty_zero() {
        assertEquals(0, service.ltv(new BigDecimal("1000"), null).signum());
        assertEquals(0, new BigDecimal("0.5").compareTo(service.ltv(new BigDecimal("100000"), new BigDecimal("200000"))));
    }

    @Test
    @DisplayName("Invalid loans throw InvalidInputException")
    void monthlyPayment_invalid_throws() {
        assertThrows(InvalidInputException.class, () -> service.monthlyPayment(new BigDecimal("-1"), BigDecimal.ZERO, 12));
        assertThrows(InvalidInputException.class, () -> service.monthlyPayment(BigDecimal.ONE, new BigDecimal("-0.01"), 12));
        assertThrows(InvalidInputException.class, () -> service.monthlyPayment(BigDecimal.ONE, BigDecimal.ZERO, 0));
    }
}
