package com.gillianbc.lifeplan.service;

import com.gillianbc.lifeplan.InvalidInputException;
import com.gillianbc.lifeplan.model.Debt;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Level-payment loan maths for a single debt.
 * <p>
 * Interest is charged monthly at {@code annualRate / 12} and rounded HALF_UP to the cent.
 * The month that clears a balance pays exactly what is owed, so balances land on 0.00.
 */
@Slf4j
@Service
public class AmortizationService {

    private static final MathContext MATH_CONTEXT = new MathContext(16, RoundingMode.HALF_UP);
    private static final BigDecimal TWELVE = BigDecimal.valueOf(12);
    private static final BigDecimal ZERO = BigDecimal.ZERO.setScale(2);
    private static final int MONTHS_PER_YEAR = 12;

    /**
     * Standard annuity payment, rounded up to the next cent so that the level payment never
     * leaves a residual balance at the end of the term.
     *
     * @param principal  amount borrowed (>= 0)
     * @param annualRate annual interest rate (>= 0)
     * @param termMonths number of payments (> 0)
     */
    public BigDecimal monthlyPayment(BigDecimal principal, BigDecimal annualRate, int termMonths) {
        validateLoan(principal, annualRate, termMonths);
        if (annualRate.signum() == 0) {
            return principal.divide(BigDecimal.valueOf(termMonths), 2, RoundingMode.CEILING);
        }
        BigDecimal monthlyRate = annualRate.divide(TWELVE, MATH_CONTEXT);
        // P * r / (1 - (1 + r)^-n)
        BigDecimal discount = BigDecimal.ONE.subtract(BigDecimal.ONE.add(monthlyRate).pow(-termMonths, MATH_CONTEXT));
        return principal.multiply(monthlyRate, MATH_CONTEXT)
                .divide(discount, MATH_CONTEXT)
                .setScale(2, RoundingMode.CEILING);
    }

    /**
     * Month-by-month schedule at the level payment plus {@code extraPayment}. Each call to
     * {@link Iterable#iterator()} starts again from month one; entries are computed on demand.
     * The walk stops when the balance reaches zero, at the latest in month {@code termMonths}.
     */
    public Iterable<AmortizationEntry> amortizationSchedule(BigDecimal principal, BigDecimal annualRate,
                                                            int termMonths, BigDecimal extraPayment) {
        Objects.requireNonNull(extraPayment, "extraPayment must not be null");
        if (extraPayment.signum() < 0) {
            throw new InvalidInputException("extraPayment", "must be >= 0");
        }
        BigDecimal payment = monthlyPayment(principal, annualRate, termMonths).add(extraPayment);
        BigDecimal monthlyRate = annualRate.divide(TWELVE, MATH_CONTEXT);
        BigDecimal startBalance = principal.setScale(2, RoundingMode.HALF_UP);
        return () -> new ScheduleIterator(startBalance, monthlyRate, payment, termMonths);
    }

    public Iterable<AmortizationEntry> amortizationSchedule(BigDecimal principal, BigDecimal annualRate, int termMonths) {
        return amortizationSchedule(principal, annualRate, termMonths, BigDecimal.ZERO);
    }

    /**
     * Applies up to twelve months of payments to {@code startingBalance}, using the debt's
     * remaining term ({@code monthsRemaining}, else {@code termMonths}).
     */
    public DebtYearResult debtYear(Debt debt, BigDecimal startingBalance) {
        Objects.requireNonNull(debt, "debt must not be null");
        return debtYear(debt, startingBalance, debt.remainingTerm());
    }

    /**
     * Applies up to twelve months of payments to {@code startingBalance}. When a finite term runs
     * out during the year the remaining balance is settled in that month. A payment smaller than the
     * interest lets the balance grow; it never goes below zero.
     *
     * @param monthsRemaining months left on the term at the start of the year; 0 means open-ended
     */
    public DebtYearResult debtYear(Debt debt, BigDecimal startingBalance, int monthsRemaining) {
        Objects.requireNonNull(debt, "debt must not be null");
        Objects.requireNonNull(startingBalance, "startingBalance must not be null");
        if (startingBalance.signum() < 0) {
            throw new InvalidInputException("startingBalance", "must be >= 0");
        }
        if (monthsRemaining < 0) {
            throw new InvalidInputException("monthsRemaining", "must be >= 0");
        }

        BigDecimal start = startingBalance.setScale(2, RoundingMode.HALF_UP);
        if (start.signum() == 0) {
            return DebtYearResult.builder()
                    .startingBalance(start)
                    .endBalance(ZERO)
                    .interestPaid(ZERO)
                    .principalPaid(ZERO)
                    .totalPaid(ZERO)
                    .paidOff(true)
                    .payoffMonth(null)
                    .monthsRemaining(0)
                    .build();
        }

        BigDecimal monthlyRate = debt.getInterestRate().divide(TWELVE, MATH_CONTEXT);
        BigDecimal payment = debt.effectivePayment();
        boolean finiteTerm = monthsRemaining > 0;

        BigDecimal balance = start;
        BigDecimal interestPaid = BigDecimal.ZERO;
        BigDecimal principalPaid = BigDecimal.ZERO;
        BigDecimal totalPaid = BigDecimal.ZERO;
        Integer payoffMonth = null;
        int remaining = monthsRemaining;

        for (int month = 1; month <= MONTHS_PER_YEAR; month++) {
            MonthStep step = step(balance, monthlyRate, payment, finiteTerm && remaining == 1);
            interestPaid = interestPaid.add(step.interest);
            principalPaid = principalPaid.add(step.principal);
            totalPaid = totalPaid.add(step.payment);
            balance = step.balance;
            if (finiteTerm) {
                remaining--;
            }
            if (balance.signum() == 0) {
                payoffMonth = month;
                break;
            }
        }

        return DebtYearResult.builder()
                .startingBalance(start)
                .endBalance(balance.max(BigDecimal.ZERO).setScale(2, RoundingMode.HALF_UP))
                .interestPaid(interestPaid.setScale(2, RoundingMode.HALF_UP))
                .principalPaid(principalPaid.setScale(2, RoundingMode.HALF_UP))
                .totalPaid(totalPaid.setScale(2, RoundingMode.HALF_UP))
                .paidOff(balance.signum() == 0)
                .payoffMonth(payoffMonth)
                .monthsRemaining(balance.signum() == 0 ? 0 : remaining)
                .build();
    }

    /**
     * Months needed to clear {@code principal} at a fixed payment, or null if the payment never
     * gets ahead of the interest.
     */
    public Integer payoffMonths(BigDecimal principal, BigDecimal annualRate, BigDecimal payment) {
        Objects.requireNonNull(payment, "payment must not be null");
        validateLoan(principal, annualRate, 1);
        if (principal.signum() == 0) {
            return 0;
        }
        BigDecimal monthlyRate = annualRate.divide(TWELVE, MATH_CONTEXT);
        BigDecimal firstInterest = principal.multiply(monthlyRate, MATH_CONTEXT).setScale(2, RoundingMode.HALF_UP);
        if (payment.compareTo(firstInterest) <= 0) {
            log.debug("Payment {} does not cover first month's interest {}", payment, firstInterest);
            return null;
        }
        BigDecimal balance = principal.setScale(2, RoundingMode.HALF_UP);
        int months = 0;
        while (balance.signum() > 0) {
            balance = step(balance, monthlyRate, payment, false).balance;
            months++;
        }
        return months;
    }

    /**
     * Loan-to-value ratio, zero when there is no property value.
     */
    public BigDecimal ltv(BigDecimal balance, BigDecimal propertyValue) {
        Objects.requireNonNull(balance, "balance must not be null");
        if (propertyValue == null || propertyValue.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        return balance.divide(propertyValue, 6, RoundingMode.HALF_UP);
    }

    /**
     * PMI is required while the loan-to-value ratio is above the threshold.
     */
    public boolean shouldPayPmi(BigDecimal balance, BigDecimal propertyValue, BigDecimal threshold) {
        Objects.requireNonNull(threshold, "threshold must not be null");
        if (propertyValue == null || propertyValue.signum() <= 0) {
            return false;
        }
        return ltv(balance, propertyValue).compareTo(threshold) > 0;
    }

    private static MonthStep step(BigDecimal balance, BigDecimal monthlyRate, BigDecimal payment, boolean finalMonth) {
        BigDecimal interest = balance.multiply(monthlyRate, MATH_CONTEXT).setScale(2, RoundingMode.HALF_UP);
        BigDecimal owed = balance.add(interest);
        if (finalMonth || owed.compareTo(payment) <= 0) {
            // Clip the last payment to what is owed
            return new MonthStep(owed, balance, interest, ZERO);
        }
        BigDecimal principal = payment.subtract(interest);
        return new MonthStep(payment, principal, interest, balance.subtract(principal));
    }

    private static void validateLoan(BigDecimal principal, BigDecimal annualRate, int termMonths) {
        Objects.requireNonNull(principal, "principal must not be null");
        Objects.requireNonNull(annualRate, "annualRate must not be null");
        if (principal.signum() < 0) {
            throw new InvalidInputException("principal", "must be >= 0");
        }
        if (annualRate.signum() < 0) {
            throw new InvalidInputException("annualRate", "must be >= 0");
        }
        if (termMonths <= 0) {
            throw new InvalidInputException("termMonths", "must be > 0");
        }
    }

    private static final class MonthStep {
        final BigDecimal payment;
        final BigDecimal principal;
        final BigDecimal interest;
        final BigDecimal balance;

        MonthStep(BigDecimal payment, BigDecimal principal, BigDecimal interest, BigDecimal balance) {
            this.payment = payment;
            this.principal = principal;
            this.interest = interest;
            this.balance = balance;
        }
    }

    private static final class ScheduleIterator implements Iterator<AmortizationEntry> {
        private final BigDecimal monthlyRate;
        private final BigDecimal payment;
        private final int termMonths;
        private BigDecimal balance;
        private int month;

        ScheduleIterator(BigDecimal balance, BigDecimal monthlyRate, BigDecimal payment, int termMonths) {
            this.balance = balance;
            this.monthlyRate = monthlyRate;
            this.payment = payment;
            this.termMonths = termMonths;
        }

        @Override
        public boolean hasNext() {
            return balance.signum() > 0 && month < termMonths;
        }

        @Override
        public AmortizationEntry next() {
            if (!hasNext()) {
                throw new NoSuchElementException("schedule complete after month " + month);
            }
            month++;
            MonthStep step = step(balance, monthlyRate, payment, month == termMonths);
            balance = step.balance;
            return new AmortizationEntry(month, step.payment, step.principal, step.interest, step.balance);
        }
    }
}
