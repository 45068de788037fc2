package com.gillianbc.lifeplan.service;

import com.gillianbc.lifeplan.model.Income;
import com.gillianbc.lifeplan.model.IncomeType;
import com.gillianbc.lifeplan.model.MonthYear;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * Evaluates a single income for a projected year.
 */
@Service
public class IncomeService {

    private static final MathContext MATH_CONTEXT = new MathContext(16, RoundingMode.HALF_UP);
    private static final BigDecimal WEEKS_PER_YEAR = BigDecimal.valueOf(52);
    private static final BigDecimal TWELVE = BigDecimal.valueOf(12);
    private static final BigDecimal ZERO = BigDecimal.ZERO.setScale(2);

    /**
     * Expected gross amount of {@code income} in the year at {@code yearIndex} (0 = first projected year).
     * Growth compounds from the first year; the end year is pro-rated by its end month.
     *
     * @param calendarYear  calendar year of {@code yearIndex}, compared against the end date
     * @param defaultGrowth growth applied when the income has none of its own
     */
    public BigDecimal annualAmount(Income income, int yearIndex, int calendarYear, BigDecimal defaultGrowth) {
        Objects.requireNonNull(income, "income must not be null");
        Objects.requireNonNull(defaultGrowth, "defaultGrowth must not be null");
        BigDecimal share = activeShare(income.getEndDate(), calendarYear);
        if (share.signum() == 0) {
            return ZERO;
        }
        BigDecimal growth = income.getExpectedGrowth() != null ? income.getExpectedGrowth() : defaultGrowth;
        BigDecimal grown = baseAnnualAmount(income)
                .multiply(BigDecimal.ONE.add(growth).pow(yearIndex, MATH_CONTEXT), MATH_CONTEXT);
        return grown.multiply(share, MATH_CONTEXT).setScale(2, RoundingMode.HALF_UP);
    }

    /**
     * Variable incomes range by their variability factor either side of the expected amount;
     * every other kind has a single value.
     */
    public IncomeRange incomeRange(Income income, int yearIndex, int calendarYear, BigDecimal defaultGrowth) {
        BigDecimal expected = annualAmount(income, yearIndex, calendarYear, defaultGrowth);
        if (income.getType() != IncomeType.VARIABLE || income.getVariability().signum() == 0) {
            return new IncomeRange(expected, expected, expected);
        }
        BigDecimal swing = expected.multiply(income.getVariability(), MATH_CONTEXT);
        return new IncomeRange(
                expected.subtract(swing).max(BigDecimal.ZERO).setScale(2, RoundingMode.HALF_UP),
                expected,
                expected.add(swing).setScale(2, RoundingMode.HALF_UP));
    }

    /**
     * Hours worked for the income in a year; zero for passive or ended income.
     */
    public BigDecimal workHours(Income income, int calendarYear) {
        Objects.requireNonNull(income, "income must not be null");
        if (!isEarned(income)) {
            return BigDecimal.ZERO.setScale(2);
        }
        return income.getWeeklyHours()
                .multiply(WEEKS_PER_YEAR)
                .multiply(activeShare(income.getEndDate(), calendarYear), MATH_CONTEXT)
                .setScale(2, RoundingMode.HALF_UP);
    }

    /**
     * Earned income is subject to FICA and counts as work; passive income is neither.
     */
    public boolean isEarned(Income income) {
        return income.getType() != IncomeType.PASSIVE;
    }

    /**
     * Salary-like income that an employer match is keyed off.
     */
    public boolean isSalary(Income income) {
        return income.getType() == IncomeType.SALARY || income.getType() == IncomeType.HOURLY;
    }

    private static BigDecimal baseAnnualAmount(Income income) {
        if (income.getType() == IncomeType.HOURLY) {
            return income.getAmount().multiply(income.getWeeklyHours()).multiply(WEEKS_PER_YEAR);
        }
        return income.getAmount();
    }

    /**
     * Fraction of the calendar year in which an income or expense with this end date is active.
     */
    static BigDecimal activeShare(MonthYear endDate, int calendarYear) {
        if (endDate == null || calendarYear < endDate.getYear()) {
            return BigDecimal.ONE;
        }
        if (calendarYear > endDate.getYear()) {
            return BigDecimal.ZERO;
        }
        return BigDecimal.valueOf(endDate.getMonth()).divide(TWELVE, MATH_CONTEXT);
    }
}
