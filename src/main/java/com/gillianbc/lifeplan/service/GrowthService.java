package com.gillianbc.lifeplan.service;

import com.gillianbc.lifeplan.InvalidInputException;
import com.gillianbc.lifeplan.model.Asset;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Compound growth, employer matching and target maths.
 * <p>
 * Rounding point: during a year the balance is rounded HALF_UP to the cent after every monthly
 * step (deposit, then {@code × (1 + r/12)}). Lump-sum helpers compound annually and round once.
 */
@Slf4j
@Service
public class GrowthService {

    private static final MathContext MATH_CONTEXT = new MathContext(16, RoundingMode.HALF_UP);
    private static final BigDecimal TWELVE = BigDecimal.valueOf(12);
    private static final BigDecimal ZERO = BigDecimal.ZERO.setScale(2);
    private static final int MONTHS_PER_YEAR = 12;
    public static final int DEFAULT_MAX_YEARS = 100;

    /**
     * Twelve months of deposits at the start of each month followed by monthly compounding.
     *
     * @param startingBalance     balance at the start of the year (>= 0)
     * @param monthlyContribution deposit per month (>= 0)
     * @param annualReturn        expected annual return, may be negative but above -100%
     */
    public GrowthResult yearlyGrowth(BigDecimal startingBalance, BigDecimal monthlyContribution, BigDecimal annualReturn) {
        validateBalance(startingBalance, "startingBalance");
        validateBalance(monthlyContribution, "monthlyContribution");
        validateReturn(annualReturn);
        return compound(startingBalance, monthlyContribution.setScale(2, RoundingMode.HALF_UP), ZERO, annualReturn);
    }

    /**
     * One year for an asset, with any employer match spread evenly across the twelve deposits.
     *
     * @param annualSalary salary the match is keyed off
     * @param annualReturn return to apply; callers resolve the asset's default beforehand
     */
    public GrowthResult assetYear(Asset asset, BigDecimal startingBalance, BigDecimal annualSalary, BigDecimal annualReturn) {
        Objects.requireNonNull(asset, "asset must not be null");
        validateBalance(startingBalance, "startingBalance");
        validateReturn(annualReturn);

        BigDecimal match = asset.hasEmployerMatch()
                ? employerMatch(asset.getMonthlyContribution(), annualSalary, asset.getEmployerMatch(), asset.getMatchLimit())
                : ZERO;
        return compound(startingBalance, asset.getMonthlyContribution().setScale(2, RoundingMode.HALF_UP), match, annualReturn);
    }

    /**
     * Employer contribution for a year: the match rate applied to own contributions, counting
     * only contributions up to {@code matchLimit × annualSalary}.
     */
    public BigDecimal employerMatch(BigDecimal monthlyContribution, BigDecimal annualSalary,
                                    BigDecimal matchRate, BigDecimal matchLimit) {
        validateBalance(monthlyContribution, "monthlyContribution");
        validateBalance(annualSalary, "annualSalary");
        validateBalance(matchRate, "matchRate");
        validateBalance(matchLimit, "matchLimit");

        BigDecimal annualContribution = monthlyContribution.multiply(TWELVE);
        BigDecimal cap = annualSalary.multiply(matchLimit, MATH_CONTEXT).setScale(2, RoundingMode.HALF_UP);
        return annualContribution.min(cap).multiply(matchRate, MATH_CONTEXT).setScale(2, RoundingMode.HALF_UP);
    }

    /**
     * Year-by-year balances over {@code years}, the first entry being the starting balance.
     */
    public List<BigDecimal> projectOverYears(BigDecimal startingBalance, BigDecimal monthlyContribution,
                                             BigDecimal annualReturn, int years) {
        if (years < 0) {
            throw new InvalidInputException("years", "must be >= 0");
        }
        List<BigDecimal> balances = new ArrayList<>();
        BigDecimal balance = startingBalance.setScale(2, RoundingMode.HALF_UP);
        balances.add(balance);
        for (int year = 0; year < years; year++) {
            balance = yearlyGrowth(balance, monthlyContribution, annualReturn).getEndingBalance();
            balances.add(balance);
        }
        return balances;
    }

    /**
     * Lump sum compounded annually: {@code pv × (1 + r)^years}.
     */
    public BigDecimal futureValue(BigDecimal presentValue, BigDecimal annualReturn, int years) {
        Objects.requireNonNull(presentValue, "presentValue must not be null");
        validateReturn(annualReturn);
        validateYears(years);
        return presentValue.multiply(growthFactor(annualReturn, years), MATH_CONTEXT).setScale(2, RoundingMode.HALF_UP);
    }

    /**
     * Inverse of {@link #futureValue}: {@code fv / (1 + r)^years}.
     */
    public BigDecimal presentValue(BigDecimal futureValue, BigDecimal annualReturn, int years) {
        Objects.requireNonNull(futureValue, "futureValue must not be null");
        validateReturn(annualReturn);
        validateYears(years);
        return futureValue.divide(growthFactor(annualReturn, years), MATH_CONTEXT).setScale(2, RoundingMode.HALF_UP);
    }

    /**
     * Property value after {@code years} of appreciation.
     */
    public BigDecimal propertyAppreciation(BigDecimal currentValue, BigDecimal appreciationRate, int years) {
        return futureValue(currentValue, appreciationRate, years);
    }

    /**
     * Whole years of {@link #yearlyGrowth} needed to reach {@code target}.
     *
     * @return 0 if already at or above target, null if not reached within {@code maxYears}
     */
    public Integer yearsToTarget(BigDecimal startingBalance, BigDecimal monthlyContribution,
                                 BigDecimal annualReturn, BigDecimal target, int maxYears) {
        Objects.requireNonNull(target, "target must not be null");
        validateYears(maxYears);
        BigDecimal balance = startingBalance;
        for (int year = 0; year < maxYears; year++) {
            if (balance.compareTo(target) >= 0) {
                return year;
            }
            balance = yearlyGrowth(balance, monthlyContribution, annualReturn).getEndingBalance();
        }
        if (balance.compareTo(target) >= 0) {
            return maxYears;
        }
        log.debug("Target {} not reached within {} years (balance {})", target, maxYears, balance);
        return null;
    }

    public Integer yearsToTarget(BigDecimal startingBalance, BigDecimal monthlyContribution,
                                 BigDecimal annualReturn, BigDecimal target) {
        return yearsToTarget(startingBalance, monthlyContribution, annualReturn, target, DEFAULT_MAX_YEARS);
    }

    /**
     * Monthly deposit needed to grow {@code startingBalance} to {@code target} in {@code years},
     * from the future value of an annuity. Never negative.
     */
    public BigDecimal requiredMonthlySavings(BigDecimal startingBalance, BigDecimal target,
                                             BigDecimal annualReturn, int years) {
        validateBalance(startingBalance, "startingBalance");
        Objects.requireNonNull(target, "target must not be null");
        validateReturn(annualReturn);

        if (years <= 0) {
            return target.subtract(startingBalance).max(BigDecimal.ZERO).setScale(2, RoundingMode.HALF_UP);
        }

        BigDecimal needed = target.subtract(futureValue(startingBalance, annualReturn, years));
        if (needed.signum() <= 0) {
            return ZERO;
        }

        int months = years * MONTHS_PER_YEAR;
        BigDecimal monthlyReturn = annualReturn.divide(TWELVE, MATH_CONTEXT);
        // FV = PMT * ((1 + r)^n - 1) / r  =>  PMT = FV * r / ((1 + r)^n - 1)
        BigDecimal factor = BigDecimal.ONE.add(monthlyReturn).pow(months, MATH_CONTEXT).subtract(BigDecimal.ONE);
        if (factor.signum() == 0) {
            return needed.divide(BigDecimal.valueOf(months), 2, RoundingMode.HALF_UP);
        }
        return needed.multiply(monthlyReturn, MATH_CONTEXT).divide(factor, MATH_CONTEXT).setScale(2, RoundingMode.HALF_UP);
    }

    /**
     * Safe-withdrawal view of a pot: the nest egg needed for {@code desiredAnnualIncome} at
     * {@code withdrawalRate}. A zero withdrawal rate can never fund an income, so it reports a
     * zero nest egg and not ready.
     */
    public RetirementReadiness retirementReadiness(BigDecimal retirementAssets, BigDecimal desiredAnnualIncome,
                                                   BigDecimal withdrawalRate) {
        Objects.requireNonNull(retirementAssets, "retirementAssets must not be null");
        validateBalance(desiredAnnualIncome, "desiredAnnualIncome");
        validateBalance(withdrawalRate, "withdrawalRate");

        BigDecimal assets = retirementAssets.setScale(2, RoundingMode.HALF_UP);
        BigDecimal sustainable = assets.multiply(withdrawalRate, MATH_CONTEXT).setScale(2, RoundingMode.HALF_UP);
        BigDecimal monthlyIncome = sustainable.divide(TWELVE, 2, RoundingMode.HALF_UP);

        BigDecimal required;
        BigDecimal percentage;
        boolean ready;
        if (withdrawalRate.signum() == 0) {
            required = ZERO;
            percentage = BigDecimal.ZERO;
            ready = false;
        } else {
            required = desiredAnnualIncome.divide(withdrawalRate, MATH_CONTEXT).setScale(2, RoundingMode.HALF_UP);
            if (required.signum() == 0) {
                percentage = BigDecimal.ONE;
            } else {
                percentage = assets.max(BigDecimal.ZERO).divide(required, 6, RoundingMode.HALF_UP).min(BigDecimal.ONE);
            }
            ready = assets.compareTo(required) >= 0;
        }

        return RetirementReadiness.builder()
                .currentAssets(assets)
                .requiredNestEgg(required)
                .percentageComplete(percentage)
                .ready(ready)
                .sustainableWithdrawal(sustainable)
                .monthlyIncome(monthlyIncome)
                .build();
    }

    private static GrowthResult compound(BigDecimal startingBalance, BigDecimal monthlyContribution,
                                         BigDecimal annualMatch, BigDecimal annualReturn) {
        BigDecimal monthlyRate = annualReturn.divide(TWELVE, MATH_CONTEXT);
        BigDecimal multiplier = BigDecimal.ONE.add(monthlyRate);
        BigDecimal monthlyMatch = annualMatch.divide(TWELVE, 2, RoundingMode.HALF_UP);
        BigDecimal monthlyDeposit = monthlyContribution.add(monthlyMatch);

        BigDecimal start = startingBalance.setScale(2, RoundingMode.HALF_UP);
        BigDecimal balance = start;
        for (int month = 0; month < MONTHS_PER_YEAR; month++) {
            balance = balance.add(monthlyDeposit).multiply(multiplier, MATH_CONTEXT).setScale(2, RoundingMode.HALF_UP);
        }
        balance = balance.max(BigDecimal.ZERO).setScale(2, RoundingMode.HALF_UP);

        BigDecimal contributions = monthlyContribution.multiply(TWELVE).setScale(2, RoundingMode.HALF_UP);
        // The match actually deposited, after rounding each monthly instalment
        BigDecimal match = monthlyMatch.multiply(TWELVE).setScale(2, RoundingMode.HALF_UP);
        BigDecimal deposited = monthlyDeposit.multiply(TWELVE).setScale(2, RoundingMode.HALF_UP);
        return GrowthResult.builder()
                .startingBalance(start)
                .endingBalance(balance)
                .contributions(contributions)
                .employerMatch(match)
                .totalContributions(deposited)
                .growth(balance.subtract(start).subtract(deposited))
                .build();
    }

    private static BigDecimal growthFactor(BigDecimal annualReturn, int years) {
        return BigDecimal.ONE.add(annualReturn).pow(years, MATH_CONTEXT);
    }

    private static void validateBalance(BigDecimal amount, String field) {
        Objects.requireNonNull(amount, field + " must not be null");
        if (amount.signum() < 0) {
            throw new InvalidInputException(field, "must be >= 0");
        }
    }

    private static void validateReturn(BigDecimal annualReturn) {
        Objects.requireNonNull(annualReturn, "annualReturn must not be null");
        if (annualReturn.compareTo(BigDecimal.ONE.negate()) <= 0) {
            throw new InvalidInputException("annualReturn", "must be > -1");
        }
    }

    private static void validateYears(int years) {
        if (years < 0) {
            throw new InvalidInputException("years", "must be >= 0");
        }
    }
}
