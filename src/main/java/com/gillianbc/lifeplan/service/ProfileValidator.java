package com.gillianbc.lifeplan.service;

import com.gillianbc.lifeplan.InvalidInputException;
import com.gillianbc.lifeplan.model.Asset;
import com.gillianbc.lifeplan.model.Assumptions;
import com.gillianbc.lifeplan.model.Debt;
import com.gillianbc.lifeplan.model.Goal;
import com.gillianbc.lifeplan.model.Income;
import com.gillianbc.lifeplan.model.Obligation;
import com.gillianbc.lifeplan.model.Profile;
import com.gillianbc.lifeplan.tax.TaxService;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;

/**
 * Rejects a profile the engine cannot project, naming the first offending field.
 */
@Component
public class ProfileValidator {

    private static final BigDecimal MINUS_ONE = BigDecimal.ONE.negate();

    private final TaxService taxService;

    public ProfileValidator(TaxService taxService) {
        this.taxService = taxService;
    }

    public void validate(Profile profile) {
        Objects.requireNonNull(profile, "profile must not be null");
        validateAssumptions(profile.getAssumptions());

        List<Income> incomes = profile.getIncomes();
        for (int i = 0; i < incomes.size(); i++) {
            Income income = incomes.get(i);
            String path = "incomes[" + i + "]";
            nonNegative(income.getAmount(), path + ".amount");
            nonNegative(income.getWeeklyHours(), path + ".weeklyHours");
            if (income.getVariability().signum() < 0 || income.getVariability().compareTo(BigDecimal.ONE) > 0) {
                throw new InvalidInputException(path + ".variability", "must be between 0 and 1");
            }
            if (income.getExpectedGrowth() != null) {
                aboveMinusOne(income.getExpectedGrowth(), path + ".expectedGrowth");
            }
        }

        List<Debt> debts = profile.getDebts();
        for (int i = 0; i < debts.size(); i++) {
            Debt debt = debts.get(i);
            String path = "debts[" + i + "]";
            nonNegative(debt.getPrincipal(), path + ".principal");
            nonNegative(debt.getInterestRate(), path + ".interestRate");
            nonNegative(debt.getMinimumPayment(), path + ".minimumPayment");
            nonNegative(debt.getActualPayment(), path + ".actualPayment");
            nonNegative(debt.getTermMonths(), path + ".termMonths");
            nonNegative(debt.getMonthsRemaining(), path + ".monthsRemaining");
            if (debt.getTermMonths() > 0 && debt.getMonthsRemaining() > debt.getTermMonths()) {
                throw new InvalidInputException(path + ".monthsRemaining", "must be <= termMonths");
            }
            if (debt.getPropertyValue() != null) {
                nonNegative(debt.getPropertyValue(), path + ".propertyValue");
            }
            nonNegative(debt.getPmiThreshold(), path + ".pmiThreshold");
            nonNegative(debt.getMonthlyPmi(), path + ".monthlyPmi");
            nonNegative(debt.getMonthlyEscrow(), path + ".monthlyEscrow");
        }

        List<Asset> assets = profile.getAssets();
        for (int i = 0; i < assets.size(); i++) {
            Asset asset = assets.get(i);
            String path = "assets[" + i + "]";
            nonNegative(asset.getBalance(), path + ".balance");
            nonNegative(asset.getMonthlyContribution(), path + ".monthlyContribution");
            if (asset.getExpectedReturn() != null) {
                aboveMinusOne(asset.getExpectedReturn(), path + ".expectedReturn");
            }
            if (asset.getEmployerMatch() != null) {
                nonNegative(asset.getEmployerMatch(), path + ".employerMatch");
            }
            if (asset.getMatchLimit() != null) {
                nonNegative(asset.getMatchLimit(), path + ".matchLimit");
            }
        }

        List<Obligation> obligations = profile.getObligations();
        for (int i = 0; i < obligations.size(); i++) {
            nonNegative(obligations.get(i).getMonthlyAmount(), "obligations[" + i + "].monthlyAmount");
        }

        List<Goal> goals = profile.getGoals();
        for (int i = 0; i < goals.size(); i++) {
            nonNegative(goals.get(i).getTargetAmount(), "goals[" + i + "].targetAmount");
        }
    }

    private void validateAssumptions(Assumptions assumptions) {
        String path = "assumptions";
        if (assumptions.getCurrentAge() < 0) {
            throw new InvalidInputException(path + ".currentAge", "must be >= 0");
        }
        if (assumptions.getLifeExpectancy() <= assumptions.getCurrentAge()) {
            throw new InvalidInputException(path + ".lifeExpectancy", "must be > currentAge");
        }
        aboveMinusOne(assumptions.getInflationRate(), path + ".inflationRate");
        aboveMinusOne(assumptions.getMarketReturn(), path + ".marketReturn");
        aboveMinusOne(assumptions.getHomeAppreciation(), path + ".homeAppreciation");
        aboveMinusOne(assumptions.getSalaryGrowth(), path + ".salaryGrowth");
        nonNegative(assumptions.getRetirementWithdrawalRate(), path + ".retirementWithdrawalRate");
        nonNegative(assumptions.getIncomeReplacementRatio(), path + ".incomeReplacementRatio");
        if (taxService.getTaxTables().forYear(assumptions.getTaxYear()).stateRule(assumptions.getState()).isEmpty()) {
            throw new InvalidInputException(path + ".state", "must be a known state code");
        }
    }

    private static void nonNegative(BigDecimal value, String field) {
        if (value.signum() < 0) {
            throw new InvalidInputException(field, "must be >= 0");
        }
    }

    private static void nonNegative(int value, String field) {
        if (value < 0) {
            throw new InvalidInputException(field, "must be >= 0");
        }
    }

    private static void aboveMinusOne(BigDecimal value, String field) {
        if (value.compareTo(MINUS_ONE) <= 0) {
            throw new InvalidInputException(field, "must be > -1");
        }
    }
}
