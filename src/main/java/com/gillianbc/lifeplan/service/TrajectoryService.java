package com.gillianbc.lifeplan.service;

import com.gillianbc.lifeplan.InvalidInputException;
import com.gillianbc.lifeplan.config.ProjectionProperties;
import com.gillianbc.lifeplan.model.Asset;
import com.gillianbc.lifeplan.model.AssetState;
import com.gillianbc.lifeplan.model.AssetType;
import com.gillianbc.lifeplan.model.Assumptions;
import com.gillianbc.lifeplan.model.Debt;
import com.gillianbc.lifeplan.model.DebtState;
import com.gillianbc.lifeplan.model.Income;
import com.gillianbc.lifeplan.model.Milestone;
import com.gillianbc.lifeplan.model.MilestoneType;
import com.gillianbc.lifeplan.model.Obligation;
import com.gillianbc.lifeplan.model.Profile;
import com.gillianbc.lifeplan.model.Trajectory;
import com.gillianbc.lifeplan.model.TrajectorySummary;
import com.gillianbc.lifeplan.model.TrajectoryYear;
import com.gillianbc.lifeplan.tax.TaxService;
import com.gillianbc.lifeplan.tax.TaxSummary;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Projects a profile forward one calendar year at a time until life expectancy.
 * <p>
 * Each year is computed from the previous year's {@link ProjectionState} alone, so the result
 * depends only on the profile; {@code generatedAt} is the one exception.
 */
@Slf4j
@Service
public class TrajectoryService {

    private static final MathContext MATH_CONTEXT = new MathContext(16, RoundingMode.HALF_UP);
    private static final BigDecimal TWELVE = BigDecimal.valueOf(12);
    private static final BigDecimal ZERO = BigDecimal.ZERO.setScale(2);
    private static final int MONTHS_PER_YEAR = 12;

    private final TaxService taxService;
    private final AmortizationService amortizationService;
    private final GrowthService growthService;
    private final IncomeService incomeService;
    private final MilestoneDetector milestoneDetector;
    private final ProfileValidator profileValidator;
    private final ProjectionProperties properties;
    private final Clock clock;

    public TrajectoryService(TaxService taxService,
                             AmortizationService amortizationService,
                             GrowthService growthService,
                             IncomeService incomeService,
                             MilestoneDetector milestoneDetector,
                             ProfileValidator profileValidator,
                             ProjectionProperties properties,
                             Clock clock) {
        this.taxService = taxService;
        this.amortizationService = amortizationService;
        this.growthService = growthService;
        this.incomeService = incomeService;
        this.milestoneDetector = milestoneDetector;
        this.profileValidator = profileValidator;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Full projection: one year per year of age from {@code currentAge} up to {@code lifeExpectancy}.
     */
    public Trajectory generateTrajectory(Profile profile) {
        profileValidator.validate(profile);
        return project(profile, fullYears(profile));
    }

    /**
     * Preview projection of the configured number of years.
     */
    public Trajectory generateQuickTrajectory(Profile profile) {
        return generateQuickTrajectory(profile, properties.getQuickYears());
    }

    /**
     * Same fold as {@link #generateTrajectory(Profile)} truncated to {@code min(years, full length)}.
     */
    public Trajectory generateQuickTrajectory(Profile profile, int years) {
        if (years < 0) {
            throw new InvalidInputException("years", "must be >= 0");
        }
        profileValidator.validate(profile);
        return project(profile, Math.min(years, fullYears(profile)));
    }

    private static int fullYears(Profile profile) {
        Assumptions assumptions = profile.getAssumptions();
        return assumptions.getLifeExpectancy() - assumptions.getCurrentAge();
    }

    private Trajectory project(Profile profile, int yearCount) {
        long started = System.nanoTime();
        Map<String, AssetType> assetTypes = new HashMap<>();
        for (Asset asset : profile.getAssets()) {
            assetTypes.put(asset.getId(), asset.getType());
        }

        ProjectionState state = initialState(profile);
        List<TrajectoryYear> years = new ArrayList<>(yearCount);
        List<Milestone> milestones = new ArrayList<>();

        for (int i = 0; i < yearCount; i++) {
            TrajectoryYear year = projectYear(profile, state, i);
            years.add(year);

            List<Milestone> found = new ArrayList<>();
            ProjectionState next = detectMilestones(profile, state, year, assetTypes, found);
            for (Milestone milestone : found) {
                log.debug("{} {}/{}: {}", milestone.getType(), milestone.getMonth(), milestone.getYear(), milestone.getDescription());
            }
            milestones.addAll(found);
            state = next;

            log.debug("Year {} (age {}): gross={}, net={}, debt={}, assets={}, netWorth={}",
                    year.getYear(), year.getAge(), year.getGrossIncome(), year.getNetIncome(),
                    year.getTotalDebt(), year.getTotalAssets(), year.getNetWorth());
        }

        TrajectorySummary summary = summarise(profile, years, milestones);
        Trajectory trajectory = new Trajectory(profile.getId(), clock.instant(), years, milestones, summary);
        log.info("Projected profile {} over {} years with {} milestones in {} ms",
                profile.getId(), years.size(), milestones.size(),
                TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started));
        return trajectory;
    }

    private ProjectionState initialState(Profile profile) {
        List<DebtState> debts = new ArrayList<>();
        BigDecimal totalDebt = BigDecimal.ZERO;
        for (Debt debt : profile.getDebts()) {
            BigDecimal principal = debt.getPrincipal().setScale(2, RoundingMode.HALF_UP);
            totalDebt = totalDebt.add(principal);
            debts.add(DebtState.builder()
                    .debtId(debt.getId())
                    .remainingPrincipal(principal)
                    .monthsRemaining(debt.remainingTerm())
                    .interestPaidThisYear(ZERO)
                    .principalPaidThisYear(ZERO)
                    .paymentsThisYear(ZERO)
                    .paidOff(principal.signum() == 0)
                    .payoffMonth(null)
                    .propertyValue(debt.getPropertyValue())
                    .ltv(amortizationService.ltv(principal, debt.getPropertyValue()))
                    .payingPmi(debt.getMonthlyPmi().signum() > 0
                            && amortizationService.shouldPayPmi(principal, debt.getPropertyValue(), debt.getPmiThreshold()))
                    .build());
        }

        List<AssetState> assets = new ArrayList<>();
        BigDecimal totalAssets = BigDecimal.ZERO;
        for (Asset asset : profile.getAssets()) {
            BigDecimal balance = asset.getBalance().setScale(2, RoundingMode.HALF_UP);
            totalAssets = totalAssets.add(balance);
            assets.add(AssetState.builder()
                    .assetId(asset.getId())
                    .balance(balance)
                    .contributionsThisYear(ZERO)
                    .employerMatchThisYear(ZERO)
                    .growthThisYear(ZERO)
                    .build());
        }

        BigDecimal netWorth = totalAssets.subtract(totalDebt);
        return ProjectionState.builder()
                .yearIndex(0)
                .debts(debts)
                .assets(assets)
                .netWorth(netWorth)
                .peakGrossIncome(BigDecimal.ZERO)
                .retirementReady(false)
                .reachedThresholds(Set.copyOf(milestoneDetector.exceededThresholds(netWorth)))
                .resolvedGoalIds(Set.of())
                .build();
    }

    private TrajectoryYear projectYear(Profile profile, ProjectionState state, int yearIndex) {
        Assumptions assumptions = profile.getAssumptions();
        int calendarYear = assumptions.getTaxYear() + yearIndex;

        // Income
        BigDecimal gross = BigDecimal.ZERO;
        BigDecimal earned = BigDecimal.ZERO;
        BigDecimal salary = BigDecimal.ZERO;
        BigDecimal workHours = BigDecimal.ZERO;
        for (Income income : profile.getIncomes()) {
            BigDecimal amount = incomeService.annualAmount(income, yearIndex, calendarYear, assumptions.getSalaryGrowth());
            gross = gross.add(amount);
            if (incomeService.isEarned(income)) {
                earned = earned.add(amount);
            }
            if (incomeService.isSalary(income)) {
                salary = salary.add(amount);
            }
            workHours = workHours.add(incomeService.workHours(income, calendarYear));
        }

        // Taxes
        BigDecimal pretax = BigDecimal.ZERO;
        for (Asset asset : profile.getAssets()) {
            if (asset.getType() == AssetType.RETIREMENT_PRETAX) {
                pretax = pretax.add(asset.getMonthlyContribution().multiply(TWELVE));
            }
        }
        pretax = pretax.setScale(2, RoundingMode.HALF_UP);
        TaxSummary tax = taxService.projectedTax(gross, pretax.min(gross), calendarYear, assumptions);

        // Debts
        List<DebtState> debtStates = new ArrayList<>();
        BigDecimal totalDebt = BigDecimal.ZERO;
        BigDecimal totalDebtPayment = BigDecimal.ZERO;
        BigDecimal totalInterest = BigDecimal.ZERO;
        BigDecimal totalPropertyValue = BigDecimal.ZERO;
        BigDecimal totalMortgageBalance = BigDecimal.ZERO;
        boolean anyPmi = false;
        for (int d = 0; d < profile.getDebts().size(); d++) {
            DebtState debtState = advanceDebt(profile.getDebts().get(d), state.getDebts().get(d), assumptions);
            debtStates.add(debtState);
            totalDebt = totalDebt.add(debtState.getRemainingPrincipal());
            totalDebtPayment = totalDebtPayment.add(debtState.getPaymentsThisYear());
            totalInterest = totalInterest.add(debtState.getInterestPaidThisYear());
            if (debtState.getPropertyValue() != null && debtState.getPropertyValue().signum() > 0) {
                totalPropertyValue = totalPropertyValue.add(debtState.getPropertyValue());
                totalMortgageBalance = totalMortgageBalance.add(debtState.getRemainingPrincipal());
            }
            anyPmi = anyPmi || debtState.isPayingPmi();
        }

        // Assets
        List<AssetState> assetStates = new ArrayList<>();
        BigDecimal totalAssets = BigDecimal.ZERO;
        BigDecimal totalContributions = BigDecimal.ZERO;
        for (int a = 0; a < profile.getAssets().size(); a++) {
            Asset asset = profile.getAssets().get(a);
            GrowthResult growth = growthService.assetYear(asset, state.getAssets().get(a).getBalance(), salary,
                    assetReturn(asset, assumptions));
            assetStates.add(AssetState.builder()
                    .assetId(asset.getId())
                    .balance(growth.getEndingBalance())
                    .contributionsThisYear(growth.getContributions())
                    .employerMatchThisYear(growth.getEmployerMatch())
                    .growthThisYear(growth.getGrowth())
                    .build());
            totalAssets = totalAssets.add(growth.getEndingBalance());
            totalContributions = totalContributions.add(growth.getContributions());
        }

        // Obligations
        BigDecimal totalObligations = BigDecimal.ZERO;
        BigDecimal inflationFactor = BigDecimal.ONE.add(assumptions.getInflationRate()).pow(yearIndex, MATH_CONTEXT);
        for (Obligation obligation : profile.getObligations()) {
            BigDecimal annual = obligation.getMonthlyAmount().multiply(TWELVE);
            if (obligation.isInflationAdjusted()) {
                annual = annual.multiply(inflationFactor, MATH_CONTEXT);
            }
            annual = annual.multiply(IncomeService.activeShare(obligation.getEndDate(), calendarYear), MATH_CONTEXT);
            totalObligations = totalObligations.add(annual);
        }
        totalObligations = totalObligations.setScale(2, RoundingMode.HALF_UP);

        BigDecimal netIncome = tax.getNetIncome();
        BigDecimal discretionary = netIncome
                .subtract(totalDebtPayment)
                .subtract(totalObligations)
                .subtract(totalContributions);
        BigDecimal savingsRate = gross.signum() == 0
                ? BigDecimal.ZERO
                : totalContributions.divide(gross, 6, RoundingMode.HALF_UP);
        BigDecimal hourlyRate = workHours.signum() == 0
                ? ZERO
                : netIncome.divide(workHours, 2, RoundingMode.HALF_UP);
        BigDecimal ltvRatio = totalPropertyValue.signum() == 0
                ? BigDecimal.ZERO
                : totalMortgageBalance.divide(totalPropertyValue, 6, RoundingMode.HALF_UP);

        return TrajectoryYear.builder()
                .year(calendarYear)
                .age(assumptions.getCurrentAge() + yearIndex)
                .grossIncome(gross.setScale(2, RoundingMode.HALF_UP))
                .earnedIncome(earned.setScale(2, RoundingMode.HALF_UP))
                .netIncome(netIncome)
                .taxFederal(tax.getFederalTax())
                .taxState(tax.getStateTax())
                .taxFica(tax.getTotalFica())
                .totalTax(tax.getTotalTax())
                .effectiveTaxRate(tax.getEffectiveRate())
                .pretaxContributions(pretax)
                .debts(debtStates)
                .assets(assetStates)
                .totalDebt(totalDebt.setScale(2, RoundingMode.HALF_UP))
                .totalAssets(totalAssets.setScale(2, RoundingMode.HALF_UP))
                .netWorth(totalAssets.subtract(totalDebt).setScale(2, RoundingMode.HALF_UP))
                .totalDebtPayment(totalDebtPayment.setScale(2, RoundingMode.HALF_UP))
                .totalInterestPaid(totalInterest.setScale(2, RoundingMode.HALF_UP))
                .totalContributions(totalContributions.setScale(2, RoundingMode.HALF_UP))
                .totalObligations(totalObligations)
                .discretionaryIncome(discretionary.setScale(2, RoundingMode.HALF_UP))
                .savingsRate(savingsRate)
                .totalWorkHours(workHours.setScale(2, RoundingMode.HALF_UP))
                .effectiveHourlyRate(hourlyRate)
                .homeEquity(totalPropertyValue.subtract(totalMortgageBalance).setScale(2, RoundingMode.HALF_UP))
                .ltvRatio(ltvRatio)
                .payingPmi(anyPmi)
                .build();
    }

    private DebtState advanceDebt(Debt debt, DebtState previous, Assumptions assumptions) {
        BigDecimal propertyValue = previous.getPropertyValue();
        if (propertyValue != null && propertyValue.signum() > 0) {
            propertyValue = propertyValue.multiply(BigDecimal.ONE.add(assumptions.getHomeAppreciation()), MATH_CONTEXT)
                    .setScale(2, RoundingMode.HALF_UP);
        }

        if (previous.isPaidOff()) {
            return previous.toBuilder()
                    .remainingPrincipal(ZERO)
                    .monthsRemaining(0)
                    .interestPaidThisYear(ZERO)
                    .principalPaidThisYear(ZERO)
                    .paymentsThisYear(ZERO)
                    .payoffMonth(null)
                    .propertyValue(propertyValue)
                    .ltv(amortizationService.ltv(ZERO, propertyValue))
                    .payingPmi(false)
                    .build();
        }

        DebtYearResult result = amortizationService.debtYear(debt, previous.getRemainingPrincipal(), previous.getMonthsRemaining());
        int activeMonths = result.getPayoffMonth() != null ? result.getPayoffMonth() : MONTHS_PER_YEAR;

        // PMI is billed for the active months when it applied at the start of the year
        BigDecimal pmi = previous.isPayingPmi()
                ? debt.getMonthlyPmi().multiply(BigDecimal.valueOf(activeMonths))
                : BigDecimal.ZERO;
        BigDecimal escrow = debt.getMonthlyEscrow().multiply(BigDecimal.valueOf(activeMonths));

        boolean payingPmi = debt.getMonthlyPmi().signum() > 0
                && amortizationService.shouldPayPmi(result.getEndBalance(), propertyValue, debt.getPmiThreshold());

        return DebtState.builder()
                .debtId(debt.getId())
                .remainingPrincipal(result.getEndBalance())
                .monthsRemaining(result.getMonthsRemaining())
                .interestPaidThisYear(result.getInterestPaid())
                .principalPaidThisYear(result.getPrincipalPaid())
                .paymentsThisYear(result.getTotalPaid().add(pmi).add(escrow).setScale(2, RoundingMode.HALF_UP))
                .paidOff(result.isPaidOff())
                .payoffMonth(result.getPayoffMonth())
                .propertyValue(propertyValue)
                .ltv(amortizationService.ltv(result.getEndBalance(), propertyValue))
                .payingPmi(payingPmi)
                .build();
    }

    private static BigDecimal assetReturn(Asset asset, Assumptions assumptions) {
        if (asset.getExpectedReturn() != null) {
            return asset.getExpectedReturn();
        }
        if (asset.getType() == AssetType.PROPERTY) {
            return assumptions.getHomeAppreciation();
        }
        return assumptions.getMarketReturn();
    }

    private ProjectionState detectMilestones(Profile profile, ProjectionState state, TrajectoryYear year,
                                             Map<String, AssetType> assetTypes, List<Milestone> found) {
        found.addAll(milestoneDetector.debtPayoffs(profile.getDebts(), state.getDebts(), year));
        found.addAll(milestoneDetector.pmiRemovals(profile.getDebts(), state.getDebts(), year));

        Set<BigDecimal> reached = new HashSet<>(state.getReachedThresholds());
        for (BigDecimal threshold : milestoneDetector.newlyExceededThresholds(year.getNetWorth(), reached)) {
            found.add(milestoneDetector.netWorthMilestone(threshold, year.getYear()));
            reached.add(threshold);
        }

        BigDecimal peak = state.getPeakGrossIncome().max(year.getGrossIncome());
        boolean retirementReady = state.isRetirementReady();
        if (!retirementReady && peak.signum() > 0) {
            BigDecimal desiredIncome = peak.multiply(profile.getAssumptions().getIncomeReplacementRatio(), MATH_CONTEXT);
            BigDecimal retirementAssets = BigDecimal.ZERO;
            for (AssetState asset : year.getAssets()) {
                AssetType type = assetTypes.get(asset.getAssetId());
                if (type != null && type.isRetirementEligible()) {
                    retirementAssets = retirementAssets.add(asset.getBalance());
                }
            }
            RetirementReadiness readiness = growthService.retirementReadiness(retirementAssets, desiredIncome,
                    profile.getAssumptions().getRetirementWithdrawalRate());
            if (readiness.isReady()) {
                found.add(milestoneDetector.retirementReady(year));
                retirementReady = true;
            }
        }

        Set<String> resolved = new HashSet<>(state.getResolvedGoalIds());
        for (Milestone goal : milestoneDetector.goals(profile.getGoals(), resolved, year, assetTypes)) {
            found.add(goal);
            resolved.add(goal.getRelatedId());
        }

        return ProjectionState.builder()
                .yearIndex(state.getYearIndex() + 1)
                .debts(year.getDebts())
                .assets(year.getAssets())
                .netWorth(year.getNetWorth())
                .peakGrossIncome(peak)
                .retirementReady(retirementReady)
                .reachedThresholds(Set.copyOf(reached))
                .resolvedGoalIds(Set.copyOf(resolved))
                .build();
    }

    private static TrajectorySummary summarise(Profile profile, List<TrajectoryYear> years, List<Milestone> milestones) {
        Integer retirementYear = null;
        int goalsAchieved = 0;
        int goalsMissed = 0;
        for (Milestone milestone : milestones) {
            if (milestone.getType() == MilestoneType.RETIREMENT_READY && retirementYear == null) {
                retirementYear = milestone.getYear();
            } else if (milestone.getType() == MilestoneType.GOAL_ACHIEVED) {
                goalsAchieved++;
            } else if (milestone.getType() == MilestoneType.GOAL_MISSED) {
                goalsMissed++;
            }
        }

        BigDecimal income = BigDecimal.ZERO;
        BigDecimal taxes = BigDecimal.ZERO;
        BigDecimal interest = BigDecimal.ZERO;
        BigDecimal hours = BigDecimal.ZERO;
        BigDecimal net = BigDecimal.ZERO;
        BigDecimal netWorthAtRetirement = ZERO;
        for (TrajectoryYear year : years) {
            income = income.add(year.getGrossIncome());
            taxes = taxes.add(year.getTotalTax());
            interest = interest.add(year.getTotalInterestPaid());
            hours = hours.add(year.getTotalWorkHours());
            net = net.add(year.getNetIncome());
            if (retirementYear != null && year.getYear() == retirementYear) {
                netWorthAtRetirement = year.getNetWorth();
            }
        }

        BigDecimal netWorthAtEnd = years.isEmpty()
                ? startingNetWorth(profile)
                : years.get(years.size() - 1).getNetWorth();
        Integer retirementAge = retirementYear == null
                ? null
                : profile.getAssumptions().getCurrentAge() + (retirementYear - profile.getAssumptions().getTaxYear());

        return TrajectorySummary.builder()
                .totalYears(years.size())
                .retirementYear(retirementYear)
                .retirementAge(retirementAge)
                .totalLifetimeIncome(income.setScale(2, RoundingMode.HALF_UP))
                .totalLifetimeTaxes(taxes.setScale(2, RoundingMode.HALF_UP))
                .totalLifetimeInterest(interest.setScale(2, RoundingMode.HALF_UP))
                .netWorthAtRetirement(netWorthAtRetirement)
                .netWorthAtEnd(netWorthAtEnd)
                .totalLifetimeWorkHours(hours.setScale(2, RoundingMode.HALF_UP))
                .averageEffectiveHourlyRate(hours.signum() == 0 ? ZERO : net.divide(hours, 2, RoundingMode.HALF_UP))
                .goalsAchieved(goalsAchieved)
                .goalsMissed(goalsMissed)
                .build();
    }

    private static BigDecimal startingNetWorth(Profile profile) {
        BigDecimal assets = profile.getAssets().stream().map(Asset::getBalance).reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal debts = profile.getDebts().stream().map(Debt::getPrincipal).reduce(BigDecimal.ZERO, BigDecimal::add);
        return assets.subtract(debts).setScale(2, RoundingMode.HALF_UP);
    }
}
