package com.gillianbc.lifeplan.service;

import com.gillianbc.lifeplan.InvalidInputException;
import com.gillianbc.lifeplan.config.ProjectionProperties;
import com.gillianbc.lifeplan.model.Trajectory;
import com.gillianbc.lifeplan.model.TrajectorySummary;
import com.gillianbc.lifeplan.model.TrajectoryYear;
import com.gillianbc.lifeplan.model.comparison.Change;
import com.gillianbc.lifeplan.model.comparison.Comparison;
import com.gillianbc.lifeplan.model.comparison.ComparisonSummary;
import com.gillianbc.lifeplan.model.comparison.CumulativeImpact;
import com.gillianbc.lifeplan.model.comparison.RetirementImpact;
import com.gillianbc.lifeplan.model.comparison.YearComparison;
import com.gillianbc.lifeplan.model.comparison.YearDelta;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Lines up two trajectories of the same person and describes what changed between them.
 */
@Slf4j
@Service
public class ComparisonService {

    public static final String DEFAULT_NAME = "Comparison";
    static final String MINIMAL_DIFFERENCE = "Minimal difference between scenarios";

    private static final BigDecimal ZERO = BigDecimal.ZERO.setScale(2);

    private final ProjectionProperties properties;
    private final Clock clock;

    public ComparisonService(ProjectionProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    public Comparison compareTrajectories(Trajectory baseline, Trajectory alternate, List<Change> changes) {
        return compareTrajectories(baseline, alternate, changes, DEFAULT_NAME);
    }

    /**
     * Deltas are alternate minus baseline for every year present in both trajectories.
     *
     * @throws InvalidInputException if the trajectories start in different years or ages
     */
    public Comparison compareTrajectories(Trajectory baseline, Trajectory alternate, List<Change> changes, String name) {
        Objects.requireNonNull(baseline, "baseline must not be null");
        Objects.requireNonNull(alternate, "alternate must not be null");
        Objects.requireNonNull(changes, "changes must not be null");
        Objects.requireNonNull(name, "name must not be null");
        checkAligned(baseline, alternate);

        long started = System.nanoTime();
        List<YearDelta> deltas = yearDeltas(baseline, alternate);
        ComparisonSummary summary = summarise(baseline.getSummary(), alternate.getSummary());
        log.info("Compared '{}' over {} shared years in {} ms: {}", name, deltas.size(),
                (System.nanoTime() - started) / 1_000_000, summary.getKeyInsight());
        return new Comparison(name, clock.instant(), baseline, alternate, changes, deltas, summary);
    }

    /**
     * One sentence naming the material differences, or {@value #MINIMAL_DIFFERENCE}.
     */
    public String generateKeyInsight(RetirementImpact impact, BigDecimal netWorthAtEndDelta,
                                     BigDecimal lifetimeInterestDelta, BigDecimal workHoursDelta) {
        ProjectionProperties.Insight thresholds = properties.getInsight();
        List<String> insights = new ArrayList<>();

        switch (impact.getOutcome()) {
            case ENABLED_BY_CHANGE -> insights.add("This change enables retirement");
            case DISABLED_BY_CHANGE -> insights.add("This change prevents retirement");
            case BOTH_ACHIEVED -> {
                int months = impact.getMonthsEarlier();
                if (months != 0) {
                    String years = BigDecimal.valueOf(Math.abs(months)).divide(BigDecimal.valueOf(12), 1, RoundingMode.HALF_UP).toPlainString();
                    insights.add("Retire " + years + " years " + (months > 0 ? "earlier" : "later"));
                }
            }
            case NEITHER_ACHIEVED -> {
            }
        }

        if (netWorthAtEndDelta.abs().compareTo(thresholds.getNetWorthThreshold()) >= 0) {
            insights.add(Money.compact(netWorthAtEndDelta.abs()) + (netWorthAtEndDelta.signum() > 0 ? " more" : " less") + " at end");
        }

        if (lifetimeInterestDelta.abs().compareTo(thresholds.getInterestThreshold()) >= 0) {
            String amount = Money.compact(lifetimeInterestDelta.abs());
            insights.add(lifetimeInterestDelta.signum() < 0
                    ? "Save " + amount + " in interest"
                    : "Pay " + amount + " more in interest");
        }

        BigDecimal workYear = thresholds.getWorkHoursThreshold();
        if (workYear.signum() > 0 && workHoursDelta.abs().compareTo(workYear) >= 0) {
            String years = workHoursDelta.abs().divide(workYear, 1, RoundingMode.HALF_UP).toPlainString();
            insights.add("Work " + years + (workHoursDelta.signum() < 0 ? " fewer" : " more") + " years");
        }

        return insights.isEmpty() ? MINIMAL_DIFFERENCE : String.join(". ", insights);
    }

    /**
     * The year with the largest absolute net worth difference; the earliest wins a tie.
     */
    public Optional<YearDelta> findMaxDivergenceYear(List<YearDelta> deltas) {
        YearDelta max = null;
        for (YearDelta delta : deltas) {
            if (max == null || delta.getNetWorthDelta().abs().compareTo(max.getNetWorthDelta().abs()) > 0) {
                max = delta;
            }
        }
        return Optional.ofNullable(max);
    }

    /**
     * First year in which the net worth difference changes sign.
     */
    public Optional<Integer> findCrossoverYear(List<YearDelta> deltas) {
        for (int i = 1; i < deltas.size(); i++) {
            int previous = deltas.get(i - 1).getNetWorthDelta().signum();
            int current = deltas.get(i).getNetWorthDelta().signum();
            if ((previous <= 0 && current > 0) || (previous >= 0 && current < 0)) {
                return Optional.of(deltas.get(i).getYear());
            }
        }
        return Optional.empty();
    }

    /**
     * First year at which the running total of net worth differences turns positive.
     */
    public Optional<Integer> findBreakEvenYear(List<YearDelta> deltas) {
        BigDecimal cumulative = BigDecimal.ZERO;
        for (YearDelta delta : deltas) {
            cumulative = cumulative.add(delta.getNetWorthDelta());
            if (cumulative.signum() > 0) {
                return Optional.of(delta.getYear());
            }
        }
        return Optional.empty();
    }

    /**
     * Income and tax deltas summed over {@code startYear..endYear} inclusive; net worth is the
     * delta in the last year of the range, not a sum.
     */
    public CumulativeImpact calculateCumulativeImpact(List<YearDelta> deltas, int startYear, int endYear) {
        List<YearDelta> range = deltas.stream()
                .filter(d -> d.getYear() >= startYear && d.getYear() <= endYear)
                .collect(Collectors.toList());
        if (range.isEmpty()) {
            return CumulativeImpact.builder()
                    .startYear(startYear)
                    .endYear(endYear)
                    .years(0)
                    .incomeDelta(ZERO)
                    .taxesDelta(ZERO)
                    .netWorthDelta(ZERO)
                    .averageYearlyBenefit(ZERO)
                    .build();
        }

        BigDecimal income = BigDecimal.ZERO;
        BigDecimal taxes = BigDecimal.ZERO;
        for (YearDelta delta : range) {
            income = income.add(delta.getIncomeDelta());
            taxes = taxes.add(delta.getTaxesDelta());
        }
        BigDecimal netWorth = range.get(range.size() - 1).getNetWorthDelta();
        return CumulativeImpact.builder()
                .startYear(startYear)
                .endYear(endYear)
                .years(range.size())
                .incomeDelta(income.setScale(2, RoundingMode.HALF_UP))
                .taxesDelta(taxes.setScale(2, RoundingMode.HALF_UP))
                .netWorthDelta(netWorth.setScale(2, RoundingMode.HALF_UP))
                .averageYearlyBenefit(netWorth.divide(BigDecimal.valueOf(range.size()), 2, RoundingMode.HALF_UP))
                .build();
    }

    /**
     * Both years and their delta, if the year is in both trajectories.
     */
    public Optional<YearComparison> comparisonAtYear(Comparison comparison, int year) {
        Optional<TrajectoryYear> baseline = comparison.getBaseline().findYear(year);
        Optional<TrajectoryYear> alternate = comparison.getAlternate().findYear(year);
        Optional<YearDelta> delta = comparison.getDeltas().stream().filter(d -> d.getYear() == year).findFirst();
        if (baseline.isEmpty() || alternate.isEmpty() || delta.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new YearComparison(baseline.get(), alternate.get(), delta.get()));
    }

    private static void checkAligned(Trajectory baseline, Trajectory alternate) {
        if (baseline.getYears().isEmpty() || alternate.getYears().isEmpty()) {
            return;
        }
        TrajectoryYear first = baseline.getYears().get(0);
        TrajectoryYear other = alternate.getYears().get(0);
        if (first.getYear() != other.getYear()) {
            throw new InvalidInputException("alternate.years[0].year", "must equal baseline start year " + first.getYear());
        }
        if (first.getAge() != other.getAge()) {
            throw new InvalidInputException("alternate.years[0].age", "must equal baseline start age " + first.getAge());
        }
    }

    private static List<YearDelta> yearDeltas(Trajectory baseline, Trajectory alternate) {
        Map<Integer, TrajectoryYear> baselineYears = baseline.getYears().stream()
                .collect(Collectors.toMap(TrajectoryYear::getYear, Function.identity()));
        List<YearDelta> deltas = new ArrayList<>();
        for (TrajectoryYear alt : alternate.getYears()) {
            TrajectoryYear base = baselineYears.get(alt.getYear());
            if (base != null) {
                deltas.add(YearDelta.builder()
                        .year(alt.getYear())
                        .age(alt.getAge())
                        .netWorthDelta(alt.getNetWorth().subtract(base.getNetWorth()))
                        .incomeDelta(alt.getGrossIncome().subtract(base.getGrossIncome()))
                        .taxesDelta(alt.getTotalTax().subtract(base.getTotalTax()))
                        .debtDelta(alt.getTotalDebt().subtract(base.getTotalDebt()))
                        .assetsDelta(alt.getTotalAssets().subtract(base.getTotalAssets()))
                        .build());
            }
        }
        return deltas;
    }

    private ComparisonSummary summarise(TrajectorySummary baseline, TrajectorySummary alternate) {
        RetirementImpact impact = RetirementImpact.of(baseline.getRetirementYear(), alternate.getRetirementYear());
        BigDecimal interest = alternate.getTotalLifetimeInterest().subtract(baseline.getTotalLifetimeInterest());
        BigDecimal atRetirement = alternate.getNetWorthAtRetirement().subtract(baseline.getNetWorthAtRetirement());
        BigDecimal hours = alternate.getTotalLifetimeWorkHours().subtract(baseline.getTotalLifetimeWorkHours());
        BigDecimal atEnd = alternate.getNetWorthAtEnd().subtract(baseline.getNetWorthAtEnd());
        return ComparisonSummary.builder()
                .retirementImpact(impact)
                .lifetimeInterestDelta(interest)
                .netWorthAtRetirementDelta(atRetirement)
                .totalWorkHoursDelta(hours)
                .netWorthAtEndDelta(atEnd)
                .keyInsight(generateKeyInsight(impact, atEnd, interest, hours))
                .build();
    }
}
