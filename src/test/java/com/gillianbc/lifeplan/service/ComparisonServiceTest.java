package com.gillianbc.lifeplan.service;

import com.gillianbc.lifeplan.InvalidInputException;
import com.gillianbc.lifeplan.model.Assumptions;
import com.gillianbc.lifeplan.model.Profile;
import com.gillianbc.lifeplan.model.Trajectory;
import com.gillianbc.lifeplan.model.comparison.AssumptionChange;
import com.gillianbc.lifeplan.model.comparison.AssumptionField;
import com.gillianbc.lifeplan.model.comparison.Change;
import com.gillianbc.lifeplan.model.comparison.Comparison;
import com.gillianbc.lifeplan.model.comparison.CumulativeImpact;
import com.gillianbc.lifeplan.model.comparison.DebtPaymentChange;
import com.gillianbc.lifeplan.model.comparison.IncomeAmountChange;
import com.gillianbc.lifeplan.model.comparison.RetirementImpact;
import com.gillianbc.lifeplan.model.comparison.YearComparison;
import com.gillianbc.lifeplan.model.comparison.YearDelta;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ComparisonServiceTest {

    private final TrajectoryService trajectories = ProfileFixtures.trajectoryService();
    private final ComparisonService service = ProfileFixtures.comparisonService();

    private static YearDelta delta(int year, String netWorth) {
        return YearDelta.builder()
                .year(year)
                .age(year - 1994)
                .netWorthDelta(new BigDecimal(netWorth))
                .incomeDelta(new BigDecimal("100"))
                .taxesDelta(new BigDecimal("10"))
                .debtDelta(BigDecimal.ZERO)
                .assetsDelta(new BigDecimal(netWorth))
                .build();
    }

    @Test
    @DisplayName("Identical trajectories show no difference")
    void compareTrajectories_identical() {
        Trajectory trajectory = trajectories.generateTrajectory(ProfileFixtures.household());
        Comparison comparison = service.compareTrajectories(trajectory, trajectory, List.of());

        assertEquals(ComparisonService.DEFAULT_NAME, comparison.getName());
        assertEquals(trajectory.getYears().size(), comparison.getDeltas().size());
        for (YearDelta delta : comparison.getDeltas()) {
            assertEquals(0, delta.getNetWorthDelta().signum());
        }
        assertEquals(0, comparison.getSummary().getNetWorthAtEndDelta().signum());
        assertEquals(ComparisonService.MINIMAL_DIFFERENCE, comparison.getSummary().getKeyInsight());
        assertTrue(service.findCrossoverYear(comparison.getDeltas()).isEmpty());
        assertTrue(service.findBreakEvenYear(comparison.getDeltas()).isEmpty());
    }

    @Test
    @DisplayName("A raise produces more net worth at the end")
    void compareTrajectories_raise() {
        Profile baseline = ProfileFixtures.household();
        Profile alternate = baseline.toBuilder()
                .clearIncomes()
                .income(ProfileFixtures.salary("120000"))
                .build();
        List<Change> changes = List.of(new IncomeAmountChange("salary", "Salary", new BigDecimal("85000"), new BigDecimal("120000")));

        Comparison comparison = service.compareTrajectories(trajectories.generateTrajectory(baseline),
                trajectories.generateTrajectory(alternate), changes, "Raise");

        assertEquals("Raise", comparison.getName());
        assertEquals(ProfileFixtures.NOW, comparison.getCreatedAt());
        assertTrue(comparison.getDeltas().get(0).getIncomeDelta().signum() > 0);
        assertTrue(comparison.getDeltas().get(0).getTaxesDelta().signum() > 0);
        assertEquals("Salary: $85,000.00 → $120,000.00", comparison.getChanges().get(0).describe());
    }

    @Test
    @DisplayName("Only overlapping years are compared")
    void compareTrajectories_overlapOnly() {
        Profile profile = ProfileFixtures.household();
        Comparison comparison = service.compareTrajectories(trajectories.generateTrajectory(profile),
                trajectories.generateQuickTrajectory(profile, 5), List.of());
        assertEquals(5, comparison.getDeltas().size());
    }

    @Test
    @DisplayName("Trajectories starting at different ages are rejected")
    void compareTrajectories_misaligned_throws() {
        Profile profile = ProfileFixtures.household();
        Profile older = profile.toBuilder().assumptions(Assumptions.builder().currentAge(40).build()).build();
        assertThrows(InvalidInputException.class, () -> service.compareTrajectories(
                trajectories.generateTrajectory(profile), trajectories.generateTrajectory(older), List.of()));
    }

    @Test
    @DisplayName("Retirement impact distinguishes enabled, disabled and shifted retirement")
    void retirementImpact_outcomes() {
        assertEquals(RetirementImpact.Outcome.ENABLED_BY_CHANGE, RetirementImpact.of(null, 2050).getOutcome());
        assertEquals(RetirementImpact.Outcome.DISABLED_BY_CHANGE, RetirementImpact.of(2050, null).getOutcome());
        assertEquals(RetirementImpact.Outcome.NEITHER_ACHIEVED, RetirementImpact.of(null, null).getOutcome());
        RetirementImpact both = RetirementImpact.of(2050, 2048);
        assertEquals(RetirementImpact.Outcome.BOTH_ACHIEVED, both.getOutcome());
        assertEquals(24, both.getMonthsEarlier());
        assertNull(RetirementImpact.of(null, 2050).getMonthsEarlier());
    }

    @Test
    @DisplayName("Key insight joins every material difference")
    void generateKeyInsight_combined() {
        String insight = service.generateKeyInsight(RetirementImpact.of(2050, 2048),
                new BigDecimal("150000"), new BigDecimal("-5000"), new BigDecimal("-4160"));
        assertEquals("Retire 2.0 years earlier. $150K more at end. Save $5K in interest. Work 2.0 fewer years", insight);
    }

    @Test
    @DisplayName("Key insight reports enabled retirement and extra interest")
    void generateKeyInsight_enabledAndMoreInterest() {
        String insight = service.generateKeyInsight(RetirementImpact.of(null, 2050),
                BigDecimal.ZERO, new BigDecimal("2500"), BigDecimal.ZERO);
        assertEquals("This change enables retirement. Pay $3K more in interest", insight);
    }

    @Test
    @DisplayName("Differences below the thresholds are minimal")
    void generateKeyInsight_minimal() {
        String insight = service.generateKeyInsight(RetirementImpact.of(null, null),
                new BigDecimal("99999"), new BigDecimal("-999"), new BigDecimal("2079"));
        assertEquals(ComparisonService.MINIMAL_DIFFERENCE, insight);
    }

    @Test
    @DisplayName("Max divergence picks the largest absolute net worth delta")
    void findMaxDivergenceYear() {
        List<YearDelta> deltas = List.of(delta(2024, "100"), delta(2025, "-500"), delta(2026, "300"));
        assertEquals(2025, service.findMaxDivergenceYear(deltas).orElseThrow().getYear());
        assertTrue(service.findMaxDivergenceYear(List.of()).isEmpty());
    }

    @Test
    @DisplayName("Crossover is the first sign change")
    void findCrossoverYear() {
        List<YearDelta> deltas = List.of(delta(2024, "-100"), delta(2025, "-50"), delta(2026, "20"), delta(2027, "-5"));
        assertEquals(Optional.of(2026), service.findCrossoverYear(deltas));
    }

    @Test
    @DisplayName("Break-even waits for the running total to turn positive")
    void findBreakEvenYear() {
        List<YearDelta> deltas = List.of(delta(2024, "-100"), delta(2025, "60"), delta(2026, "60"));
        assertEquals(Optional.of(2026), service.findBreakEvenYear(deltas));
    }

    @Test
    @DisplayName("Cumulative impact sums flows and takes the last net worth delta")
    void calculateCumulativeImpact() {
        List<YearDelta> deltas = List.of(delta(2024, "-100"), delta(2025, "60"), delta(2026, "90"), delta(2027, "1000"));
        CumulativeImpact impact = service.calculateCumulativeImpact(deltas, 2024, 2026);
        assertEquals(3, impact.getYears());
        assertEquals(new BigDecimal("300.00"), impact.getIncomeDelta());
        assertEquals(new BigDecimal("30.00"), impact.getTaxesDelta());
        assertEquals(new BigDecimal("90.00"), impact.getNetWorthDelta());
        assertEquals(new BigDecimal("30.00"), impact.getAverageYearlyBenefit());
    }

    @Test
    @DisplayName("An empty range gives zeros")
    void calculateCumulativeImpact_empty() {
        CumulativeImpact impact = service.calculateCumulativeImpact(List.of(delta(2024, "5")), 2030, 2040);
        assertEquals(0, impact.getYears());
        assertEquals(new BigDecimal("0.00"), impact.getNetWorthDelta());
    }

    @Test
    @DisplayName("Comparison at a year returns both sides and the delta")
    void comparisonAtYear() {
        Trajectory trajectory = trajectories.generateQuickTrajectory(ProfileFixtures.household(), 3);
        Comparison comparison = service.compareTrajectories(trajectory, trajectory, List.of());
        Optional<YearComparison> year = service.comparisonAtYear(comparison, 2025);
        assertTrue(year.isPresent());
        assertEquals(2025, year.get().getDelta().getYear());
        assertTrue(service.comparisonAtYear(comparison, 2090).isEmpty());
    }

    @Test
    @DisplayName("Change descriptions show typed old and new values")
    void changeDescriptions() {
        assertEquals("Market return: 7% → 5%",
                new AssumptionChange(AssumptionField.MARKET_RETURN, new BigDecimal("0.07"), new BigDecimal("0.05")).describe());
        assertEquals("Car loan payment: $356.42/mo → $500.00/mo",
                new DebtPaymentChange("car", "Car loan", new BigDecimal("356.42"), new BigDecimal("500")).describe());
    }
}
