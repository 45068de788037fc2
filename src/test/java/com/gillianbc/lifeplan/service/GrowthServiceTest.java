package com.gillianbc.lifeplan.service;

import com.gillianbc.lifeplan.InvalidInputException;
import com.gillianbc.lifeplan.model.Asset;
import com.gillianbc.lifeplan.model.AssetType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GrowthServiceTest {

    private final GrowthService service = new GrowthService();

    @Test
    @DisplayName("Zero return just adds the contributions")
    void yearlyGrowth_zeroReturn() {
        GrowthResult result = service.yearlyGrowth(new BigDecimal("1000"), new BigDecimal("100"), BigDecimal.ZERO);
        assertEquals(new BigDecimal("2200.00"), result.getEndingBalance());
        assertEquals(new BigDecimal("1200.00"), result.getContributions());
        assertEquals(new BigDecimal("0.00"), result.getGrowth());
    }

    @Test
    @DisplayName("Ending balance = start + deposits + growth")
    void yearlyGrowth_identity() {
        GrowthResult result = service.yearlyGrowth(new BigDecimal("50000"), new BigDecimal("500"), new BigDecimal("0.07"));
        assertEquals(result.getEndingBalance(),
                result.getStartingBalance().add(result.getTotalContributions()).add(result.getGrowth()));
        assertTrue(result.getGrowth().signum() > 0);
    }

    @Test
    @DisplayName("A negative return shrinks the balance but never below zero")
    void yearlyGrowth_negativeReturn() {
        GrowthResult result = service.yearlyGrowth(new BigDecimal("10000"), BigDecimal.ZERO, new BigDecimal("-0.20"));
        assertTrue(result.getEndingBalance().compareTo(new BigDecimal("10000")) < 0);
        assertTrue(result.getEndingBalance().signum() >= 0);
    }

    @Test
    @DisplayName("Return of -100% or below throws InvalidInputException")
    void yearlyGrowth_returnTooLow_throws() {
        assertThrows(InvalidInputException.class, () ->
                service.yearlyGrowth(new BigDecimal("100"), BigDecimal.ZERO, new BigDecimal("-1")));
    }

    @Test
    @DisplayName("Employer match is capped at the salary limit")
    void employerMatch_capped() {
        // 1000/month = 12000/year; cap 6% of 100000 = 6000; 50% of 6000
        assertEquals(new BigDecimal("3000.00"), service.employerMatch(new BigDecimal("1000"), new BigDecimal("100000"),
                new BigDecimal("0.50"), new BigDecimal("0.06")));
    }

    @Test
    @DisplayName("Employer match below the cap matches the full contribution")
    void employerMatch_underCap() {
        assertEquals(new BigDecimal("2400.00"), service.employerMatch(new BigDecimal("200"), new BigDecimal("100000"),
                BigDecimal.ONE, new BigDecimal("0.06")));
    }

    @Test
    @DisplayName("An asset year deposits the match alongside own contributions")
    void assetYear_includesMatch() {
        Asset asset = Asset.builder()
                .id("k")
                .name("401k")
                .type(AssetType.RETIREMENT_PRETAX)
                .balance(BigDecimal.ZERO)
                .monthlyContribution(new BigDecimal("200"))
                .employerMatch(BigDecimal.ONE)
                .matchLimit(new BigDecimal("0.06"))
                .build();
        GrowthResult result = service.assetYear(asset, BigDecimal.ZERO, new BigDecimal("100000"), BigDecimal.ZERO);
        assertEquals(new BigDecimal("2400.00"), result.getContributions());
        assertEquals(new BigDecimal("2400.00"), result.getEmployerMatch());
        assertEquals(new BigDecimal("4800.00"), result.getEndingBalance());
    }

    @Test
    @DisplayName("The reported match is what the rounded monthly deposits add up to")
    void assetYear_matchNotDivisibleByTwelve() {
        // 1% of 100000 caps the match at 1000.00, deposited as 83.33 a month
        Asset asset = Asset.builder()
                .id("k")
                .name("401k")
                .type(AssetType.RETIREMENT_PRETAX)
                .balance(BigDecimal.ZERO)
                .monthlyContribution(new BigDecimal("100"))
                .employerMatch(BigDecimal.ONE)
                .matchLimit(new BigDecimal("0.01"))
                .build();
        GrowthResult result = service.assetYear(asset, BigDecimal.ZERO, new BigDecimal("100000"), BigDecimal.ZERO);
        assertEquals(new BigDecimal("999.96"), result.getEmployerMatch());
        assertEquals(result.getTotalContributions(), result.getContributions().add(result.getEmployerMatch()));
        assertEquals(new BigDecimal("2199.96"), result.getEndingBalance());
    }

    @Test
    @DisplayName("Projection list starts with the starting balance")
    void projectOverYears_length() {
        List<BigDecimal> balances = service.projectOverYears(new BigDecimal("1000"), new BigDecimal("100"), BigDecimal.ZERO, 3);
        assertEquals(4, balances.size());
        assertEquals(new BigDecimal("1000.00"), balances.get(0));
        assertEquals(new BigDecimal("4600.00"), balances.get(3));
    }

    @Test
    @DisplayName("Future value compounds annually")
    void futureValue_compounds() {
        assertEquals(new BigDecimal("1102.50"), service.futureValue(new BigDecimal("1000"), new BigDecimal("0.05"), 2));
        assertEquals(new BigDecimal("1000.00"), service.futureValue(new BigDecimal("1000"), new BigDecimal("0.05"), 0));
    }

    @Test
    @DisplayName("Property appreciates like a lump sum")
    void propertyAppreciation() {
        assertEquals(new BigDecimal("318270.00"), service.propertyAppreciation(new BigDecimal("300000"), new BigDecimal("0.03"), 2));
    }

    @Test
    @DisplayName("Present value of a future value comes back within a dollar")
    void presentValue_roundTrip() {
        BigDecimal amount = new BigDecimal("12345.67");
        for (String rate : List.of("-0.05", "0", "0.07", "0.5")) {
            for (int years : new int[]{0, 10, 30, 75}) {
                BigDecimal r = new BigDecimal(rate);
                BigDecimal back = service.presentValue(service.futureValue(amount, r, years), r, years);
                assertTrue(back.subtract(amount).abs().compareTo(BigDecimal.ONE) <= 0,
                        "rate " + rate + " years " + years + " gave " + back);
            }
        }
    }

    @Test
    @DisplayName("Already at target needs zero years; unreachable target gives null")
    void yearsToTarget_edges() {
        assertEquals(0, service.yearsToTarget(new BigDecimal("5000"), BigDecimal.ZERO, BigDecimal.ZERO, new BigDecimal("5000")));
        assertNull(service.yearsToTarget(BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, new BigDecimal("1")));
        assertEquals(5, service.yearsToTarget(BigDecimal.ZERO, new BigDecimal("100"), BigDecimal.ZERO, new BigDecimal("6000")));
    }

    @Test
    @DisplayName("Required savings at zero return spreads the gap evenly")
    void requiredMonthlySavings_zeroReturn() {
        assertEquals(new BigDecimal("100.00"),
                service.requiredMonthlySavings(BigDecimal.ZERO, new BigDecimal("12000"), BigDecimal.ZERO, 10));
    }

    @Test
    @DisplayName("Required savings is never negative")
    void requiredMonthlySavings_alreadyThere() {
        assertEquals(new BigDecimal("0.00"),
                service.requiredMonthlySavings(new BigDecimal("50000"), new BigDecimal("10000"), new BigDecimal("0.05"), 10));
    }

    @Test
    @DisplayName("Nest egg is income over withdrawal rate")
    void retirementReadiness_nestEgg() {
        RetirementReadiness readiness = service.retirementReadiness(new BigDecimal("500000"), new BigDecimal("40000"), new BigDecimal("0.04"));
        assertEquals(new BigDecimal("1000000.00"), readiness.getRequiredNestEgg());
        assertEquals(0, new BigDecimal("0.5").compareTo(readiness.getPercentageComplete()));
        assertFalse(readiness.isReady());
        assertEquals(new BigDecimal("20000.00"), readiness.getSustainableWithdrawal());
    }

    @Test
    @DisplayName("Zero withdrawal rate is never ready")
    void retirementReadiness_zeroWithdrawal() {
        RetirementReadiness readiness = service.retirementReadiness(new BigDecimal("5000000"), new BigDecimal("40000"), BigDecimal.ZERO);
        assertFalse(readiness.isReady());
        assertEquals(new BigDecimal("0.00"), readiness.getRequiredNestEgg());
    }
}
