package com.gillianbc.lifeplan.tax;

import com.gillianbc.lifeplan.InvalidInputException;
import com.gillianbc.lifeplan.model.Assumptions;
import com.gillianbc.lifeplan.model.FilingStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Federal, state and FICA tax calculations over a {@link TaxTables} registry.
 * <p>
 * Methods without a year argument use the latest table in the registry.
 * All amounts are dollars rounded HALF_UP to cents; rates carry six decimal places.
 */
@Slf4j
@Service
public class TaxService {

    private static final MathContext MATH_CONTEXT = new MathContext(16, RoundingMode.HALF_UP);
    private static final int RATE_SCALE = 6;
    private static final BigDecimal ZERO = BigDecimal.ZERO.setScale(2);
    private static final BigDecimal ZERO_RATE = BigDecimal.ZERO.setScale(RATE_SCALE);

    private final TaxTables taxTables;

    public TaxService(TaxTables taxTables) {
        this.taxTables = Objects.requireNonNull(taxTables, "taxTables must not be null");
    }

    public TaxTables getTaxTables() {
        return taxTables;
    }

    /**
     * Progressive federal income tax after the standard deduction and pre-tax contributions.
     *
     * @param income       gross annual income (>= 0)
     * @param status       filing status
     * @param contribution pre-tax retirement contribution (>= 0)
     * @param year         tax year; resolved through the registry's lookup policy
     */
    public FederalTaxResult federalTax(BigDecimal income, FilingStatus status, BigDecimal contribution, int year) {
        validateAmounts(income, contribution);
        Objects.requireNonNull(status, "status must not be null");
        TaxTable table = taxTables.forYear(year);

        BigDecimal taxable = nonNegative(income.subtract(contribution).subtract(table.standardDeduction(status)));

        BigDecimal tax = BigDecimal.ZERO;
        for (TaxBracket bracket : table.brackets(status)) {
            if (taxable.compareTo(bracket.getMin()) <= 0) {
                break;
            }
            BigDecimal upper = bracket.isTopBracket() ? taxable : taxable.min(bracket.getMax());
            tax = tax.add(upper.subtract(bracket.getMin()).multiply(bracket.getRate(), MATH_CONTEXT));
        }
        tax = tax.setScale(2, RoundingMode.HALF_UP);

        BigDecimal marginalRate = lastDollarBracket(taxable, table.brackets(status))
                .map(TaxBracket::getRate)
                .orElse(BigDecimal.ZERO);

        return new FederalTaxResult(taxable, tax, marginalRate, rate(tax, income));
    }

    public FederalTaxResult federalTax(BigDecimal income, FilingStatus status, BigDecimal contribution) {
        return federalTax(income, status, contribution, taxTables.latestYear());
    }

    /**
     * State income tax. Progressive states are approximated with their top marginal rate
     * over the whole taxable base; states without income tax always return zero.
     *
     * @throws InvalidInputException if the state code is not known
     */
    public StateTaxResult stateTax(BigDecimal income, String stateCode, BigDecimal contribution, int year) {
        validateAmounts(income, contribution);
        StateTaxRule rule = taxTables.forYear(year).stateRule(stateCode)
                .orElseThrow(() -> new InvalidInputException("state", "must be a known state code (got '" + stateCode + "')"));

        if (!rule.hasIncomeTax()) {
            return new StateTaxResult(ZERO, ZERO, ZERO_RATE);
        }

        BigDecimal taxable = nonNegative(income.subtract(contribution).subtract(rule.getStandardDeduction()));
        BigDecimal tax = taxable.multiply(rule.getRate(), MATH_CONTEXT).setScale(2, RoundingMode.HALF_UP);
        return new StateTaxResult(taxable, tax, rate(tax, income));
    }

    public StateTaxResult stateTax(BigDecimal income, String stateCode, BigDecimal contribution) {
        return stateTax(income, stateCode, contribution, taxTables.latestYear());
    }

    /**
     * Employee Social Security (capped at the wage base) and Medicare (with the additional
     * surcharge above the filing-status threshold).
     */
    public FicaResult fica(BigDecimal income, FilingStatus status, int year) {
        validateAmounts(income, BigDecimal.ZERO);
        Objects.requireNonNull(status, "status must not be null");
        TaxTable table = taxTables.forYear(year);

        BigDecimal socialSecurity = income.min(table.getSocialSecurityWageBase())
                .multiply(table.getSocialSecurityRate(), MATH_CONTEXT)
                .setScale(2, RoundingMode.HALF_UP);

        BigDecimal aboveThreshold = nonNegative(income.subtract(table.additionalMedicareThreshold(status)));
        BigDecimal medicare = income.multiply(table.getMedicareRate(), MATH_CONTEXT)
                .add(aboveThreshold.multiply(table.getAdditionalMedicareRate(), MATH_CONTEXT))
                .setScale(2, RoundingMode.HALF_UP);

        return new FicaResult(socialSecurity, medicare, socialSecurity.add(medicare));
    }

    public FicaResult fica(BigDecimal income, FilingStatus status) {
        return fica(income, status, taxTables.latestYear());
    }

    /**
     * Federal + state + FICA for one year. The effective rate is zero for zero income.
     */
    public TaxSummary totalTax(BigDecimal income, FilingStatus status, String stateCode, BigDecimal contribution, int year) {
        FederalTaxResult federal = federalTax(income, status, contribution, year);
        StateTaxResult state = stateTax(income, stateCode, contribution, year);
        FicaResult fica = fica(income, status, year);

        BigDecimal total = federal.getTax().add(state.getTax()).add(fica.getTotal());
        return TaxSummary.builder()
                .grossIncome(income.setScale(2, RoundingMode.HALF_UP))
                .federalTax(federal.getTax())
                .stateTax(state.getTax())
                .socialSecurity(fica.getSocialSecurity())
                .medicare(fica.getMedicare())
                .totalFica(fica.getTotal())
                .totalTax(total)
                .netIncome(income.subtract(total).setScale(2, RoundingMode.HALF_UP))
                .effectiveRate(rate(total, income))
                .marginalRate(federal.getMarginalRate())
                .build();
    }

    public TaxSummary totalTax(BigDecimal income, FilingStatus status, String stateCode, BigDecimal contribution) {
        return totalTax(income, status, stateCode, contribution, taxTables.latestYear());
    }

    /**
     * Tax saved by making a pre-tax retirement contribution. Exactly zero for a zero contribution.
     */
    public BigDecimal retirementTaxSavings(BigDecimal income, BigDecimal contribution, FilingStatus status,
                                           String stateCode, int year) {
        validateAmounts(income, contribution);
        if (contribution.signum() == 0) {
            return ZERO;
        }
        BigDecimal without = totalTax(income, status, stateCode, BigDecimal.ZERO, year).getTotalTax();
        BigDecimal with = totalTax(income, status, stateCode, contribution, year).getTotalTax();
        return without.subtract(with);
    }

    public BigDecimal retirementTaxSavings(BigDecimal income, BigDecimal contribution, FilingStatus status, String stateCode) {
        return retirementTaxSavings(income, contribution, status, stateCode, taxTables.latestYear());
    }

    /**
     * Approximates tax {@code yearsOut} years ahead of the assumptions' tax year by deflating income
     * to today's money, taxing it with today's brackets and reflating every component.
     */
    public TaxSummary estimateFutureTax(BigDecimal income, BigDecimal contribution, int yearsOut, Assumptions assumptions) {
        Objects.requireNonNull(assumptions, "assumptions must not be null");
        return indexedTax(income, contribution, yearsOut, assumptions, taxTables.resolveYear(assumptions.getTaxYear()));
    }

    public TaxSummary estimateFutureTax(BigDecimal income, int yearsOut, Assumptions assumptions) {
        return estimateFutureTax(income, BigDecimal.ZERO, yearsOut, assumptions);
    }

    /**
     * Tax for a projected calendar year: the year's own table when one exists, otherwise the
     * inflation-indexed estimate against the table the lookup policy resolves to.
     */
    public TaxSummary projectedTax(BigDecimal income, BigDecimal contribution, int calendarYear, Assumptions assumptions) {
        Objects.requireNonNull(assumptions, "assumptions must not be null");
        int baseYear = taxTables.resolveYear(calendarYear);
        int yearsOut = Math.max(0, calendarYear - baseYear);
        return indexedTax(income, contribution, yearsOut, assumptions, baseYear);
    }

    public Optional<TaxBracket> marginalBracket(BigDecimal taxableIncome, FilingStatus status, int year) {
        Objects.requireNonNull(taxableIncome, "taxableIncome must not be null");
        return taxTables.forYear(year).brackets(status).stream()
                .filter(b -> b.contains(taxableIncome))
                .findFirst();
    }

    public Optional<TaxBracket> nextBracket(BigDecimal taxableIncome, FilingStatus status, int year) {
        List<TaxBracket> brackets = taxTables.forYear(year).brackets(status);
        for (int i = 0; i < brackets.size() - 1; i++) {
            if (brackets.get(i).contains(taxableIncome)) {
                return Optional.of(brackets.get(i + 1));
            }
        }
        return Optional.empty();
    }

    /**
     * @return dollars of taxable income left before the next band, or null in the top band
     */
    public BigDecimal distanceToNextBracket(BigDecimal taxableIncome, FilingStatus status, int year) {
        return marginalBracket(taxableIncome, status, year)
                .filter(b -> !b.isTopBracket())
                .map(b -> b.getMax().subtract(taxableIncome))
                .orElse(null);
    }

    private TaxSummary indexedTax(BigDecimal income, BigDecimal contribution, int yearsOut, Assumptions assumptions, int baseYear) {
        validateAmounts(income, contribution);
        FilingStatus status = assumptions.getTaxFilingStatus();
        String state = assumptions.getState();
        if (yearsOut <= 0) {
            return totalTax(income, status, state, contribution, baseYear);
        }

        BigDecimal factor = BigDecimal.ONE.add(assumptions.getInflationRate()).pow(yearsOut, MATH_CONTEXT);
        log.debug("Indexing tax {} years past the {} table (factor {})", yearsOut, baseYear, factor);
        BigDecimal presentIncome = income.divide(factor, MATH_CONTEXT).setScale(2, RoundingMode.HALF_UP);
        BigDecimal presentContribution = contribution.divide(factor, MATH_CONTEXT).setScale(2, RoundingMode.HALF_UP);
        TaxSummary present = totalTax(presentIncome, status, state, presentContribution, baseYear);

        BigDecimal federal = reflate(present.getFederalTax(), factor);
        BigDecimal stateTax = reflate(present.getStateTax(), factor);
        BigDecimal socialSecurity = reflate(present.getSocialSecurity(), factor);
        BigDecimal medicare = reflate(present.getMedicare(), factor);
        BigDecimal fica = socialSecurity.add(medicare);
        BigDecimal total = federal.add(stateTax).add(fica);

        return TaxSummary.builder()
                .grossIncome(income.setScale(2, RoundingMode.HALF_UP))
                .federalTax(federal)
                .stateTax(stateTax)
                .socialSecurity(socialSecurity)
                .medicare(medicare)
                .totalFica(fica)
                .totalTax(total)
                .netIncome(income.subtract(total).setScale(2, RoundingMode.HALF_UP))
                .effectiveRate(rate(total, income))
                .marginalRate(present.getMarginalRate())
                .build();
    }

    private static Optional<TaxBracket> lastDollarBracket(BigDecimal taxable, List<TaxBracket> brackets) {
        if (taxable.signum() <= 0) {
            return Optional.empty();
        }
        return brackets.stream()
                .filter(b -> taxable.compareTo(b.getMin()) > 0 && (b.isTopBracket() || taxable.compareTo(b.getMax()) <= 0))
                .findFirst();
    }

    private static BigDecimal reflate(BigDecimal amount, BigDecimal factor) {
        return amount.multiply(factor, MATH_CONTEXT).setScale(2, RoundingMode.HALF_UP);
    }

    private static BigDecimal rate(BigDecimal tax, BigDecimal income) {
        if (income.signum() == 0) {
            return ZERO_RATE;
        }
        return tax.divide(income, RATE_SCALE, RoundingMode.HALF_UP);
    }

    private static BigDecimal nonNegative(BigDecimal amount) {
        return amount.max(BigDecimal.ZERO).setScale(2, RoundingMode.HALF_UP);
    }

    private static void validateAmounts(BigDecimal income, BigDecimal contribution) {
        Objects.requireNonNull(income, "income must not be null");
        Objects.requireNonNull(contribution, "contribution must not be null");
        if (income.signum() < 0) {
            throw new InvalidInputException("income", "must be >= 0");
        }
        if (contribution.signum() < 0) {
            throw new InvalidInputException("contribution", "must be >= 0");
        }
    }
}
