package com.gillianbc.lifeplan.tax;

import com.gillianbc.lifeplan.model.FilingStatus;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Published federal, FICA and state figures. State rates are the simplified
 * flat or top-marginal rates and are shared by both years.
 */
final class BuiltInTaxTables {

    private static final String[] FEDERAL_RATES = {"0.10", "0.12", "0.22", "0.24", "0.32", "0.35", "0.37"};

    private BuiltInTaxTables() {
    }

    static List<TaxTable> all() {
        return List.of(table2024(), table2025());
    }

    static TaxTable table2024() {
        return TaxTable.builder()
                .year(2024)
                .federalBracket(FilingStatus.SINGLE, brackets(11600, 47150, 100525, 191950, 243725, 609350))
                .federalBracket(FilingStatus.MARRIED_JOINT, brackets(23200, 94300, 201050, 383900, 487450, 731200))
                .federalBracket(FilingStatus.MARRIED_SEPARATE, brackets(11600, 47150, 100525, 191950, 243725, 365600))
                .federalBracket(FilingStatus.HEAD_OF_HOUSEHOLD, brackets(16550, 63100, 100500, 191950, 243700, 609350))
                .standardDeduction(FilingStatus.SINGLE, dollars(14600))
                .standardDeduction(FilingStatus.MARRIED_JOINT, dollars(29200))
                .standardDeduction(FilingStatus.MARRIED_SEPARATE, dollars(14600))
                .standardDeduction(FilingStatus.HEAD_OF_HOUSEHOLD, dollars(21900))
                .socialSecurityRate(new BigDecimal("0.062"))
                .socialSecurityWageBase(dollars(168600))
                .medicareRate(new BigDecimal("0.0145"))
                .additionalMedicareRate(new BigDecimal("0.009"))
                .additionalMedicareThresholds(medicareThresholds())
                .stateRules(stateRules())
                .retirementLimits(new RetirementLimits(dollars(23000), dollars(7500), dollars(7000), dollars(1000)))
                .build();
    }

    static TaxTable table2025() {
        return TaxTable.builder()
                .year(2025)
                .federalBracket(FilingStatus.SINGLE, brackets(11925, 48475, 103350, 197300, 250525, 626350))
                .federalBracket(FilingStatus.MARRIED_JOINT, brackets(23850, 96950, 206700, 394600, 501050, 751600))
                .federalBracket(FilingStatus.MARRIED_SEPARATE, brackets(11925, 48475, 103350, 197300, 250525, 375800))
                .federalBracket(FilingStatus.HEAD_OF_HOUSEHOLD, brackets(17000, 64850, 103350, 197300, 250500, 626350))
                .standardDeduction(FilingStatus.SINGLE, dollars(15750))
                .standardDeduction(FilingStatus.MARRIED_JOINT, dollars(31500))
                .standardDeduction(FilingStatus.MARRIED_SEPARATE, dollars(15750))
                .standardDeduction(FilingStatus.HEAD_OF_HOUSEHOLD, dollars(23625))
                .socialSecurityRate(new BigDecimal("0.062"))
                .socialSecurityWageBase(dollars(176100))
                .medicareRate(new BigDecimal("0.0145"))
                .additionalMedicareRate(new BigDecimal("0.009"))
                .additionalMedicareThresholds(medicareThresholds())
                .stateRules(stateRules())
                .retirementLimits(new RetirementLimits(dollars(23500), dollars(7500), dollars(7000), dollars(1000)))
                .build();
    }

    /**
     * Builds the seven standard federal bands from the six upper bounds.
     */
    private static List<TaxBracket> brackets(long... upperBounds) {
        if (upperBounds.length != FEDERAL_RATES.length - 1) {
            throw new IllegalArgumentException("expected " + (FEDERAL_RATES.length - 1) + " bounds");
        }
        List<TaxBracket> brackets = new ArrayList<>();
        BigDecimal min = BigDecimal.ZERO.setScale(2);
        for (int i = 0; i < FEDERAL_RATES.length; i++) {
            BigDecimal max = i < upperBounds.length ? dollars(upperBounds[i]) : null;
            brackets.add(new TaxBracket(min, max, new BigDecimal(FEDERAL_RATES[i])));
            min = max;
        }
        return List.copyOf(brackets);
    }

    private static Map<FilingStatus, BigDecimal> medicareThresholds() {
        Map<FilingStatus, BigDecimal> thresholds = new LinkedHashMap<>();
        thresholds.put(FilingStatus.SINGLE, dollars(200000));
        thresholds.put(FilingStatus.HEAD_OF_HOUSEHOLD, dollars(200000));
        thresholds.put(FilingStatus.MARRIED_JOINT, dollars(250000));
        thresholds.put(FilingStatus.MARRIED_SEPARATE, dollars(125000));
        return thresholds;
    }

    private static Map<String, StateTaxRule> stateRules() {
        Map<String, StateTaxRule> rules = new LinkedHashMap<>();
        // No income tax
        none(rules, "AK", "Alaska");
        none(rules, "FL", "Florida");
        none(rules, "NV", "Nevada");
        none(rules, "SD", "South Dakota");
        none(rules, "TX", "Texas");
        none(rules, "WA", "Washington");
        none(rules, "WY", "Wyoming");
        none(rules, "TN", "Tennessee");
        none(rules, "NH", "New Hampshire");
        // Flat
        flat(rules, "CO", "Colorado", "0.044", 0);
        flat(rules, "IL", "Illinois", "0.0495", 0);
        flat(rules, "IN", "Indiana", "0.0305", 0);
        flat(rules, "KY", "Kentucky", "0.04", 2960);
        flat(rules, "MA", "Massachusetts", "0.05", 0);
        flat(rules, "MI", "Michigan", "0.0425", 0);
        flat(rules, "NC", "North Carolina", "0.0525", 12750);
        flat(rules, "PA", "Pennsylvania", "0.0307", 0);
        flat(rules, "UT", "Utah", "0.0465", 0);
        // Progressive, top marginal rate
        progressive(rules, "AL", "Alabama", "0.05", 3000);
        progressive(rules, "AZ", "Arizona", "0.025", 14136);
        progressive(rules, "AR", "Arkansas", "0.044", 2460);
        progressive(rules, "CA", "California", "0.133", 5456);
        progressive(rules, "CT", "Connecticut", "0.0699", 0);
        progressive(rules, "DE", "Delaware", "0.066", 3300);
        progressive(rules, "DC", "District of Columbia", "0.1075", 0);
        progressive(rules, "GA", "Georgia", "0.0549", 12400);
        progressive(rules, "HI", "Hawaii", "0.11", 2480);
        progressive(rules, "ID", "Idaho", "0.058", 14600);
        progressive(rules, "IA", "Iowa", "0.057", 0);
        progressive(rules, "KS", "Kansas", "0.057", 3000);
        progressive(rules, "LA", "Louisiana", "0.0425", 0);
        progressive(rules, "ME", "Maine", "0.0715", 14100);
        progressive(rules, "MD", "Maryland", "0.0575", 2650);
        progressive(rules, "MN", "Minnesota", "0.0985", 14600);
        progressive(rules, "MS", "Mississippi", "0.05", 0);
        progressive(rules, "MO", "Missouri", "0.048", 0);
        progressive(rules, "MT", "Montana", "0.059", 5650);
        progressive(rules, "NE", "Nebraska", "0.0584", 0);
        progressive(rules, "NJ", "New Jersey", "0.1075", 0);
        progressive(rules, "NM", "New Mexico", "0.059", 0);
        progressive(rules, "NY", "New York", "0.109", 8000);
        progressive(rules, "ND", "North Dakota", "0.029", 0);
        progressive(rules, "OH", "Ohio", "0.035", 0);
        progressive(rules, "OK", "Oklahoma", "0.0475", 0);
        progressive(rules, "OR", "Oregon", "0.099", 2600);
        progressive(rules, "RI", "Rhode Island", "0.0599", 10250);
        progressive(rules, "SC", "South Carolina", "0.064", 0);
        progressive(rules, "VT", "Vermont", "0.0875", 6990);
        progressive(rules, "VA", "Virginia", "0.0575", 8000);
        progressive(rules, "WV", "West Virginia", "0.055", 0);
        progressive(rules, "WI", "Wisconsin", "0.0765", 13240);
        return rules;
    }

    private static void none(Map<String, StateTaxRule> rules, String code, String name) {
        rules.put(code, new StateTaxRule(code, name, StateTaxType.NONE, BigDecimal.ZERO, BigDecimal.ZERO));
    }

    private static void flat(Map<String, StateTaxRule> rules, String code, String name, String rate, long deduction) {
        rules.put(code, new StateTaxRule(code, name, StateTaxType.FLAT, new BigDecimal(rate), dollars(deduction)));
    }

    private static void progressive(Map<String, StateTaxRule> rules, String code, String name, String rate, long deduction) {
        rules.put(code, new StateTaxRule(code, name, StateTaxType.PROGRESSIVE, new BigDecimal(rate), dollars(deduction)));
    }

    private static BigDecimal dollars(long amount) {
        return BigDecimal.valueOf(amount).setScale(2);
    }
}
