package com.gillianbc.lifeplan.tax;

import com.gillianbc.lifeplan.model.FilingStatus;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Every rate and threshold needed to tax one year. Amounts are in dollars.
 */
@Value
@Builder
public class TaxTable {

    int year;
    @Singular Map<FilingStatus, List<TaxBracket>> federalBrackets;
    @Singular Map<FilingStatus, BigDecimal> standardDeductions;

    @NonNull BigDecimal socialSecurityRate;
    @NonNull BigDecimal socialSecurityWageBase;
    @NonNull BigDecimal medicareRate;
    @NonNull BigDecimal additionalMedicareRate;
    @Singular Map<FilingStatus, BigDecimal> additionalMedicareThresholds;

    @Singular Map<String, StateTaxRule> stateRules;
    @NonNull RetirementLimits retirementLimits;

    public List<TaxBracket> brackets(FilingStatus status) {
        List<TaxBracket> brackets = federalBrackets.get(status);
        if (brackets == null || brackets.isEmpty()) {
            throw new IllegalStateException("No federal brackets for " + status + " in " + year);
        }
        return brackets;
    }

    public BigDecimal standardDeduction(FilingStatus status) {
        return standardDeductions.getOrDefault(status, BigDecimal.ZERO);
    }

    public BigDecimal additionalMedicareThreshold(FilingStatus status) {
        BigDecimal threshold = additionalMedicareThresholds.get(status);
        return threshold != null ? threshold : additionalMedicareThresholds.get(FilingStatus.SINGLE);
    }

    public Optional<StateTaxRule> stateRule(String stateCode) {
        if (stateCode == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(stateRules.get(stateCode.trim().toUpperCase(Locale.ROOT)));
    }
}
