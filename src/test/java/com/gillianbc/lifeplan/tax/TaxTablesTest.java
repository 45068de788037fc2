package com.gillianbc.lifeplan.tax;

import com.gillianbc.lifeplan.model.FilingStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TaxTablesTest {

    private final TaxTables tables = TaxTables.builtIn();

    @Test
    @DisplayName("Built-in tables cover 2024 and 2025")
    void builtIn_years() {
        assertEquals(2024, tables.firstYear());
        assertEquals(2025, tables.latestYear());
        assertTrue(tables.hasTable(2024));
        assertFalse(tables.hasTable(2026));
    }

    @Test
    @DisplayName("Later years resolve to the latest table, earlier years to the first")
    void resolveYear_policy() {
        assertEquals(2025, tables.resolveYear(2040));
        assertEquals(2024, tables.resolveYear(2024));
        assertEquals(2024, tables.resolveYear(1999));
    }

    @Test
    @DisplayName("Brackets for every status are contiguous and open-ended at the top")
    void brackets_contiguous() {
        for (int year : List.of(2024, 2025)) {
            for (FilingStatus status : FilingStatus.values()) {
                List<TaxBracket> brackets = tables.forYear(year).brackets(status);
                assertEquals(0, BigDecimal.ZERO.compareTo(brackets.get(0).getMin()));
                for (int i = 1; i < brackets.size(); i++) {
                    assertEquals(0, brackets.get(i - 1).getMax().compareTo(brackets.get(i).getMin()),
                            year + " " + status + " gap at band " + i);
                }
                assertNull(brackets.get(brackets.size() - 1).getMax());
            }
        }
    }

    @Test
    @DisplayName("2025 standard deduction for married filing jointly")
    void standardDeduction_2025() {
        assertEquals(0, new BigDecimal("31500").compareTo(tables.forYear(2025).standardDeduction(FilingStatus.MARRIED_JOINT)));
    }

    @Test
    @DisplayName("Retirement contribution limits change by year")
    void retirementLimits_byYear() {
        assertEquals(0, new BigDecimal("23000").compareTo(tables.forYear(2024).getRetirementLimits().getLimit401k()));
        assertEquals(0, new BigDecimal("23500").compareTo(tables.forYear(2025).getRetirementLimits().getLimit401k()));
    }

    @Test
    @DisplayName("Duplicate years are rejected")
    void constructor_duplicate_throws() {
        TaxTable table = tables.forYear(2024);
        assertThrows(IllegalArgumentException.class, () -> new TaxTables(List.of(table, table)));
    }

    @Test
    @DisplayName("An empty registry is rejected")
    void constructor_empty_throws() {
        assertThrows(IllegalArgumentException.class, () -> new TaxTables(List.of()));
    }
}
