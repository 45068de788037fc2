package com.gillianbc.lifeplan.tax;

import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Versioned registry of tax tables keyed by year.
 * <p>
 * Lookup policy: a year with no table of its own uses the latest table at or before it;
 * a year before the first table uses the first table.
 */
@Slf4j
public class TaxTables {

    private final NavigableMap<Integer, TaxTable> tables = new TreeMap<>();

    public TaxTables(Collection<TaxTable> tables) {
        Objects.requireNonNull(tables, "tables must not be null");
        if (tables.isEmpty()) {
            throw new IllegalArgumentException("at least one tax table is required");
        }
        for (TaxTable table : tables) {
            if (this.tables.putIfAbsent(table.getYear(), table) != null) {
                throw new IllegalArgumentException("duplicate tax table for year " + table.getYear());
            }
        }
    }

    /**
     * @return the tables shipped with the engine (2024 and 2025)
     */
    public static TaxTables builtIn() {
        return new TaxTables(BuiltInTaxTables.all());
    }

    public boolean hasTable(int year) {
        return tables.containsKey(year);
    }

    public int firstYear() {
        return tables.firstKey();
    }

    public int latestYear() {
        return tables.lastKey();
    }

    /**
     * @return the year whose table is used for {@code year} under the lookup policy
     */
    public int resolveYear(int year) {
        Map.Entry<Integer, TaxTable> entry = tables.floorEntry(year);
        return entry != null ? entry.getKey() : tables.firstKey();
    }

    public TaxTable forYear(int year) {
        int resolved = resolveYear(year);
        if (resolved != year) {
            log.debug("No tax table for {}, using {}", year, resolved);
        }
        return tables.get(resolved);
    }
}
