package com.jay.finsync.layer3_sync;

import com.jay.finsync.entity.Company;
import com.jay.finsync.entity.PeriodRecord;
import com.jay.finsync.layer1_data.FmpClient;
import com.jay.finsync.layer1_data.dto.FmpPeriodRow;
import com.jay.finsync.model.enums.ReportingPeriod;
import com.jay.finsync.repository.CompanyRepository;
import com.jay.finsync.repository.PeriodRecordRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.BeanUtils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Layer 3: shared plumbing for every FMP sync service.
 * Symbol normalisation, company lookup, FMP row to entity copying and the
 * (symbol, date, period) upsert used by statements, key metrics and ratios.
 */
@Slf4j
public abstract class BaseSyncService {

    /** Entity properties that never come from an FMP row. */
    private static final String[] MANAGED_PROPERTIES = {"id", "companyId", "createdAt", "updatedAt"};

    protected final FmpClient fmpClient;
    protected final CompanyRepository companyRepository;

    protected BaseSyncService(FmpClient fmpClient, CompanyRepository companyRepository) {
        this.fmpClient = fmpClient;
        this.companyRepository = companyRepository;
    }

    /** Trims and upper-cases a ticker. */
    protected static String normalize(String symbol) {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("Symbol cannot be empty");
        }
        return symbol.trim().toUpperCase(Locale.ROOT);
    }

    /** Rejects a period or limit FMP would not accept, before anything is looked up. */
    protected static void validatePeriodQuery(String period, int limit) {
        ReportingPeriod.fromApiValue(period);
        if (limit < 1 || limit > 100) {
            throw new IllegalArgumentException("Limit must be between 1 and 100");
        }
    }

    /** The stored company, or empty (logged) when its profile has not been synced yet. */
    protected Optional<Company> findCompany(String symbol) {
        Optional<Company> company = companyRepository.findBySymbol(symbol);
        if (company.isEmpty()) {
            log.warn("Company {} not found, sync its profile first", symbol);
        }
        return company;
    }

    /** Copies every same-named, type-compatible property of an FMP row onto an entity. */
    protected static void copyRow(Object source, Object target, String... alsoIgnore) {
        String[] ignore = new String[MANAGED_PROPERTIES.length + alsoIgnore.length];
        System.arraycopy(MANAGED_PROPERTIES, 0, ignore, 0, MANAGED_PROPERTIES.length);
        System.arraycopy(alsoIgnore, 0, ignore, MANAGED_PROPERTIES.length, alsoIgnore.length);
        BeanUtils.copyProperties(source, target, ignore);
    }

    /**
     * Writes each row onto the stored entity with the same (symbol, date, period), or a new one.
     * Rows without a date are skipped; a row without a period takes the requested one.
     * When FMP repeats a key within one response the last row wins.
     */
    protected static <R extends FmpPeriodRow, E extends PeriodRecord> List<E> upsertPeriodRows(
            String symbol, Long companyId, String requestedPeriod, List<R> rows,
            PeriodRecordRepository<E> repository, Supplier<E> factory) {
        Map<String, E> byKey = new LinkedHashMap<>();
        for (R row : rows) {
            if (row.getDate() == null) {
                log.debug("Skipping {} row without a date", symbol);
                continue;
            }
            String period = row.getPeriod() != null && !row.getPeriod().isBlank() ? row.getPeriod() : requestedPeriod;
            String key = row.getDate() + "|" + period;
            E entity = byKey.get(key);
            if (entity == null) {
                entity = repository.findBySymbolAndDateAndPeriod(symbol, row.getDate(), period).orElseGet(factory);
            }
            copyRow(row, entity);
            entity.setCompanyId(companyId);
            entity.setSymbol(symbol);
            entity.setPeriod(period);
            byKey.put(key, entity);
        }
        return repository.saveAll(new ArrayList<>(byKey.values()));
    }

    protected static void logNoData(String what, String symbol) {
        log.warn("No {} returned by FMP for {}", what, symbol);
    }

    protected static void logSynced(int count, String what, String symbol) {
        log.info("Synced {} {} for {}", count, what, symbol);
    }
}
