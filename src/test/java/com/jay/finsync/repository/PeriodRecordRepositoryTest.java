package com.jay.finsync.repository;

import com.jay.finsync.entity.Company;
import com.jay.finsync.entity.CompanyBalanceSheet;
import com.jay.finsync.entity.CompanyKeyMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.test.context.ActiveProfiles;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@ActiveProfiles("test")
@DisplayName("Period-keyed repositories")
class PeriodRecordRepositoryTest {

    @Autowired
    private CompanyRepository companyRepository;

    @Autowired
    private CompanyKeyMetricsRepository keyMetricsRepository;

    @Autowired
    private CompanyBalanceSheetRepository balanceSheetRepository;

    private Company apple;

    @BeforeEach
    void setUp() {
        apple = companyRepository.save(Company.builder().symbol("AAPL").companyName("Apple Inc.").build());
    }

    private CompanyKeyMetrics keyMetrics(LocalDate date, String period, double roe) {
        return CompanyKeyMetrics.builder()
            .companyId(apple.getId())
            .symbol("AAPL")
            .date(date)
            .period(period)
            .returnOnEquity(roe)
            .build();
    }

    @Test
    void findsByNaturalKey() {
        keyMetricsRepository.save(keyMetrics(LocalDate.of(2024, 9, 28), "FY", 1.6));
        keyMetricsRepository.save(keyMetrics(LocalDate.of(2024, 9, 28), "Q4", 0.4));

        assertThat(keyMetricsRepository.findBySymbolAndDateAndPeriod("AAPL", LocalDate.of(2024, 9, 28), "Q4"))
            .hasValueSatisfying(m -> assertThat(m.getReturnOnEquity()).isEqualTo(0.4));
        assertThat(keyMetricsRepository.findBySymbolAndDateAndPeriod("AAPL", LocalDate.of(2023, 9, 30), "FY"))
            .isEmpty();
    }

    @Test
    void latestRowIsTheMostRecentDate() {
        keyMetricsRepository.save(keyMetrics(LocalDate.of(2022, 9, 24), "FY", 1.9));
        keyMetricsRepository.save(keyMetrics(LocalDate.of(2024, 9, 28), "FY", 1.6));
        keyMetricsRepository.save(keyMetrics(LocalDate.of(2023, 9, 30), "FY", 1.5));

        assertThat(keyMetricsRepository.findTopBySymbolOrderByDateDesc("AAPL"))
            .hasValueSatisfying(m -> assertThat(m.getDate()).isEqualTo(LocalDate.of(2024, 9, 28)));
        assertThat(keyMetricsRepository.findTopBySymbolOrderByDateDesc("MSFT")).isEmpty();
    }

    @Test
    void duplicateNaturalKeyIsRejected() {
        keyMetricsRepository.saveAndFlush(keyMetrics(LocalDate.of(2024, 9, 28), "FY", 1.6));

        assertThatThrownBy(() -> keyMetricsRepository.saveAndFlush(keyMetrics(LocalDate.of(2024, 9, 28), "FY", 1.7)))
            .isInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    void timestampsAreStamped() {
        CompanyBalanceSheet sheet = balanceSheetRepository.saveAndFlush(CompanyBalanceSheet.builder()
            .companyId(apple.getId())
            .symbol("AAPL")
            .date(LocalDate.of(2024, 9, 28))
            .period("FY")
            .totalAssets(364_980_000_000.0)
            .build());

        assertThat(sheet.getCreatedAt()).isNotNull();
        assertThat(sheet.getUpdatedAt()).isNotNull();
    }
}
