package com.jay.finsync.repository;

import com.jay.finsync.entity.CompanyFinancialHealth;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.test.context.ActiveProfiles;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@ActiveProfiles("test")
@DisplayName("CompanyFinancialHealthRepository")
class CompanyFinancialHealthRepositoryTest {

    @Autowired
    private CompanyFinancialHealthRepository repository;

    @Autowired
    private TestEntityManager entityManager;

    private CompanyFinancialHealth row(String section, String metric, String value, String status) {
        return CompanyFinancialHealth.builder()
            .companyId(1L)
            .symbol("AAPL")
            .section(section)
            .metric(metric)
            .benchmark("1.0–2.0")
            .value(value)
            .status(status)
            .insight("")
            .build();
    }

    @Test
    void storesAndFindsRowsBySectionAndMetric() {
        repository.save(row("Liquidity & Solvency", "Current Ratio", "0.867", "warning"));
        repository.save(row("Profitability", "Return on Equity", "1.6459", "healthy"));
        entityManager.flush();
        entityManager.clear();

        assertThat(repository.findBySymbolAndSectionAndMetric("AAPL", "Liquidity & Solvency", "Current Ratio"))
            .hasValueSatisfying(r -> {
                assertThat(r.getValue()).isEqualTo("0.867");
                assertThat(r.getBenchmark()).isEqualTo("1.0–2.0");
            });
        assertThat(repository.findBySymbolOrderByIdAsc("AAPL"))
            .extracting(CompanyFinancialHealth::getMetric)
            .containsExactly("Current Ratio", "Return on Equity");
        assertThat(repository.countBySymbolAndStatus("AAPL", "healthy")).isEqualTo(1);
    }
}
