package com.jay.finsync.layer3_sync;

import com.jay.finsync.entity.Company;
import com.jay.finsync.layer1_data.FmpClient;
import com.jay.finsync.layer1_data.dto.FmpCompanyProfile;
import com.jay.finsync.repository.CompanyRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/** Layer 3: company profile sync. The profile row is what every other sync hangs off. */
@Slf4j
@Service
public class CompanySyncService extends BaseSyncService {

    public CompanySyncService(FmpClient fmpClient, CompanyRepository companyRepository) {
        super(fmpClient, companyRepository);
    }

    @Transactional
    public Optional<Company> upsertCompany(String symbol) {
        String ticker = normalize(symbol);
        Optional<FmpCompanyProfile> profile = fmpClient.getCompanyProfile(ticker);
        if (profile.isEmpty()) {
            logNoData("company profile", ticker);
            return Optional.empty();
        }

        Company company = companyRepository.findBySymbol(ticker).orElseGet(Company::new);
        copyRow(profile.get(), company);
        company.setSymbol(ticker);
        if (company.getCompanyName() == null || company.getCompanyName().isBlank()) {
            company.setCompanyName(ticker);
        }
        Company saved = companyRepository.save(company);
        log.info("Synced company profile for {} ({})", ticker, saved.getCompanyName());
        return Optional.of(saved);
    }
}
