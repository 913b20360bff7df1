package com.jay.finsync.layer3_sync;

import com.jay.finsync.entity.Company;
import com.jay.finsync.entity.CompanyPriceTarget;
import com.jay.finsync.entity.CompanyPriceTargetSummary;
import com.jay.finsync.layer1_data.FmpClient;
import com.jay.finsync.layer1_data.dto.FmpPriceTargetConsensus;
import com.jay.finsync.layer1_data.dto.FmpPriceTargetSummary;
import com.jay.finsync.repository.CompanyPriceTargetRepository;
import com.jay.finsync.repository.CompanyPriceTargetSummaryRepository;
import com.jay.finsync.repository.CompanyRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/** Layer 3: analyst price target consensus and summary sync. One row per symbol each. */
@Slf4j
@Service
public class PriceTargetSyncService extends BaseSyncService {

    private final CompanyPriceTargetRepository priceTargetRepository;
    private final CompanyPriceTargetSummaryRepository summaryRepository;

    public PriceTargetSyncService(FmpClient fmpClient,
                                  CompanyRepository companyRepository,
                                  CompanyPriceTargetRepository priceTargetRepository,
                                  CompanyPriceTargetSummaryRepository summaryRepository) {
        super(fmpClient, companyRepository);
        this.priceTargetRepository = priceTargetRepository;
        this.summaryRepository = summaryRepository;
    }

    @Transactional
    public Optional<CompanyPriceTarget> upsertPriceTarget(String symbol) {
        String ticker = normalize(symbol);
        Optional<Company> company = findCompany(ticker);
        if (company.isEmpty()) return Optional.empty();

        Optional<FmpPriceTargetConsensus> consensus = fmpClient.getPriceTarget(ticker);
        if (consensus.isEmpty()) {
            logNoData("price target consensus", ticker);
            return Optional.empty();
        }

        CompanyPriceTarget row = priceTargetRepository.findBySymbol(ticker).orElseGet(CompanyPriceTarget::new);
        copyRow(consensus.get(), row);
        row.setCompanyId(company.get().getId());
        row.setSymbol(ticker);
        CompanyPriceTarget saved = priceTargetRepository.save(row);
        log.info("Synced price target for {}: consensus {} (low {}, high {})",
            ticker, saved.getTargetConsensus(), saved.getTargetLow(), saved.getTargetHigh());
        return Optional.of(saved);
    }

    @Transactional
    public Optional<CompanyPriceTargetSummary> upsertPriceTargetSummary(String symbol) {
        String ticker = normalize(symbol);
        Optional<Company> company = findCompany(ticker);
        if (company.isEmpty()) return Optional.empty();

        Optional<FmpPriceTargetSummary> summary = fmpClient.getPriceTargetSummary(ticker);
        if (summary.isEmpty()) {
            logNoData("price target summary", ticker);
            return Optional.empty();
        }

        CompanyPriceTargetSummary row = summaryRepository.findBySymbol(ticker)
            .orElseGet(CompanyPriceTargetSummary::new);
        copyRow(summary.get(), row, "publishers");
        List<String> publishers = summary.get().publisherNames();
        row.setPublishers(publishers.isEmpty() ? null : String.join(", ", publishers));
        row.setCompanyId(company.get().getId());
        row.setSymbol(ticker);
        CompanyPriceTargetSummary saved = summaryRepository.save(row);
        log.info("Synced price target summary for {} ({} publishers)", ticker, publishers.size());
        return Optional.of(saved);
    }
}
