package com.jay.finsync.layer1_data.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.time.LocalDate;

/** FMP /profile row. */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class FmpCompanyProfile {
    private String symbol;
    private String companyName;
    private Double price;
    private Double marketCap;
    private Double beta;
    private String currency;
    private String cik;
    private String isin;
    private String exchangeFullName;
    private String exchange;
    private String industry;
    private String sector;
    private String country;
    private String website;
    private String description;
    private String ceo;
    private String fullTimeEmployees;
    private String image;
    private LocalDate ipoDate;
    private Boolean isEtf;
    private Boolean isActivelyTrading;
}
