package com.jay.finsync.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDate;
import java.time.LocalDateTime;

/** Company profile. Every other synced row points back here through companyId. */
@Entity
@Table(name = "companies", indexes = {
    @Index(name = "ix_company_exchange", columnList = "exchange"),
    @Index(name = "ix_company_sector_industry", columnList = "sector, industry")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Company {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, length = 20)
    private String symbol;

    @Column(nullable = false)
    private String companyName;

    private Double price;
    private Double marketCap;
    @Column(length = 10)
    private String currency;

    private String exchangeFullName;
    @Column(length = 50)
    private String exchange;

    private String industry;
    private String sector;
    @Column(length = 50)
    private String country;

    private String website;
    @Column(length = 5000)
    private String description;
    private String image;
    private LocalDate ipoDate;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;
    @UpdateTimestamp
    private LocalDateTime updatedAt;
}
