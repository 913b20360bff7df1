package com.jay.finsync.layer1_data.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Data;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/** FMP /price-target-summary row. */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class FmpPriceTargetSummary {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private String symbol;
    private Integer lastMonthCount;
    private Double lastMonthAvgPriceTarget;
    private Integer lastQuarterCount;
    private Double lastQuarterAvgPriceTarget;
    private Integer lastYearCount;
    private Double lastYearAvgPriceTarget;
    private Integer allTimeCount;
    private Double allTimeAvgPriceTarget;

    // FMP sends either a JSON array or a string holding one
    private JsonNode publishers;

    /** Publisher names in the order FMP lists them. Empty when none were sent. */
    public List<String> publisherNames() {
        if (publishers == null || publishers.isNull()) return List.of();
        JsonNode array = publishers;
        if (publishers.isTextual()) {
            String text = publishers.asText().trim();
            if (text.isEmpty()) return List.of();
            if (!text.startsWith("[")) {
                return Arrays.stream(text.split(",")).map(String::trim).filter(s -> !s.isEmpty()).toList();
            }
            try {
                array = MAPPER.readTree(text);
            } catch (JsonProcessingException e) {
                return List.of(text);
            }
        }
        List<String> names = new ArrayList<>();
        for (JsonNode n : array) {
            String name = n.asText().trim();
            if (!name.isEmpty()) names.add(name);
        }
        return names;
    }
}
