package com.lynkvertx.evfeas.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Result DTO for a single uploaded file.
 * Contains either the hourly profile with its capacity evaluation, or an error.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FileAnalysisDTO {

    private String fileName;

    /** "OK" or "ERROR" */
    private String status;

    /** TALL or WIDE, absent when the file could not be read */
    private String shape;

    private String errorCode;

    private String errorMessage;

    private List<String> warnings;

    private Integer readingCount;

    /** Maximum power per defined hour; hours without data are omitted */
    private List<HourlyPowerPoint> hourlyProfile;

    /** Highest hourly maximum (kW) */
    private BigDecimal peakPowerKw;

    private BigDecimal capacityKw;

    private String strategy;

    /** True when the total load exceeds the capacity in at least one hour */
    private Boolean exceedsCapacity;

    /** Per-hour evaluation records: Hour, Max_Power_kW, Capacity_kW, Excess_Power_kW, ... */
    private List<Map<String, String>> evaluation;

    private ChargerMixResultDTO chargerMix;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class HourlyPowerPoint {
        private int hour;
        private BigDecimal maxPowerKw;
    }
}
