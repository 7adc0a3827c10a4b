package com.lynkvertx.evfeas.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Result DTO for the charger mix allocation
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChargerMixResultDTO {

    /** Describes the allocation as approximate */
    private String label;

    /** One record per hour: Hour, &lt;rating&gt;kW_Count..., Used_kW, Remaining_kW */
    private List<Map<String, String>> records;
}
