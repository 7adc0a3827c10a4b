package com.lynkvertx.evfeas.dto;

import com.lynkvertx.evfeas.model.AllocationStrategy;
import com.lynkvertx.evfeas.model.TableShape;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import javax.validation.Valid;
import javax.validation.constraints.DecimalMin;
import javax.validation.constraints.Min;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Parameters for analysing one or more uploaded load profile files.
 * Omitted values fall back to the configured defaults.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AnalysisRequestDTO {

    /** Site supply capacity for all files (kW) */
    @DecimalMin(value = "0.0", message = "Capacity must not be negative")
    private BigDecimal capacityKw;

    /** Per-file capacity overrides, keyed by uploaded file name (kW) */
    private Map<String, @DecimalMin(value = "0.0", message = "Capacity must not be negative") BigDecimal> capacityByFile =
        new HashMap<>();

    /** Level 2 charger size (kW) */
    @DecimalMin(value = "1.0", message = "Level 2 charger size must be at least 1 kW")
    private BigDecimal level2Kw;

    /** Level 3 charger size (kW) */
    @DecimalMin(value = "10.0", message = "Level 3 charger size must be at least 10 kW")
    private BigDecimal level3Kw;

    /** Layout to assume for every file (TALL or WIDE); detected per file when absent */
    private TableShape layout;

    /** Charger count allocation: NONE, AUTO, FIXED_L3 or FIXED_L2 */
    private AllocationStrategy strategy = AllocationStrategy.AUTO;

    /** Fixed Level 3 count (FIXED_L3) or fixed Level 2 count (FIXED_L2) */
    @Min(value = 0, message = "Fixed count must not be negative")
    private int fixedCount;

    /** Whether to compute the approximate charger mix per hour */
    private boolean chargerMix;

    /** Candidate charger ratings for the mix (kW); defaults apply when empty */
    private List<@DecimalMin(value = "0.0", inclusive = false, message = "Charger ratings must be positive") BigDecimal> mixSizesKw =
        new ArrayList<>();

    /** Custom charger types added on top of the observed demand */
    @Valid
    private List<CustomChargerDTO> customChargers = new ArrayList<>();
}
