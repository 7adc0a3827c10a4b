package com.lynkvertx.evfeas.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Immutable per-file configuration for capacity evaluation and charger mix allocation.
 * Built by the caller for each pipeline run; the core never reads global configuration.
 */
@Value
@Builder(toBuilder = true)
public class EvaluationSettings {

    /** Site supply limit in kW, constant over all 24 hours */
    BigDecimal capacityKw;

    BigDecimal level2Kw;

    BigDecimal level3Kw;

    @Builder.Default
    AllocationStrategy strategy = AllocationStrategy.AUTO;

    /** Level 3 count for FIXED_L3, Level 2 count for FIXED_L2, ignored otherwise */
    int fixedCount;

    /** Candidate ratings for the greedy charger mix; empty skips the mix */
    @Singular("mixSizeKw")
    List<BigDecimal> mixSizesKw;

    /** Custom charger types whose combined load is added on top of the observed demand */
    @Singular
    List<ChargerSpec> customChargers;
}
