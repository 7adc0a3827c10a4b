package com.lynkvertx.evfeas.model;

import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Greedy largest-first charger allocation for one hour.
 * The allocation is approximate: a different combination may leave less headroom unused.
 */
@Value
public class ChargerMixResult {
    int hour;
    BigDecimal excessKw;
    /** Count per rating, ratings in descending order */
    Map<BigDecimal, Long> countsByRatingKw;
    BigDecimal usedKw;
    BigDecimal remainingKw;
    /** false when the hour was overloaded and allocation was skipped */
    boolean allocated;
}
