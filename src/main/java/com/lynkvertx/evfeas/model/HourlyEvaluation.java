package com.lynkvertx.evfeas.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Evaluation of one defined hour against the site capacity.
 */
@Value
@Builder
public class HourlyEvaluation {
    int hour;
    BigDecimal maxPowerKw;
    BigDecimal capacityKw;
    /** capacity − max power; negative means overload */
    BigDecimal excessKw;
    /** null when the strategy is NONE */
    Long level2Count;
    /** null when the strategy is NONE */
    Long level3Count;
    BigDecimal customLoadKw;
    /** max power + custom load + fixed charger load */
    BigDecimal totalLoadKw;
    boolean exceedsCapacity;
}
