package com.lynkvertx.evfeas.model;

import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Hourly profile evaluated against a constant supply capacity.
 * Only hours defined in the source profile are present.
 */
@Value
public class CapacityProfile {
    BigDecimal capacityKw;
    AllocationStrategy strategy;
    boolean customLoadApplied;
    List<HourlyEvaluation> hours;

    public boolean anyHourExceedsCapacity() {
        return hours.stream().anyMatch(HourlyEvaluation::isExceedsCapacity);
    }
}
