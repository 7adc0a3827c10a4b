package com.lynkvertx.evfeas.model;

import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Maximum observed power per hour-of-day (0-23), across all days of a dataset.
 *
 * Hours without any reading are absent, not zero. Callers must treat a missing hour as a data gap.
 */
@ToString
@EqualsAndHashCode
public final class HourlyProfile {

    public static final int HOURS_PER_DAY = 24;

    private final SortedMap<Integer, BigDecimal> maxPowerByHour;

    public HourlyProfile(Map<Integer, BigDecimal> maxPowerByHour) {
        for (Integer hour : maxPowerByHour.keySet()) {
            if (hour < 0 || hour >= HOURS_PER_DAY) {
                throw new IllegalArgumentException("Hour out of range: " + hour);
            }
        }
        this.maxPowerByHour = Collections.unmodifiableSortedMap(new TreeMap<>(maxPowerByHour));
    }

    public static HourlyProfile empty() {
        return new HourlyProfile(Collections.emptyMap());
    }

    public Optional<BigDecimal> maxPowerKw(int hour) {
        return Optional.ofNullable(maxPowerByHour.get(hour));
    }

    /** Defined hours in ascending order with their maximum power. */
    public SortedMap<Integer, BigDecimal> definedHours() {
        return maxPowerByHour;
    }

    public boolean isDefined(int hour) {
        return maxPowerByHour.containsKey(hour);
    }

    public int definedHourCount() {
        return maxPowerByHour.size();
    }

    public boolean isEmpty() {
        return maxPowerByHour.isEmpty();
    }

    /** Highest hourly maximum, empty when the profile holds no data. */
    public Optional<BigDecimal> peakPowerKw() {
        return maxPowerByHour.values().stream().max(BigDecimal::compareTo);
    }
}
