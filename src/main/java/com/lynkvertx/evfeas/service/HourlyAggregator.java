package com.lynkvertx.evfeas.service;

import com.lynkvertx.evfeas.model.HourlyProfile;
import com.lynkvertx.evfeas.model.Reading;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Reduces readings to the maximum power per hour-of-day across all days.
 * Timestamps are naive local time; no timezone conversion is applied.
 */
@Service
public class HourlyAggregator {

    public HourlyProfile aggregate(List<Reading> readings) {
        Map<Integer, BigDecimal> maxByHour = new HashMap<>();
        for (Reading reading : readings) {
            maxByHour.merge(reading.hourOfDay(), reading.getPowerKw(),
                (current, candidate) -> candidate.compareTo(current) > 0 ? candidate : current);
        }
        return new HourlyProfile(maxByHour);
    }
}
