package com.lynkvertx.evfeas.service;

import com.lynkvertx.evfeas.model.CapacityProfile;
import com.lynkvertx.evfeas.model.ChargerMixResult;
import com.lynkvertx.evfeas.model.HourlyEvaluation;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeSet;

/**
 * Charger Mix Optimizer
 *
 * Fits whole charger units of several ratings into the headroom of each hour using a single
 * largest-first greedy pass:
 * 1. Sort the distinct ratings descending.
 * 2. For each rating: count = floor(remaining / rating), remaining -= count × rating.
 *
 * The result is approximate. Example: ratings {5, 4} with 8 kW headroom gives one 5 kW unit and
 * 3 kW left over, although two 4 kW units would use it all.
 */
@Service
public class ChargerMixOptimizer {

    public static final String ALLOCATION_LABEL = "Approximate charger mix (greedy, largest first)";

    public List<ChargerMixResult> optimize(CapacityProfile capacity, List<BigDecimal> ratingsKw) {
        List<BigDecimal> ordered = orderRatings(ratingsKw);
        List<ChargerMixResult> results = new ArrayList<>();
        for (HourlyEvaluation hour : capacity.getHours()) {
            results.add(allocate(hour.getHour(), hour.getExcessKw(), ordered));
        }
        return results;
    }

    /** Allocate every hour of a caller-supplied headroom series, hours in ascending order. */
    public List<ChargerMixResult> optimize(SortedMap<Integer, BigDecimal> excessByHour, List<BigDecimal> ratingsKw) {
        List<BigDecimal> ordered = orderRatings(ratingsKw);
        List<ChargerMixResult> results = new ArrayList<>();
        excessByHour.forEach((hour, excess) -> results.add(allocate(hour, excess, ordered)));
        return results;
    }

    /**
     * Greedy fill of one hour. Ratings must already be distinct, positive and descending.
     * An overloaded hour (negative excess) is not allocated: all counts are zero and the
     * remaining power equals the excess.
     */
    ChargerMixResult allocate(int hour, BigDecimal excessKw, List<BigDecimal> orderedRatings) {
        Map<BigDecimal, Long> counts = new LinkedHashMap<>();
        if (excessKw.signum() < 0) {
            orderedRatings.forEach(rating -> counts.put(rating, 0L));
            return new ChargerMixResult(hour, excessKw, Collections.unmodifiableMap(counts),
                BigDecimal.ZERO, excessKw, false);
        }

        BigDecimal remaining = excessKw;
        BigDecimal used = BigDecimal.ZERO;
        for (BigDecimal rating : orderedRatings) {
            long count = CapacityEvaluator.unitsFitting(remaining, rating);
            counts.put(rating, count);
            BigDecimal unitsKw = rating.multiply(BigDecimal.valueOf(count));
            used = used.add(unitsKw);
            remaining = remaining.subtract(unitsKw);
        }
        return new ChargerMixResult(hour, excessKw, Collections.unmodifiableMap(counts), used, remaining, true);
    }

    /**
     * Distinct ratings, largest first. Ratings equal in value but not in scale (50 vs 50.0)
     * count as one.
     */
    static List<BigDecimal> orderRatings(List<BigDecimal> ratingsKw) {
        TreeSet<BigDecimal> distinct = new TreeSet<>(Comparator.reverseOrder());
        for (BigDecimal rating : ratingsKw) {
            if (rating == null || rating.signum() <= 0) {
                throw new IllegalArgumentException("Charger ratings must be positive: " + rating);
            }
            distinct.add(rating);
        }
        return new ArrayList<>(distinct);
    }
}
