package com.lynkvertx.evfeas.service;

import com.lynkvertx.evfeas.model.AllocationStrategy;
import com.lynkvertx.evfeas.model.CapacityProfile;
import com.lynkvertx.evfeas.model.ChargerSpec;
import com.lynkvertx.evfeas.model.EvaluationSettings;
import com.lynkvertx.evfeas.model.HourlyEvaluation;
import com.lynkvertx.evfeas.model.HourlyProfile;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Capacity Evaluator
 *
 * Compares the hourly demand profile with a constant site supply capacity and derives, per hour:
 * - Excess power (headroom) = capacity − max demand; negative values signal overload
 * - Level 2 / Level 3 charger counts under the selected {@link AllocationStrategy}
 * - Total load including any custom charger types, and whether it exceeds the capacity
 *
 * AUTO counts are computed independently against the same headroom. They are alternatives,
 * not a combination that can be installed together.
 */
@Service
public class CapacityEvaluator {

    public CapacityProfile evaluate(HourlyProfile profile, EvaluationSettings settings) {
        validate(settings);

        BigDecimal capacityKw = settings.getCapacityKw();
        BigDecimal customLoadKw = customLoad(settings.getCustomChargers());
        boolean customApplied = settings.getCustomChargers().stream().anyMatch(c -> c.getQuantity() > 0);

        List<HourlyEvaluation> hours = new ArrayList<>();
        for (Map.Entry<Integer, BigDecimal> entry : profile.definedHours().entrySet()) {
            BigDecimal maxPowerKw = entry.getValue();
            BigDecimal excessKw = capacityKw.subtract(maxPowerKw);

            HourlyEvaluation.HourlyEvaluationBuilder row = HourlyEvaluation.builder()
                .hour(entry.getKey())
                .maxPowerKw(maxPowerKw)
                .capacityKw(capacityKw)
                .excessKw(excessKw)
                .customLoadKw(customLoadKw);

            BigDecimal fixedLoadKw = applyStrategy(row, excessKw, settings);

            BigDecimal totalLoadKw = maxPowerKw.add(customLoadKw).add(fixedLoadKw);
            row.totalLoadKw(totalLoadKw)
                .exceedsCapacity(totalLoadKw.compareTo(capacityKw) > 0);
            hours.add(row.build());
        }
        return new CapacityProfile(capacityKw, settings.getStrategy(), customApplied, hours);
    }

    /**
     * Fill in the charger counts for one hour.
     *
     * @return load of the caller-fixed chargers in kW (zero for NONE and AUTO)
     */
    private BigDecimal applyStrategy(HourlyEvaluation.HourlyEvaluationBuilder row, BigDecimal excessKw,
                                     EvaluationSettings settings) {
        BigDecimal headroom = excessKw.max(BigDecimal.ZERO);
        long fixedCount = settings.getFixedCount();

        switch (settings.getStrategy()) {
            case AUTO:
                row.level2Count(unitsFitting(headroom, settings.getLevel2Kw()))
                    .level3Count(unitsFitting(headroom, settings.getLevel3Kw()));
                return BigDecimal.ZERO;
            case FIXED_L3: {
                BigDecimal used = settings.getLevel3Kw().multiply(BigDecimal.valueOf(fixedCount));
                row.level3Count(fixedCount)
                    .level2Count(unitsFitting(excessKw.subtract(used).max(BigDecimal.ZERO), settings.getLevel2Kw()));
                return used;
            }
            case FIXED_L2: {
                BigDecimal used = settings.getLevel2Kw().multiply(BigDecimal.valueOf(fixedCount));
                row.level2Count(fixedCount)
                    .level3Count(unitsFitting(excessKw.subtract(used).max(BigDecimal.ZERO), settings.getLevel3Kw()));
                return used;
            }
            case NONE:
            default:
                return BigDecimal.ZERO;
        }
    }

    /**
     * floor(available / unit), never negative.
     *
     * @throws IllegalArgumentException when the count does not fit in a long
     */
    static long unitsFitting(BigDecimal availableKw, BigDecimal unitKw) {
        if (availableKw.signum() <= 0) {
            return 0;
        }
        BigDecimal units = availableKw.divide(unitKw, 0, RoundingMode.FLOOR);
        try {
            return units.longValueExact();
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Charger count out of range: " + availableKw.toPlainString()
                + " kW / " + unitKw.toPlainString() + " kW", e);
        }
    }

    static BigDecimal customLoad(List<ChargerSpec> chargers) {
        return chargers.stream()
            .filter(c -> c.getQuantity() > 0)
            .map(ChargerSpec::totalKw)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private void validate(EvaluationSettings settings) {
        if (settings.getCapacityKw() == null || settings.getCapacityKw().signum() < 0) {
            throw new IllegalArgumentException("Capacity must be zero or positive: " + settings.getCapacityKw());
        }
        if (settings.getStrategy() == null) {
            throw new IllegalArgumentException("Allocation strategy is required");
        }
        if (settings.getStrategy() != AllocationStrategy.NONE) {
            requirePositive(settings.getLevel2Kw(), "Level 2 charger size");
            requirePositive(settings.getLevel3Kw(), "Level 3 charger size");
        }
        if (settings.getFixedCount() < 0) {
            throw new IllegalArgumentException("Fixed charger count must not be negative: " + settings.getFixedCount());
        }
    }

    private static void requirePositive(BigDecimal value, String what) {
        if (value == null || value.signum() <= 0) {
            throw new IllegalArgumentException(what + " must be positive: " + value);
        }
    }
}
