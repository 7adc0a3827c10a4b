package com.lynkvertx.evfeas.service;

import com.lynkvertx.evfeas.model.AllocationStrategy;
import com.lynkvertx.evfeas.model.CapacityProfile;
import com.lynkvertx.evfeas.model.ChargerSpec;
import com.lynkvertx.evfeas.model.EvaluationSettings;
import com.lynkvertx.evfeas.model.HourlyEvaluation;
import com.lynkvertx.evfeas.model.HourlyProfile;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CapacityEvaluatorTest {

    private final CapacityEvaluator evaluator = new CapacityEvaluator();

    private final HourlyProfile profile = new HourlyProfile(Map.of(
        5, new BigDecimal("40"),
        6, new BigDecimal("120")));

    private EvaluationSettings.EvaluationSettingsBuilder settings(AllocationStrategy strategy) {
        return EvaluationSettings.builder()
            .capacityKw(new BigDecimal("100"))
            .level2Kw(new BigDecimal("7.2"))
            .level3Kw(new BigDecimal("50"))
            .strategy(strategy);
    }

    @Test
    void excessIsCapacityMinusMaxPowerForEveryDefinedHour() {
        CapacityProfile result = evaluator.evaluate(profile, settings(AllocationStrategy.AUTO).build());

        assertThat(result.getHours()).extracting(HourlyEvaluation::getHour).containsExactly(5, 6);
        for (HourlyEvaluation hour : result.getHours()) {
            assertThat(hour.getExcessKw()).isEqualByComparingTo(hour.getCapacityKw().subtract(hour.getMaxPowerKw()));
            assertThat(hour.isExceedsCapacity()).isEqualTo(hour.getExcessKw().signum() < 0);
        }
    }

    @Test
    void autoCountsAreIndependentAgainstFullHeadroom() {
        CapacityProfile result = evaluator.evaluate(profile, settings(AllocationStrategy.AUTO).build());

        HourlyEvaluation hour5 = result.getHours().get(0);
        assertThat(hour5.getExcessKw()).isEqualByComparingTo("60");
        assertThat(hour5.getLevel2Count()).isEqualTo(8);
        assertThat(hour5.getLevel3Count()).isEqualTo(1);
        assertThat(hour5.isExceedsCapacity()).isFalse();
    }

    @Test
    void overloadedHourGetsZeroCountsAndFlag() {
        CapacityProfile result = evaluator.evaluate(profile, settings(AllocationStrategy.AUTO).build());

        HourlyEvaluation hour6 = result.getHours().get(1);
        assertThat(hour6.getExcessKw()).isEqualByComparingTo("-20");
        assertThat(hour6.getLevel2Count()).isZero();
        assertThat(hour6.getLevel3Count()).isZero();
        assertThat(hour6.isExceedsCapacity()).isTrue();
        assertThat(result.anyHourExceedsCapacity()).isTrue();
    }

    @Test
    void fixedLevel3ThenLevel2FillsRemainder() {
        CapacityProfile result = evaluator.evaluate(profile, settings(AllocationStrategy.FIXED_L3).fixedCount(1).build());

        HourlyEvaluation hour5 = result.getHours().get(0);
        assertThat(hour5.getLevel3Count()).isEqualTo(1);
        assertThat(hour5.getLevel2Count()).isEqualTo(1);
        assertThat(hour5.getTotalLoadKw()).isEqualByComparingTo("90");
        assertThat(hour5.isExceedsCapacity()).isFalse();

        HourlyEvaluation hour6 = result.getHours().get(1);
        assertThat(hour6.getLevel2Count()).isZero();
        assertThat(hour6.isExceedsCapacity()).isTrue();
    }

    @Test
    void fixedLevel2ThenLevel3FillsRemainder() {
        CapacityProfile result = evaluator.evaluate(profile, settings(AllocationStrategy.FIXED_L2).fixedCount(2).build());

        HourlyEvaluation hour5 = result.getHours().get(0);
        assertThat(hour5.getLevel2Count()).isEqualTo(2);
        // 60 - 14.4 = 45.6 left, not enough for a 50 kW unit
        assertThat(hour5.getLevel3Count()).isZero();
    }

    @Test
    void fixedLoadBeyondHeadroomIsFlaggedAsOverload() {
        CapacityProfile result = evaluator.evaluate(profile, settings(AllocationStrategy.FIXED_L3).fixedCount(2).build());

        HourlyEvaluation hour5 = result.getHours().get(0);
        assertThat(hour5.getExcessKw()).isEqualByComparingTo("60");
        assertThat(hour5.getLevel2Count()).isZero();
        assertThat(hour5.isExceedsCapacity()).isTrue();
    }

    @Test
    void customChargersAddLoadAndIgnoreZeroQuantities() {
        EvaluationSettings withCustom = settings(AllocationStrategy.NONE)
            .capacityKw(new BigDecimal("70"))
            .customCharger(new ChargerSpec("Depot DC", new BigDecimal("20"), 2))
            .customCharger(new ChargerSpec("Unused", new BigDecimal("150"), 0))
            .build();

        CapacityProfile result = evaluator.evaluate(profile, withCustom);

        HourlyEvaluation hour5 = result.getHours().get(0);
        assertThat(result.isCustomLoadApplied()).isTrue();
        assertThat(hour5.getCustomLoadKw()).isEqualByComparingTo("40");
        assertThat(hour5.getTotalLoadKw()).isEqualByComparingTo("80");
        assertThat(hour5.getExcessKw()).isEqualByComparingTo("30");
        assertThat(hour5.isExceedsCapacity()).isTrue();
        assertThat(hour5.getLevel2Count()).isNull();
        assertThat(hour5.getLevel3Count()).isNull();
    }

    @Test
    void negativeCapacityIsRejected() {
        EvaluationSettings bad = settings(AllocationStrategy.AUTO).capacityKw(new BigDecimal("-1")).build();

        assertThatThrownBy(() -> evaluator.evaluate(profile, bad))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Capacity");
    }

    @Test
    void zeroChargerSizeIsRejectedWhenCountsAreRequested() {
        EvaluationSettings bad = settings(AllocationStrategy.AUTO).level2Kw(BigDecimal.ZERO).build();

        assertThatThrownBy(() -> evaluator.evaluate(profile, bad))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void largeCapacityYieldsCountsBeyondIntRange() {
        EvaluationSettings large = settings(AllocationStrategy.AUTO)
            .capacityKw(new BigDecimal("5000000000"))
            .level2Kw(BigDecimal.ONE)
            .build();

        HourlyEvaluation hour5 = evaluator.evaluate(profile, large).getHours().get(0);

        assertThat(hour5.getLevel2Count()).isEqualTo(4_999_999_960L);
        assertThat(hour5.getLevel3Count()).isEqualTo(99_999_999L);
    }

    @Test
    void countBeyondLongRangeIsRejected() {
        EvaluationSettings absurd = settings(AllocationStrategy.AUTO)
            .capacityKw(new BigDecimal("1E+30"))
            .level2Kw(BigDecimal.ONE)
            .build();

        assertThatThrownBy(() -> evaluator.evaluate(profile, absurd))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Charger count out of range");
    }
}
