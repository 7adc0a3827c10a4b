package com.lynkvertx.evfeas.model;

import lombok.Value;

import java.math.BigDecimal;

/**
 * A named charger type with its rated power and the number of units planned.
 */
@Value
public class ChargerSpec {
    String name;
    BigDecimal powerKw;
    int quantity;

    public ChargerSpec(String name, BigDecimal powerKw, int quantity) {
        if (powerKw == null || powerKw.signum() <= 0) {
            throw new IllegalArgumentException("Charger power must be positive: " + powerKw);
        }
        if (quantity < 0) {
            throw new IllegalArgumentException("Charger quantity must not be negative: " + quantity);
        }
        this.name = name;
        this.powerKw = powerKw;
        this.quantity = quantity;
    }

    public BigDecimal totalKw() {
        return powerKw.multiply(BigDecimal.valueOf(quantity));
    }
}
