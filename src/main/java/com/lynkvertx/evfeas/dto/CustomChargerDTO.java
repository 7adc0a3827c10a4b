package com.lynkvertx.evfeas.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import javax.validation.constraints.DecimalMin;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotNull;
import java.math.BigDecimal;

/**
 * A custom charger type for the "what if" load test
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CustomChargerDTO {

    /** Display name, e.g. "Type-1" */
    private String name;

    /** Rated power per unit (kW) */
    @NotNull
    @DecimalMin(value = "1.0", message = "Charger power must be at least 1 kW")
    private BigDecimal powerKw;

    /** Number of units; zero entries are ignored */
    @Min(value = 0, message = "Quantity must not be negative")
    private int quantity;
}
