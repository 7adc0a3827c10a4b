package com.lynkvertx.evfeas.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import javax.validation.constraints.DecimalMin;
import javax.validation.constraints.NotEmpty;
import javax.validation.constraints.NotNull;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Request DTO for a standalone charger mix allocation over a given headroom series
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ChargerMixRequestDTO {

    /** Headroom per hour-of-day (kW); negative values mark overloaded hours */
    @NotEmpty(message = "At least one hour of headroom is required")
    private Map<Integer, @NotNull(message = "Headroom must be given for every listed hour") BigDecimal> excessByHour;

    /** Candidate charger ratings (kW) */
    @NotEmpty(message = "At least one charger rating is required")
    private List<@DecimalMin(value = "0.0", inclusive = false, message = "Charger ratings must be positive") BigDecimal> ratingsKw;
}
