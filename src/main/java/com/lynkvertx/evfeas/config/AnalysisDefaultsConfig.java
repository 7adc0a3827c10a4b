package com.lynkvertx.evfeas.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Default parameters for feasibility analysis.
 * Request values take precedence; these only fill in what a request leaves out,
 * and are configurable via application.yml.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "evfeas.analysis")
public class AnalysisDefaultsConfig {

    /** Level 2 charger rated power (kW) */
    private BigDecimal level2ChargerPowerKw = new BigDecimal("7.2");

    /** Level 3 (DC fast) charger rated power (kW) */
    private BigDecimal level3ChargerPowerKw = new BigDecimal("50");

    /** Site supply capacity used when neither the request nor a per-file override gives one (kW) */
    private BigDecimal defaultCapacityKw = new BigDecimal("100");

    /** Upper bound on custom charger types per request */
    private int maxCustomChargerTypes = 5;

    /** Candidate ratings for the charger mix when a request asks for a mix without listing sizes */
    private List<BigDecimal> defaultMixSizesKw = new ArrayList<>(Arrays.asList(
        new BigDecimal("350"), new BigDecimal("150"), new BigDecimal("50"), new BigDecimal("7.2")
    ));

    /** Frontend origin patterns allowed by CORS */
    private List<String> allowedOrigins = new ArrayList<>(Arrays.asList(
        "http://localhost:*",
        "http://127.0.0.1:*"
    ));
}
