package com.lynkvertx.evfeas.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;
import org.springframework.web.filter.CorsFilter;

import java.util.Arrays;

/**
 * CORS Configuration
 * Lets the dashboard frontend call the analysis API
 */
@Configuration
public class CorsConfig {

    @Bean
    public CorsFilter corsFilter(AnalysisDefaultsConfig defaults) {
        CorsConfiguration config = new CorsConfiguration();

        config.setAllowCredentials(true);
        config.setAllowedOriginPatterns(defaults.getAllowedOrigins());

        // Uploads are multipart, exports are plain downloads
        config.setAllowedHeaders(Arrays.asList(
            "Origin",
            "Content-Type",
            "Accept",
            "X-Requested-With"
        ));
        config.setAllowedMethods(Arrays.asList("GET", "POST", "OPTIONS"));
        config.setExposedHeaders(Arrays.asList("Content-Disposition"));

        // Max age for preflight cache
        config.setMaxAge(3600L);

        UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
        source.registerCorsConfiguration("/api/**", config);

        return new CorsFilter(source);
    }
}
