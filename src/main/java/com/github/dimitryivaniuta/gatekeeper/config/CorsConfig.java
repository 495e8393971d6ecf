package com.github.dimitryivaniuta.gatekeeper.config;

import java.util.List;

import com.github.dimitryivaniuta.gatekeeper.ratelimit.RateLimitHeaders;
import com.github.dimitryivaniuta.gatekeeper.web.RequestContextKeys;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.CorsConfigurationSource;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;
import org.springframework.web.filter.CorsFilter;

@Configuration
public class CorsConfig {

    @Bean
    CorsConfigurationSource corsConfigurationSource(GatekeeperProperties properties) {
        CorsConfiguration c = new CorsConfiguration();
        c.setAllowedOriginPatterns(properties.getCors().getAllowedOrigins());
        c.setAllowedMethods(List.of("GET", "POST", "PUT", "PATCH", "DELETE", "OPTIONS"));
        c.setAllowedHeaders(List.of(
                "Content-Type",
                "Authorization",
                "X-API-Key",
                RequestContextKeys.SITE_ID_HEADER,
                RequestContextKeys.CORRELATION_ID_HEADER
        ));
        c.setExposedHeaders(List.of(
                RateLimitHeaders.RETRY_AFTER,
                RateLimitHeaders.LIMIT,
                RateLimitHeaders.REMAINING,
                RateLimitHeaders.RESET,
                RequestContextKeys.CORRELATION_ID_HEADER
        ));
        c.setAllowCredentials(false);
        c.setMaxAge(3600L);

        UrlBasedCorsConfigurationSource src = new UrlBasedCorsConfigurationSource();
        src.registerCorsConfiguration("/**", c);
        return src;
    }

    @Bean
    CorsFilter corsFilter(CorsConfigurationSource corsConfigurationSource) {
        return new CorsFilter(corsConfigurationSource);
    }
}
