package com.fieldservice.scheduling.config;

import com.fieldservice.shared.featureflag.FeatureFlagService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Seeds default feature flags for the "default" tenant on startup.
 * Flags already set in Redis are NOT overwritten (putIfAbsent).
 *
 * To toggle a flag at runtime without restart:
 *   redis-cli HSET feature-flags:default recommendations_kill_switch true
 *   redis-cli HSET feature-flags:default distance_cache_enabled false
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class FeatureFlagInitializer {

    private final FeatureFlagService featureFlagService;

    @Bean
    public ApplicationRunner seedFeatureFlags() {
        return args -> {
            try {
                featureFlagService.initDefaults(FeatureFlagService.DEFAULT_TENANT);
                log.info("Feature flags initialised for tenant={}", FeatureFlagService.DEFAULT_TENANT);
            } catch (RuntimeException e) {
                log.warn("Could not seed feature flags for tenant={}, defaults apply until Redis is reachable: {}",
                        FeatureFlagService.DEFAULT_TENANT, e.getMessage());
            }
        };
    }
}
