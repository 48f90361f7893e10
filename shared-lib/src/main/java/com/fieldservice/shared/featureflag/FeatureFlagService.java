package com.fieldservice.shared.featureflag;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;

import java.time.Duration;

/**
 * Feature flag service backed by Redis hashes.
 *
 * Key pattern:  feature-flags:{tenantId}
 * Field:        {flagName}
 * Value:        "true" | "false"
 *
 * Registered via FeatureFlagAutoConfiguration (Spring Boot auto-config).
 * Set a flag via Redis CLI:
 *   HSET feature-flags:default recommendations_kill_switch true
 *   HSET feature-flags:default distance_cache_enabled false
 */
@Slf4j
@RequiredArgsConstructor
public class FeatureFlagService {

    private static final String FLAG_KEY_PREFIX = "feature-flags:";
    private static final String GLOBAL_TENANT   = "global";
    public static final String DEFAULT_TENANT   = "default";

    public static final String RECOMMENDATIONS_KILL_SWITCH = "recommendations_kill_switch";
    public static final String DISTANCE_CACHE_ENABLED      = "distance_cache_enabled";

    private final RedisTemplate<String, String> redisTemplate;

    /**
     * Returns true if the flag is enabled for the given tenant.
     * Falls back to global flag, then to the provided default value.
     */
    public boolean isEnabled(String tenantId, String flagName, boolean defaultValue) {
        Object tenantVal = redisTemplate.opsForHash().get(FLAG_KEY_PREFIX + tenantId, flagName);
        if (tenantVal != null) {
            return Boolean.parseBoolean(tenantVal.toString());
        }

        Object globalVal = redisTemplate.opsForHash().get(FLAG_KEY_PREFIX + GLOBAL_TENANT, flagName);
        if (globalVal != null) {
            return Boolean.parseBoolean(globalVal.toString());
        }

        log.debug("Feature flag '{}' not found for tenant='{}', using default={}", flagName, tenantId, defaultValue);
        return defaultValue;
    }

    public boolean isEnabled(String flagName, boolean defaultValue) {
        return isEnabled(DEFAULT_TENANT, flagName, defaultValue);
    }

    public void setFlag(String tenantId, String flagName, boolean value) {
        redisTemplate.opsForHash().put(FLAG_KEY_PREFIX + tenantId, flagName, String.valueOf(value));
        log.info("Feature flag set: tenant={} flag={} value={}", tenantId, flagName, value);
    }

    /**
     * Seeds default flags without overwriting values already in Redis (called at startup).
     */
    public void initDefaults(String tenantId) {
        String key = FLAG_KEY_PREFIX + tenantId;
        redisTemplate.opsForHash().putIfAbsent(key, RECOMMENDATIONS_KILL_SWITCH, "false");
        redisTemplate.opsForHash().putIfAbsent(key, DISTANCE_CACHE_ENABLED, "true");
        redisTemplate.expire(key, Duration.ofDays(365));
    }
}
