package com.fieldservice.scheduling.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fieldservice.scheduling.distance.CachedDistanceProvider;
import com.fieldservice.scheduling.distance.DistanceProvider;
import com.fieldservice.scheduling.distance.GoogleMapsDistanceProvider;
import com.fieldservice.scheduling.metrics.SchedulingMetrics;
import com.fieldservice.shared.featureflag.FeatureFlagService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.web.client.RestClient;

import java.time.Duration;

/**
 * Wires the single {@link DistanceProvider} bean: Google Maps behind a Redis cache.
 */
@Slf4j
@Configuration
public class DistanceProviderConfig {

    @Bean
    public DistanceProvider distanceProvider(
            RestClient.Builder restClientBuilder,
            ObjectMapper objectMapper,
            StringRedisTemplate redisTemplate,
            FeatureFlagService featureFlagService,
            SchedulingMetrics metrics,
            @Value("${scheduling.distance.google-maps.base-url:https://maps.googleapis.com}") String baseUrl,
            @Value("${scheduling.distance.google-maps.api-key:}") String apiKey,
            @Value("${scheduling.distance.cache-ttl-hours:24}") long cacheTtlHours) {

        GoogleMapsDistanceProvider googleMaps = new GoogleMapsDistanceProvider(
                restClientBuilder.baseUrl(baseUrl).build(), objectMapper, apiKey);

        log.info("Distance provider: Google Maps at {} with {}h Redis cache", baseUrl, cacheTtlHours);
        return new CachedDistanceProvider(googleMaps, redisTemplate, featureFlagService, metrics,
                objectMapper, Duration.ofHours(cacheTtlHours));
    }
}
