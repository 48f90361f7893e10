package com.fieldservice.scheduling.distance;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fieldservice.scheduling.metrics.SchedulingMetrics;
import com.fieldservice.shared.featureflag.FeatureFlagService;
import com.fieldservice.shared.util.GeoUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Redis read-through cache in front of another {@link DistanceProvider}.
 *
 * Key pattern:  distance:{originH3}:{destinationH3}:{type}
 *   type = distance | time | matrix
 *   H3 cells at resolution 15, so coordinates within ~1 m share an entry.
 *
 * Cache faults (Redis down, unreadable entry) are logged and treated as a miss;
 * they never fail the lookup. Caching can be switched off with the
 * distance_cache_enabled feature flag.
 */
@Slf4j
public class CachedDistanceProvider implements DistanceProvider {

    static final String KEY_PREFIX = "distance:";
    static final String TYPE_DISTANCE = "distance";
    static final String TYPE_TIME = "time";
    static final String TYPE_MATRIX = "matrix";

    private final DistanceProvider delegate;
    private final RedisTemplate<String, String> redisTemplate;
    private final FeatureFlagService featureFlagService;
    private final SchedulingMetrics metrics;
    private final ObjectMapper objectMapper;
    private final Duration ttl;

    public CachedDistanceProvider(DistanceProvider delegate,
                                  RedisTemplate<String, String> redisTemplate,
                                  FeatureFlagService featureFlagService,
                                  SchedulingMetrics metrics,
                                  ObjectMapper objectMapper,
                                  Duration ttl) {
        this.delegate = delegate;
        this.redisTemplate = redisTemplate;
        this.featureFlagService = featureFlagService;
        this.metrics = metrics;
        this.objectMapper = objectMapper;
        this.ttl = ttl;
    }

    @Override
    public BigDecimal getDistance(double originLat, double originLng, double destLat, double destLng) {
        GeoUtil.validateCoordinates(originLat, originLng);
        GeoUtil.validateCoordinates(destLat, destLng);

        if (!cacheEnabled()) {
            return delegate.getDistance(originLat, originLng, destLat, destLng);
        }

        String key = cacheKey(originLat, originLng, destLat, destLng, TYPE_DISTANCE);
        String cached = readCache(key);
        if (cached != null) {
            try {
                BigDecimal miles = new BigDecimal(cached);
                metrics.recordCacheHit();
                return miles;
            } catch (NumberFormatException e) {
                log.warn("Ignoring unreadable cached distance under key {}: {}", key, cached);
            }
        }

        metrics.recordCacheMiss();
        BigDecimal miles = delegate.getDistance(originLat, originLng, destLat, destLng);
        writeCache(key, miles.toPlainString());
        return miles;
    }

    @Override
    public int getTravelTime(double originLat, double originLng, double destLat, double destLng) {
        GeoUtil.validateCoordinates(originLat, originLng);
        GeoUtil.validateCoordinates(destLat, destLng);

        if (!cacheEnabled()) {
            return delegate.getTravelTime(originLat, originLng, destLat, destLng);
        }

        String key = cacheKey(originLat, originLng, destLat, destLng, TYPE_TIME);
        String cached = readCache(key);
        if (cached != null) {
            try {
                int minutes = Integer.parseInt(cached);
                metrics.recordCacheHit();
                return minutes;
            } catch (NumberFormatException e) {
                log.warn("Ignoring unreadable cached travel time under key {}: {}", key, cached);
            }
        }

        metrics.recordCacheMiss();
        int minutes = delegate.getTravelTime(originLat, originLng, destLat, destLng);
        writeCache(key, String.valueOf(minutes));
        return minutes;
    }

    /**
     * Serves each origin/destination pair from the cache where possible and
     * forwards only the missing pairs to the delegate, one origin row at a time.
     * Only OK elements are written back.
     */
    @Override
    public List<List<DistanceResult>> getDistanceBatch(List<Coordinates> origins, List<Coordinates> destinations) {
        if (origins == null || origins.isEmpty()) {
            throw new IllegalArgumentException("Origins cannot be null or empty");
        }
        if (destinations == null || destinations.isEmpty()) {
            throw new IllegalArgumentException("Destinations cannot be null or empty");
        }
        if (!cacheEnabled()) {
            return delegate.getDistanceBatch(origins, destinations);
        }

        List<List<DistanceResult>> matrix = new ArrayList<>();
        for (Coordinates origin : origins) {
            GeoUtil.validateCoordinates(origin.latitude(), origin.longitude());

            List<DistanceResult> row = new ArrayList<>();
            List<Integer> missingIndexes = new ArrayList<>();
            List<Coordinates> missingDestinations = new ArrayList<>();

            for (int j = 0; j < destinations.size(); j++) {
                Coordinates destination = destinations.get(j);
                GeoUtil.validateCoordinates(destination.latitude(), destination.longitude());

                DistanceResult cached = readMatrixElement(origin, destination);
                row.add(cached);
                if (cached == null) {
                    metrics.recordCacheMiss();
                    missingIndexes.add(j);
                    missingDestinations.add(destination);
                } else {
                    metrics.recordCacheHit();
                }
            }

            if (!missingDestinations.isEmpty()) {
                List<List<DistanceResult>> fetched = delegate.getDistanceBatch(List.of(origin), missingDestinations);
                List<DistanceResult> fetchedRow = fetched.isEmpty() ? List.of() : fetched.get(0);
                for (int k = 0; k < missingIndexes.size(); k++) {
                    DistanceResult result = k < fetchedRow.size()
                            ? fetchedRow.get(k)
                            : DistanceResult.builder().status("NOT_FOUND").errorMessage("Missing from provider response").build();
                    row.set(missingIndexes.get(k), result);
                    if (result.isOk()) {
                        writeMatrixElement(origin, missingDestinations.get(k), result);
                    }
                }
            }
            matrix.add(row);
        }
        return matrix;
    }

    private DistanceResult readMatrixElement(Coordinates origin, Coordinates destination) {
        String key = cacheKey(origin.latitude(), origin.longitude(),
                destination.latitude(), destination.longitude(), TYPE_MATRIX);
        String cached = readCache(key);
        if (cached == null) {
            return null;
        }
        try {
            return objectMapper.readValue(cached, DistanceResult.class);
        } catch (JsonProcessingException e) {
            log.warn("Ignoring unreadable cached distance element under key {}: {}", key, e.getMessage());
            return null;
        }
    }

    private void writeMatrixElement(Coordinates origin, Coordinates destination, DistanceResult result) {
        String key = cacheKey(origin.latitude(), origin.longitude(),
                destination.latitude(), destination.longitude(), TYPE_MATRIX);
        try {
            writeCache(key, objectMapper.writeValueAsString(result));
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize distance element for key {}: {}", key, e.getMessage());
        }
    }

    private boolean cacheEnabled() {
        try {
            return featureFlagService.isEnabled(FeatureFlagService.DISTANCE_CACHE_ENABLED, true);
        } catch (RuntimeException e) {
            log.warn("Feature flag lookup failed, bypassing distance cache: {}", e.getMessage());
            return false;
        }
    }

    private String readCache(String key) {
        try {
            return redisTemplate.opsForValue().get(key);
        } catch (RuntimeException e) {
            log.warn("Distance cache read failed for key {}: {}", key, e.getMessage());
            return null;
        }
    }

    private void writeCache(String key, String value) {
        try {
            redisTemplate.opsForValue().set(key, value, ttl);
        } catch (RuntimeException e) {
            log.warn("Distance cache write failed for key {}: {}", key, e.getMessage());
        }
    }

    static String cacheKey(double originLat, double originLng, double destLat, double destLng, String type) {
        return KEY_PREFIX + GeoUtil.cacheKeyCell(originLat, originLng)
                + ":" + GeoUtil.cacheKeyCell(destLat, destLng)
                + ":" + type;
    }
}
