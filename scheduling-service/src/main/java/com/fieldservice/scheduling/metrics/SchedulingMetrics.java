package com.fieldservice.scheduling.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Custom Micrometer metrics for the Scheduling Service.
 *
 * Metrics exposed at /actuator/prometheus:
 *
 *   recommendation_requests_total{status="success|empty|rejected|timeout"}
 *   recommendation_latency_seconds{quantile="0.5|0.95|0.99"}
 *   recommendation_contractors_excluded_total   (contractors dropped because scoring failed)
 *   distance_cache_total{result="hit|miss"}
 */
@Component
public class SchedulingMetrics {

    private final Counter successCounter;
    private final Counter emptyCounter;
    private final Counter rejectedCounter;
    private final Counter timeoutCounter;
    private final Counter contractorExcludedCounter;
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;
    private final Timer   recommendationLatencyTimer;

    public SchedulingMetrics(MeterRegistry registry) {
        this.successCounter = Counter.builder("recommendation.requests")
                .tag("status", "success")
                .description("Recommendation requests answered with at least one contractor")
                .register(registry);

        this.emptyCounter = Counter.builder("recommendation.requests")
                .tag("status", "empty")
                .description("Recommendation requests answered with no available contractors")
                .register(registry);

        this.rejectedCounter = Counter.builder("recommendation.requests")
                .tag("status", "rejected")
                .description("Recommendation requests rejected (past date, kill switch)")
                .register(registry);

        this.timeoutCounter = Counter.builder("recommendation.requests")
                .tag("status", "timeout")
                .description("Recommendation requests abandoned on timeout or cancellation")
                .register(registry);

        this.contractorExcludedCounter = Counter.builder("recommendation.contractors.excluded")
                .description("Contractors excluded from a batch because their scoring failed")
                .register(registry);

        this.cacheHitCounter = Counter.builder("distance.cache")
                .tag("result", "hit")
                .description("Distance lookups served from Redis")
                .register(registry);

        this.cacheMissCounter = Counter.builder("distance.cache")
                .tag("result", "miss")
                .description("Distance lookups forwarded to the provider")
                .register(registry);

        this.recommendationLatencyTimer = Timer.builder("recommendation.latency")
                .description("Time from recommendation request to ranked response")
                .publishPercentiles(0.5, 0.95, 0.99)
                .publishPercentileHistogram(true)
                .minimumExpectedValue(Duration.ofMillis(5))
                .maximumExpectedValue(Duration.ofSeconds(5))
                .register(registry);
    }

    public void recordSuccess()             { successCounter.increment(); }
    public void recordEmpty()               { emptyCounter.increment(); }
    public void recordRejected()            { rejectedCounter.increment(); }
    public void recordTimeout()             { timeoutCounter.increment(); }
    public void recordContractorExcluded()  { contractorExcludedCounter.increment(); }
    public void recordCacheHit()            { cacheHitCounter.increment(); }
    public void recordCacheMiss()           { cacheMissCounter.increment(); }
    public Timer getRecommendationLatencyTimer() { return recommendationLatencyTimer; }
}
