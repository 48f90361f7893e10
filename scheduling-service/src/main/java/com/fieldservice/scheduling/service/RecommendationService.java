package com.fieldservice.scheduling.service;

import com.fieldservice.scheduling.distance.DistanceProvider;
import com.fieldservice.scheduling.entity.Contractor;
import com.fieldservice.scheduling.entity.Job;
import com.fieldservice.scheduling.exception.NotFoundException;
import com.fieldservice.scheduling.exception.SchedulingException;
import com.fieldservice.scheduling.exception.ServiceUnavailableException;
import com.fieldservice.scheduling.metrics.SchedulingMetrics;
import com.fieldservice.scheduling.model.ContractorRecommendation;
import com.fieldservice.scheduling.model.RecommendationResponse;
import com.fieldservice.scheduling.model.ScoreComponents;
import com.fieldservice.scheduling.repository.ContractorRepository;
import com.fieldservice.scheduling.repository.DispatcherContractorListRepository;
import com.fieldservice.scheduling.repository.JobRepository;
import com.fieldservice.shared.featureflag.FeatureFlagService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Ranks contractors for a job.
 *
 * Recommendation flow:
 *  1. Kill switch check (recommendations_kill_switch feature flag)
 *  2. Load job → 404 if missing, 400 if its desired date-time is in the past (UTC)
 *  3. Resolve candidate pool: all active contractors, or the dispatcher's curated list
 *  4. Score every contractor concurrently on the recommendation executor;
 *     a contractor whose scoring fails is dropped, never the whole batch
 *  5. Join with a deadline → 503 on timeout/interruption, in-flight work cancelled
 *  6. Sort by score descending (stable), keep the top 5
 */
@Slf4j
@Service
public class RecommendationService {

    private final JobRepository jobRepository;
    private final ContractorRepository contractorRepository;
    private final DispatcherContractorListRepository dispatcherContractorListRepository;
    private final AvailabilityService availabilityService;
    private final TimeSlotService timeSlotService;
    private final ScoringService scoringService;
    private final DistanceProvider distanceProvider;
    private final FeatureFlagService featureFlagService;
    private final SchedulingMetrics metrics;
    private final Clock clock;
    private final ExecutorService executor;
    private final Duration defaultTimeout;

    public RecommendationService(JobRepository jobRepository,
                                 ContractorRepository contractorRepository,
                                 DispatcherContractorListRepository dispatcherContractorListRepository,
                                 AvailabilityService availabilityService,
                                 TimeSlotService timeSlotService,
                                 ScoringService scoringService,
                                 DistanceProvider distanceProvider,
                                 FeatureFlagService featureFlagService,
                                 SchedulingMetrics metrics,
                                 Clock clock,
                                 @Qualifier("recommendationExecutor") ExecutorService executor,
                                 @Value("${scheduling.recommendation.timeout-ms:5000}") long timeoutMs) {
        this.jobRepository = jobRepository;
        this.contractorRepository = contractorRepository;
        this.dispatcherContractorListRepository = dispatcherContractorListRepository;
        this.availabilityService = availabilityService;
        this.timeSlotService = timeSlotService;
        this.scoringService = scoringService;
        this.distanceProvider = distanceProvider;
        this.featureFlagService = featureFlagService;
        this.metrics = metrics;
        this.clock = clock;
        this.executor = executor;
        this.defaultTimeout = Duration.ofMillis(timeoutMs);
    }

    public RecommendationResponse getRecommendations(Long jobId, Long dispatcherId, boolean contractorListOnly) {
        return getRecommendations(jobId, dispatcherId, contractorListOnly, defaultTimeout);
    }

    public RecommendationResponse getRecommendations(Long jobId, Long dispatcherId, boolean contractorListOnly,
                                                     Duration timeout) {
        // Ops can stop recommendation traffic instantly via the Redis flag
        if (killSwitchEngaged()) {
            metrics.recordRejected();
            throw new ServiceUnavailableException("SERVICE_UNAVAILABLE",
                    "Recommendations are temporarily disabled. Please try again shortly.");
        }

        Job job = jobRepository.findById(jobId).orElseThrow(() -> NotFoundException.job(jobId));

        LocalDateTime now = LocalDateTime.now(clock);
        if (job.getDesiredDateTime().isBefore(now)) {
            metrics.recordRejected();
            throw new SchedulingException("DESIRED_TIME_IN_PAST",
                    "Job " + jobId + " desired date-time " + job.getDesiredDateTime() + " is in the past");
        }

        long startNanos = System.nanoTime();
        List<Long> pool = resolveCandidatePool(dispatcherId, contractorListOnly);
        if (pool.isEmpty()) {
            log.warn("No candidate contractors for job={} dispatcher={} contractorListOnly={}",
                    jobId, dispatcherId, contractorListOnly);
            metrics.recordEmpty();
            return RecommendationResponse.empty();
        }

        List<ContractorRecommendation> scored = scoreAll(job, pool, timeout);

        List<ContractorRecommendation> top = scored.stream()
                .sorted(Comparator.comparing(ContractorRecommendation::getScore).reversed())
                .limit(ScoringService.MAX_RECOMMENDATIONS)
                .toList();

        metrics.getRecommendationLatencyTimer().record(Duration.ofNanos(System.nanoTime() - startNanos));
        if (top.isEmpty()) {
            metrics.recordEmpty();
        } else {
            metrics.recordSuccess();
        }

        log.info("Recommendations for job={}: pool={} scored={} returned={}",
                jobId, pool.size(), scored.size(), top.size());
        return RecommendationResponse.of(top);
    }

    private boolean killSwitchEngaged() {
        try {
            return featureFlagService.isEnabled(FeatureFlagService.RECOMMENDATIONS_KILL_SWITCH, false);
        } catch (RuntimeException e) {
            log.warn("Kill switch lookup failed, serving recommendations: {}", e.getMessage());
            return false;
        }
    }

    private List<Long> resolveCandidatePool(Long dispatcherId, boolean contractorListOnly) {
        List<Long> ids = contractorListOnly
                ? dispatcherContractorListRepository.findContractorIdsByDispatcherId(dispatcherId)
                : contractorRepository.findActiveContractorIds();
        return ids.stream().distinct().toList();
    }

    private List<ContractorRecommendation> scoreAll(Job job, List<Long> pool, Duration timeout) {
        List<Future<Optional<ContractorRecommendation>>> futures = pool.stream()
                .map(id -> executor.submit(() -> scoreContractor(job, id)))
                .toList();

        long deadline = System.nanoTime() + timeout.toNanos();
        List<ContractorRecommendation> scored = new ArrayList<>();
        try {
            for (Future<Optional<ContractorRecommendation>> future : futures) {
                long remaining = Math.max(0L, deadline - System.nanoTime());
                future.get(remaining, TimeUnit.NANOSECONDS).ifPresent(scored::add);
            }
        } catch (TimeoutException e) {
            cancelAll(futures);
            metrics.recordTimeout();
            log.error("Recommendation scoring for job {} exceeded {}ms across {} contractors",
                    job.getId(), timeout.toMillis(), pool.size());
            throw new ServiceUnavailableException("RECOMMENDATION_TIMEOUT",
                    "Recommendation scoring did not complete within " + timeout.toMillis() + "ms", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancelAll(futures);
            metrics.recordTimeout();
            log.warn("Recommendation scoring for job {} interrupted", job.getId());
            throw new ServiceUnavailableException("RECOMMENDATION_CANCELLED",
                    "Recommendation request was cancelled", e);
        } catch (ExecutionException e) {
            cancelAll(futures);
            // scoreContractor never throws
            throw new IllegalStateException("Unexpected failure joining contractor scoring", e.getCause());
        }
        return scored;
    }

    /**
     * Scores one contractor; any failure excludes the contractor instead of
     * failing the batch.
     */
    Optional<ContractorRecommendation> scoreContractor(Job job, Long contractorId) {
        try {
            Optional<Contractor> found = contractorRepository.findById(contractorId);
            if (found.isEmpty() || !found.get().isActive()) {
                log.debug("Skipping contractor {}: missing or inactive", contractorId);
                return Optional.empty();
            }
            Contractor contractor = found.get();

            boolean available = availabilityService.calculateAvailability(
                    contractor, job.getDesiredDateTime(), ScoringService.ASSUMED_JOB_DURATION_HOURS, 0);

            BigDecimal distanceMiles = distanceProvider.getDistance(
                    job.getLatitude(), job.getLongitude(), contractor.getLatitude(), contractor.getLongitude());
            int travelTimeMinutes = distanceProvider.getTravelTime(
                    job.getLatitude(), job.getLongitude(), contractor.getLatitude(), contractor.getLongitude());

            ScoreComponents components = scoringService.scoreComponents(
                    available, contractor.getAverageRating(), distanceMiles);
            BigDecimal score = scoringService.calculateScore(components);

            List<LocalDateTime> slots = timeSlotService.findFreeSlots(contractor, job.getDesiredDateTime().toLocalDate());

            return Optional.of(ContractorRecommendation.builder()
                    .contractorId(contractor.getId())
                    .name(contractor.getName())
                    .score(score)
                    .rating(contractor.getAverageRating())
                    .reviewCount(contractor.getReviewCount())
                    .distanceMiles(distanceMiles)
                    .travelTimeMinutes(travelTimeMinutes)
                    .availableTimeSlots(slots)
                    .build());
        } catch (Exception e) {
            if (cancelled(e)) {
                Thread.currentThread().interrupt();
                log.debug("Scoring of contractor {} for job {} cancelled", contractorId, job.getId());
                return Optional.empty();
            }
            metrics.recordContractorExcluded();
            log.warn("Excluding contractor {} from recommendations for job {}: {}",
                    contractorId, job.getId(), e.getMessage(), e);
            return Optional.empty();
        }
    }

    private static boolean cancelled(Throwable e) {
        if (Thread.currentThread().isInterrupted()) {
            return true;
        }
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof InterruptedException) {
                return true;
            }
        }
        return false;
    }

    private static void cancelAll(List<? extends Future<?>> futures) {
        futures.forEach(f -> f.cancel(true));
    }
}
