package com.fieldservice.scheduling.integration;

import com.fieldservice.scheduling.SchedulingServiceApplication;
import com.fieldservice.scheduling.distance.DistanceProvider;
import com.fieldservice.scheduling.entity.Assignment;
import com.fieldservice.scheduling.entity.Contractor;
import com.fieldservice.scheduling.entity.DispatcherContractorList;
import com.fieldservice.scheduling.entity.Job;
import com.fieldservice.scheduling.model.ContractorRecommendation;
import com.fieldservice.scheduling.model.RecommendationResponse;
import com.fieldservice.scheduling.repository.AssignmentRepository;
import com.fieldservice.scheduling.repository.ContractorRepository;
import com.fieldservice.scheduling.repository.DispatcherContractorListRepository;
import com.fieldservice.scheduling.repository.JobRepository;
import com.fieldservice.scheduling.service.RecommendationService;
import com.fieldservice.shared.enums.AssignmentStatus;
import com.fieldservice.shared.enums.TradeType;
import com.fieldservice.shared.featureflag.FeatureFlagService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Integration test: full recommendation flow through real JPA (H2), the
 * recommendation executor and the REST layer.
 *
 * Scenario:
 *   Given: a job three days out at 10:00 and three active contractors:
 *          near (4.5★, 5 mi, free), far (unrated, 60 mi, free),
 *          busy (4.0★, 10 mi, accepted assignment at 10:00 for 2h)
 *   When:  recommendations are requested
 *   Then:  near 0.94, far 0.55, busy 0.48, in that order
 */
@SpringBootTest(classes = SchedulingServiceApplication.class)
@AutoConfigureMockMvc
@ActiveProfiles("test")
class RecommendationIntegrationTest {

    // ── Infrastructure mocks: replace Google Maps / Redis ────────────────────
    @MockBean private DistanceProvider distanceProvider;
    @MockBean private FeatureFlagService featureFlagService;

    @Autowired private RecommendationService recommendationService;
    @Autowired private JobRepository jobRepository;
    @Autowired private ContractorRepository contractorRepository;
    @Autowired private AssignmentRepository assignmentRepository;
    @Autowired private DispatcherContractorListRepository dispatcherContractorListRepository;
    @Autowired private MockMvc mockMvc;

    private final Map<Double, BigDecimal> milesByLatitude = new HashMap<>();

    private LocalDate jobDay;
    private Job job;
    private Contractor near;
    private Contractor far;
    private Contractor busy;

    @BeforeEach
    void setUp() {
        // ── Arrange ─────────────────────────────────────────────────────────
        jobDay = LocalDate.now(ZoneOffset.UTC).plusDays(3);
        job = jobRepository.save(job(jobDay.atTime(10, 0)));

        near = contractorRepository.save(contractor("Near Contractor", 40.80, new BigDecimal("4.5"), 18));
        far = contractorRepository.save(contractor("Far Contractor", 41.50, null, 0));
        busy = contractorRepository.save(contractor("Busy Contractor", 40.90, new BigDecimal("4.0"), 30));

        milesByLatitude.put(near.getLatitude(), new BigDecimal("5"));
        milesByLatitude.put(far.getLatitude(), new BigDecimal("60"));
        milesByLatitude.put(busy.getLatitude(), new BigDecimal("10"));

        Job existing = jobRepository.save(job(jobDay.atTime(10, 0)));
        assignmentRepository.save(Assignment.builder()
                .job(existing)
                .contractorId(busy.getId())
                .status(AssignmentStatus.ACCEPTED)
                .build());

        when(distanceProvider.getDistance(anyDouble(), anyDouble(), anyDouble(), anyDouble()))
                .thenAnswer(inv -> milesByLatitude.get((Double) inv.getArgument(2)));
        when(distanceProvider.getTravelTime(anyDouble(), anyDouble(), anyDouble(), anyDouble()))
                .thenAnswer(inv -> milesByLatitude.get((Double) inv.getArgument(2)).intValue() * 2);
    }

    @AfterEach
    void tearDown() {
        assignmentRepository.deleteAll();
        dispatcherContractorListRepository.deleteAll();
        contractorRepository.deleteAll();
        jobRepository.deleteAll();
    }

    @Test
    @DisplayName("Given three contractors, when recommendations requested, then ranked near > far > busy")
    void givenMixedPool_whenRecommendationsRequested_thenRankedByScore() {
        // ── Act ─────────────────────────────────────────────────────────────
        RecommendationResponse response = recommendationService.getRecommendations(job.getId(), 1L, false);

        // ── Assert ──────────────────────────────────────────────────────────
        assertThat(response.getMessage()).isEqualTo("Success");
        assertThat(response.getRecommendations())
                .extracting(ContractorRecommendation::getContractorId)
                .containsExactly(near.getId(), far.getId(), busy.getId());
        assertThat(response.getRecommendations())
                .extracting(ContractorRecommendation::getScore)
                .usingElementComparator(BigDecimal::compareTo)
                .containsExactly(new BigDecimal("0.94"), new BigDecimal("0.55"), new BigDecimal("0.48"));

        ContractorRecommendation busyRec = response.getRecommendations().get(2);
        assertThat(busyRec.getAvailableTimeSlots())
                .doesNotContain(jobDay.atTime(10, 0), jobDay.atTime(11, 0))
                .contains(jobDay.atTime(8, 0), jobDay.atTime(12, 0));
    }

    @Test
    @DisplayName("Given a dispatcher list, when contractorListOnly, then only listed contractors are ranked")
    void givenDispatcherList_whenContractorListOnly_thenOnlyListedContractors() {
        dispatcherContractorListRepository.save(
                DispatcherContractorList.builder()
                        .dispatcherId(7L).contractorId(far.getId()).build());

        RecommendationResponse response = recommendationService.getRecommendations(job.getId(), 7L, true);

        assertThat(response.getRecommendations())
                .extracting(ContractorRecommendation::getContractorId)
                .containsExactly(far.getId());
    }

    @Test
    @DisplayName("Given a past job, when recommendations requested, then a validation error is raised")
    void givenPastJob_whenRecommendationsRequested_thenRejected() {
        Job past = jobRepository.save(job(LocalDateTime.now(ZoneOffset.UTC).minusDays(1)));

        assertThatThrownBy(() -> recommendationService.getRecommendations(past.getId(), 1L, false))
                .hasMessageContaining("in the past");
    }

    @Test
    @DisplayName("Given the REST endpoint, when called, then the envelope carries the ranking")
    void givenEndpoint_whenCalled_thenEnvelopeCarriesRanking() throws Exception {
        mockMvc.perform(get("/api/v1/recommendations")
                        .param("jobId", job.getId().toString())
                        .param("dispatcherId", "1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.recommendations.length()").value(3))
                .andExpect(jsonPath("$.data.recommendations[0].name").value("Near Contractor"));

        mockMvc.perform(get("/api/v1/recommendations")
                        .param("jobId", "999999")
                        .param("dispatcherId", "1"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error.code").value("JOB_NOT_FOUND"));
    }

    @Test
    @DisplayName("Given a contractor, when slots requested for the job date, then assignment hours are excluded")
    void givenBusyContractor_whenSlotsRequested_thenAssignmentHoursExcluded() throws Exception {
        mockMvc.perform(get("/api/v1/contractors/" + busy.getId() + "/available-slots")
                        .param("date", jobDay.toString()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.length()").value(7));
    }

    private static Job job(LocalDateTime desired) {
        return Job.builder()
                .customerId(500L)
                .jobType(TradeType.ELECTRICAL)
                .location("350 5th Ave, New York, NY")
                .latitude(40.7484)
                .longitude(-73.9857)
                .desiredDateTime(desired)
                .estimatedDurationHours(new BigDecimal("2"))
                .build();
    }

    private static Contractor contractor(String name, double latitude, BigDecimal rating, int reviews) {
        return Contractor.builder()
                .name(name)
                .latitude(latitude)
                .longitude(-73.95)
                .tradeType(TradeType.ELECTRICAL)
                .workingHoursStart(LocalTime.of(8, 0))
                .workingHoursEnd(LocalTime.of(17, 0))
                .averageRating(rating)
                .reviewCount(reviews)
                .build();
    }
}
