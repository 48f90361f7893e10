package com.fieldservice.scheduling.controller;

import com.fieldservice.scheduling.model.RecommendationResponse;
import com.fieldservice.scheduling.service.RecommendationService;
import com.fieldservice.shared.dto.ApiResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/recommendations")
@RequiredArgsConstructor
public class RecommendationController {

    private final RecommendationService recommendationService;

    @GetMapping
    public ResponseEntity<ApiResponse<RecommendationResponse>> getRecommendations(
            @RequestParam("jobId") Long jobId,
            @RequestParam("dispatcherId") Long dispatcherId,
            @RequestParam(value = "contractorListOnly", defaultValue = "false") boolean contractorListOnly) {

        return ResponseEntity.ok(ApiResponse.ok(
                recommendationService.getRecommendations(jobId, dispatcherId, contractorListOnly)));
    }
}
