package com.fieldservice.scheduling.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class RecommendationResponse {

    public static final String MESSAGE_SUCCESS = "Success";
    public static final String MESSAGE_NO_CONTRACTORS = "No available contractors";

    private List<ContractorRecommendation> recommendations;
    private String message;

    public static RecommendationResponse empty() {
        return RecommendationResponse.builder()
                .recommendations(List.of())
                .message(MESSAGE_NO_CONTRACTORS)
                .build();
    }

    public static RecommendationResponse of(List<ContractorRecommendation> recommendations) {
        if (recommendations.isEmpty()) {
            return empty();
        }
        return RecommendationResponse.builder()
                .recommendations(recommendations)
                .message(MESSAGE_SUCCESS)
                .build();
    }
}
