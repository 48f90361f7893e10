package com.fieldservice.scheduling.controller;

import com.fieldservice.scheduling.model.AvailabilityResponse;
import com.fieldservice.scheduling.service.AvailabilityService;
import com.fieldservice.scheduling.service.TimeSlotService;
import com.fieldservice.shared.dto.ApiResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

@RestController
@RequestMapping("/api/v1/contractors/{contractorId}")
@RequiredArgsConstructor
public class ContractorScheduleController {

    private final TimeSlotService timeSlotService;
    private final AvailabilityService availabilityService;

    @GetMapping("/available-slots")
    public ResponseEntity<ApiResponse<List<LocalDateTime>>> getAvailableSlots(
            @PathVariable("contractorId") Long contractorId,
            @RequestParam("date") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {

        return ResponseEntity.ok(ApiResponse.ok(timeSlotService.getAvailableTimeSlots(contractorId, date)));
    }

    @GetMapping("/availability")
    public ResponseEntity<ApiResponse<AvailabilityResponse>> checkAvailability(
            @PathVariable("contractorId") Long contractorId,
            @RequestParam("desiredDateTime") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime desiredDateTime,
            @RequestParam("durationHours") BigDecimal durationHours,
            @RequestParam(value = "travelTimeMinutes", defaultValue = "0") int travelTimeMinutes) {

        boolean available = availabilityService.calculateAvailability(
                contractorId, desiredDateTime, durationHours, travelTimeMinutes);

        return ResponseEntity.ok(ApiResponse.ok(AvailabilityResponse.builder()
                .contractorId(contractorId)
                .desiredDateTime(desiredDateTime)
                .durationHours(durationHours)
                .travelTimeMinutes(travelTimeMinutes)
                .available(available)
                .build()));
    }
}
