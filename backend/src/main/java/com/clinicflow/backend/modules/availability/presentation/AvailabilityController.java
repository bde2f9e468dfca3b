package com.clinicflow.backend.modules.availability.presentation;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.clinicflow.backend.global.security.SecurityUtils;
import com.clinicflow.backend.modules.availability.application.AvailabilityService;
import com.clinicflow.backend.modules.availability.presentation.dto.AvailabilityTemplateResponse;
import com.clinicflow.backend.modules.availability.presentation.dto.CreateAvailabilityRequest;
import com.clinicflow.backend.modules.availability.presentation.dto.DaySlotsResponse;
import com.clinicflow.backend.modules.availability.presentation.dto.DisableDayRequest;
import com.clinicflow.backend.modules.availability.presentation.dto.UpdateAvailabilityRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import jakarta.validation.Valid;

import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class AvailabilityController {

    private final AvailabilityService availabilityService;

    public AvailabilityController(AvailabilityService availabilityService) {
        this.availabilityService = availabilityService;
    }

    @Operation(
            summary = "Day slots of a practitioner",
            description = "Generated from ACTIVE weekly templates at read time. Each slot carries an `available` flag "
                    + "and, when unavailable, the reason (`BOOKED`, `PRACTITIONER_UNAVAILABLE`, `DEPARTMENT_MISMATCH`)."
    )
    @GetMapping("/practitioners/{practitionerId}/slots")
    public ResponseEntity<DaySlotsResponse> getSlots(
            @PathVariable("practitionerId") UUID practitionerId,
            @RequestParam(name = "date") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @RequestParam(name = "departmentId", required = false) UUID departmentId
    ) {
        return ResponseEntity.ok(availabilityService.getDoctorDaySlots(
                SecurityUtils.getCurrentSession(), practitionerId, date, departmentId));
    }

    @GetMapping("/practitioners/{practitionerId}/availability")
    public ResponseEntity<List<AvailabilityTemplateResponse>> listAvailability(
            @PathVariable("practitionerId") UUID practitionerId
    ) {
        return ResponseEntity.ok(availabilityService.listAvailability(SecurityUtils.getCurrentSession(), practitionerId));
    }

    @Operation(summary = "Create weekly availability for several days")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "All templates created"),
            @ApiResponse(responseCode = "409", description = "`AVAILABILITY_OVERLAP`, nothing was created")
    })
    @PostMapping("/practitioners/{practitionerId}/availability")
    public ResponseEntity<List<AvailabilityTemplateResponse>> createAvailability(
            @PathVariable("practitionerId") UUID practitionerId,
            @Valid @RequestBody CreateAvailabilityRequest request
    ) {
        return ResponseEntity.status(201).body(availabilityService.bulkCreateAvailability(
                SecurityUtils.getCurrentSession(), practitionerId, request));
    }

    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Updated"),
            @ApiResponse(responseCode = "409", description = "`VERSION_CONFLICT` or `AVAILABILITY_OVERLAP`")
    })
    @PatchMapping("/availability/{templateId}")
    public ResponseEntity<AvailabilityTemplateResponse> updateAvailability(
            @PathVariable("templateId") UUID templateId,
            @Valid @RequestBody UpdateAvailabilityRequest request
    ) {
        return ResponseEntity.ok(availabilityService.updateAvailability(
                SecurityUtils.getCurrentSession(), templateId, request));
    }

    @PostMapping("/practitioners/{practitionerId}/availability/disable-day")
    public ResponseEntity<Map<String, Integer>> disableDay(
            @PathVariable("practitionerId") UUID practitionerId,
            @Valid @RequestBody DisableDayRequest request
    ) {
        int disabled = availabilityService.disableDay(SecurityUtils.getCurrentSession(), practitionerId, request);
        return ResponseEntity.ok(Map.of("disabled", disabled));
    }
}
