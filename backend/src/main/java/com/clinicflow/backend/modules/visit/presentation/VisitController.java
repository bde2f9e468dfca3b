package com.clinicflow.backend.modules.visit.presentation;

import java.util.UUID;

import com.clinicflow.backend.global.security.SecurityUtils;
import com.clinicflow.backend.modules.visit.application.ConsultationService;
import com.clinicflow.backend.modules.visit.presentation.dto.UpdateVisitPriorityRequest;
import com.clinicflow.backend.modules.visit.presentation.dto.VisitResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/visits")
public class VisitController {

    private final ConsultationService consultationService;

    public VisitController(ConsultationService consultationService) {
        this.consultationService = consultationService;
    }

    @Operation(
            summary = "Start consultation",
            description = """
                    Moves a WAITING visit to IN_PROGRESS. If the practitioner already has another visit in \
                    progress the call fails with 409 `HAS_IN_PROGRESS` and `properties.inProgressVisitId`, \
                    unless `force=true`.
                    """
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Started, or already in progress"),
            @ApiResponse(responseCode = "409", description = "`HAS_IN_PROGRESS` or `INVALID_TRANSITION`")
    })
    @PostMapping("/{visitId}/start")
    public ResponseEntity<VisitResponse> start(
            @PathVariable("visitId") UUID visitId,
            @RequestParam(name = "force", defaultValue = "false") boolean force
    ) {
        return ResponseEntity.ok(consultationService.startConsultation(SecurityUtils.getCurrentSession(), visitId, force));
    }

    @PostMapping("/{visitId}/complete")
    public ResponseEntity<VisitResponse> complete(@PathVariable("visitId") UUID visitId) {
        return ResponseEntity.ok(consultationService.complete(SecurityUtils.getCurrentSession(), visitId));
    }

    @PatchMapping("/{visitId}/priority")
    public ResponseEntity<VisitResponse> updatePriority(
            @PathVariable("visitId") UUID visitId,
            @Valid @RequestBody UpdateVisitPriorityRequest request
    ) {
        return ResponseEntity.ok(consultationService.updatePriority(
                SecurityUtils.getCurrentSession(), visitId, request.priority()));
    }
}
