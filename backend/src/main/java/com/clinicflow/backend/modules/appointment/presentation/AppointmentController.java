package com.clinicflow.backend.modules.appointment.presentation;

import java.net.URI;
import java.time.LocalDate;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import com.clinicflow.backend.global.security.SecurityUtils;
import com.clinicflow.backend.modules.access.domain.SessionContext;
import com.clinicflow.backend.modules.appointment.application.AppointmentBookingService;
import com.clinicflow.backend.modules.appointment.application.AppointmentQueryService;
import com.clinicflow.backend.modules.appointment.application.AppointmentQueryService.AppointmentQuery;
import com.clinicflow.backend.modules.appointment.domain.AppointmentStatus;
import com.clinicflow.backend.modules.appointment.presentation.dto.AppointmentListResponse;
import com.clinicflow.backend.modules.appointment.presentation.dto.AppointmentResponse;
import com.clinicflow.backend.modules.appointment.presentation.dto.BookingResponse;
import com.clinicflow.backend.modules.appointment.presentation.dto.CancelAppointmentRequest;
import com.clinicflow.backend.modules.appointment.presentation.dto.CheckInResponse;
import com.clinicflow.backend.modules.appointment.presentation.dto.CreateAppointmentRequest;
import com.clinicflow.backend.modules.appointment.presentation.dto.RescheduleAppointmentRequest;
import com.clinicflow.backend.modules.appointment.presentation.dto.WalkInRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import jakarta.validation.Valid;

import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/appointments")
public class AppointmentController {

    private final AppointmentBookingService bookingService;
    private final AppointmentQueryService queryService;

    public AppointmentController(AppointmentBookingService bookingService, AppointmentQueryService queryService) {
        this.bookingService = bookingService;
        this.queryService = queryService;
    }

    @Operation(
            summary = "Book an appointment",
            description = """
                    Reserves one generated slot and assigns the next daily token of the department. \
                    Two concurrent requests for the same slot produce exactly one 201; the other gets \
                    409 `SLOT_CONFLICT`.
                    """
    )
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Booked"),
            @ApiResponse(responseCode = "400", description = "`VALIDATION_ERROR` (past date, not a slot, ...)"),
            @ApiResponse(responseCode = "409", description = "`SLOT_CONFLICT`")
    })
    @PostMapping
    public ResponseEntity<BookingResponse> create(@Valid @RequestBody CreateAppointmentRequest request) {
        BookingResponse response = bookingService.create(SecurityUtils.getCurrentSession(), request);
        return ResponseEntity.created(URI.create("/appointments/" + response.appointmentId())).body(response);
    }

    @Operation(summary = "Walk-in", description = "Books the next free walk-in slot of today and queues the patient.")
    @PostMapping("/walk-in")
    public ResponseEntity<BookingResponse> walkIn(@Valid @RequestBody WalkInRequest request) {
        BookingResponse response = bookingService.walkIn(SecurityUtils.getCurrentSession(), request);
        return ResponseEntity.created(URI.create("/appointments/" + response.appointmentId())).body(response);
    }

    @GetMapping
    public ResponseEntity<AppointmentListResponse> list(
            @RequestParam(name = "departmentId", required = false) List<UUID> departmentIds,
            @RequestParam(name = "practitionerId", required = false) UUID practitionerId,
            @RequestParam(name = "patientId", required = false) UUID patientId,
            @RequestParam(name = "date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @RequestParam(name = "status", required = false) Set<AppointmentStatus> statuses,
            @RequestParam(name = "cursor", required = false) String cursor,
            @RequestParam(name = "limit", required = false) Integer limit
    ) {
        SessionContext session = SecurityUtils.getCurrentSession();
        return ResponseEntity.ok(queryService.list(session,
                new AppointmentQuery(departmentIds, practitionerId, patientId, date, statuses, cursor, limit)));
    }

    @GetMapping("/{appointmentId}")
    public ResponseEntity<AppointmentResponse> get(@PathVariable("appointmentId") UUID appointmentId) {
        return ResponseEntity.ok(queryService.get(SecurityUtils.getCurrentSession(), appointmentId));
    }

    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Successor appointment"),
            @ApiResponse(responseCode = "409", description = "`SLOT_CONFLICT`; the original booking is unchanged")
    })
    @PostMapping("/{appointmentId}/reschedule")
    public ResponseEntity<BookingResponse> reschedule(
            @PathVariable("appointmentId") UUID appointmentId,
            @Valid @RequestBody RescheduleAppointmentRequest request
    ) {
        return ResponseEntity.ok(bookingService.reschedule(SecurityUtils.getCurrentSession(), appointmentId, request));
    }

    @PostMapping("/{appointmentId}/cancel")
    public ResponseEntity<BookingResponse> cancel(
            @PathVariable("appointmentId") UUID appointmentId,
            @Valid @RequestBody(required = false) CancelAppointmentRequest request
    ) {
        return ResponseEntity.ok(bookingService.cancel(SecurityUtils.getCurrentSession(), appointmentId, request));
    }

    @PostMapping("/{appointmentId}/confirm")
    public ResponseEntity<BookingResponse> confirm(@PathVariable("appointmentId") UUID appointmentId) {
        return ResponseEntity.ok(bookingService.confirm(SecurityUtils.getCurrentSession(), appointmentId));
    }

    @PostMapping("/{appointmentId}/no-show")
    public ResponseEntity<BookingResponse> markNoShow(@PathVariable("appointmentId") UUID appointmentId) {
        return ResponseEntity.ok(bookingService.markNoShow(SecurityUtils.getCurrentSession(), appointmentId));
    }

    @PostMapping("/{appointmentId}/check-in")
    public ResponseEntity<CheckInResponse> checkIn(@PathVariable("appointmentId") UUID appointmentId) {
        return ResponseEntity.ok(bookingService.checkIn(SecurityUtils.getCurrentSession(), appointmentId));
    }
}
