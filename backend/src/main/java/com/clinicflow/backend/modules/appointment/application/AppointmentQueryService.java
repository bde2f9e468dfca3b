package com.clinicflow.backend.modules.appointment.application;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import com.clinicflow.backend.global.error.ErrorCode;
import com.clinicflow.backend.global.error.ProblemException;
import com.clinicflow.backend.global.pagination.Cursor;
import com.clinicflow.backend.global.pagination.CursorCodec;
import com.clinicflow.backend.global.pagination.CursorPage;
import com.clinicflow.backend.modules.access.application.AccessGuard;
import com.clinicflow.backend.modules.access.domain.DepartmentFilter;
import com.clinicflow.backend.modules.access.domain.Permission;
import com.clinicflow.backend.modules.access.domain.SessionContext;
import com.clinicflow.backend.modules.appointment.domain.Appointment;
import com.clinicflow.backend.modules.appointment.domain.AppointmentStatus;
import com.clinicflow.backend.modules.appointment.infrastructure.persistence.AppointmentRepository;
import com.clinicflow.backend.modules.appointment.infrastructure.persistence.AppointmentSearchCondition;
import com.clinicflow.backend.modules.appointment.presentation.dto.AppointmentListResponse;
import com.clinicflow.backend.modules.appointment.presentation.dto.AppointmentResponse;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional(readOnly = true)
public class AppointmentQueryService {

    private final AppointmentRepository appointmentRepository;
    private final AccessGuard accessGuard;
    private final CursorCodec cursorCodec;

    public AppointmentQueryService(
            AppointmentRepository appointmentRepository,
            AccessGuard accessGuard,
            CursorCodec cursorCodec
    ) {
        this.appointmentRepository = appointmentRepository;
        this.accessGuard = accessGuard;
        this.cursorCodec = cursorCodec;
    }

    public AppointmentResponse get(SessionContext session, UUID appointmentId) {
        Appointment appointment = appointmentRepository.findById(appointmentId)
                .orElseThrow(() -> new ProblemException(ErrorCode.NOT_FOUND, "APPOINTMENT_NOT_FOUND"));
        accessGuard.require(session, Permission.APPOINTMENT_VIEW, appointment);
        return AppointmentResponse.from(appointment);
    }

    public AppointmentListResponse list(SessionContext session, AppointmentQuery query) {
        accessGuard.require(session, Permission.APPOINTMENT_VIEW);
        DepartmentFilter filter = accessGuard.buildFilter(session, query.departmentIds());
        if (filter.matchesNothing()) {
            return new AppointmentListResponse(List.of(), null, false);
        }

        int limit = CursorPage.clampLimit(query.limit());
        Optional<Cursor> cursor = cursorCodec.decodeRequired(query.cursor());
        cursor.ifPresent(AppointmentQueryService::ensureTimestampCursor);

        AppointmentSearchCondition condition = new AppointmentSearchCondition(
                session.tenantId(),
                filter,
                query.practitionerId(),
                query.patientId(),
                query.appointmentDate(),
                query.statuses(),
                cursor.orElse(null),
                limit
        );
        CursorPage<AppointmentResponse> page = CursorPage.fromOverfetch(
                        appointmentRepository.searchAppointments(condition),
                        limit,
                        appointment -> cursorCodec.encode(appointment.getCreatedAt().toString(), appointment.getId()))
                .map(AppointmentResponse::from);
        return new AppointmentListResponse(page.items(), page.nextCursor(), page.hasMore());
    }

    private static void ensureTimestampCursor(Cursor cursor) {
        try {
            OffsetDateTime.parse(cursor.sortValue());
        } catch (DateTimeParseException ex) {
            throw new ProblemException(ErrorCode.VALIDATION_ERROR, "INVALID_CURSOR");
        }
    }

    public record AppointmentQuery(
            Collection<UUID> departmentIds,
            UUID practitionerId,
            UUID patientId,
            LocalDate appointmentDate,
            Set<AppointmentStatus> statuses,
            String cursor,
            Integer limit
    ) {
    }
}
