package com.clinicflow.backend.modules.availability.application;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

import com.clinicflow.backend.global.common.ResourceStatus;
import com.clinicflow.backend.global.common.time.ClinicCalendar;
import com.clinicflow.backend.global.error.ErrorCode;
import com.clinicflow.backend.global.error.ProblemException;
import com.clinicflow.backend.modules.access.application.AccessGuard;
import com.clinicflow.backend.modules.access.domain.Permission;
import com.clinicflow.backend.modules.access.domain.SessionContext;
import com.clinicflow.backend.modules.appointment.domain.AppointmentStatus;
import com.clinicflow.backend.modules.appointment.infrastructure.persistence.AppointmentRepository;
import com.clinicflow.backend.modules.audit.application.AuditLogService;
import com.clinicflow.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.clinicflow.backend.modules.availability.domain.AvailabilityTemplate;
import com.clinicflow.backend.modules.availability.domain.Slot;
import com.clinicflow.backend.modules.availability.domain.SlotGenerator;
import com.clinicflow.backend.modules.availability.domain.SlotUnavailableReason;
import com.clinicflow.backend.modules.availability.domain.TimeWindow;
import com.clinicflow.backend.modules.availability.infrastructure.persistence.AvailabilityTemplateRepository;
import com.clinicflow.backend.modules.availability.presentation.dto.AvailabilityTemplateResponse;
import com.clinicflow.backend.modules.availability.presentation.dto.CreateAvailabilityRequest;
import com.clinicflow.backend.modules.availability.presentation.dto.DaySlotsResponse;
import com.clinicflow.backend.modules.availability.presentation.dto.DisableDayRequest;
import com.clinicflow.backend.modules.availability.presentation.dto.SlotResponse;
import com.clinicflow.backend.modules.availability.presentation.dto.UpdateAvailabilityRequest;
import com.clinicflow.backend.modules.master.domain.Practitioner;
import com.clinicflow.backend.modules.master.infrastructure.persistence.PractitionerDepartmentRepository;
import com.clinicflow.backend.modules.master.infrastructure.persistence.PractitionerRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class AvailabilityService {

    private static final Logger log = LoggerFactory.getLogger(AvailabilityService.class);
    private static final String RESOURCE_TYPE = "AVAILABILITY_TEMPLATE";

    private final AvailabilityTemplateRepository templateRepository;
    private final AppointmentRepository appointmentRepository;
    private final PractitionerRepository practitionerRepository;
    private final PractitionerDepartmentRepository practitionerDepartmentRepository;
    private final AccessGuard accessGuard;
    private final AuditLogService auditLogService;
    private final ClinicCalendar clinicCalendar;

    public AvailabilityService(
            AvailabilityTemplateRepository templateRepository,
            AppointmentRepository appointmentRepository,
            PractitionerRepository practitionerRepository,
            PractitionerDepartmentRepository practitionerDepartmentRepository,
            AccessGuard accessGuard,
            AuditLogService auditLogService,
            ClinicCalendar clinicCalendar
    ) {
        this.templateRepository = templateRepository;
        this.appointmentRepository = appointmentRepository;
        this.practitionerRepository = practitionerRepository;
        this.practitionerDepartmentRepository = practitionerDepartmentRepository;
        this.accessGuard = accessGuard;
        this.auditLogService = auditLogService;
        this.clinicCalendar = clinicCalendar;
    }

    @Transactional(readOnly = true)
    public DaySlotsResponse getDoctorDaySlots(SessionContext session, UUID practitionerId, LocalDate date,
                                              UUID departmentId) {
        accessGuard.require(session, Permission.DOCTOR_VIEW, departmentId);
        if (date == null) {
            throw new ProblemException(ErrorCode.VALIDATION_ERROR, "date is required");
        }
        Practitioner practitioner = loadPractitioner(session.tenantId(), practitionerId);
        List<SlotResponse> slots = computeSlots(practitioner, date, departmentId).stream()
                .map(SlotResponse::from)
                .toList();
        int available = (int) slots.stream().filter(SlotResponse::available).count();
        return new DaySlotsResponse(practitionerId, date, available, slots);
    }

    @Transactional(readOnly = true)
    public List<AvailabilityTemplateResponse> listAvailability(SessionContext session, UUID practitionerId) {
        accessGuard.require(session, Permission.DOCTOR_VIEW);
        loadPractitioner(session.tenantId(), practitionerId);
        return templateRepository.findByPractitionerIdAndTenantId(practitionerId, session.tenantId()).stream()
                .sorted(Comparator.comparing(AvailabilityTemplate::getDayOfWeek)
                        .thenComparing(AvailabilityTemplate::getStartTime))
                .map(AvailabilityTemplateResponse::from)
                .toList();
    }

    /**
     * Creates one template per requested day. Either every day is created or none is.
     */
    public List<AvailabilityTemplateResponse> bulkCreateAvailability(SessionContext session, UUID practitionerId,
                                                                     CreateAvailabilityRequest request) {
        accessGuard.require(session, Permission.DOCTOR_EDIT, request.departmentId());
        loadPractitioner(session.tenantId(), practitionerId);
        ensurePractitionerInDepartment(practitionerId, request.departmentId());

        TimeWindow window = toWindow(request.startTime(), request.endTime());
        validateDuration(window, request.slotDurationMinutes());
        LocalDate effectiveFrom = request.effectiveFrom() != null ? request.effectiveFrom() : clinicCalendar.today();
        validateEffectiveRange(effectiveFrom, request.effectiveTo());

        lockPractitioner(practitionerId);
        List<AvailabilityTemplate> existing =
                templateRepository.findByPractitionerIdAndStatus(practitionerId, ResourceStatus.ACTIVE);

        Map<DayOfWeek, TimeWindow> requested = new LinkedHashMap<>();
        for (DayOfWeek day : request.daysOfWeek()) {
            if (requested.putIfAbsent(day, window) != null) {
                throw overlap(day, window, null);
            }
            for (AvailabilityTemplate template : existing) {
                if (template.getDayOfWeek() == day
                        && template.effectiveRangeIntersects(effectiveFrom, request.effectiveTo())
                        && template.window().overlaps(window)) {
                    throw overlap(day, template.window(), template.getId());
                }
            }
        }

        List<AvailabilityTemplate> created = new ArrayList<>();
        for (DayOfWeek day : requested.keySet()) {
            AvailabilityTemplate template = new AvailabilityTemplate();
            template.setTenantId(session.tenantId());
            template.setPractitionerId(practitionerId);
            template.setDepartmentId(request.departmentId());
            template.setDayOfWeek(day);
            template.setStartTime(window.start());
            template.setEndTime(window.end());
            template.setSlotDurationMinutes(request.slotDurationMinutes());
            template.setAllowWalkIn(request.allowWalkIn() == null || request.allowWalkIn());
            template.setEffectiveFrom(effectiveFrom);
            template.setEffectiveTo(request.effectiveTo());
            template.setStatus(ResourceStatus.ACTIVE);
            created.add(templateRepository.save(template));
        }
        log.debug("Availability created practitioner={} days={} window={}", practitionerId, requested.keySet(), window);
        created.forEach(template -> audit(session, "AVAILABILITY_CREATE", template));
        return created.stream().map(AvailabilityTemplateResponse::from).toList();
    }

    public AvailabilityTemplateResponse updateAvailability(SessionContext session, UUID templateId,
                                                           UpdateAvailabilityRequest request) {
        AvailabilityTemplate template = templateRepository.findByIdAndTenantId(templateId, session.tenantId())
                .orElseThrow(() -> new ProblemException(ErrorCode.NOT_FOUND, "AVAILABILITY_NOT_FOUND"));
        accessGuard.require(session, Permission.DOCTOR_EDIT, template);
        if (!Objects.equals(request.expectedVersion(), template.getVersion())) {
            throw new ProblemException(ErrorCode.VERSION_CONFLICT,
                    "Availability was modified; expected version " + request.expectedVersion()
                            + " but found " + template.getVersion());
        }

        TimeWindow window = toWindow(
                request.startTime() != null ? request.startTime() : template.getStartTime(),
                request.endTime() != null ? request.endTime() : template.getEndTime());
        int duration = request.slotDurationMinutes() != null
                ? request.slotDurationMinutes()
                : template.getSlotDurationMinutes();
        validateDuration(window, duration);
        LocalDate effectiveTo = request.effectiveTo() != null ? request.effectiveTo() : template.getEffectiveTo();
        validateEffectiveRange(template.getEffectiveFrom(), effectiveTo);
        ResourceStatus status = request.status() != null ? request.status() : template.getStatus();

        if (status.isActive()) {
            lockPractitioner(template.getPractitionerId());
            for (AvailabilityTemplate other : templateRepository.findByPractitionerIdAndDayOfWeekAndStatus(
                    template.getPractitionerId(), template.getDayOfWeek(), ResourceStatus.ACTIVE)) {
                if (!other.getId().equals(template.getId())
                        && other.effectiveRangeIntersects(template.getEffectiveFrom(), effectiveTo)
                        && other.window().overlaps(window)) {
                    throw overlap(template.getDayOfWeek(), other.window(), other.getId());
                }
            }
        }

        template.setStartTime(window.start());
        template.setEndTime(window.end());
        template.setSlotDurationMinutes(duration);
        if (request.allowWalkIn() != null) {
            template.setAllowWalkIn(request.allowWalkIn());
        }
        template.setEffectiveTo(effectiveTo);
        template.setStatus(status);
        AvailabilityTemplate saved = templateRepository.saveAndFlush(template);
        audit(session, "AVAILABILITY_UPDATE", saved);
        return AvailabilityTemplateResponse.from(saved);
    }

    public int disableDay(SessionContext session, UUID practitionerId, DisableDayRequest request) {
        accessGuard.require(session, Permission.DOCTOR_EDIT, request.departmentId());
        loadPractitioner(session.tenantId(), practitionerId);
        List<AvailabilityTemplate> templates = templateRepository
                .findByPractitionerIdAndDepartmentIdAndDayOfWeekAndStatus(
                        practitionerId, request.departmentId(), request.dayOfWeek(), ResourceStatus.ACTIVE);
        templates.forEach(template -> {
            template.setStatus(ResourceStatus.INACTIVE);
            audit(session, "AVAILABILITY_DISABLE", template);
        });
        log.debug("Availability disabled practitioner={} day={} count={}",
                practitionerId, request.dayOfWeek(), templates.size());
        return templates.size();
    }

    /**
     * Resolves the slot a booking targets. Fails when the time is not a generated slot for the
     * practitioner and department on that date, or when the slot already has a live booking.
     */
    @Transactional(readOnly = true)
    public Slot validateSlotBooking(UUID tenantId, UUID practitionerId, UUID departmentId, LocalDate date,
                                    LocalTime time, boolean walkIn) {
        Practitioner practitioner = loadPractitioner(tenantId, practitionerId);
        if (!practitioner.getStatus().isSchedulable()) {
            throw new ProblemException(ErrorCode.VALIDATION_ERROR, "PRACTITIONER_UNAVAILABLE");
        }
        Slot slot = computeSlots(practitioner, date, departmentId).stream()
                .filter(candidate -> candidate.start().equals(time))
                .filter(candidate -> candidate.departmentId().equals(departmentId))
                .findFirst()
                .orElseThrow(() -> new ProblemException(ErrorCode.VALIDATION_ERROR,
                        "Time " + time + " is not a slot of practitioner " + practitionerId + " on " + date));
        if (walkIn && !slot.walkInAllowed()) {
            throw new ProblemException(ErrorCode.VALIDATION_ERROR, "WALK_IN_NOT_ALLOWED");
        }
        if (slot.unavailableReason() == SlotUnavailableReason.BOOKED) {
            throw new ProblemException(ErrorCode.SLOT_CONFLICT, "Slot " + slot.window() + " on " + date + " is taken");
        }
        return slot;
    }

    /**
     * First free walk-in slot of {@code now}'s date that starts at or after {@code now}.
     */
    @Transactional(readOnly = true)
    public Optional<Slot> nextWalkInSlot(UUID tenantId, UUID practitionerId, UUID departmentId, LocalDateTime now) {
        Practitioner practitioner = loadPractitioner(tenantId, practitionerId);
        LocalTime earliest = now.toLocalTime().truncatedTo(ChronoUnit.MINUTES);
        return computeSlots(practitioner, now.toLocalDate(), departmentId).stream()
                .filter(Slot::available)
                .filter(Slot::walkInAllowed)
                .filter(slot -> !slot.start().isBefore(earliest))
                .findFirst();
    }

    List<Slot> computeSlots(Practitioner practitioner, LocalDate date, UUID departmentId) {
        List<AvailabilityTemplate> templates = templateRepository.findByPractitionerIdAndDayOfWeekAndStatus(
                practitioner.getId(), date.getDayOfWeek(), ResourceStatus.ACTIVE);
        if (templates.isEmpty()) {
            return List.of();
        }
        List<TimeWindow> booked = appointmentRepository.findBookedWindows(
                practitioner.getId(), date, AppointmentStatus.slotHolding());
        return SlotGenerator.generate(templates, date, practitioner.getStatus(), departmentId, booked);
    }

    private Practitioner loadPractitioner(UUID tenantId, UUID practitionerId) {
        return practitionerRepository.findByIdAndTenantId(practitionerId, tenantId)
                .orElseThrow(() -> new ProblemException(ErrorCode.NOT_FOUND, "PRACTITIONER_NOT_FOUND"));
    }

    private void lockPractitioner(UUID practitionerId) {
        practitionerRepository.findByIdForUpdate(practitionerId)
                .orElseThrow(() -> new ProblemException(ErrorCode.NOT_FOUND, "PRACTITIONER_NOT_FOUND"));
    }

    private void ensurePractitionerInDepartment(UUID practitionerId, UUID departmentId) {
        if (!practitionerDepartmentRepository.existsByPractitionerIdAndDepartmentIdAndActiveTrue(
                practitionerId, departmentId)) {
            throw new ProblemException(ErrorCode.VALIDATION_ERROR, "PRACTITIONER_NOT_IN_DEPARTMENT");
        }
    }

    private static TimeWindow toWindow(LocalTime start, LocalTime end) {
        if (!start.isBefore(end)) {
            throw new ProblemException(ErrorCode.VALIDATION_ERROR, "startTime must be before endTime");
        }
        return new TimeWindow(start, end);
    }

    private static void validateDuration(TimeWindow window, int slotDurationMinutes) {
        long windowMinutes = ChronoUnit.MINUTES.between(window.start(), window.end());
        if (slotDurationMinutes <= 0 || slotDurationMinutes > windowMinutes) {
            throw new ProblemException(ErrorCode.VALIDATION_ERROR,
                    "slotDurationMinutes must fit inside the window " + window);
        }
    }

    private static void validateEffectiveRange(LocalDate from, LocalDate to) {
        if (to != null && to.isBefore(from)) {
            throw new ProblemException(ErrorCode.VALIDATION_ERROR, "effectiveTo must not be before effectiveFrom");
        }
    }

    private static ProblemException overlap(DayOfWeek day, TimeWindow conflicting, UUID templateId) {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("dayOfWeek", day.name());
        properties.put("conflictingWindow", conflicting.toString());
        if (templateId != null) {
            properties.put("templateId", templateId);
        }
        return new ProblemException(ErrorCode.AVAILABILITY_OVERLAP,
                "Availability on " + day + " overlaps " + conflicting, properties);
    }

    private void audit(SessionContext session, String action, AvailabilityTemplate template) {
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("practitionerId", template.getPractitionerId());
        detail.put("dayOfWeek", template.getDayOfWeek().name());
        detail.put("window", template.window().toString());
        detail.put("status", template.getStatus().name());
        auditLogService.recordAfterCommit(AuditLogCommand.of(session.tenantId(), action, RESOURCE_TYPE,
                template.getId(), session.userId(), detail));
    }
}
