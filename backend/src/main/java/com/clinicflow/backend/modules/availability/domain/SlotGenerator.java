package com.clinicflow.backend.modules.availability.domain;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;

import com.clinicflow.backend.modules.master.domain.PractitionerStatus;

/**
 * Projects weekly templates onto one date. Pure function of its inputs: nothing is persisted,
 * so a template change is visible on the next read.
 */
public final class SlotGenerator {

    private SlotGenerator() {
    }

    public static List<Slot> generate(
            List<AvailabilityTemplate> templates,
            LocalDate date,
            PractitionerStatus practitionerStatus,
            UUID requestedDepartmentId,
            List<TimeWindow> bookedWindows
    ) {
        boolean practitionerAvailable = practitionerStatus != null && practitionerStatus.isSchedulable();
        List<Slot> slots = new ArrayList<>();
        for (AvailabilityTemplate template : templates) {
            if (!template.isActive()
                    || template.getDayOfWeek() != date.getDayOfWeek()
                    || !template.isEffectiveOn(date)
                    || template.getSlotDurationMinutes() <= 0) {
                continue;
            }
            int start = toMinutes(template.getStartTime());
            int end = toMinutes(template.getEndTime());
            int duration = template.getSlotDurationMinutes();
            for (int cursor = start; cursor + duration <= end; cursor += duration) {
                LocalTime slotStart = fromMinutes(cursor);
                LocalTime slotEnd = fromMinutes(cursor + duration);
                TimeWindow window = new TimeWindow(slotStart, slotEnd);
                SlotUnavailableReason reason = resolveReason(
                        practitionerAvailable,
                        template.getDepartmentId(),
                        requestedDepartmentId,
                        window,
                        bookedWindows
                );
                slots.add(new Slot(slotStart, slotEnd, template.getId(), template.getDepartmentId(),
                        template.isAllowWalkIn(), reason));
            }
        }
        slots.sort(Comparator.comparing(Slot::start));
        return slots;
    }

    private static SlotUnavailableReason resolveReason(
            boolean practitionerAvailable,
            UUID templateDepartmentId,
            UUID requestedDepartmentId,
            TimeWindow window,
            List<TimeWindow> bookedWindows
    ) {
        if (!practitionerAvailable) {
            return SlotUnavailableReason.PRACTITIONER_UNAVAILABLE;
        }
        if (requestedDepartmentId != null && !requestedDepartmentId.equals(templateDepartmentId)) {
            return SlotUnavailableReason.DEPARTMENT_MISMATCH;
        }
        for (TimeWindow booked : bookedWindows) {
            if (booked.overlaps(window)) {
                return SlotUnavailableReason.BOOKED;
            }
        }
        return null;
    }

    private static int toMinutes(LocalTime time) {
        return time.getHour() * 60 + time.getMinute();
    }

    private static LocalTime fromMinutes(int minutes) {
        return LocalTime.of(minutes / 60, minutes % 60);
    }
}
