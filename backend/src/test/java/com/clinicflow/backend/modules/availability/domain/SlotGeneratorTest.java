package com.clinicflow.backend.modules.availability.domain;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.UUID;

import com.clinicflow.backend.global.common.ResourceStatus;
import com.clinicflow.backend.modules.master.domain.PractitionerStatus;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

class SlotGeneratorTest {

    private static final UUID CARDIOLOGY = UUID.fromString("00000000-0000-0000-0000-0000000000d1");
    private static final UUID NEUROLOGY = UUID.fromString("00000000-0000-0000-0000-0000000000d2");
    // 2025-03-03 is a Monday
    private static final LocalDate MONDAY = LocalDate.of(2025, 3, 3);

    @Test
    @DisplayName("09:00-10:00 in 15 minute steps yields four slots")
    void splitsWindowIntoSlots() {
        List<Slot> slots = SlotGenerator.generate(
                List.of(template(CARDIOLOGY, LocalTime.of(9, 0), LocalTime.of(10, 0), 15)),
                MONDAY, PractitionerStatus.ACTIVE, null, List.of());

        assertThat(slots).extracting(Slot::start)
                .containsExactly(LocalTime.of(9, 0), LocalTime.of(9, 15), LocalTime.of(9, 30), LocalTime.of(9, 45));
        assertThat(slots).allMatch(Slot::available);
        assertThat(slots.get(3).end()).isEqualTo(LocalTime.of(10, 0));
    }

    @Test
    @DisplayName("a trailing remainder shorter than the slot length is dropped")
    void dropsPartialTrailingSlot() {
        List<Slot> slots = SlotGenerator.generate(
                List.of(template(CARDIOLOGY, LocalTime.of(9, 0), LocalTime.of(9, 50), 20)),
                MONDAY, PractitionerStatus.ACTIVE, null, List.of());

        assertThat(slots).extracting(Slot::start).containsExactly(LocalTime.of(9, 0), LocalTime.of(9, 20));
    }

    @Test
    @DisplayName("slots never run past the last minute of the day")
    void windowUntilEndOfDay() {
        List<Slot> slots = SlotGenerator.generate(
                List.of(template(CARDIOLOGY, LocalTime.of(23, 0), LocalTime.of(23, 59), 30)),
                MONDAY, PractitionerStatus.ACTIVE, null, List.of());

        assertThat(slots).extracting(Slot::start).containsExactly(LocalTime.of(23, 0));
        assertThat(slots.get(0).end()).isEqualTo(LocalTime.of(23, 30));
    }

    @Test
    @DisplayName("slots overlapping a booked window are unavailable")
    void markBookedSlots() {
        List<Slot> slots = SlotGenerator.generate(
                List.of(template(CARDIOLOGY, LocalTime.of(9, 0), LocalTime.of(10, 0), 30)),
                MONDAY, PractitionerStatus.ACTIVE, null,
                List.of(new TimeWindow(LocalTime.of(9, 30), LocalTime.of(10, 0))));

        assertThat(slots.get(0).available()).isTrue();
        assertThat(slots.get(1).unavailableReason()).isEqualTo(SlotUnavailableReason.BOOKED);
    }

    @Test
    @DisplayName("a practitioner on leave has only unavailable slots")
    void practitionerOnLeave() {
        List<Slot> slots = SlotGenerator.generate(
                List.of(template(CARDIOLOGY, LocalTime.of(9, 0), LocalTime.of(10, 0), 30)),
                MONDAY, PractitionerStatus.ON_LEAVE, null, List.of());

        assertThat(slots).hasSize(2)
                .allMatch(slot -> slot.unavailableReason() == SlotUnavailableReason.PRACTITIONER_UNAVAILABLE);
    }

    @Test
    @DisplayName("slots of another department are flagged when a department is requested")
    void departmentMismatch() {
        List<Slot> slots = SlotGenerator.generate(
                List.of(template(CARDIOLOGY, LocalTime.of(9, 0), LocalTime.of(9, 30), 30),
                        template(NEUROLOGY, LocalTime.of(14, 0), LocalTime.of(14, 30), 30)),
                MONDAY, PractitionerStatus.ACTIVE, CARDIOLOGY, List.of());

        assertThat(slots).hasSize(2);
        assertThat(slots.get(0).available()).isTrue();
        assertThat(slots.get(1).unavailableReason()).isEqualTo(SlotUnavailableReason.DEPARTMENT_MISMATCH);
    }

    @Test
    @DisplayName("inactive, other-weekday and out-of-range templates produce nothing")
    void skipsNonApplicableTemplates() {
        AvailabilityTemplate inactive = template(CARDIOLOGY, LocalTime.of(9, 0), LocalTime.of(10, 0), 30);
        inactive.setStatus(ResourceStatus.INACTIVE);
        AvailabilityTemplate tuesday = template(CARDIOLOGY, LocalTime.of(9, 0), LocalTime.of(10, 0), 30);
        tuesday.setDayOfWeek(DayOfWeek.TUESDAY);
        AvailabilityTemplate expired = template(CARDIOLOGY, LocalTime.of(9, 0), LocalTime.of(10, 0), 30);
        expired.setEffectiveTo(MONDAY.minusDays(1));
        AvailabilityTemplate future = template(CARDIOLOGY, LocalTime.of(9, 0), LocalTime.of(10, 0), 30);
        future.setEffectiveFrom(MONDAY.plusDays(1));

        List<Slot> slots = SlotGenerator.generate(List.of(inactive, tuesday, expired, future),
                MONDAY, PractitionerStatus.ACTIVE, null, List.of());

        assertThat(slots).isEmpty();
    }

    @Test
    @DisplayName("slots from several templates come back sorted by start time")
    void mergesTemplatesInOrder() {
        List<Slot> slots = SlotGenerator.generate(
                List.of(template(CARDIOLOGY, LocalTime.of(14, 0), LocalTime.of(15, 0), 60),
                        template(CARDIOLOGY, LocalTime.of(8, 0), LocalTime.of(9, 0), 60)),
                MONDAY, PractitionerStatus.ACTIVE, null, List.of());

        assertThat(slots).extracting(Slot::start).containsExactly(LocalTime.of(8, 0), LocalTime.of(14, 0));
    }

    static AvailabilityTemplate template(UUID departmentId, LocalTime start, LocalTime end, int minutes) {
        AvailabilityTemplate template = new AvailabilityTemplate();
        ReflectionTestUtils.setField(template, "id", UUID.randomUUID());
        template.setTenantId(UUID.fromString("00000000-0000-0000-0000-0000000000a1"));
        template.setPractitionerId(UUID.fromString("00000000-0000-0000-0000-0000000000b1"));
        template.setDepartmentId(departmentId);
        template.setDayOfWeek(DayOfWeek.MONDAY);
        template.setStartTime(start);
        template.setEndTime(end);
        template.setSlotDurationMinutes(minutes);
        template.setEffectiveFrom(LocalDate.of(2025, 1, 1));
        return template;
    }
}
