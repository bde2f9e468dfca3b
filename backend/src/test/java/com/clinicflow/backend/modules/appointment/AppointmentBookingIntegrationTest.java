package com.clinicflow.backend.modules.appointment;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import com.clinicflow.backend.modules.access.domain.Permission;
import com.clinicflow.backend.modules.master.domain.Department;
import com.clinicflow.backend.modules.master.domain.Patient;
import com.clinicflow.backend.modules.master.domain.Practitioner;
import com.clinicflow.backend.support.AbstractPostgresIntegrationTest;
import com.clinicflow.backend.support.TestClinicFactory;
import com.clinicflow.backend.support.TestSessionTokens;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

@SpringBootTest
@AutoConfigureMockMvc
class AppointmentBookingIntegrationTest extends AbstractPostgresIntegrationTest {

    private static final Set<Permission> RECEPTION = Set.of(
            Permission.APPOINTMENT_VIEW,
            Permission.APPOINTMENT_CREATE,
            Permission.APPOINTMENT_EDIT
    );

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private TestClinicFactory clinic;

    private UUID tenantId;
    private Department cardiology;
    private Department neurology;
    private Practitioner doctor;
    private LocalDate tomorrow;
    private String receptionToken;

    @BeforeEach
    void setUp() {
        tenantId = UUID.randomUUID();
        cardiology = clinic.department(tenantId, "CARD", "Cardiology");
        neurology = clinic.department(tenantId, "NEURO", "Neurology");
        doctor = clinic.practitioner(tenantId, "DR-001", "Dr. Rao", cardiology);
        clinic.everyDay(tenantId, doctor, cardiology, LocalTime.of(9, 0), LocalTime.of(12, 0), 15, true);
        tomorrow = LocalDate.now(ZoneOffset.UTC).plusDays(1);
        receptionToken = TestSessionTokens.bearer(tenantId, UUID.randomUUID(), List.of(cardiology.getId()), RECEPTION);
    }

    @Test
    void concurrentBookingsOfOneSlotProduceExactlyOneAppointment() throws Exception {
        Patient first = clinic.patient(tenantId, "MRN-1001", "Asha", "Verma");
        Patient second = clinic.patient(tenantId, "MRN-1002", "Ravi", "Kumar");

        ExecutorService executor = Executors.newFixedThreadPool(2);
        CountDownLatch ready = new CountDownLatch(2);
        CountDownLatch start = new CountDownLatch(1);

        List<Callable<MockHttpServletResponse>> tasks = new ArrayList<>();
        for (Patient patient : List.of(first, second)) {
            tasks.add(() -> {
                ready.countDown();
                boolean started = start.await(5, TimeUnit.SECONDS);
                assertThat(started).isTrue();
                return mockMvc.perform(post("/appointments")
                                .header("Authorization", receptionToken)
                                .contentType(MediaType.APPLICATION_JSON)
                                .content(bookingJson(patient.getId(), tomorrow, "10:00")))
                        .andReturn()
                        .getResponse();
            });
        }

        Future<MockHttpServletResponse> firstResult = executor.submit(tasks.get(0));
        Future<MockHttpServletResponse> secondResult = executor.submit(tasks.get(1));
        try {
            ready.await(5, TimeUnit.SECONDS);
            start.countDown();

            List<MockHttpServletResponse> responses = List.of(
                    firstResult.get(10, TimeUnit.SECONDS),
                    secondResult.get(10, TimeUnit.SECONDS)
            );
            assertThat(responses.stream().map(MockHttpServletResponse::getStatus))
                    .containsExactlyInAnyOrder(HttpStatus.CREATED.value(), HttpStatus.CONFLICT.value());

            MockHttpServletResponse conflict = responses.stream()
                    .filter(res -> res.getStatus() == HttpStatus.CONFLICT.value())
                    .findFirst()
                    .orElseThrow();
            assertThat(readJson(conflict).path("code").asText()).isEqualTo("SLOT_CONFLICT");
        } finally {
            executor.shutdownNow();
        }

        mockMvc.perform(get("/appointments")
                        .header("Authorization", receptionToken)
                        .param("date", tomorrow.toString()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.items.length()").value(1));
    }

    @Test
    void tokensIncreasePerDepartmentAndDay() throws Exception {
        Patient first = clinic.patient(tenantId, "MRN-2001", "Asha", "Verma");
        Patient second = clinic.patient(tenantId, "MRN-2002", "Ravi", "Kumar");

        JsonNode booked1 = book(first.getId(), tomorrow, "11:00");
        JsonNode booked2 = book(second.getId(), tomorrow, "09:00");

        assertThat(booked1.path("tokenNumber").asInt()).isEqualTo(1);
        assertThat(booked2.path("tokenNumber").asInt()).isEqualTo(2);
        assertThat(booked1.path("status").asText()).isEqualTo("BOOKED");
    }

    @Test
    void pastDatesAndOffGridTimesAreRejected() throws Exception {
        Patient patient = clinic.patient(tenantId, "MRN-3001", "Asha", "Verma");

        mockMvc.perform(post("/appointments")
                        .header("Authorization", receptionToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(bookingJson(patient.getId(), tomorrow.minusDays(3), "10:00")))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.detail").value("DATE_IN_PAST"));

        mockMvc.perform(post("/appointments")
                        .header("Authorization", receptionToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(bookingJson(patient.getId(), tomorrow, "10:05")))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));
    }

    @Test
    void rescheduleOntoTakenSlotLeavesBothAppointmentsUntouched() throws Exception {
        Patient first = clinic.patient(tenantId, "MRN-4001", "Asha", "Verma");
        Patient second = clinic.patient(tenantId, "MRN-4002", "Ravi", "Kumar");
        UUID movingId = UUID.fromString(book(first.getId(), tomorrow, "09:00").path("appointmentId").asText());
        UUID occupyingId = UUID.fromString(book(second.getId(), tomorrow, "09:15").path("appointmentId").asText());

        mockMvc.perform(post("/appointments/" + movingId + "/reschedule")
                        .header("Authorization", receptionToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"newDate": "%s", "newTime": "09:15"}
                                """.formatted(tomorrow)))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("SLOT_CONFLICT"));

        mockMvc.perform(get("/appointments/" + movingId).header("Authorization", receptionToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("BOOKED"))
                .andExpect(jsonPath("$.appointmentTime").value(startsWith("09:00")));
        mockMvc.perform(get("/appointments/" + occupyingId).header("Authorization", receptionToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("BOOKED"))
                .andExpect(jsonPath("$.appointmentTime").value(startsWith("09:15")));
    }

    @Test
    void rescheduleMovesBookingToSuccessor() throws Exception {
        Patient patient = clinic.patient(tenantId, "MRN-5001", "Asha", "Verma");
        UUID originalId = UUID.fromString(book(patient.getId(), tomorrow, "09:00").path("appointmentId").asText());

        MvcResult result = mockMvc.perform(post("/appointments/" + originalId + "/reschedule")
                        .header("Authorization", receptionToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"newDate": "%s", "newTime": "10:30"}
                                """.formatted(tomorrow)))
                .andExpect(status().isOk())
                .andReturn();
        UUID successorId = UUID.fromString(readJson(result.getResponse()).path("appointmentId").asText());

        mockMvc.perform(get("/appointments/" + originalId).header("Authorization", receptionToken))
                .andExpect(jsonPath("$.status").value("RESCHEDULED"));
        mockMvc.perform(get("/appointments/" + successorId).header("Authorization", receptionToken))
                .andExpect(jsonPath("$.status").value("BOOKED"))
                .andExpect(jsonPath("$.rescheduledFromId").value(originalId.toString()));

        // the freed slot is bookable again
        Patient other = clinic.patient(tenantId, "MRN-5002", "Ravi", "Kumar");
        book(other.getId(), tomorrow, "09:00");
    }

    @Test
    void unassignedDepartmentFilterIsDeniedAndNoDepartmentsSeesNothing() throws Exception {
        Patient patient = clinic.patient(tenantId, "MRN-6001", "Asha", "Verma");
        book(patient.getId(), tomorrow, "09:00");

        mockMvc.perform(get("/appointments")
                        .header("Authorization", receptionToken)
                        .param("departmentId", neurology.getId().toString()))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("DEPT_ACCESS_DENIED"));

        String unassigned = TestSessionTokens.bearer(tenantId, UUID.randomUUID(), List.of(), RECEPTION);
        mockMvc.perform(get("/appointments").header("Authorization", unassigned))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.items.length()").value(0))
                .andExpect(jsonPath("$.hasMore").value(false));

        String otherTenant = TestSessionTokens.superAdminBearer(UUID.randomUUID(), UUID.randomUUID());
        mockMvc.perform(get("/appointments").header("Authorization", otherTenant))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.items.length()").value(0));
    }

    @Test
    void cursorPagesNeverRepeatOrSkipAppointments() throws Exception {
        Set<String> booked = new HashSet<>();
        String[] times = {"09:00", "09:15", "09:30", "09:45", "10:00", "10:15", "10:30"};
        for (int i = 0; i < times.length; i++) {
            Patient patient = clinic.patient(tenantId, "MRN-70" + i, "Patient", String.valueOf(i));
            booked.add(book(patient.getId(), tomorrow, times[i]).path("appointmentId").asText());
        }

        List<String> seen = new ArrayList<>();
        String cursor = null;
        int pages = 0;
        do {
            var request = get("/appointments")
                    .header("Authorization", receptionToken)
                    .param("date", tomorrow.toString())
                    .param("limit", "3");
            if (cursor != null) {
                request = request.param("cursor", cursor);
            }
            JsonNode page = readJson(mockMvc.perform(request).andExpect(status().isOk()).andReturn().getResponse());
            page.path("items").forEach(item -> seen.add(item.path("id").asText()));
            cursor = page.path("hasMore").asBoolean() ? page.path("nextCursor").asText() : null;
            pages++;
        } while (cursor != null && pages < 10);

        assertThat(pages).isEqualTo(3);
        assertThat(seen).doesNotHaveDuplicates();
        assertThat(seen).containsExactlyInAnyOrderElementsOf(booked);
    }

    @Test
    void malformedCursorIsRejected() throws Exception {
        mockMvc.perform(get("/appointments")
                        .header("Authorization", receptionToken)
                        .param("cursor", "not-a-cursor"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.detail").value("INVALID_CURSOR"));
    }

    private JsonNode book(UUID patientId, LocalDate date, String time) throws Exception {
        MvcResult result = mockMvc.perform(post("/appointments")
                        .header("Authorization", receptionToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(bookingJson(patientId, date, time)))
                .andExpect(status().isCreated())
                .andReturn();
        return readJson(result.getResponse());
    }

    private String bookingJson(UUID patientId, LocalDate date, String time) {
        return """
                {
                  "patientId": "%s",
                  "practitionerId": "%s",
                  "departmentId": "%s",
                  "appointmentDate": "%s",
                  "appointmentTime": "%s"
                }
                """.formatted(patientId, doctor.getId(), cardiology.getId(), date, time);
    }

    private JsonNode readJson(MockHttpServletResponse response) throws Exception {
        return objectMapper.readTree(response.getContentAsString());
    }
}
