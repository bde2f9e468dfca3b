package com.clinicflow.backend.modules.queue;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
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
import com.clinicflow.backend.modules.visit.domain.VisitPriority;
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
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.MockHttpServletRequestBuilder;

@SpringBootTest
@AutoConfigureMockMvc
class OpdQueueIntegrationTest extends AbstractPostgresIntegrationTest {

    private static final Set<Permission> DOCTOR_DESK = Set.of(
            Permission.APPOINTMENT_VIEW,
            Permission.APPOINTMENT_CREATE,
            Permission.APPOINTMENT_EDIT,
            Permission.VISIT_VIEW,
            Permission.VISIT_EDIT,
            Permission.CONSULTATION_EDIT,
            Permission.QUEUE_MANAGE
    );

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private TestClinicFactory clinic;

    private UUID tenantId;
    private Department cardiology;
    private Practitioner doctor;
    private LocalDate tomorrow;
    private String token;

    @BeforeEach
    void setUp() {
        tenantId = UUID.randomUUID();
        cardiology = clinic.department(tenantId, "CARD", "Cardiology");
        doctor = clinic.practitioner(tenantId, "DR-001", "Dr. Rao", cardiology);
        clinic.everyDay(tenantId, doctor, cardiology, LocalTime.of(9, 0), LocalTime.of(12, 0), 15, true);
        tomorrow = LocalDate.now(ZoneOffset.UTC).plusDays(1);
        token = TestSessionTokens.bearer(tenantId, UUID.randomUUID(), List.of(cardiology.getId()), DOCTOR_DESK);
    }

    @Test
    void emergencyIsServedBeforeEarlierNormalCheckIn() throws Exception {
        Patient normal = clinic.patient(tenantId, "MRN-1001", "Asha", "Verma");
        Patient emergency = clinic.patient(tenantId, "MRN-1002", "Ravi", "Kumar");
        UUID normalVisit = checkIn(book(normal.getId(), "09:00", "NORMAL"));
        UUID emergencyVisit = checkIn(book(emergency.getId(), "09:15", "EMERGENCY"));

        mockMvc.perform(get("/queue").header("Authorization", token))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.items.length()").value(2))
                .andExpect(jsonPath("$.items[0].visitId").value(emergencyVisit.toString()))
                .andExpect(jsonPath("$.items[0].priority").value("EMERGENCY"))
                .andExpect(jsonPath("$.items[0].patientName").value("Ravi Kumar"))
                .andExpect(jsonPath("$.items[0].practitionerName").value("Dr. Rao"))
                .andExpect(jsonPath("$.items[0].departmentName").value("Cardiology"))
                .andExpect(jsonPath("$.items[1].visitId").value(normalVisit.toString()));

        mockMvc.perform(get("/queue/counts").header("Authorization", token))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.waiting").value(2))
                .andExpect(jsonPath("$.inProgress").value(0));
    }

    @Test
    void priorityChangeReordersQueue() throws Exception {
        Patient first = clinic.patient(tenantId, "MRN-2001", "Asha", "Verma");
        Patient second = clinic.patient(tenantId, "MRN-2002", "Ravi", "Kumar");
        checkIn(book(first.getId(), "09:00", "NORMAL"));
        UUID laterVisit = checkIn(book(second.getId(), "09:15", "NORMAL"));

        mockMvc.perform(patch("/visits/" + laterVisit + "/priority")
                        .header("Authorization", token)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"priority\": \"URGENT\"}"))
                .andExpect(status().isOk());

        mockMvc.perform(get("/queue").header("Authorization", token))
                .andExpect(jsonPath("$.items[0].visitId").value(laterVisit.toString()))
                .andExpect(jsonPath("$.items[0].priority").value("URGENT"));
    }

    @Test
    void oneConsultationAtATimeAndCompletionLeavesTheQueue() throws Exception {
        Patient first = clinic.patient(tenantId, "MRN-3001", "Asha", "Verma");
        Patient second = clinic.patient(tenantId, "MRN-3002", "Ravi", "Kumar");
        UUID firstVisit = checkIn(book(first.getId(), "09:00", "NORMAL"));
        UUID secondVisit = checkIn(book(second.getId(), "09:15", "NORMAL"));

        mockMvc.perform(post("/visits/" + firstVisit + "/start").header("Authorization", token))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("IN_PROGRESS"));

        mockMvc.perform(post("/visits/" + secondVisit + "/start").header("Authorization", token))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("HAS_IN_PROGRESS"))
                .andExpect(jsonPath("$.properties.inProgressVisitId").value(firstVisit.toString()));

        mockMvc.perform(post("/visits/" + firstVisit + "/complete").header("Authorization", token))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("COMPLETED"));

        mockMvc.perform(get("/queue").header("Authorization", token))
                .andExpect(jsonPath("$.items.length()").value(1))
                .andExpect(jsonPath("$.items[0].visitId").value(secondVisit.toString()));
        Integer remaining = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM opd_queue_snapshot WHERE visit_id = ?", Integer.class, firstVisit);
        assertThat(remaining).isZero();
    }

    @Test
    void cancellingACheckedInAppointmentRemovesItsQueueEntry() throws Exception {
        Patient patient = clinic.patient(tenantId, "MRN-4001", "Asha", "Verma");
        UUID appointmentId = book(patient.getId(), "09:00", "NORMAL");
        checkIn(appointmentId);

        mockMvc.perform(post("/appointments/" + appointmentId + "/cancel")
                        .header("Authorization", token)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"reason\": \"Patient left\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("CANCELLED"));

        mockMvc.perform(get("/queue").header("Authorization", token))
                .andExpect(jsonPath("$.items.length()").value(0));
    }

    @Test
    void rebuildRestoresLostEntries() throws Exception {
        Patient patient = clinic.patient(tenantId, "MRN-5001", "Asha", "Verma");
        UUID visitId = checkIn(book(patient.getId(), "09:00", "NORMAL"));
        jdbcTemplate.update("DELETE FROM opd_queue_snapshot WHERE visit_id = ?", visitId);

        mockMvc.perform(post("/queue/rebuild").header("Authorization", token))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.upserted").value(1))
                .andExpect(jsonPath("$.failed").value(0));

        mockMvc.perform(get("/queue").header("Authorization", token))
                .andExpect(jsonPath("$.items[0].visitId").value(visitId.toString()));
    }

    @Test
    void rebuildLeavesUnchangedEntriesUntouched() throws Exception {
        Patient patient = clinic.patient(tenantId, "MRN-5101", "Asha", "Verma");
        UUID visitId = checkIn(book(patient.getId(), "09:00", "NORMAL"));
        Map<String, Object> before = jdbcTemplate.queryForMap(
                "SELECT * FROM opd_queue_snapshot WHERE visit_id = ?", visitId);

        mockMvc.perform(post("/queue/rebuild").header("Authorization", token))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.upserted").value(0))
                .andExpect(jsonPath("$.failed").value(0));

        Map<String, Object> after = jdbcTemplate.queryForMap(
                "SELECT * FROM opd_queue_snapshot WHERE visit_id = ?", visitId);
        assertThat(after).isEqualTo(before);
    }

    @Test
    void pagingThroughTiedEntriesReturnsEachVisitOnce() throws Exception {
        List<UUID> visitIds = new ArrayList<>();
        String[] times = {"09:00", "09:15", "09:30", "09:45", "10:00"};
        for (int i = 0; i < times.length; i++) {
            Patient patient = clinic.patient(tenantId, "MRN-71" + i + "0", "Patient", "No" + i);
            visitIds.add(checkIn(book(patient.getId(), times[i], "NORMAL")));
        }
        OffsetDateTime sameInstant = OffsetDateTime.parse("2025-03-03T09:00:00Z");
        jdbcTemplate.update("UPDATE opd_queue_snapshot SET check_in_time = ? WHERE tenant_id = ?",
                sameInstant, tenantId);
        jdbcTemplate.update(
                "UPDATE opd_queue_snapshot SET priority = 'EMERGENCY', priority_rank = ? WHERE visit_id IN (?, ?)",
                VisitPriority.EMERGENCY.rank(), visitIds.get(1), visitIds.get(3));
        List<UUID> expected = jdbcTemplate.queryForList("""
                SELECT visit_id FROM opd_queue_snapshot
                 WHERE tenant_id = ?
                 ORDER BY priority_rank DESC, check_in_time ASC, id ASC
                """, UUID.class, tenantId);

        List<UUID> seen = new ArrayList<>();
        String cursor = null;
        int pages = 0;
        do {
            MockHttpServletRequestBuilder request = get("/queue")
                    .header("Authorization", token)
                    .param("limit", "2");
            if (cursor != null) {
                request.param("cursor", cursor);
            }
            JsonNode page = readJson(mockMvc.perform(request).andExpect(status().isOk()).andReturn());
            page.path("items").forEach(item -> seen.add(UUID.fromString(item.path("visitId").asText())));
            cursor = page.path("nextCursor").isNull() ? null : page.path("nextCursor").asText(null);
            pages++;
        } while (cursor != null && pages < 10);

        assertThat(pages).isEqualTo(3);
        assertThat(seen).containsExactlyElementsOf(expected);
        assertThat(seen).containsExactlyInAnyOrderElementsOf(visitIds);
        assertThat(seen.subList(0, 2)).containsExactlyInAnyOrder(visitIds.get(1), visitIds.get(3));
    }

    @Test
    void concurrentStartsLetOnlyOneConsultationRun() throws Exception {
        Patient first = clinic.patient(tenantId, "MRN-8001", "Asha", "Verma");
        Patient second = clinic.patient(tenantId, "MRN-8002", "Ravi", "Kumar");
        UUID firstVisit = checkIn(book(first.getId(), "09:00", "NORMAL"));
        UUID secondVisit = checkIn(book(second.getId(), "09:15", "NORMAL"));

        ExecutorService executor = Executors.newFixedThreadPool(2);
        CountDownLatch ready = new CountDownLatch(2);
        CountDownLatch start = new CountDownLatch(1);

        List<Callable<MockHttpServletResponse>> tasks = new ArrayList<>();
        for (UUID visitId : List.of(firstVisit, secondVisit)) {
            tasks.add(() -> {
                ready.countDown();
                boolean started = start.await(5, TimeUnit.SECONDS);
                assertThat(started).isTrue();
                return mockMvc.perform(post("/visits/" + visitId + "/start").header("Authorization", token))
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
                    .containsExactlyInAnyOrder(HttpStatus.OK.value(), HttpStatus.CONFLICT.value());

            MockHttpServletResponse conflict = responses.stream()
                    .filter(res -> res.getStatus() == HttpStatus.CONFLICT.value())
                    .findFirst()
                    .orElseThrow();
            assertThat(objectMapper.readTree(conflict.getContentAsString()).path("code").asText())
                    .isEqualTo("HAS_IN_PROGRESS");
        } finally {
            executor.shutdownNow();
        }

        Integer inProgress = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM visit WHERE practitioner_id = ? AND status = 'IN_PROGRESS'",
                Integer.class, doctor.getId());
        assertThat(inProgress).isEqualTo(1);
    }

    @Test
    void queueIsScopedToAssignedDepartments() throws Exception {
        Patient patient = clinic.patient(tenantId, "MRN-6001", "Asha", "Verma");
        checkIn(book(patient.getId(), "09:00", "NORMAL"));
        Department neurology = clinic.department(tenantId, "NEURO", "Neurology");
        String neurologist = TestSessionTokens.bearer(tenantId, UUID.randomUUID(),
                List.of(neurology.getId()), Set.of(Permission.VISIT_VIEW));

        mockMvc.perform(get("/queue").header("Authorization", neurologist))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.items.length()").value(0));
        mockMvc.perform(get("/queue")
                        .header("Authorization", neurologist)
                        .param("departmentId", cardiology.getId().toString()))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("DEPT_ACCESS_DENIED"));
    }

    private UUID book(UUID patientId, String time, String priority) throws Exception {
        MvcResult result = mockMvc.perform(post("/appointments")
                        .header("Authorization", token)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "patientId": "%s",
                                  "practitionerId": "%s",
                                  "departmentId": "%s",
                                  "appointmentDate": "%s",
                                  "appointmentTime": "%s",
                                  "priority": "%s"
                                }
                                """.formatted(patientId, doctor.getId(), cardiology.getId(), tomorrow, time, priority)))
                .andExpect(status().isCreated())
                .andReturn();
        return UUID.fromString(readJson(result).path("appointmentId").asText());
    }

    private UUID checkIn(UUID appointmentId) throws Exception {
        MvcResult result = mockMvc.perform(post("/appointments/" + appointmentId + "/check-in")
                        .header("Authorization", token))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("CHECKED_IN"))
                .andReturn();
        return UUID.fromString(readJson(result).path("visitId").asText());
    }

    private JsonNode readJson(MvcResult result) throws Exception {
        return objectMapper.readTree(result.getResponse().getContentAsString());
    }
}
