package com.clinicflow.backend.modules.queue.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import com.clinicflow.backend.global.error.ProblemException;
import com.clinicflow.backend.global.pagination.CursorCodec;
import com.clinicflow.backend.global.pagination.CursorPage;
import com.clinicflow.backend.modules.access.application.AccessGuard;
import com.clinicflow.backend.modules.access.domain.Permission;
import com.clinicflow.backend.modules.access.domain.SessionContext;
import com.clinicflow.backend.modules.queue.application.OpdQueueQueryService.QueueQuery;
import com.clinicflow.backend.modules.queue.domain.OpdQueueSnapshot;
import com.clinicflow.backend.modules.queue.domain.QueueCounts;
import com.clinicflow.backend.modules.queue.infrastructure.persistence.OpdQueueSnapshotRepository;
import com.clinicflow.backend.modules.queue.infrastructure.persistence.QueueSearchCondition;
import com.clinicflow.backend.modules.visit.domain.VisitPriority;
import com.clinicflow.backend.modules.visit.domain.VisitStatus;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

@ExtendWith(MockitoExtension.class)
class OpdQueueQueryServiceTest {

    private static final UUID TENANT = UUID.fromString("00000000-0000-0000-0000-0000000000a1");
    private static final UUID CARDIOLOGY = UUID.fromString("00000000-0000-0000-0000-0000000000d1");
    private static final UUID NEUROLOGY = UUID.fromString("00000000-0000-0000-0000-0000000000d2");
    private static final UUID USER = UUID.fromString("00000000-0000-0000-0000-0000000000f1");
    private static final OffsetDateTime NINE = OffsetDateTime.parse("2025-03-03T09:00:00Z");

    @Mock
    private OpdQueueSnapshotRepository snapshotRepository;

    private final CursorCodec cursorCodec = new CursorCodec(new ObjectMapper());
    private OpdQueueQueryService service;

    @BeforeEach
    void setUp() {
        service = new OpdQueueQueryService(snapshotRepository, new AccessGuard(), cursorCodec);
    }

    @Test
    @DisplayName("a full page carries a cursor built from the last entry's rank and check-in time")
    void pagesWithCursor() {
        OpdQueueSnapshot emergency = entry(VisitPriority.EMERGENCY, NINE.plusMinutes(5));
        OpdQueueSnapshot normal = entry(VisitPriority.NORMAL, NINE);
        OpdQueueSnapshot extra = entry(VisitPriority.NORMAL, NINE.plusMinutes(10));
        when(snapshotRepository.searchQueue(any())).thenReturn(List.of(emergency, normal, extra));

        CursorPage<OpdQueueSnapshot> page = service.getQueue(cardiologyStaff(),
                new QueueQuery(null, null, null, null, 2));

        assertThat(page.items()).containsExactly(emergency, normal);
        assertThat(page.hasMore()).isTrue();

        when(snapshotRepository.searchQueue(any())).thenReturn(List.of(extra));
        service.getQueue(cardiologyStaff(), new QueueQuery(null, null, null, page.nextCursor(), 2));

        ArgumentCaptor<QueueSearchCondition> captor = ArgumentCaptor.forClass(QueueSearchCondition.class);
        verify(snapshotRepository, times(2)).searchQueue(captor.capture());
        QueueSearchCondition second = captor.getAllValues().get(1);
        assertThat(second.afterPosition().priorityRank()).isEqualTo(VisitPriority.NORMAL.rank());
        assertThat(second.afterPosition().checkInTime()).isEqualTo(NINE);
        assertThat(second.afterId()).isEqualTo(normal.getId());
        assertThat(second.departmentFilter().departmentIds()).containsExactly(CARDIOLOGY);
        assertThat(second.tenantId()).isEqualTo(TENANT);
    }

    @Test
    @DisplayName("a user without departments gets an empty queue without touching the database")
    void noDepartmentsEmpty() {
        SessionContext session = new SessionContext(TENANT, USER, Set.of(), Set.of(Permission.VISIT_VIEW), false);

        CursorPage<OpdQueueSnapshot> page = service.getQueue(session, new QueueQuery(null, null, null, null, null));

        assertThat(page.items()).isEmpty();
        assertThat(page.hasMore()).isFalse();
        verify(snapshotRepository, never()).searchQueue(any());
    }

    @Test
    @DisplayName("filtering by an unassigned department is denied")
    void foreignDepartmentDenied() {
        assertThatThrownBy(() -> service.getQueue(cardiologyStaff(),
                new QueueQuery(List.of(NEUROLOGY), null, null, null, null)))
                .isInstanceOf(ProblemException.class)
                .extracting("code")
                .isEqualTo("DEPT_ACCESS_DENIED");
    }

    @Test
    @DisplayName("a cursor from another listing is rejected")
    void foreignCursorRejected() {
        String appointmentCursor = cursorCodec.encode("2025-03-03T09:00", UUID.randomUUID());

        assertThatThrownBy(() -> service.getQueue(cardiologyStaff(),
                new QueueQuery(null, null, null, appointmentCursor, null)))
                .isInstanceOf(ProblemException.class)
                .extracting("detailMessage")
                .isEqualTo("INVALID_CURSOR");
    }

    @Test
    @DisplayName("viewing the queue requires VISIT_VIEW")
    void requiresPermission() {
        SessionContext session = new SessionContext(TENANT, USER, Set.of(CARDIOLOGY),
                Set.of(Permission.APPOINTMENT_VIEW), false);

        assertThatThrownBy(() -> service.getQueue(session, new QueueQuery(null, null, null, null, null)))
                .isInstanceOf(ProblemException.class)
                .extracting("code")
                .isEqualTo("PERMISSION_DENIED");
    }

    @Test
    @DisplayName("counts default missing statuses to zero")
    void counts() {
        when(snapshotRepository.countByStatus(eq(TENANT), any(), isNull()))
                .thenReturn(Map.of(VisitStatus.WAITING, 4L));

        QueueCounts counts = service.getQueueCounts(cardiologyStaff(), null, null);

        assertThat(counts.waiting()).isEqualTo(4L);
        assertThat(counts.inProgress()).isZero();
        assertThat(counts.total()).isEqualTo(4L);
    }

    private static SessionContext cardiologyStaff() {
        return new SessionContext(TENANT, USER, Set.of(CARDIOLOGY), Set.of(Permission.VISIT_VIEW), false);
    }

    private static OpdQueueSnapshot entry(VisitPriority priority, OffsetDateTime checkIn) {
        OpdQueueSnapshot snapshot = new OpdQueueSnapshot(UUID.randomUUID());
        ReflectionTestUtils.setField(snapshot, "id", UUID.randomUUID());
        snapshot.setTenantId(TENANT);
        snapshot.setDepartmentId(CARDIOLOGY);
        snapshot.setPriority(priority);
        snapshot.setStatus(VisitStatus.WAITING);
        snapshot.setCheckInTime(checkIn);
        return snapshot;
    }
}
