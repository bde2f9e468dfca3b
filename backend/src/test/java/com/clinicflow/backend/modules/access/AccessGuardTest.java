package com.clinicflow.backend.modules.access;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.Set;
import java.util.UUID;

import com.clinicflow.backend.global.error.ProblemException;
import com.clinicflow.backend.modules.access.application.AccessGuard;
import com.clinicflow.backend.modules.access.domain.AccessDecision;
import com.clinicflow.backend.modules.access.domain.DepartmentFilter;
import com.clinicflow.backend.modules.access.domain.DepartmentScoped;
import com.clinicflow.backend.modules.access.domain.Permission;
import com.clinicflow.backend.modules.access.domain.SessionContext;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class AccessGuardTest {

    private static final UUID TENANT = UUID.fromString("00000000-0000-0000-0000-0000000000a1");
    private static final UUID OTHER_TENANT = UUID.fromString("00000000-0000-0000-0000-0000000000a2");
    private static final UUID CARDIOLOGY = UUID.fromString("00000000-0000-0000-0000-0000000000d1");
    private static final UUID NEUROLOGY = UUID.fromString("00000000-0000-0000-0000-0000000000d2");
    private static final UUID USER = UUID.fromString("00000000-0000-0000-0000-0000000000f1");

    private final AccessGuard guard = new AccessGuard();

    @Test
    @DisplayName("super admin sees every department in the tenant")
    void superAdminUnrestricted() {
        SessionContext admin = new SessionContext(TENANT, USER, Set.of(), Set.of(), true);

        assertThat(guard.verifyDepartmentAccess(admin, NEUROLOGY)).isTrue();
        assertThat(guard.buildFilter(admin).isUnrestricted()).isTrue();
        assertThat(guard.authorize(admin, Permission.QUEUE_MANAGE, (DepartmentScoped) null).allowed()).isTrue();
    }

    @Test
    @DisplayName("a user without department assignments gets a filter that matches nothing")
    void noDepartmentsMatchesNothing() {
        SessionContext session = session(Set.of(), Set.of(Permission.APPOINTMENT_VIEW));

        DepartmentFilter filter = guard.buildFilter(session);

        assertThat(filter.matchesNothing()).isTrue();
        assertThat(filter.matches(CARDIOLOGY)).isFalse();
    }

    @Test
    @DisplayName("explicitly requesting an unassigned department is denied")
    void requestedDepartmentOutsideAssignment() {
        SessionContext cardiologist = session(Set.of(CARDIOLOGY), Set.of(Permission.APPOINTMENT_VIEW));

        assertThatThrownBy(() -> guard.buildFilter(cardiologist, List.of(NEUROLOGY)))
                .isInstanceOf(ProblemException.class)
                .extracting("code")
                .isEqualTo("DEPT_ACCESS_DENIED");

        DepartmentFilter narrowed = guard.buildFilter(cardiologist, List.of(CARDIOLOGY));
        assertThat(narrowed.departmentIds()).containsExactly(CARDIOLOGY);
    }

    @Test
    @DisplayName("permission is checked before tenant and department")
    void permissionFirst() {
        SessionContext session = session(Set.of(CARDIOLOGY), Set.of(Permission.APPOINTMENT_VIEW));
        DepartmentScoped foreign = record(OTHER_TENANT, NEUROLOGY);

        AccessDecision decision = guard.authorize(session, Permission.APPOINTMENT_EDIT, foreign);

        assertThat(decision.allowed()).isFalse();
        assertThat(decision.reason().name()).isEqualTo("PERMISSION_DENIED");
    }

    @Test
    @DisplayName("tenant mismatch is reported before department mismatch")
    void tenantBeforeDepartment() {
        SessionContext session = session(Set.of(CARDIOLOGY), Set.of(Permission.APPOINTMENT_VIEW));

        assertThat(guard.authorize(session, Permission.APPOINTMENT_VIEW, record(OTHER_TENANT, NEUROLOGY)).reason().name())
                .isEqualTo("CROSS_TENANT_ACCESS");
        assertThat(guard.authorize(session, Permission.APPOINTMENT_VIEW, record(TENANT, NEUROLOGY)).reason().name())
                .isEqualTo("DEPT_ACCESS_DENIED");
        assertThat(guard.authorize(session, Permission.APPOINTMENT_VIEW, record(TENANT, CARDIOLOGY)).allowed())
                .isTrue();
    }

    @Test
    @DisplayName("super admin still cannot cross tenants")
    void superAdminBoundToTenant() {
        SessionContext admin = new SessionContext(TENANT, USER, Set.of(), Set.of(), true);

        assertThatThrownBy(() -> guard.verifyRecordAccess(admin, record(OTHER_TENANT, CARDIOLOGY)))
                .isInstanceOf(ProblemException.class)
                .extracting("code")
                .isEqualTo("CROSS_TENANT_ACCESS");
    }

    @Test
    void requireByDepartmentId() {
        SessionContext session = session(Set.of(CARDIOLOGY), Set.of(Permission.DOCTOR_EDIT));

        guard.require(session, Permission.DOCTOR_EDIT, CARDIOLOGY);
        assertThatThrownBy(() -> guard.require(session, Permission.DOCTOR_EDIT, NEUROLOGY))
                .isInstanceOf(ProblemException.class)
                .extracting("code")
                .isEqualTo("DEPT_ACCESS_DENIED");
        assertThatThrownBy(() -> guard.require(session, Permission.QUEUE_MANAGE))
                .isInstanceOf(ProblemException.class)
                .extracting("code")
                .isEqualTo("PERMISSION_DENIED");
    }

    private static SessionContext session(Set<UUID> departments, Set<Permission> permissions) {
        return new SessionContext(TENANT, USER, departments, permissions, false);
    }

    private static DepartmentScoped record(UUID tenantId, UUID departmentId) {
        return new DepartmentScoped() {
            @Override
            public UUID getTenantId() {
                return tenantId;
            }

            @Override
            public UUID getDepartmentId() {
                return departmentId;
            }
        };
    }
}
