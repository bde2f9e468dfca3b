package com.clinicflow.backend.modules.access.application;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.UUID;

import com.clinicflow.backend.global.error.ErrorCode;
import com.clinicflow.backend.global.error.ProblemException;
import com.clinicflow.backend.modules.access.domain.AccessDecision;
import com.clinicflow.backend.modules.access.domain.DepartmentFilter;
import com.clinicflow.backend.modules.access.domain.DepartmentScoped;
import com.clinicflow.backend.modules.access.domain.Permission;
import com.clinicflow.backend.modules.access.domain.SessionContext;

import org.springframework.stereotype.Component;

/**
 * Tenant and department scoping for every read and write. Order of checks is fixed:
 * permission, then tenant, then department.
 */
@Component
public class AccessGuard {

    public boolean verifyDepartmentAccess(SessionContext session, UUID departmentId) {
        if (session.superAdmin()) {
            return true;
        }
        return departmentId != null && session.departmentIds().contains(departmentId);
    }

    public DepartmentFilter buildFilter(SessionContext session) {
        if (session.superAdmin()) {
            return DepartmentFilter.unrestricted();
        }
        return DepartmentFilter.of(session.departmentIds());
    }

    /**
     * Narrows the listing to explicitly requested departments. Asking for a department the
     * session is not assigned to is an error rather than a silently empty result.
     */
    public DepartmentFilter buildFilter(SessionContext session, Collection<UUID> requestedDepartmentIds) {
        if (requestedDepartmentIds == null || requestedDepartmentIds.isEmpty()) {
            return buildFilter(session);
        }
        Set<UUID> requested = new LinkedHashSet<>(requestedDepartmentIds);
        for (UUID departmentId : requested) {
            if (!verifyDepartmentAccess(session, departmentId)) {
                throw new ProblemException(ErrorCode.DEPT_ACCESS_DENIED,
                        "No access to department " + departmentId);
            }
        }
        return DepartmentFilter.of(requested);
    }

    public void verifyRecordAccess(SessionContext session, DepartmentScoped record) {
        checkRecord(session, record).orThrow();
    }

    public AccessDecision authorize(SessionContext session, Permission permission, DepartmentScoped record) {
        if (!session.hasPermission(permission)) {
            return AccessDecision.deny(ErrorCode.PERMISSION_DENIED, "Missing permission " + permission.name());
        }
        if (record == null) {
            return AccessDecision.allow();
        }
        return checkRecord(session, record);
    }

    public AccessDecision authorize(SessionContext session, Permission permission, UUID departmentId) {
        if (!session.hasPermission(permission)) {
            return AccessDecision.deny(ErrorCode.PERMISSION_DENIED, "Missing permission " + permission.name());
        }
        if (departmentId != null && !verifyDepartmentAccess(session, departmentId)) {
            return AccessDecision.deny(ErrorCode.DEPT_ACCESS_DENIED, "No access to department " + departmentId);
        }
        return AccessDecision.allow();
    }

    public void require(SessionContext session, Permission permission) {
        authorize(session, permission, (DepartmentScoped) null).orThrow();
    }

    public void require(SessionContext session, Permission permission, DepartmentScoped record) {
        authorize(session, permission, record).orThrow();
    }

    public void require(SessionContext session, Permission permission, UUID departmentId) {
        authorize(session, permission, departmentId).orThrow();
    }

    private AccessDecision checkRecord(SessionContext session, DepartmentScoped record) {
        if (!session.tenantId().equals(record.getTenantId())) {
            return AccessDecision.deny(ErrorCode.CROSS_TENANT_ACCESS, "Record belongs to another tenant");
        }
        if (!verifyDepartmentAccess(session, record.getDepartmentId())) {
            return AccessDecision.deny(ErrorCode.DEPT_ACCESS_DENIED,
                    "No access to department " + record.getDepartmentId());
        }
        return AccessDecision.allow();
    }
}
