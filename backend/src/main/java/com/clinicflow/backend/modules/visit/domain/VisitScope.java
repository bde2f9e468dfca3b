package com.clinicflow.backend.modules.visit.domain;

import java.util.UUID;

import com.clinicflow.backend.modules.access.domain.DepartmentScoped;

/**
 * Ownership columns of a visit, read without loading the entity so the row can be locked later.
 */
public record VisitScope(
        UUID id,
        UUID tenantId,
        UUID departmentId,
        UUID practitionerId,
        UUID appointmentId
) implements DepartmentScoped {

    @Override
    public UUID getTenantId() {
        return tenantId;
    }

    @Override
    public UUID getDepartmentId() {
        return departmentId;
    }
}
