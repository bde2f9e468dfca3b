package com.clinicflow.backend.modules.access.domain;

import java.util.UUID;

/**
 * A record that belongs to exactly one tenant and one department.
 */
public interface DepartmentScoped {

    UUID getTenantId();

    UUID getDepartmentId();
}
