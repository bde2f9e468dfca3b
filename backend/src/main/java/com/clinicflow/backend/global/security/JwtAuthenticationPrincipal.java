package com.clinicflow.backend.global.security;

import java.util.Set;
import java.util.UUID;

import com.clinicflow.backend.modules.access.domain.Permission;
import com.clinicflow.backend.modules.access.domain.SessionContext;

public record JwtAuthenticationPrincipal(
        UUID userId,
        UUID tenantId,
        Set<UUID> departmentIds,
        Set<Permission> permissions,
        boolean superAdmin
) {

    public SessionContext toSessionContext() {
        return new SessionContext(tenantId, userId, departmentIds, permissions, superAdmin);
    }
}
