package com.clinicflow.backend.modules.access.domain;

import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Who is acting: tenant, user, assigned departments and granted permissions.
 * Built per request from the verified session token and never cached.
 */
public record SessionContext(
        UUID tenantId,
        UUID userId,
        Set<UUID> departmentIds,
        Set<Permission> permissions,
        boolean superAdmin
) {

    public SessionContext {
        Objects.requireNonNull(tenantId, "tenantId must not be null");
        Objects.requireNonNull(userId, "userId must not be null");
        departmentIds = departmentIds == null ? Set.of() : Set.copyOf(departmentIds);
        permissions = permissions == null ? Set.of() : Set.copyOf(permissions);
    }

    public boolean hasPermission(Permission permission) {
        return superAdmin || permissions.contains(permission);
    }
}
