package com.clinicflow.backend.modules.access.domain;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Department restriction applied to list queries. A normal user without any department
 * assignment gets {@link #none()}, which matches no rows at all.
 */
public final class DepartmentFilter {

    private static final DepartmentFilter UNRESTRICTED = new DepartmentFilter(null);
    private static final DepartmentFilter NONE = new DepartmentFilter(Set.of());

    private final Set<UUID> departmentIds;

    private DepartmentFilter(Set<UUID> departmentIds) {
        this.departmentIds = departmentIds;
    }

    public static DepartmentFilter unrestricted() {
        return UNRESTRICTED;
    }

    public static DepartmentFilter none() {
        return NONE;
    }

    public static DepartmentFilter of(Set<UUID> departmentIds) {
        if (departmentIds == null || departmentIds.isEmpty()) {
            return NONE;
        }
        return new DepartmentFilter(Set.copyOf(departmentIds));
    }

    public boolean isUnrestricted() {
        return departmentIds == null;
    }

    public boolean matchesNothing() {
        return departmentIds != null && departmentIds.isEmpty();
    }

    public Set<UUID> departmentIds() {
        return departmentIds == null ? Set.of() : departmentIds;
    }

    public boolean matches(UUID departmentId) {
        return isUnrestricted() || departmentIds.contains(departmentId);
    }

    /**
     * Appends the SQL restriction for {@code column} to a native where-clause list.
     */
    public void appendTo(List<String> whereClauses, Map<String, Object> params, String column, String paramName) {
        if (isUnrestricted()) {
            return;
        }
        if (matchesNothing()) {
            whereClauses.add("1 = 0");
            return;
        }
        whereClauses.add(column + " in (:" + paramName + ")");
        params.put(paramName, List.copyOf(departmentIds));
    }

    @Override
    public String toString() {
        if (isUnrestricted()) {
            return "DepartmentFilter[unrestricted]";
        }
        return "DepartmentFilter" + departmentIds;
    }
}
