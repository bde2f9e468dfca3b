package com.clinicflow.backend.modules.appointment.domain;

import java.io.Serializable;
import java.time.LocalDate;
import java.util.Objects;
import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;

@Embeddable
public class DailyTokenCounterId implements Serializable {

    @Column(name = "tenant_id", nullable = false, columnDefinition = "uuid")
    private UUID tenantId;

    @Column(name = "department_id", nullable = false, columnDefinition = "uuid")
    private UUID departmentId;

    @Column(name = "token_date", nullable = false)
    private LocalDate tokenDate;

    protected DailyTokenCounterId() {
    }

    public DailyTokenCounterId(UUID tenantId, UUID departmentId, LocalDate tokenDate) {
        this.tenantId = tenantId;
        this.departmentId = departmentId;
        this.tokenDate = tokenDate;
    }

    public UUID getTenantId() {
        return tenantId;
    }

    public UUID getDepartmentId() {
        return departmentId;
    }

    public LocalDate getTokenDate() {
        return tokenDate;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DailyTokenCounterId that)) {
            return false;
        }
        return Objects.equals(tenantId, that.tenantId)
                && Objects.equals(departmentId, that.departmentId)
                && Objects.equals(tokenDate, that.tokenDate);
    }

    @Override
    public int hashCode() {
        return Objects.hash(tenantId, departmentId, tokenDate);
    }
}
