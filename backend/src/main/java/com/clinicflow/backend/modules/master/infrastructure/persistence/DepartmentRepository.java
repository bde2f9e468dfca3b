package com.clinicflow.backend.modules.master.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.clinicflow.backend.modules.master.domain.Department;

import org.springframework.data.jpa.repository.JpaRepository;

public interface DepartmentRepository extends JpaRepository<Department, UUID> {

    Optional<Department> findByIdAndTenantId(UUID id, UUID tenantId);
}
