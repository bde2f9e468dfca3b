package com.clinicflow.backend.modules.master.infrastructure.persistence;

import java.util.UUID;

import com.clinicflow.backend.modules.master.domain.PractitionerDepartment;

import org.springframework.data.jpa.repository.JpaRepository;

public interface PractitionerDepartmentRepository extends JpaRepository<PractitionerDepartment, UUID> {

    boolean existsByPractitionerIdAndDepartmentIdAndActiveTrue(UUID practitionerId, UUID departmentId);
}
