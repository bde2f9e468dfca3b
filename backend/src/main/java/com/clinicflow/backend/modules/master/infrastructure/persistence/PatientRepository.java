package com.clinicflow.backend.modules.master.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.clinicflow.backend.modules.master.domain.Patient;

import org.springframework.data.jpa.repository.JpaRepository;

public interface PatientRepository extends JpaRepository<Patient, UUID> {

    Optional<Patient> findByIdAndTenantId(UUID id, UUID tenantId);
}
