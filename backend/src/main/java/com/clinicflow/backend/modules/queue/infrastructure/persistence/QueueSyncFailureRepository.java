package com.clinicflow.backend.modules.queue.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.clinicflow.backend.modules.queue.domain.QueueSyncFailure;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface QueueSyncFailureRepository extends JpaRepository<QueueSyncFailure, UUID> {

    @Modifying
    @Query("update QueueSyncFailure f set f.resolvedAt = :now where f.visitId = :visitId and f.resolvedAt is null")
    int markResolved(@Param("visitId") UUID visitId, @Param("now") OffsetDateTime now);

    @Query("select distinct f.visitId from QueueSyncFailure f where f.tenantId = :tenantId and f.resolvedAt is null")
    List<UUID> findUnresolvedVisitIds(@Param("tenantId") UUID tenantId);

    @Query("select distinct f.tenantId from QueueSyncFailure f where f.resolvedAt is null and f.tenantId is not null")
    List<UUID> findTenantIdsWithUnresolved();

    long countByVisitIdAndResolvedAtIsNull(UUID visitId);
}
