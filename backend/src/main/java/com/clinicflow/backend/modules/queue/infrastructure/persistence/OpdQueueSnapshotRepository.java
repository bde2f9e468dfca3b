package com.clinicflow.backend.modules.queue.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.clinicflow.backend.modules.queue.domain.OpdQueueSnapshot;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface OpdQueueSnapshotRepository extends JpaRepository<OpdQueueSnapshot, UUID>,
        OpdQueueSnapshotRepositoryCustom {

    Optional<OpdQueueSnapshot> findByVisitId(UUID visitId);

    @Modifying
    @Query("delete from OpdQueueSnapshot s where s.visitId = :visitId")
    int deleteByVisitId(@Param("visitId") UUID visitId);

    @Query("select s.visitId from OpdQueueSnapshot s where s.tenantId = :tenantId")
    List<UUID> findVisitIdsByTenantId(@Param("tenantId") UUID tenantId);

    @Query("select distinct s.tenantId from OpdQueueSnapshot s")
    List<UUID> findDistinctTenantIds();

    @Modifying
    @Query(value = """
            DELETE FROM opd_queue_snapshot s
             USING visit v
             WHERE s.visit_id = v.id
               AND s.tenant_id = :tenantId
               AND v.status IN ('COMPLETED', 'CANCELLED')
               AND COALESCE(v.end_time, v.updated_at) < :cutoff
            """, nativeQuery = true)
    int deleteFinishedBefore(@Param("tenantId") UUID tenantId, @Param("cutoff") OffsetDateTime cutoff);

    @Modifying
    @Query(value = """
            DELETE FROM opd_queue_snapshot s
             WHERE s.tenant_id = :tenantId
               AND s.synced_at < :cutoff
               AND NOT EXISTS (SELECT 1 FROM visit v WHERE v.id = s.visit_id)
            """, nativeQuery = true)
    int deleteOrphansBefore(@Param("tenantId") UUID tenantId, @Param("cutoff") OffsetDateTime cutoff);
}
