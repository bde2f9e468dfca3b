package com.clinicflow.backend.modules.visit.infrastructure.persistence;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.clinicflow.backend.modules.visit.domain.Visit;
import com.clinicflow.backend.modules.visit.domain.VisitScope;
import com.clinicflow.backend.modules.visit.domain.VisitStatus;
import com.clinicflow.backend.modules.visit.domain.VisitType;

import jakarta.persistence.LockModeType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface VisitRepository extends JpaRepository<Visit, UUID> {

    Optional<Visit> findByIdAndTenantId(UUID id, UUID tenantId);

    @Query("""
            select new com.clinicflow.backend.modules.visit.domain.VisitScope(
                   v.id, v.tenantId, v.departmentId, v.practitionerId, v.appointmentId)
              from Visit v
             where v.id = :id
            """)
    Optional<VisitScope> findScopeById(@Param("id") UUID id);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select v from Visit v where v.id = :id")
    Optional<Visit> findByIdForUpdate(@Param("id") UUID id);

    @Query("""
            select v from Visit v
             where v.practitionerId = :practitionerId
               and v.status = com.clinicflow.backend.modules.visit.domain.VisitStatus.IN_PROGRESS
               and v.id <> :excludeVisitId
             order by v.startTime asc
            """)
    List<Visit> findOtherInProgress(@Param("practitionerId") UUID practitionerId,
                                    @Param("excludeVisitId") UUID excludeVisitId);

    @Query("""
            select v.id from Visit v
             where v.tenantId = :tenantId
               and v.visitType = :visitType
               and v.status in :statuses
            """)
    List<UUID> findIdsByTenantAndTypeAndStatusIn(@Param("tenantId") UUID tenantId,
                                                 @Param("visitType") VisitType visitType,
                                                 @Param("statuses") Collection<VisitStatus> statuses);

    @Query("""
            select distinct v.tenantId from Visit v
             where v.visitType = :visitType
               and v.status in :statuses
            """)
    List<UUID> findTenantIdsWithVisits(@Param("visitType") VisitType visitType,
                                       @Param("statuses") Collection<VisitStatus> statuses);
}
