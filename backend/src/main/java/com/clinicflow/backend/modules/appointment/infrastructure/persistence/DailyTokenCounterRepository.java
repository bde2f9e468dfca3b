package com.clinicflow.backend.modules.appointment.infrastructure.persistence;

import java.time.LocalDate;
import java.util.Optional;
import java.util.UUID;

import com.clinicflow.backend.modules.appointment.domain.DailyTokenCounter;
import com.clinicflow.backend.modules.appointment.domain.DailyTokenCounterId;

import jakarta.persistence.LockModeType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface DailyTokenCounterRepository extends JpaRepository<DailyTokenCounter, DailyTokenCounterId> {

    @Modifying
    @Query(value = """
            INSERT INTO daily_token_counter (tenant_id, department_id, token_date, last_value, created_at, updated_at)
            VALUES (:tenantId, :departmentId, :tokenDate, 0, now(), now())
            ON CONFLICT (tenant_id, department_id, token_date) DO NOTHING
            """, nativeQuery = true)
    int insertIfAbsent(@Param("tenantId") UUID tenantId,
                       @Param("departmentId") UUID departmentId,
                       @Param("tokenDate") LocalDate tokenDate);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("""
            select c from DailyTokenCounter c
             where c.id.tenantId = :tenantId
               and c.id.departmentId = :departmentId
               and c.id.tokenDate = :tokenDate
            """)
    Optional<DailyTokenCounter> findForUpdate(@Param("tenantId") UUID tenantId,
                                              @Param("departmentId") UUID departmentId,
                                              @Param("tokenDate") LocalDate tokenDate);
}
