package com.clinicflow.backend.modules.appointment.application;

import java.time.LocalDate;
import java.util.UUID;

import com.clinicflow.backend.modules.appointment.domain.DailyTokenCounter;
import com.clinicflow.backend.modules.appointment.infrastructure.persistence.DailyTokenCounterRepository;

import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Hands out per-department daily token numbers. The counter row stays locked until the calling
 * transaction ends, so tokens are gap-free for committed bookings and never repeat.
 */
@Component
public class DailyTokenAllocator {

    private final DailyTokenCounterRepository counterRepository;

    public DailyTokenAllocator(DailyTokenCounterRepository counterRepository) {
        this.counterRepository = counterRepository;
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public int next(UUID tenantId, UUID departmentId, LocalDate date) {
        counterRepository.insertIfAbsent(tenantId, departmentId, date);
        DailyTokenCounter counter = counterRepository.findForUpdate(tenantId, departmentId, date)
                .orElseThrow(() -> new IllegalStateException(
                        "Token counter missing for department " + departmentId + " on " + date));
        return counter.next();
    }
}
