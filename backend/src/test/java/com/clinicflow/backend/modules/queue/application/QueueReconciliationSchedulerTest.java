package com.clinicflow.backend.modules.queue.application;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.List;
import java.util.UUID;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class QueueReconciliationSchedulerTest {

    @Mock
    private QueueReconciliationService reconciliationService;

    @Test
    void failingTenantDoesNotStopTheRun() {
        UUID broken = UUID.randomUUID();
        UUID healthy = UUID.randomUUID();
        Duration retention = Duration.ofHours(24);
        when(reconciliationService.tenantsToReconcile()).thenReturn(List.of(broken, healthy));
        when(reconciliationService.rebuildForTenant(broken)).thenThrow(new IllegalStateException("boom"));

        new QueueReconciliationScheduler(reconciliationService, retention).reconcile();

        verify(reconciliationService).rebuildForTenant(healthy);
        verify(reconciliationService).cleanup(healthy, retention);
    }
}
