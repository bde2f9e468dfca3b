package com.clinicflow.backend.global.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Background jobs (queue reconciliation) only run when {@code app.scheduling.enabled} is on.
 * Integration tests switch it off and call the jobs directly.
 */
@Configuration(proxyBeanMethods = false)
@ConditionalOnProperty(value = "app.scheduling.enabled", havingValue = "true", matchIfMissing = true)
@EnableScheduling
public class SchedulingConfig {
}
