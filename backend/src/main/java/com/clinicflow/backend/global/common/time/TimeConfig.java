package com.clinicflow.backend.global.common.time;

import java.time.Clock;
import java.time.ZoneId;
import java.time.ZoneOffset;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Single UTC clock shared by booking, queue and scheduling code so tests can pin "now", plus the
 * clinic-local calendar derived from it.
 */
@Configuration
public class TimeConfig {

    @Bean
    public Clock utcClock() {
        return Clock.system(ZoneOffset.UTC);
    }

    @Bean
    public ClinicCalendar clinicCalendar(Clock clock, @Value("${app.clinic.zone-id:UTC}") String zoneId) {
        return new ClinicCalendar(clock, ZoneId.of(zoneId.trim()));
    }
}
