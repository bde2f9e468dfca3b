package com.clinicflow.backend.global.config;

import java.util.Optional;
import java.util.UUID;

import com.clinicflow.backend.global.security.JwtAuthenticationPrincipal;

import org.springframework.data.domain.AuditorAware;
import org.springframework.lang.NonNull;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

/**
 * Resolves the staff user id behind the current request for {@code created_by}/{@code updated_by}.
 * Scheduler threads and the queue synchronizer run without a principal and record nothing.
 */
public class ClinicAuditorAware implements AuditorAware<UUID> {

    @Override
    @NonNull
    public Optional<UUID> getCurrentAuditor() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication == null || !authentication.isAuthenticated()) {
            return Optional.empty();
        }
        if (authentication.getPrincipal() instanceof JwtAuthenticationPrincipal principal) {
            return Optional.ofNullable(principal.userId());
        }
        return Optional.empty();
    }
}
