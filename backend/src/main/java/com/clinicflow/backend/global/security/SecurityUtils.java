package com.clinicflow.backend.global.security;

import java.util.UUID;

import com.clinicflow.backend.global.error.ErrorCode;
import com.clinicflow.backend.global.error.ProblemException;
import com.clinicflow.backend.modules.access.domain.SessionContext;

import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

public final class SecurityUtils {

    private SecurityUtils() {
    }

    public static JwtAuthenticationPrincipal getCurrentPrincipal() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication == null || !(authentication.getPrincipal() instanceof JwtAuthenticationPrincipal principal)) {
            throw new ProblemException(ErrorCode.UNAUTHORIZED, "No authenticated session");
        }
        return principal;
    }

    public static SessionContext getCurrentSession() {
        return getCurrentPrincipal().toSessionContext();
    }

    public static UUID getCurrentUserId() {
        return getCurrentPrincipal().userId();
    }
}
