package com.clinicflow.backend.modules.auth.application;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.Date;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

import com.clinicflow.backend.modules.access.domain.Permission;
import com.clinicflow.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Verifies session tokens minted by the platform's identity service and extracts the
 * tenant, department and permission claims this service scopes every request by.
 */
@Service
public class JwtTokenService {

    public static final String CLAIM_TENANT_ID = "tenantId";
    public static final String CLAIM_DEPARTMENT_IDS = "departmentIds";
    public static final String CLAIM_PERMISSIONS = "permissions";
    public static final String CLAIM_SUPER_ADMIN = "superAdmin";

    private static final Logger log = LoggerFactory.getLogger(JwtTokenService.class);

    private final JwtTokenProvider tokenProvider;
    private final Clock clock;

    public JwtTokenService(JwtTokenProvider tokenProvider, Clock clock) {
        this.tokenProvider = tokenProvider;
        this.clock = clock;
    }

    public ParsedToken parseAccessToken(String token) {
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(tokenProvider.getSecretKey())
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();

            UUID userId = UUID.fromString(claims.getSubject());
            String tenantClaim = claims.get(CLAIM_TENANT_ID, String.class);
            if (tenantClaim == null) {
                throw new InvalidTokenException("Token has no tenant", null);
            }
            UUID tenantId = UUID.fromString(tenantClaim);
            Set<UUID> departmentIds = new LinkedHashSet<>();
            for (String value : stringList(claims.get(CLAIM_DEPARTMENT_IDS, List.class))) {
                departmentIds.add(UUID.fromString(value));
            }
            Set<Permission> permissions = EnumSet.noneOf(Permission.class);
            for (String value : stringList(claims.get(CLAIM_PERMISSIONS, List.class))) {
                Permission.fromCode(value).ifPresentOrElse(
                        permissions::add,
                        () -> log.debug("Ignoring unknown permission claim {}", value)
                );
            }
            boolean superAdmin = Boolean.TRUE.equals(claims.get(CLAIM_SUPER_ADMIN, Boolean.class));
            Instant issuedAt = claims.getIssuedAt() != null ? claims.getIssuedAt().toInstant() : clock.instant();
            Instant expiresAt = claims.getExpiration() != null ? claims.getExpiration().toInstant() : issuedAt;

            return new ParsedToken(
                    userId,
                    tenantId,
                    Set.copyOf(departmentIds),
                    Set.copyOf(permissions),
                    superAdmin,
                    OffsetDateTime.ofInstant(issuedAt, clock.getZone()),
                    OffsetDateTime.ofInstant(expiresAt, clock.getZone())
            );
        } catch (JwtException | IllegalArgumentException e) {
            throw new InvalidTokenException("Invalid access token", e);
        }
    }

    private static List<String> stringList(List<?> raw) {
        if (raw == null) {
            return List.of();
        }
        return raw.stream()
                .filter(Objects::nonNull)
                .map(Object::toString)
                .toList();
    }

    public record ParsedToken(
            UUID userId,
            UUID tenantId,
            Set<UUID> departmentIds,
            Set<Permission> permissions,
            boolean superAdmin,
            OffsetDateTime issuedAt,
            OffsetDateTime expiresAt
    ) {
    }

    public static class InvalidTokenException extends RuntimeException {
        public InvalidTokenException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
