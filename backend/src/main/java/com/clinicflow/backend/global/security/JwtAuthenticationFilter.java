package com.clinicflow.backend.global.security;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import com.clinicflow.backend.modules.auth.application.JwtTokenService;
import com.clinicflow.backend.modules.auth.application.JwtTokenService.InvalidTokenException;
import com.clinicflow.backend.modules.auth.application.JwtTokenService.ParsedToken;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

@Component
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    private static final String BEARER_PREFIX = "Bearer ";
    private final JwtTokenService jwtTokenService;
    private final RestAuthenticationEntryPoint authenticationEntryPoint;

    public JwtAuthenticationFilter(JwtTokenService jwtTokenService, RestAuthenticationEntryPoint authenticationEntryPoint) {
        this.jwtTokenService = jwtTokenService;
        this.authenticationEntryPoint = authenticationEntryPoint;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String authorization = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (authorization != null && authorization.startsWith(BEARER_PREFIX)) {
            String token = authorization.substring(BEARER_PREFIX.length());
            ParsedToken parsed;
            try {
                parsed = jwtTokenService.parseAccessToken(token);
            } catch (InvalidTokenException ex) {
                SecurityContextHolder.clearContext();
                authenticationEntryPoint.commence(request, response,
                        new BadCredentialsException("INVALID_ACCESS_TOKEN", ex));
                return;
            }

            List<SimpleGrantedAuthority> authorities = new ArrayList<>();
            parsed.permissions().forEach(permission ->
                    authorities.add(new SimpleGrantedAuthority("PERM_" + permission.name())));
            if (parsed.superAdmin()) {
                authorities.add(new SimpleGrantedAuthority("ROLE_SUPER_ADMIN"));
            }

            JwtAuthenticationPrincipal principal = new JwtAuthenticationPrincipal(
                    parsed.userId(),
                    parsed.tenantId(),
                    parsed.departmentIds(),
                    parsed.permissions(),
                    parsed.superAdmin()
            );

            UsernamePasswordAuthenticationToken authentication =
                    new UsernamePasswordAuthenticationToken(principal, token, authorities);
            authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
            SecurityContextHolder.getContext().setAuthentication(authentication);
        }

        filterChain.doFilter(request, response);
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        if (request.getMethod().equalsIgnoreCase("OPTIONS")) {
            return true;
        }
        String path = request.getServletPath();
        return path.startsWith("/actuator/health") || path.startsWith("/v3/api-docs") || path.startsWith("/swagger-ui");
    }
}
