package com.clinicflow.backend.global.error;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;

import org.springframework.http.HttpStatus;

@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ProblemResponse(
        String type,
        String title,
        int status,
        String detail,
        String instance,
        String code,
        Map<String, Object> properties
) {

    private static final String DEFAULT_TYPE_PREFIX = "https://clinicflow.app/errors/";

    public static ProblemResponse of(HttpStatus httpStatus, String code, String detail, String instance) {
        return of(httpStatus, code, detail, instance, Map.of());
    }

    public static ProblemResponse of(HttpStatus httpStatus, String code, String detail, String instance,
                                     Map<String, Object> properties) {
        String safeCode = (code != null && !code.isBlank()) ? code : httpStatus.name();
        String normalized = safeCode.toLowerCase().replaceAll("[^a-z0-9\\-_.]+", "-");
        String safeDetail = (detail != null && !detail.isBlank()) ? detail : httpStatus.getReasonPhrase();
        String type = DEFAULT_TYPE_PREFIX + normalized;
        return new ProblemResponse(type, httpStatus.getReasonPhrase(), httpStatus.value(), safeDetail, instance,
                safeCode, properties == null ? Map.of() : properties);
    }
}
