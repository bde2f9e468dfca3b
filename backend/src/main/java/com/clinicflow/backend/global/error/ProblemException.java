package com.clinicflow.backend.global.error;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

public class ProblemException extends ResponseStatusException {

    private static final String DEFAULT_TYPE_PREFIX = "urn:problem:clinicflow:";

    private final String code;
    private final String detail;
    private final String type;
    private final Map<String, Object> properties;

    public ProblemException(ErrorCode errorCode, String detail) {
        this(errorCode.status(), errorCode.name(), detail, null, Map.of());
    }

    public ProblemException(ErrorCode errorCode, String detail, Map<String, Object> properties) {
        this(errorCode.status(), errorCode.name(), detail, null, properties);
    }

    public ProblemException(HttpStatus status, String code) {
        this(status, code, null, null, Map.of());
    }

    public ProblemException(HttpStatus status, String code, String detail) {
        this(status, code, detail, null, Map.of());
    }

    public ProblemException(HttpStatus status, String code, String detail, String typeOverride,
                            Map<String, Object> properties) {
        super(status, code);
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("ProblemException code must not be blank");
        }
        this.code = code;
        this.detail = (detail != null && !detail.isBlank()) ? detail : code;
        if (typeOverride != null && !typeOverride.isBlank()) {
            this.type = typeOverride;
        } else {
            String normalized = code.toLowerCase().replaceAll("[^a-z0-9\\-_.:]+", "-");
            this.type = DEFAULT_TYPE_PREFIX + normalized;
        }
        this.properties = properties == null || properties.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    }

    public String getCode() {
        return code;
    }

    public String getDetailMessage() {
        return detail;
    }

    public String getProblemType() {
        return type;
    }

    public Map<String, Object> getProperties() {
        return properties;
    }
}
