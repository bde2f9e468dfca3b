package com.clinicflow.backend.modules.access.domain;

import com.clinicflow.backend.global.error.ErrorCode;
import com.clinicflow.backend.global.error.ProblemException;

public record AccessDecision(boolean allowed, ErrorCode reason, String detail) {

    private static final AccessDecision ALLOW = new AccessDecision(true, null, null);

    public static AccessDecision allow() {
        return ALLOW;
    }

    public static AccessDecision deny(ErrorCode reason, String detail) {
        return new AccessDecision(false, reason, detail);
    }

    public void orThrow() {
        if (!allowed) {
            throw new ProblemException(reason, detail);
        }
    }
}
