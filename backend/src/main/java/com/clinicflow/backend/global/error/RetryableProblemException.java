package com.clinicflow.backend.global.error;

public class RetryableProblemException extends ProblemException {

    private final long retryAfterSeconds;

    public RetryableProblemException(ErrorCode errorCode, String detail, long retryAfterSeconds) {
        super(errorCode, detail);
        if (retryAfterSeconds < 0) {
            throw new IllegalArgumentException("retryAfterSeconds must be >= 0");
        }
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public long getRetryAfterSeconds() {
        return retryAfterSeconds;
    }
}
