package com.clinicflow.backend.modules.availability.domain;

public enum SlotUnavailableReason {
    BOOKED,
    PRACTITIONER_UNAVAILABLE,
    DEPARTMENT_MISMATCH
}
