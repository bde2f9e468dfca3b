package com.clinicflow.backend.modules.appointment.domain;

public enum BookingSource {
    RECEPTION,
    PHONE,
    ONLINE,
    WALK_IN
}
