package com.clinicflow.backend.modules.visit.domain;

public enum VisitType {
    OPD,
    IPD,
    EMERGENCY
}
