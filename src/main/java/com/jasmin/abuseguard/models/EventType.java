package com.jasmin.abuseguard.models;

public enum EventType {
    RATE_LIMIT_EXCEEDED,
    PENALTY_APPLIED,
    LOGIN_FAILURE,
    OPERATION_FAILED;

    /** Failure events count towards the repeated-failure check. */
    public boolean isFailure() {
        return this == LOGIN_FAILURE || this == OPERATION_FAILED;
    }
}
