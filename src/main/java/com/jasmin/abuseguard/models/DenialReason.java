package com.jasmin.abuseguard.models;

public enum DenialReason {
    RATE_LIMITED,
    PENALIZED,
    BLOCKED,
    STORAGE_UNAVAILABLE
}
