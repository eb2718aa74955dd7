package com.jasmin.abuseguard.models;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public enum BlockReason {
    EXCESSIVE_FAILED_LOGINS("excessive_failed_logins"),
    BURST_DETECTED("burst_detected"),
    REPEATED_FAILURES("repeated_failures"),
    MANUAL("manual");

    @JsonValue
    final String id;
}
