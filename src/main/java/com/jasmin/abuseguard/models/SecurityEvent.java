package com.jasmin.abuseguard.models;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class SecurityEvent {
    EventType type;
    String subject;
    SubjectType subjectType;
    Severity severity;
    String action;
    Instant timestamp;
    String details;
}
