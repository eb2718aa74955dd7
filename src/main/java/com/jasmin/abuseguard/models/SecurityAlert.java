package com.jasmin.abuseguard.models;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class SecurityAlert {
    private String type;
    private Severity severity;
    private String subject;
    private String details;
    private Instant timestamp;
}
