package com.jasmin.abuseguard.models;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class PenaltyRecord {
    private long violationCount;
    private Instant penaltyUntil;

    public boolean isActiveAt(Instant now) {
        return penaltyUntil != null && penaltyUntil.isAfter(now);
    }
}
