package com.jasmin.abuseguard.models;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class BlockRecord {
    private String identifier;
    private BlockScope scope;
    private BlockReason reason;
    private Instant createdAt;
    private Instant blockedUntil;

    public boolean isActiveAt(Instant now) {
        return blockedUntil != null && blockedUntil.isAfter(now);
    }
}
