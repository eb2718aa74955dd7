package com.jasmin.abuseguard.models;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class BlockStatus {
    private boolean blocked;
    private Instant until;
    private BlockReason reason;

    public static BlockStatus notBlocked() {
        return new BlockStatus(false, null, null);
    }

    public static BlockStatus of(BlockRecord record) {
        return new BlockStatus(true, record.getBlockedUntil(), record.getReason());
    }
}
