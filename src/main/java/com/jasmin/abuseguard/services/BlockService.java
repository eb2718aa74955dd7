package com.jasmin.abuseguard.services;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jasmin.abuseguard.models.BlockReason;
import com.jasmin.abuseguard.models.BlockRecord;
import com.jasmin.abuseguard.models.BlockScope;
import com.jasmin.abuseguard.models.BlockStatus;
import com.jasmin.abuseguard.store.SecurityStore;
import com.jasmin.abuseguard.store.StorageUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Hard, reason-tagged blocks on a network origin or account. A block lives until its TTL runs
 * out; automated blocks never replace or shorten one that is already active.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BlockService {

    private final SecurityStore store;
    private final KeyManager keys;
    private final ObjectMapper objectMapper;
    private final SecurityStatsService stats;
    private final Clock clock;

    public Optional<BlockRecord> activeBlock(String identifier) {
        Instant now = clock.instant();
        return store.get(keys.block(identifier))
                .map(this::read)
                .filter(record -> record.isActiveAt(now));
    }

    public BlockStatus status(String identifier) {
        return activeBlock(identifier).map(BlockStatus::of).orElseGet(BlockStatus::notBlocked);
    }

    /**
     * Creates a block unless one is already active for the identifier.
     *
     * @return the new record, or empty when an existing block was left in place
     */
    public Optional<BlockRecord> block(String identifier, BlockScope scope, BlockReason reason, Duration duration) {
        BlockRecord record = newRecord(identifier, scope, reason, duration);
        if (!store.setIfAbsent(keys.block(identifier), write(record), duration)) {
            return Optional.empty();
        }
        log.info("Blocked identifier={} scope={} reason={} until={}",
                identifier, scope, reason.getId(), record.getBlockedUntil());
        stats.recordBlock(reason, record.getCreatedAt());
        return Optional.of(record);
    }

    /** Administrator block: replaces whatever block is in place. */
    public BlockRecord forceBlock(String identifier, BlockScope scope, Duration duration) {
        BlockRecord record = newRecord(identifier, scope, BlockReason.MANUAL, duration);
        store.set(keys.block(identifier), write(record), duration);
        log.info("Manually blocked identifier={} scope={} until={}", identifier, scope, record.getBlockedUntil());
        stats.recordBlock(BlockReason.MANUAL, record.getCreatedAt());
        return record;
    }

    private BlockRecord newRecord(String identifier, BlockScope scope, BlockReason reason, Duration duration) {
        if (duration == null || duration.isNegative() || duration.isZero()) {
            throw new IllegalArgumentException("Block duration must be positive, got " + duration);
        }
        Instant now = clock.instant();
        return new BlockRecord(identifier, scope, reason, now, now.plus(duration));
    }

    private String write(BlockRecord record) {
        try {
            return objectMapper.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize block record for " + record.getIdentifier(), e);
        }
    }

    private BlockRecord read(String json) {
        try {
            return objectMapper.readValue(json, BlockRecord.class);
        } catch (JsonProcessingException e) {
            throw new StorageUnavailableException("Unreadable block record", e);
        }
    }
}
