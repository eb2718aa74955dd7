package com.jasmin.abuseguard.services;

import com.jasmin.abuseguard.detectors.DetectorUtils;
import com.jasmin.abuseguard.models.BlockReason;
import com.jasmin.abuseguard.models.EventStatsResponse;
import com.jasmin.abuseguard.models.EventType;
import com.jasmin.abuseguard.models.SecurityEvent;
import com.jasmin.abuseguard.store.SecurityStore;
import com.jasmin.abuseguard.store.StorageUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

@Slf4j
@Service
@RequiredArgsConstructor
public class SecurityStatsService {
    private final SecurityStore store;
    private final KeyManager keys;
    private final StatsProperties cfg;

    public void recordEvent(SecurityEvent event) {
        increment(keys.eventsKey(event.getType().name(), DetectorUtils.minuteKey(event.getTimestamp())));
    }

    public void recordBlock(BlockReason reason, Instant at) {
        increment(keys.blocksKey(reason.name(), DetectorUtils.minuteKey(at)));
    }

    public EventStatsResponse getEventStats(LocalDateTime from, LocalDateTime to) {
        if (to.isBefore(from)) {
            throw new IllegalArgumentException("'to' must not be before 'from'");
        }
        LocalDateTime start = from.truncatedTo(ChronoUnit.MINUTES);
        LocalDateTime end = to.truncatedTo(ChronoUnit.MINUTES);
        if (ChronoUnit.MINUTES.between(start, end) >= cfg.getMaxRangeMinutes()) {
            throw new IllegalArgumentException("Range exceeds " + cfg.getMaxRangeMinutes() + " minutes");
        }

        List<String> minuteKeys = new ArrayList<>();
        for (LocalDateTime dt = start; !dt.isAfter(end); dt = dt.plusMinutes(1)) {
            minuteKeys.add(DetectorUtils.minuteKey(dt));
        }

        Map<String, Long> eventsByType = new LinkedHashMap<>();
        for (EventType type : EventType.values()) {
            List<String> typeKeys = minuteKeys.stream().map(m -> keys.eventsKey(type.name(), m)).toList();
            eventsByType.put(type.name(), sum(store.multiGet(typeKeys)));
        }

        Map<String, Long> blocksByReason = new LinkedHashMap<>();
        for (BlockReason reason : BlockReason.values()) {
            List<String> reasonKeys = minuteKeys.stream().map(m -> keys.blocksKey(reason.name(), m)).toList();
            blocksByReason.put(reason.getId(), sum(store.multiGet(reasonKeys)));
        }

        long totalEvents = eventsByType.values().stream().mapToLong(Long::longValue).sum();
        long totalBlocks = blocksByReason.values().stream().mapToLong(Long::longValue).sum();
        return new EventStatsResponse(totalEvents, totalBlocks, start, end, eventsByType, blocksByReason);
    }

    public EventStatsResponse getEventStatsForLastMinutes(int minutes, Instant now) {
        LocalDateTime to = LocalDateTime.ofInstant(now, ZoneOffset.UTC);
        return getEventStats(to.minusMinutes(Math.max(0, minutes - 1)), to);
    }

    private void increment(String key) {
        if (!cfg.isEnabled()) {
            return;
        }
        try {
            store.incrementAndExpire(key, cfg.getRetention());
        } catch (StorageUnavailableException e) {
            log.warn("Could not update statistics counter {}", key, e);
        }
    }

    private static long sum(List<String> values) {
        return values.stream()
                .filter(Objects::nonNull)
                .mapToLong(Long::parseLong)
                .sum();
    }
}
