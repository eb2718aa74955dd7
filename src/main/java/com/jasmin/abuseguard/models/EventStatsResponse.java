package com.jasmin.abuseguard.models;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.Map;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class EventStatsResponse {
    private long totalEvents;
    private long totalBlocks;
    private LocalDateTime from;
    private LocalDateTime to;
    private Map<String, Long> eventsByType;
    private Map<String, Long> blocksByReason;
}
