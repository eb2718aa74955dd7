package com.jasmin.abuseguard.controllers;

import com.jasmin.abuseguard.models.EventStatsResponse;
import com.jasmin.abuseguard.services.SecurityStatsService;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.LocalDateTime;

@RestController
@RequestMapping("/v1/stats")
@RequiredArgsConstructor
public class SecurityStatsController {

    private final SecurityStatsService statsService;
    private final Clock clock;

    @GetMapping
    public EventStatsResponse getStats(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime to,
            @RequestParam(defaultValue = "60") int lastMinutes
    ) {
        if (from == null || to == null) {
            return statsService.getEventStatsForLastMinutes(lastMinutes, clock.instant());
        }
        return statsService.getEventStats(from, to);
    }
}
