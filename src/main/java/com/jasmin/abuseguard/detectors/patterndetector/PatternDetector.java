package com.jasmin.abuseguard.detectors.patterndetector;

import com.jasmin.abuseguard.constants.Constants;
import com.jasmin.abuseguard.models.BlockReason;
import com.jasmin.abuseguard.models.BlockScope;
import com.jasmin.abuseguard.models.SecurityEvent;
import com.jasmin.abuseguard.models.Severity;
import com.jasmin.abuseguard.models.SubjectType;
import com.jasmin.abuseguard.services.BlockService;
import com.jasmin.abuseguard.services.SecurityAlertService;
import com.jasmin.abuseguard.services.SecurityEventListener;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;

/**
 * Watches the security event stream for abuse that stays under each per-action limit but adds up
 * across actions:
 * <ul>
 *     <li><b>burst</b>: too many events of any kind for one subject in a short window</li>
 *     <li><b>repeated failures</b>: too many failed operations or logins for one account</li>
 * </ul>
 * Either one blocks the subject and raises a critical alert. An existing block is never renewed
 * or duplicated, so a pattern that keeps going produces a single block and a single alert.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PatternDetector implements SecurityEventListener {

    private final PatternDetectorProperties cfg;
    private final SecurityEventBuffer buffer;
    private final BlockService blocks;
    private final SecurityAlertService alerts;
    private final Clock clock;

    @Override
    public void onEvent(SecurityEvent event) {
        observe(event);
    }

    public void observe(SecurityEvent event) {
        if (!cfg.isEnabled() || event.getSubject() == null || event.getTimestamp() == null) {
            return;
        }

        Instant now = clock.instant();
        List<SecurityEvent> recent = buffer.append(event, now);

        burstCheck(event, recent, now);
        repeatedFailureCheck(event, recent, now);
    }

    private void burstCheck(SecurityEvent event, List<SecurityEvent> recent, Instant now) {
        long count = countWithin(recent, now, cfg.getBurstWindow(), e -> true);
        if (count < cfg.getBurstThreshold()) {
            return;
        }

        String subject = event.getSubject();
        blocks.block(subject, scopeOf(event.getSubjectType()), BlockReason.BURST_DETECTED, cfg.getBurstBlockDuration())
                .ifPresent(record -> {
                    log.warn("Burst detected subject={} events={} windowSeconds={}",
                            subject, count, cfg.getBurstWindow().toSeconds());
                    alerts.raise(Constants.BURST_DETECTED, Severity.CRITICAL, subject,
                            String.format(Locale.ROOT, "%d security events within %d seconds, blocked until %s",
                                    count, cfg.getBurstWindow().toSeconds(), record.getBlockedUntil()));
                });
    }

    private void repeatedFailureCheck(SecurityEvent event, List<SecurityEvent> recent, Instant now) {
        if (event.getSubjectType() != SubjectType.ACCOUNT || !event.getType().isFailure()) {
            return;
        }

        long count = countWithin(recent, now, cfg.getRepeatedFailureWindow(),
                e -> e.getSubjectType() == SubjectType.ACCOUNT && e.getType().isFailure());
        if (count < cfg.getRepeatedFailureThreshold()) {
            return;
        }

        String account = event.getSubject();
        blocks.block(account, BlockScope.ACCOUNT, BlockReason.REPEATED_FAILURES, cfg.getRepeatedFailureBlockDuration())
                .ifPresent(record -> {
                    log.warn("Repeated failures account={} failures={} windowSeconds={}",
                            account, count, cfg.getRepeatedFailureWindow().toSeconds());
                    alerts.raise(Constants.REPEATED_FAILURES, Severity.CRITICAL, account,
                            String.format(Locale.ROOT, "%d failed operations within %d seconds, locked until %s",
                                    count, cfg.getRepeatedFailureWindow().toSeconds(), record.getBlockedUntil()));
                });
    }

    private static long countWithin(List<SecurityEvent> events, Instant now, Duration window,
                                     Predicate<SecurityEvent> filter) {
        Instant cutoff = now.minus(window);
        return events.stream()
                .filter(e -> !e.getTimestamp().isBefore(cutoff))
                .filter(filter)
                .count();
    }

    private static BlockScope scopeOf(SubjectType type) {
        if (type == null) {
            return BlockScope.IDENTIFIER;
        }
        return switch (type) {
            case NETWORK_ORIGIN -> BlockScope.NETWORK_ORIGIN;
            case ACCOUNT -> BlockScope.ACCOUNT;
            case IDENTIFIER -> BlockScope.IDENTIFIER;
        };
    }
}
