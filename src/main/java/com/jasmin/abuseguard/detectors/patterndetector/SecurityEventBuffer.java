package com.jasmin.abuseguard.detectors.patterndetector;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.jasmin.abuseguard.models.SecurityEvent;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Short-lived, bounded memory of recent security events, one ring per subject. Events older than
 * the detector's longest window are dropped whenever their subject is touched, and the ring never
 * holds more than the configured capacity. At most {@code maxSubjects} subjects are tracked; past
 * that the cache evicts the least valuable subject, and a subject idle for longer than the
 * retention is dropped on its own. Subjects are independent: appending for one never waits on
 * another.
 */
@Component
public class SecurityEventBuffer {

    private final PatternDetectorProperties cfg;
    private final Cache<String, Deque<SecurityEvent>> bySubject;

    public SecurityEventBuffer(PatternDetectorProperties cfg, Clock clock) {
        this.cfg = cfg;
        this.bySubject = Caffeine.newBuilder()
                .maximumSize(cfg.getMaxSubjects())
                .expireAfterAccess(cfg.retention())
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .executor(Runnable::run)
                .build();
    }

    /** Appends the event and returns a snapshot of its subject's events still in retention. */
    public List<SecurityEvent> append(SecurityEvent event, Instant now) {
        List<SecurityEvent> snapshot = new ArrayList<>();
        bySubject.asMap().compute(event.getSubject(), (subject, ring) -> {
            Deque<SecurityEvent> q = ring == null ? new ArrayDeque<>() : ring;
            prune(q, now);
            q.addLast(event);
            while (q.size() > cfg.getBufferCapacityPerSubject()) {
                q.removeFirst();
            }
            snapshot.addAll(q);
            return q;
        });
        return snapshot;
    }

    public long subjectCount() {
        bySubject.cleanUp();
        return bySubject.estimatedSize();
    }

    private void prune(Deque<SecurityEvent> q, Instant now) {
        Instant cutoff = now.minus(cfg.retention());
        while (!q.isEmpty() && q.peekFirst().getTimestamp().isBefore(cutoff)) {
            q.removeFirst();
        }
    }
}
