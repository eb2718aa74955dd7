package com.jasmin.abuseguard.services;

import com.jasmin.abuseguard.models.EventType;
import com.jasmin.abuseguard.models.RateLimitKey;
import com.jasmin.abuseguard.models.SecurityEvent;
import com.jasmin.abuseguard.models.Severity;
import com.jasmin.abuseguard.models.SubjectType;
import com.jasmin.abuseguard.store.StorageUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

/**
 * Hands security events to every registered listener, in-line on the calling thread, and
 * counts them for the statistics endpoint.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SecurityEventPublisher {

    private final List<SecurityEventListener> listeners;
    private final SecurityStatsService stats;
    private final Clock clock;

    public void publish(EventType type, RateLimitKey key, Severity severity, String details) {
        publish(type, key.getIdentifier(), key.getSubjectType(), severity, key.getAction(), details);
    }

    public void publish(EventType type, String subject, SubjectType subjectType, Severity severity,
                        String action, String details) {
        publish(SecurityEvent.builder()
                .type(type)
                .subject(subject)
                .subjectType(subjectType)
                .severity(severity)
                .action(action)
                .timestamp(clock.instant())
                .details(details)
                .build());
    }

    public void publish(SecurityEvent event) {
        log.debug("Security event type={} subject={} severity={} action={}",
                event.getType(), event.getSubject(), event.getSeverity(), event.getAction());

        for (SecurityEventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (StorageUnavailableException e) {
                log.warn("Listener {} could not process event type={} subject={}",
                        listener.getClass().getSimpleName(), event.getType(), event.getSubject(), e);
            }
        }

        stats.recordEvent(event);
    }
}
