package com.jasmin.abuseguard.services;

import com.jasmin.abuseguard.models.SecurityAlert;
import com.jasmin.abuseguard.models.Severity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * Raises alerts without letting delivery problems reach the security decision that triggered
 * them: a failed delivery is logged and the caller carries on.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SecurityAlertService {

    private final AlertDispatcher dispatcher;
    private final Clock clock;

    /** Returns whether the alert was delivered. */
    public boolean raise(String type, Severity severity, String subject, String details) {
        SecurityAlert alert = new SecurityAlert(type, severity, subject, details, clock.instant());
        try {
            dispatcher.dispatch(alert);
            return true;
        } catch (RuntimeException e) {
            log.error("Failed to deliver alert type={} subject={}", type, subject, e);
            return false;
        }
    }
}
