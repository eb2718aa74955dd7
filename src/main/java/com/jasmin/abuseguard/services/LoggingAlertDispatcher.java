package com.jasmin.abuseguard.services;

import com.jasmin.abuseguard.models.SecurityAlert;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class LoggingAlertDispatcher implements AlertDispatcher {

    @Override
    public void dispatch(SecurityAlert alert) {
        log.warn("SECURITY ALERT type={} severity={} subject={} details={} at={}",
                alert.getType(), alert.getSeverity(), alert.getSubject(), alert.getDetails(), alert.getTimestamp());
    }
}
