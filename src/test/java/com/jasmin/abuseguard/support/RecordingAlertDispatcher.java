package com.jasmin.abuseguard.support;

import com.jasmin.abuseguard.models.SecurityAlert;
import com.jasmin.abuseguard.services.AlertDeliveryException;
import com.jasmin.abuseguard.services.AlertDispatcher;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

public class RecordingAlertDispatcher implements AlertDispatcher {

    private final List<SecurityAlert> alerts = new CopyOnWriteArrayList<>();
    private volatile boolean failing;

    public void failDeliveries() {
        failing = true;
    }

    @Override
    public void dispatch(SecurityAlert alert) {
        if (failing) {
            throw new AlertDeliveryException("alert channel down", new IllegalStateException("connection refused"));
        }
        alerts.add(alert);
    }

    public List<SecurityAlert> alerts() {
        return alerts;
    }

    public List<SecurityAlert> alertsOfType(String type) {
        return alerts.stream().filter(a -> type.equals(a.getType())).toList();
    }
}
