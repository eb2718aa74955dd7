package com.jasmin.abuseguard.services;

import com.jasmin.abuseguard.models.SecurityEvent;

public interface SecurityEventListener {
    void onEvent(SecurityEvent event);
}
