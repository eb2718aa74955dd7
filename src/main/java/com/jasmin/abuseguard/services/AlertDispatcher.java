package com.jasmin.abuseguard.services;

import com.jasmin.abuseguard.models.SecurityAlert;

/** Delivers alerts to operators. Implementations throw {@link AlertDeliveryException} on failure. */
public interface AlertDispatcher {
    void dispatch(SecurityAlert alert);
}
