package com.jasmin.abuseguard.detectors.ratelimiter;

/** An invalid limit or window. Never silently ignored. */
public class RateLimitConfigurationException extends IllegalArgumentException {

    public RateLimitConfigurationException(String message) {
        super(message);
    }
}
