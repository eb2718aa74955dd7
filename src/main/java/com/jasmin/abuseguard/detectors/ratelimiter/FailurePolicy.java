package com.jasmin.abuseguard.detectors.ratelimiter;

/** What a check answers when the store cannot be reached. */
public enum FailurePolicy {
    /** Allow and log a warning. For low-stakes throttles. */
    FAIL_OPEN,
    /** Deny. For authentication-adjacent actions. */
    FAIL_CLOSED
}
