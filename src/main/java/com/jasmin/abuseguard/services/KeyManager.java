package com.jasmin.abuseguard.services;

import com.jasmin.abuseguard.models.RateLimitKey;
import com.jasmin.abuseguard.store.StoreProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class KeyManager {
    private static final String NS_ATTEMPTS = "rl";              // rl:<len>:<action>:<identifier>
    private static final String NS_VIOLATIONS = "pen:count";     // pen:count:<len>:<action>:<identifier>
    private static final String NS_PENALTY_UNTIL = "pen:until";  // pen:until:<len>:<action>:<identifier>
    private static final String NS_BLOCK = "blk";                // blk:<identifier>
    private static final String NS_LOCKOUTS = "bf:lockouts";     // bf:lockouts:<origin>
    private static final String NS_EVENTS = "events";            // events:<type>:<minute>
    private static final String NS_BLOCKS = "blocks";            // blocks:<reason>:<minute>

    private final StoreProperties props;

    public String attemptLog(RateLimitKey key) {
        return join(NS_ATTEMPTS, key.storageSuffix());
    }

    public String violations(RateLimitKey key) {
        return join(NS_VIOLATIONS, key.storageSuffix());
    }

    public String penaltyUntil(RateLimitKey key) {
        return join(NS_PENALTY_UNTIL, key.storageSuffix());
    }

    public String block(String identifier) {
        return join(NS_BLOCK, identifier);
    }

    public String lockouts(String networkOrigin) {
        return join(NS_LOCKOUTS, networkOrigin);
    }

    public String eventsKey(String eventType, String minuteKey) {
        return join(NS_EVENTS, eventType + ":" + minuteKey);
    }

    public String blocksKey(String reason, String minuteKey) {
        return join(NS_BLOCKS, reason + ":" + minuteKey);
    }

    private String join(String namespace, String suffix) {
        return props.getKeyPrefix() + ":" + namespace + ":" + suffix;
    }
}
