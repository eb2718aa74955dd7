package com.jasmin.abuseguard.models;

import lombok.EqualsAndHashCode;
import lombok.Value;

/**
 * Identifies one throttled principal for one class of operation.
 * <p>
 * Only {@code identifier} and {@code action} take part in equality and in the storage key;
 * {@code subjectType} tells the pattern detector what kind of subject an emitted event is about.
 */
@Value
public class RateLimitKey {
    String identifier;
    String action;

    @EqualsAndHashCode.Exclude
    SubjectType subjectType;

    public static RateLimitKey of(String identifier, String action) {
        return new RateLimitKey(identifier, action, SubjectType.IDENTIFIER);
    }

    public static RateLimitKey origin(String networkOrigin, String action) {
        return new RateLimitKey(networkOrigin, action, SubjectType.NETWORK_ORIGIN);
    }

    public static RateLimitKey account(String accountId, String action) {
        return new RateLimitKey(accountId, action, SubjectType.ACCOUNT);
    }

    /**
     * {@code <len(action)>:<action>:<identifier>}. The length prefix fixes where the action ends,
     * so colons inside either part (IPv6 origins, namespaced actions) cannot make two keys collide.
     */
    public String storageSuffix() {
        String a = String.valueOf(action);
        return a.length() + ":" + a + ":" + identifier;
    }
}
