package com.jasmin.abuseguard.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@AllArgsConstructor
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LoginDecision {
    private boolean allowed;
    private LoginDenial denial;
    private DenialReason cause;
    private Instant until;
    private Long retryAfterSeconds;
    private String message;

    public static LoginDecision allow() {
        return new LoginDecision(true, null, null, null, null, null);
    }

    public static LoginDecision unavailable(RateLimitDecision decision) {
        return new LoginDecision(false, null, decision.getReason(), null, decision.getRetryAfterSeconds(),
                decision.getMessage());
    }

    public static LoginDecision deny(LoginDenial denial, RateLimitDecision decision) {
        String message = switch (denial) {
            case ORIGIN_BLOCKED -> "Too many failed login attempts from your network. Please try again in %d seconds.";
            case ACCOUNT_LOCKED -> "This account is temporarily locked. Please try again in %d seconds.";
        };
        long retryAfter = decision.getRetryAfterSeconds() == null ? 1L : decision.getRetryAfterSeconds();
        return new LoginDecision(false, denial, decision.getReason(), decision.getUntil(), retryAfter,
                String.format(message, retryAfter));
    }
}
