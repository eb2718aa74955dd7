package com.jasmin.abuseguard.controllers;

import com.jasmin.abuseguard.models.BlockStatus;
import com.jasmin.abuseguard.models.FailedOperationRequest;
import com.jasmin.abuseguard.models.LoginDecision;
import com.jasmin.abuseguard.models.LoginEventRequest;
import com.jasmin.abuseguard.models.ManualBlockRequest;
import com.jasmin.abuseguard.models.RateLimitCheckRequest;
import com.jasmin.abuseguard.models.RateLimitDecision;
import com.jasmin.abuseguard.services.AbuseGuardService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;

@RequiredArgsConstructor
@RestController
@RequestMapping("/v1")
public class AbuseGuardController {

    private final AbuseGuardService abuseGuardService;

    @PostMapping("/rate-limit/check")
    public ResponseEntity<RateLimitDecision> checkRateLimit(@Valid @RequestBody RateLimitCheckRequest req) {
        Duration window = req.getWindowSeconds() == null ? null : Duration.ofSeconds(req.getWindowSeconds());
        RateLimitDecision decision = abuseGuardService.checkRateLimit(
                req.getIdentifier(), req.getAction(), req.getLimit(), window);

        if (decision.isAllowed()) {
            return ResponseEntity.ok(decision);
        }
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                .headers(retryAfter(decision.getRetryAfterSeconds()))
                .body(decision);
    }

    @PostMapping("/login/attempt")
    public ResponseEntity<LoginDecision> loginAttempt(@Valid @RequestBody LoginEventRequest req) {
        LoginDecision decision = abuseGuardService.checkLoginAttempt(req.getUsername(), req.getNetworkOrigin());
        if (decision.isAllowed()) {
            return ResponseEntity.ok(decision);
        }
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                .headers(retryAfter(decision.getRetryAfterSeconds()))
                .body(decision);
    }

    @PostMapping("/login/failure")
    public ResponseEntity<Void> loginFailure(@Valid @RequestBody LoginEventRequest req) {
        abuseGuardService.reportLoginFailure(req.getUsername(), req.getNetworkOrigin());
        return ResponseEntity.accepted().build();
    }

    @PostMapping("/login/success")
    public ResponseEntity<Void> loginSuccess(@Valid @RequestBody LoginEventRequest req) {
        abuseGuardService.reportLoginSuccess(req.getUsername(), req.getNetworkOrigin());
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/operations/failure")
    public ResponseEntity<Void> operationFailure(@Valid @RequestBody FailedOperationRequest req) {
        abuseGuardService.reportFailedOperation(req.getAccountId(), req.getAction(), req.getDetails());
        return ResponseEntity.accepted().build();
    }

    @GetMapping("/blocks/{identifier}")
    public BlockStatus isBlocked(@PathVariable String identifier) {
        return abuseGuardService.isBlocked(identifier);
    }

    @PostMapping("/blocks")
    public ResponseEntity<BlockStatus> block(@Valid @RequestBody ManualBlockRequest req) {
        BlockStatus status = abuseGuardService.block(
                req.getIdentifier(), req.getScope(), Duration.ofSeconds(req.getDurationSeconds()), req.getNote());
        return ResponseEntity.status(HttpStatus.CREATED).body(status);
    }

    private static HttpHeaders retryAfter(Long seconds) {
        HttpHeaders h = new HttpHeaders();
        if (seconds != null) {
            h.set(HttpHeaders.RETRY_AFTER, String.valueOf(seconds));
        }
        return h;
    }
}
