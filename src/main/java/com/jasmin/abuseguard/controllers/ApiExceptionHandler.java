package com.jasmin.abuseguard.controllers;

import com.jasmin.abuseguard.store.StorageUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(StorageUnavailableException.class)
    public ResponseEntity<ErrorBody> storageUnavailable(StorageUnavailableException e) {
        log.error("Store unavailable", e);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(new ErrorBody("storage_unavailable", "Security store unavailable"));
    }

    // also covers RateLimitConfigurationException
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorBody> badRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(new ErrorBody("invalid_request", e.getMessage()));
    }

    public record ErrorBody(String code, String message) {}
}
