package com.jasmin.abuseguard.services;

public class AlertDeliveryException extends RuntimeException {

    public AlertDeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
