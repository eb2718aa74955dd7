package com.jasmin.abuseguard.models;

public enum SubjectType {
    NETWORK_ORIGIN,
    ACCOUNT,
    IDENTIFIER
}
