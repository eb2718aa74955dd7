package com.jasmin.abuseguard.models;

public enum BlockScope {
    NETWORK_ORIGIN,
    ACCOUNT,
    IDENTIFIER
}
