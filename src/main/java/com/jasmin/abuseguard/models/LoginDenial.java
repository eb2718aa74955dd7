package com.jasmin.abuseguard.models;

public enum LoginDenial {
    ORIGIN_BLOCKED,
    ACCOUNT_LOCKED
}
