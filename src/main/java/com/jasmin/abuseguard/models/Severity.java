package com.jasmin.abuseguard.models;

public enum Severity {
    INFO,
    WARNING,
    CRITICAL
}
