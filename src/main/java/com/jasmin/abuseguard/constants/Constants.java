package com.jasmin.abuseguard.constants;

public class Constants {
    public static final String LOGIN_ATTEMPT = "login_attempt";
    public static final String LOGIN_ACCOUNT = "login_account";
    public static final String REGISTRATION = "registration";

    public static final String BURST_DETECTED = "BURST_DETECTED";
    public static final String REPEATED_FAILURES = "REPEATED_FAILURES";
    public static final String ORIGIN_BANNED = "ORIGIN_BANNED";
    public static final String MANUAL_BLOCK = "MANUAL_BLOCK";
}
