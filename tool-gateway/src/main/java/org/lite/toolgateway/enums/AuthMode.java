package org.lite.toolgateway.enums;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Arrays;

/**
 * How the gateway authenticates against an external system.
 */
public enum AuthMode {
    NONE,   // no Authorization header
    BASIC,  // username + password
    TOKEN;  // bearer token

    /**
     * Accepts {@code basic} as well as {@code BASIC}.
     */
    @JsonCreator
    public static AuthMode fromValue(String value) {
        return Arrays.stream(values())
                .filter(mode -> mode.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown auth mode: " + value));
    }
}
