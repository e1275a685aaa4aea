package org.lite.toolgateway.connector;

import lombok.Builder;
import lombok.Getter;

import java.util.Collections;
import java.util.Map;

/**
 * Plaintext credentials for the lifetime of one connector call. Never
 * persisted, serialized or logged.
 */
@Getter
@Builder
public class ResolvedCredentials {

    private final String username;
    private final String password;
    private final String token;
    @Builder.Default
    private final Map<String, String> customHeaders = Collections.emptyMap();

    public static ResolvedCredentials none() {
        return ResolvedCredentials.builder().build();
    }

    @Override
    public String toString() {
        return "ResolvedCredentials[username=" + mask(username)
                + ", password=" + mask(password)
                + ", token=" + mask(token)
                + ", customHeaders=" + customHeaders.keySet() + "]";
    }

    private static String mask(String value) {
        return value == null ? "null" : "****";
    }
}
