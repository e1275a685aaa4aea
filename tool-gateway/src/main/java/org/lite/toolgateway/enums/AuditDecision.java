package org.lite.toolgateway.enums;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Outcome recorded for every authorization decision and invocation.
 */
public enum AuditDecision {
    ALLOWED,
    DENIED,
    THROTTLED,
    ERROR;

    @JsonValue
    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
