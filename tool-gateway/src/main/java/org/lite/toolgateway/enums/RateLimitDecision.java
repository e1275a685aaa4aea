package org.lite.toolgateway.enums;

public enum RateLimitDecision {
    ACQUIRED,
    MINUTE_LIMIT_EXCEEDED,
    RUN_LIMIT_EXCEEDED
}
