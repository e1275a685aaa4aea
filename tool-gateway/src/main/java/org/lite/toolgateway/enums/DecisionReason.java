package org.lite.toolgateway.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Machine-readable reasons attached to audit events and tool run responses.
 */
public enum DecisionReason {
    OK("ok"),
    NO_POLICY("no_policy"),
    DISABLED("disabled"),
    NOT_ALLOWLISTED("not_allowlisted"),
    PROVIDER_NOT_FOUND("provider_not_found"),
    SSRF_BLOCKED("ssrf_blocked"),
    RATE_LIMITED("rate_limited"),
    RUN_LIMIT_EXCEEDED("run_limit_exceeded"),
    RATE_LIMIT_UNAVAILABLE("rate_limit_unavailable"),
    VAULT_FAILURE("vault_failure"),
    CONNECTOR_ERROR("connector_error"),
    CONNECTOR_TIMEOUT("connector_timeout"),
    INTERNAL_ERROR("internal_error"),
    POLICY_UPDATED("policy_updated");

    private final String code;

    DecisionReason(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
