package org.lite.toolgateway.enums;

/**
 * Enumeration of audited tool gateway actions
 */
public enum AuditAction {
    TOOL_RUN,
    TEST_CONNECTION,
    POLICY_CHANGE
}
