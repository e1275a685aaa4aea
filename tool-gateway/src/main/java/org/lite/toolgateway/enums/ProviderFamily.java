package org.lite.toolgateway.enums;

/**
 * External-system families a tenant can connect to.
 */
public enum ProviderFamily {
    SERVICENOW
}
