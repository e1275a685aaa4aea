package org.lite.toolgateway.enums;

/**
 * Secret slots a provider configuration can carry. The redacted view exposes
 * one {@code has*} flag per constant, so adding a slot here adds its flag too.
 */
public enum CredentialField {
    USERNAME("hasUsername"),
    PASSWORD("hasPassword"),
    TOKEN("hasToken"),
    CUSTOM_HEADERS("hasCustomHeaders");

    private final String presenceFlag;

    CredentialField(String presenceFlag) {
        this.presenceFlag = presenceFlag;
    }

    public String getPresenceFlag() {
        return presenceFlag;
    }
}
