package org.lite.toolgateway.dto;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.lite.toolgateway.entity.ProviderConfig;
import org.lite.toolgateway.enums.AuthMode;
import org.lite.toolgateway.enums.CredentialField;
import org.lite.toolgateway.enums.ProviderFamily;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Redacted provider. Secret slots appear only as {@code has*} booleans,
 * derived from {@link CredentialField}, so a new slot cannot be forgotten here.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Provider configuration without any secret material")
public class ProviderView {

    private String id;
    private String tenantId;
    private ProviderFamily providerFamily;
    private String displayName;

    @JsonProperty("isEnabled")
    private boolean enabled;

    private String baseUrl;
    private AuthMode authMode;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    @Builder.Default
    private Map<String, Boolean> credentialFlags = new LinkedHashMap<>();

    @JsonAnyGetter
    public Map<String, Boolean> getCredentialFlags() {
        return credentialFlags;
    }

    public static ProviderView from(ProviderConfig provider) {
        Map<String, Boolean> flags = new LinkedHashMap<>();
        for (CredentialField field : CredentialField.values()) {
            flags.put(field.getPresenceFlag(), provider.hasCredential(field));
        }
        return ProviderView.builder()
                .id(provider.getId())
                .tenantId(provider.getTenantId())
                .providerFamily(provider.getProviderFamily())
                .displayName(provider.getDisplayName())
                .enabled(provider.isEnabled())
                .baseUrl(provider.getBaseUrl())
                .authMode(provider.getAuthMode())
                .createdAt(provider.getCreatedAt())
                .updatedAt(provider.getUpdatedAt())
                .credentialFlags(flags)
                .build();
    }
}
