package org.lite.toolgateway.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.lite.toolgateway.enums.AuthMode;
import org.lite.toolgateway.enums.CredentialField;
import org.lite.toolgateway.enums.ProviderFamily;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.annotation.Version;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * One tenant-owned connection to an external system.
 * Credentials are stored only as {@link EncryptedSecret}s keyed by slot.
 */
@Document(collection = "integration_provider_configs")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@CompoundIndexes({
    // Registry reads: tenant + not deleted, newest first
    @CompoundIndex(name = "tenant_deleted_created_idx", def = "{'tenantId': 1, 'deleted': 1, 'createdAt': -1}"),

    // Dispatcher lookup: usable provider of a family
    @CompoundIndex(name = "tenant_family_usable_idx", def = "{'tenantId': 1, 'providerFamily': 1, 'enabled': 1, 'deleted': 1}")
})
public class ProviderConfig {

    @Id
    private String id;

    private String tenantId;

    private ProviderFamily providerFamily;

    private String displayName;

    @Builder.Default
    private boolean enabled = true;

    private String baseUrl;

    @Builder.Default
    private AuthMode authMode = AuthMode.NONE;

    @ToString.Exclude
    @Builder.Default
    private Map<CredentialField, EncryptedSecret> credentials = new EnumMap<>(CredentialField.class);

    // Soft delete only; rows are kept for audit continuity
    private boolean deleted;

    @Version
    private Long version;

    @CreatedDate
    private LocalDateTime createdAt;

    @LastModifiedDate
    private LocalDateTime updatedAt;

    public Optional<EncryptedSecret> credential(CredentialField field) {
        return credentials == null ? Optional.empty() : Optional.ofNullable(credentials.get(field));
    }

    public boolean hasCredential(CredentialField field) {
        return credential(field).isPresent();
    }

    public void putCredential(CredentialField field, EncryptedSecret secret) {
        if (credentials == null) {
            credentials = new EnumMap<>(CredentialField.class);
        }
        if (secret == null) {
            credentials.remove(field);
        } else {
            credentials.put(field, secret);
        }
    }

    /**
     * A soft-deleted row is never dispatchable, whatever its enabled flag says.
     */
    public boolean isDispatchable() {
        return enabled && !deleted;
    }
}
