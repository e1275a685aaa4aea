package org.lite.toolgateway.connector;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.lite.toolgateway.entity.EncryptedSecret;
import org.lite.toolgateway.entity.ProviderConfig;
import org.lite.toolgateway.enums.AuthMode;
import org.lite.toolgateway.enums.CredentialField;
import org.lite.toolgateway.validation.CustomHeaders;
import org.lite.vault.credential.CredentialVault;
import org.lite.vault.credential.CredentialVaultException;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Decrypts exactly the slots a provider's auth mode needs, plus custom headers.
 * Any failure aborts the whole resolution; partial credentials are never returned.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CredentialResolver {

    private final CredentialVault credentialVault;
    private final ObjectMapper objectMapper;

    /**
     * @throws CredentialVaultException when any required slot cannot be decrypted
     *                                  or the stored custom headers are unreadable
     */
    public ResolvedCredentials resolve(ProviderConfig provider) {
        ResolvedCredentials.ResolvedCredentialsBuilder builder = ResolvedCredentials.builder();
        AuthMode authMode = provider.getAuthMode() != null ? provider.getAuthMode() : AuthMode.NONE;

        if (authMode == AuthMode.BASIC) {
            builder.username(decrypt(provider, CredentialField.USERNAME));
            builder.password(decrypt(provider, CredentialField.PASSWORD));
        } else if (authMode == AuthMode.TOKEN) {
            builder.token(decrypt(provider, CredentialField.TOKEN));
        }

        String headersJson = decrypt(provider, CredentialField.CUSTOM_HEADERS);
        if (headersJson != null) {
            try {
                Map<String, String> headers = CustomHeaders.parse(objectMapper, headersJson);
                builder.customHeaders(headers);
            } catch (IllegalArgumentException e) {
                throw new CredentialVaultException("Stored custom headers for provider " + provider.getId()
                        + " are unreadable");
            }
        }
        return builder.build();
    }

    private String decrypt(ProviderConfig provider, CredentialField field) {
        return provider.credential(field)
                .map(EncryptedSecret::getCiphertext)
                .map(ciphertext -> {
                    try {
                        return credentialVault.decrypt(ciphertext);
                    } catch (CredentialVaultException e) {
                        log.error("Failed to decrypt {} for provider {}", field, provider.getId());
                        throw e;
                    }
                })
                .orElse(null);
    }
}
