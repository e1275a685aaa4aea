package org.lite.toolgateway.config;

import lombok.extern.slf4j.Slf4j;
import org.lite.vault.credential.AesGcmCredentialVault;
import org.lite.vault.credential.CredentialVault;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@Slf4j
public class CredentialVaultConfig {

    /**
     * Fails startup when the master key is missing or too short rather than
     * running with a vault that cannot decrypt.
     */
    @Bean
    public CredentialVault credentialVault(ToolGatewayProperties properties) {
        ToolGatewayProperties.Vault vault = properties.getVault();
        log.info("Initializing credential vault with key context '{}'", vault.getKeyContext());
        return new AesGcmCredentialVault(vault.getMasterKey(), vault.getKeyContext());
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
