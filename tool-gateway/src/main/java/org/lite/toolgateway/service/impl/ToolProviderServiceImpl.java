package org.lite.toolgateway.service.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.lite.toolgateway.connector.ConnectorContext;
import org.lite.toolgateway.connector.CredentialResolver;
import org.lite.toolgateway.connector.ToolConnector;
import org.lite.toolgateway.connector.ToolConnectorRegistry;
import org.lite.toolgateway.dto.ConnectionTestResult;
import org.lite.toolgateway.dto.CreateProviderRequest;
import org.lite.toolgateway.dto.ProviderView;
import org.lite.toolgateway.dto.UpdateProviderRequest;
import org.lite.toolgateway.entity.AuditEvent;
import org.lite.toolgateway.entity.EncryptedSecret;
import org.lite.toolgateway.entity.ProviderConfig;
import org.lite.toolgateway.enums.AuditAction;
import org.lite.toolgateway.enums.AuditDecision;
import org.lite.toolgateway.enums.AuthMode;
import org.lite.toolgateway.enums.CredentialField;
import org.lite.toolgateway.enums.DecisionReason;
import org.lite.toolgateway.exception.ProviderNotFoundException;
import org.lite.toolgateway.exception.ToolGatewayValidationException;
import org.lite.toolgateway.repository.ProviderConfigRepository;
import org.lite.toolgateway.service.AuditService;
import org.lite.toolgateway.service.SsrfGuardService;
import org.lite.toolgateway.service.ToolProviderService;
import org.lite.toolgateway.validation.CustomHeaders;
import org.lite.vault.credential.CredentialVault;
import org.lite.vault.credential.CredentialVaultException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.EnumMap;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class ToolProviderServiceImpl implements ToolProviderService {

    private final ProviderConfigRepository providerConfigRepository;
    private final SsrfGuardService ssrfGuardService;
    private final CredentialVault credentialVault;
    private final CredentialResolver credentialResolver;
    private final ToolConnectorRegistry toolConnectorRegistry;
    private final AuditService auditService;
    private final ObjectMapper objectMapper;

    @Override
    public Flux<ProviderView> listProviders(String tenantId) {
        return providerConfigRepository.findByTenantIdAndDeletedFalseOrderByCreatedAtDesc(tenantId)
                .map(ProviderView::from);
    }

    @Override
    public Mono<ProviderView> getProvider(String id, String tenantId) {
        return findVisible(id, tenantId).map(ProviderView::from);
    }

    @Override
    public Mono<ProviderView> createProvider(String tenantId, CreateProviderRequest request) {
        return Mono.defer(() -> {
            validateCustomHeaders(request.getCustomHeaders());
            String baseUrl = request.getBaseUrl().trim();

            return requireSafeBaseUrl(baseUrl)
                    .then(Mono.fromCallable(() -> {
                        ProviderConfig provider = ProviderConfig.builder()
                                .tenantId(tenantId)
                                .providerFamily(request.getProviderFamily())
                                .displayName(request.getDisplayName().trim())
                                .enabled(request.getIsEnabled() == null || request.getIsEnabled())
                                .baseUrl(baseUrl)
                                .authMode(request.getAuthMode() != null ? request.getAuthMode() : AuthMode.NONE)
                                .credentials(new EnumMap<>(CredentialField.class))
                                .build();
                        secretsOf(request.getUsername(), request.getPassword(), request.getToken(),
                                request.getCustomHeaders())
                                .forEach((field, value) -> applySecret(provider, field, value));
                        return provider;
                    }))
                    .flatMap(providerConfigRepository::save)
                    .doOnSuccess(saved -> log.info("Created {} provider {} for tenant {}",
                            saved.getProviderFamily(), saved.getId(), tenantId))
                    .map(ProviderView::from);
        });
    }

    @Override
    public Mono<ProviderView> updateProvider(String id, String tenantId, UpdateProviderRequest request) {
        return Mono.defer(() -> {
            validateCustomHeaders(request.getCustomHeaders());
            return findVisible(id, tenantId)
                    .flatMap(existing -> {
                        String newBaseUrl = request.getBaseUrl() != null ? request.getBaseUrl().trim() : null;
                        boolean baseUrlChanged = newBaseUrl != null && !newBaseUrl.equals(existing.getBaseUrl());
                        Mono<Void> urlCheck = baseUrlChanged ? requireSafeBaseUrl(newBaseUrl) : Mono.empty();

                        return urlCheck.then(Mono.fromCallable(() -> {
                            if (request.getDisplayName() != null) {
                                existing.setDisplayName(request.getDisplayName().trim());
                            }
                            if (request.getIsEnabled() != null) {
                                existing.setEnabled(request.getIsEnabled());
                            }
                            if (request.getAuthMode() != null) {
                                existing.setAuthMode(request.getAuthMode());
                            }
                            if (baseUrlChanged) {
                                existing.setBaseUrl(newBaseUrl);
                            }
                            secretsOf(request.getUsername(), request.getPassword(), request.getToken(),
                                    request.getCustomHeaders())
                                    .forEach((field, value) -> applySecret(existing, field, value));
                            return existing;
                        }));
                    })
                    // A concurrent soft delete bumps the version; never resurrect the row
                    .flatMap(providerConfigRepository::save)
                    .onErrorMap(OptimisticLockingFailureException.class, e -> new ResponseStatusException(
                            HttpStatus.CONFLICT, "Provider was modified concurrently, retry the update"))
                    .doOnSuccess(saved -> log.info("Updated provider {} for tenant {}", id, tenantId))
                    .map(ProviderView::from);
        });
    }

    @Override
    public Mono<Void> deleteProvider(String id, String tenantId) {
        return providerConfigRepository.softDelete(id, tenantId)
                .switchIfEmpty(Mono.error(new ProviderNotFoundException(id)))
                .doOnSuccess(deleted -> log.info("Soft-deleted provider {} for tenant {}", id, tenantId))
                .then();
    }

    @Override
    public Mono<ConnectionTestResult> testConnection(String id, String tenantId, String actorUserId) {
        return findVisible(id, tenantId)
                .flatMap(provider -> {
                    long start = System.currentTimeMillis();
                    AuditEvent.AuditEventBuilder audit = AuditEvent.builder()
                            .tenantId(tenantId)
                            .actorUserId(actorUserId)
                            .action(AuditAction.TEST_CONNECTION)
                            .providerFamily(provider.getProviderFamily())
                            .providerId(provider.getId());

                    ToolConnector connector = toolConnectorRegistry.forFamily(provider.getProviderFamily())
                            .orElse(null);
                    if (connector == null) {
                        log.error("No connector registered for provider family {}", provider.getProviderFamily());
                        return recordAndReturn(audit, AuditDecision.ERROR, DecisionReason.INTERNAL_ERROR,
                                new ConnectionTestResult(false, 0, "No connector available for this provider"));
                    }

                    return ssrfGuardService.validateUrl(provider.getBaseUrl())
                            .flatMap(validation -> {
                                if (!validation.isValid()) {
                                    return recordAndReturn(audit, AuditDecision.DENIED, DecisionReason.SSRF_BLOCKED,
                                            new ConnectionTestResult(false, elapsed(start),
                                                    ToolGatewayValidationException.UNSAFE_BASE_URL_MESSAGE));
                                }
                                return Mono.fromCallable(() -> credentialResolver.resolve(provider))
                                        .flatMap(credentials -> connector.testConnection(ConnectorContext.builder()
                                                .providerId(provider.getId())
                                                .baseUrl(provider.getBaseUrl())
                                                .authMode(provider.getAuthMode())
                                                .credentials(credentials)
                                                .build()))
                                        .flatMap(result -> recordAndReturn(audit,
                                                result.isSuccess() ? AuditDecision.ALLOWED : AuditDecision.ERROR,
                                                result.isSuccess() ? DecisionReason.OK : DecisionReason.CONNECTOR_ERROR,
                                                result))
                                        .onErrorResume(CredentialVaultException.class, e -> {
                                            log.error("Connection test for provider {} aborted: credentials could not be decrypted",
                                                    provider.getId());
                                            return recordAndReturn(audit, AuditDecision.ERROR, DecisionReason.VAULT_FAILURE,
                                                    new ConnectionTestResult(false, elapsed(start),
                                                            "Stored credentials could not be decrypted"));
                                        });
                            });
                });
    }

    private Mono<ConnectionTestResult> recordAndReturn(AuditEvent.AuditEventBuilder audit,
                                                      AuditDecision decision,
                                                      DecisionReason reason,
                                                      ConnectionTestResult result) {
        AuditEvent event = audit
                .decision(decision)
                .reason(reason)
                .latencyMs(result.getLatencyMs())
                .details(result.getMessage())
                .build();
        return auditService.record(event).thenReturn(result);
    }

    private Mono<ProviderConfig> findVisible(String id, String tenantId) {
        return providerConfigRepository.findByIdAndTenantIdAndDeletedFalse(id, tenantId)
                .switchIfEmpty(Mono.error(new ProviderNotFoundException(id)));
    }

    private Mono<Void> requireSafeBaseUrl(String baseUrl) {
        return ssrfGuardService.validateUrl(baseUrl)
                .flatMap(result -> result.isValid()
                        ? Mono.<Void>empty()
                        : Mono.error(ToolGatewayValidationException.unsafeBaseUrl()));
    }

    private void validateCustomHeaders(String customHeaders) {
        if (customHeaders == null || customHeaders.isEmpty()) {
            return;
        }
        try {
            CustomHeaders.parse(objectMapper, customHeaders);
        } catch (IllegalArgumentException e) {
            throw new ToolGatewayValidationException(e.getMessage());
        }
    }

    /**
     * null leaves the slot alone, "" clears it, anything else is encrypted into it.
     */
    private void applySecret(ProviderConfig provider, CredentialField field, String value) {
        if (value.isEmpty()) {
            provider.putCredential(field, null);
            return;
        }
        try {
            provider.putCredential(field, EncryptedSecret.of(credentialVault.encrypt(value)));
        } catch (CredentialVaultException e) {
            log.error("Failed to encrypt {} for tenant {}", field, provider.getTenantId());
            throw new ResponseStatusException(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to store credentials");
        }
    }

    private static Map<CredentialField, String> secretsOf(String username, String password,
                                                          String token, String customHeaders) {
        Map<CredentialField, String> secrets = new EnumMap<>(CredentialField.class);
        if (username != null) {
            secrets.put(CredentialField.USERNAME, username);
        }
        if (password != null) {
            secrets.put(CredentialField.PASSWORD, password);
        }
        if (token != null) {
            secrets.put(CredentialField.TOKEN, token);
        }
        if (customHeaders != null) {
            secrets.put(CredentialField.CUSTOM_HEADERS, customHeaders);
        }
        return secrets;
    }

    private static long elapsed(long start) {
        return System.currentTimeMillis() - start;
    }
}
