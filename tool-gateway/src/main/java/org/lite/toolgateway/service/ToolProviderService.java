package org.lite.toolgateway.service;

import org.lite.toolgateway.dto.ConnectionTestResult;
import org.lite.toolgateway.dto.CreateProviderRequest;
import org.lite.toolgateway.dto.ProviderView;
import org.lite.toolgateway.dto.UpdateProviderRequest;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Per-tenant provider configurations. Every read returns a redacted view;
 * every lookup is scoped by tenant and excludes soft-deleted rows.
 */
public interface ToolProviderService {

    Flux<ProviderView> listProviders(String tenantId);

    Mono<ProviderView> getProvider(String id, String tenantId);

    Mono<ProviderView> createProvider(String tenantId, CreateProviderRequest request);

    Mono<ProviderView> updateProvider(String id, String tenantId, UpdateProviderRequest request);

    /**
     * Soft delete. A second call for the same id signals not-found.
     */
    Mono<Void> deleteProvider(String id, String tenantId);

    Mono<ConnectionTestResult> testConnection(String id, String tenantId, String actorUserId);
}
