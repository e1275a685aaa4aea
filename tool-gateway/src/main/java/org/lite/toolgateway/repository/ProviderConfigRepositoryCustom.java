package org.lite.toolgateway.repository;

import org.lite.toolgateway.entity.ProviderConfig;
import reactor.core.publisher.Mono;

public interface ProviderConfigRepositoryCustom {

    /**
     * Atomically mark a visible provider deleted and disabled.
     *
     * @return the updated row, or empty when no non-deleted row with this id
     *         exists for the tenant
     */
    Mono<ProviderConfig> softDelete(String id, String tenantId);
}
