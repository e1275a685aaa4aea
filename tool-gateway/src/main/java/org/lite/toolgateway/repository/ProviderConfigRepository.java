package org.lite.toolgateway.repository;

import org.lite.toolgateway.entity.ProviderConfig;
import org.lite.toolgateway.enums.ProviderFamily;
import org.springframework.data.mongodb.repository.ReactiveMongoRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Collection;

/**
 * Provider configurations. Every finder scopes by tenant in the query
 * predicate itself and excludes soft-deleted rows.
 */
@Repository
public interface ProviderConfigRepository extends ReactiveMongoRepository<ProviderConfig, String>,
        ProviderConfigRepositoryCustom {

    Flux<ProviderConfig> findByTenantIdAndDeletedFalseOrderByCreatedAtDesc(String tenantId);

    Mono<ProviderConfig> findByIdAndTenantIdAndDeletedFalse(String id, String tenantId);

    /**
     * Oldest usable provider of a family for the tenant
     */
    Mono<ProviderConfig> findFirstByTenantIdAndProviderFamilyAndEnabledTrueAndDeletedFalseOrderByCreatedAtAsc(
            String tenantId, ProviderFamily providerFamily);

    Mono<Boolean> existsByTenantIdAndProviderFamilyInAndEnabledTrueAndDeletedFalse(
            String tenantId, Collection<ProviderFamily> providerFamilies);
}
