package org.lite.toolgateway.repository;

import org.lite.toolgateway.entity.ToolPolicy;
import org.springframework.data.mongodb.repository.ReactiveMongoRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

@Repository
public interface ToolPolicyRepository extends ReactiveMongoRepository<ToolPolicy, String>,
        ToolPolicyRepositoryCustom {

    Mono<ToolPolicy> findByTenantId(String tenantId);
}
