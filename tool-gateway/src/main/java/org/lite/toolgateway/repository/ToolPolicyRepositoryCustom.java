package org.lite.toolgateway.repository;

import org.lite.toolgateway.entity.ToolPolicy;
import reactor.core.publisher.Mono;

import java.util.List;

public interface ToolPolicyRepositoryCustom {

    /**
     * Insert-or-update the single policy row of a tenant in one atomic
     * operation. Null arguments leave the stored value untouched (or take the
     * supplied insert default when the row is created).
     */
    Mono<ToolPolicy> upsertForTenant(String tenantId,
                                     boolean toolsEnabled,
                                     List<String> allowedTools,
                                     Integer rateLimitPerMinute,
                                     Integer maxToolCallsPerRun,
                                     int defaultRateLimitPerMinute,
                                     int defaultMaxToolCallsPerRun,
                                     String actorUserId);
}
