package org.lite.toolgateway.service;

import lombok.extern.slf4j.Slf4j;
import org.lite.toolgateway.exception.TenantContextMissingException;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

/**
 * Tenant and actor arrive already resolved by the upstream identity layer.
 */
@Service
@Slf4j
public class TenantContextService {

    public static final String TENANT_HEADER = "X-Tenant-Id";
    public static final String ACTOR_HEADER = "X-Actor-Id";

    private static final int MAX_ID_LENGTH = 128;

    public Mono<String> getTenantId(ServerWebExchange exchange) {
        String tenantId = exchange.getRequest().getHeaders().getFirst(TENANT_HEADER);
        if (tenantId == null || tenantId.isBlank() || tenantId.length() > MAX_ID_LENGTH) {
            log.warn("Request {} {} without a usable {} header", exchange.getRequest().getMethod(),
                    exchange.getRequest().getPath(), TENANT_HEADER);
            return Mono.error(new TenantContextMissingException());
        }
        return Mono.just(tenantId.trim());
    }

    /**
     * @return the acting user, or null for system callers
     */
    public String getActorUserId(ServerWebExchange exchange) {
        String actor = exchange.getRequest().getHeaders().getFirst(ACTOR_HEADER);
        if (actor == null || actor.isBlank()) {
            return null;
        }
        return actor.length() > MAX_ID_LENGTH ? actor.substring(0, MAX_ID_LENGTH) : actor.trim();
    }
}
