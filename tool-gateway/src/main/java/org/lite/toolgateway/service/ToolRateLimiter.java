package org.lite.toolgateway.service;

import org.lite.toolgateway.enums.RateLimitDecision;
import reactor.core.publisher.Mono;

/**
 * Atomic check-and-increment of a tenant's per-minute budget and, when a run id
 * is supplied, the per-run call cap. A slot is consumed only when both limits
 * admit the call. Errors mean the backing store is unavailable.
 */
public interface ToolRateLimiter {

    Mono<RateLimitDecision> tryAcquire(String tenantId, String runId, int rateLimitPerMinute, int maxToolCallsPerRun);
}
