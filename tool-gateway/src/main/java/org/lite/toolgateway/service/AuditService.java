package org.lite.toolgateway.service;

import org.lite.toolgateway.entity.AuditEvent;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

public interface AuditService {

    /**
     * Append one event. Completes empty even when persistence fails; the
     * failure is logged and never replaces the decision being recorded.
     */
    Mono<Void> record(AuditEvent event);

    /**
     * Most recent events of a tenant, newest first. {@code limit} defaults to
     * 50 and is capped at 200.
     */
    Flux<AuditEvent> listRecent(String tenantId, Integer limit);

    Flux<AuditEvent> listForRun(String tenantId, String runId);
}
