package org.lite.toolgateway.repository;

import org.lite.toolgateway.entity.AuditEvent;
import org.springframework.data.domain.Pageable;
import org.springframework.data.repository.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Append-only audit repository: insert and read, no update or delete surface.
 */
@org.springframework.stereotype.Repository
public interface AuditEventRepository extends Repository<AuditEvent, String> {

    /**
     * Insert a new event; fails instead of overwriting when the id exists
     */
    <S extends AuditEvent> Mono<S> insert(S event);

    Flux<AuditEvent> findByTenantIdOrderByTimestampDesc(String tenantId, Pageable pageable);

    Flux<AuditEvent> findByTenantIdAndRunIdOrderByTimestampAsc(String tenantId, String runId);
}
