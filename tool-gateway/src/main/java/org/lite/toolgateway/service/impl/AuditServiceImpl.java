package org.lite.toolgateway.service.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.lite.toolgateway.config.ToolGatewayProperties;
import org.lite.toolgateway.entity.AuditEvent;
import org.lite.toolgateway.repository.AuditEventRepository;
import org.lite.toolgateway.service.AuditService;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class AuditServiceImpl implements AuditService {

    private final AuditEventRepository auditEventRepository;
    private final ToolGatewayProperties properties;
    private final Clock clock;

    @Override
    public Mono<Void> record(AuditEvent event) {
        if (event.getEventId() == null) {
            event.setEventId(UUID.randomUUID().toString());
        }
        if (event.getTimestamp() == null) {
            event.setTimestamp(LocalDateTime.now(clock));
        }

        return Mono.defer(() -> auditEventRepository.insert(event))
                .timeout(properties.getPersistenceTimeout())
                .doOnSuccess(saved -> log.debug("Audit event {} recorded: {} {} {} for tenant {}",
                        event.getEventId(), event.getAction(), event.getDecision(),
                        event.getReason(), event.getTenantId()))
                .doOnError(e -> log.error("Failed to record audit event {} ({} {} {}) for tenant {}: {}",
                        event.getEventId(), event.getAction(), event.getDecision(), event.getReason(),
                        event.getTenantId(), e.getMessage(), e))
                .onErrorResume(e -> Mono.empty()) // Never mask the decision being audited
                .then();
    }

    @Override
    public Flux<AuditEvent> listRecent(String tenantId, Integer limit) {
        int pageSize = properties.getAudit().resolvePageSize(limit);
        return auditEventRepository.findByTenantIdOrderByTimestampDesc(tenantId, PageRequest.of(0, pageSize));
    }

    @Override
    public Flux<AuditEvent> listForRun(String tenantId, String runId) {
        return auditEventRepository.findByTenantIdAndRunIdOrderByTimestampAsc(tenantId, runId);
    }
}
