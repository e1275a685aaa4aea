package org.lite.toolgateway.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.lite.toolgateway.entity.AuditEvent;
import org.lite.toolgateway.service.AuditService;
import org.lite.toolgateway.service.TenantContextService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Flux;

/**
 * Read-only view of the tenant's tool audit trail
 */
@RestController
@RequestMapping("/api/v1/tool-gateway/audit-events")
@RequiredArgsConstructor
@Tag(name = "Tool Audit", description = "Tool gateway audit events, newest first")
public class ToolAuditController {

    private final AuditService auditService;
    private final TenantContextService tenantContextService;

    @GetMapping
    @Operation(summary = "List audit events", description = "limit defaults to 50 and is capped at 200; runId narrows to one agent run")
    public Flux<AuditEvent> listAuditEvents(@RequestParam(required = false) Integer limit,
                                            @RequestParam(required = false) String runId,
                                            ServerWebExchange exchange) {
        return tenantContextService.getTenantId(exchange)
                .flatMapMany(tenantId -> runId != null
                        ? auditService.listForRun(tenantId, runId)
                        : auditService.listRecent(tenantId, limit));
    }
}
