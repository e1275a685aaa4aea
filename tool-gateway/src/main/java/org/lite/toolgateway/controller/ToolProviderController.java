package org.lite.toolgateway.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.lite.toolgateway.dto.ConnectionTestResult;
import org.lite.toolgateway.dto.CreateProviderRequest;
import org.lite.toolgateway.dto.ProviderView;
import org.lite.toolgateway.dto.UpdateProviderRequest;
import org.lite.toolgateway.service.TenantContextService;
import org.lite.toolgateway.service.ToolProviderService;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Slf4j
@RestController
@RequestMapping("/api/v1/tool-gateway/providers")
@RequiredArgsConstructor
@Tag(name = "Tool Providers", description = "Per-tenant connections to external systems. Secrets are write-only.")
public class ToolProviderController {

    private final ToolProviderService toolProviderService;
    private final TenantContextService tenantContextService;

    @GetMapping
    @Operation(summary = "List providers", description = "Redacted views of every non-deleted provider of the tenant")
    public Flux<ProviderView> listProviders(ServerWebExchange exchange) {
        return tenantContextService.getTenantId(exchange)
                .flatMapMany(toolProviderService::listProviders);
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    @Operation(summary = "Create provider", description = "Rejects unsafe base URLs before anything is stored")
    public Mono<ProviderView> createProvider(@Valid @RequestBody CreateProviderRequest request,
                                             ServerWebExchange exchange) {
        return tenantContextService.getTenantId(exchange)
                .flatMap(tenantId -> toolProviderService.createProvider(tenantId, request));
    }

    @GetMapping("/{id}")
    public Mono<ProviderView> getProvider(@PathVariable String id, ServerWebExchange exchange) {
        return tenantContextService.getTenantId(exchange)
                .flatMap(tenantId -> toolProviderService.getProvider(id, tenantId));
    }

    @PatchMapping("/{id}")
    @Operation(summary = "Update provider", description = "Omitted secrets are kept; an empty string clears a secret")
    public Mono<ProviderView> updateProvider(@PathVariable String id,
                                             @Valid @RequestBody UpdateProviderRequest request,
                                             ServerWebExchange exchange) {
        return tenantContextService.getTenantId(exchange)
                .flatMap(tenantId -> toolProviderService.updateProvider(id, tenantId, request));
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    @Operation(summary = "Delete provider", description = "Soft delete; the row is kept for audit continuity")
    public Mono<Void> deleteProvider(@PathVariable String id, ServerWebExchange exchange) {
        return tenantContextService.getTenantId(exchange)
                .flatMap(tenantId -> toolProviderService.deleteProvider(id, tenantId));
    }

    @PostMapping("/{id}/test-connection")
    @Operation(summary = "Test provider connection")
    public Mono<ConnectionTestResult> testConnection(@PathVariable String id, ServerWebExchange exchange) {
        String actorUserId = tenantContextService.getActorUserId(exchange);
        return tenantContextService.getTenantId(exchange)
                .flatMap(tenantId -> toolProviderService.testConnection(id, tenantId, actorUserId));
    }
}
