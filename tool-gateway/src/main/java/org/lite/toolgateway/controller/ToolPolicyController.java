package org.lite.toolgateway.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.lite.toolgateway.dto.ToolPolicyView;
import org.lite.toolgateway.dto.UpsertToolPolicyRequest;
import org.lite.toolgateway.service.TenantContextService;
import org.lite.toolgateway.service.ToolPolicyService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/tool-gateway/policy")
@RequiredArgsConstructor
@Tag(name = "Tool Policy", description = "The tenant's single tool authorization policy")
public class ToolPolicyController {

    private final ToolPolicyService toolPolicyService;
    private final TenantContextService tenantContextService;

    @GetMapping
    public Mono<ToolPolicyView> getPolicy(ServerWebExchange exchange) {
        return tenantContextService.getTenantId(exchange)
                .flatMap(toolPolicyService::getPolicy);
    }

    @PutMapping
    @Operation(summary = "Create or update the tool policy",
            description = "Unknown tool identifiers reject the request and leave the stored policy unchanged")
    public Mono<ToolPolicyView> upsertPolicy(@Valid @RequestBody UpsertToolPolicyRequest request,
                                             ServerWebExchange exchange) {
        String actorUserId = tenantContextService.getActorUserId(exchange);
        return tenantContextService.getTenantId(exchange)
                .flatMap(tenantId -> toolPolicyService.upsertPolicy(tenantId, request, actorUserId));
    }
}
