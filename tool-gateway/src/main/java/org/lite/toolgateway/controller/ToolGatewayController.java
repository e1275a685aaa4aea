package org.lite.toolgateway.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.lite.toolgateway.dto.RunToolRequest;
import org.lite.toolgateway.dto.ToolRunResponse;
import org.lite.toolgateway.dto.ToolStatusView;
import org.lite.toolgateway.enums.DecisionReason;
import org.lite.toolgateway.service.TenantContextService;
import org.lite.toolgateway.service.ToolGatewayService;
import org.lite.toolgateway.service.ToolPolicyService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

@Slf4j
@RestController
@RequestMapping("/api/v1/tool-gateway")
@RequiredArgsConstructor
@Tag(name = "Tool Gateway", description = "Authorize and run read-only tools against configured providers")
public class ToolGatewayController {

    private final ToolGatewayService toolGatewayService;
    private final ToolPolicyService toolPolicyService;
    private final TenantContextService tenantContextService;

    @GetMapping("/status")
    @Operation(summary = "Tool status", description = "Whether tools are enabled, which are allowed, and whether a usable provider exists")
    public Mono<ToolStatusView> getToolStatus(ServerWebExchange exchange) {
        return tenantContextService.getTenantId(exchange)
                .flatMap(toolPolicyService::getToolStatus);
    }

    @PostMapping("/run")
    @Operation(summary = "Run a tool", description = "Every outcome, including denials, is audited exactly once")
    public Mono<ResponseEntity<ToolRunResponse>> runTool(@Valid @RequestBody RunToolRequest request,
                                                         ServerWebExchange exchange) {
        String actorUserId = tenantContextService.getActorUserId(exchange);
        return tenantContextService.getTenantId(exchange)
                .flatMap(tenantId -> toolGatewayService.runTool(tenantId, actorUserId, request))
                .map(response -> ResponseEntity.status(statusOf(response)).body(response));
    }

    static HttpStatus statusOf(ToolRunResponse response) {
        switch (response.getDecision()) {
            case ALLOWED:
                return HttpStatus.OK;
            case DENIED:
                return response.getReason() == DecisionReason.PROVIDER_NOT_FOUND
                        ? HttpStatus.NOT_FOUND
                        : HttpStatus.FORBIDDEN;
            case THROTTLED:
                return HttpStatus.TOO_MANY_REQUESTS;
            default:
                if (response.getReason() == DecisionReason.VAULT_FAILURE
                        || response.getReason() == DecisionReason.INTERNAL_ERROR
                        || response.getReason() == DecisionReason.RATE_LIMIT_UNAVAILABLE) {
                    return HttpStatus.INTERNAL_SERVER_ERROR;
                }
                return HttpStatus.BAD_GATEWAY;
        }
    }
}
