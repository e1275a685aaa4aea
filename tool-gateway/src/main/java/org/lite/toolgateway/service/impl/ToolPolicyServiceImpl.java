package org.lite.toolgateway.service.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.lite.toolgateway.config.ToolGatewayProperties;
import org.lite.toolgateway.dto.ToolPolicyView;
import org.lite.toolgateway.dto.ToolStatusView;
import org.lite.toolgateway.dto.UpsertToolPolicyRequest;
import org.lite.toolgateway.entity.AuditEvent;
import org.lite.toolgateway.enums.AuditAction;
import org.lite.toolgateway.enums.AuditDecision;
import org.lite.toolgateway.enums.DecisionReason;
import org.lite.toolgateway.enums.ProviderFamily;
import org.lite.toolgateway.enums.ToolKey;
import org.lite.toolgateway.exception.PolicyNotFoundException;
import org.lite.toolgateway.exception.ToolGatewayValidationException;
import org.lite.toolgateway.repository.ProviderConfigRepository;
import org.lite.toolgateway.repository.ToolPolicyRepository;
import org.lite.toolgateway.service.AuditService;
import org.lite.toolgateway.service.ToolPolicyService;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class ToolPolicyServiceImpl implements ToolPolicyService {

    private final ToolPolicyRepository toolPolicyRepository;
    private final ProviderConfigRepository providerConfigRepository;
    private final AuditService auditService;
    private final ToolGatewayProperties properties;

    @Override
    public Mono<ToolPolicyView> upsertPolicy(String tenantId, UpsertToolPolicyRequest request, String actorUserId) {
        return Mono.defer(() -> {
            List<String> allowedTools = request.getAllowedTools() != null
                    ? new ArrayList<>(new LinkedHashSet<>(request.getAllowedTools()))
                    : null;

            if (allowedTools != null) {
                List<String> unknown = ToolKey.unknownValues(allowedTools);
                if (!unknown.isEmpty()) {
                    log.warn("Rejected policy upsert for tenant {}: unknown tools {}", tenantId, unknown);
                    return Mono.error(new ToolGatewayValidationException(
                            "Unknown tool identifiers: " + String.join(", ", unknown)));
                }
            }

            ToolGatewayProperties.Policy defaults = properties.getPolicy();
            return toolPolicyRepository.upsertForTenant(
                            tenantId,
                            Boolean.TRUE.equals(request.getIsToolsEnabled()),
                            allowedTools,
                            request.getRateLimitPerMinute(),
                            request.getMaxToolCallsPerRun(),
                            defaults.getDefaultRateLimitPerMinute(),
                            defaults.getDefaultMaxToolCallsPerRun(),
                            actorUserId)
                    .flatMap(policy -> {
                        log.info("Tool policy updated for tenant {} by {}: enabled={}, tools={}",
                                tenantId, actorUserId, policy.isToolsEnabled(), policy.getAllowedTools());
                        return auditService.record(AuditEvent.builder()
                                        .tenantId(tenantId)
                                        .actorUserId(actorUserId)
                                        .action(AuditAction.POLICY_CHANGE)
                                        .decision(AuditDecision.ALLOWED)
                                        .reason(DecisionReason.POLICY_UPDATED)
                                        .details(String.format("isToolsEnabled=%s, allowedTools=%s, rateLimitPerMinute=%d, maxToolCallsPerRun=%d",
                                                policy.isToolsEnabled(), policy.getAllowedTools(),
                                                policy.getRateLimitPerMinute(), policy.getMaxToolCallsPerRun()))
                                        .build())
                                .thenReturn(ToolPolicyView.from(policy));
                    });
        });
    }

    @Override
    public Mono<ToolPolicyView> getPolicy(String tenantId) {
        return toolPolicyRepository.findByTenantId(tenantId)
                .map(ToolPolicyView::from)
                .switchIfEmpty(Mono.error(new PolicyNotFoundException(tenantId)));
    }

    @Override
    public Mono<ToolStatusView> getToolStatus(String tenantId) {
        return toolPolicyRepository.findByTenantId(tenantId)
                .map(policy -> ToolStatusView.builder()
                        .toolsEnabled(policy.isToolsEnabled())
                        .availableTools(policy.allowedToolKeys().stream()
                                .map(ToolKey::name)
                                .collect(Collectors.toList()))
                        .build())
                .defaultIfEmpty(ToolStatusView.builder()
                        .toolsEnabled(false)
                        .availableTools(Collections.emptyList())
                        .build())
                .flatMap(status -> hasUsableProvider(tenantId, status.getAvailableTools())
                        .map(usable -> {
                            status.setHasUsableProvider(usable);
                            return status;
                        }));
    }

    /**
     * Families serving the available tools; the whole catalog when none are available.
     */
    private Mono<Boolean> hasUsableProvider(String tenantId, List<String> availableTools) {
        Set<ToolKey> tools = availableTools.isEmpty()
                ? Set.copyOf(Arrays.asList(ToolKey.values()))
                : ToolKey.parseKnown(availableTools);
        Set<ProviderFamily> families = ToolKey.familiesOf(tools);
        return providerConfigRepository.existsByTenantIdAndProviderFamilyInAndEnabledTrueAndDeletedFalse(
                tenantId, families);
    }
}
