package org.lite.toolgateway.service.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.lite.toolgateway.config.ToolGatewayProperties;
import org.lite.toolgateway.connector.ConnectorContext;
import org.lite.toolgateway.connector.CredentialResolver;
import org.lite.toolgateway.connector.ToolConnector;
import org.lite.toolgateway.connector.ToolConnectorRegistry;
import org.lite.toolgateway.dto.RunToolRequest;
import org.lite.toolgateway.dto.ToolRunMeta;
import org.lite.toolgateway.dto.ToolRunResponse;
import org.lite.toolgateway.dto.ToolRunResult;
import org.lite.toolgateway.entity.AuditEvent;
import org.lite.toolgateway.entity.ProviderConfig;
import org.lite.toolgateway.entity.ToolPolicy;
import org.lite.toolgateway.enums.AuditAction;
import org.lite.toolgateway.enums.AuditDecision;
import org.lite.toolgateway.enums.DecisionReason;
import org.lite.toolgateway.enums.RateLimitDecision;
import org.lite.toolgateway.enums.ToolKey;
import org.lite.toolgateway.exception.ToolGatewayValidationException;
import org.lite.toolgateway.repository.ProviderConfigRepository;
import org.lite.toolgateway.repository.ToolPolicyRepository;
import org.lite.toolgateway.service.AuditService;
import org.lite.toolgateway.service.SsrfGuardService;
import org.lite.toolgateway.service.ToolGatewayService;
import org.lite.toolgateway.service.ToolRateLimiter;
import org.lite.vault.credential.CredentialVaultException;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Clock;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

/**
 * Tool dispatch pipeline:
 * policy check, provider lookup, SSRF re-validation, rate check, then decrypt
 * and execute. Every check completes before a secret is decrypted or a
 * connection is opened; every terminal outcome is audited exactly once.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ToolGatewayServiceImpl implements ToolGatewayService {

    private final ToolPolicyRepository toolPolicyRepository;
    private final ProviderConfigRepository providerConfigRepository;
    private final SsrfGuardService ssrfGuardService;
    private final ToolRateLimiter toolRateLimiter;
    private final CredentialResolver credentialResolver;
    private final ToolConnectorRegistry toolConnectorRegistry;
    private final AuditService auditService;
    private final ToolGatewayProperties properties;
    private final Clock clock;

    @Override
    public Mono<ToolRunResponse> runTool(String tenantId, String actorUserId, RunToolRequest request) {
        Optional<ToolKey> parsed = ToolKey.fromValue(request.getToolKey());
        if (parsed.isEmpty()) {
            return Mono.error(new ToolGatewayValidationException("Unknown tool key: " + request.getToolKey()
                    + ". Valid keys: " + String.join(", ", ToolKey.names())));
        }

        RunContext run = new RunContext(tenantId, actorUserId, parsed.get(), request.getRunId(),
                request.getInput() != null ? request.getInput() : Collections.emptyMap(), clock.millis());

        Mono<ToolRunResponse> pipeline = checkPolicy(run)
                .onErrorResume(e -> {
                    log.error("Tool run {} for tenant {} failed unexpectedly", run.toolKey, run.tenantId, e);
                    return Mono.just(Outcome.error(DecisionReason.INTERNAL_ERROR, "Internal error"));
                })
                .flatMap(outcome -> finish(run, outcome));

        // Detached from the caller: a disconnect does not cancel the run or its audit write
        return Mono.defer(() -> {
            Sinks.One<ToolRunResponse> sink = Sinks.one();
            pipeline.subscribe(sink::tryEmitValue, sink::tryEmitError);
            return sink.asMono();
        });
    }

    private Mono<Outcome> checkPolicy(RunContext run) {
        return toolPolicyRepository.findByTenantId(run.tenantId)
                .timeout(properties.getPersistenceTimeout())
                .map(policy -> evaluatePolicy(run, policy))
                .defaultIfEmpty(Mono.just(Outcome.denied(DecisionReason.NO_POLICY,
                        "No tool policy configured for this tenant")))
                .flatMap(next -> next);
    }

    private Mono<Outcome> evaluatePolicy(RunContext run, ToolPolicy policy) {
        if (!policy.isToolsEnabled()) {
            return Mono.just(Outcome.denied(DecisionReason.DISABLED, "Tools are disabled for this tenant"));
        }
        if (!policy.allows(run.toolKey)) {
            return Mono.just(Outcome.denied(DecisionReason.NOT_ALLOWLISTED,
                    "Tool " + run.toolKey + " is not allowed by tenant policy"));
        }
        return lookupProvider(run, policy);
    }

    private Mono<Outcome> lookupProvider(RunContext run, ToolPolicy policy) {
        return providerConfigRepository
                .findFirstByTenantIdAndProviderFamilyAndEnabledTrueAndDeletedFalseOrderByCreatedAtAsc(
                        run.tenantId, run.toolKey.getFamily())
                .timeout(properties.getPersistenceTimeout())
                .filter(ProviderConfig::isDispatchable)
                .map(provider -> {
                    Optional<ToolConnector> connector = toolConnectorRegistry.forFamily(provider.getProviderFamily());
                    if (connector.isEmpty()) {
                        log.error("No connector registered for provider family {}", provider.getProviderFamily());
                        return Mono.just(Outcome.error(DecisionReason.INTERNAL_ERROR,
                                "No connector available for " + provider.getProviderFamily()).withProvider(provider));
                    }
                    return checkSsrf(run, policy, provider, connector.get());
                })
                .defaultIfEmpty(Mono.just(Outcome.denied(DecisionReason.PROVIDER_NOT_FOUND,
                        "No active " + run.toolKey.getFamily() + " provider configured for this tenant")))
                .flatMap(next -> next);
    }

    private Mono<Outcome> checkSsrf(RunContext run, ToolPolicy policy, ProviderConfig provider, ToolConnector connector) {
        return ssrfGuardService.validateUrl(provider.getBaseUrl())
                .flatMap(validation -> {
                    if (!validation.isValid()) {
                        return Mono.just(Outcome.denied(DecisionReason.SSRF_BLOCKED,
                                ToolGatewayValidationException.UNSAFE_BASE_URL_MESSAGE).withProvider(provider));
                    }
                    return checkRate(run, policy, provider, connector);
                });
    }

    private Mono<Outcome> checkRate(RunContext run, ToolPolicy policy, ProviderConfig provider, ToolConnector connector) {
        return toolRateLimiter.tryAcquire(run.tenantId, run.runId,
                        policy.getRateLimitPerMinute(), policy.getMaxToolCallsPerRun())
                .onErrorMap(RateLimitUnavailableException::new)
                .flatMap(decision -> {
                    if (decision == RateLimitDecision.MINUTE_LIMIT_EXCEEDED) {
                        return Mono.just(Outcome.throttled(DecisionReason.RATE_LIMITED,
                                "Rate limit of " + policy.getRateLimitPerMinute() + " tool calls per minute exceeded")
                                .withProvider(provider));
                    }
                    if (decision == RateLimitDecision.RUN_LIMIT_EXCEEDED) {
                        return Mono.just(Outcome.throttled(DecisionReason.RUN_LIMIT_EXCEEDED,
                                "Run " + run.runId + " reached its limit of " + policy.getMaxToolCallsPerRun()
                                        + " tool calls").withProvider(provider));
                    }
                    return execute(run, provider, connector);
                })
                .onErrorResume(RateLimitUnavailableException.class, e -> {
                    log.error("Rate limiter unavailable for tenant {}: {}", run.tenantId, e.getCause().toString());
                    return Mono.just(Outcome.error(DecisionReason.RATE_LIMIT_UNAVAILABLE,
                            "Rate limiting is temporarily unavailable").withProvider(provider));
                });
    }

    private Mono<Outcome> execute(RunContext run, ProviderConfig provider, ToolConnector connector) {
        return Mono.fromCallable(() -> credentialResolver.resolve(provider))
                .flatMap(credentials -> connector.execute(run.toolKey, run.input, ConnectorContext.builder()
                                .providerId(provider.getId())
                                .baseUrl(provider.getBaseUrl())
                                .authMode(provider.getAuthMode())
                                .credentials(credentials)
                                .build())
                        .map(result -> result.isSuccess()
                                ? Outcome.allowed(result)
                                : Outcome.failedResult(result))
                        .switchIfEmpty(Mono.fromSupplier(() ->
                                Outcome.error(DecisionReason.CONNECTOR_ERROR, "Connector returned no result")))
                        .onErrorResume(e -> {
                            boolean timedOut = isTimeout(e);
                            log.error("Connector call for tool {} (provider {}) failed: {}",
                                    run.toolKey, provider.getId(), e.toString());
                            return Mono.just(timedOut
                                    ? Outcome.error(DecisionReason.CONNECTOR_TIMEOUT, "Connector call timed out")
                                    : Outcome.error(DecisionReason.CONNECTOR_ERROR, "Connector call failed"));
                        }))
                .onErrorResume(CredentialVaultException.class, e -> {
                    log.error("Tool {} aborted for tenant {}: credentials of provider {} could not be decrypted",
                            run.toolKey, run.tenantId, provider.getId());
                    return Mono.just(Outcome.error(DecisionReason.VAULT_FAILURE,
                            "Provider credentials could not be decrypted"));
                })
                .map(outcome -> outcome.withProvider(provider));
    }

    private Mono<ToolRunResponse> finish(RunContext run, Outcome outcome) {
        long latencyMs = clock.millis() - run.startedAt;
        logDecision(run, outcome, latencyMs);

        AuditEvent event = AuditEvent.builder()
                .tenantId(run.tenantId)
                .actorUserId(run.actorUserId)
                .action(AuditAction.TOOL_RUN)
                .toolKey(run.toolKey.name())
                .providerFamily(run.toolKey.getFamily())
                .providerId(outcome.provider != null ? outcome.provider.getId() : null)
                .decision(outcome.decision)
                .reason(outcome.reason)
                .runId(run.runId)
                .latencyMs(latencyMs)
                .details(outcome.message)
                .requestMeta(requestMeta(outcome.result))
                .build();

        ToolRunResponse response = ToolRunResponse.builder()
                .toolKey(run.toolKey.name())
                .runId(run.runId)
                .decision(outcome.decision)
                .reason(outcome.reason)
                .success(outcome.decision == AuditDecision.ALLOWED)
                .data(outcome.result != null ? outcome.result.getData() : null)
                .meta(outcome.result != null ? outcome.result.getMeta() : null)
                .error(outcome.decision == AuditDecision.ALLOWED ? null : outcome.message)
                .latencyMs(latencyMs)
                .build();

        return auditService.record(event).thenReturn(response);
    }

    private void logDecision(RunContext run, Outcome outcome, long latencyMs) {
        switch (outcome.decision) {
            case ALLOWED:
                log.info("Tool {} allowed for tenant {} (run {}, {} ms)",
                        run.toolKey, run.tenantId, run.runId, latencyMs);
                break;
            case DENIED:
            case THROTTLED:
                log.warn("Tool {} {} for tenant {} (run {}): {}",
                        run.toolKey, outcome.decision.toValue(), run.tenantId, run.runId, outcome.reason.getCode());
                break;
            default:
                log.error("Tool {} errored for tenant {} (run {}): {}",
                        run.toolKey, run.tenantId, run.runId, outcome.reason.getCode());
        }
    }

    private static Map<String, Object> requestMeta(ToolRunResult result) {
        if (result == null || result.getMeta() == null) {
            return null;
        }
        ToolRunMeta meta = result.getMeta();
        Map<String, Object> requestMeta = new HashMap<>();
        if (meta.getTable() != null) {
            requestMeta.put("table", meta.getTable());
        }
        if (meta.getRecordCount() != null) {
            requestMeta.put("recordCount", meta.getRecordCount());
        }
        if (meta.getTotalCount() != null) {
            requestMeta.put("totalCount", meta.getTotalCount());
        }
        return requestMeta.isEmpty() ? null : requestMeta;
    }

    static boolean isTimeout(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof TimeoutException
                    || current instanceof io.netty.handler.timeout.TimeoutException) {
                return true;
            }
            current = current.getCause() == current ? null : current.getCause();
        }
        return false;
    }

    private static final class RunContext {
        private final String tenantId;
        private final String actorUserId;
        private final ToolKey toolKey;
        private final String runId;
        private final Map<String, Object> input;
        private final long startedAt;

        private RunContext(String tenantId, String actorUserId, ToolKey toolKey, String runId,
                           Map<String, Object> input, long startedAt) {
            this.tenantId = tenantId;
            this.actorUserId = actorUserId;
            this.toolKey = toolKey;
            this.runId = runId;
            this.input = input;
            this.startedAt = startedAt;
        }
    }

    /**
     * Terminal state of one run.
     */
    private static final class Outcome {
        private final AuditDecision decision;
        private final DecisionReason reason;
        private final String message;
        private final ToolRunResult result;
        private ProviderConfig provider;

        private Outcome(AuditDecision decision, DecisionReason reason, String message, ToolRunResult result) {
            this.decision = decision;
            this.reason = reason;
            this.message = message;
            this.result = result;
        }

        static Outcome allowed(ToolRunResult result) {
            return new Outcome(AuditDecision.ALLOWED, DecisionReason.OK, "OK", result);
        }

        static Outcome denied(DecisionReason reason, String message) {
            return new Outcome(AuditDecision.DENIED, reason, message, null);
        }

        static Outcome throttled(DecisionReason reason, String message) {
            return new Outcome(AuditDecision.THROTTLED, reason, message, null);
        }

        static Outcome error(DecisionReason reason, String message) {
            return new Outcome(AuditDecision.ERROR, reason, message, null);
        }

        static Outcome failedResult(ToolRunResult result) {
            return new Outcome(AuditDecision.ERROR, DecisionReason.CONNECTOR_ERROR, result.getError(), result);
        }

        Outcome withProvider(ProviderConfig provider) {
            this.provider = provider;
            return this;
        }
    }

    private static final class RateLimitUnavailableException extends RuntimeException {
        private RateLimitUnavailableException(Throwable cause) {
            super(cause);
        }
    }
}
