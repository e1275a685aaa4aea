package service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.lite.toolgateway.config.ToolGatewayProperties;
import org.lite.toolgateway.connector.ConnectorContext;
import org.lite.toolgateway.connector.CredentialResolver;
import org.lite.toolgateway.connector.ResolvedCredentials;
import org.lite.toolgateway.connector.ToolConnector;
import org.lite.toolgateway.connector.ToolConnectorRegistry;
import org.lite.toolgateway.dto.RunToolRequest;
import org.lite.toolgateway.dto.ToolRunMeta;
import org.lite.toolgateway.dto.ToolRunResult;
import org.lite.toolgateway.entity.AuditEvent;
import org.lite.toolgateway.entity.ProviderConfig;
import org.lite.toolgateway.entity.ToolPolicy;
import org.lite.toolgateway.enums.AuditAction;
import org.lite.toolgateway.enums.AuditDecision;
import org.lite.toolgateway.enums.AuthMode;
import org.lite.toolgateway.enums.DecisionReason;
import org.lite.toolgateway.enums.ProviderFamily;
import org.lite.toolgateway.enums.RateLimitDecision;
import org.lite.toolgateway.enums.ToolKey;
import org.lite.toolgateway.exception.ToolGatewayValidationException;
import org.lite.toolgateway.repository.AuditEventRepository;
import org.lite.toolgateway.repository.ProviderConfigRepository;
import org.lite.toolgateway.repository.ToolPolicyRepository;
import org.lite.toolgateway.service.AuditService;
import org.lite.toolgateway.service.SsrfGuardService;
import org.lite.toolgateway.service.ToolRateLimiter;
import org.lite.toolgateway.service.impl.AuditServiceImpl;
import org.lite.toolgateway.service.impl.ToolGatewayServiceImpl;
import org.lite.toolgateway.validation.UrlValidationResult;
import org.lite.vault.credential.CredentialVaultException;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ToolGatewayServiceImplTest {

    private static final String TENANT = "tenant-a";
    private static final String ACTOR = "user-1";
    private static final String RUN_ID = "run-42";
    private static final String BASE_URL = "https://acme.service-now.com";

    @Mock
    private ToolPolicyRepository toolPolicyRepository;
    @Mock
    private ProviderConfigRepository providerConfigRepository;
    @Mock
    private SsrfGuardService ssrfGuardService;
    @Mock
    private ToolRateLimiter toolRateLimiter;
    @Mock
    private CredentialResolver credentialResolver;
    @Mock
    private ToolConnector connector;
    @Mock
    private AuditService auditService;

    private ToolGatewayProperties properties;
    private ToolGatewayServiceImpl toolGatewayService;

    @BeforeEach
    void setUp() {
        when(connector.family()).thenReturn(ProviderFamily.SERVICENOW);
        lenient().when(auditService.record(any(AuditEvent.class))).thenReturn(Mono.empty());
        properties = new ToolGatewayProperties();
        properties.setPersistenceTimeout(Duration.ofMillis(200));

        toolGatewayService = new ToolGatewayServiceImpl(
                toolPolicyRepository,
                providerConfigRepository,
                ssrfGuardService,
                toolRateLimiter,
                credentialResolver,
                new ToolConnectorRegistry(List.of(connector)),
                auditService,
                properties,
                Clock.fixed(Instant.parse("2026-01-15T10:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    void testUnknownToolKeyIsRejectedWithoutAudit() {
        StepVerifier.create(toolGatewayService.runTool(TENANT, ACTOR, request("DROP_TABLE")))
                .expectError(ToolGatewayValidationException.class)
                .verify();

        verifyNoInteractions(toolPolicyRepository, auditService);
    }

    @Test
    void testMissingPolicyIsDenied() {
        // Given
        when(toolPolicyRepository.findByTenantId(TENANT)).thenReturn(Mono.empty());

        // When & Then
        StepVerifier.create(toolGatewayService.runTool(TENANT, ACTOR, request("QUERY_INCIDENTS")))
                .assertNext(response -> {
                    assertEquals(AuditDecision.DENIED, response.getDecision());
                    assertEquals(DecisionReason.NO_POLICY, response.getReason());
                    assertFalse(response.isSuccess());
                })
                .verifyComplete();

        AuditEvent audited = singleAuditEvent();
        assertEquals(AuditAction.TOOL_RUN, audited.getAction());
        assertEquals(DecisionReason.NO_POLICY, audited.getReason());
        assertEquals(ACTOR, audited.getActorUserId());
        assertEquals(RUN_ID, audited.getRunId());
        verifyNoInteractions(providerConfigRepository, credentialResolver);
    }

    @Test
    void testDisabledPolicyIsDenied() {
        ToolPolicy policy = policy("QUERY_INCIDENTS");
        policy.setToolsEnabled(false);
        when(toolPolicyRepository.findByTenantId(TENANT)).thenReturn(Mono.just(policy));

        StepVerifier.create(toolGatewayService.runTool(TENANT, ACTOR, request("QUERY_INCIDENTS")))
                .assertNext(response -> assertEquals(DecisionReason.DISABLED, response.getReason()))
                .verifyComplete();

        assertEquals(AuditDecision.DENIED, singleAuditEvent().getDecision());
        verifyNoInteractions(providerConfigRepository);
    }

    @Test
    void testToolOutsideAllowlistIsDenied() {
        when(toolPolicyRepository.findByTenantId(TENANT)).thenReturn(Mono.just(policy("QUERY_CHANGES")));

        StepVerifier.create(toolGatewayService.runTool(TENANT, ACTOR, request("QUERY_INCIDENTS")))
                .assertNext(response -> {
                    assertEquals(AuditDecision.DENIED, response.getDecision());
                    assertEquals(DecisionReason.NOT_ALLOWLISTED, response.getReason());
                })
                .verifyComplete();

        singleAuditEvent();
        verifyNoInteractions(providerConfigRepository, toolRateLimiter);
    }

    @Test
    void testMissingProviderIsDenied() {
        givenAllowingPolicy();
        when(providerConfigRepository.findFirstByTenantIdAndProviderFamilyAndEnabledTrueAndDeletedFalseOrderByCreatedAtAsc(
                TENANT, ProviderFamily.SERVICENOW)).thenReturn(Mono.empty());

        StepVerifier.create(toolGatewayService.runTool(TENANT, ACTOR, request("QUERY_INCIDENTS")))
                .assertNext(response -> assertEquals(DecisionReason.PROVIDER_NOT_FOUND, response.getReason()))
                .verifyComplete();

        assertNull(singleAuditEvent().getProviderId());
        verifyNoInteractions(ssrfGuardService);
    }

    @Test
    void testSoftDeletedProviderIsNeverDispatched() {
        // Given - a row that slipped through the query with deleted=true
        givenAllowingPolicy();
        ProviderConfig deleted = provider();
        deleted.setDeleted(true);
        when(providerConfigRepository.findFirstByTenantIdAndProviderFamilyAndEnabledTrueAndDeletedFalseOrderByCreatedAtAsc(
                TENANT, ProviderFamily.SERVICENOW)).thenReturn(Mono.just(deleted));

        // When & Then
        StepVerifier.create(toolGatewayService.runTool(TENANT, ACTOR, request("QUERY_INCIDENTS")))
                .assertNext(response -> assertEquals(DecisionReason.PROVIDER_NOT_FOUND, response.getReason()))
                .verifyComplete();

        verifyNoInteractions(ssrfGuardService, credentialResolver);
    }

    @Test
    void testUnsafeBaseUrlIsBlockedBeforeDecryption() {
        givenAllowingPolicy();
        givenProvider();
        when(ssrfGuardService.validateUrl(BASE_URL))
                .thenReturn(Mono.just(UrlValidationResult.rejected(UrlValidationResult.RESTRICTED_ADDRESS)));

        StepVerifier.create(toolGatewayService.runTool(TENANT, ACTOR, request("QUERY_INCIDENTS")))
                .assertNext(response -> {
                    assertEquals(AuditDecision.DENIED, response.getDecision());
                    assertEquals(DecisionReason.SSRF_BLOCKED, response.getReason());
                    assertEquals("Base URL is not allowed", response.getError());
                })
                .verifyComplete();

        assertEquals("provider-1", singleAuditEvent().getProviderId());
        verifyNoInteractions(toolRateLimiter, credentialResolver);
        verify(connector, never()).execute(any(), any(), any());
    }

    @Test
    void testMinuteRateLimitThrottles() {
        givenDispatchableProvider();
        when(toolRateLimiter.tryAcquire(TENANT, RUN_ID, 60, 10))
                .thenReturn(Mono.just(RateLimitDecision.MINUTE_LIMIT_EXCEEDED));

        StepVerifier.create(toolGatewayService.runTool(TENANT, ACTOR, request("QUERY_INCIDENTS")))
                .assertNext(response -> {
                    assertEquals(AuditDecision.THROTTLED, response.getDecision());
                    assertEquals(DecisionReason.RATE_LIMITED, response.getReason());
                })
                .verifyComplete();

        singleAuditEvent();
        verifyNoInteractions(credentialResolver);
    }

    @Test
    void testRunLimitThrottles() {
        givenDispatchableProvider();
        when(toolRateLimiter.tryAcquire(TENANT, RUN_ID, 60, 10))
                .thenReturn(Mono.just(RateLimitDecision.RUN_LIMIT_EXCEEDED));

        StepVerifier.create(toolGatewayService.runTool(TENANT, ACTOR, request("QUERY_INCIDENTS")))
                .assertNext(response -> assertEquals(DecisionReason.RUN_LIMIT_EXCEEDED, response.getReason()))
                .verifyComplete();

        assertEquals(AuditDecision.THROTTLED, singleAuditEvent().getDecision());
    }

    @Test
    void testUnavailableRateLimiterFailsClosed() {
        givenDispatchableProvider();
        when(toolRateLimiter.tryAcquire(anyString(), any(), anyInt(), anyInt()))
                .thenReturn(Mono.error(new IllegalStateException("redis down")));

        StepVerifier.create(toolGatewayService.runTool(TENANT, ACTOR, request("QUERY_INCIDENTS")))
                .assertNext(response -> {
                    assertEquals(AuditDecision.ERROR, response.getDecision());
                    assertEquals(DecisionReason.RATE_LIMIT_UNAVAILABLE, response.getReason());
                })
                .verifyComplete();

        singleAuditEvent();
        verifyNoInteractions(credentialResolver);
    }

    @Test
    void testVaultFailureAbortsBeforeConnectorCall() {
        givenAcquiredRun();
        when(credentialResolver.resolve(any(ProviderConfig.class)))
                .thenThrow(new CredentialVaultException("Credential decryption failed"));

        StepVerifier.create(toolGatewayService.runTool(TENANT, ACTOR, request("QUERY_INCIDENTS")))
                .assertNext(response -> {
                    assertEquals(AuditDecision.ERROR, response.getDecision());
                    assertEquals(DecisionReason.VAULT_FAILURE, response.getReason());
                })
                .verifyComplete();

        assertEquals(DecisionReason.VAULT_FAILURE, singleAuditEvent().getReason());
        verify(connector, never()).execute(any(), any(), any());
    }

    @Test
    void testSuccessfulRunIsAllowedAndAudited() {
        // Given
        givenAcquiredRun();
        when(credentialResolver.resolve(any(ProviderConfig.class))).thenReturn(ResolvedCredentials.builder()
                .username("svc").password("pw").build());
        ToolRunResult result = ToolRunResult.builder()
                .success(true)
                .data(Map.of("records", List.of(Map.of("number", "INC001"), Map.of("number", "INC002"))))
                .meta(ToolRunMeta.builder().table("incident").recordCount(2).totalCount(7).build())
                .build();
        when(connector.execute(eq(ToolKey.QUERY_INCIDENTS), any(), any(ConnectorContext.class)))
                .thenReturn(Mono.just(result));

        // When & Then
        StepVerifier.create(toolGatewayService.runTool(TENANT, ACTOR, request("QUERY_INCIDENTS")))
                .assertNext(response -> {
                    assertTrue(response.isSuccess());
                    assertEquals(AuditDecision.ALLOWED, response.getDecision());
                    assertEquals(DecisionReason.OK, response.getReason());
                    assertEquals("incident", response.getMeta().getTable());
                    assertNull(response.getError());
                })
                .verifyComplete();

        AuditEvent audited = singleAuditEvent();
        assertEquals("QUERY_INCIDENTS", audited.getToolKey());
        assertEquals(ProviderFamily.SERVICENOW, audited.getProviderFamily());
        assertEquals("incident", audited.getRequestMeta().get("table"));
        assertEquals(2, audited.getRequestMeta().get("recordCount"));
        assertEquals(7, audited.getRequestMeta().get("totalCount"));
        assertFalse(String.valueOf(audited).contains("pw"));
    }

    @Test
    void testConnectorFailureResultIsReportedAsError() {
        givenAcquiredRun();
        when(credentialResolver.resolve(any(ProviderConfig.class))).thenReturn(ResolvedCredentials.none());
        when(connector.execute(eq(ToolKey.QUERY_INCIDENTS), any(), any(ConnectorContext.class)))
                .thenReturn(Mono.just(ToolRunResult.failure(ToolRunMeta.forTable("incident"),
                        "ServiceNow returned HTTP 401")));

        StepVerifier.create(toolGatewayService.runTool(TENANT, ACTOR, request("QUERY_INCIDENTS")))
                .assertNext(response -> {
                    assertEquals(AuditDecision.ERROR, response.getDecision());
                    assertEquals(DecisionReason.CONNECTOR_ERROR, response.getReason());
                    assertEquals("ServiceNow returned HTTP 401", response.getError());
                })
                .verifyComplete();

        singleAuditEvent();
    }

    @Test
    void testConnectorTimeoutIsDistinguished() {
        givenAcquiredRun();
        when(credentialResolver.resolve(any(ProviderConfig.class))).thenReturn(ResolvedCredentials.none());
        when(connector.execute(eq(ToolKey.QUERY_INCIDENTS), any(), any(ConnectorContext.class)))
                .thenReturn(Mono.error(new TimeoutException("Did not observe any item within 15000ms")));

        StepVerifier.create(toolGatewayService.runTool(TENANT, ACTOR, request("QUERY_INCIDENTS")))
                .assertNext(response -> assertEquals(DecisionReason.CONNECTOR_TIMEOUT, response.getReason()))
                .verifyComplete();

        assertEquals(AuditDecision.ERROR, singleAuditEvent().getDecision());
    }

    @Test
    void testConnectorTransportErrorIsReportedGenerically() {
        givenAcquiredRun();
        when(credentialResolver.resolve(any(ProviderConfig.class))).thenReturn(ResolvedCredentials.none());
        when(connector.execute(eq(ToolKey.QUERY_INCIDENTS), any(), any(ConnectorContext.class)))
                .thenReturn(Mono.error(new IllegalStateException("connection reset by 10.0.0.7")));

        StepVerifier.create(toolGatewayService.runTool(TENANT, ACTOR, request("QUERY_INCIDENTS")))
                .assertNext(response -> {
                    assertEquals(DecisionReason.CONNECTOR_ERROR, response.getReason());
                    assertFalse(response.getError().contains("10.0.0.7"));
                })
                .verifyComplete();

        singleAuditEvent();
    }

    @Test
    void testRepositoryFailureStillProducesOneAuditedError() {
        when(toolPolicyRepository.findByTenantId(TENANT)).thenReturn(Mono.error(new IllegalStateException("mongo down")));

        StepVerifier.create(toolGatewayService.runTool(TENANT, ACTOR, request("QUERY_INCIDENTS")))
                .assertNext(response -> assertEquals(DecisionReason.INTERNAL_ERROR, response.getReason()))
                .verifyComplete();

        assertEquals(AuditDecision.ERROR, singleAuditEvent().getDecision());
    }

    @Test
    void testStalledPolicyLookupEndsAsInternalError() {
        // Given
        when(toolPolicyRepository.findByTenantId(TENANT)).thenReturn(Mono.never());

        // When & Then
        StepVerifier.create(toolGatewayService.runTool(TENANT, ACTOR, request("QUERY_INCIDENTS")))
                .assertNext(response -> {
                    assertEquals(AuditDecision.ERROR, response.getDecision());
                    assertEquals(DecisionReason.INTERNAL_ERROR, response.getReason());
                })
                .expectComplete()
                .verify(Duration.ofSeconds(3));

        assertEquals(DecisionReason.INTERNAL_ERROR, singleAuditEvent().getReason());
        verifyNoInteractions(providerConfigRepository);
    }

    @Test
    void testStalledProviderLookupEndsAsInternalError() {
        givenAllowingPolicy();
        when(providerConfigRepository.findFirstByTenantIdAndProviderFamilyAndEnabledTrueAndDeletedFalseOrderByCreatedAtAsc(
                TENANT, ProviderFamily.SERVICENOW)).thenReturn(Mono.never());

        StepVerifier.create(toolGatewayService.runTool(TENANT, ACTOR, request("QUERY_INCIDENTS")))
                .assertNext(response -> assertEquals(DecisionReason.INTERNAL_ERROR, response.getReason()))
                .expectComplete()
                .verify(Duration.ofSeconds(3));

        singleAuditEvent();
        verifyNoInteractions(ssrfGuardService, toolRateLimiter, credentialResolver);
    }

    @Test
    void testDenialIsReturnedWhenAuditStoreStalls() {
        // Given - the real audit service over a store that never answers
        AuditEventRepository auditEventRepository = mock(AuditEventRepository.class);
        when(auditEventRepository.insert(any(AuditEvent.class))).thenReturn(Mono.never());
        Clock clock = Clock.fixed(Instant.parse("2026-01-15T10:00:00Z"), ZoneOffset.UTC);
        ToolGatewayServiceImpl service = new ToolGatewayServiceImpl(
                toolPolicyRepository,
                providerConfigRepository,
                ssrfGuardService,
                toolRateLimiter,
                credentialResolver,
                new ToolConnectorRegistry(List.of(connector)),
                new AuditServiceImpl(auditEventRepository, properties, clock),
                properties,
                clock);
        when(toolPolicyRepository.findByTenantId(TENANT)).thenReturn(Mono.empty());

        // When & Then
        StepVerifier.create(service.runTool(TENANT, ACTOR, request("QUERY_INCIDENTS")))
                .assertNext(response -> assertEquals(DecisionReason.NO_POLICY, response.getReason()))
                .expectComplete()
                .verify(Duration.ofSeconds(3));

        verify(auditEventRepository).insert(any(AuditEvent.class));
    }

    private AuditEvent singleAuditEvent() {
        ArgumentCaptor<AuditEvent> captor = ArgumentCaptor.forClass(AuditEvent.class);
        verify(auditService, times(1)).record(captor.capture());
        return captor.getValue();
    }

    private void givenAllowingPolicy() {
        when(toolPolicyRepository.findByTenantId(TENANT)).thenReturn(Mono.just(policy("QUERY_INCIDENTS", "GET_RECORD")));
    }

    private void givenProvider() {
        when(providerConfigRepository.findFirstByTenantIdAndProviderFamilyAndEnabledTrueAndDeletedFalseOrderByCreatedAtAsc(
                TENANT, ProviderFamily.SERVICENOW)).thenReturn(Mono.just(provider()));
    }

    private void givenDispatchableProvider() {
        givenAllowingPolicy();
        givenProvider();
        when(ssrfGuardService.validateUrl(BASE_URL)).thenReturn(Mono.just(UrlValidationResult.ok()));
    }

    private void givenAcquiredRun() {
        givenDispatchableProvider();
        when(toolRateLimiter.tryAcquire(TENANT, RUN_ID, 60, 10)).thenReturn(Mono.just(RateLimitDecision.ACQUIRED));
    }

    private static RunToolRequest request(String toolKey) {
        return RunToolRequest.builder()
                .toolKey(toolKey)
                .input(Map.of("query", "active=true", "limit", 5))
                .runId(RUN_ID)
                .build();
    }

    private static ToolPolicy policy(String... tools) {
        return ToolPolicy.builder()
                .tenantId(TENANT)
                .toolsEnabled(true)
                .allowedTools(List.of(tools))
                .rateLimitPerMinute(60)
                .maxToolCallsPerRun(10)
                .build();
    }

    private static ProviderConfig provider() {
        return ProviderConfig.builder()
                .id("provider-1")
                .tenantId(TENANT)
                .providerFamily(ProviderFamily.SERVICENOW)
                .displayName("Acme ServiceNow")
                .baseUrl(BASE_URL)
                .authMode(AuthMode.BASIC)
                .build();
    }
}
