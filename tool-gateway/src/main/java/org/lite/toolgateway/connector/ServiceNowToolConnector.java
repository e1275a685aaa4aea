package org.lite.toolgateway.connector;

import lombok.extern.slf4j.Slf4j;
import org.lite.toolgateway.config.ToolGatewayProperties;
import org.lite.toolgateway.dto.ConnectionTestResult;
import org.lite.toolgateway.dto.ToolRunMeta;
import org.lite.toolgateway.dto.ToolRunResult;
import org.lite.toolgateway.enums.AuthMode;
import org.lite.toolgateway.enums.ProviderFamily;
import org.lite.toolgateway.enums.ToolKey;
import org.lite.toolgateway.validation.CustomHeaders;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriBuilder;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.TimeoutException;
import java.util.regex.Pattern;

/**
 * Read-only ServiceNow Table API connector.
 * <p>
 * Only allowlisted tables are reachable, returned columns are limited to a safe
 * set per table, and query, limit and sys_id inputs are bounded before any
 * request is built.
 */
@Component
@Slf4j
public class ServiceNowToolConnector implements ToolConnector {

    static final Map<String, List<String>> SAFE_FIELDS = Map.of(
            "incident", List.of("sys_id", "number", "short_description", "description", "state", "impact",
                    "urgency", "priority", "category", "assignment_group", "assigned_to", "service_offering",
                    "business_service", "opened_at", "resolved_at", "closed_at", "sys_created_on", "sys_updated_on"),
            "change_request", List.of("sys_id", "number", "short_description", "description", "state", "type",
                    "risk", "impact", "priority", "category", "assignment_group", "assigned_to", "start_date",
                    "end_date", "opened_at", "closed_at", "sys_created_on", "sys_updated_on"),
            "cmdb_ci", List.of("sys_id", "name", "sys_class_name", "operational_status", "environment",
                    "category", "subcategory", "owned_by", "managed_by", "sys_created_on", "sys_updated_on"),
            "problem", List.of("sys_id", "number", "short_description", "state", "priority", "category",
                    "assignment_group", "assigned_to", "sys_created_on", "sys_updated_on"),
            "kb_knowledge", List.of("sys_id", "number", "short_description", "text", "category",
                    "workflow_state", "sys_created_on", "sys_updated_on"),
            "sc_req_item", List.of("sys_id", "number", "short_description", "state", "priority",
                    "sys_created_on", "sys_updated_on"),
            "sys_user", List.of("sys_id", "user_name", "name", "email", "title", "department", "active"));

    static final Set<String> ALLOWED_TABLES = SAFE_FIELDS.keySet();

    static final int MAX_LIMIT = 100;
    static final int DEFAULT_LIMIT = 20;
    static final int MAX_QUERY_LENGTH = 1000;
    static final Pattern SYS_ID_PATTERN = Pattern.compile("^[a-f0-9]{32}$", Pattern.CASE_INSENSITIVE);

    private static final String TABLE_PATH = "/api/now/table/{table}";
    private static final String RECORD_PATH = "/api/now/table/{table}/{sysId}";
    private static final String TOTAL_COUNT_HEADER = "X-Total-Count";

    private static final ParameterizedTypeReference<Map<String, Object>> JSON_OBJECT =
            new ParameterizedTypeReference<>() {
            };

    private final WebClient webClient;
    private final Duration timeout;

    public ServiceNowToolConnector(WebClient.Builder connectorWebClientBuilder, ToolGatewayProperties properties) {
        this.webClient = connectorWebClientBuilder.build();
        this.timeout = properties.getConnector().getTimeout();
    }

    @Override
    public ProviderFamily family() {
        return ProviderFamily.SERVICENOW;
    }

    @Override
    public Mono<ToolRunResult> execute(ToolKey toolKey, Map<String, Object> input, ConnectorContext context) {
        Map<String, Object> safeInput = input != null ? input : Collections.emptyMap();
        switch (toolKey) {
            case QUERY_TABLE:
                return queryTable(stringValue(safeInput.get("table")), safeInput, context);
            case GET_RECORD:
                return getRecord(safeInput, context);
            case QUERY_INCIDENTS:
                return queryTable("incident", safeInput, context);
            case QUERY_CHANGES:
                return queryTable("change_request", safeInput, context);
            default:
                return Mono.just(ToolRunResult.failure(null, "Unsupported tool for ServiceNow: " + toolKey));
        }
    }

    @Override
    public Mono<ConnectionTestResult> testConnection(ConnectorContext context) {
        long start = System.currentTimeMillis();
        return webClient.get()
                .uri(baseUrl(context), builder -> builder
                        .path("/api/now/table/sys_user")
                        .queryParam("sysparm_limit", 1)
                        .queryParam("sysparm_fields", "sys_id")
                        .build())
                .headers(headers -> applyHeaders(headers, context))
                .exchangeToMono(response -> response.releaseBody()
                        .then(Mono.fromSupplier(() -> {
                            long latencyMs = System.currentTimeMillis() - start;
                            int status = response.statusCode().value();
                            if (response.statusCode().is2xxSuccessful()) {
                                return new ConnectionTestResult(true, latencyMs,
                                        "ServiceNow connection successful (HTTP " + status + ")");
                            }
                            return new ConnectionTestResult(false, latencyMs, "ServiceNow returned HTTP " + status);
                        })))
                .timeout(timeout)
                .onErrorResume(e -> {
                    log.warn("ServiceNow connection test failed for provider {}: {}",
                            context.getProviderId(), e.toString());
                    String message = e instanceof TimeoutException
                            ? "Connection timed out"
                            : "Connection failed, see gateway logs for details";
                    return Mono.just(new ConnectionTestResult(false, System.currentTimeMillis() - start, message));
                });
    }

    private Mono<ToolRunResult> queryTable(String table, Map<String, Object> input, ConnectorContext context) {
        if (!isAllowedTable(table)) {
            return Mono.just(tableNotAllowed(table));
        }

        String query = stringValue(input.get("query"));
        if (query != null && query.length() > MAX_QUERY_LENGTH) {
            return Mono.just(ToolRunResult.failure(null,
                    "Query too long (max " + MAX_QUERY_LENGTH + " characters)"));
        }

        List<String> fields = resolveFields(table, input.get("fields"));
        int limit = Math.max(1, Math.min(intValue(input.get("limit"), DEFAULT_LIMIT), MAX_LIMIT));
        int offset = Math.max(0, intValue(input.get("offset"), 0));

        Map<String, Object> uriVariables = new HashMap<>();
        uriVariables.put("table", table);
        uriVariables.put("fields", String.join(",", fields));
        uriVariables.put("query", query);

        return webClient.get()
                .uri(baseUrl(context), builder -> {
                    UriBuilder uri = builder.path(TABLE_PATH)
                            .queryParam("sysparm_limit", limit)
                            .queryParam("sysparm_offset", offset)
                            .queryParam("sysparm_fields", "{fields}")
                            .queryParam("sysparm_display_value", "true");
                    if (query != null && !query.isEmpty()) {
                        uri.queryParam("sysparm_query", "{query}");
                    }
                    return uri.build(uriVariables);
                })
                .headers(headers -> applyHeaders(headers, context))
                .exchangeToMono(response -> {
                    if (!response.statusCode().is2xxSuccessful()) {
                        return httpFailure(response, table);
                    }
                    Integer headerTotal = totalCount(response);
                    return response.bodyToMono(JSON_OBJECT)
                            .defaultIfEmpty(Collections.emptyMap())
                            .map(body -> {
                                List<Object> records = asList(body.get("result"));
                                return ToolRunResult.builder()
                                        .success(true)
                                        .data(Map.of("records", records))
                                        .meta(ToolRunMeta.builder()
                                                .table(table)
                                                .totalCount(headerTotal != null ? headerTotal : records.size())
                                                .limit(limit)
                                                .offset(offset)
                                                .recordCount(records.size())
                                                .build())
                                        .build();
                            });
                })
                .timeout(timeout)
                .doOnError(e -> log.error("ServiceNow query on table {} failed for provider {}: {}",
                        table, context.getProviderId(), e.toString()));
    }

    private Mono<ToolRunResult> getRecord(Map<String, Object> input, ConnectorContext context) {
        String table = stringValue(input.get("table"));
        if (!isAllowedTable(table)) {
            return Mono.just(tableNotAllowed(table));
        }
        String sysId = stringValue(input.get("sys_id"));
        if (sysId == null || !SYS_ID_PATTERN.matcher(sysId).matches()) {
            return Mono.just(ToolRunResult.failure(null, "Invalid sys_id format: expected 32 hex characters"));
        }

        List<String> fields = resolveFields(table, input.get("fields"));
        Map<String, Object> uriVariables = Map.of(
                "table", table,
                "sysId", sysId,
                "fields", String.join(",", fields));

        return webClient.get()
                .uri(baseUrl(context), builder -> builder.path(RECORD_PATH)
                        .queryParam("sysparm_fields", "{fields}")
                        .queryParam("sysparm_display_value", "true")
                        .build(uriVariables))
                .headers(headers -> applyHeaders(headers, context))
                .exchangeToMono(response -> {
                    if (response.statusCode().value() == HttpStatus.NOT_FOUND.value()) {
                        return response.releaseBody().thenReturn(ToolRunResult.failure(
                                ToolRunMeta.forTable(table),
                                "Record " + sysId + " not found in " + table));
                    }
                    if (!response.statusCode().is2xxSuccessful()) {
                        return httpFailure(response, table);
                    }
                    return response.bodyToMono(JSON_OBJECT)
                            .defaultIfEmpty(Collections.emptyMap())
                            .map(body -> {
                                Map<String, Object> data = new HashMap<>();
                                data.put("record", body.get("result"));
                                return ToolRunResult.builder()
                                        .success(true)
                                        .data(data)
                                        .meta(ToolRunMeta.builder().table(table).recordCount(1).build())
                                        .build();
                            });
                })
                .timeout(timeout)
                .doOnError(e -> log.error("ServiceNow getRecord on table {} failed for provider {}: {}",
                        table, context.getProviderId(), e.toString()));
    }

    /**
     * Authorization from the auth mode; custom headers may add to but never
     * replace the headers the gateway owns.
     */
    void applyHeaders(HttpHeaders headers, ConnectorContext context) {
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        ResolvedCredentials credentials = context.getCredentials() != null
                ? context.getCredentials()
                : ResolvedCredentials.none();

        credentials.getCustomHeaders().forEach((name, value) -> {
            if (!CustomHeaders.isForbidden(name)) {
                headers.set(name, value);
            }
        });

        if (context.getAuthMode() == AuthMode.BASIC
                && credentials.getUsername() != null && credentials.getPassword() != null) {
            String encoded = Base64.getEncoder().encodeToString(
                    (credentials.getUsername() + ":" + credentials.getPassword()).getBytes(StandardCharsets.UTF_8));
            headers.set(HttpHeaders.AUTHORIZATION, "Basic " + encoded);
        } else if (context.getAuthMode() == AuthMode.TOKEN && credentials.getToken() != null) {
            headers.setBearerAuth(credentials.getToken());
        }
    }

    /**
     * Requested columns intersected with the table's safe set. An empty
     * intersection falls back to the safe set, never to "all columns".
     */
    static List<String> resolveFields(String table, Object requested) {
        List<String> safe = SAFE_FIELDS.get(table);
        if (!(requested instanceof List) || ((List<?>) requested).isEmpty()) {
            return safe;
        }
        Set<String> selected = new LinkedHashSet<>();
        for (Object field : (List<?>) requested) {
            if (field instanceof String && safe.contains(field)) {
                selected.add((String) field);
            }
        }
        return selected.isEmpty() ? safe : new ArrayList<>(selected);
    }

    private Mono<ToolRunResult> httpFailure(ClientResponse response, String table) {
        int status = response.statusCode().value();
        return response.releaseBody().thenReturn(
                ToolRunResult.failure(ToolRunMeta.forTable(table), "ServiceNow returned HTTP " + status));
    }

    private static Integer totalCount(ClientResponse response) {
        String header = response.headers().asHttpHeaders().getFirst(TOTAL_COUNT_HEADER);
        if (header == null) {
            return null;
        }
        try {
            return Integer.parseInt(header.trim());
        } catch (NumberFormatException e) {
            log.debug("Ignoring malformed {} header", TOTAL_COUNT_HEADER);
            return null;
        }
    }

    private static boolean isAllowedTable(String table) {
        return table != null && ALLOWED_TABLES.contains(table);
    }

    private static ToolRunResult tableNotAllowed(String table) {
        return ToolRunResult.failure(null, "Table \"" + (table != null ? table : "")
                + "\" is not in the allowlist. Allowed: " + String.join(", ", new TreeSet<>(ALLOWED_TABLES)));
    }

    private static String baseUrl(ConnectorContext context) {
        return context.getBaseUrl().replaceAll("/+$", "");
    }

    private static String stringValue(Object value) {
        return value instanceof String ? (String) value : null;
    }

    private static int intValue(Object value, int defaultValue) {
        return value instanceof Number ? ((Number) value).intValue() : defaultValue;
    }

    @SuppressWarnings("unchecked")
    private static List<Object> asList(Object value) {
        return value instanceof List ? (List<Object>) value : Collections.emptyList();
    }
}
