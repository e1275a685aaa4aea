package org.lite.toolgateway.connector;

import org.lite.toolgateway.dto.ConnectionTestResult;
import org.lite.toolgateway.dto.ToolRunResult;
import org.lite.toolgateway.enums.ProviderFamily;
import org.lite.toolgateway.enums.ToolKey;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Wire protocol for one external-system family. Implementations only ever
 * see a base URL that passed the SSRF guard moments before the call.
 */
public interface ToolConnector {

    ProviderFamily family();

    /**
     * Run a read-only tool. Input problems and non-success answers come back
     * as an unsuccessful {@link ToolRunResult}; transport failures and
     * timeouts are signalled as errors.
     */
    Mono<ToolRunResult> execute(ToolKey toolKey, Map<String, Object> input, ConnectorContext context);

    /**
     * Never errors; failures are reported in the result.
     */
    Mono<ConnectionTestResult> testConnection(ConnectorContext context);
}
