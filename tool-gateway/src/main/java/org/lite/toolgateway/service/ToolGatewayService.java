package org.lite.toolgateway.service;

import org.lite.toolgateway.dto.RunToolRequest;
import org.lite.toolgateway.dto.ToolRunResponse;
import reactor.core.publisher.Mono;

public interface ToolGatewayService {

    /**
     * Authorize and dispatch one tool call. Denials, throttling and execution
     * errors are returned as a {@link ToolRunResponse}, each after exactly one
     * audit write. Only an unknown tool key is signalled as an error, before
     * any check runs.
     */
    Mono<ToolRunResponse> runTool(String tenantId, String actorUserId, RunToolRequest request);
}
