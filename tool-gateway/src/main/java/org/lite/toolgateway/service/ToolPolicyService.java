package org.lite.toolgateway.service;

import org.lite.toolgateway.dto.ToolPolicyView;
import org.lite.toolgateway.dto.ToolStatusView;
import org.lite.toolgateway.dto.UpsertToolPolicyRequest;
import reactor.core.publisher.Mono;

public interface ToolPolicyService {

    /**
     * Create or update the tenant's single policy row. Unknown tool
     * identifiers reject the whole request before anything is written.
     */
    Mono<ToolPolicyView> upsertPolicy(String tenantId, UpsertToolPolicyRequest request, String actorUserId);

    Mono<ToolPolicyView> getPolicy(String tenantId);

    Mono<ToolStatusView> getToolStatus(String tenantId);
}
