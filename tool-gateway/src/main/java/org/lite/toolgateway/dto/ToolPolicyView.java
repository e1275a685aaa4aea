package org.lite.toolgateway.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.lite.toolgateway.entity.ToolPolicy;
import org.lite.toolgateway.enums.ToolKey;

import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ToolPolicyView {

    private String tenantId;

    @JsonProperty("isToolsEnabled")
    private boolean toolsEnabled;

    private List<String> allowedTools;
    private int rateLimitPerMinute;
    private int maxToolCallsPerRun;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
    private String updatedBy;

    /**
     * Only recognized tool identifiers leave the store.
     */
    public static ToolPolicyView from(ToolPolicy policy) {
        return ToolPolicyView.builder()
                .tenantId(policy.getTenantId())
                .toolsEnabled(policy.isToolsEnabled())
                .allowedTools(policy.allowedToolKeys().stream().map(ToolKey::name).collect(Collectors.toList()))
                .rateLimitPerMinute(policy.getRateLimitPerMinute())
                .maxToolCallsPerRun(policy.getMaxToolCallsPerRun())
                .createdAt(policy.getCreatedAt())
                .updatedAt(policy.getUpdatedAt())
                .updatedBy(policy.getUpdatedBy())
                .build();
    }
}
