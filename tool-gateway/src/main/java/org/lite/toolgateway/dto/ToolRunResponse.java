package org.lite.toolgateway.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.lite.toolgateway.enums.AuditDecision;
import org.lite.toolgateway.enums.DecisionReason;

/**
 * Outcome of one {@code runTool} call, mirroring the audit record written for it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ToolRunResponse {

    private String toolKey;
    private String runId;
    private AuditDecision decision;
    private DecisionReason reason;
    private boolean success;
    private Object data;
    private ToolRunMeta meta;
    private String error;
    private Long latencyMs;

    @JsonIgnore
    public boolean isAllowed() {
        return decision == AuditDecision.ALLOWED;
    }
}
