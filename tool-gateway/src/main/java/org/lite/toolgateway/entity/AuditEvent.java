package org.lite.toolgateway.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.lite.toolgateway.enums.AuditAction;
import org.lite.toolgateway.enums.AuditDecision;
import org.lite.toolgateway.enums.DecisionReason;
import org.lite.toolgateway.enums.ProviderFamily;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * Append-only record of a tool gateway decision. Written once, never updated
 * or deleted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "tool_audit_events")
@CompoundIndexes({
    @CompoundIndex(name = "tenant_timestamp_idx", def = "{'tenantId': 1, 'timestamp': -1}"),
    @CompoundIndex(name = "tenant_decision_timestamp_idx", def = "{'tenantId': 1, 'decision': 1, 'timestamp': -1}"),
    @CompoundIndex(name = "tenant_run_idx", def = "{'tenantId': 1, 'runId': 1}", sparse = true)
})
public class AuditEvent {

    @Id
    private String id;

    /**
     * Unique event identifier (UUID)
     */
    @Indexed(unique = true)
    private String eventId;

    private String tenantId;

    /**
     * User on whose behalf the gateway acted (resolved upstream)
     */
    private String actorUserId;

    private AuditAction action;

    /**
     * Tool identifier; null for non-tool actions such as policy changes
     */
    private String toolKey;

    private ProviderFamily providerFamily;

    private String providerId;

    private AuditDecision decision;

    private DecisionReason reason;

    private String runId;

    /**
     * Duration in milliseconds from request receipt to terminal state
     */
    private Long latencyMs;

    /**
     * Human-readable detail; never carries credentials
     */
    private String details;

    /**
     * Connector result summary (table, recordCount, totalCount)
     */
    private Map<String, Object> requestMeta;

    private LocalDateTime timestamp;
}
