package org.lite.toolgateway.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.lite.toolgateway.enums.ToolKey;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Per-tenant tool authorization policy. Exactly one row per tenant, enforced
 * by the unique index on {@code tenantId}. A missing row means "disabled".
 */
@Document(collection = "tool_policies")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ToolPolicy {

    public static final String FIELD_TENANT_ID = "tenantId";
    public static final String FIELD_TOOLS_ENABLED = "toolsEnabled";
    public static final String FIELD_ALLOWED_TOOLS = "allowedTools";
    public static final String FIELD_RATE_LIMIT_PER_MINUTE = "rateLimitPerMinute";
    public static final String FIELD_MAX_TOOL_CALLS_PER_RUN = "maxToolCallsPerRun";
    public static final String FIELD_CREATED_AT = "createdAt";
    public static final String FIELD_UPDATED_AT = "updatedAt";
    public static final String FIELD_UPDATED_BY = "updatedBy";

    @Id
    private String id;

    @Indexed(unique = true)
    private String tenantId;

    private boolean toolsEnabled;

    // Raw identifiers as stored; re-validated on every read via allowedToolKeys()
    @Builder.Default
    private List<String> allowedTools = new ArrayList<>();

    private int rateLimitPerMinute;

    private int maxToolCallsPerRun;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    private String updatedBy;

    public Set<ToolKey> allowedToolKeys() {
        return ToolKey.parseKnown(allowedTools);
    }

    public boolean allows(ToolKey toolKey) {
        return allowedToolKeys().contains(toolKey);
    }
}
