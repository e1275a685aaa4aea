package org.lite.toolgateway.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Create or update the tenant's tool policy")
public class UpsertToolPolicyRequest {

    @NotNull(message = "isToolsEnabled is required")
    private Boolean isToolsEnabled;

    @Schema(description = "Tool identifiers; every entry must be a known tool", example = "[\"QUERY_INCIDENTS\"]")
    private List<String> allowedTools;

    @Min(1)
    @Max(10000)
    private Integer rateLimitPerMinute;

    @Min(1)
    @Max(1000)
    private Integer maxToolCallsPerRun;
}
