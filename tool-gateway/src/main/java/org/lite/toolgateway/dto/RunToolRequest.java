package org.lite.toolgateway.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Invoke one tool on behalf of an agent run")
public class RunToolRequest {

    @NotBlank(message = "toolKey is required")
    @Size(max = 64, message = "toolKey must be at most 64 characters")
    @Schema(example = "QUERY_INCIDENTS")
    private String toolKey;

    @Schema(description = "Tool-specific input object", example = "{\"query\": \"active=true\", \"limit\": 10}")
    private Map<String, Object> input;

    @Size(max = 128, message = "runId must be at most 128 characters")
    @Schema(description = "Agent run identifier; enables the per-run call cap")
    private String runId;
}
