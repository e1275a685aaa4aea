package org.lite.toolgateway.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Separates "permitted by policy" from "actually configured and usable".
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ToolStatusView {

    @JsonProperty("isToolsEnabled")
    private boolean toolsEnabled;

    private List<String> availableTools;

    private boolean hasUsableProvider;
}
