package org.lite.toolgateway.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * What a connector produced for one invocation. An unsuccessful result is a
 * handled outcome (bad input, non-2xx answer); transport failures surface as
 * errors instead.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ToolRunResult {
    private boolean success;
    private Object data;
    @Builder.Default
    private ToolRunMeta meta = ToolRunMeta.empty();
    private String error;

    public static ToolRunResult failure(ToolRunMeta meta, String error) {
        return ToolRunResult.builder()
                .success(false)
                .meta(meta != null ? meta : ToolRunMeta.empty())
                .error(error)
                .build();
    }
}
