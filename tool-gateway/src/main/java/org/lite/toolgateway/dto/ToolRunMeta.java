package org.lite.toolgateway.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ToolRunMeta {
    private String table;
    private Integer totalCount;
    private Integer limit;
    private Integer offset;
    private Integer recordCount;

    public static ToolRunMeta empty() {
        return new ToolRunMeta();
    }

    public static ToolRunMeta forTable(String table) {
        return ToolRunMeta.builder().table(table).build();
    }
}
