package org.lite.toolgateway.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.lite.toolgateway.enums.AuthMode;
import org.lite.toolgateway.enums.ProviderFamily;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "New provider connection; secrets are encrypted before storage and never returned")
public class CreateProviderRequest {

    @NotNull(message = "providerFamily is required")
    private ProviderFamily providerFamily;

    @NotBlank(message = "displayName is required")
    @Size(max = 200, message = "displayName must be at most 200 characters")
    private String displayName;

    @Schema(description = "Defaults to true")
    private Boolean isEnabled;

    @NotBlank(message = "baseUrl is required")
    @Size(max = 2048, message = "baseUrl must be at most 2048 characters")
    @Schema(example = "https://example.service-now.com")
    private String baseUrl;

    @Schema(description = "Defaults to NONE")
    private AuthMode authMode;

    @ToString.Exclude
    @Size(max = 256)
    private String username;

    @ToString.Exclude
    @Size(max = 1024)
    private String password;

    @ToString.Exclude
    @Size(max = 4096)
    private String token;

    @ToString.Exclude
    @Size(max = 8192)
    @Schema(description = "JSON object of header name to string value")
    private String customHeaders;
}
