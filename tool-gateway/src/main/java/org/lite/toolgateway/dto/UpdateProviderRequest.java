package org.lite.toolgateway.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.lite.toolgateway.enums.AuthMode;

/**
 * Partial update. A null (or absent) field is left unchanged; for secret
 * fields an empty string clears the stored value.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Partial provider update; omitted secrets are kept, empty-string secrets are cleared")
public class UpdateProviderRequest {

    @Size(min = 1, max = 200)
    private String displayName;

    private Boolean isEnabled;

    @Size(min = 1, max = 2048)
    private String baseUrl;

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
    private String customHeaders;
}
