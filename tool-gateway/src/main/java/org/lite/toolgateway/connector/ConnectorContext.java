package org.lite.toolgateway.connector;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import org.lite.toolgateway.enums.AuthMode;

/**
 * Everything a connector needs to reach one provider.
 */
@Getter
@Builder
@ToString
public class ConnectorContext {

    private final String providerId;
    private final String baseUrl;
    private final AuthMode authMode;
    @ToString.Exclude
    private final ResolvedCredentials credentials;
}
