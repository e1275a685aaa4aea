package org.lite.toolgateway.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

/**
 * Thrown when a provider id is unknown, soft-deleted or owned by another tenant.
 * The three cases are indistinguishable to the caller.
 */
public class ProviderNotFoundException extends ResponseStatusException {

    public ProviderNotFoundException(String providerId) {
        super(HttpStatus.NOT_FOUND, String.format("Provider '%s' not found", providerId));
    }
}
