package org.lite.toolgateway.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

public class PolicyNotFoundException extends ResponseStatusException {

    public PolicyNotFoundException(String tenantId) {
        super(HttpStatus.NOT_FOUND, String.format("No tool policy configured for tenant '%s'", tenantId));
    }
}
