package org.lite.toolgateway.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

public class TenantContextMissingException extends ResponseStatusException {

    public TenantContextMissingException() {
        super(HttpStatus.UNAUTHORIZED, "No resolved tenant on request");
    }
}
