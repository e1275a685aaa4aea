package org.lite.toolgateway.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

/**
 * Malformed or unsafe input, rejected before any state change.
 */
public class ToolGatewayValidationException extends ResponseStatusException {

    public static final String UNSAFE_BASE_URL_MESSAGE = "Base URL is not allowed";

    public ToolGatewayValidationException(String message) {
        super(HttpStatus.BAD_REQUEST, message);
    }

    /**
     * SSRF rejection at configuration time; the guard's classification stays internal
     */
    public static ToolGatewayValidationException unsafeBaseUrl() {
        return new ToolGatewayValidationException(UNSAFE_BASE_URL_MESSAGE);
    }
}
