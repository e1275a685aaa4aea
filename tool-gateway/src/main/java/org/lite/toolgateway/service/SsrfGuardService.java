package org.lite.toolgateway.service;

import org.lite.toolgateway.validation.UrlValidationResult;
import reactor.core.publisher.Mono;

/**
 * Screens tenant-supplied base URLs before they are stored and again before
 * every outbound call.
 */
public interface SsrfGuardService {

    /**
     * Never errors: every failure, including DNS timeouts, is a rejected result.
     */
    Mono<UrlValidationResult> validateUrl(String url);
}
