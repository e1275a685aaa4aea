package org.lite.toolgateway.service.impl;

import lombok.extern.slf4j.Slf4j;
import org.lite.toolgateway.config.ToolGatewayProperties;
import org.lite.toolgateway.service.SsrfGuardService;
import org.lite.toolgateway.validation.HostResolver;
import org.lite.toolgateway.validation.RestrictedAddresses;
import org.lite.toolgateway.validation.UrlValidationResult;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.net.InetAddress;
import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.Arrays;
import java.util.Locale;

@Service
@Slf4j
public class SsrfGuardServiceImpl implements SsrfGuardService {

    private static final String ALLOWED_SCHEME = "https";

    private final HostResolver hostResolver;
    private final Duration dnsTimeout;

    @Autowired
    public SsrfGuardServiceImpl(ToolGatewayProperties properties) {
        this(HostResolver.system(), properties.getSsrf().getDnsTimeout());
    }

    public SsrfGuardServiceImpl(HostResolver hostResolver, Duration dnsTimeout) {
        this.hostResolver = hostResolver;
        this.dnsTimeout = dnsTimeout;
    }

    @Override
    public Mono<UrlValidationResult> validateUrl(String url) {
        if (url == null || url.isBlank()) {
            return Mono.just(reject(url, UrlValidationResult.MALFORMED_URL));
        }

        URI uri;
        try {
            uri = new URI(url.trim());
        } catch (URISyntaxException e) {
            return Mono.just(reject(url, UrlValidationResult.MALFORMED_URL));
        }

        String scheme = uri.getScheme();
        if (scheme == null || !ALLOWED_SCHEME.equals(scheme.toLowerCase(Locale.ROOT))) {
            return Mono.just(reject(url, UrlValidationResult.SCHEME_NOT_ALLOWED));
        }
        // Also catches user-info hidden in an authority the URI parser could not split
        if (uri.getRawUserInfo() != null || (uri.getRawAuthority() != null && uri.getRawAuthority().contains("@"))) {
            return Mono.just(reject(url, UrlValidationResult.USERINFO_NOT_ALLOWED));
        }
        String host = uri.getHost();
        if (host == null || host.isBlank()) {
            return Mono.just(reject(url, UrlValidationResult.MISSING_HOST));
        }
        String bareHost = host.startsWith("[") && host.endsWith("]")
                ? host.substring(1, host.length() - 1)
                : host;

        return Mono.fromCallable(() -> hostResolver.resolveAll(bareHost))
                .subscribeOn(Schedulers.boundedElastic())
                .timeout(dnsTimeout)
                .map(addresses -> classify(url, addresses))
                .onErrorResume(e -> {
                    log.warn("SSRF guard could not resolve host of {}: {}", redactUserInfo(url), e.toString());
                    return Mono.just(UrlValidationResult.rejected(UrlValidationResult.UNRESOLVABLE_HOST));
                });
    }

    private UrlValidationResult classify(String url, InetAddress[] addresses) {
        if (addresses == null || addresses.length == 0) {
            return reject(url, UrlValidationResult.UNRESOLVABLE_HOST);
        }
        // Any restricted record rejects the host; a rebinding name only needs one
        boolean restricted = Arrays.stream(addresses).anyMatch(RestrictedAddresses::isRestricted);
        if (restricted) {
            return reject(url, UrlValidationResult.RESTRICTED_ADDRESS);
        }
        return UrlValidationResult.ok();
    }

    private UrlValidationResult reject(String url, String reason) {
        log.warn("SSRF guard rejected url {}: {}", redactUserInfo(url), reason);
        return UrlValidationResult.rejected(reason);
    }

    private static String redactUserInfo(String url) {
        return url == null ? null : url.replaceAll("//[^/@]*@", "//****@");
    }
}
