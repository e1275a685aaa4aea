package org.lite.toolgateway.validation;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Outcome of screening a candidate base URL. {@code reason} is an internal
 * classification for logs only; callers show a generic message.
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class UrlValidationResult {

    public static final String MALFORMED_URL = "malformed_url";
    public static final String SCHEME_NOT_ALLOWED = "scheme_not_allowed";
    public static final String MISSING_HOST = "missing_host";
    public static final String USERINFO_NOT_ALLOWED = "userinfo_not_allowed";
    public static final String UNRESOLVABLE_HOST = "unresolvable_host";
    public static final String RESTRICTED_ADDRESS = "restricted_address";

    private static final UrlValidationResult VALID = new UrlValidationResult(true, null);

    private final boolean valid;
    private final String reason;

    public static UrlValidationResult ok() {
        return VALID;
    }

    public static UrlValidationResult rejected(String reason) {
        return new UrlValidationResult(false, reason);
    }
}
