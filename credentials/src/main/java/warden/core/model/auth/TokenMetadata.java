package warden.core.model.auth;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Unverified view of a token, for diagnostics and audit logging.
 *
 * <p>Nothing here has been checked against a signing key. Never use it for
 * authorization decisions.
 *
 * @param claims    the decoded claims, or null when the standard claims are missing
 * @param rawClaims every claim in the payload
 * @param expired   whether the expiry claim is in the past (ignoring leeway)
 */
public record TokenMetadata(TokenClaims claims, Map<String, Object> rawClaims, boolean expired) {

    public TokenMetadata {
        rawClaims = rawClaims == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(rawClaims));
    }
}
