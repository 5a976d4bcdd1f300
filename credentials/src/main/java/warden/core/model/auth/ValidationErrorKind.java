package warden.core.model.auth;

/**
 * Reason a bearer token was not accepted.
 */
public enum ValidationErrorKind {
    /** Token accepted. */
    NONE,
    /** Structurally invalid: not a compact JWS, missing kid, unreadable claims. */
    MALFORMED,
    /** Header names an algorithm other than RS256. */
    UNSUPPORTED_ALGORITHM,
    /** Signing key is unknown or past its grace period. */
    UNKNOWN_KEY,
    /** Signature does not verify against the named key. */
    BAD_SIGNATURE,
    /** Issuer, audience or not-before does not match. */
    INVALID_CLAIMS,
    /** Signature verified but expiry plus leeway has passed. */
    EXPIRED,
    /** The token's jti has been revoked. */
    REVOKED,
    /** The revocation backend could not be consulted; the token is rejected. */
    REVOCATION_CHECK_FAILED,
    /** A valid token of the wrong type was presented (refresh flow). */
    WRONG_TOKEN_TYPE;

    /**
     * Whether the caller may retry the same token later.
     */
    public boolean isRetryable() {
        return this == REVOCATION_CHECK_FAILED;
    }
}
