package warden.core.port.in;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import warden.core.model.auth.IssuedToken;
import warden.core.model.auth.PublicKeySet;
import warden.core.model.auth.SigningKeyRecord;
import warden.core.model.auth.TokenMetadata;
import warden.core.model.auth.TokenPair;
import warden.core.model.auth.TokenValidationResult;
import warden.core.model.auth.ValidationErrorKind;

/**
 * Inbound port for credential operations.
 *
 * <p>The surrounding service mints tokens for principals it has already
 * authenticated, and validates or revokes bearer tokens on inbound requests.
 */
public interface CredentialManagement {

    /**
     * Issue a short-lived access token.
     *
     * @param principal   principal identifier, must not be blank
     * @param secondaryId secondary identifier (login id), may be null
     * @return the signed token
     * @throws warden.core.service.auth.SigningKeyRegistry.NoActiveSigningKeyException if no key exists yet
     *         or the current key expired without being rotated
     * @throws warden.core.port.out.TokenSigner.TokenIssuanceException if signing fails
     */
    IssuedToken issueAccessToken(String principal, String secondaryId);

    /**
     * Issue a long-lived refresh token. Same failure modes as {@link #issueAccessToken}.
     */
    IssuedToken issueRefreshToken(String principal, String secondaryId);

    /**
     * Validate a bearer token, bounding the revocation lookup by the configured check timeout.
     *
     * <p>Never fails; every outcome is a {@link TokenValidationResult}.
     */
    Uni<TokenValidationResult> validate(String token);

    /**
     * Validate a bearer token, bounding the revocation lookup by {@code deadline}.
     */
    Uni<TokenValidationResult> validate(String token, Duration deadline);

    /**
     * Revoke a token. Expired tokens may still be revoked; revoking twice is a no-op.
     *
     * @return Uni failing with {@link InvalidTokenException} if the token cannot be trusted
     */
    Uni<Void> revoke(String token);

    /**
     * Exchange a refresh token for a new pair, revoking the presented one.
     *
     * <p>The validity check and the revocation are not atomic. Requests that
     * present the same refresh token concurrently can each pass validation
     * before either revocation lands, so more than one may receive a new pair.
     * Once a revocation is stored, later presentations fail with
     * {@link ValidationErrorKind#REVOKED}.
     *
     * @return Uni failing with {@link InvalidTokenException} if the token is not a valid refresh token
     */
    Uni<TokenPair> refresh(String refreshToken);

    /**
     * Every public key currently accepted for verification.
     */
    PublicKeySet publicKeySet();

    /**
     * Rotate the signing key now, outside the regular schedule.
     *
     * @param reason free text recorded in the log
     * @return the new current key
     */
    SigningKeyRecord rotateSigningKey(String reason);

    /**
     * Decode a token without verifying it. For diagnostics only.
     */
    Optional<TokenMetadata> inspect(String token);

    /**
     * Exception thrown when a presented token is not acceptable for the requested operation.
     */
    class InvalidTokenException extends RuntimeException {
        private final ValidationErrorKind kind;

        public InvalidTokenException(ValidationErrorKind kind, String message) {
            super(message);
            this.kind = kind;
        }

        public ValidationErrorKind getKind() {
            return kind;
        }

        /** Whether the same token may succeed on a later attempt. */
        public boolean isRetryable() {
            return kind.isRetryable();
        }
    }
}
