package warden.core.model.auth;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of validating a bearer token.
 *
 * <p>Expired, revoked and revocation-check-failed results still carry the
 * decoded claims so callers can log the identity, but only {@link Valid}
 * authorizes anything.
 */
public sealed interface TokenValidationResult {

    ValidationErrorKind kind();

    /**
     * Decoded claims, when the signature verified far enough to read them.
     */
    Optional<TokenClaims> claims();

    default boolean isValid() {
        return kind() == ValidationErrorKind.NONE;
    }

    /**
     * Token verified, is within its lifetime and is not revoked.
     */
    record Valid(TokenClaims tokenClaims) implements TokenValidationResult {
        public Valid {
            Objects.requireNonNull(tokenClaims, "tokenClaims is required");
        }

        @Override
        public ValidationErrorKind kind() {
            return ValidationErrorKind.NONE;
        }

        @Override
        public Optional<TokenClaims> claims() {
            return Optional.of(tokenClaims);
        }
    }

    /**
     * Signature verified but the token is past expiry plus leeway.
     */
    record Expired(TokenClaims tokenClaims) implements TokenValidationResult {
        @Override
        public ValidationErrorKind kind() {
            return ValidationErrorKind.EXPIRED;
        }

        @Override
        public Optional<TokenClaims> claims() {
            return Optional.ofNullable(tokenClaims);
        }
    }

    /**
     * Token verified but its jti is revoked.
     */
    record Revoked(TokenClaims tokenClaims) implements TokenValidationResult {
        @Override
        public ValidationErrorKind kind() {
            return ValidationErrorKind.REVOKED;
        }

        @Override
        public Optional<TokenClaims> claims() {
            return Optional.of(tokenClaims);
        }
    }

    /**
     * Token verified but the revocation store could not answer in time.
     *
     * @param reason description of the backend failure
     */
    record RevocationCheckFailed(TokenClaims tokenClaims, String reason) implements TokenValidationResult {
        @Override
        public ValidationErrorKind kind() {
            return ValidationErrorKind.REVOCATION_CHECK_FAILED;
        }

        @Override
        public Optional<TokenClaims> claims() {
            return Optional.of(tokenClaims);
        }
    }

    /**
     * Token rejected before its claims could be trusted.
     *
     * @param kind   why it was rejected
     * @param reason human readable detail
     */
    record Invalid(ValidationErrorKind kind, String reason) implements TokenValidationResult {
        public Invalid {
            if (kind == null || kind == ValidationErrorKind.NONE) {
                throw new IllegalArgumentException("Invalid result requires a failure kind");
            }
        }

        @Override
        public Optional<TokenClaims> claims() {
            return Optional.empty();
        }
    }
}
