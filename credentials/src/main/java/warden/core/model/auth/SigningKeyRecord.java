package warden.core.model.auth;

import java.security.interfaces.RSAPrivateKey;
import java.security.interfaces.RSAPublicKey;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Signing key with metadata for lifecycle management.
 *
 * <p>
 * Each key has a unique ID (kid) used in JWT headers for key selection
 * during verification. A key verifies tokens until {@code graceEndsAt};
 * for the current key that is its hard expiry, for a retired key it is
 * the end of the grace period granted at rotation.
 *
 * @param keyId        Unique key identifier (used as JWT 'kid' header)
 * @param privateKey   RSA private key for signing
 * @param publicKey    RSA public key for verification and key set export
 * @param status       Current lifecycle status
 * @param createdAt    When the key was generated
 * @param expiresAt    Hard expiry, creation time plus key lifetime
 * @param graceEndsAt  Last instant at which the key still verifies
 * @param deprecatedAt When the key stopped signing (null while ACTIVE)
 */
public record SigningKeyRecord(
        String keyId,
        RSAPrivateKey privateKey,
        RSAPublicKey publicKey,
        KeyStatus status,
        Instant createdAt,
        Instant expiresAt,
        Instant graceEndsAt,
        Instant deprecatedAt) {

    public SigningKeyRecord {
        Objects.requireNonNull(keyId, "keyId is required");
        Objects.requireNonNull(privateKey, "privateKey is required");
        Objects.requireNonNull(publicKey, "publicKey is required");
        Objects.requireNonNull(status, "status is required");
        Objects.requireNonNull(createdAt, "createdAt is required");
        Objects.requireNonNull(expiresAt, "expiresAt is required");
        Objects.requireNonNull(graceEndsAt, "graceEndsAt is required");
    }

    /**
     * Create a new current key.
     */
    public static SigningKeyRecord active(
            String keyId, RSAPrivateKey privateKey, RSAPublicKey publicKey, Instant createdAt, Duration lifetime) {
        final var expiresAt = createdAt.plus(lifetime);
        return new SigningKeyRecord(
                keyId, privateKey, publicKey, KeyStatus.ACTIVE, createdAt, expiresAt, expiresAt, null);
    }

    /**
     * Transition this key to DEPRECATED status.
     *
     * @param deprecatedAt when the key stopped signing
     * @param gracePeriod  how long the key keeps verifying after that
     */
    public SigningKeyRecord deprecate(Instant deprecatedAt, Duration gracePeriod) {
        if (status != KeyStatus.ACTIVE) {
            throw new IllegalStateException("Can only deprecate ACTIVE keys, current status: " + status);
        }
        return new SigningKeyRecord(
                keyId,
                privateKey,
                publicKey,
                KeyStatus.DEPRECATED,
                createdAt,
                expiresAt,
                deprecatedAt.plus(gracePeriod),
                deprecatedAt);
    }

    /**
     * Check if this key still verifies tokens at the given instant.
     */
    public boolean canVerifyAt(Instant now) {
        return !now.isAfter(graceEndsAt);
    }

    /**
     * Check if this key can be used for signing.
     */
    public boolean canSign() {
        return status == KeyStatus.ACTIVE;
    }
}
