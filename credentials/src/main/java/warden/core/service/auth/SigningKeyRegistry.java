package warden.core.service.auth;

import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.NoSuchAlgorithmException;
import java.security.interfaces.RSAPrivateKey;
import java.security.interfaces.RSAPublicKey;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import warden.core.config.KeyRotationConfig;
import warden.core.model.auth.SigningKeyRecord;

/**
 * Registry owning the RSA signing keys.
 *
 * <p>
 * Exactly one key is current and signs new tokens. Retired keys stay
 * available for verification until their grace period ends, after which
 * lookups fail and the record is purged.
 *
 * <h2>Thread Safety</h2>
 * A single read-write lock guards the key map and the current key pointer.
 * Lookups take the read lock. RSA key generation runs outside the lock; the
 * write lock is held only to swap pointers and purge.
 */
@ApplicationScoped
public class SigningKeyRegistry {

    private static final Logger LOG = Logger.getLogger(SigningKeyRegistry.class);

    private final KeyRotationConfig config;
    private final Clock clock;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, SigningKeyRecord> keys = new HashMap<>();
    private String currentKeyId;

    @Inject
    public SigningKeyRegistry(KeyRotationConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
    }

    /**
     * Generate a new key pair and make it the current signing key.
     *
     * <p>A previous current key, if any, is retired with the configured grace
     * period. Use {@link #rotateKey(Duration)} to choose the grace period.
     *
     * @return the new current key
     * @throws KeyGenerationException if RSA key generation is unavailable
     */
    public SigningKeyRecord generateNewKey() {
        return rotateKey(config.effectiveGracePeriod());
    }

    /**
     * Retire the current key and promote a freshly generated one.
     *
     * <p>The retired key keeps verifying until {@code now + gracePeriod}. Keys
     * whose grace has already elapsed are purged in the same step.
     *
     * @param gracePeriod how long the retired key keeps verifying
     * @return the new current key
     * @throws KeyGenerationException if RSA key generation is unavailable
     */
    public SigningKeyRecord rotateKey(Duration gracePeriod) {
        final var keyPair = generateKeyPair();
        final var newKey = SigningKeyRecord.active(
                UUID.randomUUID().toString(),
                (RSAPrivateKey) keyPair.getPrivate(),
                (RSAPublicKey) keyPair.getPublic(),
                clock.instant(),
                config.keyLifetime());

        String retiredKeyId = null;
        String expiredKeyId = null;
        int purged;
        lock.writeLock().lock();
        try {
            final var now = clock.instant();
            if (currentKeyId != null) {
                final var previous = keys.get(currentKeyId);
                // an expired key gets no grace; it is purged below
                if (previous != null && previous.canSign() && previous.canVerifyAt(now)) {
                    keys.put(previous.keyId(), previous.deprecate(now, gracePeriod));
                    retiredKeyId = previous.keyId();
                } else if (previous != null) {
                    expiredKeyId = previous.keyId();
                }
            }
            keys.put(newKey.keyId(), newKey);
            currentKeyId = newKey.keyId();
            purged = purgeLocked(now);
        } finally {
            lock.writeLock().unlock();
        }

        if (expiredKeyId != null) {
            LOG.warnv("Replaced expired signing key {0} with {1}", expiredKeyId, newKey.keyId());
        } else if (retiredKeyId == null) {
            LOG.infov("Generated signing key {0} (expires {1})", newKey.keyId(), newKey.expiresAt());
        } else {
            LOG.infov(
                    "Rotated signing key {0} -> {1}; old key verifies until {2}",
                    retiredKeyId, newKey.keyId(), clock.instant().plus(gracePeriod));
        }
        if (purged > 0) {
            LOG.infov("Purged {0} signing keys past their grace period", purged);
        }
        return newKey;
    }

    /**
     * Get the current signing key.
     *
     * <p>A key past its hard expiry is never returned: tokens it signed
     * would fail verification immediately.
     *
     * @return the key used to sign new tokens
     * @throws NoActiveSigningKeyException if no key has been generated yet or the current key has expired
     */
    public SigningKeyRecord getCurrentSigningKey() {
        final var now = clock.instant();
        lock.readLock().lock();
        try {
            final var key = currentKeyId == null ? null : keys.get(currentKeyId);
            if (key == null) {
                throw new NoActiveSigningKeyException("No active signing key");
            }
            if (!key.canVerifyAt(now)) {
                throw new NoActiveSigningKeyException(
                        "Signing key " + key.keyId() + " expired at " + key.expiresAt() + " and was not rotated");
            }
            return key;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Get the current signing key, if one exists and has not expired.
     */
    public Optional<SigningKeyRecord> findCurrentKey() {
        final var now = clock.instant();
        lock.readLock().lock();
        try {
            if (currentKeyId == null) {
                return Optional.empty();
            }
            return Optional.ofNullable(keys.get(currentKeyId)).filter(key -> key.canVerifyAt(now));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Get a verification key by its ID.
     *
     * <p>Used during token validation to find the key matching the 'kid'
     * header. Keys past their grace period are never returned, even if the
     * record has not been purged yet.
     *
     * @param keyId the key identifier
     * @return the key if known and still within its grace period
     */
    public Optional<SigningKeyRecord> findVerificationKey(String keyId) {
        if (keyId == null) {
            return Optional.empty();
        }
        final var now = clock.instant();
        lock.readLock().lock();
        try {
            final var key = keys.get(keyId);
            if (key == null || !key.canVerifyAt(now)) {
                return Optional.empty();
            }
            return Optional.of(key);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Get all keys valid for verification, current key first.
     *
     * @return snapshot of verification keys (may be empty)
     */
    public List<SigningKeyRecord> getVerificationKeys() {
        final var now = clock.instant();
        lock.readLock().lock();
        try {
            final var result = new ArrayList<SigningKeyRecord>();
            for (var key : keys.values()) {
                if (key.canVerifyAt(now)) {
                    result.add(key);
                }
            }
            result.sort(Comparator.comparing((SigningKeyRecord k) -> !k.canSign())
                    .thenComparing(SigningKeyRecord::createdAt, Comparator.reverseOrder()));
            return List.copyOf(result);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Remove keys whose grace period has elapsed.
     *
     * @return number of keys removed
     */
    public int purgeExpiredKeys() {
        int purged;
        lock.writeLock().lock();
        try {
            purged = purgeLocked(clock.instant());
        } finally {
            lock.writeLock().unlock();
        }
        if (purged > 0) {
            LOG.infov("Purged {0} signing keys past their grace period", purged);
        }
        return purged;
    }

    /**
     * Check if the registry has a current key that has not expired.
     */
    public boolean isReady() {
        return findCurrentKey().isPresent();
    }

    private int purgeLocked(Instant now) {
        final var before = keys.size();
        keys.values().removeIf(key -> !key.keyId().equals(currentKeyId) && !key.canVerifyAt(now));
        return before - keys.size();
    }

    /**
     * Generate an RSA key pair with the configured key size.
     */
    private KeyPair generateKeyPair() {
        try {
            final var keyGen = KeyPairGenerator.getInstance("RSA");
            keyGen.initialize(config.keySize());
            return keyGen.generateKeyPair();
        } catch (NoSuchAlgorithmException | IllegalArgumentException e) {
            throw new KeyGenerationException("Unable to generate RSA key pair", e);
        }
    }

    /**
     * Exception thrown when a token is requested before any signing key exists.
     */
    public static class NoActiveSigningKeyException extends IllegalStateException {
        public NoActiveSigningKeyException(String message) {
            super(message);
        }
    }

    /**
     * Exception thrown when RSA key material cannot be generated.
     */
    public static class KeyGenerationException extends RuntimeException {
        public KeyGenerationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
