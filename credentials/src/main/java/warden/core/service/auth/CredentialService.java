package warden.core.service.auth;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.config.KeyRotationConfig;
import warden.core.config.TokenConfig;
import warden.core.config.TokenRevocationConfig;
import warden.core.model.auth.IssuedToken;
import warden.core.model.auth.PublicKeySet;
import warden.core.model.auth.SigningKeyRecord;
import warden.core.model.auth.TokenClaims;
import warden.core.model.auth.TokenMetadata;
import warden.core.model.auth.TokenPair;
import warden.core.model.auth.TokenType;
import warden.core.model.auth.TokenValidationResult;
import warden.core.model.auth.ValidationErrorKind;
import warden.core.port.in.CredentialManagement;
import warden.core.port.out.CredentialMetrics;
import warden.core.port.out.TokenRevocationRepository;
import warden.core.port.out.TokenSigner;
import warden.core.port.out.TokenVerifier;

/**
 * Issues, validates, refreshes and revokes signed credentials.
 *
 * <p>Validation consults the revocation store only after the signature and
 * lifetime checks pass, and fails closed: if the store errors or does not
 * answer within the deadline, the token is rejected with
 * {@link TokenValidationResult.RevocationCheckFailed}.
 *
 * <p>Also owns the background tasks that rotate the signing key and sweep
 * expired revocation records. They run on a single daemon thread started by
 * {@link #start()} and stopped by {@link #shutdown()}.
 */
@ApplicationScoped
public class CredentialService implements CredentialManagement {

    private static final Logger LOG = Logger.getLogger(CredentialService.class);

    static final Duration CLEANUP_TIMEOUT = Duration.ofMinutes(5);
    static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);

    private final SigningKeyRegistry keyRegistry;
    private final TokenSigner signer;
    private final TokenVerifier verifier;
    private final TokenRevocationRepository revocationRepository;
    private final CredentialMetrics metrics;
    private final TokenConfig tokenConfig;
    private final KeyRotationConfig keyRotationConfig;
    private final TokenRevocationConfig revocationConfig;
    private final Clock clock;

    private ScheduledExecutorService scheduler;

    @Inject
    public CredentialService(
            SigningKeyRegistry keyRegistry,
            TokenSigner signer,
            TokenVerifier verifier,
            TokenRevocationRepository revocationRepository,
            CredentialMetrics metrics,
            TokenConfig tokenConfig,
            KeyRotationConfig keyRotationConfig,
            TokenRevocationConfig revocationConfig,
            Clock clock) {
        this.keyRegistry = keyRegistry;
        this.signer = signer;
        this.verifier = verifier;
        this.revocationRepository = revocationRepository;
        this.metrics = metrics;
        this.tokenConfig = tokenConfig;
        this.keyRotationConfig = keyRotationConfig;
        this.revocationConfig = revocationConfig;
        this.clock = clock;
    }

    // Issuance

    @Override
    public IssuedToken issueAccessToken(String principal, String secondaryId) {
        return issue(principal, secondaryId, TokenType.ACCESS, tokenConfig.accessTokenTtl());
    }

    @Override
    public IssuedToken issueRefreshToken(String principal, String secondaryId) {
        return issue(principal, secondaryId, TokenType.REFRESH, tokenConfig.refreshTokenTtl());
    }

    private IssuedToken issue(String principal, String secondaryId, TokenType type, Duration ttl) {
        if (principal == null || principal.isBlank()) {
            throw new IllegalArgumentException("Principal is required");
        }

        final var key = keyRegistry.getCurrentSigningKey();
        // claims carry whole seconds
        final var now = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        final var claims = new TokenClaims(
                principal,
                secondaryId,
                type,
                UUID.randomUUID().toString(),
                tokenConfig.issuer(),
                tokenConfig.audience(),
                now,
                now.plus(ttl),
                now,
                key.keyId());

        final var token = signer.sign(claims, key);
        metrics.recordTokenIssued(type);
        LOG.debugf(
                "Issued %s token %s for %s (key: %s, expires: %s)",
                type.claimValue(), claims.jti(), principal, key.keyId(), claims.expiresAt());
        return new IssuedToken(token, claims.jti(), type, key.keyId(), claims.expiresAt());
    }

    // Validation

    @Override
    public Uni<TokenValidationResult> validate(String token) {
        return validate(token, revocationConfig.checkTimeout());
    }

    @Override
    public Uni<TokenValidationResult> validate(String token, Duration deadline) {
        final var verified = verifier.verify(token);
        if (!(verified instanceof TokenValidationResult.Valid valid)) {
            metrics.recordValidation(verified.kind());
            return Uni.createFrom().item(verified);
        }

        final var claims = valid.tokenClaims();
        return Uni.createFrom()
                .deferred(() -> revocationRepository.isRevoked(claims.jti(), revocationExpiry(claims)))
                .ifNoItem()
                .after(deadline)
                .failWith(() -> new TimeoutException("Revocation check exceeded " + deadline))
                .<TokenValidationResult>map(revoked -> {
                    if (Boolean.TRUE.equals(revoked)) {
                        LOG.warnv("Rejected revoked token {0} for {1}", claims.jti(), claims.subject());
                        return new TokenValidationResult.Revoked(claims);
                    }
                    return valid;
                })
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.errorv(
                            "Revocation check failed for token {0}, rejecting: {1}", claims.jti(), error.getMessage());
                    return new TokenValidationResult.RevocationCheckFailed(claims, describe(error));
                })
                .invoke(result -> metrics.recordValidation(result.kind()));
    }

    // Revocation

    @Override
    public Uni<Void> revoke(String token) {
        return Uni.createFrom().<Void>deferred(() -> {
            final var verified = verifier.verify(token);
            if (verified instanceof TokenValidationResult.Invalid invalid) {
                metrics.recordRevocation("rejected");
                return Uni.createFrom()
                        .<Void>failure(new InvalidTokenException(invalid.kind(), "Cannot revoke token: " + invalid.reason()));
            }
            final var claims = verified.claims();
            if (claims.isEmpty()) {
                metrics.recordRevocation("rejected");
                return Uni.createFrom()
                        .<Void>failure(new InvalidTokenException(ValidationErrorKind.MALFORMED, "Token claims unreadable"));
            }
            return revokeClaims(claims.get());
        });
    }

    private Uni<Void> revokeClaims(TokenClaims claims) {
        final var expiresAt = revocationExpiry(claims);
        LOG.infov("Revoking token {0} for {1} (record expires: {2})", claims.jti(), claims.subject(), expiresAt);
        return revocationRepository
                .revoke(claims.jti(), expiresAt)
                .invoke(() -> metrics.recordRevocation("revoked"))
                .onFailure()
                .invoke(error -> metrics.recordRevocation("failed"));
    }

    /**
     * A token stays acceptable until {@code exp + leeway}, so its revocation record must live that long too.
     */
    private Instant revocationExpiry(TokenClaims claims) {
        if (claims.expiresAt() == null) {
            return clock.instant().plus(keyRotationConfig.effectiveGracePeriod());
        }
        return claims.expiresAt().plus(tokenConfig.leeway());
    }

    // Refresh

    @Override
    public Uni<TokenPair> refresh(String refreshToken) {
        return validate(refreshToken).chain(result -> {
            if (!(result instanceof TokenValidationResult.Valid valid)) {
                return Uni.createFrom()
                        .<TokenPair>failure(new InvalidTokenException(result.kind(), "Refresh token rejected: " + result.kind()));
            }
            final var claims = valid.tokenClaims();
            if (!claims.isRefresh()) {
                return Uni.createFrom()
                        .<TokenPair>failure(new InvalidTokenException(
                                ValidationErrorKind.WRONG_TOKEN_TYPE, "Token " + claims.jti() + " is not a refresh token"));
            }

            return revokeClaims(claims)
                    .onFailure()
                    .recoverWithItem(error -> {
                        LOG.errorv(
                                "Failed to revoke refresh token {0} for {1}, issuing new pair anyway: {2}",
                                claims.jti(), claims.subject(), error.getMessage());
                        return null;
                    })
                    .map(ignored -> new TokenPair(
                            issueAccessToken(claims.subject(), claims.secondaryId()),
                            issueRefreshToken(claims.subject(), claims.secondaryId())));
        });
    }

    // Keys

    @Override
    public PublicKeySet publicKeySet() {
        return new PublicKeySet(keyRegistry.getVerificationKeys().stream()
                .map(verifier::describe)
                .toList());
    }

    @Override
    public SigningKeyRecord rotateSigningKey(String reason) {
        LOG.warnv("Rotating signing key on demand: {0}", reason);
        try {
            final var key = keyRegistry.rotateKey(keyRotationConfig.effectiveGracePeriod());
            metrics.recordKeyRotation(true);
            return key;
        } catch (RuntimeException e) {
            metrics.recordKeyRotation(false);
            throw e;
        }
    }

    @Override
    public Optional<TokenMetadata> inspect(String token) {
        return verifier.decodeUnverified(token);
    }

    // Lifecycle

    /**
     * Generate the first signing key if needed and start the background tasks.
     *
     * <p>Calling this again while running has no effect.
     *
     * @throws IllegalStateException if the rotation interval is not shorter than the key lifetime
     * @throws SigningKeyRegistry.KeyGenerationException if the first key cannot be generated
     */
    public synchronized void start() {
        if (scheduler != null) {
            return;
        }
        if (keyRotationConfig.rotationInterval().compareTo(keyRotationConfig.keyLifetime()) >= 0) {
            throw new IllegalStateException("warden.auth.key-rotation.rotation-interval ("
                    + keyRotationConfig.rotationInterval()
                    + ") must be shorter than key-lifetime ("
                    + keyRotationConfig.keyLifetime()
                    + ")");
        }
        if (!keyRegistry.isReady()) {
            keyRegistry.generateNewKey();
        }

        final var rotationInterval = keyRotationConfig.rotationInterval().toMillis();
        final var cleanupInterval = revocationConfig.cleanupInterval().toMillis();

        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            final var t = new Thread(r, "credential-scheduler");
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleAtFixedRate(
                this::runScheduledRotation, rotationInterval, rotationInterval, TimeUnit.MILLISECONDS);
        scheduler.scheduleAtFixedRate(
                this::runScheduledCleanup, cleanupInterval, cleanupInterval, TimeUnit.MILLISECONDS);

        LOG.infov(
                "Credential service started (rotation every {0}, grace {1}, cleanup every {2})",
                keyRotationConfig.rotationInterval(),
                keyRotationConfig.effectiveGracePeriod(),
                revocationConfig.cleanupInterval());
    }

    /**
     * Stop the background tasks, waiting briefly for a running task to finish.
     */
    @PreDestroy
    public synchronized void shutdown() {
        if (scheduler == null) {
            return;
        }
        final var executor = scheduler;
        scheduler = null;
        executor.shutdown();
        try {
            if (!executor.awaitTermination(SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        LOG.info("Credential service stopped");
    }

    public synchronized boolean isRunning() {
        return scheduler != null;
    }

    void runScheduledRotation() {
        try {
            keyRegistry.rotateKey(keyRotationConfig.effectiveGracePeriod());
            metrics.recordKeyRotation(true);
        } catch (RuntimeException e) {
            LOG.errorv(e, "Scheduled key rotation failed, keeping current key");
            metrics.recordKeyRotation(false);
        }
    }

    void runScheduledCleanup() {
        try {
            final int removed = revocationRepository.cleanupExpired().await().atMost(CLEANUP_TIMEOUT);
            final int purgedKeys = keyRegistry.purgeExpiredKeys();
            LOG.debugf("Cleanup removed %d revocation records and %d signing keys", removed, purgedKeys);
            metrics.recordRevocationCleanup(true);
        } catch (RuntimeException e) {
            LOG.errorv(e, "Revocation cleanup failed");
            metrics.recordRevocationCleanup(false);
        }
    }

    private static String describe(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }
}
