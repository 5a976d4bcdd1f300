package warden.adapter.out.storage;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.port.out.TokenRevocationRepository;
import warden.core.service.auth.RevocationCache;

/**
 * Revocation repository fronted by the local LRU cache.
 *
 * <p>Writes go to the backend first, then to the cache. Reads check the cache
 * and fall through to the backend on a miss. Only positive results are
 * cached: a token revoked by another process is never hidden behind a cached
 * "not revoked".
 *
 * <p>Entries cached from a backend hit live for the shorter of the grace
 * period and the token's remaining lifetime. Backend errors propagate
 * unchanged.
 */
public class CachedTokenRevocationRepository implements TokenRevocationRepository {

    private static final Logger LOG = Logger.getLogger(CachedTokenRevocationRepository.class);

    private final TokenRevocationRepository backend;
    private final RevocationCache cache;
    private final Duration gracePeriod;
    private final Clock clock;

    public CachedTokenRevocationRepository(
            TokenRevocationRepository backend, RevocationCache cache, Duration gracePeriod, Clock clock) {
        this.backend = backend;
        this.cache = cache;
        this.gracePeriod = gracePeriod;
        this.clock = clock;
    }

    @Override
    public Uni<Void> revoke(String jti, Instant expiresAt) {
        final var effectiveExpiry = expiresAt != null ? expiresAt : clock.instant().plus(gracePeriod);
        return backend.revoke(jti, effectiveExpiry).invoke(() -> {
            if (effectiveExpiry.isAfter(clock.instant())) {
                cache.cacheJtiRevocation(jti, effectiveExpiry);
            }
        });
    }

    @Override
    public Uni<Boolean> isRevoked(String jti) {
        return isRevoked(jti, null);
    }

    @Override
    public Uni<Boolean> isRevoked(String jti, Instant tokenExpiresAt) {
        if (cache.isJtiRevoked(jti).orElse(false)) {
            return Uni.createFrom().item(true);
        }
        return backend.isRevoked(jti, tokenExpiresAt).invoke(revoked -> {
            if (Boolean.TRUE.equals(revoked)) {
                cache.cacheJtiRevocation(jti, cacheExpiry(tokenExpiresAt));
            }
        });
    }

    @Override
    public Uni<Integer> cleanupExpired() {
        return Uni.createFrom()
                .item(cache::cleanup)
                .invoke(removed -> LOG.debugf("Revocation cache cleanup removed %d entries", removed))
                .chain(cached -> backend.cleanupExpired());
    }

    public RevocationCache getCache() {
        return cache;
    }

    private Instant cacheExpiry(Instant tokenExpiresAt) {
        final var byGrace = clock.instant().plus(gracePeriod);
        if (tokenExpiresAt != null && tokenExpiresAt.isBefore(byGrace)) {
            return tokenExpiresAt;
        }
        return byGrace;
    }
}
