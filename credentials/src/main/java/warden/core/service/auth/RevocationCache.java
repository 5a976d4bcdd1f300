package warden.core.service.auth;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

import org.jboss.logging.Logger;

/**
 * Bounded local LRU cache for confirmed revocations.
 *
 * <p>This is the first tier in the revocation check hierarchy:
 * <ol>
 *   <li>Local cache - confirmed revocations (this class)</li>
 *   <li>Backend store - authoritative source</li>
 * </ol>
 *
 * <p>Only revocations are cached. A miss means "ask the backend", never
 * "not revoked", so evicting an entry can cost a lookup but cannot let a
 * revoked token through.
 *
 * <p>Guarded by its own lock, independent of the signing key registry.
 */
public class RevocationCache {

    private static final Logger LOG = Logger.getLogger(RevocationCache.class);

    static final int FALLBACK_CAPACITY = 512;

    private final int capacity;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private final LinkedHashMap<String, Instant> entries;

    public RevocationCache(int capacity, Clock clock) {
        this.capacity = capacity > 0 ? capacity : FALLBACK_CAPACITY;
        this.clock = clock;
        // access-order iteration: eldest entry is the least recently touched
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Instant> eldest) {
                return size() > RevocationCache.this.capacity;
            }
        };
        LOG.infof("Initialized revocation cache (capacity: %d)", this.capacity);
    }

    /**
     * Check if a JTI is cached as revoked.
     *
     * <p>An entry is stale once its expiry has passed; stale entries are evicted and reported as a miss.
     *
     * @param jti the JWT ID to check
     * @return Optional containing true if cached as revoked, empty if not cached
     */
    public Optional<Boolean> isJtiRevoked(String jti) {
        final var now = clock.instant();
        lock.lock();
        try {
            final var expiresAt = entries.get(jti);
            if (expiresAt == null) {
                return Optional.empty();
            }
            if (now.isAfter(expiresAt)) {
                entries.remove(jti);
                return Optional.empty();
            }
            return Optional.of(true);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Cache a JTI revocation, marking it most recently used.
     *
     * @param jti       the revoked JWT ID
     * @param expiresAt when the cached entry stops counting
     */
    public void cacheJtiRevocation(String jti, Instant expiresAt) {
        lock.lock();
        try {
            entries.put(jti, expiresAt);
        } finally {
            lock.unlock();
        }
        LOG.debugf("Cached JTI revocation: %s (expires: %s)", jti, expiresAt);
    }

    /**
     * Remove expired entries, scanning from the least recently used end.
     *
     * @return number of entries removed
     */
    public int cleanup() {
        final var now = clock.instant();
        int removed = 0;
        lock.lock();
        try {
            final var it = entries.entrySet().iterator();
            while (it.hasNext()) {
                if (now.isAfter(it.next().getValue())) {
                    it.remove();
                    removed++;
                }
            }
        } finally {
            lock.unlock();
        }
        if (removed > 0) {
            LOG.debugf("Removed %d expired revocation cache entries", removed);
        }
        return removed;
    }

    /**
     * Invalidate all cached entries.
     */
    public void invalidateAll() {
        lock.lock();
        try {
            entries.clear();
        } finally {
            lock.unlock();
        }
        LOG.debug("Invalidated all revocation cache entries");
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    public int capacity() {
        return capacity;
    }
}
