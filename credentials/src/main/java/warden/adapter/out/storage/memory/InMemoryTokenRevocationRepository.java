package warden.adapter.out.storage.memory;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.port.out.TokenRevocationRepository;

/**
 * In-memory implementation of TokenRevocationRepository.
 *
 * <p>Records expire lazily on lookup and in bulk via {@link #cleanupExpired()},
 * which the credential service calls on its cleanup schedule.
 *
 * <p><strong>Warning:</strong> Revocations are lost on restart and not shared
 * across instances. Use the Redis backend when running more than one process.
 */
public class InMemoryTokenRevocationRepository implements TokenRevocationRepository {

    private static final Logger LOG = Logger.getLogger(InMemoryTokenRevocationRepository.class);

    private final ConcurrentMap<String, Instant> revokedJtis = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryTokenRevocationRepository(Clock clock) {
        this.clock = clock;
        LOG.info("Initialized in-memory token revocation repository");
    }

    @Override
    public Uni<Void> revoke(String jti, Instant expiresAt) {
        return Uni.createFrom().item(() -> {
            if (!expiresAt.isAfter(clock.instant())) {
                LOG.debugf("Skipping revocation for already-expired token: %s", jti);
                return null;
            }
            revokedJtis.put(jti, expiresAt);
            LOG.debugf("Revoked token in memory: %s (expires: %s)", jti, expiresAt);
            return null;
        });
    }

    @Override
    public Uni<Boolean> isRevoked(String jti) {
        return Uni.createFrom().item(() -> {
            final var expiresAt = revokedJtis.get(jti);
            if (expiresAt == null) {
                return false;
            }
            if (clock.instant().isAfter(expiresAt)) {
                revokedJtis.remove(jti, expiresAt);
                return false;
            }
            return true;
        });
    }

    @Override
    public Uni<Integer> cleanupExpired() {
        return Uni.createFrom().item(() -> {
            final var now = clock.instant();
            final var before = revokedJtis.size();
            revokedJtis.entrySet().removeIf(entry -> now.isAfter(entry.getValue()));
            final var removed = before - revokedJtis.size();
            if (removed > 0) {
                LOG.debugf("Cleaned up %d expired JTI revocations", removed);
            }
            return removed;
        });
    }

    /**
     * Get the current count of revocation records (for testing).
     */
    public int getRevokedJtiCount() {
        return revokedJtis.size();
    }

    /**
     * Clear all revocations (for testing).
     */
    public void clear() {
        revokedJtis.clear();
    }
}
