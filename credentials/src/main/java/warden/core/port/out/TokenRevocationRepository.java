package warden.core.port.out;

import java.time.Instant;

import io.smallrye.mutiny.Uni;

/**
 * Storage port for token revocation records.
 *
 * <h2>Implementation Requirements</h2>
 * <ul>
 *   <li>Entries MUST stop reporting revoked once their expiry has passed</li>
 *   <li>All operations MUST be non-blocking (return Uni)</li>
 *   <li>Implementations MUST be thread-safe</li>
 *   <li>Backend failures MUST surface as failed Uni, never as "not revoked"</li>
 * </ul>
 *
 * @see warden.adapter.out.storage.redis.RedisTokenRevocationRepository
 * @see warden.adapter.out.storage.memory.InMemoryTokenRevocationRepository
 */
public interface TokenRevocationRepository {

    /**
     * Revoke a specific token by its JTI.
     *
     * <p>The revocation entry expires at the specified time, which matches the
     * token's own expiry so entries don't accumulate indefinitely. Revoking
     * with an expiry already in the past is a no-op.
     *
     * @param jti       the JWT ID to revoke
     * @param expiresAt when the revocation entry should expire (matches token expiry)
     * @return Uni completing when revocation is stored
     */
    Uni<Void> revoke(String jti, Instant expiresAt);

    /**
     * Check if a token has been revoked.
     *
     * @param jti the JWT ID to check
     * @return Uni with true if revoked, false otherwise
     */
    Uni<Boolean> isRevoked(String jti);

    /**
     * Check if a token has been revoked, passing the token's own expiry.
     *
     * <p>A revocation record never outlives the token it revokes, so callers
     * that know the expiry pass it along for decorators that cache results.
     * Backends ignore it.
     *
     * @param jti            the JWT ID to check
     * @param tokenExpiresAt the token's expiry claim (may be null)
     * @return Uni with true if revoked, false otherwise
     */
    default Uni<Boolean> isRevoked(String jti, Instant tokenExpiresAt) {
        return isRevoked(jti);
    }

    /**
     * Remove records whose expiry has passed.
     *
     * <p>Backends with native per-record expiry complete immediately with zero.
     *
     * @return Uni with the number of records removed
     */
    Uni<Integer> cleanupExpired();
}
