package warden.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Configuration mapping for token revocation.
 *
 * <p>Configuration prefix: {@code warden.auth.revocation}
 *
 * <p>Revocation lookups go through two tiers:
 * <ol>
 *   <li>Local cache - LRU cache for confirmed revocations</li>
 *   <li>Backend store - Redis or in-memory map</li>
 * </ol>
 */
@ConfigMapping(prefix = "warden.auth.revocation")
public interface TokenRevocationConfig {

    /**
     * Backend holding revocation records: {@code memory} or {@code redis}.
     */
    @WithDefault("memory")
    String store();

    /**
     * How often expired revocation records are swept.
     */
    @WithName("cleanup-interval")
    @WithDefault("PT1H")
    Duration cleanupInterval();

    /**
     * Default deadline for the revocation lookup done during validation.
     *
     * <p>When exceeded the token is rejected, never accepted.
     */
    @WithName("check-timeout")
    @WithDefault("PT2S")
    Duration checkTimeout();

    /**
     * Redis backend configuration.
     */
    RedisConfig redis();

    /**
     * Local LRU cache configuration.
     */
    CacheConfig cache();

    interface RedisConfig {

        /**
         * Key prefix; records are stored under {@code {namespace}:revoked:{jti}}.
         */
        @WithDefault("jwt")
        String namespace();

        /**
         * Bound on every individual Redis call.
         */
        @WithDefault("PT1S")
        Duration timeout();
    }

    interface CacheConfig {

        /**
         * Whether the LRU front cache is enabled.
         */
        @WithDefault("true")
        boolean enabled();

        /**
         * Maximum number of cached revocations. Non-positive values fall back to 512.
         */
        @WithDefault("2048")
        int capacity();
    }
}
