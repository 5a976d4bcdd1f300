package warden.adapter.out.storage;

import java.time.Clock;
import java.util.Locale;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import org.jboss.logging.Logger;

import warden.adapter.out.storage.memory.InMemoryTokenRevocationRepository;
import warden.adapter.out.storage.redis.RedisTimeoutHelper;
import warden.adapter.out.storage.redis.RedisTokenRevocationRepository;
import warden.core.config.KeyRotationConfig;
import warden.core.config.TokenRevocationConfig;
import warden.core.port.out.CredentialMetrics;
import warden.core.port.out.TokenRevocationRepository;
import warden.core.service.auth.RevocationCache;

/**
 * CDI producer for the token revocation repository.
 *
 * <p>Selects the backend once from {@code warden.auth.revocation.store}
 * ({@code memory} or {@code redis}) and, unless disabled, fronts it with the
 * local LRU cache. The Redis data source is resolved lazily so deployments
 * using the in-memory store need no Redis connection.
 */
@ApplicationScoped
public class TokenRevocationRepositoryProducer {

    private static final Logger LOG = Logger.getLogger(TokenRevocationRepositoryProducer.class);

    static final String STORE_MEMORY = "memory";
    static final String STORE_REDIS = "redis";

    private final TokenRevocationConfig config;
    private final KeyRotationConfig keyRotationConfig;
    private final Instance<ReactiveRedisDataSource> redisDataSource;
    private final CredentialMetrics metrics;
    private final Clock clock;

    @Inject
    public TokenRevocationRepositoryProducer(
            TokenRevocationConfig config,
            KeyRotationConfig keyRotationConfig,
            Instance<ReactiveRedisDataSource> redisDataSource,
            CredentialMetrics metrics,
            Clock clock) {
        this.config = config;
        this.keyRotationConfig = keyRotationConfig;
        this.redisDataSource = redisDataSource;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Produces the revocation repository used by the credential service.
     *
     * @return the configured backend, cached when enabled
     * @throws IllegalStateException if the configured store is unknown or unavailable
     */
    @Produces
    @ApplicationScoped
    public TokenRevocationRepository tokenRevocationRepository() {
        final var backend = createBackend();
        if (!config.cache().enabled()) {
            LOG.infov("Revocation store: {0} (cache disabled)", config.store());
            return backend;
        }
        final var cache = new RevocationCache(config.cache().capacity(), clock);
        LOG.infov("Revocation store: {0} (cache capacity {1})", config.store(), cache.capacity());
        return new CachedTokenRevocationRepository(
                backend, cache, keyRotationConfig.effectiveGracePeriod(), clock);
    }

    TokenRevocationRepository createBackend() {
        final var store = config.store() == null ? STORE_MEMORY : config.store().trim().toLowerCase(Locale.ROOT);
        switch (store) {
            case STORE_MEMORY:
                return new InMemoryTokenRevocationRepository(clock);
            case STORE_REDIS:
                if (!redisDataSource.isResolvable()) {
                    throw new IllegalStateException("Revocation store 'redis' selected but no Redis client is configured");
                }
                final var redis = config.redis();
                final var timeoutHelper =
                        new RedisTimeoutHelper(redis.timeout(), metrics, "RedisTokenRevocationRepository");
                return new RedisTokenRevocationRepository(
                        redisDataSource.get(), redis.namespace(), timeoutHelper, clock);
            default:
                throw new IllegalStateException("Unknown revocation store: " + config.store());
        }
    }
}
