package warden.adapter.out.storage.redis;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.datasource.keys.ReactiveKeyCommands;
import io.quarkus.redis.datasource.value.ReactiveValueCommands;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.port.out.TokenRevocationRepository;

/**
 * Redis implementation of TokenRevocationRepository.
 *
 * <p>One key per revoked token, {@code {namespace}:revoked:{jti}}, written
 * with a millisecond TTL equal to the token's remaining lifetime. Redis
 * expires records natively, so {@link #cleanupExpired()} has nothing to do.
 *
 * <p>Every call is bounded by the configured operation timeout.
 */
public class RedisTokenRevocationRepository implements TokenRevocationRepository {

    private static final Logger LOG = Logger.getLogger(RedisTokenRevocationRepository.class);

    static final String REVOKED_VALUE = "revoked";

    private final ReactiveValueCommands<String, String> valueCommands;
    private final ReactiveKeyCommands<String> keyCommands;
    private final RedisTimeoutHelper timeoutHelper;
    private final String keyPrefix;
    private final Clock clock;

    public RedisTokenRevocationRepository(
            ReactiveRedisDataSource redisDataSource, String namespace, RedisTimeoutHelper timeoutHelper, Clock clock) {
        this.valueCommands = redisDataSource.value(String.class, String.class);
        this.keyCommands = redisDataSource.key(String.class);
        this.timeoutHelper = timeoutHelper;
        this.keyPrefix = namespace + ":revoked:";
        this.clock = clock;
        LOG.infov("Initialized Redis token revocation repository (namespace: {0})", namespace);
    }

    @Override
    public Uni<Void> revoke(String jti, Instant expiresAt) {
        final var key = keyFor(jti);
        final var ttlMillis = Duration.between(clock.instant(), expiresAt).toMillis();

        if (ttlMillis <= 0) {
            LOG.debugf("Skipping revocation for already-expired token: %s", jti);
            return Uni.createFrom().voidItem();
        }

        return timeoutHelper
                .withTimeout(valueCommands.psetex(key, ttlMillis, REVOKED_VALUE), "revoke")
                .invoke(() -> LOG.debugf("Revoked token in Redis: %s (TTL: %dms)", jti, ttlMillis));
    }

    @Override
    public Uni<Boolean> isRevoked(String jti) {
        return timeoutHelper.withTimeout(keyCommands.exists(keyFor(jti)), "isRevoked");
    }

    @Override
    public Uni<Integer> cleanupExpired() {
        return Uni.createFrom().item(0);
    }

    String keyFor(String jti) {
        return keyPrefix + jti;
    }
}
