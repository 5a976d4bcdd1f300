package warden.adapter.out.storage;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;

import jakarta.enterprise.inject.Instance;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import warden.adapter.out.storage.memory.InMemoryTokenRevocationRepository;
import warden.adapter.out.storage.redis.RedisTokenRevocationRepository;
import warden.core.config.ConfigFixtures;
import warden.core.config.TokenRevocationConfig;
import warden.core.port.out.CredentialMetrics;

@DisplayName("TokenRevocationRepositoryProducer")
class TokenRevocationRepositoryProducerTest {

    private Instance<ReactiveRedisDataSource> redisInstance;
    private ReactiveRedisDataSource dataSource;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        redisInstance = mock(Instance.class);
        dataSource = mock(ReactiveRedisDataSource.class);
    }

    private TokenRevocationRepositoryProducer producer(TokenRevocationConfig config) {
        return new TokenRevocationRepositoryProducer(
                config, ConfigFixtures.keyRotation(), redisInstance, CredentialMetrics.NOOP, Clock.systemUTC());
    }

    @Nested
    @DisplayName("createBackend()")
    class CreateBackend {

        @Test
        @DisplayName("should use the in-memory store without touching Redis")
        void shouldCreateMemoryStore() {
            final var backend = producer(ConfigFixtures.revocation("memory", false, 16)).createBackend();

            assertInstanceOf(InMemoryTokenRevocationRepository.class, backend);
            verify(redisInstance, never()).get();
        }

        @Test
        @DisplayName("should default to the in-memory store when unset")
        void shouldDefaultToMemory() {
            final var backend = producer(ConfigFixtures.revocation(null, false, 16)).createBackend();

            assertInstanceOf(InMemoryTokenRevocationRepository.class, backend);
        }

        @Test
        @DisplayName("should accept the store name in any case")
        void shouldIgnoreCase() {
            when(redisInstance.isResolvable()).thenReturn(true);
            when(redisInstance.get()).thenReturn(dataSource);

            final var backend = producer(ConfigFixtures.revocation(" Redis ", false, 16)).createBackend();

            assertInstanceOf(RedisTokenRevocationRepository.class, backend);
        }

        @Test
        @DisplayName("should fail when Redis is selected but unavailable")
        void shouldFailWithoutRedisClient() {
            when(redisInstance.isResolvable()).thenReturn(false);
            final var producer = producer(ConfigFixtures.revocation("redis", false, 16));

            assertThrows(IllegalStateException.class, producer::createBackend);
        }

        @Test
        @DisplayName("should reject an unknown store")
        void shouldRejectUnknownStore() {
            final var producer = producer(ConfigFixtures.revocation("cassandra", false, 16));

            final var error = assertThrows(IllegalStateException.class, producer::createBackend);

            assertTrue(error.getMessage().contains("cassandra"));
        }
    }

    @Nested
    @DisplayName("tokenRevocationRepository()")
    class Produce {

        @Test
        @DisplayName("should wrap the backend with the cache when enabled")
        void shouldWrapWithCache() {
            final var repository = producer(ConfigFixtures.revocation("memory", true, 64)).tokenRevocationRepository();

            final var cached = assertInstanceOf(CachedTokenRevocationRepository.class, repository);
            assertEquals(64, cached.getCache().capacity());
        }

        @Test
        @DisplayName("should return the bare backend when the cache is disabled")
        void shouldSkipCacheWhenDisabled() {
            final var repository = producer(ConfigFixtures.revocation("memory", false, 64)).tokenRevocationRepository();

            assertInstanceOf(InMemoryTokenRevocationRepository.class, repository);
        }
    }
}
