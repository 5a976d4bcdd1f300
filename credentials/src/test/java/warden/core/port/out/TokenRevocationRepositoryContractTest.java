package warden.core.port.out;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.UUID;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.threeten.extra.MutableClock;

/**
 * Contract tests for TokenRevocationRepository implementations.
 *
 * <p>Extend this class and implement {@link #createRepository(MutableClock)}
 * to verify an implementation conforms to the contract. The repository must
 * read time from the given clock.
 */
public abstract class TokenRevocationRepositoryContractTest {

    private static final Duration WAIT = Duration.ofSeconds(5);

    /**
     * Create a fresh instance of the repository under test.
     */
    protected abstract TokenRevocationRepository createRepository(MutableClock clock);

    protected MutableClock clock;
    private TokenRevocationRepository repository;

    @BeforeEach
    void setUpContract() {
        clock = MutableClock.of(Instant.parse("2026-03-01T12:00:00Z"), ZoneOffset.UTC);
        repository = createRepository(clock);
    }

    private boolean isRevoked(String jti) {
        return repository.isRevoked(jti).await().atMost(WAIT);
    }

    @Nested
    @DisplayName("revoke() and isRevoked()")
    class RevokeAndCheckTests {

        @Test
        @DisplayName("revoke() then isRevoked() should return true")
        void revokeAndCheck() {
            final var jti = UUID.randomUUID().toString();

            repository.revoke(jti, clock.instant().plus(Duration.ofHours(1))).await().atMost(WAIT);

            assertTrue(isRevoked(jti), "Token should be revoked after calling revoke()");
        }

        @Test
        @DisplayName("isRevoked() should return false for unknown JTI")
        void unknownJtiNotRevoked() {
            assertFalse(isRevoked(UUID.randomUUID().toString()), "Unknown JTI should not be revoked");
        }

        @Test
        @DisplayName("revoking twice should be harmless")
        void revokeIsIdempotent() {
            final var jti = UUID.randomUUID().toString();
            final var expiresAt = clock.instant().plus(Duration.ofHours(1));

            repository.revoke(jti, expiresAt).await().atMost(WAIT);
            repository.revoke(jti, expiresAt).await().atMost(WAIT);

            assertTrue(isRevoked(jti));
        }

        @Test
        @DisplayName("isRevoked() with token expiry should agree with isRevoked()")
        void overloadAgrees() {
            final var jti = UUID.randomUUID().toString();
            final var expiresAt = clock.instant().plus(Duration.ofHours(1));

            repository.revoke(jti, expiresAt).await().atMost(WAIT);

            assertTrue(repository.isRevoked(jti, expiresAt).await().atMost(WAIT));
            assertFalse(repository.isRevoked("other", expiresAt).await().atMost(WAIT));
        }
    }

    @Nested
    @DisplayName("expiry")
    class ExpiryTests {

        @Test
        @DisplayName("revoking with an expiry in the past should be a no-op")
        void pastExpiryIsNoOp() {
            final var jti = UUID.randomUUID().toString();

            repository.revoke(jti, clock.instant().minusSeconds(1)).await().atMost(WAIT);

            assertFalse(isRevoked(jti));
        }

        @Test
        @DisplayName("record should stop counting once its expiry passes")
        void recordExpires() {
            final var jti = UUID.randomUUID().toString();
            repository.revoke(jti, clock.instant().plus(Duration.ofMinutes(10))).await().atMost(WAIT);

            clock.add(Duration.ofMinutes(9));
            assertTrue(isRevoked(jti));

            clock.add(Duration.ofMinutes(2));
            assertFalse(isRevoked(jti));
        }

        @Test
        @DisplayName("cleanupExpired() should keep live records")
        void cleanupKeepsLiveRecords() {
            final var live = UUID.randomUUID().toString();
            final var stale = UUID.randomUUID().toString();
            repository.revoke(live, clock.instant().plus(Duration.ofHours(1))).await().atMost(WAIT);
            repository.revoke(stale, clock.instant().plus(Duration.ofMinutes(1))).await().atMost(WAIT);
            clock.add(Duration.ofMinutes(5));

            repository.cleanupExpired().await().atMost(WAIT);

            assertTrue(isRevoked(live));
            assertFalse(isRevoked(stale));
        }
    }
}
