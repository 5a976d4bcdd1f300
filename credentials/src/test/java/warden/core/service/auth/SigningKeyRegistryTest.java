package warden.core.service.auth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.threeten.extra.MutableClock;

import warden.core.config.ConfigFixtures;
import warden.core.model.auth.KeyStatus;
import warden.core.model.auth.SigningKeyRecord;

@DisplayName("SigningKeyRegistry")
class SigningKeyRegistryTest {

    private static final Duration GRACE = Duration.ofMinutes(5);

    private MutableClock clock;
    private SigningKeyRegistry registry;

    @BeforeEach
    void setUp() {
        clock = MutableClock.of(Instant.parse("2026-03-01T12:00:00Z"), ZoneOffset.UTC);
        registry = new SigningKeyRegistry(ConfigFixtures.keyRotation(), clock);
    }

    @Nested
    @DisplayName("before the first key")
    class EmptyRegistryTests {

        @Test
        @DisplayName("getCurrentSigningKey() should throw NoActiveSigningKeyException")
        void shouldThrowWithoutKey() {
            assertThrows(SigningKeyRegistry.NoActiveSigningKeyException.class, registry::getCurrentSigningKey);
            assertTrue(registry.findCurrentKey().isEmpty());
            assertFalse(registry.isReady());
        }

        @Test
        @DisplayName("getVerificationKeys() should be empty")
        void shouldHaveNoVerificationKeys() {
            assertTrue(registry.getVerificationKeys().isEmpty());
        }
    }

    @Nested
    @DisplayName("generateNewKey()")
    class GenerateNewKeyTests {

        @Test
        @DisplayName("should create an active key with a UUID id and seven day lifetime")
        void shouldCreateActiveKey() {
            final var key = registry.generateNewKey();

            assertEquals(KeyStatus.ACTIVE, key.status());
            assertEquals(key.keyId(), UUID.fromString(key.keyId()).toString());
            assertEquals(clock.instant(), key.createdAt());
            assertEquals(clock.instant().plus(Duration.ofDays(7)), key.expiresAt());
            assertEquals(2048, key.publicKey().getModulus().bitLength());
            assertEquals(key, registry.getCurrentSigningKey());
            assertTrue(registry.isReady());
        }

        @Test
        @DisplayName("should fail with KeyGenerationException for an unusable key size")
        void shouldFailForBadKeySize() {
            final var broken = new SigningKeyRegistry(
                    new ConfigFixtures.KeyRotation(Duration.ofHours(24), Duration.ofDays(7), GRACE, -1), clock);

            assertThrows(SigningKeyRegistry.KeyGenerationException.class, broken::generateNewKey);
            assertFalse(broken.isReady());
        }
    }

    @Nested
    @DisplayName("rotateKey()")
    class RotateKeyTests {

        @Test
        @DisplayName("should promote a new key and keep the old one verifiable during grace")
        void shouldKeepOldKeyDuringGrace() {
            final var first = registry.generateNewKey();

            final var second = registry.rotateKey(GRACE);

            assertNotEquals(first.keyId(), second.keyId());
            assertEquals(second.keyId(), registry.getCurrentSigningKey().keyId());

            final var retired = registry.findVerificationKey(first.keyId());
            assertTrue(retired.isPresent());
            assertEquals(KeyStatus.DEPRECATED, retired.get().status());
            assertEquals(clock.instant().plus(GRACE), retired.get().graceEndsAt());
        }

        @Test
        @DisplayName("should stop returning the old key once its grace period ends")
        void shouldHideOldKeyAfterGrace() {
            final var first = registry.generateNewKey();
            registry.rotateKey(GRACE);

            clock.add(GRACE);
            assertTrue(registry.findVerificationKey(first.keyId()).isPresent());

            clock.add(Duration.ofSeconds(1));
            assertTrue(registry.findVerificationKey(first.keyId()).isEmpty());
        }

        @Test
        @DisplayName("should purge keys whose grace has elapsed")
        void shouldPurgeElapsedKeys() {
            final var first = registry.generateNewKey();
            registry.rotateKey(GRACE);
            clock.add(Duration.ofMinutes(10));

            final var third = registry.rotateKey(GRACE);

            final var ids = registry.getVerificationKeys().stream()
                    .map(SigningKeyRecord::keyId)
                    .toList();
            assertFalse(ids.contains(first.keyId()));
            assertEquals(2, ids.size());
            assertEquals(third.keyId(), ids.get(0));
        }
    }

    @Nested
    @DisplayName("findVerificationKey()")
    class FindVerificationKeyTests {

        @Test
        @DisplayName("should return empty for unknown or null ids")
        void shouldReturnEmptyForUnknownId() {
            registry.generateNewKey();

            assertTrue(registry.findVerificationKey("missing").isEmpty());
            assertTrue(registry.findVerificationKey(null).isEmpty());
        }

        @Test
        @DisplayName("should not return the current key past its hard expiry")
        void shouldRejectExpiredCurrentKey() {
            final var key = registry.generateNewKey();
            clock.add(Duration.ofDays(7).plusSeconds(1));

            assertTrue(registry.findVerificationKey(key.keyId()).isEmpty());
        }
    }

    @Nested
    @DisplayName("current key past its lifetime")
    class ExpiredCurrentKeyTests {

        @Test
        @DisplayName("should no longer be handed out for signing")
        void shouldNotSignWithExpiredKey() {
            final var key = registry.generateNewKey();
            clock.add(Duration.ofDays(7));
            assertEquals(key.keyId(), registry.getCurrentSigningKey().keyId());

            clock.add(Duration.ofSeconds(1));

            final var error = assertThrows(
                    SigningKeyRegistry.NoActiveSigningKeyException.class, registry::getCurrentSigningKey);
            assertTrue(error.getMessage().contains(key.keyId()));
            assertTrue(registry.findCurrentKey().isEmpty());
            assertFalse(registry.isReady());
        }

        @Test
        @DisplayName("rotation should replace it without granting grace")
        void rotationShouldNotExtendExpiredKey() {
            final var expired = registry.generateNewKey();
            clock.add(Duration.ofDays(7).plusSeconds(1));

            final var replacement = registry.rotateKey(GRACE);

            assertEquals(replacement.keyId(), registry.getCurrentSigningKey().keyId());
            assertTrue(registry.findVerificationKey(expired.keyId()).isEmpty());
            assertEquals(1, registry.getVerificationKeys().size());
            assertTrue(registry.isReady());
        }
    }

    @Nested
    @DisplayName("purgeExpiredKeys()")
    class PurgeTests {

        @Test
        @DisplayName("should remove retired keys past grace and never the current key")
        void shouldRemoveRetiredKeysOnly() {
            registry.generateNewKey();
            registry.rotateKey(GRACE);
            final var current = registry.rotateKey(GRACE);
            clock.add(Duration.ofMinutes(6));

            assertEquals(2, registry.purgeExpiredKeys());
            assertEquals(0, registry.purgeExpiredKeys());
            assertEquals(current.keyId(), registry.getCurrentSigningKey().keyId());
        }
    }

    @Test
    @DisplayName("concurrent lookups during rotation should always see a current key")
    void concurrentLookupsDuringRotation() throws Exception {
        registry.generateNewKey();
        final var executor = Executors.newFixedThreadPool(4);
        final var start = new CountDownLatch(1);
        final var failures = new AtomicInteger();
        final var futures = new ArrayList<Future<?>>();
        try {
            for (int i = 0; i < 3; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int j = 0; j < 500; j++) {
                        final var current = registry.getCurrentSigningKey();
                        if (!current.canSign()) {
                            failures.incrementAndGet();
                        }
                    }
                    return null;
                }));
            }
            futures.add(executor.submit(() -> {
                start.await();
                for (int j = 0; j < 3; j++) {
                    registry.rotateKey(GRACE);
                }
                return null;
            }));
            start.countDown();
            for (var future : futures) {
                future.get(60, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(0, failures.get());
        assertEquals(4, registry.getVerificationKeys().size());
    }
}
