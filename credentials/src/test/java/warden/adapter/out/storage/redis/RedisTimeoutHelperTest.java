package warden.adapter.out.storage.redis;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import java.time.Duration;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import warden.adapter.out.storage.redis.RedisTimeoutHelper.RedisTimeoutException;
import warden.core.port.out.CredentialMetrics;

@DisplayName("RedisTimeoutHelper")
@ExtendWith(MockitoExtension.class)
class RedisTimeoutHelperTest {

    private static final Duration TIMEOUT = Duration.ofMillis(50);
    private static final String REPOSITORY_NAME = "TestRepository";
    private static final String OPERATION_NAME = "testOperation";

    @Mock
    private CredentialMetrics metrics;

    private RedisTimeoutHelper helper;

    @BeforeEach
    void setUp() {
        helper = new RedisTimeoutHelper(TIMEOUT, metrics, REPOSITORY_NAME);
    }

    @Test
    @DisplayName("should return result when operation completes within timeout")
    void shouldReturnResultWhenOperationCompletesWithinTimeout() {
        final var result = helper.withTimeout(Uni.createFrom().item("success"), OPERATION_NAME)
                .await()
                .indefinitely();

        assertEquals("success", result);
        verifyNoInteractions(metrics);
    }

    @Test
    @DisplayName("should throw RedisTimeoutException when operation times out")
    void shouldThrowRedisTimeoutExceptionWhenOperationTimesOut() {
        final var operation = Uni.createFrom().<String>nothing();

        final var exception = assertThrows(
                RedisTimeoutException.class,
                () -> helper.withTimeout(operation, OPERATION_NAME).await().indefinitely());

        assertEquals(OPERATION_NAME, exception.getOperation());
        assertEquals(REPOSITORY_NAME, exception.getRepository());
        assertTrue(exception.getMessage().contains(OPERATION_NAME));
        verify(metrics).recordRedisTimeout(eq(REPOSITORY_NAME), eq(OPERATION_NAME));
    }

    @Test
    @DisplayName("should propagate non-timeout failures unchanged")
    void shouldPropagateOtherFailures() {
        final var operation = Uni.createFrom().<String>failure(new IllegalStateException("connection reset"));

        final var exception = assertThrows(
                IllegalStateException.class,
                () -> helper.withTimeout(operation, OPERATION_NAME).await().indefinitely());

        assertEquals("connection reset", exception.getMessage());
        verifyNoInteractions(metrics);
    }

    @Test
    @DisplayName("should tolerate a missing metrics instance")
    void shouldTolerateNullMetrics() {
        final var withoutMetrics = new RedisTimeoutHelper(TIMEOUT, null, REPOSITORY_NAME);

        assertThrows(
                RedisTimeoutException.class,
                () -> withoutMetrics
                        .withTimeout(Uni.createFrom().<String>nothing(), OPERATION_NAME)
                        .await()
                        .indefinitely());
    }
}
