package warden.adapter.out.storage.redis;

import java.time.Duration;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.port.out.CredentialMetrics;

/**
 * Bounds Redis operations by a fixed timeout.
 *
 * <p>Operations exceeding the timeout fail with {@link RedisTimeoutException};
 * other failures (connection errors, server errors) propagate unchanged.
 * Nothing here degrades to a fallback value: revocation lookups must fail
 * rather than report "not revoked".
 */
public class RedisTimeoutHelper {

    private static final Logger LOG = Logger.getLogger(RedisTimeoutHelper.class);

    private final Duration timeout;
    private final CredentialMetrics metrics;
    private final String repositoryName;

    /**
     * Create a new timeout helper.
     *
     * @param timeout the timeout duration for Redis operations
     * @param metrics the metrics instance for recording timeouts (may be null)
     * @param repositoryName the repository name for metrics tagging
     */
    public RedisTimeoutHelper(Duration timeout, CredentialMetrics metrics, String repositoryName) {
        this.timeout = timeout;
        this.metrics = metrics;
        this.repositoryName = repositoryName;
    }

    /**
     * Apply timeout to an operation that should fail on timeout.
     *
     * @param operation the Redis operation
     * @param operationName name for logging and metrics
     * @param <T> the result type
     * @return a Uni that fails with RedisTimeoutException on timeout; other failures propagate
     */
    public <T> Uni<T> withTimeout(Uni<T> operation, String operationName) {
        return operation.ifNoItem().after(timeout).failWith(() -> {
            LOG.warnv("Redis operation timeout: {0} in {1} after {2}", operationName, repositoryName, timeout);
            if (metrics != null) {
                metrics.recordRedisTimeout(repositoryName, operationName);
            }
            return new RedisTimeoutException(operationName, repositoryName);
        });
    }

    /**
     * Exception indicating a Redis operation timeout.
     */
    public static class RedisTimeoutException extends RuntimeException {
        private final String operation;
        private final String repository;

        public RedisTimeoutException(String operation, String repository) {
            super("Redis operation timeout: " + operation + " in " + repository);
            this.operation = operation;
            this.repository = repository;
        }

        /** Returns the name of the operation that timed out. */
        public String getOperation() {
            return operation;
        }

        /** Returns the repository where the timeout occurred. */
        public String getRepository() {
            return repository;
        }
    }
}
