package warden.core.port.out;

import warden.core.model.auth.TokenType;
import warden.core.model.auth.ValidationErrorKind;

/**
 * Port for recording credential lifecycle metrics.
 *
 * <p>Implementations must never throw; metrics are observability only.
 */
public interface CredentialMetrics {

    void recordTokenIssued(TokenType type);

    void recordValidation(ValidationErrorKind outcome);

    /**
     * @param outcome one of {@code revoked}, {@code rejected}, {@code failed}
     */
    void recordRevocation(String outcome);

    void recordKeyRotation(boolean success);

    void recordRevocationCleanup(boolean success);

    void recordRedisTimeout(String repository, String operation);

    /**
     * No-op implementation for tests and wiring without a registry.
     */
    CredentialMetrics NOOP = new CredentialMetrics() {
        @Override
        public void recordTokenIssued(TokenType type) {}

        @Override
        public void recordValidation(ValidationErrorKind outcome) {}

        @Override
        public void recordRevocation(String outcome) {}

        @Override
        public void recordKeyRotation(boolean success) {}

        @Override
        public void recordRevocationCleanup(boolean success) {}

        @Override
        public void recordRedisTimeout(String repository, String operation) {}
    };
}
