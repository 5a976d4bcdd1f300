package warden.adapter.out.telemetry;

import java.util.Locale;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import warden.core.model.auth.TokenType;
import warden.core.model.auth.ValidationErrorKind;
import warden.core.port.out.CredentialMetrics;

/**
 * Micrometer implementation of {@link CredentialMetrics}.
 *
 * <p>Records metrics for:
 * <ul>
 *   <li>{@code warden.tokens.issued} - Tokens issued by type</li>
 *   <li>{@code warden.tokens.validation} - Validation outcomes</li>
 *   <li>{@code warden.tokens.revocation} - Revocation outcomes</li>
 *   <li>{@code warden.keys.rotation} - Key rotation attempts by outcome</li>
 *   <li>{@code warden.revocation.cleanup} - Revocation cleanup runs by outcome</li>
 *   <li>{@code warden.redis.timeouts} - Redis operation timeouts</li>
 * </ul>
 */
@ApplicationScoped
public class MicrometerCredentialMetrics implements CredentialMetrics {

    private final MeterRegistry registry;

    @Inject
    public MicrometerCredentialMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void recordTokenIssued(TokenType type) {
        Counter.builder("warden.tokens.issued")
                .description("Tokens issued")
                .tag("type", type.claimValue())
                .register(registry)
                .increment();
    }

    @Override
    public void recordValidation(ValidationErrorKind outcome) {
        Counter.builder("warden.tokens.validation")
                .description("Token validation outcomes")
                .tag("outcome", outcome.name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }

    @Override
    public void recordRevocation(String outcome) {
        Counter.builder("warden.tokens.revocation")
                .description("Token revocation outcomes")
                .tag("outcome", nullSafe(outcome))
                .register(registry)
                .increment();
    }

    @Override
    public void recordKeyRotation(boolean success) {
        Counter.builder("warden.keys.rotation")
                .description("Signing key rotations")
                .tag("outcome", success ? "success" : "failure")
                .register(registry)
                .increment();
    }

    @Override
    public void recordRevocationCleanup(boolean success) {
        Counter.builder("warden.revocation.cleanup")
                .description("Revocation cleanup runs")
                .tag("outcome", success ? "success" : "failure")
                .register(registry)
                .increment();
    }

    @Override
    public void recordRedisTimeout(String repository, String operation) {
        Counter.builder("warden.redis.timeouts")
                .description("Redis operations that exceeded their timeout")
                .tag("repository", nullSafe(repository))
                .tag("operation", nullSafe(operation))
                .register(registry)
                .increment();
    }

    private static String nullSafe(String value) {
        return value != null ? value : "unknown";
    }
}
