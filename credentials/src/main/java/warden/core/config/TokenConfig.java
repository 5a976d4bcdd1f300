package warden.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Configuration for issued credentials.
 *
 * <p>Example configuration:
 * <pre>{@code
 * warden.auth.token.issuer=bolt-tracker
 * warden.auth.token.audience=bolt-api
 * warden.auth.token.access-token-ttl=PT15M
 * warden.auth.token.refresh-token-ttl=PT168H
 * warden.auth.token.leeway=PT2M
 * }</pre>
 */
@ConfigMapping(prefix = "warden.auth.token")
public interface TokenConfig {

    /**
     * Value of the {@code iss} claim, also required on validation.
     */
    @WithDefault("bolt-tracker")
    String issuer();

    /**
     * Value of the {@code aud} claim, also required on validation.
     */
    @WithDefault("bolt-api")
    String audience();

    /**
     * Lifetime of access tokens.
     */
    @WithName("access-token-ttl")
    @WithDefault("PT15M")
    Duration accessTokenTtl();

    /**
     * Lifetime of refresh tokens.
     */
    @WithName("refresh-token-ttl")
    @WithDefault("PT168H")
    Duration refreshTokenTtl();

    /**
     * Clock skew tolerated on expiry and not-before checks.
     */
    @WithDefault("PT2M")
    Duration leeway();
}
