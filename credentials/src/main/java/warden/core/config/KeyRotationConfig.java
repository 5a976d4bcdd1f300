package warden.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Configuration for signing key rotation.
 *
 * <p>Example configuration:
 * <pre>{@code
 * warden.auth.key-rotation.rotation-interval=PT24H
 * warden.auth.key-rotation.key-lifetime=P7D
 * warden.auth.key-rotation.grace-period=PT5M
 * warden.auth.key-rotation.key-size=2048
 * }</pre>
 */
@ConfigMapping(prefix = "warden.auth.key-rotation")
public interface KeyRotationConfig {

    /**
     * Smallest grace period honoured; shorter configured values are raised to this.
     */
    Duration MINIMUM_GRACE_PERIOD = Duration.ofMinutes(5);

    /**
     * How often the background ticker rotates the signing key.
     */
    @WithName("rotation-interval")
    @WithDefault("PT24H")
    Duration rotationInterval();

    /**
     * Hard expiry of a key measured from its creation.
     *
     * <p>Default: 7 days. Must exceed the rotation interval so the current
     * key never expires between rotations; startup fails otherwise.
     */
    @WithName("key-lifetime")
    @WithDefault("P7D")
    Duration keyLifetime();

    /**
     * How long a retired key keeps verifying tokens it signed.
     *
     * <p>Default: 5 minutes, which is also the minimum.
     */
    @WithName("grace-period")
    @WithDefault("PT5M")
    Duration gracePeriod();

    /**
     * RSA key size in bits.
     *
     * <p>Default: 2048. Higher values (e.g., 4096) provide more security
     * but slower signing/verification.
     */
    @WithName("key-size")
    @WithDefault("2048")
    int keySize();

    /**
     * Grace period with the minimum applied.
     */
    default Duration effectiveGracePeriod() {
        final var configured = gracePeriod();
        if (configured == null || configured.compareTo(MINIMUM_GRACE_PERIOD) < 0) {
            return MINIMUM_GRACE_PERIOD;
        }
        return configured;
    }
}
