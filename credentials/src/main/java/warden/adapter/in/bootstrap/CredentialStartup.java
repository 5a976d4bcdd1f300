package warden.adapter.in.bootstrap;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;

import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import org.jboss.logging.Logger;

import warden.core.service.auth.CredentialService;
import warden.core.service.auth.SigningKeyRegistry.KeyGenerationException;

/**
 * Starts the credential service with the application.
 *
 * <h2>Failure Behavior</h2>
 * <ul>
 *   <li>If the first signing key cannot be generated: startup FAILS</li>
 *   <li>If the key rotation settings are inconsistent: startup FAILS</li>
 * </ul>
 */
@ApplicationScoped
public class CredentialStartup {

    private static final Logger LOG = Logger.getLogger(CredentialStartup.class);

    private final CredentialService credentialService;

    @Inject
    public CredentialStartup(CredentialService credentialService) {
        this.credentialService = credentialService;
    }

    void onStart(@Observes StartupEvent event) {
        LOG.info("Starting credential service...");
        try {
            credentialService.start();
        } catch (KeyGenerationException | IllegalStateException e) {
            LOG.error("========================================");
            LOG.errorf(e, "CREDENTIALS UNAVAILABLE: %s", e.getMessage());
            LOG.error("========================================");
            throw e; // Re-throw to fail startup
        }
    }

    void onStop(@Observes ShutdownEvent event) {
        credentialService.shutdown();
    }
}
