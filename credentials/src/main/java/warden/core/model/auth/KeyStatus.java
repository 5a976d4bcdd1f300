package warden.core.model.auth;

/**
 * Lifecycle status of a signing key.
 *
 * <p>Keys transition through these states:
 * <pre>
 * ACTIVE → DEPRECATED → (purged)
 * </pre>
 *
 * <ul>
 *   <li>{@link #ACTIVE} - The current key, used for signing and verification</li>
 *   <li>{@link #DEPRECATED} - Retired from signing, verifies until its grace period ends</li>
 * </ul>
 *
 * <p>Keys past their grace period are removed from the registry entirely.
 */
public enum KeyStatus {

    /**
     * Key signs new tokens and verifies existing ones.
     * Exactly one key is ACTIVE once startup completes.
     */
    ACTIVE,

    /**
     * Key no longer signs but still verifies tokens issued before rotation.
     */
    DEPRECATED
}
