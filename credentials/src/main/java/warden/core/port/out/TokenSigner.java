package warden.core.port.out;

import warden.core.model.auth.SigningKeyRecord;
import warden.core.model.auth.TokenClaims;

/**
 * Port for producing signed compact tokens.
 */
public interface TokenSigner {

    /**
     * Sign the given claims with the given key.
     *
     * @param claims claims to embed; {@code keyId} is taken from the key
     * @param key    the current signing key
     * @return compact JWS serialization
     * @throws TokenIssuanceException if signing fails
     */
    String sign(TokenClaims claims, SigningKeyRecord key);

    /**
     * Exception thrown when a token cannot be signed.
     */
    class TokenIssuanceException extends RuntimeException {
        public TokenIssuanceException(String message) {
            super(message);
        }

        public TokenIssuanceException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
