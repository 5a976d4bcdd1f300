package warden.core.model.auth;

import java.time.Instant;

/**
 * A freshly signed credential.
 *
 * @param token     compact JWS serialization
 * @param jti       token id
 * @param tokenType access or refresh
 * @param keyId     id of the signing key
 * @param expiresAt expiry claim
 */
public record IssuedToken(String token, String jti, TokenType tokenType, String keyId, Instant expiresAt) {

    @Override
    public String toString() {
        return "IssuedToken[jti=" + jti + ", tokenType=" + tokenType + ", keyId=" + keyId + ", expiresAt="
                + expiresAt + "]";
    }
}
