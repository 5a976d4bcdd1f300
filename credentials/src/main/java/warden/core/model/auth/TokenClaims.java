package warden.core.model.auth;

import java.time.Instant;
import java.util.Objects;

/**
 * Claims carried by an issued credential.
 *
 * @param subject     principal id ({@code sub} and {@code user_id})
 * @param secondaryId secondary principal id ({@code login_id}, may be null)
 * @param tokenType   access or refresh
 * @param jti         unique token id, the unit of revocation
 * @param issuer      {@code iss}
 * @param audience    {@code aud}
 * @param issuedAt    {@code iat}
 * @param expiresAt   {@code exp} (null only when decoded from a token lacking it)
 * @param notBefore   {@code nbf}
 * @param keyId       {@code kid} header of the signing key (null before signing)
 */
public record TokenClaims(
        String subject,
        String secondaryId,
        TokenType tokenType,
        String jti,
        String issuer,
        String audience,
        Instant issuedAt,
        Instant expiresAt,
        Instant notBefore,
        String keyId) {

    public TokenClaims {
        Objects.requireNonNull(subject, "subject is required");
        Objects.requireNonNull(tokenType, "tokenType is required");
        Objects.requireNonNull(jti, "jti is required");
    }

    public boolean isRefresh() {
        return tokenType == TokenType.REFRESH;
    }
}
