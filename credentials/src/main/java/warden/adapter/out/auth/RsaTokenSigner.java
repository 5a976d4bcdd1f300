package warden.adapter.out.auth;

import jakarta.enterprise.context.ApplicationScoped;

import org.jboss.logging.Logger;
import org.jose4j.jws.AlgorithmIdentifiers;
import org.jose4j.jws.JsonWebSignature;
import org.jose4j.jwt.JwtClaims;
import org.jose4j.jwt.NumericDate;
import org.jose4j.lang.JoseException;

import warden.core.model.auth.SigningKeyRecord;
import warden.core.model.auth.TokenClaims;
import warden.core.port.out.TokenSigner;

/**
 * RS256 (RSA with SHA-256) token signer.
 *
 * <p>Writes the registered claims plus {@code user_id}, {@code login_id} and
 * {@code token_type}, and sets the {@code kid} header to the signing key id.
 */
@ApplicationScoped
public class RsaTokenSigner implements TokenSigner {

    private static final Logger LOG = Logger.getLogger(RsaTokenSigner.class);

    static final String CLAIM_USER_ID = "user_id";
    static final String CLAIM_LOGIN_ID = "login_id";
    static final String CLAIM_TOKEN_TYPE = "token_type";

    @Override
    public String sign(TokenClaims claims, SigningKeyRecord key) {
        if (!key.canSign()) {
            throw new TokenIssuanceException("Key " + key.keyId() + " is not an active signing key");
        }
        try {
            final var jws = new JsonWebSignature();
            jws.setPayload(buildClaims(claims).toJson());
            jws.setKey(key.privateKey());
            jws.setKeyIdHeaderValue(key.keyId());
            jws.setAlgorithmHeaderValue(AlgorithmIdentifiers.RSA_USING_SHA256);
            final var token = jws.getCompactSerialization();
            LOG.debugf("Signed %s token %s with key %s", claims.tokenType().claimValue(), claims.jti(), key.keyId());
            return token;
        } catch (JoseException e) {
            throw new TokenIssuanceException("Failed to sign token: " + e.getMessage(), e);
        }
    }

    private JwtClaims buildClaims(TokenClaims source) {
        final var claims = new JwtClaims();
        claims.setSubject(source.subject());
        claims.setClaim(CLAIM_USER_ID, source.subject());
        if (source.secondaryId() != null) {
            claims.setClaim(CLAIM_LOGIN_ID, source.secondaryId());
        }
        claims.setClaim(CLAIM_TOKEN_TYPE, source.tokenType().claimValue());
        claims.setJwtId(source.jti());
        claims.setIssuer(source.issuer());
        claims.setAudience(source.audience());
        claims.setIssuedAt(NumericDate.fromSeconds(source.issuedAt().getEpochSecond()));
        claims.setNotBefore(NumericDate.fromSeconds(source.notBefore().getEpochSecond()));
        claims.setExpirationTime(NumericDate.fromSeconds(source.expiresAt().getEpochSecond()));
        return claims;
    }
}
