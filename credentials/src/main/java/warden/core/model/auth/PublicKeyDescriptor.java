package warden.core.model.auth;

import java.util.Map;

/**
 * Public half of a verification key, for verifiers outside this process.
 *
 * @param keyId     key identifier, matches the JWT 'kid' header
 * @param algorithm JWS algorithm the key verifies (RS256)
 * @param jwk       JSON Web Key parameters (kty, kid, use, alg, n, e)
 * @param pem       X.509 SubjectPublicKeyInfo in PEM armour
 */
public record PublicKeyDescriptor(String keyId, String algorithm, Map<String, Object> jwk, String pem) {

    public PublicKeyDescriptor {
        jwk = jwk == null ? Map.of() : Map.copyOf(jwk);
    }
}
