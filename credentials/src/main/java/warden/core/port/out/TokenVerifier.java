package warden.core.port.out;

import java.util.Optional;

import warden.core.model.auth.PublicKeyDescriptor;
import warden.core.model.auth.SigningKeyRecord;
import warden.core.model.auth.TokenMetadata;
import warden.core.model.auth.TokenValidationResult;

/**
 * Port for checking signature and registered claims of a compact token.
 *
 * <p>Implementations cover everything except revocation: the result is
 * {@link TokenValidationResult.Valid}, {@link TokenValidationResult.Expired}
 * or {@link TokenValidationResult.Invalid}. Never throws for bad input.
 */
public interface TokenVerifier {

    TokenValidationResult verify(String token);

    /**
     * Decode claims without checking the signature.
     *
     * @return metadata, or empty when the token cannot be parsed at all
     */
    Optional<TokenMetadata> decodeUnverified(String token);

    /**
     * Export the public half of a key in the form external verifiers consume.
     */
    PublicKeyDescriptor describe(SigningKeyRecord key);
}
