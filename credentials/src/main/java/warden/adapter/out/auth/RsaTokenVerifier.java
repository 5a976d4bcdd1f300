package warden.adapter.out.auth;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.Base64;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;
import org.jose4j.jwa.AlgorithmConstraints;
import org.jose4j.jwk.JsonWebKey;
import org.jose4j.jwk.RsaJsonWebKey;
import org.jose4j.jwk.Use;
import org.jose4j.jws.AlgorithmIdentifiers;
import org.jose4j.jws.JsonWebSignature;
import org.jose4j.jwt.JwtClaims;
import org.jose4j.jwt.MalformedClaimException;
import org.jose4j.jwt.NumericDate;
import org.jose4j.jwt.consumer.ErrorCodes;
import org.jose4j.jwt.consumer.InvalidJwtException;
import org.jose4j.jwt.consumer.JwtConsumerBuilder;
import org.jose4j.jwt.consumer.JwtContext;
import org.jose4j.lang.JoseException;

import warden.core.config.TokenConfig;
import warden.core.model.auth.PublicKeyDescriptor;
import warden.core.model.auth.SigningKeyRecord;
import warden.core.model.auth.TokenClaims;
import warden.core.model.auth.TokenMetadata;
import warden.core.model.auth.TokenType;
import warden.core.model.auth.TokenValidationResult;
import warden.core.model.auth.ValidationErrorKind;
import warden.core.port.out.TokenVerifier;
import warden.core.service.auth.SigningKeyRegistry;

/**
 * RS256 token verifier backed by the {@link SigningKeyRegistry}.
 *
 * <p>Checks, in order: header structure, algorithm, key id, signature,
 * issuer and audience, then expiry and not-before with the configured leeway.
 * A token counts as expired once {@code now >= exp + leeway}, at second
 * resolution.
 */
@ApplicationScoped
public class RsaTokenVerifier implements TokenVerifier {

    private static final Logger LOG = Logger.getLogger(RsaTokenVerifier.class);

    private static final AlgorithmConstraints RS256_ONLY = new AlgorithmConstraints(
            AlgorithmConstraints.ConstraintType.PERMIT, AlgorithmIdentifiers.RSA_USING_SHA256);

    private final SigningKeyRegistry keyRegistry;
    private final TokenConfig config;
    private final Clock clock;

    @Inject
    public RsaTokenVerifier(SigningKeyRegistry keyRegistry, TokenConfig config, Clock clock) {
        this.keyRegistry = keyRegistry;
        this.config = config;
        this.clock = clock;
    }

    @Override
    public TokenValidationResult verify(String token) {
        if (token == null || token.isBlank()) {
            return invalid(ValidationErrorKind.MALFORMED, "Token is empty");
        }

        final String algorithm;
        final String keyId;
        try {
            final var jws = new JsonWebSignature();
            jws.setCompactSerialization(token);
            algorithm = jws.getAlgorithmHeaderValue();
            keyId = jws.getKeyIdHeaderValue();
        } catch (JoseException e) {
            return invalid(ValidationErrorKind.MALFORMED, "Unparseable token: " + e.getMessage());
        }

        if (!AlgorithmIdentifiers.RSA_USING_SHA256.equals(algorithm)) {
            return invalid(ValidationErrorKind.UNSUPPORTED_ALGORITHM, "Unsupported algorithm: " + algorithm);
        }
        if (keyId == null || keyId.isBlank()) {
            return invalid(ValidationErrorKind.MALFORMED, "Missing kid header");
        }

        final var key = keyRegistry.findVerificationKey(keyId);
        if (key.isEmpty()) {
            return invalid(ValidationErrorKind.UNKNOWN_KEY, "Unknown or retired key: " + keyId);
        }

        final var consumer = new JwtConsumerBuilder()
                .setRequireSubject()
                .setRequireExpirationTime()
                .setRequireJwtId()
                .setExpectedIssuer(config.issuer())
                .setExpectedAudience(config.audience())
                .setAllowedClockSkewInSeconds((int) config.leeway().toSeconds())
                .setEvaluationTime(NumericDate.fromSeconds(clock.instant().getEpochSecond()))
                .setJwsAlgorithmConstraints(RS256_ONLY)
                .setVerificationKey(key.get().publicKey())
                .build();

        try {
            final var claims = consumer.processToClaims(token);
            return toClaims(claims, keyId)
                    .<TokenValidationResult>map(TokenValidationResult.Valid::new)
                    .orElseGet(() -> invalid(ValidationErrorKind.MALFORMED, "Missing or unknown token_type"));
        } catch (InvalidJwtException e) {
            return classify(e, keyId);
        }
    }

    @Override
    public Optional<TokenMetadata> decodeUnverified(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        // read claims only; nothing here is trusted
        final var consumer = new JwtConsumerBuilder()
                .setSkipSignatureVerification()
                .setSkipAllValidators()
                .setDisableRequireSignature()
                .setSkipAllDefaultValidators()
                .build();
        try {
            final var context = consumer.process(token);
            final var claims = context.getJwtClaims();
            final var expiration = claims.getExpirationTime();
            final var expired = expiration != null && clock.instant().getEpochSecond() >= expiration.getValue();
            final var keyId = context.getJoseObjects().isEmpty()
                    ? null
                    : context.getJoseObjects().get(0).getKeyIdHeaderValue();
            return Optional.of(new TokenMetadata(toClaims(claims, keyId).orElse(null), claims.getClaimsMap(), expired));
        } catch (InvalidJwtException | MalformedClaimException e) {
            LOG.debugv("Unable to decode token: {0}", e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public PublicKeyDescriptor describe(SigningKeyRecord key) {
        final var jwk = new RsaJsonWebKey(key.publicKey());
        jwk.setKeyId(key.keyId());
        jwk.setUse(Use.SIGNATURE);
        jwk.setAlgorithm(AlgorithmIdentifiers.RSA_USING_SHA256);
        return new PublicKeyDescriptor(
                key.keyId(),
                AlgorithmIdentifiers.RSA_USING_SHA256,
                jwk.toParams(JsonWebKey.OutputControlLevel.PUBLIC_ONLY),
                toPem(key));
    }

    private static String toPem(SigningKeyRecord key) {
        final var encoder = Base64.getMimeEncoder(64, "\n".getBytes(StandardCharsets.US_ASCII));
        return "-----BEGIN PUBLIC KEY-----\n"
                + encoder.encodeToString(key.publicKey().getEncoded())
                + "\n-----END PUBLIC KEY-----\n";
    }

    private TokenValidationResult classify(InvalidJwtException e, String keyId) {
        if (e.hasErrorCode(ErrorCodes.SIGNATURE_INVALID)) {
            return invalid(ValidationErrorKind.BAD_SIGNATURE, "Signature does not verify with key " + keyId);
        }
        if (e.hasErrorCode(ErrorCodes.ISSUER_INVALID)
                || e.hasErrorCode(ErrorCodes.ISSUER_MISSING)
                || e.hasErrorCode(ErrorCodes.AUDIENCE_INVALID)
                || e.hasErrorCode(ErrorCodes.AUDIENCE_MISSING)
                || e.hasErrorCode(ErrorCodes.NOT_YET_VALID)) {
            return invalid(ValidationErrorKind.INVALID_CLAIMS, summarize(e));
        }
        if (e.hasExpired()) {
            final var claims = Optional.ofNullable(e.getJwtContext())
                    .map(JwtContext::getJwtClaims)
                    .flatMap(c -> toClaims(c, keyId));
            claims.ifPresentOrElse(
                    c -> LOG.debugf("Token %s for %s has expired", c.jti(), c.subject()),
                    () -> LOG.debug("Token has expired"));
            return new TokenValidationResult.Expired(claims.orElse(null));
        }
        return invalid(ValidationErrorKind.MALFORMED, summarize(e));
    }

    private Optional<TokenClaims> toClaims(JwtClaims claims, String keyId) {
        try {
            final var tokenType = TokenType.fromClaim(claims.getStringClaimValue(RsaTokenSigner.CLAIM_TOKEN_TYPE));
            if (tokenType.isEmpty() || claims.getSubject() == null || claims.getJwtId() == null) {
                return Optional.empty();
            }
            final var audience = claims.getAudience();
            return Optional.of(new TokenClaims(
                    claims.getSubject(),
                    claims.getStringClaimValue(RsaTokenSigner.CLAIM_LOGIN_ID),
                    tokenType.get(),
                    claims.getJwtId(),
                    claims.getIssuer(),
                    audience == null || audience.isEmpty() ? null : audience.get(0),
                    toInstant(claims.getIssuedAt()),
                    toInstant(claims.getExpirationTime()),
                    toInstant(claims.getNotBefore()),
                    keyId));
        } catch (MalformedClaimException e) {
            LOG.debugv("Malformed claims: {0}", e.getMessage());
            return Optional.empty();
        }
    }

    private static Instant toInstant(NumericDate date) {
        return date == null ? null : Instant.ofEpochSecond(date.getValue());
    }

    private static String summarize(InvalidJwtException e) {
        final var details = e.getErrorDetails();
        if (details == null || details.isEmpty()) {
            return e.getMessage();
        }
        return details.get(0).getErrorMessage();
    }

    private static TokenValidationResult invalid(ValidationErrorKind kind, String reason) {
        switch (kind) {
            case UNSUPPORTED_ALGORITHM, BAD_SIGNATURE, INVALID_CLAIMS ->
                LOG.warnv("Rejected token ({0}): {1}", kind, reason);
            case UNKNOWN_KEY -> LOG.infov("Rejected token ({0}): {1}", kind, reason);
            default -> LOG.debugv("Rejected token ({0}): {1}", kind, reason);
        }
        return new TokenValidationResult.Invalid(kind, reason);
    }
}
