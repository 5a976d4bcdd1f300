package warden.core.model.auth;

import java.util.Optional;

/**
 * Kind of credential carried in the {@code token_type} claim.
 */
public enum TokenType {
    ACCESS("access"),
    REFRESH("refresh");

    private final String claimValue;

    TokenType(String claimValue) {
        this.claimValue = claimValue;
    }

    public String claimValue() {
        return claimValue;
    }

    /**
     * Resolve a token type from its claim value.
     *
     * @param value the raw {@code token_type} claim (may be null)
     * @return the matching type, or empty if unknown
     */
    public static Optional<TokenType> fromClaim(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (var type : values()) {
            if (type.claimValue.equals(value)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
