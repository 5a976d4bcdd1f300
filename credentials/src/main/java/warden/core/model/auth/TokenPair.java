package warden.core.model.auth;

/**
 * Access and refresh tokens issued together by a refresh.
 */
public record TokenPair(IssuedToken accessToken, IssuedToken refreshToken) {}
