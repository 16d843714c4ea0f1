package io.veomenu.backend.session;

import java.util.UUID;

/**
 * Credential pair returned to a client after login or refresh.
 *
 * @param sessionId the backing {@link UserSession}
 * @param accessToken signed, self-contained bearer token
 * @param refreshToken opaque token exchangeable for a new pair
 * @param accessExpiresInSeconds remaining lifetime of the access token
 */
public record SessionTokens(
    UUID sessionId, String accessToken, String refreshToken, long accessExpiresInSeconds) {}
