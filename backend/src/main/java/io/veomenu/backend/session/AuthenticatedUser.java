package io.veomenu.backend.session;

import java.util.UUID;

/** Security principal bound by {@link SessionAuthFilter} for bearer-authenticated requests. */
public record AuthenticatedUser(UUID userId, UUID sessionId) {}
