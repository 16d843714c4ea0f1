package io.veomenu.backend.auth;

import io.veomenu.backend.session.SessionTokens;
import io.veomenu.backend.user.User;

/** A verified identity together with the session credentials issued for it. */
public record VerifiedLogin(User user, SessionTokens tokens) {}
