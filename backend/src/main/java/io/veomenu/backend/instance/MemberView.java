package io.veomenu.backend.instance;

import java.time.Instant;
import java.util.UUID;

/** A member of an instance with the account fields shown in member lists. */
public record MemberView(
    UUID userId, String email, String name, MembershipRole role, Instant joinedAt) {}
