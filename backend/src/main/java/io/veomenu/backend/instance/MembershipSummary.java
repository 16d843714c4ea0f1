package io.veomenu.backend.instance;

import java.util.UUID;

/** An instance as seen by one of its members. */
public record MembershipSummary(
    UUID instanceId, String name, String slug, InstanceStatus status, MembershipRole role) {}
