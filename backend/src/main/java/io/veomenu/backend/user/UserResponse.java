package io.veomenu.backend.user;

import java.time.Instant;
import java.util.UUID;

public record UserResponse(
    UUID id,
    String email,
    String name,
    String phone,
    boolean phoneVerified,
    String language,
    Instant dateJoined,
    Instant lastLogin) {

  public static UserResponse from(User user) {
    return new UserResponse(
        user.getId(),
        user.getEmail(),
        user.getName(),
        user.getPhone(),
        user.isPhoneVerified(),
        user.getLanguage(),
        user.getDateJoined(),
        user.getLastLogin());
  }
}
