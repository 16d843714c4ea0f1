package io.veomenu.backend.user;

import io.veomenu.backend.exception.InvalidRequestException;
import io.veomenu.backend.exception.ResourceNotFoundException;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class UserService {

  private static final Logger log = LoggerFactory.getLogger(UserService.class);

  private final UserRepository userRepository;

  public UserService(UserRepository userRepository) {
    this.userRepository = userRepository;
  }

  @Transactional(readOnly = true)
  public User getUser(UUID userId) {
    return userRepository
        .findById(userId)
        .orElseThrow(() -> new ResourceNotFoundException("User", userId));
  }

  /**
   * Applies the non-null fields; the email is the identity key and cannot change here.
   *
   * @throws InvalidRequestException if a phone number is supplied; phone numbers change only by
   *     confirming a texted code
   */
  @Transactional
  public User updateProfile(UUID userId, String name, String phone, String language) {
    if (phone != null) {
      throw new InvalidRequestException(
          "Phone change requires verification",
          "Request a code at /api/users/me/phone-verification to change the phone number");
    }
    User user = getUser(userId);
    user.updateProfile(name != null ? name.trim() : null, language);
    log.info("Updated profile of user {}", userId);
    return user;
  }
}
