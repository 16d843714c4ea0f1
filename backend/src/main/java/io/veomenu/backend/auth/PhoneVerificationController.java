package io.veomenu.backend.auth;

import io.veomenu.backend.session.AuthenticatedUser;
import io.veomenu.backend.user.UserResponse;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import java.time.Instant;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Phone number changes for the signed-in user, confirmed by a texted code. */
@RestController
@RequestMapping("/api/users/me/phone-verification")
public class PhoneVerificationController {

  private final PhoneVerificationService phoneVerificationService;

  public PhoneVerificationController(PhoneVerificationService phoneVerificationService) {
    this.phoneVerificationService = phoneVerificationService;
  }

  @PostMapping
  public ResponseEntity<PhoneCodeSentResponse> request(
      @AuthenticationPrincipal AuthenticatedUser caller,
      @Valid @RequestBody PhoneVerificationRequest request) {
    var delivery = phoneVerificationService.request(caller.userId(), request.phone());
    return ResponseEntity.ok(PhoneCodeSentResponse.of(delivery));
  }

  @PostMapping("/confirm")
  public ResponseEntity<PhoneVerifiedResponse> confirm(
      @AuthenticationPrincipal AuthenticatedUser caller,
      @Valid @RequestBody ConfirmPhoneRequest request) {
    var user = phoneVerificationService.confirm(caller.userId(), request.code());
    return ResponseEntity.ok(
        new PhoneVerifiedResponse("Phone number verified successfully.", UserResponse.from(user)));
  }

  @GetMapping("/cooldown")
  public ResponseEntity<PhoneVerificationStatus> cooldown(
      @AuthenticationPrincipal AuthenticatedUser caller) {
    return ResponseEntity.ok(phoneVerificationService.cooldown(caller.userId()));
  }

  public record PhoneVerificationRequest(
      @NotBlank(message = "phone is required")
          @Size(max = 32, message = "phone must be at most 32 characters")
          String phone) {}

  public record ConfirmPhoneRequest(
      @NotBlank(message = "code is required")
          @Pattern(regexp = "\\d{6}", message = "code must be 6 digits")
          String code) {}

  public record PhoneCodeSentResponse(
      String message,
      UUID verificationId,
      String phone,
      Instant expiresAt,
      long expiresInMinutes,
      boolean delivered) {

    static PhoneCodeSentResponse of(PhoneVerificationService.PhoneCodeDelivery delivery) {
      return new PhoneCodeSentResponse(
          "Verification code sent to your phone number.",
          delivery.verificationId(),
          delivery.phone(),
          delivery.expiresAt(),
          delivery.validMinutes(),
          delivery.delivered());
    }
  }

  public record PhoneVerifiedResponse(String message, UserResponse user) {}
}
