package io.veomenu.backend.auth;

import io.veomenu.backend.notification.DispatchResult;
import io.veomenu.backend.security.ClientIpResolver;
import io.veomenu.backend.session.AuthenticatedUser;
import io.veomenu.backend.session.DeviceMetadata;
import io.veomenu.backend.session.SessionTokens;
import io.veomenu.backend.user.UserResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import org.springframework.core.env.Environment;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Passwordless authentication endpoints. All are unauthenticated except logout. The magic-link
 * request answers identically whether or not the email is known; in local/dev/test profiles it
 * also returns the link.
 */
@RestController
@RequestMapping("/api/auth")
public class AuthController {

  private static final String GENERIC_LINK_MESSAGE =
      "If an account exists for this email, a login link has been sent.";

  private final RegistrationService registrationService;
  private final PasswordlessLoginService loginService;
  private final Environment environment;

  public AuthController(
      RegistrationService registrationService,
      PasswordlessLoginService loginService,
      Environment environment) {
    this.registrationService = registrationService;
    this.loginService = loginService;
    this.environment = environment;
  }

  @PostMapping("/register")
  public ResponseEntity<CodeSentResponse> register(
      @Valid @RequestBody RegisterRequest request, HttpServletRequest httpRequest) {
    var registration =
        PendingRegistration.of(
            request.email(), request.phone(), request.name(), request.language());
    var delivery =
        registrationService.register(registration, ClientIpResolver.resolve(httpRequest));
    return ResponseEntity.ok(
        CodeSentResponse.of("Verification code sent to your email and phone.", delivery));
  }

  @PostMapping("/verify-otp")
  public ResponseEntity<AuthResponse> verifyOtp(
      @Valid @RequestBody VerifyOtpRequest request, HttpServletRequest httpRequest) {
    var login =
        registrationService.verify(
            request.email(), request.phone(), request.otpCode(), deviceOf(httpRequest));
    return ResponseEntity.status(HttpStatus.CREATED).body(AuthResponse.of(login));
  }

  @PostMapping("/resend-otp")
  public ResponseEntity<CodeSentResponse> resendOtp(
      @Valid @RequestBody ResendOtpRequest request, HttpServletRequest httpRequest) {
    var delivery =
        registrationService.resend(
            request.email(), request.phone(), ClientIpResolver.resolve(httpRequest));
    return ResponseEntity.ok(
        CodeSentResponse.of("A new verification code has been sent.", delivery));
  }

  @PostMapping("/request-magic-link")
  public ResponseEntity<MagicLinkResponse> requestMagicLink(
      @Valid @RequestBody MagicLinkRequest request, HttpServletRequest httpRequest) {
    var issued =
        loginService.requestMagicLink(request.email(), ClientIpResolver.resolve(httpRequest));
    String magicLink = isDevProfile() ? issued.map(IssuedMagicLink::url).orElse(null) : null;
    return ResponseEntity.ok(new MagicLinkResponse(GENERIC_LINK_MESSAGE, magicLink));
  }

  @PostMapping("/verify-magic-link")
  public ResponseEntity<AuthResponse> verifyMagicLink(
      @Valid @RequestBody VerifyMagicLinkRequest request, HttpServletRequest httpRequest) {
    var login = loginService.verifyMagicLink(request.token(), deviceOf(httpRequest));
    return ResponseEntity.ok(AuthResponse.of(login));
  }

  @PostMapping("/refresh")
  public ResponseEntity<TokenResponse> refresh(@Valid @RequestBody RefreshRequest request) {
    return ResponseEntity.ok(TokenResponse.of(loginService.refresh(request.refreshToken())));
  }

  @PostMapping("/logout")
  public ResponseEntity<Void> logout(@AuthenticationPrincipal AuthenticatedUser caller) {
    loginService.logout(caller);
    return ResponseEntity.noContent().build();
  }

  private static DeviceMetadata deviceOf(HttpServletRequest request) {
    return new DeviceMetadata(
        request.getHeader(HttpHeaders.USER_AGENT), ClientIpResolver.resolve(request));
  }

  private boolean isDevProfile() {
    for (String profile : environment.getActiveProfiles()) {
      if ("local".equals(profile) || "test".equals(profile) || "dev".equals(profile)) {
        return true;
      }
    }
    return false;
  }

  // --- DTOs ---

  public record RegisterRequest(
      @NotBlank(message = "email is required") @Email(message = "invalid email format")
          String email,
      @NotBlank(message = "name is required")
          @Size(max = 255, message = "name must be at most 255 characters")
          String name,
      @NotBlank(message = "phone is required")
          @Size(max = 32, message = "phone must be at most 32 characters")
          String phone,
      @Pattern(regexp = "[a-z]{2}(-[A-Z]{2})?", message = "language must be like 'en' or 'pt-BR'")
          String language) {}

  public record VerifyOtpRequest(
      @NotBlank(message = "email is required") @Email(message = "invalid email format")
          String email,
      @NotBlank(message = "phone is required") String phone,
      @NotBlank(message = "otpCode is required")
          @Pattern(regexp = "\\d{6}", message = "otpCode must be 6 digits")
          String otpCode) {}

  public record ResendOtpRequest(
      @NotBlank(message = "email is required") @Email(message = "invalid email format")
          String email,
      @NotBlank(message = "phone is required") String phone) {}

  public record MagicLinkRequest(
      @NotBlank(message = "email is required") @Email(message = "invalid email format")
          String email) {}

  public record VerifyMagicLinkRequest(@NotBlank(message = "token is required") String token) {}

  public record RefreshRequest(
      @NotBlank(message = "refreshToken is required") String refreshToken) {}

  public record CodeSentResponse(
      String message, long expiresInMinutes, Map<String, Boolean> dispatch) {

    static CodeSentResponse of(String message, RegistrationService.CodeDelivery delivery) {
      Map<String, Boolean> channels = new LinkedHashMap<>();
      for (DispatchResult.ChannelResult result : delivery.dispatch().channels()) {
        channels.put(result.channelId(), result.success());
      }
      return new CodeSentResponse(message, delivery.validMinutes(), channels);
    }
  }

  public record MagicLinkResponse(String message, String magicLink) {}

  public record TokenResponse(
      UUID sessionId,
      String accessToken,
      String refreshToken,
      String tokenType,
      long expiresIn) {

    static TokenResponse of(SessionTokens tokens) {
      return new TokenResponse(
          tokens.sessionId(),
          tokens.accessToken(),
          tokens.refreshToken(),
          "Bearer",
          tokens.accessExpiresInSeconds());
    }
  }

  public record AuthResponse(TokenResponse session, UserResponse user) {

    static AuthResponse of(VerifiedLogin login) {
      return new AuthResponse(TokenResponse.of(login.tokens()), UserResponse.from(login.user()));
    }
  }
}
