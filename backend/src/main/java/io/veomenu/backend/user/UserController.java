package io.veomenu.backend.user;

import io.veomenu.backend.instance.InstanceService;
import io.veomenu.backend.instance.MembershipSummary;
import io.veomenu.backend.session.AuthenticatedUser;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/users/me")
public class UserController {

  private final UserService userService;
  private final InstanceService instanceService;

  public UserController(UserService userService, InstanceService instanceService) {
    this.userService = userService;
    this.instanceService = instanceService;
  }

  /** The caller's profile with the instances they belong to. */
  @GetMapping
  public ResponseEntity<MeResponse> me(@AuthenticationPrincipal AuthenticatedUser caller) {
    var user = userService.getUser(caller.userId());
    return ResponseEntity.ok(
        new MeResponse(
            UserResponse.from(user), instanceService.listInstancesForUser(caller.userId())));
  }

  @PatchMapping
  public ResponseEntity<UserResponse> updateProfile(
      @AuthenticationPrincipal AuthenticatedUser caller,
      @Valid @RequestBody UpdateProfileRequest request) {
    var user =
        userService.updateProfile(
            caller.userId(), request.name(), request.phone(), request.language());
    return ResponseEntity.ok(UserResponse.from(user));
  }

  public record MeResponse(UserResponse user, List<MembershipSummary> instances) {}

  public record UpdateProfileRequest(
      @Size(min = 1, max = 255, message = "name must be 1 to 255 characters")
          @Pattern(regexp = "(?s).*\\S.*", message = "name must not be blank")
          String name,
      @Size(max = 20, message = "phone must be at most 20 characters") String phone,
      @Pattern(regexp = "[a-z]{2}(-[A-Z]{2})?", message = "language must be like 'en' or 'pt-BR'")
          String language) {}
}
