package io.veomenu.backend.instance;

import io.veomenu.backend.session.AuthenticatedUser;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.net.URI;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Instances of the caller, across tenants. Not tenant-scoped. */
@RestController
@RequestMapping("/api/instances")
public class InstanceController {

  private final InstanceService instanceService;

  public InstanceController(InstanceService instanceService) {
    this.instanceService = instanceService;
  }

  @GetMapping
  public ResponseEntity<List<MembershipSummary>> listInstances(
      @AuthenticationPrincipal AuthenticatedUser caller) {
    return ResponseEntity.ok(instanceService.listInstancesForUser(caller.userId()));
  }

  @PostMapping
  public ResponseEntity<MembershipSummary> createInstance(
      @AuthenticationPrincipal AuthenticatedUser caller,
      @Valid @RequestBody CreateInstanceRequest request) {
    var created = instanceService.createInstance(caller.userId(), request.name());
    return ResponseEntity.created(URI.create("/api/instances/" + created.instanceId()))
        .body(created);
  }

  public record CreateInstanceRequest(
      @NotBlank(message = "name is required")
          @Size(max = 255, message = "name must be at most 255 characters")
          String name) {}
}
