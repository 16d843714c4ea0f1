package io.veomenu.backend.instance;

import io.veomenu.backend.multitenancy.TenantContext;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Endpoints scoped to the instance named by the {@code X-Instance-Id} header. The tenant filter
 * has already verified membership before any of these run.
 */
@RestController
@RequestMapping("/api/instance")
public class TenantInstanceController {

  private final InstanceService instanceService;
  private final InstanceMemberService memberService;

  public TenantInstanceController(
      InstanceService instanceService, InstanceMemberService memberService) {
    this.instanceService = instanceService;
    this.memberService = memberService;
  }

  @GetMapping
  public ResponseEntity<MembershipSummary> getCurrentInstance(TenantContext tenant) {
    return ResponseEntity.ok(instanceService.getCurrentInstance(tenant));
  }

  @GetMapping("/members")
  public ResponseEntity<List<MemberView>> listMembers(TenantContext tenant) {
    return ResponseEntity.ok(memberService.listMembers(tenant));
  }

  @PostMapping("/members")
  public ResponseEntity<MemberView> addMember(
      TenantContext tenant, @Valid @RequestBody AddMemberRequest request) {
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(memberService.addMember(tenant, request.email(), request.role()));
  }

  @PatchMapping("/members/{userId}")
  public ResponseEntity<Void> changeRole(
      TenantContext tenant,
      @PathVariable UUID userId,
      @Valid @RequestBody ChangeRoleRequest request) {
    memberService.changeRole(tenant, userId, request.role());
    return ResponseEntity.noContent().build();
  }

  @DeleteMapping("/members/{userId}")
  public ResponseEntity<Void> removeMember(TenantContext tenant, @PathVariable UUID userId) {
    memberService.removeMember(tenant, userId);
    return ResponseEntity.noContent().build();
  }

  public record AddMemberRequest(
      @NotBlank(message = "email is required") @Email(message = "invalid email format")
          String email,
      @NotNull(message = "role is required") MembershipRole role) {}

  public record ChangeRoleRequest(@NotNull(message = "role is required") MembershipRole role) {}
}
