package io.veomenu.backend.session;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Lets a user see and revoke their own active sessions. */
@RestController
@RequestMapping("/api/users/me/sessions")
public class SessionController {

  private final SessionService sessionService;

  public SessionController(SessionService sessionService) {
    this.sessionService = sessionService;
  }

  @GetMapping
  public ResponseEntity<List<SessionResponse>> listSessions(
      @AuthenticationPrincipal AuthenticatedUser caller) {
    var sessions =
        sessionService.listActiveSessions(caller.userId()).stream()
            .map(s -> SessionResponse.from(s, caller.sessionId()))
            .toList();
    return ResponseEntity.ok(sessions);
  }

  @PostMapping("/{sessionId}/revoke")
  public ResponseEntity<Void> revokeSession(
      @AuthenticationPrincipal AuthenticatedUser caller, @PathVariable UUID sessionId) {
    sessionService.revokeOwnSession(caller.userId(), sessionId);
    return ResponseEntity.noContent().build();
  }

  public record SessionResponse(
      UUID id,
      String deviceType,
      String userAgent,
      String ipAddress,
      Instant createdAt,
      Instant lastSeenAt,
      Instant expiresAt,
      boolean current) {

    static SessionResponse from(UserSession session, UUID currentSessionId) {
      return new SessionResponse(
          session.getId(),
          session.getDeviceType(),
          session.getUserAgent(),
          session.getIpAddress(),
          session.getCreatedAt(),
          session.getLastSeenAt(),
          session.getExpiresAt(),
          session.getId().equals(currentSessionId));
    }
  }
}
