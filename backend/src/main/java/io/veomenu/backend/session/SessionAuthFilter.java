package io.veomenu.backend.session;

import io.veomenu.backend.security.ProblemResponseWriter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.util.matcher.AntPathRequestMatcher;
import org.springframework.security.web.util.matcher.RequestMatcher;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Authenticates {@code /api/**} requests from a {@code Bearer} access token. The token signature
 * and expiry are checked locally; revocation is checked through {@link
 * SessionService#isSessionActive}. On success the {@link AuthenticatedUser} becomes the security
 * principal.
 *
 * <p>Requests without an {@code Authorization} header pass through unauthenticated and are rejected
 * by the authorization rules where authentication is required.
 */
@Component
public class SessionAuthFilter extends OncePerRequestFilter {

  private static final Logger log = LoggerFactory.getLogger(SessionAuthFilter.class);
  private static final String BEARER_PREFIX = "Bearer ";
  private static final RequestMatcher API = new AntPathRequestMatcher("/api/**");
  private static final RequestMatcher PUBLIC_AUTH = new AntPathRequestMatcher("/api/auth/**");
  private static final RequestMatcher LOGOUT = new AntPathRequestMatcher("/api/auth/logout");

  private final SessionTokenService tokenService;
  private final SessionService sessionService;
  private final ProblemResponseWriter problemWriter;

  public SessionAuthFilter(
      SessionTokenService tokenService,
      SessionService sessionService,
      ProblemResponseWriter problemWriter) {
    this.tokenService = tokenService;
    this.sessionService = sessionService;
    this.problemWriter = problemWriter;
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    String authHeader = request.getHeader("Authorization");
    if (authHeader == null) {
      filterChain.doFilter(request, response);
      return;
    }

    AuthenticatedUser principal;
    try {
      principal = authenticate(authHeader);
    } catch (AuthenticationFailedException e) {
      log.warn("Session authentication failed for {}: {}", request.getRequestURI(), e.getReason());
      problemWriter.write(response, e);
      return;
    }

    var authentication = new UsernamePasswordAuthenticationToken(principal, null, List.of());
    var context = SecurityContextHolder.createEmptyContext();
    context.setAuthentication(authentication);
    SecurityContextHolder.setContext(context);

    filterChain.doFilter(request, response);
  }

  private AuthenticatedUser authenticate(String authHeader) {
    if (!authHeader.startsWith(BEARER_PREFIX)) {
      throw new AuthenticationFailedException("unsupported authorization scheme");
    }
    var claims = tokenService.verifyAccessToken(authHeader.substring(BEARER_PREFIX.length()));
    if (!sessionService.isSessionActive(claims.sessionId())) {
      throw new AuthenticationFailedException("session " + claims.sessionId() + " not active");
    }
    return new AuthenticatedUser(claims.userId(), claims.sessionId());
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    if (!API.matches(request)) {
      return true;
    }
    // Public auth endpoints; logout needs the caller's session
    return PUBLIC_AUTH.matches(request) && !LOGOUT.matches(request);
  }
}
