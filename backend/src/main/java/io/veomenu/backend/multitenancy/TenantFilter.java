package io.veomenu.backend.multitenancy;

import io.veomenu.backend.security.ProblemResponseWriter;
import io.veomenu.backend.session.AuthenticatedUser;
import io.veomenu.backend.session.AuthenticationFailedException;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.util.matcher.AntPathRequestMatcher;
import org.springframework.security.web.util.matcher.RequestMatcher;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Resolves the tenant for every request under {@code /api/instance}. Runs after session
 * authentication; no tenant-scoped handler executes unless a {@link TenantContext} was bound.
 */
@Component
public class TenantFilter extends OncePerRequestFilter {

  private static final Logger log = LoggerFactory.getLogger(TenantFilter.class);
  // Matches the decoded path MVC routes on; also covers "/api/instance" itself but not
  // "/api/instances"
  private static final RequestMatcher TENANT_SCOPED = new AntPathRequestMatcher("/api/instance/**");

  private final TenantResolver tenantResolver;
  private final ProblemResponseWriter problemWriter;

  public TenantFilter(TenantResolver tenantResolver, ProblemResponseWriter problemWriter) {
    this.tenantResolver = tenantResolver;
    this.problemWriter = problemWriter;
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
    if (authentication == null
        || !(authentication.getPrincipal() instanceof AuthenticatedUser caller)) {
      problemWriter.write(response, new AuthenticationFailedException("no session"));
      return;
    }

    TenantContext context;
    try {
      context =
          tenantResolver.resolve(caller.userId(), request.getHeader(TenantResolver.TENANT_HEADER));
    } catch (TenantAccessException e) {
      log.warn("Tenant access denied for {}: {}", request.getRequestURI(), e.getReason());
      problemWriter.write(response, e);
      return;
    }

    request.setAttribute(TenantContext.REQUEST_ATTRIBUTE, context);
    filterChain.doFilter(request, response);
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    return !TENANT_SCOPED.matches(request);
  }
}
