package io.veomenu.backend.multitenancy;

import io.veomenu.backend.session.AuthenticatedUser;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import org.slf4j.MDC;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

@Component
public class TenantLoggingFilter extends OncePerRequestFilter {

  private static final String MDC_INSTANCE_ID = "instanceId";
  private static final String MDC_USER_ID = "userId";
  private static final String MDC_REQUEST_ID = "requestId";

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    try {
      MDC.put(MDC_REQUEST_ID, UUID.randomUUID().toString());

      if (request.getAttribute(TenantContext.REQUEST_ATTRIBUTE) instanceof TenantContext tenant) {
        MDC.put(MDC_INSTANCE_ID, tenant.instanceId().toString());
      }

      Authentication auth = SecurityContextHolder.getContext().getAuthentication();
      if (auth != null && auth.getPrincipal() instanceof AuthenticatedUser caller) {
        MDC.put(MDC_USER_ID, caller.userId().toString());
      }

      filterChain.doFilter(request, response);
    } finally {
      MDC.remove(MDC_INSTANCE_ID);
      MDC.remove(MDC_USER_ID);
      MDC.remove(MDC_REQUEST_ID);
    }
  }
}
