package io.veomenu.backend.multitenancy;

import org.springframework.core.MethodParameter;
import org.springframework.stereotype.Component;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.context.request.RequestAttributes;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

/** Supplies the {@link TenantContext} bound by {@link TenantFilter} to controller methods. */
@Component
public class TenantContextArgumentResolver implements HandlerMethodArgumentResolver {

  @Override
  public boolean supportsParameter(MethodParameter parameter) {
    return TenantContext.class.equals(parameter.getParameterType());
  }

  @Override
  public TenantContext resolveArgument(
      MethodParameter parameter,
      ModelAndViewContainer mavContainer,
      NativeWebRequest webRequest,
      WebDataBinderFactory binderFactory) {
    Object context =
        webRequest.getAttribute(TenantContext.REQUEST_ATTRIBUTE, RequestAttributes.SCOPE_REQUEST);
    if (context instanceof TenantContext tenantContext) {
      return tenantContext;
    }
    throw new TenantContextNotBoundException();
  }
}
