package io.veomenu.backend.security;

import io.veomenu.backend.exception.ForbiddenException;
import io.veomenu.backend.multitenancy.TenantFilter;
import io.veomenu.backend.multitenancy.TenantLoggingFilter;
import io.veomenu.backend.session.AuthenticationFailedException;
import io.veomenu.backend.session.SessionAuthFilter;
import java.util.List;
import org.springframework.boot.context.properties.bind.Bindable;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.CorsConfigurationSource;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;

@Configuration
@EnableWebSecurity
public class SecurityConfig {

  private final SessionAuthFilter sessionAuthFilter;
  private final TenantFilter tenantFilter;
  private final TenantLoggingFilter tenantLoggingFilter;
  private final ProblemResponseWriter problemWriter;
  private final Environment environment;

  public SecurityConfig(
      SessionAuthFilter sessionAuthFilter,
      TenantFilter tenantFilter,
      TenantLoggingFilter tenantLoggingFilter,
      ProblemResponseWriter problemWriter,
      Environment environment) {
    this.sessionAuthFilter = sessionAuthFilter;
    this.tenantFilter = tenantFilter;
    this.tenantLoggingFilter = tenantLoggingFilter;
    this.problemWriter = problemWriter;
    this.environment = environment;
  }

  /**
   * Stateless chain for the API. Session authentication runs first, then tenant resolution for
   * {@code /api/instance/**}, then MDC population. Public auth endpoints are open; everything else
   * under {@code /api/**} needs a session.
   */
  @Bean
  public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
    http.cors(cors -> cors.configurationSource(corsConfigurationSource()))
        .csrf(csrf -> csrf.disable())
        .httpBasic(basic -> basic.disable())
        .formLogin(form -> form.disable())
        .logout(logout -> logout.disable())
        .sessionManagement(
            session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .authorizeHttpRequests(
            auth ->
                auth.requestMatchers("/actuator/health/**", "/actuator/health", "/actuator/info")
                    .permitAll()
                    .requestMatchers("/error")
                    .permitAll()
                    .requestMatchers(HttpMethod.POST, "/api/auth/logout")
                    .authenticated()
                    .requestMatchers("/api/auth/**")
                    .permitAll()
                    .requestMatchers("/api/**")
                    .authenticated()
                    .anyRequest()
                    .denyAll())
        .exceptionHandling(
            exceptions ->
                exceptions
                    .authenticationEntryPoint(
                        (request, response, ex) ->
                            problemWriter.write(
                                response, new AuthenticationFailedException(ex.getMessage())))
                    .accessDeniedHandler(
                        (request, response, ex) ->
                            problemWriter.write(response, ForbiddenException.accessDenied())))
        .addFilterBefore(sessionAuthFilter, UsernamePasswordAuthenticationFilter.class)
        .addFilterAfter(tenantFilter, SessionAuthFilter.class)
        .addFilterAfter(tenantLoggingFilter, TenantFilter.class);

    return http.build();
  }

  // The filters are @Components; keep the servlet container from running them outside the chain.

  @Bean
  FilterRegistrationBean<SessionAuthFilter> sessionAuthFilterRegistration(
      SessionAuthFilter filter) {
    var registration = new FilterRegistrationBean<>(filter);
    registration.setEnabled(false);
    return registration;
  }

  @Bean
  FilterRegistrationBean<TenantFilter> tenantFilterRegistration(TenantFilter filter) {
    var registration = new FilterRegistrationBean<>(filter);
    registration.setEnabled(false);
    return registration;
  }

  @Bean
  FilterRegistrationBean<TenantLoggingFilter> tenantLoggingFilterRegistration(
      TenantLoggingFilter filter) {
    var registration = new FilterRegistrationBean<>(filter);
    registration.setEnabled(false);
    return registration;
  }

  @Bean
  CorsConfigurationSource corsConfigurationSource() {
    List<String> origins =
        Binder.get(environment)
            .bind("cors.allowed-origins", Bindable.listOf(String.class))
            .orElse(List.of());

    var config = new CorsConfiguration();
    if (!origins.isEmpty()) {
      config.setAllowedOrigins(origins);
    }
    config.setAllowedMethods(List.of("GET", "POST", "PUT", "DELETE", "PATCH", "OPTIONS"));
    config.setAllowedHeaders(List.of("*"));
    config.setAllowCredentials(true);
    config.setMaxAge(3600L);

    var source = new UrlBasedCorsConfigurationSource();
    source.registerCorsConfiguration("/**", config);
    return source;
  }
}
