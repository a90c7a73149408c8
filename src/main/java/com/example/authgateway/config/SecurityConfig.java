package com.example.authgateway.config;

import com.example.authgateway.security.filter.MiddlewarePipelineFilter;
import com.example.authgateway.security.middleware.EndpointPreset;
import com.example.authgateway.security.middleware.MiddlewareFactory;
import com.example.authgateway.web.rest.errors.DelegatedAuthenticationEntryPoint;
import com.example.authgateway.web.rest.errors.ErrorResponseWriter;
import com.example.authgateway.web.rest.errors.JsonAccessDeniedHandler;
import java.time.Duration;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.annotation.Order;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.annotation.web.configurers.HeadersConfigurer.FrameOptionsConfig;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;
import org.springframework.security.web.header.writers.ReferrerPolicyHeaderWriter.ReferrerPolicy;
import org.springframework.security.web.header.writers.StaticHeadersWriter;
import org.springframework.security.web.header.writers.XXssProtectionHeaderWriter.HeaderValue;

import static com.example.authgateway.web.rest.ApiConstants.ApiPath.ADMIN_BASE;
import static com.example.authgateway.web.rest.ApiConstants.ApiPath.API_BASE;
import static com.example.authgateway.web.rest.ApiConstants.ApiPath.HEALTH_BASE;
import static com.example.authgateway.web.rest.ApiConstants.ApiPath.SESSION_BASE;

/**
 * Stateless security configuration, one filter chain per endpoint preset.
 * <p>
 * INFRASTRUCTURE (@Order(1)): health, actuator health and API docs, open.
 * PUBLIC (@Order(2)): session endpoints behind the auth-tier rate limit.
 * ADMIN (@Order(3)): admin endpoints behind rate limit, CSRF, authentication and the admin role.
 * AUTHENTICATED (@Order(4)): API endpoints behind rate limit, CSRF and authentication.
 * DEFAULT (@Order(5)): everything else is denied.
 * <p>
 * Each preset chain runs its middleware pipeline in a {@link MiddlewarePipelineFilter}; the
 * authorization rules behind it only restate what the pipeline already enforced.
 */
@Configuration(proxyBeanMethods = false)
@EnableWebSecurity
@RequiredArgsConstructor
public class SecurityConfig {

  private static final String PERMISSIONS_POLICY_HEADER = "Permissions-Policy";

  private final MiddlewareFactory middlewareFactory;
  private final ErrorResponseWriter errorResponseWriter;
  private final DelegatedAuthenticationEntryPoint delegatedAuthenticationEntryPoint;
  private final JsonAccessDeniedHandler jsonAccessDeniedHandler;

  @Bean
  @Order(1)
  public SecurityFilterChain infrastructureFilterChain(HttpSecurity http) throws Exception {
    http
        .securityMatcher(HEALTH_BASE,
                         HEALTH_BASE + "/**",
                         "/actuator/health",
                         "/actuator/health/**",
                         "/v3/api-docs/**",
                         "/swagger-ui/**",
                         "/swagger-ui.html",
                         "/error")
        .authorizeHttpRequests(authorize -> authorize.anyRequest().permitAll());

    applyCommonSettings(http);
    return http.build();
  }

  @Bean
  @Order(2)
  public SecurityFilterChain publicEndpointsFilterChain(HttpSecurity http) throws Exception {
    http
        .securityMatcher(SESSION_BASE, SESSION_BASE + "/**")
        .addFilterBefore(pipelineFilter(EndpointPreset.PUBLIC),
                         UsernamePasswordAuthenticationFilter.class)
        .authorizeHttpRequests(authorize -> authorize.anyRequest().permitAll());

    applyCommonSettings(http);
    return http.build();
  }

  @Bean
  @Order(3)
  public SecurityFilterChain adminEndpointsFilterChain(HttpSecurity http) throws Exception {
    http
        .securityMatcher(ADMIN_BASE, ADMIN_BASE + "/**")
        .addFilterBefore(pipelineFilter(EndpointPreset.ADMIN),
                         UsernamePasswordAuthenticationFilter.class)
        .authorizeHttpRequests(authorize -> authorize.anyRequest().hasRole("ADMIN"))
        .exceptionHandling(exceptions -> exceptions
            .authenticationEntryPoint(delegatedAuthenticationEntryPoint)
            .accessDeniedHandler(jsonAccessDeniedHandler));

    applyCommonSettings(http);
    return http.build();
  }

  @Bean
  @Order(4)
  public SecurityFilterChain authenticatedEndpointsFilterChain(HttpSecurity http) throws Exception {
    http
        .securityMatcher(API_BASE + "/**")
        .addFilterBefore(pipelineFilter(EndpointPreset.AUTHENTICATED),
                         UsernamePasswordAuthenticationFilter.class)
        .authorizeHttpRequests(authorize -> authorize.anyRequest().authenticated())
        .exceptionHandling(exceptions -> exceptions
            .authenticationEntryPoint(delegatedAuthenticationEntryPoint)
            .accessDeniedHandler(jsonAccessDeniedHandler));

    applyCommonSettings(http);
    return http.build();
  }

  @Bean
  @Order(5)
  public SecurityFilterChain defaultDenyFilterChain(HttpSecurity http) throws Exception {
    http
        .authorizeHttpRequests(authorize -> authorize.anyRequest().denyAll())
        .exceptionHandling(exceptions -> exceptions
            .authenticationEntryPoint(jsonAccessDeniedHandler)
            .accessDeniedHandler(jsonAccessDeniedHandler));

    applyCommonSettings(http);
    return http.build();
  }

  private MiddlewarePipelineFilter pipelineFilter(EndpointPreset preset) {
    return new MiddlewarePipelineFilter(preset, preset.stages(middlewareFactory), errorResponseWriter);
  }

  /**
   * Settings shared by every chain
   */
  private void applyCommonSettings(HttpSecurity http) throws Exception {
    http
        // Spring's synchronizer-token CSRF is replaced by the double-submit check in the pipeline
        .csrf(AbstractHttpConfigurer::disable)
        .httpBasic(AbstractHttpConfigurer::disable)
        .formLogin(AbstractHttpConfigurer::disable)
        .logout(AbstractHttpConfigurer::disable)
        .requestCache(AbstractHttpConfigurer::disable)

        // Session state lives in the cookies, never in a server session
        .sessionManagement(session -> session
                               .sessionCreationPolicy(SessionCreationPolicy.STATELESS)
                          )

        .headers(headers -> headers
                     .frameOptions(FrameOptionsConfig::deny)
                     .xssProtection(xss -> xss
                                        .headerValue(HeaderValue.ENABLED_MODE_BLOCK)
                                   )
                     .contentTypeOptions(contentType -> {
                     })
                     .referrerPolicy(referrer -> referrer
                                         .policy(ReferrerPolicy.STRICT_ORIGIN_WHEN_CROSS_ORIGIN)
                                    )
                     .addHeaderWriter(new StaticHeadersWriter(PERMISSIONS_POLICY_HEADER,
                                                              "camera=(), microphone="
                                                                  + "(), geolocation="
                                                                  + "(), payment=()"))
                     .httpStrictTransportSecurity(hsts -> hsts
                                                      .maxAgeInSeconds(Duration.ofDays(365).toSeconds())
                                                      .includeSubDomains(true)
                                                 )
                     .contentSecurityPolicy(csp -> csp
                                                .policyDirectives("default-src 'none'; "
                                                                      + "frame-ancestors 'none'; "
                                                                      + "base-uri 'none'")
                                           )
                     // Session responses must never be cached
                     .addHeaderWriter((request, response) -> {
                       response.setHeader("Cache-Control",
                                          "no-cache, no-store, must-revalidate");
                       response.setHeader("Pragma",
                                          "no-cache");
                       response.setHeader("Expires",
                                          "0");
                     })
                );
  }
}
