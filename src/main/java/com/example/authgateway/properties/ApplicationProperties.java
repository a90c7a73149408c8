package com.example.authgateway.properties;

import com.example.authgateway.domain.entity.EnvironmentProfile;
import jakarta.validation.Valid;
import jakarta.validation.constraints.*;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.List;

/**
 * Centralized configuration properties for the Auth Gateway.
 * Uses records for immutability and type safety.
 */
@Validated
@ConfigurationProperties(prefix = "app")
public record ApplicationProperties(
    @NotNull EnvironmentProfile environmentProfile,
    @NotNull @Valid IdentityProperties identity,
    @NotNull @Valid DatastoreProperties datastore,
    @NotNull @Valid CookieProperties cookies,
    @NotNull @Valid SecurityProperties security,
    @NotNull @Valid RateLimitProperties rateLimit,
    @NotNull @Valid OkHttpProperties http,
    @NotNull @Valid CacheProperties cache
) {

  public boolean isDevelopment() {
    return environmentProfile == EnvironmentProfile.DEVELOPMENT;
  }

  /**
   * Identity provider (GoTrue-compatible auth API)
   */
  public record IdentityProperties(
      @NotBlank String url,
      @NotBlank String apiKey,
      @DefaultValue("5s") Duration timeout
  ) {}

  /**
   * Row-level-security datastore (PostgREST-compatible API).
   * The service key is only handed out for administrative operations.
   */
  public record DatastoreProperties(
      @NotBlank String url,
      @NotBlank String apiKey,
      String serviceKey
  ) {}

  /**
   * Session cookie names and lifetimes
   */
  public record CookieProperties(
      @DefaultValue("access-token") @NotBlank String accessTokenName,
      @DefaultValue("refresh-token") @NotBlank String refreshTokenName,
      @DefaultValue("csrf-token") @NotBlank String csrfTokenName,
      @DefaultValue("/session/refresh") @NotBlank String refreshPath,
      @DefaultValue("1h") Duration accessTokenMaxAge,
      @DefaultValue("7d") Duration refreshTokenMaxAge,
      @DefaultValue("1h") Duration csrfTokenMaxAge,
      String domain
  ) {}

  /**
   * Request verification settings
   */
  public record SecurityProperties(
      @NotNull @Valid CsrfProperties csrf
  ) {
    public record CsrfProperties(
        @DefaultValue("X-CSRF-Token") @NotBlank String headerName,
        @NotNull List<String> allowedOrigins
    ) {}
  }

  /**
   * Rate limiting. Profile selection comes from {@code app.environment-profile};
   * the bypass flag is honoured only under the development profile.
   */
  public record RateLimitProperties(
      @DefaultValue("false") boolean bypass,
      @DefaultValue("memory") @Pattern(regexp = "memory|redis") String store,
      @NotNull @Valid TierLimits strict,
      @NotNull @Valid TierLimits lenient
  ) {

    public TierLimits limitsFor(EnvironmentProfile profile) {
      return profile == EnvironmentProfile.PRODUCTION ? strict : lenient;
    }

    public record TierLimits(
        @NotNull @Valid Limit auth,
        @NotNull @Valid Limit api,
        @NotNull @Valid Limit admin
    ) {}

    public record Limit(
        @Positive int requests,
        @NotNull Duration window
    ) {}
  }

  /**
   * OkHttp client configuration
   */
  public record OkHttpProperties(
      @NotNull @Valid ClientProperties client
  ) {
    public record ClientProperties(
        @DefaultValue("20") @Positive int maxIdleConnections,
        @DefaultValue("5") @Positive int keepAliveDurationMinutes,
        @DefaultValue("100") @Positive int maxRequests,
        @DefaultValue("20") @Positive int maxRequestsPerHost
    ) {}
  }

  /**
   * Cache configuration
   */
  public record CacheProperties(
      @NotNull @Valid PrincipalCacheProperties principal
  ) {
    public record PrincipalCacheProperties(
        @DefaultValue("2m") Duration ttl,
        @DefaultValue("10000") @Positive int maxSize
    ) {}
  }
}
