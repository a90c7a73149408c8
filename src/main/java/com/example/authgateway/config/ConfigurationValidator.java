package com.example.authgateway.config;

import com.example.authgateway.properties.ApplicationProperties;
import com.example.authgateway.properties.ApplicationProperties.RateLimitProperties.Limit;
import com.example.authgateway.properties.ApplicationProperties.RateLimitProperties.TierLimits;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration validator that enforces rules spanning several properties, beyond the
 * per-field JSR-303 constraints. Fails startup with every violation listed.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConfigurationValidator implements InitializingBean {

  private static final String ERROR_INVALID_URL = "%s is invalid: %s";
  private static final String ERROR_HTTPS_REQUIRED = "%s must use HTTPS outside development: %s";
  private static final String SCHEME_HTTP = "http";
  private static final String SCHEME_HTTPS = "https";
  private static final String PATH_PREFIX_SLASH = "/";

  private final ApplicationProperties properties;

  @Override
  public void afterPropertiesSet() {
    log.info("Validating application configuration for profile {}...", properties.environmentProfile());
    List<String> errors = new ArrayList<>();

    validateUpstreams(errors);
    validateCookies(errors);
    validateCsrf(errors);
    validateRateLimits(errors);
    validateHttpConfig(errors);

    if (!errors.isEmpty()) {
      String errorMessage = String.format("Configuration validation failed with %d error(s):\n- %s",
                                          errors.size(), String.join("\n- ", errors));
      log.error(errorMessage);
      throw new IllegalStateException(errorMessage);
    }
    log.info("Configuration validated successfully.");
  }

  private void validateUpstreams(List<String> errors) {
    validateUrl(properties.identity().url(), "Identity provider URL", errors);
    validateUrl(properties.datastore().url(), "Datastore URL", errors);

    String serviceKey = properties.datastore().serviceKey();
    if (serviceKey == null || serviceKey.isBlank()) {
      log.warn("No datastore service key configured; administrative operations will be refused");
    }
  }

  private void validateCookies(List<String> errors) {
    ApplicationProperties.CookieProperties cookies = properties.cookies();
    if (!cookies.refreshPath().startsWith(PATH_PREFIX_SLASH)) {
      errors.add("Refresh cookie path must be absolute: " + cookies.refreshPath());
    }
    if (cookies.accessTokenMaxAge().isNegative() || cookies.accessTokenMaxAge().isZero()) {
      errors.add("Access token cookie max-age must be positive.");
    }
    if (cookies.refreshTokenMaxAge().compareTo(cookies.accessTokenMaxAge()) < 0) {
      errors.add("Refresh token cookie must not expire before the access token cookie.");
    }
  }

  private void validateCsrf(List<String> errors) {
    List<String> origins = properties.security().csrf().allowedOrigins();
    if (origins.isEmpty()) {
      errors.add("At least one allowed origin must be configured in 'app.security.csrf.allowed-origins'.");
    }
    for (String origin : origins) {
      validateUrl(origin, "Allowed origin", errors);
    }
  }

  private void validateRateLimits(List<String> errors) {
    TierLimits strict = properties.rateLimit().strict();
    TierLimits lenient = properties.rateLimit().lenient();
    compareTier("auth", strict.auth(), lenient.auth(), errors);
    compareTier("api", strict.api(), lenient.api(), errors);
    compareTier("admin", strict.admin(), lenient.admin(), errors);

    if (properties.rateLimit().bypass() && !properties.isDevelopment()) {
      log.warn("app.rate-limit.bypass is set but ignored under the {} profile",
               properties.environmentProfile());
    }
  }

  private void compareTier(String tier, Limit strict, Limit lenient, List<String> errors) {
    if (strict.window().isNegative() || strict.window().isZero()
        || lenient.window().isNegative() || lenient.window().isZero()) {
      errors.add("Rate limit window for tier '%s' must be positive.".formatted(tier));
      return;
    }
    double strictRate = (double) strict.requests() / strict.window().toMillis();
    double lenientRate = (double) lenient.requests() / lenient.window().toMillis();
    if (strictRate > lenientRate) {
      errors.add("Strict rate limit for tier '%s' is looser than the lenient one.".formatted(tier));
    }
  }

  private void validateHttpConfig(List<String> errors) {
    ApplicationProperties.OkHttpProperties.ClientProperties client = properties.http().client();
    if (client.maxRequests() < client.maxRequestsPerHost()) {
      errors.add("Total max requests must be greater than or equal to max requests per host.");
    }
  }

  private void validateUrl(String value, String fieldName, List<String> errors) {
    try {
      URI uri = new URI(value);
      String scheme = uri.getScheme();
      if (uri.getHost() == null || (!SCHEME_HTTP.equals(scheme) && !SCHEME_HTTPS.equals(scheme))) {
        errors.add(ERROR_INVALID_URL.formatted(fieldName, value));
        return;
      }
      if (SCHEME_HTTP.equals(scheme) && !properties.isDevelopment()) {
        errors.add(ERROR_HTTPS_REQUIRED.formatted(fieldName, value));
      }
    } catch (URISyntaxException e) {
      errors.add(ERROR_INVALID_URL.formatted(fieldName, value));
    }
  }
}
