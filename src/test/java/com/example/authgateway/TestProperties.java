package com.example.authgateway;

import com.example.authgateway.domain.entity.EnvironmentProfile;
import com.example.authgateway.properties.ApplicationProperties;
import com.example.authgateway.properties.ApplicationProperties.CacheProperties;
import com.example.authgateway.properties.ApplicationProperties.CookieProperties;
import com.example.authgateway.properties.ApplicationProperties.DatastoreProperties;
import com.example.authgateway.properties.ApplicationProperties.IdentityProperties;
import com.example.authgateway.properties.ApplicationProperties.OkHttpProperties;
import com.example.authgateway.properties.ApplicationProperties.RateLimitProperties;
import com.example.authgateway.properties.ApplicationProperties.RateLimitProperties.Limit;
import com.example.authgateway.properties.ApplicationProperties.RateLimitProperties.TierLimits;
import com.example.authgateway.properties.ApplicationProperties.SecurityProperties;

import java.time.Duration;
import java.util.List;

/**
 * Builds {@link ApplicationProperties} for unit tests without a Spring context.
 */
public final class TestProperties {

  public static final String ALLOWED_ORIGIN = "https://app.example.com";

  private EnvironmentProfile profile = EnvironmentProfile.PRODUCTION;
  private String identityUrl = "https://idp.test.example.com";
  private String datastoreUrl = "https://db.test.example.com";
  private String serviceKey = "test-service-key";
  private boolean bypass = false;
  private TierLimits strict = limits(5, Duration.ofMinutes(15), 100, Duration.ofMinutes(1), 20, Duration.ofMinutes(15));
  private TierLimits lenient = limits(50, Duration.ofMinutes(15), 1000, Duration.ofMinutes(1), 200, Duration.ofMinutes(15));

  private TestProperties() {
  }

  public static TestProperties builder() {
    return new TestProperties();
  }

  public static ApplicationProperties production() {
    return builder().build();
  }

  public static ApplicationProperties development() {
    return builder().profile(EnvironmentProfile.DEVELOPMENT).build();
  }

  public static TierLimits limits(int auth, Duration authWindow, int api, Duration apiWindow,
                                  int admin, Duration adminWindow) {
    return new TierLimits(new Limit(auth, authWindow), new Limit(api, apiWindow), new Limit(admin, adminWindow));
  }

  public TestProperties profile(EnvironmentProfile profile) {
    this.profile = profile;
    return this;
  }

  public TestProperties identityUrl(String identityUrl) {
    this.identityUrl = identityUrl;
    return this;
  }

  public TestProperties datastoreUrl(String datastoreUrl) {
    this.datastoreUrl = datastoreUrl;
    return this;
  }

  public TestProperties serviceKey(String serviceKey) {
    this.serviceKey = serviceKey;
    return this;
  }

  public TestProperties bypass(boolean bypass) {
    this.bypass = bypass;
    return this;
  }

  public TestProperties strict(TierLimits strict) {
    this.strict = strict;
    return this;
  }

  public TestProperties lenient(TierLimits lenient) {
    this.lenient = lenient;
    return this;
  }

  public ApplicationProperties build() {
    return new ApplicationProperties(
        profile,
        new IdentityProperties(identityUrl, "test-anon-key", Duration.ofSeconds(2)),
        new DatastoreProperties(datastoreUrl, "test-anon-key", serviceKey),
        new CookieProperties("access-token", "refresh-token", "csrf-token", "/session/refresh",
                             Duration.ofHours(1), Duration.ofDays(7), Duration.ofHours(1), null),
        new SecurityProperties(new SecurityProperties.CsrfProperties("X-CSRF-Token", List.of(ALLOWED_ORIGIN))),
        new RateLimitProperties(bypass, "memory", strict, lenient),
        new OkHttpProperties(new OkHttpProperties.ClientProperties(5, 1, 16, 8)),
        new CacheProperties(new CacheProperties.PrincipalCacheProperties(Duration.ofMinutes(2), 100)));
  }
}
