package com.example.authgateway.security.middleware;

import com.example.authgateway.domain.entity.Role;
import com.example.authgateway.security.ratelimit.RateLimitTier;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class EndpointPresetTest {

  private final MiddlewareFactory factory = new MiddlewareFactory(null, null, null, null);

  @Test
  void publicPreset_onlyRateLimitsOnTheAuthTier() {
    List<RequestMiddleware> stages = EndpointPreset.PUBLIC.stages(factory);

    assertThat(stages).hasSize(1);
    assertThat(stages.get(0)).isInstanceOfSatisfying(RateLimitMiddleware.class,
        stage -> assertThat(stage.tier()).isEqualTo(RateLimitTier.AUTH));
  }

  @Test
  void authenticatedPreset_checksCsrfBeforeAuthenticating() {
    List<RequestMiddleware> stages = EndpointPreset.AUTHENTICATED.stages(factory);

    assertThat(stages).extracting(Object::getClass).containsExactly(
        RateLimitMiddleware.class, CsrfMiddleware.class, AuthenticationMiddleware.class);
    assertThat(((RateLimitMiddleware) stages.get(0)).tier()).isEqualTo(RateLimitTier.API);
  }

  @Test
  void adminPreset_endsWithTheAdminRoleGate() {
    List<RequestMiddleware> stages = EndpointPreset.ADMIN.stages(factory);

    assertThat(stages).extracting(Object::getClass).containsExactly(
        RateLimitMiddleware.class, CsrfMiddleware.class, AuthenticationMiddleware.class,
        RequireRoleMiddleware.class);
    assertThat(((RequireRoleMiddleware) stages.get(3)).requiredRole()).isEqualTo(Role.ADMIN);
    assertThat(EndpointPreset.ADMIN.tier()).isEqualTo(RateLimitTier.ADMIN);
  }
}
