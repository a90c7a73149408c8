package com.example.authgateway.config;

import com.example.authgateway.TestProperties;
import com.example.authgateway.domain.entity.EnvironmentProfile;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigurationValidatorTest {

  @Test
  void acceptsValidProductionConfiguration() {
    ConfigurationValidator validator = new ConfigurationValidator(TestProperties.production());

    assertThatCode(validator::afterPropertiesSet).doesNotThrowAnyException();
  }

  @Test
  void requiresHttpsUpstreamsOutsideDevelopment() {
    ConfigurationValidator validator = new ConfigurationValidator(
        TestProperties.builder().identityUrl("http://idp.internal").build());

    assertThatThrownBy(validator::afterPropertiesSet)
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("HTTPS");
  }

  @Test
  void allowsPlainHttpUpstreamsInDevelopment() {
    ConfigurationValidator validator = new ConfigurationValidator(
        TestProperties.builder()
            .profile(EnvironmentProfile.DEVELOPMENT)
            .identityUrl("http://localhost:9999")
            .datastoreUrl("http://localhost:3000")
            .build());

    assertThatCode(validator::afterPropertiesSet).doesNotThrowAnyException();
  }

  @Test
  void rejectsStrictLimitsLooserThanLenientOnes() {
    ConfigurationValidator validator = new ConfigurationValidator(
        TestProperties.builder()
            .strict(TestProperties.limits(500, Duration.ofMinutes(1), 100, Duration.ofMinutes(1),
                                          20, Duration.ofMinutes(15)))
            .build());

    assertThatThrownBy(validator::afterPropertiesSet).isInstanceOf(IllegalStateException.class);
  }
}
