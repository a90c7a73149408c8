package com.example.authgateway;

import com.example.authgateway.properties.ApplicationProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Auth Gateway Application
 *
 * Cookie-based session bridge in front of an external identity provider and a
 * row-level-security datastore.
 */
@SpringBootApplication
@EnableConfigurationProperties(ApplicationProperties.class)
@EnableScheduling
public class AuthGatewayApplication {
  public static void main(String[] args) {
    SpringApplication app = new SpringApplication(AuthGatewayApplication.class);
    app.setRegisterShutdownHook(true);
    app.run(args);
  }
}
