package com.example.authgateway.web.rest.controller;

import com.example.authgateway.adapter.idp.dto.IdpUser;
import com.example.authgateway.service.SessionService;
import com.example.authgateway.service.SessionService.SessionResult;
import com.example.authgateway.service.SessionService.SignupOutcome;
import com.example.authgateway.web.rest.dto.LoginRequest;
import com.example.authgateway.web.rest.dto.SignupRequest;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequiredArgsConstructor
public class SessionController implements SessionAPI {

  private final SessionService sessionService;
  private final Clock clock;

  @Override
  public ResponseEntity<Map<String, Object>> login(LoginRequest loginRequest, HttpServletResponse response) {
    SessionResult result = sessionService.login(loginRequest.email(), loginRequest.password(), response);

    Map<String, Object> body = new LinkedHashMap<>();
    body.put("success", true);
    body.put("user", userSummary(result.user()));
    body.put("expiresAt", result.tokens().expiresAt().toString());
    body.put("timestamp", clock.instant().toString());
    return ResponseEntity.ok(body);
  }

  @Override
  public ResponseEntity<Map<String, Object>> logout(HttpServletRequest request, HttpServletResponse response) {
    sessionService.logout(request, response);
    return ResponseEntity.ok(Map.of(
        "success", true,
        "timestamp", clock.instant().toString()
                                   ));
  }

  @Override
  public ResponseEntity<Map<String, Object>> refresh(HttpServletRequest request, HttpServletResponse response) {
    SessionResult result = sessionService.refresh(request, response);

    Map<String, Object> body = new LinkedHashMap<>();
    body.put("success", true);
    if (result.user() != null) {
      body.put("user", userSummary(result.user()));
    }
    body.put("expiresAt", result.tokens().expiresAt().toString());
    body.put("timestamp", clock.instant().toString());
    return ResponseEntity.ok(body);
  }

  @Override
  public ResponseEntity<Map<String, Object>> signup(SignupRequest signupRequest, HttpServletResponse response) {
    SignupOutcome outcome = sessionService.signup(
        signupRequest.email(), signupRequest.password(), signupRequest.fullName(), response);

    Map<String, Object> body = new LinkedHashMap<>();
    body.put("success", true);
    body.put("user", userSummary(outcome.user()));
    body.put("requiresEmailConfirmation", outcome.requiresEmailConfirmation());
    if (outcome.requiresEmailConfirmation()) {
      body.put("message", "Please check your email to confirm your account");
    } else {
      body.put("expiresAt", outcome.tokens().expiresAt().toString());
    }
    body.put("timestamp", clock.instant().toString());

    HttpStatus status = outcome.requiresEmailConfirmation() ? HttpStatus.OK : HttpStatus.CREATED;
    return ResponseEntity.status(status).body(body);
  }

  private static Map<String, Object> userSummary(IdpUser user) {
    Map<String, Object> summary = new LinkedHashMap<>();
    summary.put("id", user.id());
    summary.put("email", user.email());
    summary.put("full_name", user.fullName());
    Object avatar = user.userMetadata() != null ? user.userMetadata().get("avatar_url") : null;
    summary.put("avatar_url", avatar);
    summary.put("created_at", user.createdAt());
    summary.put("updated_at", user.updatedAt());
    return summary;
  }
}
