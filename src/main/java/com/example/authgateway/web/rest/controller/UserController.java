package com.example.authgateway.web.rest.controller;

import com.example.authgateway.domain.entity.AuthenticatedSession;
import com.example.authgateway.domain.entity.Capability;
import com.example.authgateway.domain.entity.UserPrincipal;
import com.example.authgateway.domain.entity.UserProfile;
import com.example.authgateway.exception.UnauthenticatedException;
import com.example.authgateway.security.SessionAuthenticator;
import com.example.authgateway.service.AuthorizedDataClientFactory;
import com.example.authgateway.service.UserProfileService;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

@RestController
@RequiredArgsConstructor
public class UserController implements UserAPI {

  private final AuthorizedDataClientFactory dataClientFactory;
  private final UserProfileService userProfileService;
  private final Clock clock;

  @Override
  public ResponseEntity<Map<String, Object>> getCurrentUser(HttpServletRequest request) {
    AuthenticatedSession session = SessionAuthenticator.currentSession(request)
        .orElseThrow(() -> new UnauthenticatedException("Authentication required"));
    UserPrincipal principal = session.principal();

    Optional<UserProfile> profile = userProfileService.findProfile(
        dataClientFactory.forRequest(session), principal.userId());

    Map<String, Object> user = new LinkedHashMap<>();
    user.put("id", principal.userId());
    user.put("email", principal.email());
    user.put("role", principal.role().value());
    user.put("capabilities", principal.capabilities().stream().map(Capability::tag).sorted().toList());
    user.put("full_name", profile.map(UserProfile::fullName).orElse(principal.email()));
    user.put("avatar_url", profile.map(UserProfile::avatarUrl).orElse(null));
    user.put("created_at", profile.map(UserProfile::createdAt).orElse(null));
    user.put("updated_at", profile.map(UserProfile::updatedAt).orElse(null));

    Map<String, Object> body = new LinkedHashMap<>();
    body.put("user", user);
    body.put("timestamp", clock.instant().toString());
    return ResponseEntity.ok(body);
  }
}
