package com.example.authgateway.security;

import com.example.authgateway.adapter.datastore.DataClient;
import com.example.authgateway.adapter.idp.IdentityProviderClient;
import com.example.authgateway.adapter.idp.dto.IdpUser;
import com.example.authgateway.domain.entity.AuthenticatedSession;
import com.example.authgateway.domain.entity.Role;
import com.example.authgateway.domain.entity.UserPrincipal;
import com.example.authgateway.domain.entity.UserProfile;
import com.example.authgateway.exception.ForbiddenException;
import com.example.authgateway.exception.UnauthenticatedException;
import com.example.authgateway.service.AuthorizedDataClientFactory;
import com.example.authgateway.service.PrincipalCache;
import com.example.authgateway.service.UserProfileService;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;

import java.util.Optional;

import static com.example.authgateway.util.ClientAddressUtil.maskIdentifier;

/**
 * Resolves the principal behind the access-token cookie.
 * <p>
 * The token is verified by the identity provider on every request; only the role lookup is
 * cached. The role always comes from the profile store, read with a client scoped to the
 * verified token, and never from anything the client sent.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SessionAuthenticator {

  public static final String SESSION_ATTRIBUTE = SessionAuthenticator.class.getName() + ".SESSION";

  private final SessionCookieCodec cookieCodec;
  private final IdentityProviderClient identityProvider;
  private final AuthorizedDataClientFactory dataClientFactory;
  private final UserProfileService userProfileService;
  private final PrincipalCache principalCache;

  /**
   * Authenticates the request and attaches the session to it.
   *
   * @throws UnauthenticatedException when the cookie is missing or the token is rejected
   * @throws com.example.authgateway.exception.UpstreamUnavailableException when the identity
   *     provider or the profile store cannot be reached
   */
  public AuthenticatedSession authenticate(HttpServletRequest request) {
    String accessToken = cookieCodec.readAccessToken(request)
        .orElseThrow(() -> new UnauthenticatedException("Authentication required"));

    IdpUser user = identityProvider.getUser(accessToken);
    UserPrincipal principal = principalCache.get(user.id(), id -> resolvePrincipal(user, accessToken));

    AuthenticatedSession session = new AuthenticatedSession(principal, accessToken);
    request.setAttribute(SESSION_ATTRIBUTE, session);
    SecurityContextHolder.getContext().setAuthentication(new PrincipalAuthentication(session));

    log.trace("Authenticated {} as {}", maskIdentifier(principal.userId()), principal.role());
    return session;
  }

  /**
   * @throws ForbiddenException when the principal's role is below {@code required}
   */
  public void requireRole(AuthenticatedSession session, Role required) {
    if (session == null) {
      throw new UnauthenticatedException("Authentication required");
    }
    if (!session.principal().role().satisfies(required)) {
      throw new ForbiddenException("Insufficient role");
    }
  }

  public static Optional<AuthenticatedSession> currentSession(HttpServletRequest request) {
    Object attribute = request.getAttribute(SESSION_ATTRIBUTE);
    return attribute instanceof AuthenticatedSession session ? Optional.of(session) : Optional.empty();
  }

  private UserPrincipal resolvePrincipal(IdpUser user, String accessToken) {
    DataClient client = dataClientFactory.forVerifiedToken(user.id(), accessToken);
    Optional<UserProfile> profile = userProfileService.findProfile(client, user.id());

    if (profile.isEmpty()) {
      log.debug("No profile row for {}, defaulting to {}", maskIdentifier(user.id()), Role.USER);
      return UserPrincipal.of(user.id(), user.email(), Role.USER);
    }

    UserProfile row = profile.get();
    String email = row.email() != null ? row.email() : user.email();
    return UserPrincipal.of(user.id(), email, row.resolvedRole());
  }
}
