package com.example.authgateway.service;

import com.example.authgateway.adapter.idp.IdentityProviderClient;
import com.example.authgateway.adapter.idp.dto.IdpSession;
import com.example.authgateway.adapter.idp.dto.IdpUser;
import com.example.authgateway.adapter.idp.dto.SignUpResult;
import com.example.authgateway.domain.entity.SessionTokens;
import com.example.authgateway.exception.CredentialsRejectedException;
import com.example.authgateway.exception.ErrorCode;
import com.example.authgateway.exception.RefreshFailedException;
import com.example.authgateway.exception.UnauthenticatedException;
import com.example.authgateway.exception.UpstreamUnavailableException;
import com.example.authgateway.security.SessionCookieCodec;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Optional;

import static com.example.authgateway.util.ClientAddressUtil.maskIdentifier;

/**
 * Session lifecycle: login, refresh, logout and signup.
 * <p>
 * Tokens issued by the identity provider only ever travel to the browser as cookies; every
 * successful exchange mints a fresh CSRF token alongside them.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SessionService {

  private final IdentityProviderClient identityProvider;
  private final SessionCookieCodec cookieCodec;
  private final PrincipalCache principalCache;
  private final Clock clock;

  public record SessionResult(IdpUser user, SessionTokens tokens) {}

  public record SignupOutcome(IdpUser user, SessionTokens tokens) {
    public boolean requiresEmailConfirmation() {
      return tokens == null;
    }
  }

  public SessionResult login(String email, String password, HttpServletResponse response) {
    IdpSession session = identityProvider.signInWithPassword(email, password);
    if (!session.hasTokens() || session.user() == null) {
      throw new CredentialsRejectedException(ErrorCode.LOGIN_FAILED, HttpStatus.UNAUTHORIZED,
                                             "Invalid email or password");
    }

    SessionTokens tokens = issueCookies(session, response);
    log.info("Session established for {}", maskIdentifier(session.user().id()));
    return new SessionResult(session.user(), tokens);
  }

  /**
   * Rotates all three cookies from the refresh-token cookie. Any failure clears the cookies
   * so the browser does not keep retrying with a dead refresh token.
   */
  public SessionResult refresh(HttpServletRequest request, HttpServletResponse response) {
    Optional<String> refreshToken = cookieCodec.readRefreshToken(request);
    if (refreshToken.isEmpty()) {
      cookieCodec.clearSessionCookies(response);
      throw new RefreshFailedException("Refresh token missing");
    }

    IdpSession session;
    try {
      session = identityProvider.refreshSession(refreshToken.get());
    } catch (RefreshFailedException e) {
      log.debug("Refresh rejected: {}", e.getMessage());
      cookieCodec.clearSessionCookies(response);
      throw e;
    }

    SessionTokens tokens = issueCookies(session, response);
    if (session.user() != null) {
      principalCache.evict(session.user().id());
    }
    return new SessionResult(session.user(), tokens);
  }

  /**
   * Revokes the session at the identity provider when possible and always clears the
   * cookies. Revocation is best effort: an expired token or an unreachable provider must not
   * keep the user logged in locally.
   */
  public void logout(HttpServletRequest request, HttpServletResponse response) {
    Optional<String> accessToken = cookieCodec.readAccessToken(request);
    if (accessToken.isPresent()) {
      try {
        IdpUser user = identityProvider.getUser(accessToken.get());
        principalCache.evict(user.id());
        identityProvider.signOut(accessToken.get());
        log.info("Session revoked for {}", maskIdentifier(user.id()));
      } catch (UnauthenticatedException e) {
        log.debug("Logout with an already invalid access token");
      } catch (UpstreamUnavailableException e) {
        log.warn("Identity provider unavailable during logout, clearing cookies only", e);
      }
    }
    cookieCodec.clearSessionCookies(response);
  }

  public SignupOutcome signup(String email, String password, String fullName, HttpServletResponse response) {
    SignUpResult result = identityProvider.signUp(email, password, fullName);
    if (result.user() == null) {
      throw new CredentialsRejectedException(ErrorCode.SIGNUP_FAILED, HttpStatus.BAD_REQUEST,
                                             "Account could not be created");
    }
    if (result.requiresEmailConfirmation()) {
      log.info("Account {} created, awaiting e-mail confirmation", maskIdentifier(result.user().id()));
      return new SignupOutcome(result.user(), null);
    }
    SessionTokens tokens = issueCookies(result.session(), response);
    log.info("Account {} created with session", maskIdentifier(result.user().id()));
    return new SignupOutcome(result.user(), tokens);
  }

  private SessionTokens issueCookies(IdpSession session, HttpServletResponse response) {
    SessionTokens tokens = new SessionTokens(
        session.accessToken(),
        session.refreshToken(),
        SessionCookieCodec.generateCsrfToken(),
        session.expiry(clock.instant()));
    cookieCodec.setSessionCookies(response, tokens);
    return tokens;
  }
}
