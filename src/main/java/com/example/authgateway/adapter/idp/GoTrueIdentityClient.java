package com.example.authgateway.adapter.idp;

import com.example.authgateway.adapter.idp.dto.IdpSession;
import com.example.authgateway.adapter.idp.dto.IdpUser;
import com.example.authgateway.adapter.idp.dto.SignUpResult;
import com.example.authgateway.exception.CredentialsRejectedException;
import com.example.authgateway.exception.ErrorCode;
import com.example.authgateway.exception.RefreshFailedException;
import com.example.authgateway.exception.UnauthenticatedException;
import com.example.authgateway.exception.UpstreamUnavailableException;
import com.example.authgateway.properties.ApplicationProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * GoTrue-compatible identity provider client ({@code /auth/v1/*}).
 * <p>
 * Every call is wrapped in the {@code identityProvider} circuit breaker. Rejections by the
 * provider (bad credentials, invalid tokens) are business outcomes and do not count as
 * failures; an open circuit surfaces as {@link UpstreamUnavailableException}.
 */
@Slf4j
@Component
public class GoTrueIdentityClient implements IdentityProviderClient {

  private static final String CIRCUIT_BREAKER = "identityProvider";
  private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
  private static final String API_KEY_HEADER = "apikey";
  private static final String AUTHORIZATION_HEADER = "Authorization";
  private static final String BEARER_PREFIX = "Bearer ";

  private final ApplicationProperties.IdentityProperties identity;
  private final OkHttpClient httpClient;
  private final ObjectMapper objectMapper;

  public GoTrueIdentityClient(ApplicationProperties properties,
                              @Qualifier("identityHttpClient") OkHttpClient httpClient,
                              ObjectMapper objectMapper) {
    this.identity = properties.identity();
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
  }

  @Override
  @CircuitBreaker(name = CIRCUIT_BREAKER, fallbackMethod = "signInFallback")
  public IdpSession signInWithPassword(String email, String password) {
    log.debug("Password grant against identity provider");

    Request request = baseRequest(tokenUrl("password"))
        .post(jsonBody(Map.of("email", email, "password", password)))
        .build();

    try (Response response = httpClient.newCall(request).execute()) {
      if (isClientError(response.code())) {
        throw new CredentialsRejectedException(ErrorCode.LOGIN_FAILED, HttpStatus.UNAUTHORIZED,
                                               "Invalid email or password");
      }
      requireSuccess(response, "sign-in");
      return readSession(response, "sign-in");
    } catch (IOException e) {
      throw new UpstreamUnavailableException("Identity provider unreachable during sign-in", e);
    }
  }

  @Override
  @CircuitBreaker(name = CIRCUIT_BREAKER, fallbackMethod = "signUpFallback")
  public SignUpResult signUp(String email, String password, String fullName) {
    log.debug("Account creation against identity provider");

    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("email", email);
    payload.put("password", password);
    if (fullName != null && !fullName.isBlank()) {
      payload.put("data", Map.of("full_name", fullName));
    }

    Request request = baseRequest(authUrl("signup").build())
        .post(jsonBody(payload))
        .build();

    try (Response response = httpClient.newCall(request).execute()) {
      if (isClientError(response.code())) {
        throw new CredentialsRejectedException(ErrorCode.SIGNUP_FAILED, HttpStatus.BAD_REQUEST,
                                               "Account could not be created");
      }
      requireSuccess(response, "sign-up");

      JsonNode body = objectMapper.readTree(bodyString(response, "sign-up"));
      // Without auto-confirm the provider answers with the bare user object.
      if (body.hasNonNull("access_token")) {
        IdpSession session = objectMapper.treeToValue(body, IdpSession.class);
        return new SignUpResult(session.user(), session);
      }
      return new SignUpResult(objectMapper.treeToValue(body, IdpUser.class), null);
    } catch (IOException e) {
      throw new UpstreamUnavailableException("Identity provider unreachable during sign-up", e);
    }
  }

  @Override
  @CircuitBreaker(name = CIRCUIT_BREAKER, fallbackMethod = "refreshFallback")
  public IdpSession refreshSession(String refreshToken) {
    Request request = baseRequest(tokenUrl("refresh_token"))
        .post(jsonBody(Map.of("refresh_token", refreshToken)))
        .build();

    try (Response response = httpClient.newCall(request).execute()) {
      if (isClientError(response.code())) {
        throw new RefreshFailedException("Refresh token rejected");
      }
      requireSuccess(response, "refresh");

      IdpSession session = readSession(response, "refresh");
      if (!session.hasTokens()) {
        throw new RefreshFailedException("Refresh response carried no tokens");
      }
      return session;
    } catch (IOException e) {
      throw new UpstreamUnavailableException("Identity provider unreachable during refresh", e);
    }
  }

  @Override
  @CircuitBreaker(name = CIRCUIT_BREAKER, fallbackMethod = "getUserFallback")
  public IdpUser getUser(String accessToken) {
    Request request = baseRequest(authUrl("user").build())
        .header(AUTHORIZATION_HEADER, BEARER_PREFIX + accessToken)
        .get()
        .build();

    try (Response response = httpClient.newCall(request).execute()) {
      if (isClientError(response.code())) {
        throw new UnauthenticatedException("Access token rejected by identity provider");
      }
      requireSuccess(response, "user lookup");

      IdpUser user = objectMapper.readValue(bodyString(response, "user lookup"), IdpUser.class);
      if (user.id() == null || user.id().isBlank()) {
        throw new UnauthenticatedException("Identity provider returned no user");
      }
      return user;
    } catch (IOException e) {
      throw new UpstreamUnavailableException("Identity provider unreachable during user lookup", e);
    }
  }

  @Override
  @CircuitBreaker(name = CIRCUIT_BREAKER, fallbackMethod = "signOutFallback")
  public void signOut(String accessToken) {
    Request request = baseRequest(authUrl("logout").build())
        .header(AUTHORIZATION_HEADER, BEARER_PREFIX + accessToken)
        .post(RequestBody.create(new byte[0], null))
        .build();

    try (Response response = httpClient.newCall(request).execute()) {
      if (!response.isSuccessful()) {
        // Already revoked or expired tokens are answered with 401/403; nothing left to revoke.
        log.debug("Identity provider sign-out returned status {}", response.code());
      }
    } catch (IOException e) {
      throw new UpstreamUnavailableException("Identity provider unreachable during sign-out", e);
    }
  }

  // Circuit-breaker fallbacks: only an open circuit is translated, other failures propagate.

  private IdpSession signInFallback(String email, String password, CallNotPermittedException ex) {
    throw circuitOpen(ex);
  }

  private SignUpResult signUpFallback(String email, String password, String fullName,
                                      CallNotPermittedException ex) {
    throw circuitOpen(ex);
  }

  private IdpSession refreshFallback(String refreshToken, CallNotPermittedException ex) {
    throw circuitOpen(ex);
  }

  private IdpUser getUserFallback(String accessToken, CallNotPermittedException ex) {
    throw circuitOpen(ex);
  }

  private void signOutFallback(String accessToken, CallNotPermittedException ex) {
    throw circuitOpen(ex);
  }

  private UpstreamUnavailableException circuitOpen(CallNotPermittedException ex) {
    log.error("Identity provider circuit breaker is open", ex);
    return new UpstreamUnavailableException("Identity provider is temporarily unavailable", ex);
  }

  private Request.Builder baseRequest(HttpUrl url) {
    return new Request.Builder()
        .url(url)
        .header(API_KEY_HEADER, identity.apiKey())
        .header("Accept", "application/json");
  }

  private HttpUrl.Builder authUrl(String path) {
    HttpUrl base = HttpUrl.get(identity.url());
    return base.newBuilder().addPathSegments("auth/v1/" + path);
  }

  private HttpUrl tokenUrl(String grantType) {
    return authUrl("token").addQueryParameter("grant_type", grantType).build();
  }

  private RequestBody jsonBody(Object payload) {
    try {
      return RequestBody.create(objectMapper.writeValueAsBytes(payload), JSON);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to serialize identity provider request", e);
    }
  }

  private IdpSession readSession(Response response, String operation) throws IOException {
    return objectMapper.readValue(bodyString(response, operation), IdpSession.class);
  }

  private static String bodyString(Response response, String operation) throws IOException {
    ResponseBody body = response.body();
    if (body == null) {
      throw new UpstreamUnavailableException("Empty identity provider response during " + operation);
    }
    return body.string();
  }

  private static void requireSuccess(Response response, String operation) {
    if (!response.isSuccessful()) {
      log.error("Identity provider {} failed with status {}", operation, response.code());
      throw new UpstreamUnavailableException("Identity provider " + operation + " failed, status: "
                                                 + response.code());
    }
  }

  private static boolean isClientError(int code) {
    return code >= 400 && code < 500 && code != 408 && code != 429;
  }
}
