package com.example.authgateway.service;

import com.example.authgateway.adapter.datastore.AdministrativeOperation;
import com.example.authgateway.adapter.datastore.DataClient;
import com.example.authgateway.adapter.datastore.DataCredential;
import com.example.authgateway.adapter.datastore.RestDataClient;
import com.example.authgateway.domain.entity.AuthenticatedSession;
import com.example.authgateway.exception.UnauthenticatedException;
import com.example.authgateway.properties.ApplicationProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import static com.example.authgateway.util.ClientAddressUtil.maskIdentifier;

/**
 * Hands out datastore clients.
 * <p>
 * Request handling gets a client bound to the caller's own access token, so the datastore's
 * row-level security decides what is visible. The service credential is reachable only
 * through {@link #forAdministrativeOperation}; nothing on the per-request path falls back
 * to it.
 */
@Slf4j
@Service
public class AuthorizedDataClientFactory {

  private final HttpUrl baseUrl;
  private final String apiKey;
  private final String serviceKey;
  private final OkHttpClient httpClient;
  private final ObjectMapper objectMapper;

  public AuthorizedDataClientFactory(ApplicationProperties properties,
                                     @Qualifier("datastoreHttpClient") OkHttpClient httpClient,
                                     ObjectMapper objectMapper) {
    this.baseUrl = HttpUrl.get(properties.datastore().url());
    this.apiKey = properties.datastore().apiKey();
    this.serviceKey = properties.datastore().serviceKey();
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
  }

  /**
   * Client scoped to the authenticated caller.
   *
   * @throws UnauthenticatedException when there is no session or no token to scope to
   */
  public DataClient forRequest(AuthenticatedSession session) {
    if (session == null || session.principal() == null) {
      throw new UnauthenticatedException("No authenticated session for data access");
    }
    return forVerifiedToken(session.principal().userId(), session.accessToken());
  }

  /**
   * Client scoped to a token the identity provider has just verified, used while the
   * principal itself is still being resolved.
   */
  public DataClient forVerifiedToken(String userId, String accessToken) {
    if (accessToken == null || accessToken.isBlank()) {
      throw new UnauthenticatedException("No access token for data access");
    }
    log.trace("Issuing user-scoped data client for {}", maskIdentifier(userId));
    return newClient(DataCredential.user(userId, accessToken));
  }

  /**
   * Client using the service credential. Every issuance is logged.
   *
   * @throws IllegalStateException when no service key is configured
   */
  public DataClient forAdministrativeOperation(AdministrativeOperation operation) {
    if (operation == null) {
      throw new IllegalArgumentException("Administrative operation is required");
    }
    if (serviceKey == null || serviceKey.isBlank()) {
      throw new IllegalStateException("Service key is not configured; cannot run " + operation);
    }
    log.info("Issuing service-credential data client for administrative operation {}", operation);
    return newClient(DataCredential.service(operation, serviceKey));
  }

  private DataClient newClient(DataCredential credential) {
    return new RestDataClient(baseUrl, apiKey, credential, httpClient, objectMapper);
  }
}
