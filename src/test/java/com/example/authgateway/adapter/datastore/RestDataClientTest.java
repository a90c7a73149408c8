package com.example.authgateway.adapter.datastore;

import com.example.authgateway.domain.entity.UserProfile;
import com.example.authgateway.exception.ForbiddenException;
import com.example.authgateway.exception.UnauthenticatedException;
import com.example.authgateway.exception.UpstreamUnavailableException;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RestDataClientTest {

  private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();

  private MockWebServer server;
  private RestDataClient client;

  @BeforeEach
  void setUp() throws IOException {
    server = new MockWebServer();
    server.start();
    client = new RestDataClient(server.url("/"), "anon-key", DataCredential.user("user-1", "user-jwt"),
                                new OkHttpClient(), objectMapper);
  }

  @AfterEach
  void tearDown() throws IOException {
    server.shutdown();
  }

  @Test
  void selectOne_sendsEqualityFilterAndUserBearer() throws Exception {
    server.enqueue(new MockResponse().setBody(
        "[{\"id\":\"user-1\",\"email\":\"a@example.com\",\"role\":\"admin\",\"extra\":true}]"));

    Optional<UserProfile> profile = client.selectOne("user_profiles", Map.of("id", "user-1"), UserProfile.class);

    assertThat(profile).map(UserProfile::role).contains("admin");
    RecordedRequest recorded = server.takeRequest();
    assertThat(recorded.getRequestUrl().encodedPath()).isEqualTo("/rest/v1/user_profiles");
    assertThat(recorded.getRequestUrl().queryParameter("id")).isEqualTo("eq.user-1");
    assertThat(recorded.getRequestUrl().queryParameter("limit")).isEqualTo("1");
    assertThat(recorded.getHeader("Authorization")).isEqualTo("Bearer user-jwt");
    assertThat(recorded.getHeader("apikey")).isEqualTo("anon-key");
  }

  @Test
  void selectOne_returnsEmptyWhenRowLevelSecurityHidesTheRow() {
    server.enqueue(new MockResponse().setBody("[]"));

    assertThat(client.selectOne("user_profiles", Map.of("id", "someone-else"), UserProfile.class)).isEmpty();
  }

  @Test
  void select_passesOrderAndLimit() throws Exception {
    server.enqueue(new MockResponse().setBody("[]"));

    List<UserProfile> rows = client.select("admin_audit_log", Map.of(), "timestamp.desc", 50, UserProfile.class);

    assertThat(rows).isEmpty();
    RecordedRequest recorded = server.takeRequest();
    assertThat(recorded.getRequestUrl().queryParameter("order")).isEqualTo("timestamp.desc");
    assertThat(recorded.getRequestUrl().queryParameter("limit")).isEqualTo("50");
  }

  @Test
  void insert_postsRowWithMinimalReturn() throws Exception {
    server.enqueue(new MockResponse().setResponseCode(201));

    client.insert("admin_audit_log", Map.of("action", "ADMIN_ACCESS_GRANTED"));

    RecordedRequest recorded = server.takeRequest();
    assertThat(recorded.getMethod()).isEqualTo("POST");
    assertThat(recorded.getHeader("Prefer")).isEqualTo("return=minimal");
    assertThat(recorded.getBody().readUtf8()).contains("ADMIN_ACCESS_GRANTED");
  }

  @Test
  void statusCodes_mapOntoTheErrorTaxonomy() {
    server.enqueue(new MockResponse().setResponseCode(401));
    server.enqueue(new MockResponse().setResponseCode(403));
    server.enqueue(new MockResponse().setResponseCode(500));

    assertThatThrownBy(() -> client.insert("t", Map.of())).isInstanceOf(UnauthenticatedException.class);
    assertThatThrownBy(() -> client.insert("t", Map.of())).isInstanceOf(ForbiddenException.class);
    assertThatThrownBy(() -> client.insert("t", Map.of())).isInstanceOf(UpstreamUnavailableException.class);
  }

  @Test
  void credential_neverPrintsTheToken() {
    assertThat(client.credential().toString()).doesNotContain("user-jwt");
  }
}
