package com.example.authgateway.security.csrf;

import com.example.authgateway.TestProperties;
import com.example.authgateway.properties.ApplicationProperties;
import com.example.authgateway.security.SessionCookieCodec;
import jakarta.servlet.http.Cookie;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.springframework.mock.web.MockHttpServletRequest;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("CsrfVerifier")
class CsrfVerifierTest {

  private static final String TOKEN = "nonce-value";

  private final ApplicationProperties properties = TestProperties.production();
  private final CsrfVerifier verifier = new CsrfVerifier(new SessionCookieCodec(properties), properties);

  private static MockHttpServletRequest request(String method) {
    MockHttpServletRequest request = new MockHttpServletRequest(method, "/api/items");
    request.setCookies(new Cookie("csrf-token", TOKEN));
    request.addHeader("X-CSRF-Token", TOKEN);
    request.addHeader("Origin", TestProperties.ALLOWED_ORIGIN);
    return request;
  }

  @ParameterizedTest
  @ValueSource(strings = {"GET", "HEAD", "OPTIONS"})
  @DisplayName("never checks safe methods")
  void safeMethodsPass(String method) {
    MockHttpServletRequest request = new MockHttpServletRequest(method, "/api/items");

    assertThat(verifier.verify(request).allowed()).isTrue();
  }

  @Test
  @DisplayName("accepts a matching token from an allowed origin")
  void acceptsValidRequest() {
    assertThat(verifier.verify(request("POST"))).isEqualTo(CsrfVerdict.allow());
  }

  @Nested
  @DisplayName("token checks")
  class Tokens {

    @Test
    @DisplayName("rejects a missing cookie")
    void missingCookie() {
      MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/items");
      request.addHeader("X-CSRF-Token", TOKEN);
      request.addHeader("Origin", TestProperties.ALLOWED_ORIGIN);

      CsrfVerdict verdict = verifier.verify(request);

      assertThat(verdict.allowed()).isFalse();
      assertThat(verdict.reason()).isEqualTo("CSRF cookie missing");
    }

    @Test
    @DisplayName("rejects a missing header")
    void missingHeader() {
      MockHttpServletRequest request = new MockHttpServletRequest("DELETE", "/api/items");
      request.setCookies(new Cookie("csrf-token", TOKEN));
      request.addHeader("Origin", TestProperties.ALLOWED_ORIGIN);

      assertThat(verifier.verify(request).reason()).isEqualTo("CSRF header missing");
    }

    @Test
    @DisplayName("rejects a header that differs from the cookie")
    void mismatch() {
      MockHttpServletRequest request = new MockHttpServletRequest("PUT", "/api/items");
      request.setCookies(new Cookie("csrf-token", TOKEN));
      request.addHeader("X-CSRF-Token", TOKEN + "x");
      request.addHeader("Origin", TestProperties.ALLOWED_ORIGIN);

      assertThat(verifier.verify(request).reason()).isEqualTo("CSRF token mismatch");
    }
  }

  @Nested
  @DisplayName("origin checks")
  class Origins {

    @Test
    @DisplayName("rejects a foreign origin even with a matching token")
    void foreignOrigin() {
      MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/items");
      request.setCookies(new Cookie("csrf-token", TOKEN));
      request.addHeader("X-CSRF-Token", TOKEN);
      request.addHeader("Origin", "https://evil.example.net");

      assertThat(verifier.verify(request).reason()).isEqualTo("Origin not allowed");
    }

    @Test
    @DisplayName("falls back to the referer when Origin is absent")
    void refererFallback() {
      MockHttpServletRequest request = new MockHttpServletRequest("PATCH", "/api/items");
      request.setCookies(new Cookie("csrf-token", TOKEN));
      request.addHeader("X-CSRF-Token", TOKEN);
      request.addHeader("Referer", "https://APP.example.com:443/dashboard?tab=1");

      assertThat(verifier.verify(request).allowed()).isTrue();
    }

    @Test
    @DisplayName("treats an opaque null origin as absent")
    void nullOriginWithoutReferer() {
      MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/items");
      request.setCookies(new Cookie("csrf-token", TOKEN));
      request.addHeader("X-CSRF-Token", TOKEN);
      request.addHeader("Origin", "null");

      assertThat(verifier.verify(request).reason()).isEqualTo("Origin could not be determined");
    }
  }

  @Test
  @DisplayName("normalizes origins to scheme, host and non-default port")
  void normalizesOrigins() {
    assertThat(CsrfVerifier.normalizeOrigin("HTTPS://App.Example.com:443/path")).contains("https://app.example.com");
    assertThat(CsrfVerifier.normalizeOrigin("http://localhost:3000")).contains("http://localhost:3000");
    assertThat(CsrfVerifier.normalizeOrigin("not a url")).isEmpty();
  }
}
