package com.example.authgateway.client;

import okhttp3.Cookie;
import okhttp3.CookieJar;
import okhttp3.HttpUrl;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * In-memory cookie store for one client session. Cookies are replaced by name, domain and
 * path as the server rotates them; expired cookies are dropped when read.
 */
public class SessionCookieJar implements CookieJar {

  private final String csrfCookieName;
  private final List<Cookie> cookies = new ArrayList<>();

  public SessionCookieJar(String csrfCookieName) {
    this.csrfCookieName = csrfCookieName;
  }

  @Override
  public synchronized void saveFromResponse(HttpUrl url, List<Cookie> received) {
    for (Cookie cookie : received) {
      cookies.removeIf(existing -> sameIdentity(existing, cookie));
      if (cookie.expiresAt() > System.currentTimeMillis() && !cookie.value().isEmpty()) {
        cookies.add(cookie);
      }
    }
  }

  @Override
  public synchronized List<Cookie> loadForRequest(HttpUrl url) {
    long now = System.currentTimeMillis();
    cookies.removeIf(cookie -> cookie.expiresAt() <= now);

    List<Cookie> matching = new ArrayList<>();
    for (Cookie cookie : cookies) {
      if (cookie.matches(url)) {
        matching.add(cookie);
      }
    }
    return matching;
  }

  /**
   * The script-readable anti-forgery token, mirrored into the request header.
   */
  public synchronized Optional<String> csrfToken() {
    long now = System.currentTimeMillis();
    return cookies.stream()
        .filter(cookie -> cookie.name().equals(csrfCookieName) && cookie.expiresAt() > now)
        .map(Cookie::value)
        .findFirst();
  }

  public synchronized boolean isEmpty() {
    return cookies.isEmpty();
  }

  public synchronized void clear() {
    cookies.clear();
  }

  private static boolean sameIdentity(Cookie a, Cookie b) {
    return a.name().equals(b.name())
        && a.domain().equals(b.domain())
        && a.path().equals(b.path());
  }
}
