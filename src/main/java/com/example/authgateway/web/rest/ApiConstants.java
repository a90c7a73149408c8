package com.example.authgateway.web.rest;

public final class ApiConstants {

  public static final class ApiPath {
    // Base paths
    public static final String SESSION_BASE = "/session";
    public static final String API_BASE = "/api";
    public static final String ADMIN_BASE = "/admin";
    public static final String HEALTH_BASE = "/health";

    // Session paths
    public static final String REFRESH = "/refresh";
    public static final String SIGNUP = "/signup";

    // API paths
    public static final String USER = "/user";

    // Admin paths
    public static final String VERIFY = "/verify";
    public static final String AUDIT = "/audit";
    public static final String CACHE_CLEAR = "/cache/clear";

    // Health paths
    public static final String LIVE = "/live";
    public static final String READY = "/ready";

    private ApiPath() {}
  }

  private ApiConstants() {}
}
