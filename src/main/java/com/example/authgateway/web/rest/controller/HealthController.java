package com.example.authgateway.web.rest.controller;

import com.example.authgateway.security.ratelimit.RateLimiter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

/**
 * Probe endpoints. They build their own status codes instead of throwing, so monitoring
 * never sees the gateway error body.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class HealthController implements HealthAPI {

  private static final double MEMORY_USAGE_CRITICAL_PERCENT = 90.0;
  private static final String STATUS_UP = "UP";
  private static final String STATUS_DOWN = "DOWN";
  private static final String STATUS_LIVE = "LIVE";
  private static final String STATUS_DEAD = "DEAD";

  private final RateLimiter rateLimiter;

  @Override
  public ResponseEntity<Map<String, Object>> health() {
    return ResponseEntity.ok(Map.of(
        "status", STATUS_UP,
        "rateStore", rateLimiter.storeName(),
        "rateLimitBypass", rateLimiter.isBypassActive(),
        "timestamp", System.currentTimeMillis()));
  }

  /**
   * Liveness probe - checks JVM health
   */
  @Override
  public ResponseEntity<Map<String, Object>> liveness() {
    Runtime runtime = Runtime.getRuntime();
    long usedMemory = runtime.totalMemory() - runtime.freeMemory();
    double memoryUsagePercent = (double) usedMemory / runtime.maxMemory() * 100;

    Map<String, Object> response = new HashMap<>();
    response.put("memoryUsagePercent", String.format("%.2f", memoryUsagePercent));

    if (memoryUsagePercent < MEMORY_USAGE_CRITICAL_PERCENT) {
      response.put("status", STATUS_LIVE);
      return ResponseEntity.ok(response);
    }

    log.warn("Liveness check failed: memory usage {}%", memoryUsagePercent);
    response.put("status", STATUS_DEAD);
    return ResponseEntity.status(503).body(response);
  }

  /**
   * Readiness probe - checks the rate store
   */
  @Override
  public ResponseEntity<Map<String, Object>> readiness() {
    boolean storeHealthy = rateLimiter.isStoreHealthy();

    Map<String, Object> rateStore = new HashMap<>();
    rateStore.put("type", rateLimiter.storeName());
    rateStore.put("status", storeHealthy ? STATUS_UP : STATUS_DOWN);

    Map<String, Object> status = new HashMap<>();
    status.put("rateStore", rateStore);
    status.put("rateLimitBypass", rateLimiter.isBypassActive());
    status.put("ready", storeHealthy);
    status.put("timestamp", System.currentTimeMillis());

    if (!storeHealthy) {
      log.warn("Readiness check failed: {} rate store unhealthy", rateLimiter.storeName());
    }
    return ResponseEntity.status(storeHealthy ? 200 : 503).body(status);
  }
}
