package com.example.authgateway.security.ratelimit;

import java.time.Instant;

/**
 * State of one bucket after an increment.
 */
public record RateWindow(long count, Instant resetAt) {}
