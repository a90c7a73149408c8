package com.example.authgateway.web.rest.controller;

import static com.example.authgateway.web.rest.ApiConstants.ApiPath.*;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@Tag(
    name = "Health",
    description = "Probes served outside the middleware pipeline: no rate limit, CSRF or session"
)
@RequestMapping(
    value = HEALTH_BASE,
    produces = MediaType.APPLICATION_JSON_VALUE
)
public interface HealthAPI {

  @Operation(
      summary = "Gateway status",
      description = "Reports the active rate store and whether the rate limit bypass is in effect"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Gateway is up")
  })
  @GetMapping
  ResponseEntity<Map<String, Object>> health();

  @Operation(
      summary = "Liveness probe",
      description = "Fails once heap usage crosses the critical threshold"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Heap usage below threshold"),
      @ApiResponse(responseCode = "503", description = "Heap usage critical, restart the instance")
  })
  @GetMapping(value = LIVE)
  ResponseEntity<Map<String, Object>> liveness();

  @Operation(
      summary = "Readiness probe",
      description = "Ready when the rate store answers; a Redis store that cannot be reached reports DOWN"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Rate store reachable"),
      @ApiResponse(responseCode = "503", description = "Rate store unreachable")
  })
  @GetMapping(value = READY)
  ResponseEntity<Map<String, Object>> readiness();
}
