package com.example.authgateway.web.rest.controller;

import static com.example.authgateway.web.rest.ApiConstants.ApiPath.*;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * Administrative endpoints. Every request is role-checked and audited before it gets here.
 */
@Tag(
    name = "Administration",
    description = "Admin verification, audit export and cache maintenance"
)
@RequestMapping(
    value = ADMIN_BASE,
    produces = MediaType.APPLICATION_JSON_VALUE
)
public interface AdminAPI {

  @Operation(
      summary = "Verify admin access",
      description = "Returns the caller's admin role and capabilities"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Caller is an admin"),
      @ApiResponse(responseCode = "401", description = "Not authenticated"),
      @ApiResponse(responseCode = "403", description = "Not an admin, or CSRF check failed"),
      @ApiResponse(responseCode = "503", description = "Audit log unavailable")
  })
  @PostMapping(value = VERIFY)
  ResponseEntity<Map<String, Object>> verify(HttpServletRequest request);

  @Operation(
      summary = "Export audit log",
      description = "Most recent audit entries across all users; requires system administration"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Audit entries returned"),
      @ApiResponse(responseCode = "403", description = "Missing system administration capability"),
      @ApiResponse(responseCode = "503", description = "Datastore unavailable")
  })
  @GetMapping(value = AUDIT)
  ResponseEntity<Map<String, Object>> exportAudit(
      @Parameter(description = "Maximum number of entries", example = "100")
      @RequestParam(defaultValue = "100") @Min(1) @Max(1000) int limit,
      HttpServletRequest request);

  @Operation(
      summary = "Clear principal cache",
      description = "Forces every principal to be re-resolved from the profile store"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Cache cleared")
  })
  @PostMapping(value = CACHE_CLEAR)
  ResponseEntity<Map<String, Object>> clearCache(HttpServletRequest request);
}
