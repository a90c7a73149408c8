package com.example.authgateway.web.rest.controller;

import static com.example.authgateway.web.rest.ApiConstants.ApiPath.*;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;

import java.util.Map;

@Tag(
    name = "User",
    description = "Endpoints for the authenticated user"
)
@RequestMapping(
    value = API_BASE,
    produces = MediaType.APPLICATION_JSON_VALUE
)
public interface UserAPI {

  /**
   * Current user's profile, read with the user's own credential.
   */
  @Operation(
      summary = "Get current user",
      description = "Returns the authenticated user's profile, role and capabilities"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "User profile returned"),
      @ApiResponse(responseCode = "401", description = "Not authenticated"),
      @ApiResponse(responseCode = "503", description = "Upstream unavailable")
  })
  @GetMapping(value = USER)
  ResponseEntity<Map<String, Object>> getCurrentUser(HttpServletRequest request);
}
