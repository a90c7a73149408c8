package com.example.authgateway.web.rest.controller;

import static com.example.authgateway.web.rest.ApiConstants.ApiPath.*;

import com.example.authgateway.web.rest.dto.LoginRequest;
import com.example.authgateway.web.rest.dto.SignupRequest;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * Cookie session lifecycle.
 * Tokens are only ever returned as HttpOnly cookies, never in response bodies.
 */
@Tag(
    name = "Session",
    description = "Login, logout, refresh and signup"
)
@RequestMapping(
    value = SESSION_BASE,
    produces = MediaType.APPLICATION_JSON_VALUE
)
public interface SessionAPI {

  @Operation(
      summary = "Log in",
      description = "Exchanges credentials with the identity provider and sets the session cookies"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Session established"),
      @ApiResponse(responseCode = "400", description = "Invalid request body"),
      @ApiResponse(responseCode = "401", description = "Invalid credentials"),
      @ApiResponse(responseCode = "429", description = "Too many failed attempts"),
      @ApiResponse(responseCode = "503", description = "Identity provider unavailable")
  })
  @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
  ResponseEntity<Map<String, Object>> login(@Valid @RequestBody LoginRequest loginRequest,
                                            HttpServletResponse response);

  @Operation(
      summary = "Log out",
      description = "Revokes the session at the identity provider and clears the session cookies"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Cookies cleared")
  })
  @DeleteMapping
  ResponseEntity<Map<String, Object>> logout(HttpServletRequest request, HttpServletResponse response);

  @Operation(
      summary = "Refresh session",
      description = "Rotates all session cookies using the refresh-token cookie"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Cookies rotated"),
      @ApiResponse(responseCode = "401", description = "Refresh token missing or rejected; cookies cleared"),
      @ApiResponse(responseCode = "503", description = "Identity provider unavailable")
  })
  @PostMapping(value = REFRESH)
  ResponseEntity<Map<String, Object>> refresh(HttpServletRequest request, HttpServletResponse response);

  @Operation(
      summary = "Sign up",
      description = "Creates an account; sets session cookies unless e-mail confirmation is required"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "201", description = "Account created with session"),
      @ApiResponse(responseCode = "200", description = "Account created, e-mail confirmation required"),
      @ApiResponse(responseCode = "400", description = "Invalid request or account rejected"),
      @ApiResponse(responseCode = "503", description = "Identity provider unavailable")
  })
  @PostMapping(value = SIGNUP, consumes = MediaType.APPLICATION_JSON_VALUE)
  ResponseEntity<Map<String, Object>> signup(@Valid @RequestBody SignupRequest signupRequest,
                                             HttpServletResponse response);
}
