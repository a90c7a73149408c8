package com.example.authgateway.web.rest.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record SignupRequest(
    @NotBlank(message = "Email is required") @Email(message = "Email is invalid") String email,
    @NotBlank(message = "Password is required")
    @Size(min = 8, max = 128, message = "Password must be between 8 and 128 characters") String password,
    @Size(max = 100, message = "Full name must be at most 100 characters") String fullName
) {

  @Override
  public String toString() {
    return "SignupRequest[email=" + email + "]";
  }
}
