package com.example.authgateway.security;

import com.example.authgateway.domain.entity.AuthenticatedSession;
import com.example.authgateway.domain.entity.Role;
import com.example.authgateway.domain.entity.UserPrincipal;
import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;

import java.util.ArrayList;
import java.util.List;

/**
 * Spring Security view of an authenticated session. Authorities are {@code ROLE_<role>} for
 * the principal's role and every role below it, plus one authority per capability.
 */
public class PrincipalAuthentication extends AbstractAuthenticationToken {

  private final AuthenticatedSession session;

  public PrincipalAuthentication(AuthenticatedSession session) {
    super(authoritiesOf(session.principal()));
    this.session = session;
    setAuthenticated(true);
  }

  @Override
  public Object getCredentials() {
    // The access token stays on the session; it is never exposed as a credential.
    return null;
  }

  @Override
  public UserPrincipal getPrincipal() {
    return session.principal();
  }

  @Override
  public String getName() {
    return session.principal().userId();
  }

  public AuthenticatedSession getSession() {
    return session;
  }

  private static List<GrantedAuthority> authoritiesOf(UserPrincipal principal) {
    List<GrantedAuthority> authorities = new ArrayList<>();
    for (Role role : Role.values()) {
      if (principal.role().satisfies(role)) {
        authorities.add(new SimpleGrantedAuthority("ROLE_" + role.name()));
      }
    }
    principal.capabilities().forEach(capability ->
        authorities.add(new SimpleGrantedAuthority(capability.tag())));
    return authorities;
  }
}
