package com.codeheadsystems.lockr.server.resource;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.ws.rs.NotAuthorizedException;
import jakarta.ws.rs.core.SecurityContext;
import java.security.Principal;

final class RequestContexts {

  private RequestContexts() {
  }

  /**
   * User id established by the authentication filter.
   */
  static String userId(SecurityContext securityContext) {
    Principal principal = securityContext == null ? null : securityContext.getUserPrincipal();
    if (principal == null || principal.getName() == null) {
      throw new NotAuthorizedException("Bearer");
    }
    return principal.getName();
  }

  static String address(HttpServletRequest request) {
    return request == null ? null : request.getRemoteAddr();
  }
}
