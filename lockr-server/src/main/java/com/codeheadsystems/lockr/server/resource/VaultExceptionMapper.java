package com.codeheadsystems.lockr.server.resource;

import com.codeheadsystems.lockr.model.ErrorResponse;
import com.codeheadsystems.lockr.server.error.RateLimitedException;
import com.codeheadsystems.lockr.server.error.VaultErrorCode;
import com.codeheadsystems.lockr.server.error.VaultException;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renders {@link VaultException}s as {@link ErrorResponse} bodies with the status their code maps
 * to. Rate limiting adds a {@code Retry-After} header.
 */
@Provider
public class VaultExceptionMapper implements ExceptionMapper<VaultException> {

  private static final Logger log = LoggerFactory.getLogger(VaultExceptionMapper.class);

  @Override
  public Response toResponse(VaultException exception) {
    VaultErrorCode code = exception.code();
    if (code == VaultErrorCode.FATAL) {
      log.error("Vault operation failed", exception);
    } else {
      log.debug("Vault operation rejected: {} {}", code, exception.getMessage());
    }

    Response.ResponseBuilder builder = Response.status(code.httpStatus()).type(MediaType.APPLICATION_JSON_TYPE);
    if (exception instanceof RateLimitedException rateLimited) {
      long seconds = rateLimited.retryAfterSeconds();
      builder.header(HttpHeaders.RETRY_AFTER, seconds)
          .entity(new ErrorResponse(code.name(), exception.getMessage(), seconds));
    } else if (code == VaultErrorCode.FATAL) {
      // Internal detail stays in the server log.
      builder.entity(new ErrorResponse(code.name(), "Internal vault error"));
    } else {
      builder.entity(new ErrorResponse(code.name(), exception.getMessage()));
    }
    return builder.build();
  }
}
