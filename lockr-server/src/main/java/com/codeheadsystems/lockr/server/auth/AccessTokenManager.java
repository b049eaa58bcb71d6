package com.codeheadsystems.lockr.server.auth;

import com.auth0.jwt.JWT;
import com.auth0.jwt.JWTVerifier;
import com.auth0.jwt.algorithms.Algorithm;
import com.auth0.jwt.exceptions.JWTVerificationException;
import com.auth0.jwt.interfaces.DecodedJWT;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Issues and verifies the bearer tokens that identify the user on vault calls.
 * <p>
 * Tokens are HMAC-SHA256 signed; the subject is the user id. Account login lives elsewhere; this
 * class is the boundary where that layer's verified identity enters the vault core.
 */
public class AccessTokenManager {

  private static final Logger log = LoggerFactory.getLogger(AccessTokenManager.class);

  private final Algorithm algorithm;
  private final JWTVerifier verifier;
  private final String issuer;
  private final long ttlSeconds;
  private final Clock clock;

  /**
   * Creates a new AccessTokenManager.
   *
   * @param secret     HMAC-SHA256 signing secret
   * @param issuer     JWT issuer claim
   * @param ttlSeconds token time-to-live in seconds
   * @param clock      clock used for issued-at and expiry
   */
  public AccessTokenManager(byte[] secret, String issuer, long ttlSeconds, Clock clock) {
    this.algorithm = Algorithm.HMAC256(secret);
    this.verifier = JWT.require(algorithm).withIssuer(issuer).build();
    this.issuer = issuer;
    this.ttlSeconds = ttlSeconds;
    this.clock = clock;
  }

  /**
   * Issues a token for a user the caller has already authenticated.
   *
   * @param userId the user id
   * @return signed JWT string
   */
  public String issueToken(String userId) {
    if (userId == null || userId.isBlank()) {
      throw new IllegalArgumentException("userId is required");
    }
    String jti = UUID.randomUUID().toString();
    Instant now = clock.instant();
    String token = JWT.create()
        .withIssuer(issuer)
        .withJWTId(jti)
        .withSubject(userId)
        .withIssuedAt(now)
        .withExpiresAt(now.plusSeconds(ttlSeconds))
        .sign(algorithm);
    log.debug("Issued access token jti={} for userId={}", jti, userId);
    return token;
  }

  /**
   * Verifies a token.
   *
   * @param token JWT string
   * @return the user id if the token is valid
   */
  public Optional<String> verify(String token) {
    try {
      DecodedJWT decoded = verifier.verify(token);
      String subject = decoded.getSubject();
      if (subject == null || subject.isBlank()) {
        log.debug("Access token jti={} has no subject", decoded.getId());
        return Optional.empty();
      }
      return Optional.of(subject);
    } catch (JWTVerificationException e) {
      log.debug("Access token verification failed: {}", e.getMessage());
      return Optional.empty();
    }
  }
}
