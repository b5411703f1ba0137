package com.codeheadsystems.relman.server.auth;

import com.auth0.jwt.JWT;
import com.auth0.jwt.JWTVerifier;
import com.auth0.jwt.RegisteredClaims;
import com.auth0.jwt.algorithms.Algorithm;
import com.auth0.jwt.exceptions.AlgorithmMismatchException;
import com.auth0.jwt.exceptions.JWTDecodeException;
import com.auth0.jwt.exceptions.JWTVerificationException;
import com.auth0.jwt.exceptions.MissingClaimException;
import com.auth0.jwt.exceptions.SignatureVerificationException;
import com.auth0.jwt.exceptions.TokenExpiredException;
import com.auth0.jwt.interfaces.DecodedJWT;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Issues and verifies short-lived JWT session tokens.
 * <p>
 * Tokens are signed with HMAC-SHA256 using the process-wide {@link SigningSecret}. Verification
 * is stateless: no store is consulted, so the only way to invalidate outstanding tokens early
 * is to start with a new secret.
 */
public class JwtManager {

  /**
   * Lifetime of a session token.
   */
  public static final Duration TOKEN_TTL = Duration.ofMinutes(90);

  private static final Logger log = LoggerFactory.getLogger(JwtManager.class);

  private final Algorithm algorithm;
  private final JWTVerifier verifier;
  private final String issuer;
  private final Clock clock;

  /**
   * Creates a new JwtManager.
   *
   * @param secret HMAC-SHA256 signing secret
   * @param issuer JWT issuer claim
   * @param clock  time source for issuance and expiry checks
   */
  public JwtManager(SigningSecret secret, String issuer, Clock clock) {
    this.algorithm = Algorithm.HMAC256(secret.keyBytes());
    this.issuer = issuer;
    this.clock = clock;
    this.verifier = ((JWTVerifier.BaseVerification) JWT.require(algorithm)
        .withIssuer(issuer)
        .withClaimPresence(RegisteredClaims.SUBJECT)
        .withClaimPresence(RegisteredClaims.ISSUED_AT)
        .withClaimPresence(RegisteredClaims.EXPIRES_AT)
        .withClaimPresence(RegisteredClaims.JWT_ID))
        .build(clock);
  }

  /**
   * Issues a session token for a user.
   *
   * @param uid foundation user id, becomes the {@code sub} claim
   * @return the signed token with its claims
   */
  public SessionToken issue(String uid) {
    if (uid == null || uid.isBlank()) {
      throw new IllegalArgumentException("Session token requires a user id");
    }
    String jti = UUID.randomUUID().toString();
    Instant now = clock.instant().truncatedTo(ChronoUnit.SECONDS);
    Instant expiresAt = now.plus(TOKEN_TTL);

    String token = JWT.create()
        .withIssuer(issuer)
        .withJWTId(jti)
        .withSubject(uid)
        .withIssuedAt(now)
        .withExpiresAt(expiresAt)
        .sign(algorithm);

    log.debug("Issued JWT jti={} for uid={}", jti, uid);
    return new SessionToken(token, jti, uid, now, expiresAt);
  }

  /**
   * Verifies a session token.
   *
   * @param token compact JWT
   * @return the principal the token was issued to
   * @throws TokenException with reason INVALID_SIGNATURE, EXPIRED or MALFORMED
   */
  public FoundationPrincipal verify(String token) {
    if (token == null || token.isBlank()) {
      throw new TokenException(TokenException.Reason.MALFORMED, "Missing session token");
    }
    try {
      DecodedJWT decoded = verifier.verify(token);
      return new FoundationPrincipal(decoded.getSubject(), AuthenticationMethod.SESSION_TOKEN, decoded.getId());
    } catch (TokenExpiredException e) {
      log.debug("JWT expired at {}", e.getExpiredOn());
      throw new TokenException(TokenException.Reason.EXPIRED, "Session token expired", e);
    } catch (SignatureVerificationException | AlgorithmMismatchException e) {
      log.debug("JWT signature rejected: {}", e.getMessage());
      throw new TokenException(TokenException.Reason.INVALID_SIGNATURE, "Session token signature invalid", e);
    } catch (JWTDecodeException | MissingClaimException e) {
      log.debug("JWT malformed: {}", e.getMessage());
      throw new TokenException(TokenException.Reason.MALFORMED, "Session token malformed", e);
    } catch (JWTVerificationException e) {
      log.debug("JWT verification failed: {}", e.getMessage());
      throw new TokenException(TokenException.Reason.MALFORMED, "Session token rejected", e);
    } catch (IllegalArgumentException e) {
      log.debug("JWT subject rejected: {}", e.getMessage());
      throw new TokenException(TokenException.Reason.MALFORMED, "Session token has no subject", e);
    }
  }

  public String issuer() {
    return issuer;
  }
}
