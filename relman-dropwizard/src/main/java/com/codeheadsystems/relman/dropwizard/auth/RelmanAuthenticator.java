package com.codeheadsystems.relman.dropwizard.auth;

import com.codeheadsystems.relman.server.auth.FoundationPrincipal;
import com.codeheadsystems.relman.server.auth.JwtManager;
import com.codeheadsystems.relman.server.auth.TokenException;
import io.dropwizard.auth.Authenticator;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dropwizard {@link Authenticator} that validates JWT bearer tokens using {@link JwtManager}.
 */
public class RelmanAuthenticator implements Authenticator<String, FoundationPrincipal> {

  private static final Logger log = LoggerFactory.getLogger(RelmanAuthenticator.class);

  private final JwtManager jwtManager;

  /**
   * Instantiates a new Relman authenticator.
   *
   * @param jwtManager the jwt manager
   */
  public RelmanAuthenticator(JwtManager jwtManager) {
    this.jwtManager = jwtManager;
  }

  @Override
  public Optional<FoundationPrincipal> authenticate(String token) {
    try {
      return Optional.of(jwtManager.verify(token));
    } catch (TokenException e) {
      log.debug("Rejected bearer token: {}", e.reason());
      return Optional.empty();
    }
  }
}
