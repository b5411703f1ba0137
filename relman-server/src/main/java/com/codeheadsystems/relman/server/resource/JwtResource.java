package com.codeheadsystems.relman.server.resource;

import com.codeheadsystems.relman.model.token.JwtRequest;
import com.codeheadsystems.relman.model.token.JwtResponse;
import com.codeheadsystems.relman.server.manager.TokenManager;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Exchanges a personal access token for a session token.
 * <p>
 * {@code POST /api/jwt} is public; the personal access token in the body is the credential.
 */
@Singleton
@Path("/api/jwt")
public class JwtResource {

  private static final Logger log = LoggerFactory.getLogger(JwtResource.class);

  private final TokenManager tokenManager;

  /**
   * Instantiates a new Jwt resource.
   *
   * @param tokenManager the token manager
   */
  @Inject
  public JwtResource(final TokenManager tokenManager) {
    this.tokenManager = tokenManager;
    log.info("JwtResource({})", tokenManager);
  }

  /**
   * Exchange a personal access token.
   *
   * @param request the request
   * @return the session token
   */
  @POST
  @Consumes(MediaType.APPLICATION_JSON)
  @Produces(MediaType.APPLICATION_JSON)
  public JwtResponse exchange(final JwtRequest request) {
    log.trace("exchange({})", request);
    if (request == null) {
      throw new WebApplicationException("Missing request body", Response.Status.BAD_REQUEST);
    }
    return WebErrors.translate(() -> tokenManager.exchange(request));
  }
}
