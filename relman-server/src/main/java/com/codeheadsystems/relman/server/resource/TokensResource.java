package com.codeheadsystems.relman.server.resource;

import com.codeheadsystems.relman.model.token.PatSummary;
import com.codeheadsystems.relman.server.auth.FoundationPrincipal;
import com.codeheadsystems.relman.server.manager.TokenManager;
import jakarta.annotation.security.PermitAll;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.SecurityContext;
import java.util.List;

/**
 * Personal access token management for the authenticated caller.
 * <ul>
 *   <li>{@code GET  /api/tokens}                    - the caller's tokens</li>
 *   <li>{@code POST /api/tokens/{owner}/{id}/revoke} - revoke a token</li>
 * </ul>
 */
@Singleton
@Path("/api/tokens")
@Produces(MediaType.APPLICATION_JSON)
public class TokensResource {

  private final TokenManager tokenManager;

  @Inject
  public TokensResource(final TokenManager tokenManager) {
    this.tokenManager = tokenManager;
  }

  @GET
  @PermitAll
  public List<PatSummary> list(@Context final SecurityContext securityContext) {
    FoundationPrincipal principal = WebErrors.principal(securityContext);
    return WebErrors.translate(() -> tokenManager.listPats(principal));
  }

  @POST
  @PermitAll
  @Path("/{owner}/{id}/revoke")
  public Response revoke(@Context final SecurityContext securityContext,
                         @PathParam("owner") final String owner,
                         @PathParam("id") final String id) {
    FoundationPrincipal principal = WebErrors.principal(securityContext);
    WebErrors.translate(() -> {
      tokenManager.revokePat(principal, owner, id);
      return id;
    });
    return Response.noContent().build();
  }
}
