package com.codeheadsystems.relman.server.resource;

import com.codeheadsystems.relman.model.keys.KeyCheckResponse;
import com.codeheadsystems.relman.model.keys.KeyImportResponse;
import com.codeheadsystems.relman.model.keys.KeyLinkResponse;
import com.codeheadsystems.relman.model.keys.KeyRemovalResponse;
import com.codeheadsystems.relman.model.keys.PublicKeyResponse;
import com.codeheadsystems.relman.model.keys.RegenerationResponse;
import com.codeheadsystems.relman.server.auth.FoundationPrincipal;
import com.codeheadsystems.relman.server.manager.KeysManager;
import jakarta.annotation.security.PermitAll;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.SecurityContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Public signing keys and committee KEYS files.
 * <p>
 * Endpoints:
 * <ul>
 *   <li>{@code GET    /api/keys/check}                               - compare key owners with user ids</li>
 *   <li>{@code GET    /api/keys/{fingerprint}}                       - public key lookup</li>
 *   <li>{@code DELETE /api/keys/{fingerprint}}                       - delete one of the caller's keys</li>
 *   <li>{@code POST   /api/keys/{committee}/import}                  - import a KEYS file (text/plain)</li>
 *   <li>{@code POST   /api/keys/{committee}/associate/{fingerprint}} - link a key</li>
 *   <li>{@code POST   /api/keys/{committee}/dissociate/{fingerprint}} - unlink a key</li>
 *   <li>{@code POST   /api/keys/{committee}/regenerate}              - rewrite the KEYS file</li>
 *   <li>{@code POST   /api/keys/{committee}/remove-all}              - unlink every key</li>
 *   <li>{@code POST   /api/keys/regenerate-all}                      - rewrite every KEYS file</li>
 * </ul>
 */
@Singleton
@Path("/api/keys")
@Produces(MediaType.APPLICATION_JSON)
public class KeysResource {

  private static final Logger log = LoggerFactory.getLogger(KeysResource.class);

  private final KeysManager keysManager;

  @Inject
  public KeysResource(final KeysManager keysManager) {
    this.keysManager = keysManager;
    log.info("KeysResource({})", keysManager);
  }

  @GET
  @PermitAll
  @Path("/check")
  public KeyCheckResponse check(@Context final SecurityContext securityContext) {
    FoundationPrincipal principal = WebErrors.principal(securityContext);
    return WebErrors.translate(() -> keysManager.checkKeys(principal));
  }

  @GET
  @Path("/{fingerprint}")
  public PublicKeyResponse key(@PathParam("fingerprint") final String fingerprint) {
    return WebErrors.translate(() -> keysManager.key(fingerprint));
  }

  @DELETE
  @PermitAll
  @Path("/{fingerprint}")
  public RegenerationResponse delete(@Context final SecurityContext securityContext,
                                     @PathParam("fingerprint") final String fingerprint) {
    FoundationPrincipal principal = WebErrors.principal(securityContext);
    return WebErrors.translate(() -> keysManager.deleteKey(principal, fingerprint));
  }

  @POST
  @PermitAll
  @Path("/{committee}/import")
  @Consumes(MediaType.TEXT_PLAIN)
  public KeyImportResponse importKeys(@Context final SecurityContext securityContext,
                                      @PathParam("committee") final String committee,
                                      final String keysFileText) {
    FoundationPrincipal principal = WebErrors.principal(securityContext);
    log.trace("importKeys(committee={}, uid={})", committee, principal.uid());
    return WebErrors.translate(() -> keysManager.importKeys(principal, committee, keysFileText));
  }

  @POST
  @PermitAll
  @Path("/{committee}/associate/{fingerprint}")
  public KeyLinkResponse associate(@Context final SecurityContext securityContext,
                                   @PathParam("committee") final String committee,
                                   @PathParam("fingerprint") final String fingerprint) {
    FoundationPrincipal principal = WebErrors.principal(securityContext);
    return WebErrors.translate(() -> keysManager.associate(principal, committee, fingerprint));
  }

  @POST
  @PermitAll
  @Path("/{committee}/dissociate/{fingerprint}")
  public KeyLinkResponse dissociate(@Context final SecurityContext securityContext,
                                    @PathParam("committee") final String committee,
                                    @PathParam("fingerprint") final String fingerprint) {
    FoundationPrincipal principal = WebErrors.principal(securityContext);
    return WebErrors.translate(() -> keysManager.dissociate(principal, committee, fingerprint));
  }

  @POST
  @PermitAll
  @Path("/{committee}/regenerate")
  public RegenerationResponse regenerate(@Context final SecurityContext securityContext,
                                         @PathParam("committee") final String committee) {
    FoundationPrincipal principal = WebErrors.principal(securityContext);
    return WebErrors.translate(() -> keysManager.regenerate(principal, committee));
  }

  @POST
  @PermitAll
  @Path("/{committee}/remove-all")
  public KeyRemovalResponse removeAll(@Context final SecurityContext securityContext,
                                      @PathParam("committee") final String committee) {
    FoundationPrincipal principal = WebErrors.principal(securityContext);
    return WebErrors.translate(() -> keysManager.removeAll(principal, committee));
  }

  @POST
  @PermitAll
  @Path("/regenerate-all")
  public RegenerationResponse regenerateAll(@Context final SecurityContext securityContext) {
    FoundationPrincipal principal = WebErrors.principal(securityContext);
    return WebErrors.translate(() -> keysManager.regenerateAll(principal));
  }
}
