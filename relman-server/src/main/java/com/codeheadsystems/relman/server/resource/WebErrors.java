package com.codeheadsystems.relman.server.resource;

import com.codeheadsystems.relman.server.auth.FoundationPrincipal;
import com.codeheadsystems.relman.server.auth.TokenException;
import com.codeheadsystems.relman.server.storage.AccessDeniedException;
import com.codeheadsystems.relman.server.storage.NotFoundException;
import com.codeheadsystems.relman.server.store.StorageUnavailableException;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.SecurityContext;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Translates the manager exception contract into HTTP status codes. Anything else, including
 * an {@link IllegalStateException} from misuse of a storage session, is left to the server's
 * default mapping (500).
 */
final class WebErrors {

  private static final Logger log = LoggerFactory.getLogger(WebErrors.class);

  private WebErrors() {
  }

  static <T> T translate(Supplier<T> call) {
    try {
      return call.get();
    } catch (WebApplicationException e) {
      throw e;
    } catch (AccessDeniedException e) {
      log.debug("Access denied: {}", e.getMessage());
      throw new WebApplicationException(e.getMessage(), Response.Status.FORBIDDEN);
    } catch (TokenException e) {
      log.debug("Authentication failed ({}): {}", e.reason(), e.getMessage());
      throw new WebApplicationException("Authentication failed", Response.Status.UNAUTHORIZED);
    } catch (NotFoundException e) {
      throw new WebApplicationException(e.getMessage(), Response.Status.NOT_FOUND);
    } catch (IllegalArgumentException e) {
      throw new WebApplicationException(e.getMessage(), Response.Status.BAD_REQUEST);
    } catch (StorageUnavailableException e) {
      log.warn("Storage unavailable: {}", e.getMessage());
      throw new WebApplicationException("Storage unavailable", Response.Status.SERVICE_UNAVAILABLE);
    }
  }

  static FoundationPrincipal principal(SecurityContext securityContext) {
    if (securityContext != null && securityContext.getUserPrincipal() instanceof FoundationPrincipal principal) {
      return principal;
    }
    throw new WebApplicationException("Authentication required", Response.Status.UNAUTHORIZED);
  }
}
