package com.codeheadsystems.relman.server.manager;

import com.codeheadsystems.relman.model.token.JwtRequest;
import com.codeheadsystems.relman.model.token.JwtResponse;
import com.codeheadsystems.relman.model.token.PatSummary;
import com.codeheadsystems.relman.server.auth.FoundationPrincipal;
import com.codeheadsystems.relman.server.auth.IssuedPat;
import com.codeheadsystems.relman.server.auth.SessionToken;
import com.codeheadsystems.relman.server.storage.StorageManager;
import com.codeheadsystems.relman.server.store.PersonalAccessToken;
import java.time.Instant;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Framework-agnostic service for personal access tokens and session tokens.
 * <p>
 * <strong>Exception contract</strong> (callers should map these to HTTP responses):
 * <ul>
 *   <li>{@link IllegalArgumentException}    - missing request data, HTTP 400</li>
 *   <li>{@link com.codeheadsystems.relman.server.auth.TokenException}         - bad credential, HTTP 401</li>
 *   <li>{@link com.codeheadsystems.relman.server.storage.AccessDeniedException} - not allowed, HTTP 403</li>
 *   <li>{@link com.codeheadsystems.relman.server.storage.NotFoundException}    - no such token, HTTP 404</li>
 *   <li>{@link com.codeheadsystems.relman.server.store.StorageUnavailableException} - storage unavailable, HTTP 503</li>
 * </ul>
 */
public class TokenManager {

  private static final Logger log = LoggerFactory.getLogger(TokenManager.class);

  private final StorageManager storageManager;

  public TokenManager(StorageManager storageManager) {
    this.storageManager = storageManager;
  }

  /**
   * Exchanges a personal access token for a session token. Needs no prior authentication.
   *
   * @param request user id and plaintext token
   * @return the session token
   */
  public JwtResponse exchange(JwtRequest request) {
    String uid = request.uid();
    String pat = request.plaintextPat();
    SessionToken token = storageManager.writePublic(session -> session.asGeneralPublic().issueJwt(uid, pat));
    log.info("Issued session token jti={} for uid={}", token.jti(), uid);
    return new JwtResponse(uid, token.token());
  }

  /**
   * Issues a personal access token for a user who signed in through the identity provider.
   *
   * @param principal the caller
   * @param label     user-facing description
   * @return the plaintext, to show once, and the stored record
   */
  public IssuedPat issuePat(FoundationPrincipal principal, String label) {
    IssuedPat issued = storageManager.write(principal, session -> session.asFoundationCommitter().issuePat(label));
    log.info("Issued personal access token id={} for uid={}", issued.token().id(), principal.uid());
    return issued;
  }

  /**
   * Lists the caller's personal access tokens.
   *
   * @param principal the caller
   * @return token summaries, oldest first
   */
  public List<PatSummary> listPats(FoundationPrincipal principal) {
    return storageManager.read(principal, session -> session.asFoundationCommitter().pats())
        .stream()
        .map(TokenManager::toSummary)
        .toList();
  }

  /**
   * Revokes a personal access token.
   *
   * @param principal the caller, the owner or an administrator
   * @param ownerUid  the token's owner
   * @param patId     the token id
   */
  public void revokePat(FoundationPrincipal principal, String ownerUid, String patId) {
    if (ownerUid == null || ownerUid.isBlank() || patId == null || patId.isBlank()) {
      throw new IllegalArgumentException("Missing required field: owner or id");
    }
    storageManager.write(principal, session -> {
      session.asFoundationCommitter().revokePat(ownerUid, patId);
      return patId;
    });
    log.info("Revoked personal access token id={} of uid={} by uid={}", patId, ownerUid, principal.uid());
  }

  static PatSummary toSummary(PersonalAccessToken pat) {
    return new PatSummary(pat.id(), pat.uid(), pat.label(), iso(pat.created()), iso(pat.expires()),
        iso(pat.lastUsed()), pat.revoked());
  }

  static String iso(Instant instant) {
    return instant == null ? null : instant.toString();
  }
}
