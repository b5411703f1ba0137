package com.codeheadsystems.relman.server.manager;

import com.codeheadsystems.relman.model.keys.KeyCheckResponse;
import com.codeheadsystems.relman.model.keys.KeyImportItem;
import com.codeheadsystems.relman.model.keys.KeyImportResponse;
import com.codeheadsystems.relman.model.keys.KeyLinkResponse;
import com.codeheadsystems.relman.model.keys.KeyRemovalResponse;
import com.codeheadsystems.relman.model.keys.PublicKeyResponse;
import com.codeheadsystems.relman.model.keys.RegenerationResponse;
import com.codeheadsystems.relman.server.auth.FoundationPrincipal;
import com.codeheadsystems.relman.server.keys.PublicKeyParser;
import com.codeheadsystems.relman.server.outcome.Outcome;
import com.codeheadsystems.relman.server.outcome.Outcomes;
import com.codeheadsystems.relman.server.storage.AccessDeniedException;
import com.codeheadsystems.relman.server.storage.CommitteeKeysRemoval;
import com.codeheadsystems.relman.server.storage.GeneralPublic;
import com.codeheadsystems.relman.server.storage.KeyDeletion;
import com.codeheadsystems.relman.server.storage.KeyImport;
import com.codeheadsystems.relman.server.storage.KeyImportBatch;
import com.codeheadsystems.relman.server.storage.KeyLink;
import com.codeheadsystems.relman.server.storage.NotFoundException;
import com.codeheadsystems.relman.server.storage.StorageManager;
import com.codeheadsystems.relman.server.store.PublicSigningKey;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Framework-agnostic service for public signing keys and committee KEYS files.
 * <p>
 * Follows the same exception contract as {@link TokenManager}. Per-key problems in a bulk
 * import are reported in the response rather than thrown.
 */
public class KeysManager {

  private static final Logger log = LoggerFactory.getLogger(KeysManager.class);

  private final StorageManager storageManager;

  public KeysManager(StorageManager storageManager) {
    this.storageManager = storageManager;
  }

  /**
   * Looks up a key. Open to anyone.
   *
   * @param fingerprint hex fingerprint
   * @return the key
   * @throws NotFoundException when there is no such key
   */
  public PublicKeyResponse key(String fingerprint) {
    if (fingerprint == null || fingerprint.isBlank()) {
      throw new IllegalArgumentException("Missing required field: fingerprint");
    }
    return storageManager.read(null, session -> {
      GeneralPublic general = session.asGeneralPublic();
      PublicSigningKey key = general.key(fingerprint)
          .orElseThrow(() -> new NotFoundException("No key " + fingerprint));
      return new PublicKeyResponse(key.fingerprint(), key.algorithm(), key.length(),
          TokenManager.iso(key.created()), TokenManager.iso(key.expires()), key.primaryDeclaredUid(),
          key.apacheUid(), List.copyOf(general.keyCommittees(key.fingerprint())), key.asciiArmoredKey());
    });
  }

  /**
   * Imports a KEYS file into a committee.
   *
   * @param principal    a participant of the committee
   * @param committee    committee name
   * @param keysFileText KEYS file content
   * @return one report item per key block
   */
  public KeyImportResponse importKeys(FoundationPrincipal principal, String committee, String keysFileText) {
    if (keysFileText == null || keysFileText.isBlank()) {
      throw new IllegalArgumentException("Missing required field: KEYS file content");
    }
    KeyImportBatch batch = storageManager.write(principal,
        session -> session.asCommitteeParticipant(committee).ensureAssociated(keysFileText));
    Outcomes<KeyImport> imports = batch.imports();
    List<KeyImportItem> items = new ArrayList<>();
    imports.forEach((item, outcome) -> items.add(outcome.fold(
        imported -> new KeyImportItem(item, imported.key().fingerprint(), imported.status().name(), null, null),
        (imported, warning) -> new KeyImportItem(item, imported.key().fingerprint(), imported.status().name(),
            warning.getMessage(), null),
        (error, partial) -> new KeyImportItem(item, null, null, null, error.getMessage()))));
    log.info("Imported KEYS into {} for uid={}: {} succeeded, {} failed",
        committee, principal.uid(), imports.successCount(), imports.failureCount());
    return new KeyImportResponse(committee, imports.successCount(), imports.failureCount(), items,
        errorMessage(batch.keysFile()));
  }

  /**
   * Links a stored key to a committee.
   */
  public KeyLinkResponse associate(FoundationPrincipal principal, String committee, String fingerprint) {
    KeyLink link = storageManager.write(principal,
        session -> session.asCommitteeParticipant(committee).associateFingerprint(fingerprint).resultOrThrow());
    return toResponse(link);
  }

  /**
   * Unlinks a key from a committee. Committee members only.
   */
  public KeyLinkResponse dissociate(FoundationPrincipal principal, String committee, String fingerprint) {
    KeyLink link = storageManager.write(principal,
        session -> session.asCommitteeMember(committee).dissociateFingerprint(fingerprint).resultOrThrow());
    return toResponse(link);
  }

  /**
   * Rewrites one committee's KEYS file. Committee members only.
   */
  public RegenerationResponse regenerate(FoundationPrincipal principal, String committee) {
    Outcomes<Path> outcomes = new Outcomes<>();
    storageManager.write(principal,
        session -> outcomes.append(committee, session.asCommitteeMember(committee).autogenerateKeysFile()));
    return toResponse(outcomes);
  }

  /**
   * Rewrites the KEYS file of every committee. Administrators only.
   *
   * @param principal an administrator
   * @return regenerated paths and errors, by committee
   * @throws AccessDeniedException INSUFFICIENT_PRIVILEGE for anyone else
   */
  public RegenerationResponse regenerateAll(FoundationPrincipal principal) {
    return toResponse(regenerateAllOutcomes(principal));
  }

  /**
   * As {@link #regenerateAll} but returning the outcome per committee.
   */
  public Outcomes<Path> regenerateAllOutcomes(FoundationPrincipal principal) {
    requireAdministrator(principal);
    Outcomes<Path> outcomes = storageManager.write(principal, session -> {
      Outcomes<Path> regenerated = new Outcomes<>();
      storageManager.directory().committees().forEach(committee ->
          regenerated.append(committee, session.asCommitteeMember(committee).autogenerateKeysFile()));
      return regenerated;
    });
    log.info("Regenerated {} KEYS file(s), {} failed", outcomes.successCount(), outcomes.failureCount());
    return outcomes;
  }

  /**
   * Compares each stored key's recorded owner with the foundation uid its user ids declare.
   * Administrators only.
   *
   * @param principal an administrator
   * @return how many keys were checked and which of them disagree
   * @throws AccessDeniedException INSUFFICIENT_PRIVILEGE for anyone else
   */
  public KeyCheckResponse checkKeys(FoundationPrincipal principal) {
    requireAdministrator(principal);
    List<PublicSigningKey> keys = storageManager.read(principal, session -> session.asGeneralPublic().keys());
    List<KeyCheckResponse.KeyMismatch> mismatches = new ArrayList<>();
    for (PublicSigningKey key : keys) {
      List<String> declared = new ArrayList<>();
      if (key.primaryDeclaredUid() != null) {
        declared.add(key.primaryDeclaredUid());
      }
      declared.addAll(key.secondaryDeclaredUids());
      String detected = PublicKeyParser.foundationUid(declared);
      if (!Objects.equals(detected, key.apacheUid())) {
        mismatches.add(new KeyCheckResponse.KeyMismatch(key.fingerprint(), detected, key.apacheUid()));
      }
    }
    log.info("Checked {} key(s), {} mismatched", keys.size(), mismatches.size());
    return new KeyCheckResponse(keys.size(), mismatches);
  }

  /**
   * Removes every key from a committee. Administrators only.
   *
   * @throws AccessDeniedException INSUFFICIENT_PRIVILEGE for anyone else
   */
  public KeyRemovalResponse removeAll(FoundationPrincipal principal, String committee) {
    CommitteeKeysRemoval removal = storageManager.write(principal,
        session -> session.asCommitteeMember(committee).removeAllKeys().resultOrThrow());
    log.info("Removed {} key link(s) and {} key(s) from {} for uid={}",
        removal.unlinked().size(), removal.deletedKeys().size(), committee, principal.uid());
    return new KeyRemovalResponse(removal.committee(), removal.unlinked(), removal.deletedKeys(),
        errorMessage(removal.keysFile()));
  }

  /**
   * Deletes one of the caller's keys.
   *
   * @return regenerated KEYS files of the committees the key was linked to
   */
  public RegenerationResponse deleteKey(FoundationPrincipal principal, String fingerprint) {
    KeyDeletion deletion = storageManager.write(principal,
        session -> session.asFoundationCommitter().deleteKey(fingerprint).resultOrThrow());
    log.info("Deleted key {} for uid={}", deletion.fingerprint(), principal.uid());
    return toResponse(deletion.keysFiles());
  }

  private void requireAdministrator(FoundationPrincipal principal) {
    if (!storageManager.directory().isAdministrator(principal.uid())) {
      throw new AccessDeniedException(AccessDeniedException.Reason.INSUFFICIENT_PRIVILEGE,
          principal.uid() + " is not an administrator");
    }
  }

  private static KeyLinkResponse toResponse(KeyLink link) {
    return new KeyLinkResponse(link.committee(), link.fingerprint(), link.changed(), errorMessage(link.keysFile()));
  }

  private static RegenerationResponse toResponse(Outcomes<Path> outcomes) {
    Map<String, String> regenerated = new LinkedHashMap<>();
    outcomes.forEach((committee, outcome) -> outcome.result()
        .ifPresent(path -> regenerated.put(committee, path.toString())));
    Map<String, String> errors = new LinkedHashMap<>();
    outcomes.causesByKey().forEach((committee, cause) -> errors.put(committee, cause.getMessage()));
    return new RegenerationResponse(regenerated, errors);
  }

  private static String errorMessage(Outcome<Path> keysFile) {
    return keysFile.ok() ? null : keysFile.cause().map(Exception::getMessage).orElse("KEYS file not generated");
  }
}
