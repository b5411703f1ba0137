package com.codeheadsystems.relman.server.storage;

import com.codeheadsystems.relman.server.auth.FoundationPrincipal;
import com.codeheadsystems.relman.server.auth.JwtManager;
import com.codeheadsystems.relman.server.auth.PatGenerator;
import com.codeheadsystems.relman.server.keys.KeysFileRenderer;
import com.codeheadsystems.relman.server.keys.PublicKeyParser;
import com.codeheadsystems.relman.server.store.ArtifactStore;
import com.codeheadsystems.relman.server.store.ArtifactTransaction;
import com.codeheadsystems.relman.server.store.MembershipDirectory;
import com.codeheadsystems.relman.server.store.StorageBackend;
import com.codeheadsystems.relman.server.store.StorageTransaction;
import java.time.Clock;
import java.util.Objects;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Opens {@link StorageSession}s. The only way to read or change stored state.
 */
public class StorageManager {

  private static final Logger log = LoggerFactory.getLogger(StorageManager.class);

  private final StorageBackend backend;
  private final ArtifactStore artifactStore;
  private final MembershipDirectory directory;
  private final JwtManager jwtManager;
  private final PatGenerator patGenerator;
  private final PublicKeyParser keyParser;
  private final KeysFileRenderer renderer;
  private final WriteAuditor auditor;

  /**
   * Creates a StorageManager with no write auditing.
   */
  public StorageManager(StorageBackend backend, ArtifactStore artifactStore, MembershipDirectory directory,
                        JwtManager jwtManager, PatGenerator patGenerator) {
    this(backend, artifactStore, directory, jwtManager, patGenerator, WriteAuditor.NO_OP);
  }

  /**
   * Creates a StorageManager.
   *
   * @param backend       record store
   * @param artifactStore file store for KEYS files
   * @param directory     role membership
   * @param jwtManager    session token issuer
   * @param patGenerator  personal access token generator, also the session clock
   * @param auditor       hook called before every mutation
   */
  public StorageManager(StorageBackend backend, ArtifactStore artifactStore, MembershipDirectory directory,
                        JwtManager jwtManager, PatGenerator patGenerator, WriteAuditor auditor) {
    this.backend = Objects.requireNonNull(backend, "backend");
    this.artifactStore = Objects.requireNonNull(artifactStore, "artifactStore");
    this.directory = Objects.requireNonNull(directory, "directory");
    this.jwtManager = Objects.requireNonNull(jwtManager, "jwtManager");
    this.patGenerator = Objects.requireNonNull(patGenerator, "patGenerator");
    this.auditor = Objects.requireNonNull(auditor, "auditor");
    this.keyParser = new PublicKeyParser();
    this.renderer = new KeysFileRenderer();
  }

  /**
   * Opens a writable session for an authenticated user. The caller must commit or close it.
   *
   * @param principal the caller
   * @return the session
   * @throws com.codeheadsystems.relman.server.store.StorageUnavailableException when a store cannot be reached
   */
  public StorageSession open(FoundationPrincipal principal) {
    return begin(Objects.requireNonNull(principal, "principal"), false);
  }

  /**
   * Opens a writable session with no principal. Only the general public capability is available.
   *
   * @return the session
   */
  public StorageSession openPublic() {
    return begin(null, false);
  }

  /**
   * Runs work in a writable session, committing when it returns and rolling back when it throws.
   *
   * @param principal the caller
   * @param work      the work
   * @param <T>       the result type
   * @return what the work returned
   */
  public <T> T write(FoundationPrincipal principal, Function<StorageSession, T> work) {
    return run(begin(Objects.requireNonNull(principal, "principal"), false), work);
  }

  /**
   * As {@link #write} with no principal.
   */
  public <T> T writePublic(Function<StorageSession, T> work) {
    return run(begin(null, false), work);
  }

  /**
   * Runs work in a read-only session that is always rolled back. Mutations are rejected.
   *
   * @param principal the caller, null for an anonymous read
   * @param work      the work
   * @param <T>       the result type
   * @return what the work returned
   */
  public <T> T read(FoundationPrincipal principal, Function<StorageSession, T> work) {
    try (StorageSession session = begin(principal, true)) {
      return work.apply(session);
    }
  }

  public MembershipDirectory directory() {
    return directory;
  }

  private <T> T run(StorageSession session, Function<StorageSession, T> work) {
    try (session) {
      T result = work.apply(session);
      if (session.isOpen()) {
        session.commit();
      }
      return result;
    }
  }

  private StorageSession begin(FoundationPrincipal principal, boolean readOnly) {
    StorageTransaction records = backend.begin();
    ArtifactTransaction artifacts;
    try {
      artifacts = artifactStore.begin();
    } catch (RuntimeException e) {
      records.rollback();
      throw e;
    }
    log.debug("Opened {} session for {}", readOnly ? "read" : "write",
        principal == null ? "<public>" : principal.uid());
    return new StorageSession(this, principal, records, artifacts, readOnly);
  }

  JwtManager jwtManager() {
    return jwtManager;
  }

  PatGenerator patGenerator() {
    return patGenerator;
  }

  PublicKeyParser keyParser() {
    return keyParser;
  }

  KeysFileRenderer renderer() {
    return renderer;
  }

  WriteAuditor auditor() {
    return auditor;
  }

  ArtifactStore artifactStore() {
    return artifactStore;
  }

  Clock clock() {
    return patGenerator.clock();
  }
}
