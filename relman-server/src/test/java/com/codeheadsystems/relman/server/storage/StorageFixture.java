package com.codeheadsystems.relman.server.storage;

import com.codeheadsystems.relman.server.auth.AuthenticationMethod;
import com.codeheadsystems.relman.server.auth.FoundationPrincipal;
import com.codeheadsystems.relman.server.auth.JwtManager;
import com.codeheadsystems.relman.server.auth.MutableClock;
import com.codeheadsystems.relman.server.auth.PatGenerator;
import com.codeheadsystems.relman.server.auth.RandomProvider;
import com.codeheadsystems.relman.server.auth.SigningSecret;
import com.codeheadsystems.relman.server.store.FilesystemArtifactStore;
import com.codeheadsystems.relman.server.store.InMemoryStorageBackend;
import com.codeheadsystems.relman.server.store.StaticMembershipDirectory;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Storage wired against memory and a temporary directory.
 * <p>
 * Roles: root administers; alice is a tooling member and bob a tooling committer; carol is a
 * docs member; dave is a committer on no committee; eve has no role.
 */
public class StorageFixture {

  public static final Instant START = Instant.parse("2025-03-01T12:00:00Z");

  public final MutableClock clock = new MutableClock(START);
  public final InMemoryStorageBackend backend = new InMemoryStorageBackend();
  public final FilesystemArtifactStore artifacts;
  public final StaticMembershipDirectory directory = new StaticMembershipDirectory(
      Set.of("root"),
      Set.of("dave"),
      Map.of(
          "tooling", new StaticMembershipDirectory.Roster(Set.of("alice"), Set.of("bob")),
          "docs", new StaticMembershipDirectory.Roster(Set.of("carol"), Set.of())));
  public final JwtManager jwtManager = new JwtManager(SigningSecret.generate(new RandomProvider()), "relman-test", clock);
  public final PatGenerator patGenerator = new PatGenerator(new RandomProvider(), clock);
  public final List<String> audit = new ArrayList<>();
  public final StorageManager manager;

  public StorageFixture(Path artifactRoot) {
    artifacts = new FilesystemArtifactStore(artifactRoot);
    manager = new StorageManager(backend, artifacts, directory, jwtManager, patGenerator,
        (uid, operation, target) -> audit.add(uid + " " + operation + " " + target));
  }

  public static FoundationPrincipal signedIn(String uid) {
    return FoundationPrincipal.signedIn(uid);
  }

  public static FoundationPrincipal viaToken(String uid) {
    return new FoundationPrincipal(uid, AuthenticationMethod.SESSION_TOKEN, "jti-" + uid);
  }

  public Path keysFile(String committee) {
    return artifacts.root().resolve(committee).resolve("KEYS");
  }
}
