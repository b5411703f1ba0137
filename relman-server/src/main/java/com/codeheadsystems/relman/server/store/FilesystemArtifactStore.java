package com.codeheadsystems.relman.server.store;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ArtifactStore} rooted at a directory; artifacts live at {@code <root>/<committee>/<name>}.
 * <p>
 * Files are written under {@code <root>/.staging/<transaction>} and moved into place on
 * commit, atomically where the filesystem supports it.
 */
public class FilesystemArtifactStore implements ArtifactStore {

  private static final Logger log = LoggerFactory.getLogger(FilesystemArtifactStore.class);

  private static final Pattern SAFE_NAME = Pattern.compile("[a-z0-9][a-z0-9-]*");
  private static final Pattern SAFE_FILE = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]*");
  private static final String STAGING = ".staging";

  private final Path root;

  public FilesystemArtifactStore(Path root) {
    this.root = root.toAbsolutePath().normalize();
  }

  @Override
  public ArtifactTransaction begin() {
    if (!Files.isDirectory(root) || !Files.isWritable(root)) {
      throw new StorageUnavailableException("Artifact directory is not a writable directory: " + root);
    }
    return new Transaction(root.resolve(STAGING).resolve(UUID.randomUUID().toString()));
  }

  @Override
  public Path location(String committee, String name) {
    return root.resolve(checkName(committee, SAFE_NAME)).resolve(checkName(name, SAFE_FILE));
  }

  public Path root() {
    return root;
  }

  private static String checkName(String value, Pattern pattern) {
    if (value == null || !pattern.matcher(value).matches()) {
      throw new IllegalArgumentException("Invalid artifact path segment: " + value);
    }
    return value;
  }

  private static void deleteTree(Path dir) throws IOException {
    if (!Files.exists(dir)) {
      return;
    }
    try (Stream<Path> paths = Files.walk(dir)) {
      for (Path path : paths.sorted(Comparator.reverseOrder()).toList()) {
        Files.delete(path);
      }
    }
  }

  private final class Transaction implements ArtifactTransaction {

    private final Path staging;
    private final Map<Path, Path> staged = new LinkedHashMap<>();

    private Transaction(Path staging) {
      this.staging = staging;
    }

    @Override
    public Path write(String committee, String name, String content) throws IOException {
      Path target = location(committee, name);
      Path file = staging.resolve(committee).resolve(name);
      Files.createDirectories(file.getParent());
      Files.writeString(file, content, StandardCharsets.UTF_8);
      staged.put(target, file);
      return target;
    }

    @Override
    public void commit() {
      try {
        for (Map.Entry<Path, Path> entry : staged.entrySet()) {
          publish(entry.getValue(), entry.getKey());
        }
        log.debug("Published {} artifact(s)", staged.size());
      } catch (IOException e) {
        throw new StorageUnavailableException("Failed to publish artifacts", e);
      } finally {
        discard();
      }
    }

    @Override
    public void rollback() {
      if (!staged.isEmpty()) {
        log.debug("Discarding {} staged artifact(s)", staged.size());
      }
      discard();
    }

    private void publish(Path file, Path target) throws IOException {
      Files.createDirectories(target.getParent());
      try {
        Files.move(file, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
      } catch (AtomicMoveNotSupportedException e) {
        Files.move(file, target, StandardCopyOption.REPLACE_EXISTING);
      }
    }

    private void discard() {
      staged.clear();
      try {
        deleteTree(staging);
      } catch (IOException e) {
        throw new UncheckedIOException("Failed to clean staging directory " + staging, e);
      }
    }
  }
}
