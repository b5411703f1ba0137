package com.codeheadsystems.relman.server.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FilesystemArtifactStoreTest {

  @TempDir
  Path root;

  private FilesystemArtifactStore store;

  @BeforeEach
  void setUp() {
    store = new FilesystemArtifactStore(root);
  }

  @Test
  void commit_publishesStagedFile() throws Exception {
    ArtifactTransaction tx = store.begin();
    Path target = tx.write("tooling", "KEYS", "content");

    assertThat(target).isEqualTo(root.resolve("tooling").resolve("KEYS"));
    assertThat(target).doesNotExist();

    tx.commit();

    assertThat(target).hasContent("content");
    assertThat(root.resolve(".staging")).isEmptyDirectory();
  }

  @Test
  void commit_replacesExistingFile() throws Exception {
    ArtifactTransaction first = store.begin();
    first.write("tooling", "KEYS", "old");
    first.commit();

    ArtifactTransaction second = store.begin();
    second.write("tooling", "KEYS", "new");
    second.commit();

    assertThat(root.resolve("tooling/KEYS")).hasContent("new");
  }

  @Test
  void rollback_discardsStagedFile() throws Exception {
    ArtifactTransaction tx = store.begin();
    Path target = tx.write("tooling", "KEYS", "content");

    tx.rollback();

    assertThat(target).doesNotExist();
    assertThat(root.resolve("tooling")).doesNotExist();
  }

  @Test
  void write_rejectsUnsafeCommitteeName() {
    ArtifactTransaction tx = store.begin();

    assertThatThrownBy(() -> tx.write("../etc", "KEYS", "x")).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> tx.write("tooling", "../KEYS", "x")).isInstanceOf(IllegalArgumentException.class);
    tx.rollback();
  }

  @Test
  void begin_missingRoot_unavailable() throws Exception {
    Path missing = root.resolve("absent");
    FilesystemArtifactStore absent = new FilesystemArtifactStore(missing);

    assertThatThrownBy(absent::begin).isInstanceOf(StorageUnavailableException.class);
    Files.createDirectory(missing);
    absent.begin().rollback();
  }
}
