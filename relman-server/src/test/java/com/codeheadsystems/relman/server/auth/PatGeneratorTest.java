package com.codeheadsystems.relman.server.auth;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PatGeneratorTest {

  private static final Instant NOW = Instant.parse("2025-03-01T12:00:00Z");

  private PatGenerator patGenerator;

  @BeforeEach
  void setUp() {
    patGenerator = new PatGenerator(new RandomProvider(), new MutableClock(NOW));
  }

  @Test
  void hash_isSha3_256Hex() {
    assertThat(PatGenerator.hash(""))
        .isEqualTo("a7ffc6f8bf1ed76651c14756a061d662f580ff4de43b49fa82d80a4b80f8434a");
  }

  @Test
  void generate_storesOnlyHashOfPlaintext() {
    IssuedPat issued = patGenerator.generate("alice", "release laptop");

    assertThat(issued.plaintext()).matches("[A-Za-z0-9_-]{43}");
    assertThat(issued.token().tokenHash()).isEqualTo(PatGenerator.hash(issued.plaintext()));
    assertThat(issued.token().tokenHash()).doesNotContain(issued.plaintext());
    assertThat(issued.token().toString()).doesNotContain(issued.plaintext());
    assertThat(issued.toString()).doesNotContain(issued.plaintext());
  }

  @Test
  void generate_expiresAfter180Days() {
    IssuedPat issued = patGenerator.generate("alice", "ci");

    assertThat(issued.token().created()).isEqualTo(NOW);
    assertThat(issued.token().expires()).isEqualTo(NOW.plus(180, ChronoUnit.DAYS));
    assertThat(issued.token().lastUsed()).isNull();
    assertThat(issued.token().revoked()).isFalse();
    assertThat(issued.token().isExpired(NOW.plus(179, ChronoUnit.DAYS))).isFalse();
    assertThat(issued.token().isExpired(NOW.plus(180, ChronoUnit.DAYS))).isTrue();
  }

  @Test
  void generate_eachTokenUnique() {
    IssuedPat first = patGenerator.generate("alice", "a");
    IssuedPat second = patGenerator.generate("alice", "a");

    assertThat(first.plaintext()).isNotEqualTo(second.plaintext());
    assertThat(first.token().id()).isNotEqualTo(second.token().id());
  }
}
