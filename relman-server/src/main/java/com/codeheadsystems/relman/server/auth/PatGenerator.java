package com.codeheadsystems.relman.server.auth;

import com.codeheadsystems.relman.server.store.PersonalAccessToken;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.UUID;
import org.bouncycastle.crypto.digests.SHA3Digest;
import org.bouncycastle.util.encoders.Hex;

/**
 * Mints personal access tokens and hashes presented plaintexts for lookup.
 */
public class PatGenerator {

  /**
   * Lifetime of a personal access token.
   */
  public static final Duration PAT_TTL = Duration.ofDays(180);

  /**
   * Random bytes behind each plaintext.
   */
  public static final int PAT_BYTES = 32;

  private final RandomProvider randomProvider;
  private final Clock clock;

  public PatGenerator(RandomProvider randomProvider, Clock clock) {
    this.randomProvider = randomProvider;
    this.clock = clock;
  }

  /**
   * SHA3-256 of the plaintext, lower-case hex.
   *
   * @param plaintext the presented token
   * @return the stored form
   */
  public static String hash(String plaintext) {
    byte[] input = plaintext.getBytes(StandardCharsets.UTF_8);
    SHA3Digest digest = new SHA3Digest(256);
    digest.update(input, 0, input.length);
    byte[] out = new byte[digest.getDigestSize()];
    digest.doFinal(out, 0);
    return Hex.toHexString(out);
  }

  /**
   * Creates a new token for a user. Nothing is persisted here.
   *
   * @param uid   owner
   * @param label user-facing description
   * @return the plaintext and the record to store
   */
  public IssuedPat generate(String uid, String label) {
    String plaintext = randomProvider.urlSafeToken(PAT_BYTES);
    Instant created = clock.instant().truncatedTo(ChronoUnit.SECONDS);
    PersonalAccessToken pat = new PersonalAccessToken(
        UUID.randomUUID().toString(), uid, hash(plaintext), label,
        created, created.plus(PAT_TTL), null, false);
    return new IssuedPat(plaintext, pat);
  }

  public Clock clock() {
    return clock;
  }
}
