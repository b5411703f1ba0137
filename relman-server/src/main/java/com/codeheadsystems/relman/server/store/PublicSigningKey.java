package com.codeheadsystems.relman.server.store;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * An OpenPGP public signing key as stored. The fingerprint is the identity.
 *
 * @param fingerprint           lower-case hex fingerprint
 * @param algorithm             public key algorithm name
 * @param length                key size in bits, -1 when not meaningful for the algorithm
 * @param created               key creation time
 * @param expires               key expiry, null when the key does not expire
 * @param primaryDeclaredUid    first user id declared on the key, may be null
 * @param secondaryDeclaredUids remaining declared user ids
 * @param apacheUid             foundation uid of the owner, null when unknown
 * @param asciiArmoredKey       the armored public key block
 */
public record PublicSigningKey(
    String fingerprint,
    String algorithm,
    int length,
    Instant created,
    Instant expires,
    String primaryDeclaredUid,
    List<String> secondaryDeclaredUids,
    String apacheUid,
    String asciiArmoredKey) {

  public PublicSigningKey {
    Objects.requireNonNull(fingerprint, "fingerprint");
    fingerprint = normalize(fingerprint);
    secondaryDeclaredUids = secondaryDeclaredUids == null ? List.of() : List.copyOf(secondaryDeclaredUids);
  }

  /**
   * Canonical fingerprint form used as the identity everywhere.
   *
   * @param fingerprint hex, any case, spaces allowed
   * @return lower-case hex without spaces
   */
  public static String normalize(String fingerprint) {
    return fingerprint.replace(" ", "").toLowerCase(Locale.ROOT);
  }

  public PublicSigningKey withApacheUid(String uid) {
    return new PublicSigningKey(fingerprint, algorithm, length, created, expires,
        primaryDeclaredUid, secondaryDeclaredUids, uid, asciiArmoredKey);
  }
}
