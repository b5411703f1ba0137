package com.codeheadsystems.relman.server.keys;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.List;
import org.bouncycastle.bcpg.ArmoredOutputStream;
import org.bouncycastle.bcpg.HashAlgorithmTags;
import org.bouncycastle.bcpg.PublicKeyAlgorithmTags;
import org.bouncycastle.openpgp.PGPException;
import org.bouncycastle.openpgp.PGPKeyPair;
import org.bouncycastle.openpgp.PGPKeyRingGenerator;
import org.bouncycastle.openpgp.PGPPublicKeyRing;
import org.bouncycastle.openpgp.PGPSignature;
import org.bouncycastle.openpgp.PGPSignatureSubpacketGenerator;
import org.bouncycastle.openpgp.operator.PGPDigestCalculator;
import org.bouncycastle.openpgp.operator.jcajce.JcaPGPContentSignerBuilder;
import org.bouncycastle.openpgp.operator.jcajce.JcaPGPDigestCalculatorProviderBuilder;
import org.bouncycastle.openpgp.operator.jcajce.JcaPGPKeyPair;
import org.bouncycastle.util.encoders.Hex;

/**
 * Throw-away OpenPGP keys for tests.
 */
public final class TestKeys {

  /**
   * A generated key.
   *
   * @param armored     ASCII-armored public key ring
   * @param fingerprint lower-case hex fingerprint
   */
  public record Generated(String armored, String fingerprint) {
  }

  private TestKeys() {
  }

  /**
   * Generates a non-expiring RSA key created now.
   *
   * @param userId e.g. {@code "Alice <alice@apache.org>"}
   * @return the key
   */
  public static Generated generate(String userId) {
    return generate(userId, Instant.now(), null);
  }

  /**
   * Generates an RSA key.
   *
   * @param userId   the user id
   * @param created  key creation time
   * @param validFor lifetime from creation, null for no expiry
   * @return the key
   */
  public static Generated generate(String userId, Instant created, Duration validFor) {
    try {
      KeyPairGenerator generator = KeyPairGenerator.getInstance("RSA");
      generator.initialize(1024);
      KeyPair keyPair = generator.generateKeyPair();
      PGPKeyPair pgpKeyPair = new JcaPGPKeyPair(PublicKeyAlgorithmTags.RSA_GENERAL, keyPair, Date.from(created));

      PGPSignatureSubpacketGenerator hashed = new PGPSignatureSubpacketGenerator();
      if (validFor != null) {
        hashed.setKeyExpirationTime(false, validFor.getSeconds());
      }
      PGPDigestCalculator sha1 = new JcaPGPDigestCalculatorProviderBuilder().build().get(HashAlgorithmTags.SHA1);
      PGPKeyRingGenerator ringGenerator = new PGPKeyRingGenerator(
          PGPSignature.POSITIVE_CERTIFICATION, pgpKeyPair, userId, sha1, hashed.generate(), null,
          new JcaPGPContentSignerBuilder(PublicKeyAlgorithmTags.RSA_GENERAL, HashAlgorithmTags.SHA256),
          null);
      PGPPublicKeyRing ring = ringGenerator.generatePublicKeyRing();

      ByteArrayOutputStream out = new ByteArrayOutputStream();
      try (ArmoredOutputStream armored = new ArmoredOutputStream(out)) {
        ring.encode(armored);
      }
      return new Generated(out.toString(StandardCharsets.US_ASCII),
          Hex.toHexString(ring.getPublicKey().getFingerprint()));
    } catch (NoSuchAlgorithmException | PGPException | IOException e) {
      throw new IllegalStateException("Cannot generate test key", e);
    }
  }

  /**
   * Joins armored keys into a KEYS file with comment lines, as projects publish them.
   *
   * @param blocks armored keys or arbitrary text blocks
   * @return the file content
   */
  public static String keysFile(List<String> blocks) {
    StringBuilder out = new StringBuilder("This file contains the PGP keys of the project.\n\n");
    for (String block : blocks) {
      out.append("pub   rsa1024 2024-01-01\n").append(block).append("\n\n");
    }
    return out.toString();
  }
}
