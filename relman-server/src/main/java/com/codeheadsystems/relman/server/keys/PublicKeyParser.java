package com.codeheadsystems.relman.server.keys;

import com.codeheadsystems.relman.server.store.PublicSigningKey;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import org.bouncycastle.bcpg.ArmoredOutputStream;
import org.bouncycastle.bcpg.PublicKeyAlgorithmTags;
import org.bouncycastle.openpgp.PGPException;
import org.bouncycastle.openpgp.PGPPublicKey;
import org.bouncycastle.openpgp.PGPPublicKeyRing;
import org.bouncycastle.openpgp.PGPUtil;
import org.bouncycastle.openpgp.jcajce.JcaPGPPublicKeyRingCollection;
import org.bouncycastle.util.encoders.Hex;

/**
 * Reads OpenPGP public keys from ASCII armor.
 */
public class PublicKeyParser {

  static final String BEGIN = "-----BEGIN PGP PUBLIC KEY BLOCK-----";
  static final String END = "-----END PGP PUBLIC KEY BLOCK-----";

  private static final String FOUNDATION_DOMAIN = "@apache.org";

  /**
   * Splits a KEYS file into its armored key blocks. Comment lines between blocks are dropped.
   * Text that contains no armor header at all is returned as a single block so that the caller
   * reports it as one failed item.
   *
   * @param keysFileText the file content
   * @return one entry per key block, in file order
   */
  public List<String> splitBlocks(String keysFileText) {
    List<String> blocks = new ArrayList<>();
    if (keysFileText == null || keysFileText.isBlank()) {
      return blocks;
    }
    int start = keysFileText.indexOf(BEGIN);
    if (start < 0) {
      blocks.add(keysFileText.strip());
      return blocks;
    }
    while (start >= 0) {
      int next = keysFileText.indexOf(BEGIN, start + BEGIN.length());
      int end = keysFileText.indexOf(END, start);
      int stop;
      if (end >= 0 && (next < 0 || end < next)) {
        stop = end + END.length();
      } else {
        stop = next < 0 ? keysFileText.length() : next;
      }
      blocks.add(keysFileText.substring(start, stop).strip());
      start = next;
    }
    return blocks;
  }

  /**
   * Parses one armored public key. Only the primary key of the first key ring is read.
   *
   * @param armored the key block
   * @return the key, with no apache uid unless one of its user ids is a foundation address
   * @throws KeyParseException when the text is not a usable public key
   */
  public PublicSigningKey parse(String armored) throws KeyParseException {
    if (armored == null || armored.isBlank()) {
      throw new KeyParseException("Empty key block");
    }
    PGPPublicKeyRing ring;
    try (InputStream in = PGPUtil.getDecoderStream(
        new ByteArrayInputStream(armored.getBytes(StandardCharsets.US_ASCII)))) {
      Iterator<PGPPublicKeyRing> rings = new JcaPGPPublicKeyRingCollection(in).getKeyRings();
      if (!rings.hasNext()) {
        throw new KeyParseException("No public key found");
      }
      ring = rings.next();
    } catch (IOException | PGPException | RuntimeException e) {
      throw new KeyParseException("Unreadable public key: " + e.getMessage(), e);
    }

    PGPPublicKey key = ring.getPublicKey();
    List<String> uids = new ArrayList<>();
    key.getUserIDs().forEachRemaining(uids::add);
    Instant created = key.getCreationTime().toInstant();
    long validSeconds = key.getValidSeconds();

    return new PublicSigningKey(
        Hex.toHexString(key.getFingerprint()),
        algorithmName(key.getAlgorithm()),
        key.getBitStrength(),
        created,
        validSeconds > 0 ? created.plusSeconds(validSeconds) : null,
        uids.isEmpty() ? null : uids.get(0),
        uids.size() > 1 ? uids.subList(1, uids.size()) : List.of(),
        foundationUid(uids),
        armor(ring));
  }

  /**
   * The local part of the first {@code @apache.org} address among the user ids.
   *
   * @param uids declared user ids, e.g. {@code "Jane Doe <jdoe@apache.org>"}
   * @return the foundation uid, or null
   */
  public static String foundationUid(List<String> uids) {
    for (String uid : uids) {
      int at = uid.indexOf(FOUNDATION_DOMAIN);
      if (at <= 0) {
        continue;
      }
      int open = uid.lastIndexOf('<', at);
      String local = uid.substring(open + 1, at).strip();
      if (!local.isEmpty() && !local.contains(" ")) {
        return local;
      }
    }
    return null;
  }

  static String algorithmName(int algorithm) {
    switch (algorithm) {
      case PublicKeyAlgorithmTags.RSA_GENERAL:
      case PublicKeyAlgorithmTags.RSA_SIGN:
        return "RSA";
      case PublicKeyAlgorithmTags.DSA:
        return "DSA";
      case PublicKeyAlgorithmTags.ECDSA:
        return "ECDSA";
      case 22:
      case 27:
        return "EdDSA";
      case 28:
        return "Ed448";
      default:
        return "ALG-" + algorithm;
    }
  }

  private static String armor(PGPPublicKeyRing ring) throws KeyParseException {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    try (ArmoredOutputStream armored = new ArmoredOutputStream(out)) {
      ring.encode(armored);
    } catch (IOException e) {
      throw new KeyParseException("Cannot re-armor public key", e);
    }
    return out.toString(StandardCharsets.US_ASCII);
  }
}
