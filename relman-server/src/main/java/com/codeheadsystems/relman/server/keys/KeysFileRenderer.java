package com.codeheadsystems.relman.server.keys;

import com.codeheadsystems.relman.server.store.PublicSigningKey;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Renders a committee's KEYS file: a comment header followed by each key's summary and
 * armored block, ordered by fingerprint.
 */
public class KeysFileRenderer {

  /**
   * File name of the generated listing.
   */
  public static final String FILE_NAME = "KEYS";

  private static final DateTimeFormatter DATE = DateTimeFormatter.ISO_LOCAL_DATE.withZone(ZoneOffset.UTC);

  public String render(String committee, List<PublicSigningKey> keys, Instant generatedAt) {
    StringBuilder out = new StringBuilder();
    out.append("# This file contains the OpenPGP public keys used to sign releases of ")
        .append(committee).append(".\n")
        .append("# It is generated automatically; edits will be overwritten.\n")
        .append("# Generated: ").append(DateTimeFormatter.ISO_INSTANT.format(generatedAt)).append('\n')
        .append("# Keys: ").append(keys.size()).append("\n\n");

    keys.stream()
        .sorted(Comparator.comparing(PublicSigningKey::fingerprint))
        .forEach(key -> renderKey(out, key));
    return out.toString();
  }

  private void renderKey(StringBuilder out, PublicSigningKey key) {
    out.append("pub   ").append(key.algorithm());
    if (key.length() > 0) {
      out.append(' ').append(key.length());
    }
    out.append(' ').append(DATE.format(key.created()));
    if (key.expires() != null) {
      out.append(" [expires: ").append(DATE.format(key.expires())).append(']');
    }
    out.append('\n')
        .append("      ").append(key.fingerprint().toUpperCase(Locale.ROOT)).append('\n');
    if (key.primaryDeclaredUid() != null) {
      out.append("uid   ").append(key.primaryDeclaredUid()).append('\n');
    }
    key.secondaryDeclaredUids().forEach(uid -> out.append("uid   ").append(uid).append('\n'));
    out.append('\n').append(key.asciiArmoredKey().strip()).append("\n\n");
  }
}
