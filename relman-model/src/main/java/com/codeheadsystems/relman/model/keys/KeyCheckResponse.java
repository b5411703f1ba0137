package com.codeheadsystems.relman.model.keys;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Result of checking stored keys against the foundation uid their user ids declare.
 * <p>
 * Used by: {@code GET /api/keys/check} response
 *
 * @param checked    number of keys examined
 * @param mismatches keys whose declared uid differs from the recorded owner
 */
public record KeyCheckResponse(
    @JsonProperty("checked") int checked,
    @JsonProperty("mismatches") List<KeyMismatch> mismatches) {

  /**
   * One key whose recorded owner does not match its user ids.
   *
   * @param fingerprint the key
   * @param detectedUid uid derived from the declared user ids, null when none is declared
   * @param storedUid   uid recorded as owner, null when unknown
   */
  public record KeyMismatch(
      @JsonProperty("fingerprint") String fingerprint,
      @JsonProperty("detectedUid") String detectedUid,
      @JsonProperty("storedUid") String storedUid) {
  }
}
