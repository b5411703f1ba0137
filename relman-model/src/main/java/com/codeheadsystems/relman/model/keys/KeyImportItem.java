package com.codeheadsystems.relman.model.keys;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One line of a key import report. Exactly one of {@code status} and {@code error} is set.
 *
 * @param item        position label of the key block in the uploaded file
 * @param fingerprint fingerprint of the key, when it could be parsed
 * @param status      one of {@code PARSED}, {@code INSERTED}, {@code LINKED},
 *                    {@code INSERTED_AND_LINKED} on success
 * @param warning     set when the key was imported but needs attention, e.g. it has expired
 * @param error       failure description
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record KeyImportItem(
    @JsonProperty("item") String item,
    @JsonProperty("fingerprint") String fingerprint,
    @JsonProperty("status") String status,
    @JsonProperty("warning") String warning,
    @JsonProperty("error") String error) {

  /**
   * Whether this item was imported.
   *
   * @return true on success
   */
  public boolean succeeded() {
    return error == null;
  }
}
