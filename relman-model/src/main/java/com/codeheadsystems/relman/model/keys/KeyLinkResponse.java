package com.codeheadsystems.relman.model.keys;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Result of associating or dissociating a key and a committee.
 * <p>
 * Used by: {@code POST /api/keys/{committee}/associate/{fingerprint}} and
 * {@code POST /api/keys/{committee}/dissociate/{fingerprint}} responses
 *
 * @param committee     the committee
 * @param fingerprint   the key fingerprint
 * @param changed       false when the link was already in the requested state
 * @param keysFileError set when the committee KEYS file could not be regenerated
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record KeyLinkResponse(
    @JsonProperty("committee") String committee,
    @JsonProperty("fingerprint") String fingerprint,
    @JsonProperty("changed") boolean changed,
    @JsonProperty("keysFileError") String keysFileError) {
}
