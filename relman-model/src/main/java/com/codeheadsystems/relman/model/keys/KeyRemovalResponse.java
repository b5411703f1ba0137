package com.codeheadsystems.relman.model.keys;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Result of removing every key from a committee.
 * <p>
 * Used by: {@code POST /api/keys/{committee}/remove-all} response
 *
 * @param committee     the committee
 * @param unlinked      fingerprints unlinked from the committee
 * @param deletedKeys   fingerprints deleted because no committee uses them any more
 * @param keysFileError set when the committee KEYS file could not be regenerated
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record KeyRemovalResponse(
    @JsonProperty("committee") String committee,
    @JsonProperty("unlinked") List<String> unlinked,
    @JsonProperty("deletedKeys") List<String> deletedKeys,
    @JsonProperty("keysFileError") String keysFileError) {
}
