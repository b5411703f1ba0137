package com.codeheadsystems.relman.model.keys;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

/**
 * Report of KEYS file regeneration across one or more committees.
 * <p>
 * Used by: {@code POST /api/keys/{committee}/regenerate} and
 * {@code POST /api/keys/regenerate-all} responses
 *
 * @param regenerated committee name to written file path
 * @param errors      committee name to failure description
 */
public record RegenerationResponse(
    @JsonProperty("regenerated") Map<String, String> regenerated,
    @JsonProperty("errors") Map<String, String> errors) {
}
