package com.codeheadsystems.relman.model.token;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Listing entry for one personal access token. Never carries the token or its hash.
 * <p>
 * Timestamps are ISO-8601 strings; {@code lastUsed} is null until the first exchange.
 * <p>
 * Used by: {@code GET /api/tokens} response
 *
 * @param id       token id
 * @param owner    owning user id
 * @param label    user supplied label
 * @param created  issuance time
 * @param expires  expiry time
 * @param lastUsed last successful exchange for a JWT, or null
 * @param revoked  whether the token was revoked
 */
public record PatSummary(
    @JsonProperty("id") String id,
    @JsonProperty("owner") String owner,
    @JsonProperty("label") String label,
    @JsonProperty("created") String created,
    @JsonProperty("expires") String expires,
    @JsonProperty("lastUsed") String lastUsed,
    @JsonProperty("revoked") boolean revoked) {
}
