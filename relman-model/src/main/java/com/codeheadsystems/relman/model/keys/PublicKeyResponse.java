package com.codeheadsystems.relman.model.keys;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Wire model for a stored OpenPGP public signing key.
 * <p>
 * Used by: {@code GET /api/keys/{fingerprint}} response
 *
 * @param fingerprint        lower-case hex fingerprint
 * @param algorithm          OpenPGP public key algorithm name
 * @param length             key length in bits
 * @param created            creation time, ISO-8601
 * @param expires            expiry time, ISO-8601, or null when the key does not expire
 * @param primaryDeclaredUid first user id on the key
 * @param apacheUid          owning foundation user id, or null when unknown
 * @param committees         committees the key is associated with
 * @param asciiArmoredKey    the armored key block
 */
public record PublicKeyResponse(
    @JsonProperty("fingerprint") String fingerprint,
    @JsonProperty("algorithm") String algorithm,
    @JsonProperty("length") int length,
    @JsonProperty("created") String created,
    @JsonProperty("expires") String expires,
    @JsonProperty("primaryDeclaredUid") String primaryDeclaredUid,
    @JsonProperty("apacheUid") String apacheUid,
    @JsonProperty("committees") List<String> committees,
    @JsonProperty("asciiArmoredKey") String asciiArmoredKey) {
}
