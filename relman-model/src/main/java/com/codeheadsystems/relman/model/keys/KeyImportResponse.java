package com.codeheadsystems.relman.model.keys;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Per-item report for a KEYS file upload. A partially failing upload still answers with
 * HTTP 200; callers inspect {@code failureCount} and the items.
 * <p>
 * Used by: {@code POST /api/keys/{committee}/import} response
 *
 * @param committee     committee the keys were associated with
 * @param successCount  number of key blocks stored and linked
 * @param failureCount  number of key blocks rejected
 * @param items         one entry per key block, in file order
 * @param keysFileError set when the committee KEYS file could not be regenerated
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record KeyImportResponse(
    @JsonProperty("committee") String committee,
    @JsonProperty("successCount") int successCount,
    @JsonProperty("failureCount") int failureCount,
    @JsonProperty("items") List<KeyImportItem> items,
    @JsonProperty("keysFileError") String keysFileError) {
}
