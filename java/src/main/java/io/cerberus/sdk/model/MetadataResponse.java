package io.cerberus.sdk.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One page of {@link SdbMetadata}.
 */
public record MetadataResponse(
    @JsonProperty("has_next") boolean hasNext,
    @JsonProperty("next_offset") int nextOffset,
    int limit,
    int offset,
    @JsonProperty("sdb_count_in_result") int resultCount,
    @JsonProperty("total_sdbcount") int totalCount,
    @JsonProperty("safe_deposit_box_metadata") List<SdbMetadata> metadata
) {
}
