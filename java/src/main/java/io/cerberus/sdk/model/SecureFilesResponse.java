package io.cerberus.sdk.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One page of {@link SecureFileSummary}.
 */
public record SecureFilesResponse(
    @JsonProperty("has_next") boolean hasNext,
    @JsonProperty("next_offset") int nextOffset,
    int limit,
    int offset,
    @JsonProperty("file_count_in_result") int resultCount,
    @JsonProperty("total_file_count") int totalCount,
    @JsonProperty("secure_file_summaries") List<SecureFileSummary> summaries
) {
}
