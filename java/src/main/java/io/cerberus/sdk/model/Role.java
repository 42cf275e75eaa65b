package io.cerberus.sdk.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.OffsetDateTime;

/**
 * Permission level (owner, write, read) that can be granted on a safe deposit box.
 */
public record Role(
    String id,
    String name,
    @JsonProperty("created_ts") OffsetDateTime created,
    @JsonProperty("last_updated_ts") OffsetDateTime lastUpdated,
    @JsonProperty("created_by") String createdBy,
    @JsonProperty("last_updated_by") String lastUpdatedBy
) {
}
