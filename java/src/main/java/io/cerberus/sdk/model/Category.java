package io.cerberus.sdk.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.OffsetDateTime;

/**
 * Category a safe deposit box belongs to. The category path is the first segment of the box path.
 */
public record Category(
    String id,
    @JsonProperty("display_name") String displayName,
    String path,
    @JsonProperty("created_ts") OffsetDateTime created,
    @JsonProperty("last_updated_ts") OffsetDateTime lastUpdated,
    @JsonProperty("created_by") String createdBy,
    @JsonProperty("last_updated_by") String lastUpdatedBy
) {
}
