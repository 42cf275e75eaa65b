package io.cerberus.sdk.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.OffsetDateTime;
import java.util.Map;

/**
 * Metadata describing a stored secure file; the content itself is fetched separately.
 */
public record SecureFileSummary(
    String name,
    String path,
    @JsonProperty("size_in_bytes") long size,
    @JsonProperty("sdbox_id") String sdbId,
    @JsonProperty("created_ts") OffsetDateTime created,
    @JsonProperty("created_by") String createdBy,
    @JsonProperty("last_updated_ts") OffsetDateTime lastUpdated,
    @JsonProperty("last_updated_by") String lastUpdatedBy,
    @JsonProperty("user_group_permissions") Map<String, String> userGroupPermissions,
    @JsonProperty("iam_role_permissions") Map<String, String> iamRolePermissions
) {
}
