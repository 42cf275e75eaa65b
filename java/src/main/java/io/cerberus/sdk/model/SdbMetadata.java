package io.cerberus.sdk.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.OffsetDateTime;
import java.util.Map;

/**
 * Administrative view of a safe deposit box. Permissions are flattened to {@code principal -> role name}.
 */
public record SdbMetadata(
    String name,
    String path,
    String category,
    String owner,
    String description,
    @JsonProperty("created_ts") OffsetDateTime created,
    @JsonProperty("created_by") String createdBy,
    @JsonProperty("last_updated_ts") OffsetDateTime lastUpdated,
    @JsonProperty("last_updated_by") String lastUpdatedBy,
    @JsonProperty("user_group_permissions") Map<String, String> userGroupPermissions,
    @JsonProperty("iam_role_permissions") Map<String, String> iamRolePermissions
) {
}
