package io.cerberus.sdk.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Grants a role on a safe deposit box to a user group.
 */
public record UserGroupPermission(String id, String name, @JsonProperty("role_id") String roleId) {
}
