package io.cerberus.sdk.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Safe deposit box as exposed by {@code /v2/safe-deposit-box}. Fields left {@code null} are not sent, which makes
 * the same record usable as a partial update.
 */
public record SafeDepositBox(
    String id,
    String name,
    String path,
    @JsonProperty("category_id") String categoryId,
    String description,
    String owner,
    @JsonProperty("user_group_permissions") List<UserGroupPermission> userGroupPermissions,
    @JsonProperty("iam_principal_permissions") List<IamPrincipalPermission> iamPrincipalPermissions
) {

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String name;
        private String path;
        private String categoryId;
        private String description;
        private String owner;
        private List<UserGroupPermission> userGroupPermissions;
        private List<IamPrincipalPermission> iamPrincipalPermissions;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder path(String path) {
            this.path = path;
            return this;
        }

        public Builder categoryId(String categoryId) {
            this.categoryId = categoryId;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder owner(String owner) {
            this.owner = owner;
            return this;
        }

        public Builder userGroupPermissions(List<UserGroupPermission> userGroupPermissions) {
            this.userGroupPermissions = userGroupPermissions == null ? null : List.copyOf(userGroupPermissions);
            return this;
        }

        public Builder iamPrincipalPermissions(List<IamPrincipalPermission> iamPrincipalPermissions) {
            this.iamPrincipalPermissions = iamPrincipalPermissions == null ? null : List.copyOf(iamPrincipalPermissions);
            return this;
        }

        public SafeDepositBox build() {
            return new SafeDepositBox(id, name, path, categoryId, description, owner,
                userGroupPermissions, iamPrincipalPermissions);
        }
    }
}
