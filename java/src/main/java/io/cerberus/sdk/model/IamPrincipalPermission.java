package io.cerberus.sdk.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Grants a role on a safe deposit box to an IAM principal.
 */
public record IamPrincipalPermission(
    String id,
    @JsonProperty("iam_principal_arn") String iamPrincipalArn,
    @JsonProperty("role_id") String roleId
) {
}
