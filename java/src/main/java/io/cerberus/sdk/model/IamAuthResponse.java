package io.cerberus.sdk.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Response of {@code /v2/auth/sts-identity}.
 */
public record IamAuthResponse(
    @JsonProperty("client_token") String clientToken,
    List<String> policies,
    Map<String, String> metadata,
    @JsonProperty("lease_duration") long leaseDuration,
    boolean renewable
) {
}
