package io.cerberus.sdk.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Response of {@code /v2/auth/user}, {@code /v2/auth/mfa_check} and {@code /v2/auth/user/refresh}.
 */
public record UserAuthResponse(AuthStatus status, Data data) {

    public record Data(
        @JsonProperty("client_token") ClientToken clientToken,
        @JsonProperty("user_id") String userId,
        String username,
        @JsonProperty("state_token") String stateToken,
        List<MfaDevice> devices
    ) {
    }

    public record ClientToken(
        @JsonProperty("client_token") String clientToken,
        List<String> policies,
        UserMetadata metadata,
        @JsonProperty("lease_duration") long leaseDuration,
        boolean renewable
    ) {
    }

    public record MfaDevice(String id, String name) {
    }

    public record UserMetadata(String username, @JsonProperty("is_admin") String isAdmin, String groups) {
    }
}
