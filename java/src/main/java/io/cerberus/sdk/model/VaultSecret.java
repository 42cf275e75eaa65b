package io.cerberus.sdk.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Envelope returned by the key/value secret store.
 */
public record VaultSecret(
    @JsonProperty("request_id") String requestId,
    @JsonProperty("lease_id") String leaseId,
    @JsonProperty("lease_duration") long leaseDuration,
    boolean renewable,
    Map<String, Object> data,
    List<String> warnings
) {
}
