package io.cerberus.sdk.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Outcome of a username/password login.
 */
public enum AuthStatus {
    SUCCESS("success"),
    MFA_REQUIRED("mfa_req"),
    UNKNOWN("");

    private final String wireValue;

    AuthStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    @JsonCreator
    public static AuthStatus fromWire(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (AuthStatus status : values()) {
            if (status != UNKNOWN && status.wireValue.equals(normalized)) {
                return status;
            }
        }
        return UNKNOWN;
    }
}
