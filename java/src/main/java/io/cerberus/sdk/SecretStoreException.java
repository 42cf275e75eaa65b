package io.cerberus.sdk;

import java.util.List;

/**
 * Error answered by the key/value secret store behind Cerberus.
 */
public final class SecretStoreException extends CerberusException {

    private static final long serialVersionUID = 1L;

    private final int statusCode;
    private final List<String> errors;

    public SecretStoreException(int statusCode, List<String> errors) {
        super("Error making API request. Code: " + statusCode + ". Errors: " + (errors == null ? List.of() : errors));
        this.statusCode = statusCode;
        this.errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public int getStatusCode() {
        return statusCode;
    }

    public List<String> getErrors() {
        return errors;
    }
}
