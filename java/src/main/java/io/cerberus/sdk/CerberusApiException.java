package io.cerberus.sdk;

import io.cerberus.sdk.model.ErrorDetail;

import java.util.List;

/**
 * Exception representing an error returned by Cerberus. When the service rejects a request it answers with an
 * {@code error_id} and a list of field level details; the SDK hydrates this type so callers can inspect both.
 */
public final class CerberusApiException extends CerberusException {

    private static final long serialVersionUID = 1L;

    private final int statusCode;
    private final String errorId;
    private final List<ErrorDetail> errors;

    public CerberusApiException(int statusCode, String errorId, List<ErrorDetail> errors) {
        super(message(errorId, errors));
        this.statusCode = statusCode;
        this.errorId = errorId;
        this.errors = errors == null ? List.of() : List.copyOf(errors);
    }

    /**
     * @return HTTP status code returned by Cerberus.
     */
    public int getStatusCode() {
        return statusCode;
    }

    /**
     * @return server generated identifier of this failure, useful when asking the Cerberus operators for logs.
     */
    public String getErrorId() {
        return errorId;
    }

    /**
     * @return ordered error details, never {@code null}.
     */
    public List<ErrorDetail> getErrors() {
        return errors;
    }

    private static String message(String errorId, List<ErrorDetail> errors) {
        return "Error from API. ID: " + errorId + ", Details: " + (errors == null ? List.of() : errors);
    }
}
