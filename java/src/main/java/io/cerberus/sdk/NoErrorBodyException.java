package io.cerberus.sdk;

/**
 * The server answered with a non-successful status but did not describe the failure. This usually means the
 * failure happened in front of, or inside, the service rather than in request validation.
 */
public class NoErrorBodyException extends CerberusException {

    private static final long serialVersionUID = 1L;

    private final int statusCode;

    public NoErrorBodyException(int statusCode) {
        super("No error body returned from server");
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
