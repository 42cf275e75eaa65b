package io.cerberus.sdk;

/**
 * Raised when an operation needs a valid token and the authentication method does not hold one.
 */
public class UnauthenticatedException extends CerberusException {

    private static final long serialVersionUID = 1L;

    public UnauthenticatedException() {
        super("Unable to complete request: Not Authenticated");
    }
}
