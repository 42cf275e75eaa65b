package io.cerberus.sdk;

/**
 * Raised when the requested object does not exist, either because the server answered 404 or because the
 * identifier was blank and no request was made.
 */
public class NotFoundException extends CerberusException {

    private static final long serialVersionUID = 1L;

    public NotFoundException(String message) {
        super(message);
    }
}
