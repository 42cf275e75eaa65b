package io.cerberus.sdk;

/**
 * Raised when Cerberus rejects the supplied credentials (HTTP 401 or 403 on an authentication endpoint).
 */
public class UnauthorizedException extends CerberusException {

    private static final long serialVersionUID = 1L;

    public UnauthorizedException() {
        super("Invalid credentials given");
    }

    public UnauthorizedException(String message) {
        super(message);
    }
}
