package io.cerberus.sdk;

/**
 * Base exception thrown by the Cerberus Java SDK.
 */
public class CerberusException extends Exception {

    private static final long serialVersionUID = 1L;

    public CerberusException(String message) {
        super(message);
    }

    public CerberusException(String message, Throwable cause) {
        super(message, cause);
    }
}
