package io.cerberus.sdk;

import java.io.InputStream;
import java.net.http.HttpResponse;

/**
 * Raised when Cerberus asked the client to rotate its token and the rotation failed. The call itself
 * succeeded, so the original response travels with the exception and the caller remains responsible for
 * closing its body.
 */
public final class TokenRefreshException extends CerberusException {

    private static final long serialVersionUID = 1L;

    private final transient HttpResponse<InputStream> response;

    public TokenRefreshException(HttpResponse<InputStream> response, Throwable cause) {
        super("Error refreshing token: " + cause.getMessage(), cause);
        this.response = response;
    }

    public HttpResponse<InputStream> getResponse() {
        return response;
    }
}
