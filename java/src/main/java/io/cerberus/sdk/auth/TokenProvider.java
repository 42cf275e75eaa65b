package io.cerberus.sdk.auth;

import io.cerberus.sdk.CerberusException;

import java.io.Reader;
import java.net.URI;
import java.time.Instant;
import java.util.Map;

/**
 * Contract for the ways a client can authenticate against Cerberus. Implementations can be used on their own
 * to obtain a token without setting up a full {@link io.cerberus.sdk.CerberusClient}.
 */
public interface TokenProvider {

    /**
     * Returns the current token, performing every authentication step needed when there is none.
     *
     * @param otpSource where a one-time passcode is read from when the login asks for MFA; {@code null} prompts on
     *                  the console. Providers without an MFA step ignore it.
     */
    String token(Reader otpSource) throws CerberusException;

    default String token() throws CerberusException {
        return token(null);
    }

    /**
     * @return whether a token exists and has not expired.
     */
    boolean isAuthenticated();

    /**
     * Replaces the current, still valid, token with a new one.
     */
    void refresh() throws CerberusException;

    /**
     * Revokes the current token and forgets it.
     */
    void logout() throws CerberusException;

    /**
     * @return headers carrying the token plus the JSON defaults every Cerberus call expects.
     */
    Map<String, String> headers() throws CerberusException;

    URI baseUrl();

    /**
     * @return expiry of the current token.
     * @throws CerberusException when there is no token or its expiry is unknown.
     */
    Instant expiry() throws CerberusException;
}
